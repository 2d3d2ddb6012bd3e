package com.mimecast.wren.membership;

import java.util.Collection;
import java.util.Locale;

/**
 * Disposable domain membership index.
 * <p>Implemented as an exact set or as a bloom filter with trusted overrides.
 * <p>Implementations are not synchronized; the owning validator guards them with its lock.
 *
 * @see ExactMembershipIndex
 * @see BloomMembershipIndex
 */
public interface MembershipIndex {

    /**
     * Index representation.
     */
    enum Mode {
        EXACT,
        BLOOM
    }

    /**
     * Checks if domain is disposable.
     *
     * @param domain Domain string.
     * @return Boolean.
     */
    boolean isDisposable(String domain);

    /**
     * Registers disposable domains.
     *
     * @param domains Domains collection.
     */
    void register(Collection<String> domains);

    /**
     * Gets number of registered domains.
     * <p>Approximate for bloom filters.
     *
     * @return Count.
     */
    long size();

    /**
     * Gets index representation.
     *
     * @return Mode.
     */
    Mode getMode();

    /**
     * Normalizes a domain for storage and lookup.
     *
     * @param domain Domain string.
     * @return Trimmed lower case domain or empty string.
     */
    static String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
