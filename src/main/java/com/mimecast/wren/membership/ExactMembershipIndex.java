package com.mimecast.wren.membership;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Exact set membership index.
 * <p>Default representation until a bloom filter upgrade.
 */
public class ExactMembershipIndex implements MembershipIndex {
    private final Set<String> domains = new HashSet<>();

    /**
     * Constructs a new empty ExactMembershipIndex instance.
     */
    public ExactMembershipIndex() {
        // Empty.
    }

    /**
     * Constructs a new ExactMembershipIndex instance.
     *
     * @param domains Initial domains.
     */
    public ExactMembershipIndex(Collection<String> domains) {
        register(domains);
    }

    @Override
    public boolean isDisposable(String domain) {
        return domains.contains(MembershipIndex.normalize(domain));
    }

    @Override
    public void register(Collection<String> list) {
        if (list == null) {
            return;
        }

        for (String domain : list) {
            String normalized = MembershipIndex.normalize(domain);
            if (!normalized.isEmpty()) {
                domains.add(normalized);
            }
        }
    }

    @Override
    public long size() {
        return domains.size();
    }

    @Override
    public Mode getMode() {
        return Mode.EXACT;
    }

    /**
     * Gets registered domains.
     *
     * @return Unmodifiable view of domains.
     */
    public Set<String> getDomains() {
        return Collections.unmodifiableSet(domains);
    }
}
