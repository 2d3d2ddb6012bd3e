package com.mimecast.wren.membership;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;

/**
 * Bloom filter membership index.
 * <p>Trusted domains always win and are never reported disposable.
 * <p>Each verification attempt tests a differently salted key, so attempts are independent
 * <br>and the effective false positive rate is the configured rate to the power of attempts.
 * <p>Every registered domain is inserted once per attempt, the filter is sized accordingly.
 *
 * <p>Serialized form: magic, format version, attempts, false positive rate, then Guava filter bits.
 * <br>Guava hashing is unseeded Murmur3 so a reloaded filter answers exactly as the saved one.
 *
 * @see BloomFilter
 */
public class BloomMembershipIndex implements MembershipIndex {
    private static final Logger log = LogManager.getLogger(BloomMembershipIndex.class);

    private static final int MAGIC = 0x57524E42;
    private static final int FORMAT_VERSION = 1;
    private static final Funnel<CharSequence> FUNNEL = Funnels.stringFunnel(StandardCharsets.UTF_8);

    private final BloomFilter<CharSequence> filter;
    private final Set<String> trusted;
    private final int verificationAttempts;
    private final double falsePositiveRate;

    /**
     * Constructs a new BloomMembershipIndex instance.
     *
     * @param filter               Bloom filter.
     * @param trusted              Trusted domains, normalized.
     * @param verificationAttempts Attempts per lookup.
     * @param falsePositiveRate    Configured rate.
     */
    private BloomMembershipIndex(BloomFilter<CharSequence> filter, Set<String> trusted,
                                 int verificationAttempts, double falsePositiveRate) {
        this.filter = filter;
        this.trusted = Collections.unmodifiableSet(trusted);
        this.verificationAttempts = verificationAttempts;
        this.falsePositiveRate = falsePositiveRate;
    }

    /**
     * Creates an empty filter sized for the expected items.
     *
     * @param expectedItems Expected domain count.
     * @param options       BloomOptions instance.
     * @return BloomMembershipIndex instance.
     */
    public static BloomMembershipIndex create(long expectedItems, BloomOptions options) {
        long insertions = Math.max(1L, expectedItems) * options.getVerificationAttempts();
        BloomFilter<CharSequence> filter = BloomFilter.create(FUNNEL, insertions, options.getFalsePositiveRate());

        return new BloomMembershipIndex(filter, options.getTrustedDomains(),
                options.getVerificationAttempts(), options.getFalsePositiveRate());
    }

    /**
     * Upgrades an exact index to a bloom filter.
     * <p>Existing and source domains are folded into a freshly sized filter.
     * <p>The exact index is left untouched and should be discarded by the caller.
     *
     * @param current Current exact index.
     * @param source  Source domains.
     * @param options BloomOptions instance.
     * @return BloomMembershipIndex instance.
     */
    public static BloomMembershipIndex upgrade(ExactMembershipIndex current, Collection<String> source, BloomOptions options) {
        Set<String> existing = current.getDomains();
        long expected = options.getExpectedItems() > 0
                ? options.getExpectedItems()
                : (long) existing.size() + source.size();

        BloomMembershipIndex index = create(expected, options);
        index.register(existing);
        index.register(source);

        log.info("Bloom filter built from {} existing and {} source domains, rate: {}, attempts: {}",
                existing.size(), source.size(), options.getFalsePositiveRate(), options.getVerificationAttempts());
        return index;
    }

    @Override
    public boolean isDisposable(String domain) {
        String normalized = MembershipIndex.normalize(domain);
        if (normalized.isEmpty() || trusted.contains(normalized)) {
            return false;
        }

        for (int attempt = 0; attempt < verificationAttempts; attempt++) {
            if (!filter.mightContain(key(normalized, attempt))) {
                return false; // Definitely absent.
            }
        }

        return true;
    }

    @Override
    public void register(Collection<String> domains) {
        if (domains == null) {
            return;
        }

        for (String domain : domains) {
            String normalized = MembershipIndex.normalize(domain);
            if (normalized.isEmpty()) {
                continue;
            }

            for (int attempt = 0; attempt < verificationAttempts; attempt++) {
                filter.put(key(normalized, attempt));
            }
        }
    }

    @Override
    public long size() {
        return filter.approximateElementCount() / verificationAttempts;
    }

    @Override
    public Mode getMode() {
        return Mode.BLOOM;
    }

    /**
     * Gets trusted domains.
     *
     * @return Unmodifiable set.
     */
    public Set<String> getTrustedDomains() {
        return trusted;
    }

    /**
     * Gets verification attempts.
     *
     * @return Attempts count.
     */
    public int getVerificationAttempts() {
        return verificationAttempts;
    }

    /**
     * Gets configured false positive rate.
     *
     * @return Rate.
     */
    public double getFalsePositiveRate() {
        return falsePositiveRate;
    }

    /**
     * Gets filter estimate of its own false positive probability per test.
     *
     * @return Probability.
     */
    public double getExpectedFpp() {
        return filter.expectedFpp();
    }

    /**
     * Writes the filter to the given stream.
     * <p>The stream is flushed but not closed.
     *
     * @param out OutputStream instance.
     * @throws IOException Unable to write.
     */
    public void writeTo(OutputStream out) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        data.writeInt(MAGIC);
        data.writeInt(FORMAT_VERSION);
        data.writeInt(verificationAttempts);
        data.writeDouble(falsePositiveRate);
        filter.writeTo(data);
        data.flush();
    }

    /**
     * Reads a filter previously written by {@link #writeTo(OutputStream)}.
     *
     * @param in      InputStream instance.
     * @param trusted Trusted domains for the new index.
     * @return BloomMembershipIndex instance.
     * @throws IOException Unable to read or malformed data.
     */
    public static BloomMembershipIndex readFrom(InputStream in, Set<String> trusted) throws IOException {
        DataInputStream data = new DataInputStream(in);

        int magic = data.readInt();
        if (magic != MAGIC) {
            throw new IOException("Not a bloom filter blob, magic: " + Integer.toHexString(magic));
        }

        int version = data.readInt();
        if (version != FORMAT_VERSION) {
            throw new IOException("Unsupported bloom filter format version: " + version);
        }

        int attempts = data.readInt();
        if (attempts < 1) {
            throw new IOException("Invalid verification attempts: " + attempts);
        }

        double rate = data.readDouble();
        BloomFilter<CharSequence> filter = BloomFilter.readFrom(data, FUNNEL);

        return new BloomMembershipIndex(filter, trusted, attempts, rate);
    }

    /**
     * Builds the filter key for an attempt.
     *
     * @param domain  Normalized domain.
     * @param attempt Attempt index.
     * @return Key string.
     */
    private static String key(String domain, int attempt) {
        return attempt == 0 ? domain : attempt + "#" + domain;
    }
}
