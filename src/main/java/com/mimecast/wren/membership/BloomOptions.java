package com.mimecast.wren.membership;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Bloom filter options.
 * <p>Lower false positive rates use more memory.
 * <p>Each verification attempt multiplies the effective false positive rate by the configured rate:
 * <ul>
 *   <li>1 attempt: rate</li>
 *   <li>2 attempts: rate^2</li>
 *   <li>3 attempts: rate^3</li>
 * </ul>
 */
public final class BloomOptions {
    public static final double DEFAULT_FALSE_POSITIVE_RATE = 0.001;
    public static final int DEFAULT_VERIFICATION_ATTEMPTS = 1;

    private final double falsePositiveRate;
    private final Set<String> trustedDomains;
    private final int verificationAttempts;
    private final long expectedItems;

    private BloomOptions(Builder builder) {
        this.falsePositiveRate = builder.falsePositiveRate > 0.0 && builder.falsePositiveRate < 1.0
                ? builder.falsePositiveRate
                : DEFAULT_FALSE_POSITIVE_RATE;
        this.verificationAttempts = builder.verificationAttempts > 0
                ? builder.verificationAttempts
                : DEFAULT_VERIFICATION_ATTEMPTS;
        this.expectedItems = Math.max(0L, builder.expectedItems);

        Set<String> trusted = new HashSet<>();
        for (String domain : builder.trustedDomains) {
            String normalized = MembershipIndex.normalize(domain);
            if (!normalized.isEmpty()) {
                trusted.add(normalized);
            }
        }
        this.trustedDomains = Collections.unmodifiableSet(trusted);
    }

    /**
     * Gets default options.
     *
     * @return BloomOptions instance.
     */
    public static BloomOptions defaults() {
        return new Builder().build();
    }

    /**
     * Gets a new builder.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets target false positive rate of a single filter test.
     *
     * @return Rate between 0 and 1 exclusive.
     */
    public double getFalsePositiveRate() {
        return falsePositiveRate;
    }

    /**
     * Gets trusted domains that are never reported disposable.
     *
     * @return Unmodifiable set.
     */
    public Set<String> getTrustedDomains() {
        return trustedDomains;
    }

    /**
     * Gets number of independent filter tests per lookup.
     *
     * @return Attempts count.
     */
    public int getVerificationAttempts() {
        return verificationAttempts;
    }

    /**
     * Gets expected item count used to size the filter.
     * <p>Zero means derive from the domains being folded in.
     *
     * @return Expected items.
     */
    public long getExpectedItems() {
        return expectedItems;
    }

    /**
     * Builder for BloomOptions.
     */
    public static class Builder {
        private double falsePositiveRate = DEFAULT_FALSE_POSITIVE_RATE;
        private final Set<String> trustedDomains = new HashSet<>();
        private int verificationAttempts = DEFAULT_VERIFICATION_ATTEMPTS;
        private long expectedItems = 0L;

        public Builder withFalsePositiveRate(double falsePositiveRate) {
            this.falsePositiveRate = falsePositiveRate;
            return this;
        }

        public Builder withTrustedDomains(Collection<String> trustedDomains) {
            if (trustedDomains != null) {
                this.trustedDomains.addAll(trustedDomains);
            }
            return this;
        }

        public Builder withVerificationAttempts(int verificationAttempts) {
            this.verificationAttempts = verificationAttempts;
            return this;
        }

        public Builder withExpectedItems(long expectedItems) {
            this.expectedItems = expectedItems;
            return this;
        }

        /**
         * Builds the BloomOptions instance.
         * <p>Out of range values fall back to defaults.
         *
         * @return BloomOptions instance.
         */
        public BloomOptions build() {
            return new BloomOptions(this);
        }
    }
}
