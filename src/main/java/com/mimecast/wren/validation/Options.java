package com.mimecast.wren.validation;

import java.time.Duration;

/**
 * Validator options.
 * <p>Immutable once built. Zero, negative or null numeric, duration and string values
 * <br>are back-filled from the defaults at build time.
 *
 * <p>Example:
 * <pre>
 * Options options = Options.builder()
 *     .withCheckDns(false)
 *     .withCheckDisposable(true)
 *     .withRejectDisposable(true)
 *     .withDisposableListUrl("file:///etc/wren/disposable.json")
 *     .build();
 * </pre>
 */
public final class Options {
    public static final int DEFAULT_MAX_EMAIL_LENGTH = 254;
    public static final int DEFAULT_MIN_DOMAIN_LENGTH = 1;
    public static final Duration DEFAULT_DNS_TIMEOUT = Duration.ofSeconds(3);
    public static final Duration DEFAULT_DNS_CACHE_TTL = Duration.ofHours(1);
    public static final int DEFAULT_DNS_CACHE_SIZE = 1000;
    public static final int DEFAULT_BATCH_CONCURRENCY = 32;
    public static final String DEFAULT_DISPOSABLE_LIST_URL = "https://disposable.github.io/disposable-email-domains/domains.json";

    private final boolean checkDns;
    private final boolean checkDisposable;
    private final boolean checkFreeProvider;
    private final boolean rejectDisposable;
    private final boolean rejectFreeProvider;
    private final boolean rejectIpDomains;
    private final boolean rejectReserved;
    private final boolean rejectNamedEmails;
    private final int maxEmailLength;
    private final int minDomainLength;
    private final Duration dnsTimeout;
    private final Duration dnsCacheTtl;
    private final int dnsCacheSize;
    private final String disposableListUrl;
    private final String freeProvidersUrl;
    private final int batchConcurrency;

    private Options(Builder builder) {
        this.checkDns = builder.checkDns;
        this.checkDisposable = builder.checkDisposable;
        this.checkFreeProvider = builder.checkFreeProvider;
        this.rejectDisposable = builder.rejectDisposable;
        this.rejectFreeProvider = builder.rejectFreeProvider;
        this.rejectIpDomains = builder.rejectIpDomains;
        this.rejectReserved = builder.rejectReserved;
        this.rejectNamedEmails = builder.rejectNamedEmails;
        this.maxEmailLength = builder.maxEmailLength > 0 ? builder.maxEmailLength : DEFAULT_MAX_EMAIL_LENGTH;
        this.minDomainLength = builder.minDomainLength > 0 ? builder.minDomainLength : DEFAULT_MIN_DOMAIN_LENGTH;
        this.dnsTimeout = positiveOr(builder.dnsTimeout, DEFAULT_DNS_TIMEOUT);
        this.dnsCacheTtl = positiveOr(builder.dnsCacheTtl, DEFAULT_DNS_CACHE_TTL);
        this.dnsCacheSize = builder.dnsCacheSize > 0 ? builder.dnsCacheSize : DEFAULT_DNS_CACHE_SIZE;
        this.disposableListUrl = builder.disposableListUrl != null ? builder.disposableListUrl : DEFAULT_DISPOSABLE_LIST_URL;
        this.freeProvidersUrl = builder.freeProvidersUrl != null ? builder.freeProvidersUrl : "";
        this.batchConcurrency = builder.batchConcurrency > 0 ? builder.batchConcurrency : DEFAULT_BATCH_CONCURRENCY;
    }

    /**
     * Gets default options.
     *
     * @return Options instance.
     */
    public static Options defaults() {
        return new Builder().build();
    }

    /**
     * Gets a new builder initialised with the defaults.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Gets a new builder initialised from these options.
     *
     * @return Builder instance.
     */
    public Builder toBuilder() {
        return new Builder()
                .withCheckDns(checkDns)
                .withCheckDisposable(checkDisposable)
                .withCheckFreeProvider(checkFreeProvider)
                .withRejectDisposable(rejectDisposable)
                .withRejectFreeProvider(rejectFreeProvider)
                .withRejectIpDomains(rejectIpDomains)
                .withRejectReserved(rejectReserved)
                .withRejectNamedEmails(rejectNamedEmails)
                .withMaxEmailLength(maxEmailLength)
                .withMinDomainLength(minDomainLength)
                .withDnsTimeout(dnsTimeout)
                .withDnsCacheTtl(dnsCacheTtl)
                .withDnsCacheSize(dnsCacheSize)
                .withDisposableListUrl(disposableListUrl)
                .withFreeProvidersUrl(freeProvidersUrl)
                .withBatchConcurrency(batchConcurrency);
    }

    public boolean isCheckDns() {
        return checkDns;
    }

    public boolean isCheckDisposable() {
        return checkDisposable;
    }

    public boolean isCheckFreeProvider() {
        return checkFreeProvider;
    }

    public boolean isRejectDisposable() {
        return rejectDisposable;
    }

    public boolean isRejectFreeProvider() {
        return rejectFreeProvider;
    }

    public boolean isRejectIpDomains() {
        return rejectIpDomains;
    }

    public boolean isRejectReserved() {
        return rejectReserved;
    }

    public boolean isRejectNamedEmails() {
        return rejectNamedEmails;
    }

    public int getMaxEmailLength() {
        return maxEmailLength;
    }

    public int getMinDomainLength() {
        return minDomainLength;
    }

    public Duration getDnsTimeout() {
        return dnsTimeout;
    }

    public Duration getDnsCacheTtl() {
        return dnsCacheTtl;
    }

    public int getDnsCacheSize() {
        return dnsCacheSize;
    }

    public String getDisposableListUrl() {
        return disposableListUrl;
    }

    public String getFreeProvidersUrl() {
        return freeProvidersUrl;
    }

    /**
     * Gets maximum number of addresses validated in parallel by a batch.
     *
     * @return Thread count cap.
     */
    public int getBatchConcurrency() {
        return batchConcurrency;
    }

    @Override
    public String toString() {
        return "Options{" +
                "checkDns=" + checkDns +
                ", checkDisposable=" + checkDisposable +
                ", checkFreeProvider=" + checkFreeProvider +
                ", rejectDisposable=" + rejectDisposable +
                ", rejectFreeProvider=" + rejectFreeProvider +
                ", rejectIpDomains=" + rejectIpDomains +
                ", rejectReserved=" + rejectReserved +
                ", rejectNamedEmails=" + rejectNamedEmails +
                ", maxEmailLength=" + maxEmailLength +
                ", minDomainLength=" + minDomainLength +
                ", dnsTimeout=" + dnsTimeout +
                ", dnsCacheTtl=" + dnsCacheTtl +
                ", dnsCacheSize=" + dnsCacheSize +
                ", disposableListUrl='" + disposableListUrl + '\'' +
                ", freeProvidersUrl='" + freeProvidersUrl + '\'' +
                ", batchConcurrency=" + batchConcurrency +
                '}';
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    /**
     * Builder for Options.
     */
    public static class Builder {
        private boolean checkDns = true;
        private boolean checkDisposable = false;
        private boolean checkFreeProvider = false;
        private boolean rejectDisposable = false;
        private boolean rejectFreeProvider = false;
        private boolean rejectIpDomains = true;
        private boolean rejectReserved = false;
        private boolean rejectNamedEmails = false;
        private int maxEmailLength = DEFAULT_MAX_EMAIL_LENGTH;
        private int minDomainLength = DEFAULT_MIN_DOMAIN_LENGTH;
        private Duration dnsTimeout = DEFAULT_DNS_TIMEOUT;
        private Duration dnsCacheTtl = DEFAULT_DNS_CACHE_TTL;
        private int dnsCacheSize = DEFAULT_DNS_CACHE_SIZE;
        private String disposableListUrl = DEFAULT_DISPOSABLE_LIST_URL;
        private String freeProvidersUrl = "";
        private int batchConcurrency = DEFAULT_BATCH_CONCURRENCY;

        public Builder withCheckDns(boolean checkDns) {
            this.checkDns = checkDns;
            return this;
        }

        public Builder withCheckDisposable(boolean checkDisposable) {
            this.checkDisposable = checkDisposable;
            return this;
        }

        public Builder withCheckFreeProvider(boolean checkFreeProvider) {
            this.checkFreeProvider = checkFreeProvider;
            return this;
        }

        public Builder withRejectDisposable(boolean rejectDisposable) {
            this.rejectDisposable = rejectDisposable;
            return this;
        }

        public Builder withRejectFreeProvider(boolean rejectFreeProvider) {
            this.rejectFreeProvider = rejectFreeProvider;
            return this;
        }

        public Builder withRejectIpDomains(boolean rejectIpDomains) {
            this.rejectIpDomains = rejectIpDomains;
            return this;
        }

        public Builder withRejectReserved(boolean rejectReserved) {
            this.rejectReserved = rejectReserved;
            return this;
        }

        public Builder withRejectNamedEmails(boolean rejectNamedEmails) {
            this.rejectNamedEmails = rejectNamedEmails;
            return this;
        }

        public Builder withMaxEmailLength(int maxEmailLength) {
            this.maxEmailLength = maxEmailLength;
            return this;
        }

        public Builder withMinDomainLength(int minDomainLength) {
            this.minDomainLength = minDomainLength;
            return this;
        }

        public Builder withDnsTimeout(Duration dnsTimeout) {
            this.dnsTimeout = dnsTimeout;
            return this;
        }

        public Builder withDnsCacheTtl(Duration dnsCacheTtl) {
            this.dnsCacheTtl = dnsCacheTtl;
            return this;
        }

        public Builder withDnsCacheSize(int dnsCacheSize) {
            this.dnsCacheSize = dnsCacheSize;
            return this;
        }

        public Builder withDisposableListUrl(String disposableListUrl) {
            this.disposableListUrl = disposableListUrl;
            return this;
        }

        public Builder withFreeProvidersUrl(String freeProvidersUrl) {
            this.freeProvidersUrl = freeProvidersUrl;
            return this;
        }

        public Builder withBatchConcurrency(int batchConcurrency) {
            this.batchConcurrency = batchConcurrency;
            return this;
        }

        /**
         * Builds the Options instance.
         *
         * @return Options instance.
         */
        public Options build() {
            return new Options(this);
        }
    }
}
