package com.mimecast.wren.config;

import com.mimecast.wren.membership.BloomOptions;
import com.mimecast.wren.validation.Options;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validator configuration.
 *
 * <p>This class provides type safe access to validator configuration and maps it onto {@link Options}.
 * <p>Missing, malformed and out of range keys fall back to the option defaults.
 *
 * <p>Example {@code validator.json5}:
 * <pre>
 * {
 *   checkDns: true,
 *   checkDisposable: true,
 *   rejectDisposable: true,
 *   dnsTimeoutMillis: 2000,
 *   disposableListUrl: "file:///etc/wren/disposable.json",
 *   bloom: {
 *     falsePositiveRate: 0.001,
 *     verificationAttempts: 2,
 *     trustedDomains: ["example-partner.com"]
 *   }
 * }
 * </pre>
 */
public class ValidatorConfig extends ConfigFoundation {

    /**
     * Largest duration in millis that still fits the cache and timeout arithmetic.
     */
    private static final long MAX_MILLIS = Integer.MAX_VALUE * 1000L;

    /**
     * Constructs a new ValidatorConfig instance.
     */
    public ValidatorConfig() {
        super();
    }

    /**
     * Constructs a new ValidatorConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ValidatorConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ValidatorConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ValidatorConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets DNS timeout.
     *
     * @return Duration instance.
     */
    public Duration getDnsTimeout() {
        long millis = getLongProperty("dnsTimeoutMillis", Options.DEFAULT_DNS_TIMEOUT.toMillis());
        return millis > 0 && millis <= MAX_MILLIS ? Duration.ofMillis(millis) : Options.DEFAULT_DNS_TIMEOUT;
    }

    /**
     * Gets DNS cache TTL.
     *
     * @return Duration instance.
     */
    public Duration getDnsCacheTtl() {
        long seconds = getLongProperty("dnsCacheTtlSeconds", Options.DEFAULT_DNS_CACHE_TTL.getSeconds());
        return seconds > 0 && seconds <= MAX_MILLIS / 1000 ? Duration.ofSeconds(seconds) : Options.DEFAULT_DNS_CACHE_TTL;
    }

    /**
     * Maps configuration onto options.
     *
     * @return Options instance.
     */
    public Options toOptions() {
        Options defaults = Options.defaults();

        return Options.builder()
                .withCheckDns(getBooleanProperty("checkDns", defaults.isCheckDns()))
                .withCheckDisposable(getBooleanProperty("checkDisposable", defaults.isCheckDisposable()))
                .withCheckFreeProvider(getBooleanProperty("checkFreeProvider", defaults.isCheckFreeProvider()))
                .withRejectDisposable(getBooleanProperty("rejectDisposable", defaults.isRejectDisposable()))
                .withRejectFreeProvider(getBooleanProperty("rejectFreeProvider", defaults.isRejectFreeProvider()))
                .withRejectIpDomains(getBooleanProperty("rejectIpDomains", defaults.isRejectIpDomains()))
                .withRejectReserved(getBooleanProperty("rejectReserved", defaults.isRejectReserved()))
                .withRejectNamedEmails(getBooleanProperty("rejectNamedEmails", defaults.isRejectNamedEmails()))
                .withMaxEmailLength(getIntProperty("maxEmailLength", defaults.getMaxEmailLength()))
                .withMinDomainLength(getIntProperty("minDomainLength", defaults.getMinDomainLength()))
                .withDnsTimeout(getDnsTimeout())
                .withDnsCacheTtl(getDnsCacheTtl())
                .withDnsCacheSize(getIntProperty("dnsCacheSize", defaults.getDnsCacheSize()))
                .withDisposableListUrl(getStringProperty("disposableListUrl", defaults.getDisposableListUrl()))
                .withFreeProvidersUrl(getStringProperty("freeProvidersUrl", defaults.getFreeProvidersUrl()))
                .withBatchConcurrency(getIntProperty("batchConcurrency", defaults.getBatchConcurrency()))
                .build();
    }

    /**
     * Gets bloom filter options from the {@code bloom} object.
     *
     * @return BloomOptions instance.
     */
    public BloomOptions getBloomOptions() {
        ConfigFoundation bloom = new ConfigFoundation(getMapProperty("bloom"));
        BloomOptions defaults = BloomOptions.defaults();

        List<String> trusted = new ArrayList<>();
        for (Object domain : bloom.getListProperty("trustedDomains")) {
            if (domain != null) {
                trusted.add(String.valueOf(domain));
            }
        }

        return BloomOptions.builder()
                .withFalsePositiveRate(bloom.getDoubleProperty("falsePositiveRate", defaults.getFalsePositiveRate()))
                .withVerificationAttempts(bloom.getIntProperty("verificationAttempts", defaults.getVerificationAttempts()))
                .withExpectedItems(bloom.getLongProperty("expectedItems", defaults.getExpectedItems()))
                .withTrustedDomains(trusted)
                .build();
    }
}
