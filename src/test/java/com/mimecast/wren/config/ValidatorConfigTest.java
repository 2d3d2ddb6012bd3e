package com.mimecast.wren.config;

import com.mimecast.wren.membership.BloomOptions;
import com.mimecast.wren.validation.Options;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorConfigTest {

    @TempDir
    Path tempDir;

    private static String resource(String name) throws Exception {
        return Paths.get(ValidatorConfigTest.class.getResource(name).toURI()).toString();
    }

    @Test
    void fromFile() throws Exception {
        ValidatorConfig config = new ValidatorConfig(resource("/config/validator.json5"));
        Options options = config.toOptions();

        assertFalse(options.isCheckDns());
        assertTrue(options.isCheckDisposable());
        assertTrue(options.isRejectDisposable());
        assertTrue(options.isRejectReserved());
        assertTrue(options.isRejectIpDomains());
        assertFalse(options.isCheckFreeProvider());
        assertEquals(128, options.getMaxEmailLength());
        assertEquals(Duration.ofMillis(1500), options.getDnsTimeout());
        assertEquals(Duration.ofMinutes(10), options.getDnsCacheTtl());
        assertEquals(50, options.getDnsCacheSize());
        assertEquals("", options.getDisposableListUrl());
        assertEquals(8, options.getBatchConcurrency());
    }

    @Test
    void bloomOptionsFromFile() throws Exception {
        BloomOptions bloom = new ValidatorConfig(resource("/config/validator.json5")).getBloomOptions();

        assertEquals(0.01, bloom.getFalsePositiveRate());
        assertEquals(3, bloom.getVerificationAttempts());
        assertEquals(5000L, bloom.getExpectedItems());
        assertEquals(Set.of("partner.com", "friends.org"), bloom.getTrustedDomains());
    }

    @Test
    void emptyConfigUsesDefaults() {
        ValidatorConfig config = new ValidatorConfig();
        Options options = config.toOptions();
        Options defaults = Options.defaults();

        assertEquals(defaults.isCheckDns(), options.isCheckDns());
        assertEquals(defaults.getMaxEmailLength(), options.getMaxEmailLength());
        assertEquals(defaults.getDnsTimeout(), options.getDnsTimeout());
        assertEquals(defaults.getDnsCacheTtl(), options.getDnsCacheTtl());
        assertEquals(defaults.getDisposableListUrl(), options.getDisposableListUrl());

        BloomOptions bloom = config.getBloomOptions();
        assertEquals(BloomOptions.DEFAULT_FALSE_POSITIVE_RATE, bloom.getFalsePositiveRate());
        assertTrue(bloom.getTrustedDomains().isEmpty());
    }

    @Test
    void fromMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("checkFreeProvider", true);
        map.put("rejectFreeProvider", "true");
        map.put("minDomainLength", 4.0);
        map.put("freeProvidersUrl", "file:///etc/wren/free.json");
        map.put("bloom", Map.of("verificationAttempts", 2, "trustedDomains", List.of("a.com")));

        ValidatorConfig config = new ValidatorConfig(map);
        Options options = config.toOptions();

        assertTrue(options.isCheckFreeProvider());
        assertTrue(options.isRejectFreeProvider());
        assertEquals(4, options.getMinDomainLength());
        assertEquals("file:///etc/wren/free.json", options.getFreeProvidersUrl());
        assertEquals(2, config.getBloomOptions().getVerificationAttempts());
        assertEquals(Set.of("a.com"), config.getBloomOptions().getTrustedDomains());
    }

    /**
     * Numbers that do not fit fall back to defaults instead of failing.
     */
    @Test
    void outOfRangeNumbersFallBack() {
        Map<String, Object> map = new HashMap<>();
        map.put("maxEmailLength", 1e12);
        map.put("minDomainLength", -3e10);
        map.put("dnsCacheSize", 9223372036854775807L);
        map.put("batchConcurrency", 4294967296.0);
        map.put("dnsTimeoutMillis", 1e19);
        map.put("dnsCacheTtlSeconds", 1e18);
        map.put("bloom", Map.of("verificationAttempts", 1e11));

        ValidatorConfig config = new ValidatorConfig(map);
        Options options = assertDoesNotThrow(config::toOptions);
        Options defaults = Options.defaults();

        assertEquals(defaults.getMaxEmailLength(), options.getMaxEmailLength());
        assertEquals(defaults.getMinDomainLength(), options.getMinDomainLength());
        assertEquals(defaults.getDnsCacheSize(), options.getDnsCacheSize());
        assertEquals(defaults.getBatchConcurrency(), options.getBatchConcurrency());
        assertEquals(defaults.getDnsTimeout(), options.getDnsTimeout());
        assertEquals(defaults.getDnsCacheTtl(), options.getDnsCacheTtl());
        assertEquals(BloomOptions.DEFAULT_VERIFICATION_ATTEMPTS,
                assertDoesNotThrow(config::getBloomOptions).getVerificationAttempts());
    }

    @Test
    void typedAccessorsFallBack() {
        Map<String, Object> map = new HashMap<>();
        map.put("count", "not a number");
        map.put("flag", 1);

        ConfigFoundation config = new ConfigFoundation(map);

        assertEquals(7L, config.getLongProperty("count", 7L));
        assertTrue(config.getBooleanProperty("flag", true));
        assertEquals("fallback", config.getStringProperty("missing", "fallback"));
        assertTrue(config.getListProperty("missing").isEmpty());
        assertTrue(config.getMapProperty("missing").isEmpty());
        assertFalse(config.hasProperty("missing"));
    }

    @Test
    void malformedFile() throws IOException {
        Path file = tempDir.resolve("broken.json5");
        Files.writeString(file, "{ checkDns: ");

        assertThrows(IOException.class, () -> new ValidatorConfig(file.toString()));
    }

    @Test
    void missingFile() {
        assertThrows(IOException.class, () -> new ValidatorConfig(tempDir.resolve("none.json5").toString()));
    }
}
