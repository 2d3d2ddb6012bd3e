package com.mimecast.wren.mx;

import com.mimecast.wren.error.ErrorKind;
import com.mimecast.wren.error.ValidationError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ResolutionCacheTest {

    private static final List<MxHost> HOSTS = List.of(new MxHost("mx1.mail.com.", 10));

    @Mock
    private MxRecordClient client;

    private MutableClock clock;
    private ResolutionCache cache;
    private AutoCloseable closeable;

    @BeforeEach
    void setUp() throws IOException {
        closeable = MockitoAnnotations.openMocks(this);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        when(client.getMxRecords(anyString())).thenReturn(HOSTS);
        cache = cache(3);
    }

    @AfterEach
    void tearDown() throws Exception {
        cache.close();
        closeable.close();
    }

    private ResolutionCache cache(int capacity) {
        return new ResolutionCache(client, Duration.ofMillis(500), Duration.ofMinutes(10), capacity,
                new ReentrantReadWriteLock(), clock);
    }

    @Test
    void hitServedWithoutLookup() throws IOException {
        Resolution first = cache.resolve("mail.com");
        Resolution second = cache.resolve("MAIL.com");

        assertTrue(first.isFound());
        assertEquals(HOSTS, first.getHosts());
        assertSame(first, second);
        verify(client, times(1)).getMxRecords("mail.com");
        assertTrue(cache.isCached("mail.com"));
    }

    @Test
    void expiredEntryIsLookedUpAgain() throws IOException {
        cache.resolve("mail.com");
        clock.advance(Duration.ofMinutes(10));

        assertFalse(cache.isCached("mail.com"));
        cache.resolve("mail.com");

        verify(client, times(2)).getMxRecords("mail.com");
        assertEquals(1, cache.size());
    }

    @Test
    void sizeNeverExceedsCapacity() {
        for (int i = 0; i < 20; i++) {
            cache.resolve("domain" + i + ".com");
            assertTrue(cache.size() <= cache.getCapacity());
        }
        assertEquals(3, cache.size());
    }

    /**
     * With no expired entries the least recently read one goes.
     */
    @Test
    void evictsLeastRecentlyRead() {
        cache.resolve("a.com");
        clock.advance(Duration.ofSeconds(1));
        cache.resolve("b.com");
        clock.advance(Duration.ofSeconds(1));
        cache.resolve("c.com");
        clock.advance(Duration.ofSeconds(1));

        cache.resolve("a.com"); // Hit, refreshes last read.
        clock.advance(Duration.ofSeconds(1));

        cache.resolve("d.com");

        assertTrue(cache.isCached("a.com"));
        assertFalse(cache.isCached("b.com"));
        assertTrue(cache.isCached("c.com"));
        assertTrue(cache.isCached("d.com"));
    }

    @Test
    void evictsExpiredEntriesFirst() {
        cache.resolve("a.com");
        cache.resolve("b.com");
        clock.advance(Duration.ofMinutes(9));
        cache.resolve("c.com");
        clock.advance(Duration.ofMinutes(2));

        cache.resolve("d.com");

        assertEquals(2, cache.size());
        assertTrue(cache.isCached("c.com"));
        assertTrue(cache.isCached("d.com"));
    }

    @Test
    void noRecordsCachedAsFailure() throws IOException {
        when(client.getMxRecords("nomx.com")).thenReturn(Collections.emptyList());

        Resolution resolution = cache.resolve("nomx.com");
        cache.resolve("nomx.com");

        assertFalse(resolution.isFound());
        assertEquals(ErrorKind.DNS_LOOKUP_FAILURE, resolution.getError().map(ValidationError::getKind).orElse(null));
        verify(client, times(1)).getMxRecords("nomx.com");
    }

    @Test
    void lookupFailureCached() throws IOException {
        when(client.getMxRecords("broken.com")).thenThrow(new IOException("SERVFAIL"));

        Resolution resolution = cache.resolve("broken.com");
        cache.resolve("broken.com");

        assertFalse(resolution.isFound());
        ValidationError error = resolution.getError().orElseThrow();
        assertEquals(ErrorKind.DNS_LOOKUP_FAILURE, error.getKind());
        assertTrue(error.getMessage().contains("SERVFAIL"));
        verify(client, times(1)).getMxRecords("broken.com");
    }

    @Test
    void timeoutCancelsLookup() throws IOException {
        when(client.getMxRecords("slow.com")).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return HOSTS;
        });

        long start = System.currentTimeMillis();
        Resolution resolution = cache.resolve("slow.com");
        long duration = System.currentTimeMillis() - start;

        assertTrue(duration < 5000, "Lookup took " + duration + "ms");
        ValidationError error = resolution.getError().orElseThrow();
        assertEquals(ErrorKind.DNS_TIMEOUT, error.getKind());
        assertEquals("DNS lookup timeout after 500 ms", error.getMessage());
        assertTrue(cache.isCached("slow.com"));
    }

    /**
     * An interrupted caller must not poison the cache for later callers.
     */
    @Test
    void interruptedLookupNotCached() {
        Thread.currentThread().interrupt();
        Resolution interrupted = cache.resolve("mail.com");
        assertTrue(Thread.interrupted());

        assertFalse(interrupted.isFound());
        assertEquals(ErrorKind.DNS_LOOKUP_FAILURE, interrupted.getError().orElseThrow().getKind());
        assertFalse(cache.isCached("mail.com"));
        assertEquals(0, cache.size());

        Resolution clean = cache.resolve("mail.com");

        assertTrue(clean.isFound());
        assertEquals(HOSTS, clean.getHosts());
        assertTrue(cache.isCached("mail.com"));
    }

    @Test
    void resolveAfterCloseFailsWithoutThrowing() {
        cache.close();

        Resolution resolution = cache.resolve("mail.com");

        assertFalse(resolution.isFound());
        assertEquals(ErrorKind.DNS_LOOKUP_FAILURE, resolution.getError().orElseThrow().getKind());
        assertFalse(cache.isCached("mail.com"));
    }

    @Test
    void clearRemovesEntries() {
        cache.resolve("a.com");
        cache.clear();

        assertEquals(0, cache.size());
        assertFalse(cache.isCached("a.com"));
    }

    @Test
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> cache(0));
    }
}
