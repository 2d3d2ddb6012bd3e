package com.mimecast.wren.mx;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mimecast.wren.error.ErrorKind;
import com.mimecast.wren.error.ValidationError;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * TTL and capacity bounded cache of MX lookup outcomes.
 *
 * <p>Found and failed outcomes are both cached so known bad domains are not looked up again until they expire.
 * <br>Interrupted callers and lookups rejected after {@link #close()} get an uncached failure.
 * <p>Lookups run on a daemon executor and are awaited up to the DNS timeout.
 * <br>A lookup that misses the deadline is cancelled and cached as {@link ErrorKind#DNS_TIMEOUT}.
 *
 * <p>Eviction happens before inserting a new key while at capacity:
 * <ol>
 *   <li>All entries older than the TTL are dropped.</li>
 *   <li>If still at capacity the least recently read entry is dropped.</li>
 * </ol>
 *
 * <p>Hits take the read lock. The last read time is an atomic inside the entry so the freshness check
 * <br>and its bookkeeping happen in the same critical section. Inserts and evictions take the write lock.
 * <br>No lock is held while a lookup is in flight.
 */
public class ResolutionCache implements Closeable {
    private static final Logger log = LogManager.getLogger(ResolutionCache.class);

    private final MxRecordClient client;
    private final Duration timeout;
    private final long ttlMillis;
    private final int capacity;
    private final ReadWriteLock lock;
    private final Clock clock;
    private final ExecutorService executor;

    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * Constructs a new ResolutionCache instance with its own lock and system clock.
     *
     * @param client   MxRecordClient instance.
     * @param timeout  Lookup timeout.
     * @param ttl      Entry time to live.
     * @param capacity Maximum entries.
     */
    public ResolutionCache(MxRecordClient client, Duration timeout, Duration ttl, int capacity) {
        this(client, timeout, ttl, capacity, new ReentrantReadWriteLock(), Clock.systemUTC());
    }

    /**
     * Constructs a new ResolutionCache instance.
     *
     * @param client   MxRecordClient instance.
     * @param timeout  Lookup timeout.
     * @param ttl      Entry time to live.
     * @param capacity Maximum entries.
     * @param lock     Lock shared with the owner.
     * @param clock    Clock instance.
     */
    public ResolutionCache(MxRecordClient client, Duration timeout, Duration ttl, int capacity,
                           ReadWriteLock lock, Clock clock) {
        Preconditions.checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");

        this.client = client;
        this.timeout = timeout;
        this.ttlMillis = ttl.toMillis();
        this.capacity = capacity;
        this.lock = lock;
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("wren-mx-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Resolves MX records for a domain.
     * <p>Served from cache while the entry is within its TTL.
     *
     * @param domain Domain string.
     * @return Resolution instance.
     */
    public Resolution resolve(String domain) {
        String key = domain == null ? "" : domain.toLowerCase(Locale.ROOT);

        lock.readLock().lock();
        try {
            Entry entry = entries.get(key);
            long now = clock.millis();
            if (entry != null && isFresh(entry, now)) {
                entry.lastRead.set(now);
                log.debug("MX cache hit for domain: {}", key);
                return entry.resolution;
            }
        } finally {
            lock.readLock().unlock();
        }

        Resolution resolution = lookup(key);
        if (!resolution.isCacheable()) {
            return resolution;
        }

        lock.writeLock().lock();
        try {
            long now = clock.millis();
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                evict(now);
            }
            entries.put(key, new Entry(resolution, now));
        } finally {
            lock.writeLock().unlock();
        }

        return resolution;
    }

    /**
     * Checks if a fresh entry exists for the domain.
     * <p>Does not count as a read.
     *
     * @param domain Domain string.
     * @return Boolean.
     */
    public boolean isCached(String domain) {
        lock.readLock().lock();
        try {
            Entry entry = entries.get(domain == null ? "" : domain.toLowerCase(Locale.ROOT));
            return entry != null && isFresh(entry, clock.millis());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets number of retained entries, expired ones included.
     *
     * @return Size.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets capacity.
     *
     * @return Maximum entries.
     */
    public int getCapacity() {
        return capacity;
    }

    /**
     * Removes all entries.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stops the lookup executor, interrupting lookups in flight.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Performs a live lookup bounded by the timeout.
     *
     * @param domain Normalized domain.
     * @return Resolution instance.
     */
    private Resolution lookup(String domain) {
        Future<List<MxHost>> future;
        try {
            future = executor.submit(() -> client.getMxRecords(domain));
        } catch (RejectedExecutionException e) {
            log.warn("MX lookup rejected for domain: {} - cache closed", domain);
            return Resolution.aborted(new ValidationError(ErrorKind.DNS_LOOKUP_FAILURE, domain,
                    "DNS lookup rejected, resolver closed"));
        }

        try {
            List<MxHost> hosts = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (hosts == null || hosts.isEmpty()) {
                log.debug("No MX records found for domain: {}", domain);
                return Resolution.failed(new ValidationError(ErrorKind.DNS_LOOKUP_FAILURE, domain,
                        "no MX records found for " + domain));
            }

            return Resolution.found(hosts);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("MX lookup timeout after {} ms for domain: {}", timeout.toMillis(), domain);
            return Resolution.failed(new ValidationError(ErrorKind.DNS_TIMEOUT, domain,
                    "DNS lookup timeout after " + timeout.toMillis() + " ms"));

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("MX lookup failed for domain: {} - {}", domain, cause.getMessage());
            return Resolution.failed(new ValidationError(ErrorKind.DNS_LOOKUP_FAILURE, domain,
                    "DNS lookup failed: " + cause.getMessage()));

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Resolution.aborted(new ValidationError(ErrorKind.DNS_LOOKUP_FAILURE, domain,
                    "DNS lookup interrupted"));
        }
    }

    /**
     * Drops expired entries then, if still at capacity, the least recently read one.
     * <p>Caller must hold the write lock.
     *
     * @param now Current time in millis.
     */
    private void evict(long now) {
        entries.values().removeIf(entry -> !isFresh(entry, now));

        if (entries.size() >= capacity) {
            String lruKey = null;
            long lruTime = Long.MAX_VALUE;
            for (Map.Entry<String, Entry> entry : entries.entrySet()) {
                long lastRead = entry.getValue().lastRead.get();
                if (lruKey == null || lastRead < lruTime) {
                    lruKey = entry.getKey();
                    lruTime = lastRead;
                }
            }

            if (lruKey != null) {
                entries.remove(lruKey);
                log.debug("Evicted least recently read MX cache entry: {}", lruKey);
            }
        }
    }

    private boolean isFresh(Entry entry, long now) {
        return now - entry.cachedAt < ttlMillis;
    }

    /**
     * Cache entry.
     * <p>Holds the outcome, the time it was cached and the time it was last read.
     */
    private static class Entry {
        final Resolution resolution;
        final long cachedAt;
        final AtomicLong lastRead;

        Entry(Resolution resolution, long cachedAt) {
            this.resolution = resolution;
            this.cachedAt = cachedAt;
            this.lastRead = new AtomicLong(cachedAt);
        }
    }
}
