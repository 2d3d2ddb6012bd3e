/**
 * MX record resolution and caching.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link com.mimecast.wren.mx.MxRecordClient} - MX lookup seam.</li>
 *   <li>{@link com.mimecast.wren.mx.XBillMxRecordClient} - dnsjava implementation.</li>
 *   <li>{@link com.mimecast.wren.mx.ResolutionCache} - TTL and LRU bounded cache of lookup outcomes.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * MxRecordClient client = new XBillMxRecordClient(Duration.ofSeconds(3));
 * try (ResolutionCache cache = new ResolutionCache(client, Duration.ofSeconds(3), Duration.ofHours(1), 1000)) {
 *     Resolution resolution = cache.resolve("example.org");
 *     if (!resolution.isFound()) {
 *         // resolution.getError() holds DNS_TIMEOUT or DNS_LOOKUP_FAILURE.
 *     }
 * }
 * }</pre>
 */
package com.mimecast.wren.mx;
