package com.mimecast.wren.mx;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.Type;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * XBill MX record client.
 * <p>Uses DNS Java library.
 * <p>The resolver carries its own timeout so a lookup stops on its own when the deadline passes.
 * <p>No dnsjava cache is shared between lookups, caching is left to {@link ResolutionCache}.
 *
 * @see Lookup
 */
public class XBillMxRecordClient implements MxRecordClient {
    private static final Logger log = LogManager.getLogger(XBillMxRecordClient.class);

    private final Resolver resolver;

    /**
     * Constructs a new XBillMxRecordClient instance using system name servers.
     *
     * @param timeout Resolver timeout.
     */
    public XBillMxRecordClient(Duration timeout) {
        this(new ExtendedResolver());
        resolver.setTimeout(timeout);
    }

    /**
     * Constructs a new XBillMxRecordClient instance with given resolver.
     *
     * @param resolver Resolver instance.
     */
    public XBillMxRecordClient(Resolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Gets DNS MX records.
     * <p>Host not found and no MX data both yield an empty list.
     * <p>Server failures and unparsable names throw.
     *
     * @param domain Domain string.
     * @return List of MxHost instances.
     * @throws IOException Lookup could not be completed.
     */
    @Override
    public List<MxHost> getMxRecords(String domain) throws IOException {
        Lookup lookup = new Lookup(domain, Type.MX);
        lookup.setResolver(resolver);
        lookup.setCache(null);

        Record[] records = lookup.run();
        int result = lookup.getResult();
        if (result == Lookup.TRY_AGAIN || result == Lookup.UNRECOVERABLE) {
            throw new IOException("MX lookup failed for " + domain + ": " + lookup.getErrorString());
        }

        List<MxHost> hosts = new ArrayList<>();
        if (records != null) {
            for (Record record : records) {
                if (record instanceof MXRecord) {
                    MXRecord mx = (MXRecord) record;
                    hosts.add(new MxHost(mx.getTarget().toString(true), mx.getPriority()));
                }
            }
        }

        log.debug("Found {} MX records for domain: {}", hosts.size(), domain);
        return hosts;
    }
}
