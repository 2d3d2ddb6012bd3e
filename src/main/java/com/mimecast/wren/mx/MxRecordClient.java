package com.mimecast.wren.mx;

import java.io.IOException;
import java.util.List;

/**
 * MX record lookup client.
 *
 * @see XBillMxRecordClient
 */
public interface MxRecordClient {

    /**
     * Gets DNS MX records.
     * <p>Does not fall back to A records.
     *
     * @param domain Domain string.
     * @return List of MxHost instances, empty if the domain has none.
     * @throws IOException Lookup could not be completed.
     */
    List<MxHost> getMxRecords(String domain) throws IOException;
}
