package com.mimecast.wren.error;

/**
 * Error kinds.
 * <p>Every validation rejection and every failing library call maps to one of these.
 *
 * @see ValidationError
 * @see ValidatorException
 */
public enum ErrorKind {

    /**
     * Input longer than the configured maximum.
     */
    LENGTH_EXCEEDED,

    /**
     * Address could not be parsed.
     */
    PARSE_FAILURE,

    /**
     * Display name or angle brackets present while named addresses are rejected.
     */
    NAMED_ADDRESS_NOT_ALLOWED,

    /**
     * Domain shorter than the configured minimum.
     */
    DOMAIN_TOO_SHORT,

    /**
     * Bracketed IP literal domain while IP domains are rejected.
     */
    IP_DOMAIN_REJECTED,

    /**
     * Reserved domain while reserved domains are rejected.
     */
    RESERVED_DOMAIN_REJECTED,

    /**
     * Disposable domain while disposable domains are rejected.
     */
    DISPOSABLE_DOMAIN_REJECTED,

    /**
     * Free provider domain while free providers are rejected.
     */
    FREE_PROVIDER_REJECTED,

    /**
     * MX lookup did not complete within the DNS timeout.
     */
    DNS_TIMEOUT,

    /**
     * MX lookup failed or returned no records.
     */
    DNS_LOOKUP_FAILURE,

    /**
     * Domain list could not be fetched or decoded.
     */
    LIST_LOAD_FAILURE,

    /**
     * Bloom filter save requested while no filter is active.
     */
    FILTER_NOT_INITIALIZED,

    /**
     * Bloom filter blob could not be read.
     */
    FILTER_DESERIALIZE_FAILURE,

    /**
     * Unexpected runtime failure while validating a single address.
     */
    UNEXPECTED
}
