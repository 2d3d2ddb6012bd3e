package com.mimecast.wren.address;

import java.text.ParseException;

/**
 * Address parser.
 * <p>Parses a single address, optionally with display name, into its parts.
 *
 * @see InternetAddressParser
 */
public interface AddressParser {

    /**
     * Parses address string.
     *
     * @param input Address string, for example {@code "John Doe" <john@example.org>}.
     * @return ParsedAddress instance.
     * @throws ParseException Malformed address.
     */
    ParsedAddress parse(String input) throws ParseException;
}
