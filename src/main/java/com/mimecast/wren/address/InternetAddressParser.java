package com.mimecast.wren.address;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

import java.text.ParseException;

/**
 * Jakarta Mail address parser.
 * <p>Uses {@link InternetAddress} in strict mode, so missing domains, multiple at signs
 * <br>and group syntax are all rejected.
 */
public class InternetAddressParser implements AddressParser {

    @Override
    public ParsedAddress parse(String input) throws ParseException {
        if (input == null || input.isBlank()) {
            throw new ParseException("Address is empty", 0);
        }

        try {
            InternetAddress address = new InternetAddress(input, true);
            if (address.isGroup()) {
                throw new ParseException("Group addresses are not supported", 0);
            }

            String bare = address.getAddress();
            if (bare == null || bare.lastIndexOf('@') <= 0 || bare.endsWith("@")) {
                throw new ParseException("Missing domain", 0);
            }

            return new ParsedAddress(address.getPersonal(), bare);

        } catch (AddressException e) {
            throw new ParseException(e.getMessage(), Math.max(e.getPos(), 0));
        }
    }
}
