package com.mimecast.wren.address;

import org.junit.jupiter.api.Test;

import java.text.ParseException;

import static org.junit.jupiter.api.Assertions.*;

class InternetAddressParserTest {

    private final InternetAddressParser parser = new InternetAddressParser();

    @Test
    void parseBareAddress() throws ParseException {
        ParsedAddress parsed = parser.parse("user@gmail.com");

        assertEquals("", parsed.getName());
        assertEquals("user@gmail.com", parsed.getAddress());
    }

    @Test
    void parseNamedAddress() throws ParseException {
        ParsedAddress parsed = parser.parse("John Doe <john.doe@example.org>");

        assertEquals("John Doe", parsed.getName());
        assertEquals("john.doe@example.org", parsed.getAddress());
    }

    @Test
    void parseDomainLiteral() throws ParseException {
        ParsedAddress parsed = parser.parse("user@[192.168.1.1]");

        assertEquals("user@[192.168.1.1]", parsed.getAddress());
    }

    @Test
    void parseMissingDomain() {
        assertThrows(ParseException.class, () -> parser.parse("bad@"));
        assertThrows(ParseException.class, () -> parser.parse("invalid.email"));
    }

    @Test
    void parseMissingLocalPart() {
        assertThrows(ParseException.class, () -> parser.parse("@gmail.com"));
    }

    @Test
    void parseEmpty() {
        assertThrows(ParseException.class, () -> parser.parse(""));
        assertThrows(ParseException.class, () -> parser.parse("   "));
        assertThrows(ParseException.class, () -> parser.parse(null));
    }

    @Test
    void parseGroup() {
        assertThrows(ParseException.class, () -> parser.parse("team: a@b.com, c@d.com;"));
    }
}
