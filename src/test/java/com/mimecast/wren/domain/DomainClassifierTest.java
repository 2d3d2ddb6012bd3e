package com.mimecast.wren.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DomainClassifierTest {

    @Test
    void isIpDomainBracketedIpv4() {
        assertTrue(DomainClassifier.isIpDomain("[192.168.1.1]"));
        assertTrue(DomainClassifier.isIpDomain("[10.0.0.255]"));
    }

    @Test
    void isIpDomainBracketedIpv6() {
        assertTrue(DomainClassifier.isIpDomain("[IPv6:2001:db8::1]"));
        assertTrue(DomainClassifier.isIpDomain("[::1]"));
    }

    @Test
    void isIpDomainUnbracketed() {
        assertFalse(DomainClassifier.isIpDomain("192.168.1.1"));
        assertFalse(DomainClassifier.isIpDomain("2001:db8::1"));
    }

    @Test
    void isIpDomainInvalidLiteral() {
        assertFalse(DomainClassifier.isIpDomain("[999.1.1.1]"));
        assertFalse(DomainClassifier.isIpDomain("[example.com]"));
        assertFalse(DomainClassifier.isIpDomain("[]"));
        assertFalse(DomainClassifier.isIpDomain("[192.168.1.1"));
        assertFalse(DomainClassifier.isIpDomain(""));
        assertFalse(DomainClassifier.isIpDomain(null));
    }

    @Test
    void isReservedFullDomains() {
        assertTrue(DomainClassifier.isReserved("example.com"));
        assertTrue(DomainClassifier.isReserved("example.net"));
        assertTrue(DomainClassifier.isReserved("example.org"));
        assertTrue(DomainClassifier.isReserved("example.edu"));
        assertTrue(DomainClassifier.isReserved("localhost"));
    }

    @Test
    void isReservedTlds() {
        assertTrue(DomainClassifier.isReserved("domain.test"));
        assertTrue(DomainClassifier.isReserved("foo.example"));
        assertTrue(DomainClassifier.isReserved("mail.invalid"));
        assertTrue(DomainClassifier.isReserved("host.localhost"));
        assertTrue(DomainClassifier.isReserved("test"));
    }

    /**
     * Suffix must sit on a label boundary.
     */
    @Test
    void isReservedLabelBoundary() {
        assertFalse(DomainClassifier.isReserved("mytest.com"));
        assertFalse(DomainClassifier.isReserved("contest"));
        assertFalse(DomainClassifier.isReserved("sub.example.com.au"));
        assertFalse(DomainClassifier.isReserved("gmail.com"));
    }

    @Test
    void isReservedCaseInsensitive() {
        assertTrue(DomainClassifier.isReserved("EXAMPLE.COM"));
        assertTrue(DomainClassifier.isReserved("Domain.Test"));
    }

    @Test
    void isReservedFullAddress() {
        assertTrue(DomainClassifier.isReserved("user@example.com"));
        assertFalse(DomainClassifier.isReserved("user@mytest.com"));
        assertTrue(DomainClassifier.isReserved("user@domain.test"));
    }

    @Test
    void isReservedEmpty() {
        assertFalse(DomainClassifier.isReserved(""));
        assertFalse(DomainClassifier.isReserved(null));
    }
}
