/**
 * Domain classification predicates.
 *
 * <p>Reserved domains follow RFC 2606 and RFC 6761 conventions.
 * <br>IP literals follow the RFC 5321 address literal syntax and are recognised only when bracketed.
 *
 * @see <a href="https://tools.ietf.org/html/rfc2606">RFC 2606 - Reserved Top Level DNS Names</a>
 * @see <a href="https://tools.ietf.org/html/rfc5321#section-4.1.3">RFC 5321 - Address Literals</a>
 */
package com.mimecast.wren.domain;
