/**
 * Wren email address validation library.
 *
 * <p>Classifies and validates email addresses before they are accepted into a downstream system:
 * <ul>
 *     <li>Syntax via {@link com.mimecast.wren.address}.</li>
 *     <li>IP literal and reserved domains via {@link com.mimecast.wren.domain}.</li>
 *     <li>Disposable domains via {@link com.mimecast.wren.membership}.</li>
 *     <li>Deliverability via MX lookups in {@link com.mimecast.wren.mx}.</li>
 * </ul>
 *
 * <p>Entry point is {@link com.mimecast.wren.validation.Validator}, configured with
 * <br>{@link com.mimecast.wren.validation.Options} or {@link com.mimecast.wren.config.ValidatorConfig}.
 */
package com.mimecast.wren;
