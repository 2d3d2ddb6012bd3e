/**
 * Address parsing seam.
 * <p>Grammar is delegated to Jakarta Mail, only the split into display name and address is used.
 */
package com.mimecast.wren.address;
