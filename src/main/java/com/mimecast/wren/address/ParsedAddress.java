package com.mimecast.wren.address;

import java.util.Objects;

/**
 * Parsed address.
 * <p>Display name, empty when absent, and the bare normalized address.
 */
public final class ParsedAddress {
    private final String name;
    private final String address;

    /**
     * Constructs a new ParsedAddress instance.
     *
     * @param name    Display name, may be null.
     * @param address Normalized address.
     */
    public ParsedAddress(String name, String address) {
        this.name = name != null ? name : "";
        this.address = Objects.requireNonNull(address, "address");
    }

    /**
     * Gets display name.
     *
     * @return Name string, empty if none.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets normalized address.
     *
     * @return Address string.
     */
    public String getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return name.isEmpty() ? address : name + " <" + address + ">";
    }
}
