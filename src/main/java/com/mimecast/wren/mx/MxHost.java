package com.mimecast.wren.mx;

import java.util.Objects;

/**
 * Mail exchange host with its preference.
 */
public final class MxHost {
    private final String host;
    private final int priority;

    /**
     * Constructs an MxHost with the given host and priority.
     *
     * @param host     Server host.
     * @param priority Server priority.
     */
    public MxHost(String host, int priority) {
        this.host = Objects.requireNonNull(host, "host");
        this.priority = priority;
    }

    /**
     * Gets the server host.
     *
     * @return Host string.
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets the server priority.
     *
     * @return Priority integer.
     */
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MxHost)) return false;
        MxHost mxHost = (MxHost) o;
        return priority == mxHost.priority && host.equals(mxHost.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, priority);
    }

    @Override
    public String toString() {
        return priority + " " + host;
    }
}
