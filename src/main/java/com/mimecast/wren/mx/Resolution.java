package com.mimecast.wren.mx;

import com.mimecast.wren.error.ValidationError;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of an MX resolution.
 * <p>Either found with its hosts or failed with a DNS error.
 */
public final class Resolution {
    private final List<MxHost> hosts;
    private final ValidationError error;
    private final boolean cacheable;

    private Resolution(List<MxHost> hosts, ValidationError error, boolean cacheable) {
        this.hosts = hosts;
        this.error = error;
        this.cacheable = cacheable;
    }

    /**
     * Creates a found resolution.
     *
     * @param hosts MX hosts.
     * @return Resolution instance.
     */
    public static Resolution found(List<MxHost> hosts) {
        return new Resolution(Collections.unmodifiableList(hosts), null, true);
    }

    /**
     * Creates a failed resolution.
     *
     * @param error ValidationError instance.
     * @return Resolution instance.
     */
    public static Resolution failed(ValidationError error) {
        return new Resolution(Collections.emptyList(), error, true);
    }

    /**
     * Creates a failed resolution that did not come from a lookup.
     * <p>Never cached, the next caller looks the domain up again.
     *
     * @param error ValidationError instance.
     * @return Resolution instance.
     */
    static Resolution aborted(ValidationError error) {
        return new Resolution(Collections.emptyList(), error, false);
    }

    /**
     * Is found.
     *
     * @return Boolean.
     */
    public boolean isFound() {
        return error == null;
    }

    /**
     * Gets MX hosts.
     *
     * @return Unmodifiable list, empty on failure.
     */
    public List<MxHost> getHosts() {
        return hosts;
    }

    /**
     * Gets error.
     *
     * @return Optional of ValidationError.
     */
    public Optional<ValidationError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Is cacheable.
     *
     * @return Boolean.
     */
    boolean isCacheable() {
        return cacheable;
    }

    @Override
    public String toString() {
        return isFound() ? "Resolution{hosts=" + hosts + '}' : "Resolution{error=" + error + '}';
    }
}
