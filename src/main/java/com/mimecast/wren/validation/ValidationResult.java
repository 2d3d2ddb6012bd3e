package com.mimecast.wren.validation;

import com.mimecast.wren.error.ValidationError;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of validating a single address.
 * <p>Immutable once returned by the validator.
 * <br>Name and address are empty strings when parsing did not get that far.
 */
public final class ValidationResult {
    private final String original;
    private final String name;
    private final String address;
    private final boolean ipDomain;
    private final boolean reserved;
    private final boolean disposable;
    private final boolean freeProvider;
    private final boolean valid;
    private final Duration validationTime;
    private final ValidationError error;

    private ValidationResult(Builder builder) {
        this.original = builder.original;
        this.name = builder.name;
        this.address = builder.address;
        this.ipDomain = builder.ipDomain;
        this.reserved = builder.reserved;
        this.disposable = builder.disposable;
        this.freeProvider = builder.freeProvider;
        this.valid = builder.valid;
        this.validationTime = builder.validationTime;
        this.error = builder.error;
    }

    /**
     * Gets the input as given.
     *
     * @return Original string.
     */
    public String getOriginal() {
        return original;
    }

    /**
     * Gets the parsed display name.
     *
     * @return Name string.
     */
    public String getName() {
        return name;
    }

    /**
     * Gets the normalized address.
     *
     * @return Address string.
     */
    public String getAddress() {
        return address;
    }

    public boolean isIpDomain() {
        return ipDomain;
    }

    public boolean isReserved() {
        return reserved;
    }

    public boolean isDisposable() {
        return disposable;
    }

    public boolean isFreeProvider() {
        return freeProvider;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * Gets elapsed time spent validating.
     *
     * @return Duration instance.
     */
    public Duration getValidationTime() {
        return validationTime;
    }

    /**
     * Gets the error that stopped validation if any.
     *
     * @return Optional of ValidationError.
     */
    public Optional<ValidationError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "ValidationResult{" +
                "original='" + original + '\'' +
                ", name='" + name + '\'' +
                ", address='" + address + '\'' +
                ", ipDomain=" + ipDomain +
                ", reserved=" + reserved +
                ", disposable=" + disposable +
                ", freeProvider=" + freeProvider +
                ", valid=" + valid +
                ", validationTime=" + validationTime +
                ", error=" + error +
                '}';
    }

    static Builder builder(String original) {
        return new Builder(original);
    }

    /**
     * Mutable accumulator used while the pipeline runs.
     */
    static class Builder {
        private final String original;
        private String name = "";
        private String address = "";
        private boolean ipDomain;
        private boolean reserved;
        private boolean disposable;
        private boolean freeProvider;
        private boolean valid;
        private Duration validationTime = Duration.ZERO;
        private ValidationError error;

        Builder(String original) {
            this.original = original == null ? "" : original;
        }

        Builder withName(String name) {
            this.name = name == null ? "" : name;
            return this;
        }

        Builder withAddress(String address) {
            this.address = address == null ? "" : address;
            return this;
        }

        Builder withIpDomain(boolean ipDomain) {
            this.ipDomain = ipDomain;
            return this;
        }

        Builder withReserved(boolean reserved) {
            this.reserved = reserved;
            return this;
        }

        Builder withDisposable(boolean disposable) {
            this.disposable = disposable;
            return this;
        }

        Builder withFreeProvider(boolean freeProvider) {
            this.freeProvider = freeProvider;
            return this;
        }

        Builder withValid(boolean valid) {
            this.valid = valid;
            return this;
        }

        Builder withValidationTime(Duration validationTime) {
            this.validationTime = validationTime;
            return this;
        }

        Builder withError(ValidationError error) {
            this.error = error;
            return this;
        }

        ValidationResult build() {
            return new ValidationResult(this);
        }
    }
}
