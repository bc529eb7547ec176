package com.retail.storeintel.dto;

/**
 * A numeric reading tagged with where it came from, so consumers branch on
 * {@link Provenance} instead of probing for missing values.
 */
public record Measurement(Double value, Provenance provenance) {

    public enum Provenance {
        PRESENT,
        FALLBACK,
        ABSENT
    }

    public Measurement {
        if (provenance == null) {
            throw new IllegalArgumentException("provenance is required");
        }
        if (provenance == Provenance.ABSENT) {
            value = null;
        } else if (value == null) {
            throw new IllegalArgumentException("value is required for " + provenance);
        }
    }

    public static Measurement present(double value) {
        return new Measurement(value, Provenance.PRESENT);
    }

    public static Measurement fallback(double value) {
        return new Measurement(value, Provenance.FALLBACK);
    }

    public static Measurement absent() {
        return new Measurement(null, Provenance.ABSENT);
    }

    /**
     * Present when the provider supplied a value, absent otherwise.
     */
    public static Measurement ofNullable(Double value) {
        return value != null ? present(value) : absent();
    }

    public boolean isAbsent() {
        return provenance == Provenance.ABSENT;
    }

    public double orElse(double other) {
        return value != null ? value : other;
    }
}
