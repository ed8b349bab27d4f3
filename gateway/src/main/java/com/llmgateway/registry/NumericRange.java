package com.llmgateway.registry;

/**
 * Closed interval [min, max].
 */
public record NumericRange(double min, double max) {

    public NumericRange {
        if (min > max) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
    }

    public static NumericRange of(double min, double max) {
        return new NumericRange(min, max);
    }

    public boolean contains(double value) {
        return !Double.isNaN(value) && value >= min && value <= max;
    }

    public NumericRange withMax(double newMax) {
        return new NumericRange(min, Math.min(max, newMax));
    }

    @Override
    public String toString() {
        return "[" + format(min) + "," + format(max) + "]";
    }

    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
