package com.trading.quant.indicators;

import com.trading.quant.api.InvalidInputException;

/** Argument checks shared by the indicator functions. */
final class Series {

    private Series() {
        // Utility class
    }

    /** Requires {@code 1 <= period <= values.length} on a non-empty series. */
    static void requireWindow(String name, double[] values, int period) {
        InvalidInputException.requireNonEmpty(name, values);
        requirePeriod("period", period);
        if (period > values.length)
            throw new InvalidInputException("period " + period + " exceeds " + name + " length " + values.length);
    }

    static void requirePeriod(String name, int period) {
        if (period <= 0)
            throw new InvalidInputException(name + " must be > 0, was " + period);
    }

    /** Requires at least {@code min} observations. */
    static void requireLength(String name, double[] values, int min) {
        if (values == null || values.length < min)
            throw new InvalidInputException(name + " needs at least " + min + " values, got "
                    + (values == null ? 0 : values.length));
    }

    static void requireSameLength(String nameA, double[] a, String nameB, double[] b, String nameC, double[] c) {
        InvalidInputException.requireSameLength(nameA, a, nameB, b);
        InvalidInputException.requireSameLength(nameA, a, nameC, c);
    }
}
