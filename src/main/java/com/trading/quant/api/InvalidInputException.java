package com.trading.quant.api;

/**
 * Thrown when an argument lies outside the domain of a calculation.
 */
public class InvalidInputException extends QuantException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_DOMAIN_INPUT, message);
    }

    /** Throws if {@code value} is not strictly positive. */
    public static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new InvalidInputException(name + " must be > 0, was " + value);
        }
    }

    /** Throws if the array is null or empty. */
    public static void requireNonEmpty(String name, double[] values) {
        if (values == null || values.length == 0) {
            throw new InvalidInputException(name + " must not be empty");
        }
    }

    /** Throws if the two arrays differ in length. */
    public static void requireSameLength(String nameA, double[] a, String nameB, double[] b) {
        if (a.length != b.length) {
            throw new InvalidInputException(
                    nameA + " length " + a.length + " does not match " + nameB + " length " + b.length);
        }
    }

    /** Throws unless {@code 0 < value < 1}. */
    public static void requireOpenUnit(String name, double value) {
        if (!(value > 0 && value < 1)) {
            throw new InvalidInputException(name + " must be in (0, 1), was " + value);
        }
    }
}
