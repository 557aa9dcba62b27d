package com.trading.quant.api;

/**
 * Thrown when the inputs are individually valid but the requested quantity has
 * no finite value, e.g. a zero denominator or a singular normal-equation matrix.
 */
public class UndefinedResultException extends QuantException {

    public UndefinedResultException(String message) {
        super(ErrorKind.MATHEMATICALLY_UNDEFINED, message);
    }
}
