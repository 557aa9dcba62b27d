package com.trading.quant.api;

/**
 * Base class for all failures raised by the engine. Always unchecked and
 * always raised at the point of violation, with no partial result.
 */
public abstract class QuantException extends RuntimeException {
    private final ErrorKind kind;

    protected QuantException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
