package com.trading.quant.options;

/** When the holder may exercise. */
public enum ExerciseStyle {
    /** Only at expiry. */
    EUROPEAN,
    /** At any lattice node up to expiry. */
    AMERICAN
}
