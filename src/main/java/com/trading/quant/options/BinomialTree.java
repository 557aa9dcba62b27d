package com.trading.quant.options;

import static com.trading.quant.api.InvalidInputException.requirePositive;

import com.trading.quant.api.InvalidInputException;

/**
 * Cox-Ross-Rubinstein recombining lattice.
 *
 * <pre>
 * dt = T / n
 * u  = e^(sigma sqrt(dt)),  d = 1 / u
 * p  = (e^(r dt) - d) / (u - d)
 * </pre>
 *
 * Leaf payoffs are computed at the {@code n + 1} terminal nodes and rolled
 * back one level at a time in a single array. European and American pricing
 * share this one backward induction; the only difference is whether each
 * interior node is floored at its exercise value. Cost is O(n^2) time, O(n)
 * space.
 */
public final class BinomialTree {
    public static final int DEFAULT_STEPS = 100;

    private final int steps;

    public BinomialTree() {
        this(DEFAULT_STEPS);
    }

    public BinomialTree(int steps) {
        if (steps <= 0)
            throw new InvalidInputException("steps must be > 0, was " + steps);
        this.steps = steps;
    }

    public int steps() {
        return steps;
    }

    public double american(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type) {
        return price(spot, strike, expiry, rate, volatility, type, ExerciseStyle.AMERICAN);
    }

    public double european(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type) {
        return price(spot, strike, expiry, rate, volatility, type, ExerciseStyle.EUROPEAN);
    }

    public double price(OptionContract c, ExerciseStyle style) {
        return price(c.spot(), c.strike(), c.expiry(), c.rate(), c.volatility(), c.type(), style);
    }

    public double price(double spot, double strike, double expiry, double rate, double volatility,
            OptionType type, ExerciseStyle style) {
        requirePositive("spot", spot);
        requirePositive("strike", strike);
        requirePositive("expiry", expiry);
        requirePositive("volatility", volatility);

        final int n = steps;
        final double dt = expiry / n;
        final double u = Math.exp(volatility * Math.sqrt(dt));
        final double d = 1.0 / u;
        final double p = (Math.exp(rate * dt) - d) / (u - d);
        final double discount = Math.exp(-rate * dt);
        final boolean earlyExercise = style == ExerciseStyle.AMERICAN;

        // values[i] = option value after i down moves at the current level
        double[] values = new double[n + 1];
        for (int i = 0; i <= n; i++) {
            double stock = spot * Math.pow(u, n - i) * Math.pow(d, i);
            values[i] = type.intrinsic(stock, strike);
        }

        for (int level = n - 1; level >= 0; level--) {
            for (int i = 0; i <= level; i++) {
                double continuation = discount * (p * values[i] + (1.0 - p) * values[i + 1]);
                if (earlyExercise) {
                    double stock = spot * Math.pow(u, level - i) * Math.pow(d, i);
                    values[i] = Math.max(continuation, type.intrinsic(stock, strike));
                } else {
                    values[i] = continuation;
                }
            }
        }

        return values[0];
    }
}
