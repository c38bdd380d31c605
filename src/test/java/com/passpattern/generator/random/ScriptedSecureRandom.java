package com.passpattern.generator.random;

import java.security.SecureRandom;

/**
 * Entropy source that replays a fixed cycle of {@code nextDouble()} draws.
 *
 * <p>With weight 1, a draw of 0.0 makes {@code rand} return its maximum and a draw just below 1.0
 * makes it return its minimum.
 */
public class ScriptedSecureRandom extends SecureRandom {

    private static final long serialVersionUID = 1L;

    private final double[] draws;
    private int next;

    public ScriptedSecureRandom(double... draws) {
        this.draws = draws.clone();
    }

    @Override
    public double nextDouble() {
        double draw = draws[next % draws.length];
        next++;
        return draw;
    }

    /**
     * Every draw lands on the minimum: first picks, qualifiers above 0 pass, chances succeed.
     */
    public static WeightedRandom lowest() {
        return new WeightedRandom(new ScriptedSecureRandom(0.999999));
    }

    /**
     * Every draw lands on the maximum: last picks, qualifiers below 100 fail, chances fail.
     */
    public static WeightedRandom highest() {
        return new WeightedRandom(new ScriptedSecureRandom(0.0));
    }
}
