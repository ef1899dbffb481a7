package com.timexforecast.model;

import org.apache.commons.math3.distribution.NormalDistribution;

public final class ConfidenceLevels {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private ConfidenceLevels() {
    }

    /** Two-sided standard normal quantile, e.g. 1.96 for 0.95. */
    public static double zScore(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1), got: " + confidenceLevel);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(0.5 + confidenceLevel / 2.0);
    }
}
