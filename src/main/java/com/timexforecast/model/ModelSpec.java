package com.timexforecast.model;

/**
 * Construction parameters shared by every variant of one pipeline run.
 *
 * @param seasonalPeriod  number of observations per seasonal cycle; 1 disables seasonality
 * @param confidenceLevel two-sided coverage of the reported bounds, in (0, 1)
 * @param randomSeed      seed for variants with randomized initialization
 */
public record ModelSpec(int seasonalPeriod, double confidenceLevel, long randomSeed) {
    public ModelSpec {
        if (seasonalPeriod < 1) {
            throw new IllegalArgumentException("seasonalPeriod must be >= 1, got: " + seasonalPeriod);
        }
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1), got: " + confidenceLevel);
        }
    }
}
