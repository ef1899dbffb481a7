package com.timexforecast.model;

/**
 * One forecast step: point value and its lower/upper bound at the model's
 * confidence level.
 */
public record ForecastInterval(double point, double lower, double upper) {
    public ForecastInterval {
        if (lower > upper) {
            double temp = lower;
            lower = upper;
            upper = temp;
        }
    }

    public static ForecastInterval symmetric(double point, double halfWidth) {
        double half = Math.abs(halfWidth);
        return new ForecastInterval(point, point - half, point + half);
    }

    public boolean isFinite() {
        return Double.isFinite(point) && Double.isFinite(lower) && Double.isFinite(upper);
    }

    public double halfWidth() {
        return (upper - lower) / 2.0;
    }
}
