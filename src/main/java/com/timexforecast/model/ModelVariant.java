package com.timexforecast.model;

/**
 * Closed set of forecasting model families. Declaration order is the
 * priority used to break ties between candidates with equal metrics:
 * earlier wins.
 */
public enum ModelVariant {
    SEASONAL_DECOMPOSITION,
    SEASONAL_REGRESSION,
    RECURRENT_NETWORK;

    public int priority() {
        return ordinal();
    }
}
