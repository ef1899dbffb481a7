package com.timexforecast.model;

/**
 * Creates a fresh, untrained model instance. Called once per validation fold
 * and once more for the final retraining.
 */
@FunctionalInterface
public interface ForecastModelFactory {
    ForecastModel create(ModelSpec spec);
}
