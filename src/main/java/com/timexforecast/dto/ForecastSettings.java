package com.timexforecast.dto;

import com.timexforecast.model.ModelVariant;
import com.timexforecast.series.Transformation;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit configuration of one pipeline invocation. Nothing here is shared
 * between invocations.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ForecastSettings {

    @NotEmpty(message = "candidateModels must name at least one model")
    Set<ModelVariant> candidateModels;

    @Min(value = 1, message = "foldCount must be >= 1")
    int foldCount;

    @Min(value = 1, message = "foldTestLength must be >= 1")
    int foldTestLength;

    @Min(value = 1, message = "forecastHorizon must be >= 1")
    int forecastHorizon;

    @DecimalMin(value = "0.0", inclusive = false, message = "confidenceLevel must be in (0, 1)")
    @DecimalMax(value = "1.0", inclusive = false, message = "confidenceLevel must be in (0, 1)")
    double confidenceLevel;

    @NotNull(message = "ensemblePolicy is required")
    EnsemblePolicy ensemblePolicy;

    @Min(value = 1, message = "workerPoolSize must be >= 1")
    int workerPoolSize;

    @NotNull(message = "perModelTimeout is required")
    Duration perModelTimeout;

    long randomSeed;

    @NotNull(message = "primaryMetric is required")
    ErrorMetric primaryMetric;

    @NotNull(message = "transformation is required")
    Transformation transformation;

    /** Overrides the period implied by the sampling frequency when set. */
    @Min(value = 1, message = "seasonalPeriod must be >= 1")
    Integer seasonalPeriod;

    /** Regressor values for the forecast horizon, keyed by regressor name. */
    @Builder.Default
    Map<String, List<Double>> futureRegressors = Map.of();
}
