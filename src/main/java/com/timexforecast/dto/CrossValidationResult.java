package com.timexforecast.dto;

import com.timexforecast.model.ModelVariant;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Walk-forward validation outcome of one candidate. {@code folds} holds at
 * least one entry, oldest first; {@code meanMetrics} is the arithmetic mean
 * over those folds.
 */
@Value
@Builder
public class CrossValidationResult {
    ModelVariant model;
    int requestedFolds;
    int foldTestLength;
    List<FoldResult> folds;
    List<FoldSkippedWarning> skippedFolds;
    Map<ErrorMetric, Double> meanMetrics;

    public double metric(ErrorMetric metric) {
        Double value = meanMetrics.get(metric);
        return value != null ? value : Double.NaN;
    }
}
