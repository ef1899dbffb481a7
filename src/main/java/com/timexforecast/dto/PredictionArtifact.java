package com.timexforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.timexforecast.model.ModelVariant;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of one pipeline run. Exactly one of {@code chosenModel} (best-of)
 * and {@code ensembleWeights} (weighted) is set.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PredictionArtifact {
    String seriesName;
    EnsemblePolicy policy;
    ModelVariant chosenModel;
    Map<ModelVariant, Double> ensembleWeights;
    ErrorMetric primaryMetric;
    int horizon;
    double confidenceLevel;
    List<ForecastPoint> points;
    Map<ModelVariant, Map<ErrorMetric, Double>> selectionMetrics;
    List<CandidateDiagnostic> candidates;
    List<PipelineStage> stages;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
}
