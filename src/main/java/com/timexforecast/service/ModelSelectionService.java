package com.timexforecast.service;

import com.timexforecast.dto.CandidateDiagnostic;
import com.timexforecast.dto.CandidateStatus;
import com.timexforecast.dto.CrossValidationResult;
import com.timexforecast.dto.ErrorMetric;
import com.timexforecast.exception.NoViableModelException;
import com.timexforecast.model.ConfidenceLevels;
import com.timexforecast.model.ForecastInterval;
import com.timexforecast.model.ModelVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Best-of ranking and inverse-error ensemble weighting over validated
 * candidates.
 * <p>
 * Ranking: lowest primary metric, then lowest RMSE, then
 * {@link ModelVariant#priority()}. An undefined (NaN) metric ranks last.
 * Weighting: {@code 1/metric} renormalized to sum to 1; failed candidates
 * and candidates with an undefined primary metric get 0. When some
 * candidates have a metric of exactly 0 they share the whole weight equally.
 */
@Slf4j
@Service
public class ModelSelectionService {

    /**
     * Viable candidates in best-first order.
     *
     * @throws NoViableModelException if no candidate is viable
     */
    public List<ModelVariant> rank(String seriesName, List<CandidateDiagnostic> candidates, ErrorMetric primary) {
        List<ModelVariant> ranking = viable(candidates).stream()
            .sorted(comparator(primary))
            .map(CrossValidationResult::getModel)
            .toList();
        if (ranking.isEmpty()) {
            throw new NoViableModelException(seriesName, candidates);
        }
        log.info("Candidates ranked | series={} | metric={} | ranking={}", seriesName, primary, ranking);
        return ranking;
    }

    /**
     * Weight per candidate, including a 0 for every non-viable one.
     *
     * @throws NoViableModelException if every weight is 0
     */
    public Map<ModelVariant, Double> ensembleWeights(String seriesName, List<CandidateDiagnostic> candidates,
                                                     ErrorMetric primary) {
        Map<ModelVariant, Double> raw = new EnumMap<>(ModelVariant.class);
        for (CandidateDiagnostic candidate : candidates) {
            raw.put(candidate.getModel(), 0.0);
        }
        List<CrossValidationResult> viable = viable(candidates);
        boolean perfect = viable.stream().anyMatch(r -> r.metric(primary) == 0.0d);
        for (CrossValidationResult result : viable) {
            double metric = result.metric(primary);
            if (perfect) {
                raw.put(result.getModel(), metric == 0.0d ? 1.0 : 0.0);
            } else if (Double.isFinite(metric) && metric > 0.0) {
                raw.put(result.getModel(), 1.0 / metric);
            }
        }
        Map<ModelVariant, Double> weights = normalize(raw);
        if (weights.values().stream().noneMatch(w -> w > 0.0)) {
            throw new NoViableModelException(seriesName, candidates);
        }
        log.info("Ensemble weights | series={} | metric={} | weights={}", seriesName, primary, weights);
        return weights;
    }

    /**
     * Renormalizes {@code weights} over the given survivors; every other
     * candidate gets 0.
     */
    public Map<ModelVariant, Double> renormalize(Map<ModelVariant, Double> weights, Collection<ModelVariant> survivors) {
        Map<ModelVariant, Double> kept = new EnumMap<>(ModelVariant.class);
        weights.forEach((variant, weight) -> kept.put(variant, survivors.contains(variant) ? weight : 0.0));
        return normalize(kept);
    }

    /**
     * Weighted combination of per-model forecasts. Points are the weighted
     * mean; each model's bound half-width is turned back into a standard
     * deviation, the variances are averaged with the same weights
     * (independent errors) and the result is widened again to
     * {@code confidenceLevel}.
     */
    public List<ForecastInterval> combine(Map<ModelVariant, List<ForecastInterval>> forecasts,
                                          Map<ModelVariant, Double> weights, double confidenceLevel) {
        double z = ConfidenceLevels.zScore(confidenceLevel);
        int horizon = forecasts.values().stream().mapToInt(List::size).min().orElse(0);
        List<ForecastInterval> combined = new ArrayList<>(horizon);
        for (int k = 0; k < horizon; k++) {
            double point = 0.0;
            double variance = 0.0;
            for (Map.Entry<ModelVariant, List<ForecastInterval>> entry : forecasts.entrySet()) {
                double w = weights.getOrDefault(entry.getKey(), 0.0);
                if (w <= 0.0) {
                    continue;
                }
                ForecastInterval step = entry.getValue().get(k);
                double sigma = step.halfWidth() / z;
                point += w * step.point();
                variance += w * sigma * sigma;
            }
            combined.add(ForecastInterval.symmetric(point, z * Math.sqrt(variance)));
        }
        return combined;
    }

    private List<CrossValidationResult> viable(List<CandidateDiagnostic> candidates) {
        return candidates.stream()
            .filter(c -> c.getStatus() == CandidateStatus.VIABLE && c.getCrossValidation() != null)
            .map(CandidateDiagnostic::getCrossValidation)
            .toList();
    }

    private Comparator<CrossValidationResult> comparator(ErrorMetric primary) {
        return Comparator.<CrossValidationResult>comparingDouble(r -> sortKey(r.metric(primary)))
            .thenComparingDouble(r -> sortKey(r.metric(ErrorMetric.RMSE)))
            .thenComparingInt(r -> r.getModel().priority());
    }

    private static double sortKey(double metric) {
        return Double.isNaN(metric) ? Double.POSITIVE_INFINITY : metric;
    }

    private static Map<ModelVariant, Double> normalize(Map<ModelVariant, Double> raw) {
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<ModelVariant, Double> normalized = new EnumMap<>(ModelVariant.class);
        raw.forEach((variant, weight) -> normalized.put(variant, total > 0.0 ? weight / total : 0.0));
        return Collections.unmodifiableMap(normalized);
    }
}
