package com.timexforecast.service;

import com.timexforecast.dto.CandidateDiagnostic;
import com.timexforecast.dto.CandidateStatus;
import com.timexforecast.dto.CrossValidationResult;
import com.timexforecast.dto.ErrorMetric;
import com.timexforecast.exception.NoViableModelException;
import com.timexforecast.model.ConfidenceLevels;
import com.timexforecast.model.ForecastInterval;
import com.timexforecast.model.ModelVariant;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.timexforecast.model.ModelVariant.*;
import static org.assertj.core.api.Assertions.*;

class ModelSelectionServiceTest {

    private final ModelSelectionService service = new ModelSelectionService();

    private static CandidateDiagnostic viable(ModelVariant model, double mape, double rmse) {
        Map<ErrorMetric, Double> metrics = new EnumMap<>(ErrorMetric.class);
        metrics.put(ErrorMetric.MAPE, mape);
        metrics.put(ErrorMetric.RMSE, rmse);
        metrics.put(ErrorMetric.MAE, rmse);
        CrossValidationResult result = CrossValidationResult.builder()
            .model(model).requestedFolds(3).foldTestLength(5)
            .folds(List.of()).skippedFolds(List.of()).meanMetrics(metrics)
            .build();
        return CandidateDiagnostic.builder().model(model).status(CandidateStatus.VIABLE).crossValidation(result).build();
    }

    private static CandidateDiagnostic failed(ModelVariant model) {
        return CandidateDiagnostic.builder().model(model).status(CandidateStatus.FAILED)
            .errorCode("VALIDATION_FAILED").failureReason("All 3 folds were skipped").build();
    }

    @Test
    void rank_ordersByPrimaryMetric() {
        List<ModelVariant> ranking = service.rank("s", List.of(
            viable(SEASONAL_DECOMPOSITION, 7.0, 1.0),
            viable(SEASONAL_REGRESSION, 3.0, 9.0),
            failed(RECURRENT_NETWORK)), ErrorMetric.MAPE);

        assertThat(ranking).containsExactly(SEASONAL_REGRESSION, SEASONAL_DECOMPOSITION);
    }

    @Test
    void rank_breaksTiesByRmseThenPriority() {
        assertThat(service.rank("s", List.of(
            viable(SEASONAL_DECOMPOSITION, 5.0, 2.0),
            viable(SEASONAL_REGRESSION, 5.0, 1.0)), ErrorMetric.MAPE))
            .first().isEqualTo(SEASONAL_REGRESSION);

        assertThat(service.rank("s", List.of(
            viable(RECURRENT_NETWORK, 5.0, 1.0),
            viable(SEASONAL_REGRESSION, 5.0, 1.0)), ErrorMetric.MAPE))
            .containsExactly(SEASONAL_REGRESSION, RECURRENT_NETWORK);
    }

    @Test
    void rank_undefinedMetricRanksLast() {
        assertThat(service.rank("s", List.of(
            viable(SEASONAL_DECOMPOSITION, Double.NaN, 0.1),
            viable(RECURRENT_NETWORK, 40.0, 50.0)), ErrorMetric.MAPE))
            .containsExactly(RECURRENT_NETWORK, SEASONAL_DECOMPOSITION);
    }

    @Test
    void rank_honoursAlternativePrimaryMetric() {
        assertThat(service.rank("s", List.of(
            viable(SEASONAL_DECOMPOSITION, 7.0, 1.0),
            viable(SEASONAL_REGRESSION, 3.0, 9.0)), ErrorMetric.RMSE))
            .first().isEqualTo(SEASONAL_DECOMPOSITION);
    }

    @Test
    void rank_isDeterministic() {
        List<CandidateDiagnostic> candidates = List.of(
            viable(RECURRENT_NETWORK, 4.0, 1.0),
            viable(SEASONAL_DECOMPOSITION, 4.0, 1.0),
            viable(SEASONAL_REGRESSION, 4.0, 1.0));
        List<ModelVariant> first = service.rank("s", candidates, ErrorMetric.MAPE);
        for (int i = 0; i < 5; i++) {
            assertThat(service.rank("s", candidates, ErrorMetric.MAPE)).isEqualTo(first);
        }
        assertThat(first.get(0)).isEqualTo(SEASONAL_DECOMPOSITION);
    }

    @Test
    void rank_withoutViableCandidate_failsWithDiagnostics() {
        assertThatThrownBy(() -> service.rank("store-7", List.of(failed(SEASONAL_REGRESSION)), ErrorMetric.MAPE))
            .isInstanceOf(NoViableModelException.class)
            .hasMessageContaining("store-7")
            .hasMessageContaining("SEASONAL_REGRESSION")
            .satisfies(ex -> assertThat(((NoViableModelException) ex).getDiagnostics()).hasSize(1));
    }

    @Test
    void ensembleWeights_areInverseMetricAndSumToOne() {
        Map<ModelVariant, Double> weights = service.ensembleWeights("s", List.of(
            viable(SEASONAL_DECOMPOSITION, 10.0, 1.0),
            viable(SEASONAL_REGRESSION, 20.0, 1.0),
            failed(RECURRENT_NETWORK)), ErrorMetric.MAPE);

        assertThat(weights.get(SEASONAL_DECOMPOSITION)).isCloseTo(2.0 / 3, within(1e-12));
        assertThat(weights.get(SEASONAL_REGRESSION)).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(weights.get(RECURRENT_NETWORK)).isZero();
        assertThat(weights.values().stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void ensembleWeights_perfectCandidatesShareEverything() {
        Map<ModelVariant, Double> weights = service.ensembleWeights("s", List.of(
            viable(SEASONAL_DECOMPOSITION, 0.0, 0.0),
            viable(SEASONAL_REGRESSION, 0.0, 0.0),
            viable(RECURRENT_NETWORK, 3.0, 1.0)), ErrorMetric.MAPE);

        assertThat(weights).containsEntry(SEASONAL_DECOMPOSITION, 0.5)
            .containsEntry(SEASONAL_REGRESSION, 0.5)
            .containsEntry(RECURRENT_NETWORK, 0.0);
    }

    @Test
    void ensembleWeights_allZero_failsWithNoViableModel() {
        assertThatThrownBy(() -> service.ensembleWeights("s", List.of(
                viable(SEASONAL_DECOMPOSITION, Double.NaN, 1.0),
                failed(SEASONAL_REGRESSION)), ErrorMetric.MAPE))
            .isInstanceOf(NoViableModelException.class)
            .extracting("errorCode").isEqualTo("NO_VIABLE_MODEL");
    }

    @Test
    void renormalize_redistributesOverSurvivors() {
        Map<ModelVariant, Double> weights = new EnumMap<>(ModelVariant.class);
        weights.put(SEASONAL_DECOMPOSITION, 0.5);
        weights.put(SEASONAL_REGRESSION, 0.3);
        weights.put(RECURRENT_NETWORK, 0.2);

        Map<ModelVariant, Double> renormalized =
            service.renormalize(weights, Set.of(SEASONAL_REGRESSION, RECURRENT_NETWORK));

        assertThat(renormalized.get(SEASONAL_DECOMPOSITION)).isZero();
        assertThat(renormalized.get(SEASONAL_REGRESSION)).isCloseTo(0.6, within(1e-12));
        assertThat(renormalized.get(RECURRENT_NETWORK)).isCloseTo(0.4, within(1e-12));
        assertThatThrownBy(() -> renormalized.put(SEASONAL_DECOMPOSITION, 1.0))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void ensembleWeights_divergedCandidateGetsNothing() {
        Map<ModelVariant, Double> weights = service.ensembleWeights("s", List.of(
            viable(SEASONAL_DECOMPOSITION, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY),
            viable(SEASONAL_REGRESSION, 20.0, 1.0)), ErrorMetric.MAPE);

        assertThat(weights).containsEntry(SEASONAL_DECOMPOSITION, 0.0).containsEntry(SEASONAL_REGRESSION, 1.0);
    }

    @Test
    void combine_averagesPointsAndVariances() {
        double z = ConfidenceLevels.zScore(0.95);
        Map<ModelVariant, List<ForecastInterval>> forecasts = new EnumMap<>(ModelVariant.class);
        forecasts.put(SEASONAL_DECOMPOSITION, List.of(ForecastInterval.symmetric(10, z)));
        forecasts.put(SEASONAL_REGRESSION, List.of(ForecastInterval.symmetric(20, 3 * z)));

        List<ForecastInterval> combined = service.combine(forecasts,
            Map.of(SEASONAL_DECOMPOSITION, 0.5, SEASONAL_REGRESSION, 0.5), 0.95);

        assertThat(combined).hasSize(1);
        assertThat(combined.get(0).point()).isCloseTo(15.0, within(1e-9));
        assertThat(combined.get(0).halfWidth()).isCloseTo(z * Math.sqrt(5.0), within(1e-9));
    }
}
