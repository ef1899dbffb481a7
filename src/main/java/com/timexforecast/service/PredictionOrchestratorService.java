package com.timexforecast.service;

import com.timexforecast.config.ForecastPipelineProperties;
import com.timexforecast.dto.CandidateDiagnostic;
import com.timexforecast.dto.CandidateStatus;
import com.timexforecast.dto.CrossValidationResult;
import com.timexforecast.dto.EnsemblePolicy;
import com.timexforecast.dto.ErrorMetric;
import com.timexforecast.dto.ForecastPoint;
import com.timexforecast.dto.ForecastSettings;
import com.timexforecast.dto.PipelineStage;
import com.timexforecast.dto.PredictionArtifact;
import com.timexforecast.exception.CrossValidationException;
import com.timexforecast.exception.InvalidSettingsException;
import com.timexforecast.exception.MalformedSeriesException;
import com.timexforecast.exception.NoViableModelException;
import com.timexforecast.exception.TimexForecastException;
import com.timexforecast.model.ForecastInterval;
import com.timexforecast.model.ForecastModel;
import com.timexforecast.model.ModelSpec;
import com.timexforecast.model.ModelVariant;
import com.timexforecast.series.TimeSeriesWindow;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point of the pipeline. One invocation walks
 * {@code INIT → VALIDATING → SELECTING → RETRAINING → FORECASTING → DONE}
 * for a single series.
 * <p>
 * A candidate that fails, times out or has every fold skipped is excluded
 * with a diagnostic and never aborts the run. The caller gets either a
 * complete {@link PredictionArtifact} or one of
 * {@link MalformedSeriesException}, {@link InvalidSettingsException} and
 * {@link NoViableModelException}. Every invocation owns its worker pool and
 * settings, so concurrent invocations for different series are independent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionOrchestratorService {

    private final ForecastModelRegistry modelRegistry;
    private final CrossValidationService crossValidationService;
    private final ModelSelectionService selectionService;
    private final ForecastPipelineProperties properties;
    private final Validator validator;

    public Mono<PredictionArtifact> forecast(TimeSeriesWindow window, ForecastSettings settings) {
        return Mono.fromCallable(() -> forecastBlocking(window, settings))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /** Runs with the configured {@code timex.pipeline} defaults. */
    public PredictionArtifact forecastBlocking(TimeSeriesWindow window) {
        return forecastBlocking(window, properties.toSettings());
    }

    public PredictionArtifact forecastBlocking(TimeSeriesWindow window, ForecastSettings settings) {
        if (window == null) {
            throw new MalformedSeriesException("A time series window is required");
        }
        ForecastSettings effective = settings != null ? settings : properties.toSettings();
        validateSettings(effective);
        Map<String, double[]> futureRegressors = futureRegressors(window, effective);

        PipelineRun run = new PipelineRun(window.getName());
        ModelSpec spec = new ModelSpec(
            effective.getSeasonalPeriod() != null
                ? effective.getSeasonalPeriod()
                : window.getFrequency().defaultSeasonalPeriod(),
            effective.getConfidenceLevel(),
            effective.getRandomSeed());
        List<ModelVariant> candidates = effective.getCandidateModels().stream()
            .sorted(Comparator.comparingInt(ModelVariant::priority))
            .toList();
        log.info("Pipeline started | series={} | observations={} | candidates={} | policy={} | metric={} | period={}",
            window.getName(), window.size(), candidates, effective.getEnsemblePolicy(),
            effective.getPrimaryMetric(), spec.seasonalPeriod());

        try (CandidateTaskRunner runner =
                 new CandidateTaskRunner(effective.getWorkerPoolSize(), effective.getPerModelTimeout())) {
            run.enter(PipelineStage.VALIDATING);
            validateCandidates(run, runner, candidates, window, spec, effective);

            run.enter(PipelineStage.SELECTING);
            if (effective.getEnsemblePolicy() == EnsemblePolicy.WEIGHTED) {
                return weighted(run, runner, window, spec, effective, futureRegressors);
            }
            return bestOf(run, runner, window, spec, effective, futureRegressors);
        }
    }

    private void validateCandidates(PipelineRun run, CandidateTaskRunner runner, List<ModelVariant> candidates,
                                    TimeSeriesWindow window, ModelSpec spec, ForecastSettings settings) {
        List<CandidateTaskRunner.Outcome<CrossValidationResult>> outcomes = runner.runAll(candidates,
            variant -> crossValidationService.validate(
                variant,
                () -> modelRegistry.create(variant, spec, settings.getTransformation()),
                window,
                settings.getFoldCount(),
                settings.getFoldTestLength()));

        for (CandidateTaskRunner.Outcome<CrossValidationResult> outcome : outcomes) {
            if (outcome.succeeded()) {
                CrossValidationResult result = outcome.value();
                run.diagnostics.put(outcome.candidate(), CandidateDiagnostic.builder()
                    .model(outcome.candidate())
                    .status(CandidateStatus.VIABLE)
                    .crossValidation(result)
                    .skippedFolds(result.getSkippedFolds())
                    .build());
                log.info("Candidate validated | series={} | model={} | folds={} | {}={}",
                    run.seriesName, outcome.candidate(), result.getFolds().size(),
                    settings.getPrimaryMetric(), result.metric(settings.getPrimaryMetric()));
            } else {
                run.exclude(outcome.candidate(), PipelineStage.VALIDATING, outcome);
            }
        }
    }

    private PredictionArtifact bestOf(PipelineRun run, CandidateTaskRunner runner, TimeSeriesWindow window,
                                      ModelSpec spec, ForecastSettings settings,
                                      Map<String, double[]> futureRegressors) {
        List<ModelVariant> ranking = select(run, () -> selectionService.rank(
            run.seriesName, run.diagnosticList(), settings.getPrimaryMetric()));

        for (ModelVariant variant : ranking) {
            run.enter(PipelineStage.RETRAINING);
            CandidateTaskRunner.Outcome<ForecastModel> fitted = runner.runAll(List.of(variant),
                v -> retrain(v, spec, settings, window)).get(0);
            if (!fitted.succeeded()) {
                run.exclude(variant, PipelineStage.RETRAINING, fitted);
                continue;
            }

            run.enter(PipelineStage.FORECASTING);
            CandidateTaskRunner.Outcome<List<ForecastInterval>> forecast = runner.runAll(List.of(variant),
                v -> predict(v, fitted.value(), settings.getForecastHorizon(), futureRegressors)).get(0);
            if (!forecast.succeeded()) {
                run.exclude(variant, PipelineStage.FORECASTING, forecast);
                continue;
            }

            for (ModelVariant other : ranking) {
                if (other != variant && run.status(other) == CandidateStatus.VIABLE) {
                    run.mark(other, CandidateStatus.DROPPED, null);
                }
            }
            run.mark(variant, CandidateStatus.SELECTED, null);
            log.info("Best model chosen | series={} | model={} | rank={}",
                run.seriesName, variant, ranking.indexOf(variant) + 1);
            return complete(run, window, settings, variant, null, forecast.value());
        }
        throw run.fail(new NoViableModelException(run.seriesName, run.diagnosticList()));
    }

    private PredictionArtifact weighted(PipelineRun run, CandidateTaskRunner runner, TimeSeriesWindow window,
                                        ModelSpec spec, ForecastSettings settings,
                                        Map<String, double[]> futureRegressors) {
        Map<ModelVariant, Double> weights = select(run, () -> selectionService.ensembleWeights(
            run.seriesName, run.diagnosticList(), settings.getPrimaryMetric()));
        List<ModelVariant> members = weights.entrySet().stream()
            .filter(e -> e.getValue() > 0.0)
            .map(Map.Entry::getKey)
            .toList();
        weights.forEach((variant, weight) -> {
            if (weight <= 0.0 && run.status(variant) == CandidateStatus.VIABLE) {
                run.mark(variant, CandidateStatus.DROPPED, 0.0);
            }
        });

        run.enter(PipelineStage.RETRAINING);
        Map<ModelVariant, ForecastModel> fitted = new EnumMap<>(ModelVariant.class);
        for (CandidateTaskRunner.Outcome<ForecastModel> outcome
                : runner.runAll(members, v -> retrain(v, spec, settings, window))) {
            if (outcome.succeeded()) {
                fitted.put(outcome.candidate(), outcome.value());
            } else {
                run.exclude(outcome.candidate(), PipelineStage.RETRAINING, outcome);
            }
        }
        if (fitted.isEmpty()) {
            throw run.fail(new NoViableModelException(run.seriesName, run.diagnosticList()));
        }

        run.enter(PipelineStage.FORECASTING);
        Map<ModelVariant, List<ForecastInterval>> forecasts = new EnumMap<>(ModelVariant.class);
        for (CandidateTaskRunner.Outcome<List<ForecastInterval>> outcome : runner.runAll(
                List.copyOf(fitted.keySet()),
                v -> predict(v, fitted.get(v), settings.getForecastHorizon(), futureRegressors))) {
            if (outcome.succeeded()) {
                forecasts.put(outcome.candidate(), outcome.value());
            } else {
                run.exclude(outcome.candidate(), PipelineStage.FORECASTING, outcome);
            }
        }
        if (forecasts.isEmpty()) {
            throw run.fail(new NoViableModelException(run.seriesName, run.diagnosticList()));
        }

        Map<ModelVariant, Double> finalWeights = selectionService.renormalize(weights, forecasts.keySet());
        if (forecasts.size() < members.size()) {
            log.warn("Ensemble weights renormalized | series={} | survivors={} | weights={}",
                run.seriesName, forecasts.keySet(), finalWeights);
        }
        finalWeights.forEach((variant, weight) -> {
            CandidateStatus status = run.status(variant);
            if (forecasts.containsKey(variant)) {
                run.mark(variant, CandidateStatus.SELECTED, weight);
            } else if (status != null) {
                run.mark(variant, status, 0.0);
            }
        });
        List<ForecastInterval> combined =
            selectionService.combine(forecasts, finalWeights, settings.getConfidenceLevel());
        return complete(run, window, settings, null, finalWeights, combined);
    }

    private <T> T select(PipelineRun run, Supplier<T> selection) {
        try {
            return selection.get();
        } catch (NoViableModelException ex) {
            throw run.fail(ex);
        }
    }

    private ForecastModel retrain(ModelVariant variant, ModelSpec spec, ForecastSettings settings,
                                  TimeSeriesWindow window) {
        ForecastModel model = modelRegistry.create(variant, spec, settings.getTransformation()).fit(window);
        log.debug("Model retrained on full window | model={} | observations={}", variant, window.size());
        return model;
    }

    private List<ForecastInterval> predict(ModelVariant variant, ForecastModel model, int horizon,
                                           Map<String, double[]> futureRegressors) {
        return ForecastChecks.requireUsable(variant, model.predict(horizon, futureRegressors), horizon);
    }

    private PredictionArtifact complete(PipelineRun run, TimeSeriesWindow window, ForecastSettings settings,
                                        ModelVariant chosen, Map<ModelVariant, Double> weights,
                                        List<ForecastInterval> forecast) {
        List<LocalDateTime> timestamps = window.futureTimestamps(settings.getForecastHorizon());
        List<ForecastPoint> points = new ArrayList<>(forecast.size());
        for (int k = 0; k < forecast.size(); k++) {
            ForecastInterval step = forecast.get(k);
            points.add(ForecastPoint.builder()
                .timestamp(timestamps.get(k))
                .point(step.point())
                .lowerBound(step.lower())
                .upperBound(step.upper())
                .build());
        }

        Map<ModelVariant, Map<ErrorMetric, Double>> selectionMetrics = new EnumMap<>(ModelVariant.class);
        for (CandidateDiagnostic diagnostic : run.diagnosticList()) {
            if (diagnostic.getCrossValidation() != null) {
                selectionMetrics.put(diagnostic.getModel(),
                    Collections.unmodifiableMap(diagnostic.getCrossValidation().getMeanMetrics()));
            }
        }

        run.enter(PipelineStage.DONE);
        PredictionArtifact artifact = PredictionArtifact.builder()
            .seriesName(window.getName())
            .policy(settings.getEnsemblePolicy())
            .chosenModel(chosen)
            .ensembleWeights(weights == null ? null : Collections.unmodifiableMap(weights))
            .primaryMetric(settings.getPrimaryMetric())
            .horizon(settings.getForecastHorizon())
            .confidenceLevel(settings.getConfidenceLevel())
            .points(List.copyOf(points))
            .selectionMetrics(Collections.unmodifiableMap(selectionMetrics))
            .candidates(run.diagnosticList())
            .stages(List.copyOf(run.stages))
            .generatedAt(Instant.now())
            .build();
        log.info("Forecast emitted | series={} | policy={} | model={} | weights={} | horizon={}",
            artifact.getSeriesName(), artifact.getPolicy(), chosen, weights, artifact.getHorizon());
        return artifact;
    }

    private void validateSettings(ForecastSettings settings) {
        Set<ConstraintViolation<ForecastSettings>> violations = validator.validate(settings);
        List<String> problems = violations.stream()
            .map(ConstraintViolation::getMessage)
            .sorted()
            .collect(Collectors.toCollection(ArrayList::new));
        if (settings.getPerModelTimeout() != null
                && (settings.getPerModelTimeout().isZero() || settings.getPerModelTimeout().isNegative())) {
            problems.add("perModelTimeout must be positive");
        }
        if (settings.getPrimaryMetric() != null && !settings.getPrimaryMetric().isRankable()) {
            problems.add("primaryMetric " + settings.getPrimaryMetric() + " cannot rank models");
        }
        if (!problems.isEmpty()) {
            throw new InvalidSettingsException("Invalid forecast settings: " + String.join("; ", problems));
        }
    }

    /**
     * Future regressors must name exactly the window's regressors, each with
     * one finite value per forecast step.
     */
    private Map<String, double[]> futureRegressors(TimeSeriesWindow window, ForecastSettings settings) {
        Map<String, List<Double>> supplied = settings.getFutureRegressors() != null
            ? settings.getFutureRegressors() : Map.of();
        if (!supplied.keySet().equals(window.regressorNames())) {
            throw new InvalidSettingsException("futureRegressors " + supplied.keySet()
                + " must match the regressors of series '" + window.getName() + "': " + window.regressorNames());
        }
        Map<String, double[]> converted = new LinkedHashMap<>();
        for (Map.Entry<String, List<Double>> entry : supplied.entrySet()) {
            List<Double> values = entry.getValue();
            if (values == null || values.size() != settings.getForecastHorizon()
                    || values.stream().anyMatch(v -> v == null || !Double.isFinite(v))) {
                throw new InvalidSettingsException("futureRegressors." + entry.getKey() + " must hold "
                    + settings.getForecastHorizon() + " finite values");
            }
            converted.put(entry.getKey(), values.stream().mapToDouble(Double::doubleValue).toArray());
        }
        return converted;
    }

    /** Stage trace and candidate diagnostics of one invocation. */
    private static final class PipelineRun {
        private final String seriesName;
        private final List<PipelineStage> stages = new ArrayList<>(List.of(PipelineStage.INIT));
        private final Map<ModelVariant, CandidateDiagnostic> diagnostics = new EnumMap<>(ModelVariant.class);

        private PipelineRun(String seriesName) {
            this.seriesName = seriesName;
        }

        void enter(PipelineStage stage) {
            log.info("Pipeline stage | series={} | from={} | to={}", seriesName, stages.get(stages.size() - 1), stage);
            stages.add(stage);
        }

        NoViableModelException fail(NoViableModelException ex) {
            enter(PipelineStage.FAILED);
            log.error("Pipeline failed | series={} | stages={} | reason={}", seriesName, stages, ex.getMessage());
            return ex;
        }

        CandidateStatus status(ModelVariant variant) {
            CandidateDiagnostic diagnostic = diagnostics.get(variant);
            return diagnostic != null ? diagnostic.getStatus() : null;
        }

        void mark(ModelVariant variant, CandidateStatus status, Double weight) {
            diagnostics.computeIfPresent(variant, (v, d) -> d.toBuilder().status(status).ensembleWeight(weight).build());
        }

        void exclude(ModelVariant variant, PipelineStage stage, CandidateTaskRunner.Outcome<?> outcome) {
            TimexForecastException failure = outcome.failure();
            CandidateDiagnostic previous = diagnostics.get(variant);
            CandidateDiagnostic.CandidateDiagnosticBuilder builder = previous != null
                ? previous.toBuilder()
                : CandidateDiagnostic.builder().model(variant);
            if (failure instanceof CrossValidationException cv) {
                builder.skippedFolds(cv.getSkippedFolds());
            }
            diagnostics.put(variant, builder
                .status(outcome.timedOut() ? CandidateStatus.TIMED_OUT : CandidateStatus.FAILED)
                .errorCode(failure.getErrorCode())
                .failureReason(failure.getMessage())
                .build());
            log.warn("Candidate excluded | series={} | model={} | stage={} | code={} | reason={}",
                seriesName, variant, stage, failure.getErrorCode(), failure.getMessage());
        }

        List<CandidateDiagnostic> diagnosticList() {
            return List.copyOf(diagnostics.values());
        }
    }
}
