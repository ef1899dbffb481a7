package com.timexforecast.service;

import com.timexforecast.dto.CrossValidationResult;
import com.timexforecast.dto.ErrorMetric;
import com.timexforecast.dto.FoldResult;
import com.timexforecast.dto.FoldSkippedWarning;
import com.timexforecast.exception.CrossValidationException;
import com.timexforecast.exception.PredictionException;
import com.timexforecast.model.ForecastInterval;
import com.timexforecast.model.ForecastModel;
import com.timexforecast.model.ModelVariant;
import com.timexforecast.series.TimeSeriesWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Rolling-origin (walk-forward) validation.
 * <p>
 * The last {@code foldCount * foldTestLength} observations form the folds,
 * oldest first. Fold {@code i} trains a fresh model on every observation
 * strictly before its start and forecasts exactly {@code foldTestLength}
 * steps, with the fold's own regressor values as future regressors.
 * Folds whose history is shorter than the model's minimum training length
 * are skipped and reported; the result averages the remaining folds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrossValidationService {

    private final ForecastErrorCalculator errorCalculator;

    /**
     * @param modelSupplier returns a new untrained instance on every call
     * @throws CrossValidationException if every fold was skipped
     * @throws PredictionException if a fold forecast has the wrong length or a non-finite value
     */
    public CrossValidationResult validate(ModelVariant variant, Supplier<ForecastModel> modelSupplier,
                                          TimeSeriesWindow window, int foldCount, int foldTestLength) {
        if (foldCount < 1 || foldTestLength < 1) {
            throw new IllegalArgumentException("foldCount and foldTestLength must be >= 1");
        }
        int n = window.size();
        List<FoldResult> folds = new ArrayList<>();
        List<FoldSkippedWarning> skipped = new ArrayList<>();

        for (int fold = 0; fold < foldCount; fold++) {
            int testStart = n - (foldCount - fold) * foldTestLength;
            int testEnd = testStart + foldTestLength;
            ForecastModel model = modelSupplier.get();
            int required = model.minTrainingLength();
            if (testStart < Math.max(1, required)) {
                FoldSkippedWarning warning = FoldSkippedWarning.builder()
                    .foldIndex(fold)
                    .trainingLength(Math.max(0, testStart))
                    .requiredLength(required)
                    .message("Fold " + fold + " of " + variant + " skipped: " + Math.max(0, testStart)
                        + " observations before the fold, " + required + " required")
                    .build();
                skipped.add(warning);
                log.warn("Fold skipped | series={} | model={} | fold={} | history={} | required={}",
                    window.getName(), variant, fold, Math.max(0, testStart), required);
                continue;
            }

            TimeSeriesWindow train = window.range(0, testStart);
            TimeSeriesWindow test = window.range(testStart, testEnd);
            model.fit(train);
            List<ForecastInterval> forecast = ForecastChecks.requireUsable(variant,
                model.predict(foldTestLength, test.regressors()), foldTestLength);

            double[] predicted = forecast.stream().mapToDouble(ForecastInterval::point).toArray();
            double[] actual = test.values();
            Map<ErrorMetric, Double> metrics = errorCalculator.compute(predicted, actual);
            folds.add(FoldResult.builder()
                .foldIndex(fold)
                .trainingLength(train.size())
                .trainingEnd(train.lastTimestamp())
                .testStart(test.firstTimestamp())
                .testEnd(test.lastTimestamp())
                .forecasts(Arrays.stream(predicted).boxed().toList())
                .actuals(Arrays.stream(actual).boxed().toList())
                .metrics(metrics)
                .build());
            log.debug("Fold validated | series={} | model={} | fold={} | train={} | metrics={}",
                window.getName(), variant, fold, train.size(), metrics);
        }

        if (folds.isEmpty()) {
            throw new CrossValidationException(variant.name(), skipped);
        }

        Map<ErrorMetric, Double> mean = errorCalculator.mean(folds.stream().map(FoldResult::getMetrics).toList());
        return CrossValidationResult.builder()
            .model(variant)
            .requestedFolds(foldCount)
            .foldTestLength(foldTestLength)
            .folds(List.copyOf(folds))
            .skippedFolds(List.copyOf(skipped))
            .meanMetrics(mean)
            .build();
    }
}
