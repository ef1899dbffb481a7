package com.timexforecast.model;

import com.timexforecast.exception.PredictionException;
import com.timexforecast.exception.TrainingException;
import com.timexforecast.series.TimeSeriesWindow;

import java.util.List;
import java.util.Map;

/**
 * Capability shared by every forecasting model.
 * <p>
 * An instance is created untrained, fitted against exactly one window and
 * then queried any number of times. Repeated {@link #predict} calls after one
 * fit return identical results and leave the fitted state untouched.
 * Bounds are always reported; a model without a genuine interval reports
 * the point widened by z times its in-sample residual standard deviation.
 */
public interface ForecastModel {

    int UNBOUNDED_HORIZON = Integer.MAX_VALUE;

    ModelVariant variant();

    int minTrainingLength();

    default int maxHorizon() {
        return UNBOUNDED_HORIZON;
    }

    /**
     * @return this instance, now trained
     * @throws TrainingException if the window is shorter than
     *         {@link #minTrainingLength()} or the numerical fit fails
     */
    ForecastModel fit(TimeSeriesWindow training);

    /**
     * @param futureRegressors regressor values for the horizon, keyed by name;
     *                         required when the model was fitted with regressors
     * @return exactly {@code horizon} intervals, nearest step first
     * @throws PredictionException if not fitted, or regressors are missing or misaligned
     */
    List<ForecastInterval> predict(int horizon, Map<String, double[]> futureRegressors);

    default List<ForecastInterval> predict(int horizon) {
        return predict(horizon, Map.of());
    }
}
