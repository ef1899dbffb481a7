package com.timexforecast.model;

import com.timexforecast.series.TimeSeriesWindow;
import com.timexforecast.series.Transformation;

import java.util.List;
import java.util.Map;

/**
 * Fits the delegate on transformed values and maps every forecast value
 * (point and both bounds) back to the original scale.
 */
public class TransformedForecastModel implements ForecastModel {

    private final ForecastModel delegate;
    private final Transformation transformation;

    public TransformedForecastModel(ForecastModel delegate, Transformation transformation) {
        this.delegate = delegate;
        this.transformation = transformation;
    }

    @Override
    public ModelVariant variant() {
        return delegate.variant();
    }

    @Override
    public int minTrainingLength() {
        return delegate.minTrainingLength();
    }

    @Override
    public int maxHorizon() {
        return delegate.maxHorizon();
    }

    @Override
    public ForecastModel fit(TimeSeriesWindow training) {
        delegate.fit(training.mapValues(transformation::apply));
        return this;
    }

    @Override
    public List<ForecastInterval> predict(int horizon, Map<String, double[]> futureRegressors) {
        return delegate.predict(horizon, futureRegressors).stream()
            .map(f -> new ForecastInterval(
                transformation.inverse(f.point()),
                transformation.inverse(f.lower()),
                transformation.inverse(f.upper())))
            .toList();
    }
}
