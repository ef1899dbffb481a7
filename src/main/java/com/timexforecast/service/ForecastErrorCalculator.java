package com.timexforecast.service;

import com.timexforecast.dto.ErrorMetric;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Error metrics between forecasts and actuals. Positions whose actual is a
 * gap (NaN) are ignored; MAPE only counts non-zero actuals and is in percent.
 * A metric without any usable position is NaN.
 */
@Component
public class ForecastErrorCalculator {

    public Map<ErrorMetric, Double> compute(double[] forecasts, double[] actuals) {
        if (forecasts.length != actuals.length) {
            throw new IllegalArgumentException("Got " + forecasts.length + " forecasts for "
                + actuals.length + " actuals");
        }
        double absError = 0.0;
        double sqError = 0.0;
        double errorSum = 0.0;
        double ape = 0.0;
        int apeCount = 0;
        int n = 0;
        for (int i = 0; i < actuals.length; i++) {
            double actual = actuals[i];
            if (Double.isNaN(actual)) {
                continue;
            }
            double err = forecasts[i] - actual;
            absError += Math.abs(err);
            sqError += err * err;
            errorSum += err;
            if (actual != 0.0d) {
                ape += Math.abs(err / actual);
                apeCount++;
            }
            n++;
        }

        Map<ErrorMetric, Double> metrics = new EnumMap<>(ErrorMetric.class);
        if (n == 0) {
            for (ErrorMetric metric : ErrorMetric.values()) {
                metrics.put(metric, Double.NaN);
            }
            return Collections.unmodifiableMap(metrics);
        }
        double mean = errorSum / n;
        double deviation = 0.0;
        for (int i = 0; i < actuals.length; i++) {
            if (!Double.isNaN(actuals[i])) {
                double d = (forecasts[i] - actuals[i]) - mean;
                deviation += d * d;
            }
        }
        metrics.put(ErrorMetric.MAE, absError / n);
        metrics.put(ErrorMetric.MSE, sqError / n);
        metrics.put(ErrorMetric.RMSE, Math.sqrt(sqError / n));
        metrics.put(ErrorMetric.MAPE, apeCount > 0 ? (ape / apeCount) * 100.0 : Double.NaN);
        metrics.put(ErrorMetric.AM, mean);
        metrics.put(ErrorMetric.SD, Math.sqrt(deviation / n));
        return Collections.unmodifiableMap(metrics);
    }

    /**
     * Arithmetic mean of each metric over the folds where it is defined. An
     * undefined (NaN) fold metric is left out; an infinite one is kept, so a
     * fold that diverged makes the mean infinite.
     */
    public Map<ErrorMetric, Double> mean(Collection<Map<ErrorMetric, Double>> perFold) {
        Map<ErrorMetric, Double> means = new EnumMap<>(ErrorMetric.class);
        for (ErrorMetric metric : ErrorMetric.values()) {
            means.put(metric, perFold.stream()
                .map(m -> m.get(metric))
                .filter(v -> v != null && !Double.isNaN(v))
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(Double.NaN));
        }
        return Collections.unmodifiableMap(means);
    }
}
