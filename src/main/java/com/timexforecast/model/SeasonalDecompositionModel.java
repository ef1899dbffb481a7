package com.timexforecast.model;

import com.timexforecast.exception.TrainingException;
import com.timexforecast.series.TimeSeriesWindow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Classical additive decomposition: seasonal indices estimated against a
 * centered moving average, then a straight-line trend fitted on the
 * deseasonalized series. Forecast = extrapolated trend + seasonal index.
 * Bounds come from the standard error of the trend regression's prediction.
 */
@Slf4j
public class SeasonalDecompositionModel implements ForecastModel {

    private final int period;
    private final double z;

    private SimpleRegression trend;
    private double[] seasonalIndices;
    private int trainingLength;
    private double meanSquareError;

    public SeasonalDecompositionModel(ModelSpec spec) {
        this.period = spec.seasonalPeriod();
        this.z = ConfidenceLevels.zScore(spec.confidenceLevel());
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.SEASONAL_DECOMPOSITION;
    }

    @Override
    public int minTrainingLength() {
        return Math.max(4, 2 * period);
    }

    @Override
    public ForecastModel fit(TimeSeriesWindow training) {
        ModelSupport.checkTrainingLength(variant(), training, minTrainingLength());
        double[] y = training.filledValues();
        int n = y.length;

        double[] indices = period > 1 ? seasonalIndices(y) : new double[] {0.0};
        SimpleRegression regression = new SimpleRegression();
        for (int t = 0; t < n; t++) {
            regression.addData(t, y[t] - indices[t % indices.length]);
        }
        double mse = regression.getMeanSquareError();
        if (!ModelSupport.allFinite(regression.getSlope(), regression.getIntercept(), mse)) {
            throw new TrainingException("Trend regression of " + variant() + " did not converge on "
                + training.getName());
        }

        this.trend = regression;
        this.seasonalIndices = indices;
        this.trainingLength = n;
        this.meanSquareError = mse;
        log.debug("Decomposition fitted | series={} | n={} | slope={} | intercept={} | mse={}",
            training.getName(), n, regression.getSlope(), regression.getIntercept(), mse);
        return this;
    }

    @Override
    public List<ForecastInterval> predict(int horizon, Map<String, double[]> futureRegressors) {
        ModelSupport.checkPredictable(variant(), trend != null, horizon, maxHorizon());
        double xMean = (trainingLength - 1) / 2.0;
        double sxx = trend.getXSumSquares();
        List<ForecastInterval> forecast = new ArrayList<>(horizon);
        for (int k = 1; k <= horizon; k++) {
            int t = trainingLength - 1 + k;
            double point = trend.predict(t) + seasonalIndices[t % seasonalIndices.length];
            double leverage = 1.0 + 1.0 / trainingLength + (t - xMean) * (t - xMean) / sxx;
            forecast.add(ForecastInterval.symmetric(point, z * Math.sqrt(meanSquareError * leverage)));
        }
        return forecast;
    }

    private double[] seasonalIndices(double[] y) {
        double[] movingAverage = centeredMovingAverage(y);
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int t = 0; t < y.length; t++) {
            if (!Double.isNaN(movingAverage[t])) {
                sums[t % period] += y[t] - movingAverage[t];
                counts[t % period]++;
            }
        }
        double[] indices = new double[period];
        double mean = 0.0;
        for (int p = 0; p < period; p++) {
            indices[p] = counts[p] > 0 ? sums[p] / counts[p] : 0.0;
            mean += indices[p];
        }
        mean /= period;
        for (int p = 0; p < period; p++) {
            indices[p] -= mean;
        }
        return indices;
    }

    // 2xm moving average for even periods, plain m-term average for odd ones; NaN where undefined.
    private double[] centeredMovingAverage(double[] y) {
        double[] ma = new double[y.length];
        Arrays.fill(ma, Double.NaN);
        int half = period / 2;
        for (int t = half; t < y.length - half; t++) {
            double sum = 0.0;
            if (period % 2 == 1) {
                for (int j = t - half; j <= t + half; j++) {
                    sum += y[j];
                }
            } else {
                sum += 0.5 * y[t - half] + 0.5 * y[t + half];
                for (int j = t - half + 1; j < t + half; j++) {
                    sum += y[j];
                }
            }
            ma[t] = sum / period;
        }
        return ma;
    }
}
