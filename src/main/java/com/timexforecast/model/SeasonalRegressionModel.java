package com.timexforecast.model;

import com.timexforecast.exception.PredictionException;
import com.timexforecast.exception.TrainingException;
import com.timexforecast.series.TimeSeriesWindow;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Ordinary least squares on a linear time index, one dummy per seasonal
 * phase (first phase is the baseline) and every exogenous regressor of the
 * training window. Gaps are left out of the fit rather than interpolated.
 * <p>
 * Bounds use the OLS prediction variance {@code σ²(1 + x₀ᵀ(XᵀX)⁻¹x₀)}.
 */
@Slf4j
public class SeasonalRegressionModel implements ForecastModel {

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final int period;
    private final double z;

    private double[] beta;
    private double[][] parameterCovariance;
    private double errorVariance;
    private List<String> regressorNames;
    private int trainingLength;

    public SeasonalRegressionModel(ModelSpec spec) {
        this.period = spec.seasonalPeriod();
        this.z = ConfidenceLevels.zScore(spec.confidenceLevel());
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.SEASONAL_REGRESSION;
    }

    @Override
    public int minTrainingLength() {
        return period + 3;
    }

    @Override
    public ForecastModel fit(TimeSeriesWindow training) {
        ModelSupport.checkTrainingLength(variant(), training, minTrainingLength());
        List<String> names = new ArrayList<>(training.regressorNames());
        Map<String, double[]> regressors = training.regressors();
        int columns = 1 + (period - 1) + names.size();

        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (int t = 0; t < training.size(); t++) {
            double y = training.value(t);
            if (Double.isNaN(y)) {
                continue;
            }
            double[] row = new double[columns];
            fillFeatures(row, t, names, regressors, t);
            rows.add(row);
            targets.add(y);
        }
        if (rows.size() <= columns + 1) {
            throw new TrainingException(variant() + " has " + columns + " features but only " + rows.size()
                + " observed values in " + training.getName());
        }

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        try {
            ols.newSampleData(targets.stream().mapToDouble(Double::doubleValue).toArray(),
                rows.toArray(new double[0][]));
            double[] coefficients = ols.estimateRegressionParameters();
            double[][] covariance = ols.estimateRegressionParametersVariance();
            double variance = ols.estimateErrorVariance();
            if (!ModelSupport.allFinite(coefficients) || !Double.isFinite(variance)) {
                throw new TrainingException("Least squares fit of " + variant() + " produced non-finite parameters");
            }
            this.beta = coefficients;
            this.parameterCovariance = covariance;
            this.errorVariance = variance;
        } catch (MathIllegalArgumentException ex) {
            throw new TrainingException("Least squares fit of " + variant() + " failed on "
                + training.getName() + ": " + ex.getMessage(), ex);
        }
        this.regressorNames = List.copyOf(names);
        this.trainingLength = training.size();
        log.debug("Seasonal regression fitted | series={} | n={} | features={} | sigma2={}",
            training.getName(), rows.size(), columns, errorVariance);
        return this;
    }

    @Override
    public List<ForecastInterval> predict(int horizon, Map<String, double[]> futureRegressors) {
        ModelSupport.checkPredictable(variant(), beta != null, horizon, maxHorizon());
        Map<String, double[]> future = futureRegressors != null ? futureRegressors : Map.of();
        for (String name : regressorNames) {
            double[] values = future.get(name);
            if (values == null) {
                throw new PredictionException(variant() + " was trained with regressor '" + name
                    + "' but no future values were supplied");
            }
            if (values.length != horizon) {
                throw new PredictionException("Future regressor '" + name + "' has " + values.length
                    + " values for a horizon of " + horizon);
            }
        }

        List<ForecastInterval> forecast = new ArrayList<>(horizon);
        double[] features = new double[beta.length - 1];
        double[] x0 = new double[beta.length];
        for (int k = 0; k < horizon; k++) {
            fillFeatures(features, trainingLength + k, regressorNames, future, k);
            x0[0] = 1.0;
            System.arraycopy(features, 0, x0, 1, features.length);
            double point = 0.0;
            for (int i = 0; i < beta.length; i++) {
                point += beta[i] * x0[i];
            }
            double leverage = 0.0;
            for (int i = 0; i < x0.length; i++) {
                for (int j = 0; j < x0.length; j++) {
                    leverage += x0[i] * parameterCovariance[i][j] * x0[j];
                }
            }
            forecast.add(ForecastInterval.symmetric(point, z * Math.sqrt(errorVariance * (1.0 + leverage))));
        }
        return forecast;
    }

    // Layout: [t, phase_1 .. phase_{period-1}, regressors in name order]; the intercept is added by OLS.
    private void fillFeatures(double[] row, int t, List<String> names, Map<String, double[]> regressors, int regressorIndex) {
        Arrays.fill(row, 0.0);
        row[0] = t;
        int phase = t % period;
        if (phase > 0) {
            row[phase] = 1.0;
        }
        int offset = period;
        for (int r = 0; r < names.size(); r++) {
            row[offset + r] = regressors.get(names.get(r))[regressorIndex];
        }
    }
}
