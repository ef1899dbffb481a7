package com.timexforecast.model;

import com.timexforecast.exception.PredictionException;
import com.timexforecast.exception.TrainingException;
import com.timexforecast.series.SamplingFrequency;
import com.timexforecast.series.TimeSeriesWindow;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SeasonalRegressionModelTest {

    private static final LocalDateTime START = LocalDateTime.of(2023, 1, 1, 0, 0);
    private static final double[] QUARTER_PATTERN = {4, -1, -5, 2};

    private static double promo(int t) {
        return t % 5 == 0 ? 1.0 : 0.0;
    }

    private static double truth(int t) {
        return 20 + 1.5 * t + QUARTER_PATTERN[t % 4] + 8 * promo(t);
    }

    private static TimeSeriesWindow withPromo(int n) {
        double[] values = new double[n];
        double[] promo = new double[n];
        for (int t = 0; t < n; t++) {
            values[t] = truth(t);
            promo[t] = promo(t);
        }
        return TimeSeriesWindow.of("units", SamplingFrequency.MONTHLY, START, values, Map.of("promo", promo));
    }

    @Test
    void fitsTrendSeasonAndRegressor() {
        ForecastModel model = new SeasonalRegressionModel(new ModelSpec(4, 0.9, 1L)).fit(withPromo(40));
        double[] futurePromo = {promo(40), promo(41), promo(42), promo(43)};

        List<ForecastInterval> forecast = model.predict(4, Map.of("promo", futurePromo));

        for (int k = 0; k < 4; k++) {
            assertThat(forecast.get(k).point()).isCloseTo(truth(40 + k), within(1e-6));
            assertThat(forecast.get(k).lower()).isLessThanOrEqualTo(forecast.get(k).point());
        }
    }

    @Test
    void missingFutureRegressor_failsPrediction() {
        ForecastModel model = new SeasonalRegressionModel(new ModelSpec(4, 0.9, 1L)).fit(withPromo(30));

        assertThatThrownBy(() -> model.predict(3))
            .isInstanceOf(PredictionException.class)
            .hasMessageContaining("promo");
        assertThatThrownBy(() -> model.predict(3, Map.of("promo", new double[] {0, 1})))
            .isInstanceOf(PredictionException.class)
            .extracting("errorCode").isEqualTo("PREDICTION_FAILED");
    }

    @Test
    void gapsAreLeftOutOfTheFit() {
        double[] values = new double[24];
        for (int t = 0; t < values.length; t++) {
            values[t] = 5 + 2 * t + QUARTER_PATTERN[t % 4];
        }
        values[7] = Double.NaN;
        values[13] = Double.NaN;
        TimeSeriesWindow window = TimeSeriesWindow.of("q", SamplingFrequency.MONTHLY, START, values);

        List<ForecastInterval> forecast = new SeasonalRegressionModel(new ModelSpec(4, 0.95, 1L)).fit(window).predict(2);

        assertThat(forecast.get(0).point()).isCloseTo(5 + 2 * 24 + QUARTER_PATTERN[0], within(1e-6));
        assertThat(forecast.get(1).point()).isCloseTo(5 + 2 * 25 + QUARTER_PATTERN[1], within(1e-6));
    }

    @Test
    void predict_isIdempotent() {
        ForecastModel model = new SeasonalRegressionModel(new ModelSpec(4, 0.95, 1L)).fit(withPromo(30));
        Map<String, double[]> future = Map.of("promo", new double[] {1, 0, 0});
        assertThat(model.predict(3, future)).isEqualTo(model.predict(3, future));
    }

    @Test
    void tooFewObservations_failsTraining() {
        SeasonalRegressionModel model = new SeasonalRegressionModel(new ModelSpec(12, 0.95, 1L));
        double[] values = new double[14];
        for (int t = 0; t < values.length; t++) {
            values[t] = t;
        }
        assertThat(model.minTrainingLength()).isEqualTo(15);
        assertThatThrownBy(() -> model.fit(TimeSeriesWindow.of("short", SamplingFrequency.MONTHLY, START, values)))
            .isInstanceOf(TrainingException.class);
    }
}
