package com.timexforecast.model;

import com.timexforecast.series.SamplingFrequency;
import com.timexforecast.series.TimeSeriesWindow;
import com.timexforecast.series.Transformation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TransformedForecastModelTest {

    @Mock ForecastModel delegate;

    @Test
    void fitsOnTransformedValuesAndInvertsForecasts() {
        TimeSeriesWindow window = TimeSeriesWindow.of("s", SamplingFrequency.DAILY,
            LocalDateTime.of(2024, 1, 1, 0, 0), 0, 9, 99);
        when(delegate.predict(eq(1), anyMap())).thenReturn(List.of(
            new ForecastInterval(Math.log1p(100), Math.log1p(50), Math.log1p(200))));

        ForecastModel model = new TransformedForecastModel(delegate, Transformation.LOG_MODIFIED).fit(window);
        List<ForecastInterval> forecast = model.predict(1, Map.of());

        ArgumentCaptor<TimeSeriesWindow> fitted = ArgumentCaptor.forClass(TimeSeriesWindow.class);
        verify(delegate).fit(fitted.capture());
        assertThat(fitted.getValue().values())
            .containsExactly(new double[] {0.0, Math.log(10), Math.log(100)}, within(1e-12));
        assertThat(forecast.get(0).point()).isCloseTo(100.0, within(1e-9));
        assertThat(forecast.get(0).lower()).isCloseTo(50.0, within(1e-9));
        assertThat(forecast.get(0).upper()).isCloseTo(200.0, within(1e-9));
    }

    @Test
    void reportsDelegateMetadata() {
        when(delegate.variant()).thenReturn(ModelVariant.SEASONAL_REGRESSION);
        when(delegate.minTrainingLength()).thenReturn(10);
        ForecastModel model = new TransformedForecastModel(delegate, Transformation.LOG);
        assertThat(model.variant()).isEqualTo(ModelVariant.SEASONAL_REGRESSION);
        assertThat(model.minTrainingLength()).isEqualTo(10);
    }

    @Test
    void zScore_matchesNormalQuantiles() {
        assertThat(ConfidenceLevels.zScore(0.95)).isCloseTo(1.959964, within(1e-6));
        assertThat(ConfidenceLevels.zScore(0.8)).isCloseTo(1.281552, within(1e-6));
        assertThatThrownBy(() -> ConfidenceLevels.zScore(1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reversedBoundsAreSwapped() {
        ForecastInterval interval = new ForecastInterval(5, 8, 2);
        assertThat(interval.lower()).isEqualTo(2);
        assertThat(interval.upper()).isEqualTo(8);
        assertThat(interval.halfWidth()).isEqualTo(3);
    }
}
