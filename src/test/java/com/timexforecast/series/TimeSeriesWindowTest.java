package com.timexforecast.series;

import com.timexforecast.exception.InsufficientDataException;
import com.timexforecast.exception.MalformedSeriesException;
import com.timexforecast.exception.RangeException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TimeSeriesWindowTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private static TimeSeriesWindow daily(double... values) {
        return TimeSeriesWindow.of("sales", SamplingFrequency.DAILY, START, values);
    }

    @Test
    void of_buildsRegularTimestamps() {
        TimeSeriesWindow window = daily(1, 2, 3);
        assertThat(window.size()).isEqualTo(3);
        assertThat(window.timestamps()).containsExactly(START, START.plusDays(1), START.plusDays(2));
        assertThat(window.getName()).isEqualTo("sales");
    }

    @Test
    void blankName_defaultsToSeries() {
        assertThat(TimeSeriesWindow.of(" ", SamplingFrequency.DAILY, START, 1, 2).getName()).isEqualTo("series");
    }

    @Test
    void irregularSampling_isRejected() {
        List<LocalDateTime> ts = List.of(START, START.plusDays(1), START.plusDays(3));
        assertThatThrownBy(() -> new TimeSeriesWindow("s", SamplingFrequency.DAILY, ts, new double[] {1, 2, 3}, null))
            .isInstanceOf(MalformedSeriesException.class)
            .hasMessageContaining("NaN")
            .extracting("errorCode").isEqualTo("MALFORMED_INPUT");
    }

    @Test
    void nonIncreasingTimestamps_areRejected() {
        List<LocalDateTime> ts = List.of(START, START);
        assertThatThrownBy(() -> new TimeSeriesWindow("s", SamplingFrequency.DAILY, ts, new double[] {1, 2}, null))
            .isInstanceOf(MalformedSeriesException.class)
            .hasMessageContaining("strictly increasing");
    }

    @Test
    void malformedValues_areRejected() {
        assertThatThrownBy(() -> daily())
            .isInstanceOf(MalformedSeriesException.class);
        assertThatThrownBy(() -> daily(1, Double.POSITIVE_INFINITY))
            .isInstanceOf(MalformedSeriesException.class);
        assertThatThrownBy(() -> daily(Double.NaN, Double.NaN))
            .isInstanceOf(MalformedSeriesException.class)
            .hasMessageContaining("no observed value");
        assertThatThrownBy(() -> new TimeSeriesWindow("s", SamplingFrequency.DAILY, List.of(START),
                new double[] {1, 2}, null))
            .isInstanceOf(MalformedSeriesException.class);
    }

    @Test
    void misalignedRegressor_isRejected() {
        assertThatThrownBy(() -> TimeSeriesWindow.of("s", SamplingFrequency.DAILY, START,
                new double[] {1, 2, 3}, Map.of("price", new double[] {1, 2})))
            .isInstanceOf(MalformedSeriesException.class)
            .hasMessageContaining("price");
    }

    @Test
    void monthEndStart_staysRegular() {
        LocalDateTime jan31 = LocalDateTime.of(2024, 1, 31, 0, 0);
        TimeSeriesWindow window = TimeSeriesWindow.of("m", SamplingFrequency.MONTHLY, jan31, 1, 2, 3);
        assertThat(window.timestamp(1)).isEqualTo(LocalDateTime.of(2024, 2, 29, 0, 0));
        assertThat(window.timestamp(2)).isEqualTo(LocalDateTime.of(2024, 3, 31, 0, 0));
        assertThat(window.futureTimestamps(1)).containsExactly(LocalDateTime.of(2024, 4, 30, 0, 0));
    }

    @Test
    void range_keepsParentTimestampsAndMetadata() {
        TimeSeriesWindow window = TimeSeriesWindow.of("m", SamplingFrequency.MONTHLY,
            LocalDateTime.of(2024, 1, 31, 0, 0), 1, 2, 3);

        TimeSeriesWindow tail = window.range(1, 3);

        assertThat(tail.getName()).isEqualTo("m");
        assertThat(tail.getFrequency()).isEqualTo(SamplingFrequency.MONTHLY);
        assertThat(tail.timestamps())
            .containsExactly(LocalDateTime.of(2024, 2, 29, 0, 0), LocalDateTime.of(2024, 3, 31, 0, 0));
        assertThat(tail.values()).containsExactly(2, 3);
        assertThat(tail.mapValues(v -> v * 10).timestamps()).isEqualTo(tail.timestamps());
    }

    @Test
    void splitTrainTest_partitionsWithoutOverlap() {
        TimeSeriesWindow window = daily(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        for (int t = 1; t < window.size(); t++) {
            TimeSeriesWindow.Split split = window.splitTrainTest(t);
            assertThat(split.train().size() + split.test().size()).isEqualTo(window.size());
            assertThat(split.test().size()).isEqualTo(t);
            assertThat(split.train().lastTimestamp()).isBefore(split.test().firstTimestamp());
            assertThat(split.test().lastTimestamp()).isEqualTo(window.lastTimestamp());
        }
    }

    @Test
    void splitTrainTest_rejectsBadLengths() {
        TimeSeriesWindow window = daily(1, 2, 3);
        assertThatThrownBy(() -> window.splitTrainTest(3))
            .isInstanceOf(InsufficientDataException.class)
            .extracting("errorCode").isEqualTo("INSUFFICIENT_DATA");
        assertThatThrownBy(() -> window.splitTrainTest(0)).isInstanceOf(RangeException.class);
    }

    @Test
    void slice_isInclusiveAndCarriesRegressors() {
        TimeSeriesWindow window = TimeSeriesWindow.of("s", SamplingFrequency.DAILY, START,
            new double[] {10, 11, 12, 13, 14}, Map.of("promo", new double[] {0, 1, 0, 1, 0}));
        TimeSeriesWindow slice = window.slice(START.plusDays(1), START.plusDays(3));
        assertThat(slice.values()).containsExactly(11, 12, 13);
        assertThat(slice.regressor("promo")).containsExactly(1, 0, 1);
    }

    @Test
    void slice_rejectsEmptyOrInvertedRanges() {
        TimeSeriesWindow window = daily(1, 2, 3);
        assertThatThrownBy(() -> window.slice(START.plusDays(2), START))
            .isInstanceOf(RangeException.class);
        assertThatThrownBy(() -> window.slice(START.plusDays(10), START.plusDays(12)))
            .isInstanceOf(RangeException.class)
            .extracting("errorCode").isEqualTo("RANGE_ERROR");
        assertThatThrownBy(() -> window.range(2, 2)).isInstanceOf(RangeException.class);
        assertThatThrownBy(() -> window.regressor("missing")).isInstanceOf(RangeException.class);
    }

    @Test
    void filledValues_interpolatesGapsAndKeepsOriginal() {
        TimeSeriesWindow window = daily(Double.NaN, 2, Double.NaN, Double.NaN, 8, Double.NaN);
        assertThat(window.filledValues()).containsExactly(2, 2, 4, 6, 8, 8);
        assertThat(window.value(2)).isNaN();
    }

    @Test
    void window_isNotMutatedThroughAccessors() {
        double[] source = {1, 2, 3};
        TimeSeriesWindow window = daily(source);
        source[0] = 99;
        window.values()[1] = 99;
        assertThat(window.values()).containsExactly(1, 2, 3);
    }

    @Test
    void mapValues_keepsGaps() {
        TimeSeriesWindow mapped = daily(1, Double.NaN, 3).mapValues(v -> v * 2);
        assertThat(mapped.value(0)).isEqualTo(2);
        assertThat(mapped.value(1)).isNaN();
        assertThat(mapped.value(2)).isEqualTo(6);
    }
}
