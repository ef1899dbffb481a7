package com.timexforecast.series;

import com.timexforecast.exception.InsufficientDataException;
import com.timexforecast.exception.MalformedSeriesException;
import com.timexforecast.exception.RangeException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable, regularly sampled series of observations with optional
 * exogenous regressors aligned to it.
 * <p>
 * Every timestamp is exactly one sampling step after the previous one. A
 * missing observation is kept as an explicit {@code NaN} at its timestamp,
 * never dropped. Slicing always returns a new window; regressors follow the
 * same index range as the observations.
 */
public final class TimeSeriesWindow {

    private final String name;
    private final SamplingFrequency frequency;
    private final List<LocalDateTime> timestamps;
    private final double[] values;
    private final Map<String, double[]> regressors;

    public TimeSeriesWindow(String name, SamplingFrequency frequency, List<LocalDateTime> timestamps,
                            double[] values, Map<String, double[]> regressors) {
        if (frequency == null) {
            throw new MalformedSeriesException("Sampling frequency is required.");
        }
        if (timestamps == null || values == null) {
            throw new MalformedSeriesException("Timestamps and values are required.");
        }
        if (timestamps.stream().anyMatch(Objects::isNull)) {
            throw new MalformedSeriesException("Timestamps must not contain null.");
        }
        if (timestamps.size() != values.length) {
            throw new MalformedSeriesException("Series has " + timestamps.size() + " timestamps but "
                + values.length + " values.");
        }
        if (values.length == 0) {
            throw new MalformedSeriesException("Series must contain at least one observation.");
        }
        this.name = name == null || name.isBlank() ? "series" : name;
        this.frequency = frequency;
        this.timestamps = List.copyOf(timestamps);
        this.values = values.clone();
        this.regressors = copyRegressors(regressors, values.length);
        checkRegularSampling();
        checkValues();
    }

    /** Window derived from an already validated one; the arguments are used as given. */
    private TimeSeriesWindow(TimeSeriesWindow source, List<LocalDateTime> timestamps, double[] values,
                             Map<String, double[]> regressors) {
        this.name = source.name;
        this.frequency = source.frequency;
        this.timestamps = timestamps;
        this.values = values;
        this.regressors = regressors;
    }

    /**
     * Regular series starting at {@code start} with one value per sampling step.
     */
    public static TimeSeriesWindow of(String name, SamplingFrequency frequency, LocalDateTime start, double... values) {
        return of(name, frequency, start, values, Map.of());
    }

    public static TimeSeriesWindow of(String name, SamplingFrequency frequency, LocalDateTime start,
                                      double[] values, Map<String, double[]> regressors) {
        if (start == null || frequency == null) {
            throw new MalformedSeriesException("Start timestamp and sampling frequency are required.");
        }
        List<LocalDateTime> ts = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            ts.add(frequency.advance(start, i));
        }
        return new TimeSeriesWindow(name, frequency, ts, values, regressors);
    }

    public String getName() {
        return name;
    }

    public SamplingFrequency getFrequency() {
        return frequency;
    }

    public int size() {
        return values.length;
    }

    public List<LocalDateTime> timestamps() {
        return timestamps;
    }

    public LocalDateTime timestamp(int index) {
        return timestamps.get(index);
    }

    public LocalDateTime firstTimestamp() {
        return timestamps.get(0);
    }

    public LocalDateTime lastTimestamp() {
        return timestamps.get(timestamps.size() - 1);
    }

    public double value(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Values with gaps filled by linear interpolation between the nearest
     * observed neighbours; leading and trailing gaps take the nearest
     * observed value.
     */
    public double[] filledValues() {
        double[] filled = values.clone();
        int lastObserved = -1;
        for (int i = 0; i < filled.length; i++) {
            if (Double.isNaN(filled[i])) {
                continue;
            }
            if (lastObserved < 0) {
                Arrays.fill(filled, 0, i, filled[i]);
            } else if (i - lastObserved > 1) {
                double step = (filled[i] - filled[lastObserved]) / (i - lastObserved);
                for (int j = lastObserved + 1; j < i; j++) {
                    filled[j] = filled[lastObserved] + step * (j - lastObserved);
                }
            }
            lastObserved = i;
        }
        if (lastObserved >= 0 && lastObserved < filled.length - 1) {
            Arrays.fill(filled, lastObserved + 1, filled.length, filled[lastObserved]);
        }
        return filled;
    }

    /** Regressor names in ascending order. */
    public Set<String> regressorNames() {
        return Collections.unmodifiableSet(regressors.keySet());
    }

    public double[] regressor(String regressorName) {
        double[] series = regressors.get(regressorName);
        if (series == null) {
            throw new RangeException("Unknown regressor '" + regressorName + "' in series '" + name + "'.");
        }
        return series.clone();
    }

    /** Copy of every regressor sequence, keyed by name. */
    public Map<String, double[]> regressors() {
        Map<String, double[]> copy = new TreeMap<>();
        regressors.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }

    /**
     * The {@code horizon} timestamps following the last observation, counted
     * in whole sampling steps from the first one so month ends do not drift.
     */
    public List<LocalDateTime> futureTimestamps(int horizon) {
        List<LocalDateTime> future = new ArrayList<>(horizon);
        for (int i = 0; i < horizon; i++) {
            future.add(frequency.advance(firstTimestamp(), values.length + i));
        }
        return future;
    }

    /**
     * Sub-window of the observations whose timestamps fall in
     * {@code [start, end]} (both inclusive).
     *
     * @throws RangeException if no observation falls in the range
     */
    public TimeSeriesWindow slice(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || start.isAfter(end)) {
            throw new RangeException("Invalid slice range [" + start + ", " + end + "] for series '" + name + "'.");
        }
        int from = 0;
        while (from < timestamps.size() && timestamps.get(from).isBefore(start)) {
            from++;
        }
        int to = from;
        while (to < timestamps.size() && !timestamps.get(to).isAfter(end)) {
            to++;
        }
        if (to <= from) {
            throw new RangeException("Slice [" + start + ", " + end + "] contains no observation of series '"
                + name + "'.");
        }
        return range(from, to);
    }

    /**
     * Sub-window of the observations at positions {@code [fromIndex, toIndex)}.
     *
     * @throws RangeException if the range is out of bounds or empty
     */
    public TimeSeriesWindow range(int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex > values.length || fromIndex >= toIndex) {
            throw new RangeException("Index range [" + fromIndex + ", " + toIndex + ") is empty or outside a series of "
                + values.length + " observations.");
        }
        Map<String, double[]> sliced = new TreeMap<>();
        regressors.forEach((k, v) -> sliced.put(k, Arrays.copyOfRange(v, fromIndex, toIndex)));
        return new TimeSeriesWindow(this, timestamps.subList(fromIndex, toIndex),
            Arrays.copyOfRange(values, fromIndex, toIndex), Collections.unmodifiableMap(sliced));
    }

    /**
     * Splits into a training prefix and a test suffix of exactly
     * {@code testLength} observations.
     *
     * @throws InsufficientDataException if {@code testLength >= size()}
     */
    public Split splitTrainTest(int testLength) {
        if (testLength < 1) {
            throw new RangeException("Test length must be at least 1, was " + testLength + ".");
        }
        if (testLength >= values.length) {
            throw new InsufficientDataException(testLength, values.length);
        }
        int cut = values.length - testLength;
        return new Split(range(0, cut), range(cut, values.length));
    }

    /**
     * New window with every value mapped through {@code operator}; gaps stay gaps.
     */
    public TimeSeriesWindow mapValues(DoubleUnaryOperator operator) {
        double[] mapped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            mapped[i] = Double.isNaN(values[i]) ? Double.NaN : operator.applyAsDouble(values[i]);
        }
        return new TimeSeriesWindow(this, timestamps, mapped, regressors);
    }

    private void checkRegularSampling() {
        for (int i = 1; i < timestamps.size(); i++) {
            LocalDateTime previous = timestamps.get(i - 1);
            LocalDateTime current = timestamps.get(i);
            if (!current.isAfter(previous)) {
                throw new MalformedSeriesException("Timestamps of series '" + name
                    + "' are not strictly increasing at index " + i + ".");
            }
            LocalDateTime expected = frequency.advance(timestamps.get(0), i);
            if (!current.equals(expected)) {
                throw new MalformedSeriesException("Irregular sampling in series '" + name + "' at index " + i
                    + ": expected " + expected + " but found " + current
                    + ". Missing observations must be present as NaN values.");
            }
        }
    }

    private void checkValues() {
        boolean observed = false;
        for (int i = 0; i < values.length; i++) {
            if (Double.isInfinite(values[i])) {
                throw new MalformedSeriesException("Infinite value at index " + i + " of series '" + name + "'.");
            }
            observed |= !Double.isNaN(values[i]);
        }
        if (!observed) {
            throw new MalformedSeriesException("Series '" + name + "' has no observed value.");
        }
    }

    private static Map<String, double[]> copyRegressors(Map<String, double[]> source, int length) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, double[]> copy = new TreeMap<>();
        for (Map.Entry<String, double[]> entry : source.entrySet()) {
            String key = entry.getKey();
            double[] series = entry.getValue();
            if (key == null || key.isBlank()) {
                throw new MalformedSeriesException("Regressor names must not be blank.");
            }
            if (series == null || series.length != length) {
                throw new MalformedSeriesException("Regressor '" + key + "' has "
                    + (series == null ? 0 : series.length) + " values, expected " + length + ".");
            }
            for (double v : series) {
                if (!Double.isFinite(v)) {
                    throw new MalformedSeriesException("Regressor '" + key + "' contains a non-finite value.");
                }
            }
            copy.put(key, series.clone());
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "TimeSeriesWindow[" + name + ", " + frequency + ", " + values.length + " obs, "
            + firstTimestamp() + " .. " + lastTimestamp() + "]";
    }

    public record Split(TimeSeriesWindow train, TimeSeriesWindow test) {}
}
