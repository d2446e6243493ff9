package com.fluforecast.model;

import com.fluforecast.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.List;

/**
 * Weekly observations in chronological order. Position encodes the week; the
 * series carries no timestamps of its own.
 */
public final class TimeSeries {

    private final double[] values;

    private TimeSeries(double[] values) {
        this.values = values;
    }

    public static TimeSeries of(double... values) {
        if (values == null) {
            throw new InvalidArgumentException("series values must not be null");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidArgumentException("series value at position " + i + " is not finite: " + values[i]);
            }
        }
        return new TimeSeries(values.clone());
    }

    public static TimeSeries of(List<Double> values) {
        if (values == null) {
            throw new InvalidArgumentException("series values must not be null");
        }
        double[] raw = new double[values.size()];
        for (int i = 0; i < raw.length; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new InvalidArgumentException("series value at position " + i + " is null");
            }
            raw[i] = v;
        }
        return of(raw);
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int index) {
        return values[index];
    }

    /** Values in {@code [from, to)}, order preserved. */
    public TimeSeries slice(int from, int to) {
        return new TimeSeries(Arrays.copyOfRange(values, from, to));
    }

    public TimeSeries head(int count) {
        return slice(0, Math.min(count, values.length));
    }

    public TimeSeries tail(int count) {
        return slice(Math.max(0, values.length - count), values.length);
    }

    public TimeSeries concat(TimeSeries other) {
        double[] joined = Arrays.copyOf(values, values.length + other.values.length);
        System.arraycopy(other.values, 0, joined, values.length, other.values.length);
        return new TimeSeries(joined);
    }

    public double[] toArray() {
        return values.clone();
    }

    public List<Double> toList() {
        return Arrays.stream(values).boxed().toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimeSeries" + Arrays.toString(values);
    }
}
