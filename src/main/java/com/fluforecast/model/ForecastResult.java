package com.fluforecast.model;

import java.util.Arrays;
import java.util.List;

/**
 * Predicted values for the weeks following the fitted series. ILI% cannot be negative,
 * so every value is floored at zero on construction.
 */
public record ForecastResult(List<Double> values) {

    public ForecastResult {
        values = values.stream().map(v -> Math.max(0.0, v)).toList();
    }

    public static ForecastResult of(double[] raw) {
        return new ForecastResult(Arrays.stream(raw).boxed().toList());
    }

    public int size() {
        return values.size();
    }

    public double get(int index) {
        return values.get(index);
    }

    public double[] toArray() {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
