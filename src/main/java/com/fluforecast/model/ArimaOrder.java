package com.fluforecast.model;

import com.fluforecast.exception.InvalidArgumentException;

import java.util.List;

/**
 * ARIMA hyperparameters: {@code p} autoregressive lags, {@code d} differencing passes,
 * {@code q} moving-average error lags.
 */
public record ArimaOrder(int p, int d, int q) {

    public static final ArimaOrder DEFAULT = new ArimaOrder(2, 1, 2);

    public ArimaOrder {
        if (p < 0 || d < 0 || q < 0) {
            throw new InvalidArgumentException(
                "ARIMA order components must be >= 0, got (" + p + "," + d + "," + q + ")");
        }
    }

    public static ArimaOrder of(List<Integer> triple) {
        if (triple == null || triple.size() != 3 || triple.contains(null)) {
            throw new InvalidArgumentException("ARIMA order must be a triple [p, d, q]");
        }
        return new ArimaOrder(triple.get(0), triple.get(1), triple.get(2));
    }

    @Override
    public String toString() {
        return "(" + p + "," + d + "," + q + ")";
    }
}
