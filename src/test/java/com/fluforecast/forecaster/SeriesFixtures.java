package com.fluforecast.forecaster;

import com.fluforecast.model.TimeSeries;

public final class SeriesFixtures {

    private SeriesFixtures() {
    }

    /** Yearly ILI-like wave: 2.5 +/- 1.5 with a 52-week period. */
    public static TimeSeries seasonal(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 2.5 + 1.5 * Math.sin(2 * Math.PI * i / 52.0);
        }
        return TimeSeries.of(values);
    }

    public static TimeSeries ramp(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = 1.0 + i * 0.1;
        }
        return TimeSeries.of(values);
    }
}
