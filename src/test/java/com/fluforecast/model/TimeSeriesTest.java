package com.fluforecast.model;

import com.fluforecast.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class TimeSeriesTest {

    @Test
    void of_rejectsNonFiniteValues() {
        assertThatThrownBy(() -> TimeSeries.of(1.0, Double.NaN))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> TimeSeries.of(Double.POSITIVE_INFINITY))
            .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void of_rejectsNullElements() {
        assertThatThrownBy(() -> TimeSeries.of(Arrays.asList(1.0, null)))
            .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void tail_longerThanSeries_returnsWholeSeries() {
        TimeSeries series = TimeSeries.of(1.0, 2.0);
        assertThat(series.tail(5)).isEqualTo(series);
    }

    @Test
    void forecastResult_floorsNegativesAtZero() {
        assertThat(ForecastResult.of(new double[] {-0.3, 1.2}).values()).containsExactly(0.0, 1.2);
    }
}
