package com.fluforecast.forecaster;

import com.fluforecast.model.TimeSeries;

public record SeriesSplit(TimeSeries train, TimeSeries test) {
}
