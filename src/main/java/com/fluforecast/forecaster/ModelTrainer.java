package com.fluforecast.forecaster;

import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.exception.NotFittedException;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.ModelState;
import com.fluforecast.model.ModelType;
import com.fluforecast.model.TimeSeries;

/**
 * One forecasting strategy: fit on a training series, then extend the fitted state forward.
 *
 * @param <S> state produced by {@link #fit} and consumed by {@link #forecast}
 */
public interface ModelTrainer<S extends ModelState> {

    ModelType type();

    S fit(TimeSeries train);

    ForecastResult forecast(S state, int steps);

    static void checkForecastRequest(ModelState state, int steps) {
        if (state == null) {
            throw new NotFittedException();
        }
        if (steps < 1) {
            throw new InvalidArgumentException("Steps must be at least 1, got " + steps);
        }
    }
}
