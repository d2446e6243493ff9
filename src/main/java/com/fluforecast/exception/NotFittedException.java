package com.fluforecast.exception;

public class NotFittedException extends FluForecastException {
    public NotFittedException() {
        super("MODEL_NOT_FITTED",
              "Model not fitted. Call fitArima() or fitMovingAverage() first.");
    }
}
