package com.fluforecast.exception;

public class FittingException extends FluForecastException {
    public FittingException(String message) {
        super("FITTING_FAILED", message);
    }
    public FittingException(String message, Throwable cause) {
        super("FITTING_FAILED", message, cause);
    }
}
