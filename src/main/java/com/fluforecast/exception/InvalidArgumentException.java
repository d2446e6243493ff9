package com.fluforecast.exception;

public class InvalidArgumentException extends FluForecastException {
    public InvalidArgumentException(String message) {
        super("INVALID_ARGUMENT", message);
    }
}
