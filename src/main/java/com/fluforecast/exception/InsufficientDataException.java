package com.fluforecast.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends FluForecastException {
    private final int required;
    private final int actual;

    public InsufficientDataException(String message, int required, int actual) {
        super("INSUFFICIENT_DATA", message + " (need at least " + required + " points, got " + actual + ")");
        this.required = required;
        this.actual = actual;
    }
}
