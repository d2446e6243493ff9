package com.fluforecast.exception;

import lombok.Getter;

@Getter
public abstract class FluForecastException extends RuntimeException {
    private final String errorCode;
    protected FluForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected FluForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
