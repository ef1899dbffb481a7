package com.timexforecast.exception;

import lombok.Getter;

@Getter
public abstract class TimexForecastException extends RuntimeException {
    private final String errorCode;
    protected TimexForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected TimexForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
