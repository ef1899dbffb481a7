package com.timexforecast.exception;

public class UnexpectedModelException extends TimexForecastException {
    public UnexpectedModelException(String message, Throwable cause) {
        super("MODEL_ERROR", message, cause);
    }
}
