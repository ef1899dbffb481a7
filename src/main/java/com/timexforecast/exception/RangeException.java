package com.timexforecast.exception;

public class RangeException extends TimexForecastException {
    public RangeException(String message) {
        super("RANGE_ERROR", message);
    }
}
