package com.timexforecast.exception;

public class MalformedSeriesException extends TimexForecastException {
    public MalformedSeriesException(String message) {
        super("MALFORMED_INPUT", message);
    }
}
