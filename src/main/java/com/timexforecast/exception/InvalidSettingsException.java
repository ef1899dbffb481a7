package com.timexforecast.exception;

public class InvalidSettingsException extends TimexForecastException {
    public InvalidSettingsException(String message) {
        super("INVALID_SETTINGS", message);
    }
}
