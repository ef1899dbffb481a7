package com.timexforecast.exception;

public class PredictionException extends TimexForecastException {
    public PredictionException(String message) {
        super("PREDICTION_FAILED", message);
    }
}
