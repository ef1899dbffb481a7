package com.timexforecast.exception;

public class TrainingException extends TimexForecastException {
    public TrainingException(String message) {
        super("TRAINING_FAILED", message);
    }
    public TrainingException(String message, Throwable cause) {
        super("TRAINING_FAILED", message, cause);
    }
}
