package com.timexforecast.exception;

public class InsufficientDataException extends TimexForecastException {
    public InsufficientDataException(int requested, int available) {
        super("INSUFFICIENT_DATA",
              "Test length " + requested + " leaves no training data in a window of " + available + " observations.");
    }
}
