package com.timexforecast.exception;

import java.time.Duration;

public class CandidateTimeoutException extends TimexForecastException {
    public CandidateTimeoutException(String candidate, Duration timeout) {
        super("CANDIDATE_TIMEOUT",
              "Model " + candidate + " did not finish within " + timeout.toMillis() + " ms.");
    }
}
