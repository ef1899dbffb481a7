package com.timexforecast.dto;

public enum CandidateStatus {
    /** Validated; eligible for selection. */
    VIABLE,
    /** Selected and used for the final forecast. */
    SELECTED,
    /** Validated but dropped while retraining or forecasting on the full window. */
    DROPPED,
    FAILED,
    TIMED_OUT
}
