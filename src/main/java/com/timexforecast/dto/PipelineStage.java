package com.timexforecast.dto;

public enum PipelineStage {
    INIT,
    VALIDATING,
    SELECTING,
    RETRAINING,
    FORECASTING,
    DONE,
    FAILED
}
