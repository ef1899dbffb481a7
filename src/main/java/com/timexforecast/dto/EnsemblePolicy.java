package com.timexforecast.dto;

public enum EnsemblePolicy {
    BEST_OF,
    WEIGHTED
}
