package com.timexforecast.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Non-fatal diagnostic: a validation fold was skipped because the history
 * before it was shorter than the model's minimum training length.
 */
@Value
@Builder
public class FoldSkippedWarning {
    int foldIndex;
    int trainingLength;
    int requiredLength;
    String message;
}
