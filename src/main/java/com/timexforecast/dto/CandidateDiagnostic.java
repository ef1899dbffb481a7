package com.timexforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.timexforecast.model.ModelVariant;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateDiagnostic {
    ModelVariant model;
    CandidateStatus status;
    String errorCode;
    String failureReason;
    CrossValidationResult crossValidation;
    List<FoldSkippedWarning> skippedFolds;
    Double ensembleWeight;
}
