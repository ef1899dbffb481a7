package com.timexforecast.exception;

import com.timexforecast.dto.FoldSkippedWarning;
import lombok.Getter;

import java.util.List;

/**
 * Raised when every fold of a walk-forward validation was skipped, so the
 * candidate has no metric at all.
 */
@Getter
public class CrossValidationException extends TimexForecastException {

    private final transient List<FoldSkippedWarning> skippedFolds;

    public CrossValidationException(String modelName, List<FoldSkippedWarning> skippedFolds) {
        super("VALIDATION_FAILED",
              "All " + skippedFolds.size() + " folds were skipped for model " + modelName
                  + ": not enough history before the earliest fold.");
        this.skippedFolds = List.copyOf(skippedFolds);
    }
}
