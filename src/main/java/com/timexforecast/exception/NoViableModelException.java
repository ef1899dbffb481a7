package com.timexforecast.exception;

import com.timexforecast.dto.CandidateDiagnostic;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pipeline-level failure: no candidate survived validation, selection or
 * retraining. Carries the diagnostic of every candidate so the caller can
 * tell which ones failed and why.
 */
@Getter
public class NoViableModelException extends TimexForecastException {

    private final transient List<CandidateDiagnostic> diagnostics;

    public NoViableModelException(String seriesName, List<CandidateDiagnostic> diagnostics) {
        super("NO_VIABLE_MODEL", "No viable model for series '" + seriesName + "': " + summarize(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    private static String summarize(List<CandidateDiagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "no candidates were evaluated.";
        }
        return diagnostics.stream()
            .map(d -> d.getModel() + " [" + d.getErrorCode() + "] " + d.getFailureReason())
            .collect(Collectors.joining("; "));
    }
}
