package com.timexforecast.service;

import com.timexforecast.exception.PredictionException;
import com.timexforecast.model.ForecastInterval;
import com.timexforecast.model.ModelVariant;

import java.util.List;

final class ForecastChecks {

    private ForecastChecks() {
    }

    /**
     * Rejects a forecast of the wrong length or with a NaN or infinite point or bound.
     */
    static List<ForecastInterval> requireUsable(ModelVariant variant, List<ForecastInterval> forecast, int horizon) {
        if (forecast == null || forecast.size() != horizon) {
            throw new PredictionException(variant + " returned " + (forecast == null ? 0 : forecast.size())
                + " steps for a horizon of " + horizon);
        }
        for (int k = 0; k < forecast.size(); k++) {
            ForecastInterval step = forecast.get(k);
            if (step == null || !step.isFinite()) {
                throw new PredictionException(variant + " returned a non-finite forecast at step " + (k + 1)
                    + ": " + step);
            }
        }
        return forecast;
    }
}
