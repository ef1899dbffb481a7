package com.timexforecast.model;

import com.timexforecast.exception.PredictionException;
import com.timexforecast.exception.TrainingException;
import com.timexforecast.series.TimeSeriesWindow;

final class ModelSupport {

    private ModelSupport() {
    }

    static void checkTrainingLength(ModelVariant variant, TimeSeriesWindow training, int required) {
        if (training == null) {
            throw new TrainingException(variant + " cannot be fitted on a null window");
        }
        if (training.size() < required) {
            throw new TrainingException(variant + " needs at least " + required
                + " observations to train, got " + training.size());
        }
    }

    static void checkPredictable(ModelVariant variant, boolean fitted, int horizon, int maxHorizon) {
        if (!fitted) {
            throw new PredictionException(variant + " must be fitted before predicting");
        }
        if (horizon < 1) {
            throw new PredictionException("Horizon must be >= 1, got " + horizon);
        }
        if (horizon > maxHorizon) {
            throw new PredictionException(variant + " supports a horizon of at most " + maxHorizon
                + ", got " + horizon);
        }
    }

    static boolean allFinite(double... values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
