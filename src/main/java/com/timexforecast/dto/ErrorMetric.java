package com.timexforecast.dto;

/**
 * Forecast error measures reported per fold and averaged over folds.
 * Only the first four can rank candidates.
 */
public enum ErrorMetric {
    MAE(true),
    MSE(true),
    RMSE(true),
    /** Mean absolute percentage error, in percent, over non-zero actuals. */
    MAPE(true),
    /** Mean signed error (forecast minus actual). */
    AM(false),
    /** Standard deviation of the signed errors. */
    SD(false);

    private final boolean rankable;

    ErrorMetric(boolean rankable) {
        this.rankable = rankable;
    }

    public boolean isRankable() {
        return rankable;
    }
}
