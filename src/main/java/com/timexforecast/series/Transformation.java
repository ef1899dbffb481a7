package com.timexforecast.series;

/**
 * Value transformation applied before fitting and inverted on forecasts.
 * Both logarithmic variants keep the sign, so negative series are allowed.
 */
public enum Transformation {
    NONE {
        @Override
        public double apply(double value) {
            return value;
        }

        @Override
        public double inverse(double value) {
            return value;
        }
    },
    /** sign(x)·ln|x|, with 0 mapped to 0. Values in (-1, 1) are not recoverable. */
    LOG {
        @Override
        public double apply(double value) {
            if (value == 0.0d || Double.isNaN(value)) {
                return value;
            }
            return Math.signum(value) * Math.log(Math.abs(value));
        }

        @Override
        public double inverse(double value) {
            if (value == 0.0d || Double.isNaN(value)) {
                return value;
            }
            return Math.signum(value) * Math.exp(Math.abs(value));
        }
    },
    /** sign(x)·ln(|x|+1); exactly invertible. */
    LOG_MODIFIED {
        @Override
        public double apply(double value) {
            if (Double.isNaN(value)) {
                return value;
            }
            return Math.signum(value) * Math.log1p(Math.abs(value));
        }

        @Override
        public double inverse(double value) {
            if (Double.isNaN(value)) {
                return value;
            }
            return Math.signum(value) * Math.expm1(Math.abs(value));
        }
    };

    public abstract double apply(double value);

    public abstract double inverse(double value);
}
