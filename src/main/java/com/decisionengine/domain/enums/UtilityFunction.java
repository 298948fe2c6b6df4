package com.decisionengine.domain.enums;

/**
 * Risk-attitude transforms applied to terminal payoffs during rollback.
 *
 * <p>With risk tolerance {@code rho}:
 * <ul>
 *   <li>NONE: {@code U(x) = x} (risk neutral)</li>
 *   <li>EXP: {@code U(x) = 1 - e^(-x/rho)}, inverse {@code -rho * ln(1 - min(u, 0.9999))}</li>
 *   <li>LOG: {@code U(x) = ln(x + rho)}, inverse {@code e^u - rho}</li>
 * </ul>
 *
 * <p>The exponential inverse caps the utility just below 1 so the logarithm stays finite.
 */
public enum UtilityFunction {
    NONE {
        @Override
        public double apply(double value, double riskTolerance) {
            return value;
        }

        @Override
        public double inverse(double utility, double riskTolerance) {
            return utility;
        }
    },
    EXP {
        @Override
        public double apply(double value, double riskTolerance) {
            return 1.0 - Math.exp(-value / riskTolerance);
        }

        @Override
        public double inverse(double utility, double riskTolerance) {
            return -riskTolerance * Math.log(1.0 - Math.min(utility, MAX_EXP_UTILITY));
        }
    },
    LOG {
        @Override
        public double apply(double value, double riskTolerance) {
            return Math.log(value + riskTolerance);
        }

        @Override
        public double inverse(double utility, double riskTolerance) {
            return Math.exp(utility) - riskTolerance;
        }
    };

    /** Upper bound on exponential utility before inversion (1 - epsilon). */
    public static final double MAX_EXP_UTILITY = 1.0 - 1e-4;

    public abstract double apply(double value, double riskTolerance);

    public abstract double inverse(double utility, double riskTolerance);

    public boolean isActive() {
        return this != NONE;
    }
}
