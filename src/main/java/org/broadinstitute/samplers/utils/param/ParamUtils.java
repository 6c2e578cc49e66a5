package org.broadinstitute.samplers.utils.param;

/**
 * Numeric parameter checks that throw {@link IllegalArgumentException} with the supplied message.
 */
public final class ParamUtils {
    private ParamUtils() {}

    /**
     * Validates the value of a parameter.
     * @param val value to check
     * @param msg message for the exception
     * @return the validated value
     */
    public static double isPositive(final double val, final String msg) {
        if (!(val > 0)) {
            throw new IllegalArgumentException(msg);
        }
        return val;
    }

    public static int isPositive(final int val, final String msg) {
        if (val <= 0) {
            throw new IllegalArgumentException(msg);
        }
        return val;
    }

    public static double isPositiveOrZero(final double val, final String msg) {
        if (!(val >= 0)) {
            throw new IllegalArgumentException(msg);
        }
        return val;
    }

    public static int isPositiveOrZero(final int val, final String msg) {
        if (val < 0) {
            throw new IllegalArgumentException(msg);
        }
        return val;
    }

    public static double isFinite(final double val, final String msg) {
        if (Double.isNaN(val) || Double.isInfinite(val)) {
            throw new IllegalArgumentException(msg);
        }
        return val;
    }
}
