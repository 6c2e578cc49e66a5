package org.broadinstitute.samplers.utils;

import java.util.Arrays;

/**
 * Argument-checking helpers shared by the samplers.
 */
public final class Utils {
    private Utils() {}

    /**
     * Checks that an Object {@code object} is not null and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object) {
        return nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * Checks that a user provided argument is in legal range.
     */
    public static void validateArg(final boolean condition, final String msg) {
        if (!condition) {
            throw new IllegalArgumentException(msg);
        }
    }

    /**
     * Checks that two vectors share the same dimension.
     */
    public static void validateSameDimension(final double[] a, final double[] b, final String msg) {
        nonNull(a);
        nonNull(b);
        validateArg(a.length == b.length, msg);
    }

    /**
     * Returns a copy of {@code values} that the caller is free to modify.
     */
    public static double[] copy(final double[] values) {
        return Arrays.copyOf(nonNull(values), values.length);
    }
}
