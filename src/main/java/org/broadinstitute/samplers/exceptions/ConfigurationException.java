package org.broadinstitute.samplers.exceptions;

/**
 * Thrown when a sampler is configured in a way it cannot run with.  Raised before any chain iteration
 * begins (or, for {@link BadDensity}, as soon as the density is seen to break its contract).
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public ConfigurationException(final String msg) {
        super(msg);
    }

    /**
     * A keyword update named a configuration field that does not exist.
     */
    public static class UnsupportedKey extends ConfigurationException {
        private static final long serialVersionUID = 0L;

        public UnsupportedKey(final String key) {
            super(String.format("Keyword argument \"%s\" not supported.", key));
        }
    }

    public static class BadValue extends ConfigurationException {
        private static final long serialVersionUID = 0L;

        public BadValue(final String name, final Object value, final String message) {
            super(String.format("Invalid value %s for %s. %s", value, name, message));
        }

        public BadValue(final String name, final String message) {
            super(String.format("Invalid value for %s. %s", name, message));
        }
    }

    /**
     * The density function returned something other than a finite, non-negative real number.
     */
    public static class BadDensity extends ConfigurationException {
        private static final long serialVersionUID = 0L;

        public BadDensity(final double theta, final Double density) {
            super(String.format("Density must be a finite, non-negative real number, but evaluated to %s at %s.", density, theta));
        }
    }
}
