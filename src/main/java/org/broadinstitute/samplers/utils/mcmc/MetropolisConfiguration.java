package org.broadinstitute.samplers.utils.mcmc;

import org.broadinstitute.samplers.exceptions.ConfigurationException;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Immutable configuration of a {@link MetropolisSampler} run.  Built with {@link MetropolisConfiguration.Builder}:
 *
 *  MetropolisConfiguration configuration =
 *      new MetropolisConfiguration.Builder(density)
 *                                 .chainLength(10000)
 *                                 .space(0., 1.)
 *                                 .burnIn(1000)
 *                                 .seed(42L)
 *                                 .build()
 *
 * A configuration can be derived from another one by keyword with {@link #withUpdates(Map)}, which leaves the
 * original untouched.  Configurations are validated when built; invalid values throw a {@link ConfigurationException}.
 */
public final class MetropolisConfiguration {
    public static final int DEFAULT_CHAIN_LENGTH = 5000;
    public static final double DEFAULT_THETA_INIT = 0.5;
    public static final int DEFAULT_BURN_IN = 0;

    //keywords accepted by withUpdates
    public static final String DENSITY_KEY = "density";
    public static final String CHAIN_LENGTH_KEY = "chain";
    public static final String THETA_INIT_KEY = "theta_init";
    public static final String JUMP_DISTRIBUTION_KEY = "jumpdist";
    public static final String SPACE_KEY = "space";
    public static final String BURN_IN_KEY = "burnin";
    public static final String SEED_KEY = "seed";

    private final Function<Double, Double> density;
    private final int chainLength;
    private final double thetaInit;
    private final JumpDistribution jumpDistribution;
    private final double spaceMin;
    private final double spaceMax;
    private final int burnIn;
    private final Long seed;

    public static final class Builder {
        private Function<Double, Double> density;
        private int chainLength = DEFAULT_CHAIN_LENGTH;
        private double thetaInit = DEFAULT_THETA_INIT;
        private JumpDistribution jumpDistribution = JumpDistribution.DEFAULT;
        private double spaceMin = Double.NEGATIVE_INFINITY;
        private double spaceMax = Double.POSITIVE_INFINITY;
        private int burnIn = DEFAULT_BURN_IN;
        private Long seed = null;

        /**
         * @param density   unnormalized density of the target distribution; must return finite, non-negative values
         */
        public Builder(final Function<Double, Double> density) {
            this.density = density;
        }

        private Builder(final MetropolisConfiguration configuration) {
            density = configuration.density;
            chainLength = configuration.chainLength;
            thetaInit = configuration.thetaInit;
            jumpDistribution = configuration.jumpDistribution;
            spaceMin = configuration.spaceMin;
            spaceMax = configuration.spaceMax;
            burnIn = configuration.burnIn;
            seed = configuration.seed;
        }

        public Builder density(final Function<Double, Double> density) {
            this.density = density;
            return this;
        }

        /**
         * Number of states in the chain, counting the initial state and any burn-in.
         */
        public Builder chainLength(final int chainLength) {
            this.chainLength = chainLength;
            return this;
        }

        public Builder thetaInit(final double thetaInit) {
            this.thetaInit = thetaInit;
            return this;
        }

        public Builder jumpDistribution(final JumpDistribution jumpDistribution) {
            this.jumpDistribution = jumpDistribution;
            return this;
        }

        /**
         * Closed interval [spaceMin, spaceMax] of allowed values; proposals outside it are rejected.
         */
        public Builder space(final double spaceMin, final double spaceMax) {
            this.spaceMin = spaceMin;
            this.spaceMax = spaceMax;
            return this;
        }

        /**
         * Number of states dropped from the beginning of the returned chain.
         */
        public Builder burnIn(final int burnIn) {
            this.burnIn = burnIn;
            return this;
        }

        /**
         * @param seed  seed of the chain's {@link RandomSource}; {@code null} for non-reproducible chains
         */
        public Builder seed(final Long seed) {
            this.seed = seed;
            return this;
        }

        public MetropolisConfiguration build() {
            return new MetropolisConfiguration(this);
        }
    }

    private MetropolisConfiguration(final Builder builder) {
        density = builder.density;
        chainLength = builder.chainLength;
        thetaInit = builder.thetaInit;
        jumpDistribution = builder.jumpDistribution;
        spaceMin = builder.spaceMin;
        spaceMax = builder.spaceMax;
        burnIn = builder.burnIn;
        seed = builder.seed;
        validate();
    }

    private void validate() {
        if (density == null) {
            throw new ConfigurationException.BadValue(DENSITY_KEY,
                    "Density must be a function. Recreate the configuration with a valid density function.");
        }
        if (chainLength < 1) {
            throw new ConfigurationException.BadValue(CHAIN_LENGTH_KEY, chainLength, "Chain length must be positive.");
        }
        if (burnIn < 0) {
            throw new ConfigurationException.BadValue(BURN_IN_KEY, burnIn, "Number of burn-in samples must be non-negative.");
        }
        if (burnIn >= chainLength) {
            throw new ConfigurationException.BadValue(BURN_IN_KEY, burnIn,
                    String.format("Number of burn-in samples must be less than the chain length (%d).", chainLength));
        }
        if (Double.isNaN(thetaInit)) {
            throw new ConfigurationException.BadValue(THETA_INIT_KEY, thetaInit, "Initial value must be a number.");
        }
        if (jumpDistribution == null) {
            throw new ConfigurationException.BadValue(JUMP_DISTRIBUTION_KEY, "Jump distribution cannot be null.");
        }
        if (Double.isNaN(spaceMin) || Double.isNaN(spaceMax) || spaceMin > spaceMax) {
            throw new ConfigurationException.BadValue(SPACE_KEY, String.format("[%s, %s]", spaceMin, spaceMax),
                    "Minimum of the space must be less than or equal to its maximum.");
        }
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Returns a new configuration equal to this one except for the values given by keyword in {@code updates}.
     * Recognized keywords are {@value #DENSITY_KEY}, {@value #CHAIN_LENGTH_KEY}, {@value #THETA_INIT_KEY},
     * {@value #JUMP_DISTRIBUTION_KEY}, {@value #SPACE_KEY} (a two-element {@code double[]} or {@code List<Number>}),
     * {@value #BURN_IN_KEY} and {@value #SEED_KEY} (a {@code Number} or {@code null}).
     * @throws ConfigurationException.UnsupportedKey    if a keyword is not recognized
     * @throws ConfigurationException.BadValue          if a value has the wrong type or is invalid
     */
    @SuppressWarnings("unchecked")
    public MetropolisConfiguration withUpdates(final Map<String, ?> updates) {
        if (updates == null) {
            return this;
        }
        final Builder builder = toBuilder();
        for (final Map.Entry<String, ?> update : updates.entrySet()) {
            final String key = update.getKey();
            final Object value = update.getValue();
            if (DENSITY_KEY.equals(key)) {
                if (!(value instanceof Function)) {
                    throw new ConfigurationException.BadValue(DENSITY_KEY, value,
                            "Density must be a function. Recreate the configuration with a valid density function.");
                }
                builder.density((Function<Double, Double>) value);
            } else if (CHAIN_LENGTH_KEY.equals(key)) {
                builder.chainLength(toInt(key, value));
            } else if (THETA_INIT_KEY.equals(key)) {
                builder.thetaInit(toNumber(key, value).doubleValue());
            } else if (JUMP_DISTRIBUTION_KEY.equals(key)) {
                if (!(value instanceof JumpDistribution)) {
                    throw new ConfigurationException.BadValue(key, value, "Expected a JumpDistribution.");
                }
                builder.jumpDistribution((JumpDistribution) value);
            } else if (SPACE_KEY.equals(key)) {
                final double[] space = toSpace(value);
                builder.space(space[0], space[1]);
            } else if (BURN_IN_KEY.equals(key)) {
                builder.burnIn(toInt(key, value));
            } else if (SEED_KEY.equals(key)) {
                builder.seed(value == null ? null : toNumber(key, value).longValue());
            } else {
                throw new ConfigurationException.UnsupportedKey(key);
            }
        }
        return builder.build();
    }

    private static Number toNumber(final String key, final Object value) {
        if (!(value instanceof Number)) {
            throw new ConfigurationException.BadValue(key, value, "Expected a number.");
        }
        return (Number) value;
    }

    private static int toInt(final String key, final Object value) {
        final Number number = toNumber(key, value);
        if (number.doubleValue() != Math.rint(number.doubleValue()) || Math.abs(number.doubleValue()) > Integer.MAX_VALUE) {
            throw new ConfigurationException.BadValue(key, value, "Expected an integer.");
        }
        return number.intValue();
    }

    private static double[] toSpace(final Object value) {
        if (value instanceof double[] && ((double[]) value).length == 2) {
            return ((double[]) value).clone();
        }
        if (value instanceof List && ((List<?>) value).size() == 2) {
            final List<?> bounds = (List<?>) value;
            return new double[]{toNumber(SPACE_KEY, bounds.get(0)).doubleValue(), toNumber(SPACE_KEY, bounds.get(1)).doubleValue()};
        }
        throw new ConfigurationException.BadValue(SPACE_KEY, value, "Expected a pair [min, max].");
    }

    public Function<Double, Double> density() {
        return density;
    }

    public int chainLength() {
        return chainLength;
    }

    public double thetaInit() {
        return thetaInit;
    }

    public JumpDistribution jumpDistribution() {
        return jumpDistribution;
    }

    public double spaceMin() {
        return spaceMin;
    }

    public double spaceMax() {
        return spaceMax;
    }

    public int burnIn() {
        return burnIn;
    }

    public Long seed() {
        return seed;
    }

    public boolean isInSpace(final double theta) {
        return spaceMin <= theta && theta <= spaceMax;
    }

    @Override
    public String toString() {
        return String.format("MetropolisConfiguration{chain=%d, theta_init=%s, jumpdist=%s, space=[%s, %s], burnin=%d, seed=%s}",
                chainLength, thetaInit, jumpDistribution, spaceMin, spaceMax, burnIn, seed);
    }
}
