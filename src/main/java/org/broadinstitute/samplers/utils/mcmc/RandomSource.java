package org.broadinstitute.samplers.utils.mcmc;

import org.apache.commons.math3.distribution.MultivariateNormalDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.broadinstitute.samplers.utils.Utils;
import org.broadinstitute.samplers.utils.param.ParamUtils;

import java.util.Random;

/**
 * Source of the random variates consumed by the samplers.  Wraps a {@link RandomGenerator} seeded from an explicit
 * seed, so that two instances built from the same seed produce identical draws for identical call sequences.
 * A {@code null} seed gives a generator seeded from system entropy, whose draws are not reproducible.
 * <p>
 *     Instances are not thread-safe; each chain (or each HMC transition) should own its source.
 * </p>
 */
public final class RandomSource {
    //fractional part of the golden ratio, used as the Weyl increment between substreams
    private static final long GOLDEN_RATIO_64 = 0x9e3779b97f4a7c15L;

    private final Long seed;
    private final RandomGenerator rng;

    public RandomSource(final Long seed) {
        this.seed = seed;
        rng = RandomGeneratorFactory.createRandomGenerator(seed == null ? new Random() : new Random(seed));
    }

    /**
     * Derives the {@code index}-th substream of {@code seed}.  Substreams with different indices are seeded with
     * well-mixed, distinct seeds, so their draws are effectively independent, while remaining deterministic
     * in {@code seed}.  A {@code null} seed gives a non-reproducible source.
     */
    public static RandomSource substream(final Long seed, final int index) {
        return new RandomSource(substreamSeed(seed, index));
    }

    /**
     * Returns the seed of the {@code index}-th substream of {@code seed}, or {@code null} if {@code seed} is null.
     */
    public static Long substreamSeed(final Long seed, final int index) {
        ParamUtils.isPositiveOrZero(index, "Substream index must be non-negative.");
        if (seed == null) {
            return null;
        }
        return mixStafford13(seed + GOLDEN_RATIO_64 * (index + 1));
    }

    /**
     * Stafford variant 13 of the 64-bit MurmurHash3 finalizer.
     */
    static long mixStafford13(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }

    /**
     * @return the seed this source was built from, or {@code null} if it was seeded from system entropy
     */
    public Long seed() {
        return seed;
    }

    /**
     * The wrapped generator, for drawing from Commons Math distributions.  Draws made through it advance this source.
     */
    public RandomGenerator generator() {
        return rng;
    }

    /**
     * @return a uniform variate in [0, 1)
     */
    public double nextUniform() {
        return rng.nextDouble();
    }

    public double nextNormal() {
        return rng.nextGaussian();
    }

    public double nextNormal(final double mean, final double standardDeviation) {
        ParamUtils.isPositive(standardDeviation, "Standard deviation must be positive.");
        return mean + standardDeviation * rng.nextGaussian();
    }

    /**
     * Draws a vector from the multivariate normal distribution with the given mean and covariance.
     */
    public double[] nextMultivariateNormal(final double[] mean, final double[][] covariance) {
        Utils.nonNull(mean, "Mean cannot be null.");
        Utils.nonNull(covariance, "Covariance cannot be null.");
        Utils.validateArg(mean.length > 0, "Dimension must be positive.");
        Utils.validateArg(covariance.length == mean.length, "Covariance and mean must have the same dimension.");
        for (final double[] row : covariance) {
            Utils.validateArg(row.length == mean.length, "Covariance must be a square matrix.");
        }
        return new MultivariateNormalDistribution(rng, mean, covariance).sample();
    }

    /**
     * Draws a vector from MVN(0, I_d) as {@code numDimensions} independent standard normal variates.
     */
    public double[] nextStandardMultivariateNormal(final int numDimensions) {
        ParamUtils.isPositive(numDimensions, "Dimension must be positive.");
        final double[] draw = new double[numDimensions];
        for (int i = 0; i < numDimensions; i++) {
            draw[i] = rng.nextGaussian();
        }
        return draw;
    }
}
