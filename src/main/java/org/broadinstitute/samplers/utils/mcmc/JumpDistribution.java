package org.broadinstitute.samplers.utils.mcmc;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.distribution.UniformRealDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.broadinstitute.samplers.utils.Utils;
import org.broadinstitute.samplers.utils.param.ParamUtils;

import java.util.function.Function;

/**
 * Distribution of the jump Δθ proposed by {@link MetropolisSampler} at each iteration.  Draws are always made with
 * the {@link RandomSource} owned by the running chain, so that chains are reproducible from their seed.
 * <p>
 *     {@link MetropolisSampler} accepts proposals using the ratio of target densities only, which is correct for
 *     symmetric jump distributions.  An asymmetric jump distribution can be supplied, but no Hastings correction is
 *     applied for it.
 * </p>
 */
public interface JumpDistribution {
    double DEFAULT_STANDARD_DEVIATION = 0.2;

    /**
     * Symmetric normal jump with mean 0 and standard deviation {@link #DEFAULT_STANDARD_DEVIATION}.
     */
    JumpDistribution DEFAULT = normal(0., DEFAULT_STANDARD_DEVIATION);

    /**
     * Draws a jump using {@code source}.
     */
    double sample(final RandomSource source);

    /**
     * Evaluates the density of the jump distribution at {@code delta}.
     */
    double density(final double delta);

    /**
     * @return true if density(delta) == density(-delta) for all delta
     */
    boolean isSymmetric();

    static JumpDistribution normal(final double mean, final double standardDeviation) {
        ParamUtils.isFinite(mean, "Mean of the jump distribution must be finite.");
        ParamUtils.isPositive(standardDeviation, "Standard deviation of the jump distribution must be positive.");
        return new RealDistributionJump(rng -> new NormalDistribution(rng, mean, standardDeviation), mean == 0.,
                String.format("Normal(%s, %s)", mean, standardDeviation));
    }

    static JumpDistribution uniform(final double lower, final double upper) {
        Utils.validateArg(lower < upper, "Lower bound of the jump distribution must be less than the upper bound.");
        return new RealDistributionJump(rng -> new UniformRealDistribution(rng, lower, upper), lower == -upper,
                String.format("Uniform(%s, %s)", lower, upper));
    }

    /**
     * Adapts a Commons Math {@link RealDistribution}.  {@code distributionFactory} must build the distribution on the
     * generator it is given, e.g. {@code rng -> new TDistribution(rng, 3.)}.
     */
    static JumpDistribution of(final Function<RandomGenerator, RealDistribution> distributionFactory,
                               final boolean isSymmetric) {
        return new RealDistributionJump(distributionFactory, isSymmetric, "custom");
    }
}
