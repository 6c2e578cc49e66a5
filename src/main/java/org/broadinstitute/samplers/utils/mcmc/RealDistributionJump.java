package org.broadinstitute.samplers.utils.mcmc;

import org.apache.commons.math3.distribution.RealDistribution;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;
import org.broadinstitute.samplers.utils.Utils;

import java.util.function.Function;

/**
 * {@link JumpDistribution} backed by a Commons Math {@link RealDistribution}.  The distribution is rebuilt on the
 * generator of the chain's {@link RandomSource} for each draw, in the same way that the adaptive Metropolis sampler
 * wraps its normal proposal around the generator it is handed.
 */
final class RealDistributionJump implements JumpDistribution {
    private final Function<RandomGenerator, RealDistribution> distributionFactory;
    //only used for density evaluation, which never consumes random draws
    private final RealDistribution densityDistribution;
    private final boolean isSymmetric;
    private final String description;

    RealDistributionJump(final Function<RandomGenerator, RealDistribution> distributionFactory,
                         final boolean isSymmetric,
                         final String description) {
        this.distributionFactory = Utils.nonNull(distributionFactory, "Distribution factory cannot be null.");
        this.densityDistribution = Utils.nonNull(distributionFactory.apply(new JDKRandomGenerator()),
                "Distribution factory must not return null.");
        this.isSymmetric = isSymmetric;
        this.description = description;
    }

    @Override
    public double sample(final RandomSource source) {
        Utils.nonNull(source);
        return distributionFactory.apply(source.generator()).sample();
    }

    @Override
    public double density(final double delta) {
        return densityDistribution.density(delta);
    }

    @Override
    public boolean isSymmetric() {
        return isSymmetric;
    }

    @Override
    public String toString() {
        return description;
    }
}
