package org.broadinstitute.samplers.utils.mcmc;

import com.google.common.primitives.Doubles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.samplers.exceptions.ConfigurationException;
import org.broadinstitute.samplers.utils.Utils;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Implements random-walk Metropolis sampling of a univariate, unnormalized probability density function.
 * <p>
 *     Starting from the initial value, each iteration proposes θ_pro = θ_cur + Δθ with Δθ drawn from the
 *     {@link JumpDistribution}, and moves to θ_pro with probability
 *     <ul>
 *         <li>0, if θ_pro lies outside the space (the density is not evaluated there);</li>
 *         <li>1, if the density at θ_cur is zero;</li>
 *         <li>min(1, density(θ_pro) / density(θ_cur)) otherwise.</li>
 *     </ul>
 *     The chain holds {@link MetropolisConfiguration#chainLength()} states including the initial value; the first
 *     {@link MetropolisConfiguration#burnIn()} of them are dropped from the result.
 * </p>
 * <p>
 *     Runs are pure functions of their {@link MetropolisConfiguration}: all draws come from a {@link RandomSource}
 *     built from the configured seed, so a seeded run is exactly reproducible.  Exceptions thrown by the density
 *     propagate to the caller and no partial chain is returned.
 * </p>
 */
public final class MetropolisSampler {
    private static final Logger logger = LogManager.getLogger(MetropolisSampler.class);
    private static final int NUMBER_OF_SAMPLES_PER_LOG_ENTRY = 1000;

    private MetropolisSampler() {}

    /**
     * Runs a chain as specified by {@code configuration}.
     * @return samples after burn-in, {@code chainLength - burnIn} of them
     */
    public static List<Double> run(final MetropolisConfiguration configuration) {
        return runWithStatistics(configuration).samples();
    }

    /**
     * Runs a chain of {@code chainLength} states from {@code thetaInit} over the closed interval
     * [{@code spaceMin}, {@code spaceMax}].
     * @param seed  {@code null} for a non-reproducible chain
     */
    public static List<Double> run(final Function<Double, Double> density,
                                   final int chainLength,
                                   final double thetaInit,
                                   final JumpDistribution jumpDistribution,
                                   final double spaceMin,
                                   final double spaceMax,
                                   final int burnIn,
                                   final Long seed) {
        return run(new MetropolisConfiguration.Builder(density)
                .chainLength(chainLength)
                .thetaInit(thetaInit)
                .jumpDistribution(jumpDistribution)
                .space(spaceMin, spaceMax)
                .burnIn(burnIn)
                .seed(seed)
                .build());
    }

    /**
     * Runs an unbounded, non-reproducible chain with the default jump distribution and no burn-in.
     */
    public static List<Double> run(final Function<Double, Double> density,
                                   final int chainLength,
                                   final double thetaInit) {
        return run(new MetropolisConfiguration.Builder(density)
                .chainLength(chainLength)
                .thetaInit(thetaInit)
                .build());
    }

    /**
     * Runs a chain as specified by {@code configuration} and reports how many proposals were accepted.
     */
    public static MetropolisChain runWithStatistics(final MetropolisConfiguration configuration) {
        Utils.nonNull(configuration, "Configuration cannot be null.");
        final Function<Double, Double> density = configuration.density();
        final JumpDistribution jumpDistribution = configuration.jumpDistribution();
        final int chainLength = configuration.chainLength();

        if (!configuration.isInSpace(configuration.thetaInit())) {
            logger.warn(String.format("Initial value %s lies outside the space [%s, %s].",
                    configuration.thetaInit(), configuration.spaceMin(), configuration.spaceMax()));
        }
        if (!jumpDistribution.isSymmetric()) {
            logger.warn("Jump distribution " + jumpDistribution + " is not known to be symmetric; " +
                    "no Hastings correction is applied.");
        }

        final RandomSource source = new RandomSource(configuration.seed());
        final double[] chain = new double[chainLength];
        chain[0] = configuration.thetaInit();
        double thetaCurrent = chain[0];
        double densityCurrent = evaluate(density, thetaCurrent);
        int numAccepted = 0;
        int numDomainRejections = 0;

        logger.info("Starting Metropolis sampling: " + configuration);
        for (int sample = 1; sample < chainLength; sample++) {
            if (sample % NUMBER_OF_SAMPLES_PER_LOG_ENTRY == 0) {
                logger.info(sample + " of " + chainLength + " samples generated.");
            }
            final double thetaProposed = thetaCurrent + jumpDistribution.sample(source);

            final double acceptanceProbability;
            double densityProposed = Double.NaN;
            if (!configuration.isInSpace(thetaProposed)) {
                acceptanceProbability = 0.;
                numDomainRejections++;
            } else if (densityCurrent == 0.) {
                acceptanceProbability = 1.;
                densityProposed = evaluate(density, thetaProposed);
            } else {
                densityProposed = evaluate(density, thetaProposed);
                acceptanceProbability = Math.min(1., densityProposed / densityCurrent);
            }
            logger.debug("Proposed {} from {} with acceptance probability {}.", thetaProposed, thetaCurrent, acceptanceProbability);

            //one uniform variate per proposal, domain rejections included
            final double u = source.nextUniform();
            if (acceptanceProbability > 0. && u <= acceptanceProbability) {
                thetaCurrent = thetaProposed;
                densityCurrent = densityProposed;
                numAccepted++;
            }
            chain[sample] = thetaCurrent;
        }
        final int numProposals = chainLength - 1;
        logger.info(chainLength + " of " + chainLength + " samples generated.");
        logger.debug("Acceptance rate: " + (numProposals == 0 ? Double.NaN : (double) numAccepted / numProposals));
        logger.info("Metropolis sampling complete.");

        final List<Double> samples = Doubles.asList(Arrays.copyOfRange(chain, configuration.burnIn(), chainLength));
        return new MetropolisChain(samples, numProposals, numAccepted, numDomainRejections);
    }

    private static double evaluate(final Function<Double, Double> density, final double theta) {
        final Double value = density.apply(theta);
        if (value == null || !(value >= 0.) || Double.isInfinite(value)) {
            throw new ConfigurationException.BadDensity(theta, value);
        }
        return value;
    }
}
