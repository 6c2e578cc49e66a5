package org.broadinstitute.samplers.utils.mcmc.hmc;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.samplers.utils.Utils;
import org.broadinstitute.samplers.utils.mcmc.RandomSource;
import org.broadinstitute.samplers.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Implements Hamiltonian Monte Carlo sampling of a multivariate, unnormalized probability density function,
 * given as a potential energy U(q) = -log(density(q)) + constant.  See Neal 2011, "MCMC using Hamiltonian
 * dynamics", at https://arxiv.org/abs/1206.1901 for details.
 * <p>
 *     A transition draws a momentum p ~ MVN(0, I), integrates the trajectory with {@link LeapfrogIntegrator},
 *     negates the final momentum, and accepts the end position with probability
 *     min(1, exp(H_current - H_proposed)), where H(q, p) = U(q) + |p|^2 / 2.  Support is unbounded; bounded
 *     variables should be reparameterized by the caller.
 * </p>
 * <p>
 *     The sampler holds no mutable state.  Each transition builds its own {@link RandomSource}s from the seed it is
 *     given (see {@link MomentumSeeding}), so transitions may run concurrently from different threads.
 *     Exceptions thrown by the potential energy or its gradient propagate to the caller.
 * </p>
 */
public final class HamiltonianSampler {
    private static final Logger logger = LogManager.getLogger(HamiltonianSampler.class);
    private static final int NUMBER_OF_SAMPLES_PER_LOG_ENTRY = 100;

    private final GradientOracle gradientOracle;
    private final MomentumSeeding momentumSeeding;

    public HamiltonianSampler(final GradientOracle gradientOracle, final MomentumSeeding momentumSeeding) {
        this.gradientOracle = Utils.nonNull(gradientOracle, "Gradient oracle cannot be null.");
        this.momentumSeeding = Utils.nonNull(momentumSeeding, "Momentum seeding cannot be null.");
    }

    public HamiltonianSampler(final GradientOracle gradientOracle) {
        this(gradientOracle, MomentumSeeding.INDEPENDENT_SUBSTREAMS);
    }

    /**
     * Advances the chain by one transition.
     * @param potentialEnergy   potential energy U, never {@code null}
     * @param eps               leapfrog step size, positive
     * @param leapfrogSteps     number of leapfrog steps, positive
     * @param currentPosition   current state of the chain; not modified
     * @param seed              seed of the transition, {@code null} for non-reproducible draws
     * @return the end of the trajectory if accepted, otherwise a copy of {@code currentPosition}
     */
    public double[] step(final MultivariateFunction potentialEnergy,
                         final double eps,
                         final int leapfrogSteps,
                         final double[] currentPosition,
                         final Long seed) {
        return transition(potentialEnergy, eps, leapfrogSteps, currentPosition, seed).position();
    }

    /**
     * Same as {@link #step}, but also returns the energies and random variates of the transition.
     */
    public HamiltonianTransition transition(final MultivariateFunction potentialEnergy,
                                            final double eps,
                                            final int leapfrogSteps,
                                            final double[] currentPosition,
                                            final Long seed) {
        Utils.nonNull(potentialEnergy, "Potential energy cannot be null.");
        Utils.nonNull(currentPosition, "Current position cannot be null.");
        Utils.validateArg(currentPosition.length > 0, "Dimension of the position must be positive.");
        ParamUtils.isPositive(eps, "Step size must be positive.");
        ParamUtils.isFinite(eps, "Step size must be finite.");
        ParamUtils.isPositive(leapfrogSteps, "Number of leapfrog steps must be positive.");
        final MultivariateVectorFunction gradient =
                Utils.nonNull(gradientOracle.gradientOf(potentialEnergy), "Gradient oracle must not return null.");

        final double[] currentMomentum = momentumSeeding.momentumSource(seed).nextStandardMultivariateNormal(currentPosition.length);
        final LeapfrogIntegrator.PhaseSpacePoint start = new LeapfrogIntegrator.PhaseSpacePoint(currentPosition, currentMomentum);

        //negating the momentum makes the proposal reversible
        final LeapfrogIntegrator.PhaseSpacePoint end =
                LeapfrogIntegrator.integrate(gradient, start, eps, leapfrogSteps).negateMomentum();

        final double currentHamiltonian = potentialEnergy.value(start.position()) + start.kineticEnergy();
        final double proposedHamiltonian = potentialEnergy.value(end.position()) + end.kineticEnergy();

        final double acceptanceVariate = momentumSeeding.acceptanceSource(seed).nextUniform();
        final boolean isAccepted = acceptanceVariate < Math.exp(currentHamiltonian - proposedHamiltonian);
        logger.debug("Hamiltonian of current state: {}", currentHamiltonian);
        logger.debug("Hamiltonian of proposed state: {}", proposedHamiltonian);
        logger.debug(isAccepted ? "Proposed state accepted." : "Proposed state rejected.");
        return new HamiltonianTransition(currentPosition, end.position(), currentMomentum,
                currentHamiltonian, proposedHamiltonian, acceptanceVariate, isAccepted);
    }

    /**
     * Generates a chain of {@code numSamples} states starting from {@code initialPosition}, which is the first state.
     * The seed of the i-th transition is the i-th substream seed of {@code seed}.
     * @param numBurnIn     number of states dropped from the beginning of the chain
     * @return              states after burn-in, {@code numSamples - numBurnIn} of them
     */
    public List<double[]> sample(final MultivariateFunction potentialEnergy,
                                 final double eps,
                                 final int leapfrogSteps,
                                 final double[] initialPosition,
                                 final int numSamples,
                                 final int numBurnIn,
                                 final Long seed) {
        Utils.nonNull(initialPosition, "Initial position cannot be null.");
        ParamUtils.isPositive(numSamples, "Number of samples must be positive.");
        ParamUtils.isPositiveOrZero(numBurnIn, "Number of burn-in samples must be non-negative.");
        Utils.validateArg(numBurnIn < numSamples, "Number of samples must be greater than number of burn-in samples.");

        final List<double[]> samples = new ArrayList<>(numSamples - numBurnIn);
        double[] position = Utils.copy(initialPosition);
        if (numBurnIn == 0) {
            samples.add(Utils.copy(position));
        }
        int numAccepted = 0;
        logger.info("Starting HMC sampling.");
        for (int sample = 1; sample < numSamples; sample++) {
            if (sample % NUMBER_OF_SAMPLES_PER_LOG_ENTRY == 0) {
                logger.info(sample + " of " + numSamples + " samples generated.");
            }
            final HamiltonianTransition transition =
                    transition(potentialEnergy, eps, leapfrogSteps, position, RandomSource.substreamSeed(seed, sample));
            if (transition.isAccepted()) {
                numAccepted++;
            }
            position = transition.position();
            if (sample >= numBurnIn) {
                samples.add(position);
            }
        }
        logger.info(numSamples + " of " + numSamples + " samples generated.");
        logger.debug("Acceptance rate: " + (numSamples == 1 ? Double.NaN : (double) numAccepted / (numSamples - 1)));
        logger.info("HMC sampling complete.");
        return samples;
    }
}
