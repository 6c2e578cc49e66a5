package org.broadinstitute.samplers.utils.mcmc.hmc;

import org.broadinstitute.samplers.utils.Utils;

/**
 * Outcome of one {@link HamiltonianSampler} transition, with the quantities that entered the accept/reject test.
 */
public final class HamiltonianTransition {
    private final double[] currentPosition;
    private final double[] proposedPosition;
    private final double[] initialMomentum;
    private final double currentHamiltonian;
    private final double proposedHamiltonian;
    private final double acceptanceVariate;
    private final boolean isAccepted;

    HamiltonianTransition(final double[] currentPosition,
                          final double[] proposedPosition,
                          final double[] initialMomentum,
                          final double currentHamiltonian,
                          final double proposedHamiltonian,
                          final double acceptanceVariate,
                          final boolean isAccepted) {
        this.currentPosition = Utils.copy(currentPosition);
        this.proposedPosition = Utils.copy(proposedPosition);
        this.initialMomentum = Utils.copy(initialMomentum);
        this.currentHamiltonian = currentHamiltonian;
        this.proposedHamiltonian = proposedHamiltonian;
        this.acceptanceVariate = acceptanceVariate;
        this.isAccepted = isAccepted;
    }

    /**
     * @return the proposed position if accepted, otherwise the starting position
     */
    public double[] position() {
        return isAccepted ? Utils.copy(proposedPosition) : Utils.copy(currentPosition);
    }

    public double[] currentPosition() {
        return Utils.copy(currentPosition);
    }

    /**
     * @return position at the end of the leapfrog trajectory, whether or not it was accepted
     */
    public double[] proposedPosition() {
        return Utils.copy(proposedPosition);
    }

    /**
     * @return momentum drawn at the start of the transition
     */
    public double[] initialMomentum() {
        return Utils.copy(initialMomentum);
    }

    public double currentHamiltonian() {
        return currentHamiltonian;
    }

    public double proposedHamiltonian() {
        return proposedHamiltonian;
    }

    /**
     * @return min(1, exp(H_current - H_proposed)), or 0 if the proposed energy is not a number
     */
    public double acceptanceProbability() {
        final double acceptanceProbability = Math.min(1., Math.exp(currentHamiltonian - proposedHamiltonian));
        return Double.isNaN(acceptanceProbability) ? 0. : acceptanceProbability;
    }

    /**
     * @return the uniform variate compared against the acceptance probability
     */
    public double acceptanceVariate() {
        return acceptanceVariate;
    }

    public boolean isAccepted() {
        return isAccepted;
    }
}
