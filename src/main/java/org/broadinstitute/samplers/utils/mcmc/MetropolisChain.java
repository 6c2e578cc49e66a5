package org.broadinstitute.samplers.utils.mcmc;

import org.broadinstitute.samplers.utils.Utils;

import java.util.Collections;
import java.util.List;

/**
 * Result of a {@link MetropolisSampler} run: the retained samples together with proposal bookkeeping over the
 * whole chain (burn-in included).
 */
public final class MetropolisChain {
    private final List<Double> samples;
    private final int numProposals;
    private final int numAccepted;
    private final int numDomainRejections;

    MetropolisChain(final List<Double> samples, final int numProposals, final int numAccepted,
                    final int numDomainRejections) {
        this.samples = Collections.unmodifiableList(Utils.nonNull(samples));
        this.numProposals = numProposals;
        this.numAccepted = numAccepted;
        this.numDomainRejections = numDomainRejections;
    }

    /**
     * @return samples after burn-in, in chain order
     */
    public List<Double> samples() {
        return samples;
    }

    public int numProposals() {
        return numProposals;
    }

    public int numAccepted() {
        return numAccepted;
    }

    /**
     * @return number of proposals rejected because they fell outside the space
     */
    public int numDomainRejections() {
        return numDomainRejections;
    }

    public double acceptanceRate() {
        return numProposals == 0 ? Double.NaN : (double) numAccepted / numProposals;
    }
}
