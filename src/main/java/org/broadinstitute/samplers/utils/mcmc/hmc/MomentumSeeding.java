package org.broadinstitute.samplers.utils.mcmc.hmc;

import org.broadinstitute.samplers.utils.mcmc.RandomSource;

/**
 * How a single HMC transition turns its seed into the random sources for the momentum draw and for the
 * acceptance variate.
 */
public enum MomentumSeeding {
    /**
     * Momentum and acceptance variate come from two distinct substreams of the seed, so they are independent.
     */
    INDEPENDENT_SUBSTREAMS {
        @Override
        RandomSource momentumSource(final Long seed) {
            return RandomSource.substream(seed, 0);
        }

        @Override
        RandomSource acceptanceSource(final Long seed) {
            return RandomSource.substream(seed, 1);
        }
    },

    /**
     * Momentum and acceptance variate each come from a fresh source built from the seed itself.  The acceptance
     * variate then reuses the first draw of the stream that generated the momentum, so the two are correlated.
     * Kept only to reproduce chains generated that way.
     */
    SHARED_SEED {
        @Override
        RandomSource momentumSource(final Long seed) {
            return new RandomSource(seed);
        }

        @Override
        RandomSource acceptanceSource(final Long seed) {
            return new RandomSource(seed);
        }
    };

    abstract RandomSource momentumSource(final Long seed);

    abstract RandomSource acceptanceSource(final Long seed);
}
