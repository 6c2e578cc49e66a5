package org.broadinstitute.samplers.utils.mcmc.hmc;

import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.broadinstitute.samplers.utils.Utils;
import org.broadinstitute.samplers.utils.param.ParamUtils;

import java.util.Arrays;

/**
 * Leapfrog integration of Hamiltonian dynamics with unit mass, H(q, p) = U(q) + |p|^2 / 2.
 * The integrator is symplectic: integrating {@code steps} steps with step size {@code eps} and then {@code steps}
 * steps with step size {@code -eps} returns to the starting point, up to floating-point error.
 */
public final class LeapfrogIntegrator {
    private LeapfrogIntegrator() {}

    /**
     * Immutable point (q, p) in phase space.
     */
    public static final class PhaseSpacePoint {
        private final double[] position;
        private final double[] momentum;

        public PhaseSpacePoint(final double[] position, final double[] momentum) {
            Utils.validateSameDimension(position, momentum, "Position and momentum must have the same dimension.");
            Utils.validateArg(position.length > 0, "Dimension must be positive.");
            this.position = Utils.copy(position);
            this.momentum = Utils.copy(momentum);
        }

        public double[] position() {
            return Utils.copy(position);
        }

        public double[] momentum() {
            return Utils.copy(momentum);
        }

        public PhaseSpacePoint negateMomentum() {
            return new PhaseSpacePoint(position, Arrays.stream(momentum).map(x -> -x).toArray());
        }

        /**
         * @return |p|^2 / 2
         */
        public double kineticEnergy() {
            return kineticEnergy(momentum);
        }

        static double kineticEnergy(final double[] momentum) {
            double sumOfSquares = 0.;
            for (final double p : momentum) {
                sumOfSquares += p * p;
            }
            return sumOfSquares / 2.;
        }
    }

    /**
     * Integrates {@code steps} leapfrog steps of size {@code eps} from {@code start}: a half step for the momentum,
     * alternating full steps for position and momentum, then a final full step for the position and half step
     * for the momentum.  Gradient evaluations: {@code steps + 1}.
     * @param gradient  gradient of the potential energy
     * @param eps       step size; negative values integrate backward in time
     * @param steps     number of leapfrog steps, at least one
     * @return the end point of the trajectory, with momentum not negated
     */
    public static PhaseSpacePoint integrate(final MultivariateVectorFunction gradient,
                                            final PhaseSpacePoint start,
                                            final double eps,
                                            final int steps) {
        Utils.nonNull(gradient, "Gradient cannot be null.");
        Utils.nonNull(start, "Starting point cannot be null.");
        ParamUtils.isFinite(eps, "Step size must be finite.");
        Utils.validateArg(eps != 0., "Step size must be non-zero.");
        ParamUtils.isPositive(steps, "Number of leapfrog steps must be positive.");

        final double[] q = start.position();
        final double[] p = start.momentum();

        //half step for momentum at the beginning
        addScaled(p, -eps / 2., evaluate(gradient, q));
        for (int step = 0; step < steps - 1; step++) {
            addScaled(q, eps, p);
            addScaled(p, -eps, evaluate(gradient, q));
        }
        //full step for position and half step for momentum at the end
        addScaled(q, eps, p);
        addScaled(p, -eps / 2., evaluate(gradient, q));
        return new PhaseSpacePoint(q, p);
    }

    private static double[] evaluate(final MultivariateVectorFunction gradient, final double[] q) {
        final double[] value = gradient.value(Utils.copy(q));
        Utils.nonNull(value, "Gradient must not return null.");
        Utils.validateArg(value.length == q.length,
                String.format("Gradient has dimension %d, but position has dimension %d.", value.length, q.length));
        return value;
    }

    //x += scale * y, in place
    private static void addScaled(final double[] x, final double scale, final double[] y) {
        for (int i = 0; i < x.length; i++) {
            x[i] += scale * y[i];
        }
    }
}
