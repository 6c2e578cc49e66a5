package org.broadinstitute.samplers.utils.mcmc.hmc;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.differentiation.DerivativeStructure;
import org.apache.commons.math3.analysis.differentiation.FiniteDifferencesDifferentiator;
import org.apache.commons.math3.analysis.differentiation.UnivariateDifferentiableFunction;
import org.broadinstitute.samplers.utils.Utils;
import org.broadinstitute.samplers.utils.param.ParamUtils;

/**
 * Supplies the gradient of a potential-energy function U to {@link HamiltonianSampler}.
 */
@FunctionalInterface
public interface GradientOracle {
    /**
     * @param potential     potential energy U, never {@code null}
     * @return              function returning the gradient of U at a position of the same dimension
     */
    MultivariateVectorFunction gradientOf(final MultivariateFunction potential);

    /**
     * Oracle for a potential whose gradient is known in closed form.
     */
    static GradientOracle analytic(final MultivariateVectorFunction gradient) {
        Utils.nonNull(gradient, "Gradient cannot be null.");
        return potential -> gradient;
    }

    /**
     * Oracle estimating each partial derivative by a three-point central difference with spacing {@code stepSize}.
     * Costs 2d evaluations of U per gradient in d dimensions.
     */
    static GradientOracle centralDifference(final double stepSize) {
        ParamUtils.isPositive(stepSize, "Finite-difference step size must be positive.");
        final FiniteDifferencesDifferentiator differentiator = new FiniteDifferencesDifferentiator(3, stepSize);
        return potential -> {
            Utils.nonNull(potential, "Potential energy cannot be null.");
            return position -> {
                final double[] gradient = new double[position.length];
                for (int i = 0; i < position.length; i++) {
                    final int coordinate = i;
                    final UnivariateDifferentiableFunction partial = differentiator.differentiate((UnivariateFunction) x -> {
                        final double[] shifted = position.clone();
                        shifted[coordinate] = x;
                        return potential.value(shifted);
                    });
                    gradient[i] = partial.value(new DerivativeStructure(1, 1, 0, position[i])).getPartialDerivative(1);
                }
                return gradient;
            };
        };
    }
}
