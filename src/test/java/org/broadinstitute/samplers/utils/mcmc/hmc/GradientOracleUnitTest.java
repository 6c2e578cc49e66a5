package org.broadinstitute.samplers.utils.mcmc.hmc;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Unit tests for {@link GradientOracle}.
 */
public final class GradientOracleUnitTest {
    private static final double EPSILON = 1E-6;

    @Test
    public void testAnalytic() {
        final MultivariateVectorFunction gradient = q -> new double[]{2. * q[0]};
        Assert.assertSame(GradientOracle.analytic(gradient).gradientOf(q -> q[0] * q[0]), gradient);
    }

    @Test
    public void testCentralDifference() {
        final MultivariateFunction potential = q -> q[0] * q[0] + 3. * q[0] * q[1] - Math.sin(q[1]);
        final double[] position = {1., 2.};
        final double[] gradient = GradientOracle.centralDifference(1E-4).gradientOf(potential).value(position);
        Assert.assertEquals(gradient.length, 2);
        Assert.assertEquals(gradient[0], 2. * 1. + 3. * 2., EPSILON);
        Assert.assertEquals(gradient[1], 3. * 1. - Math.cos(2.), EPSILON);
        //position is not modified
        Assert.assertEquals(position[0], 1.);
        Assert.assertEquals(position[1], 2.);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveStepSize() {
        GradientOracle.centralDifference(0.);
    }
}
