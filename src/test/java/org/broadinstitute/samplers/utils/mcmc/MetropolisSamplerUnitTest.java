package org.broadinstitute.samplers.utils.mcmc;

import com.google.common.primitives.Doubles;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.broadinstitute.samplers.exceptions.ConfigurationException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Unit tests for {@link MetropolisSampler}.
 */
public final class MetropolisSamplerUnitTest {
    private static final long SEED = 72L;

    private static final Function<Double, Double> UNIFORM_DENSITY = theta -> 0. <= theta && theta <= 1. ? 1. : 0.;

    private static final double ALPHA = 15.;
    private static final double BETA = 7.;
    private static final BetaDistribution BETA_DISTRIBUTION = new BetaDistribution(ALPHA, BETA);
    private static final Function<Double, Double> BETA_DENSITY = BETA_DISTRIBUTION::density;

    private static double relativeError(final double x, final double xTrue) {
        return Math.abs((x - xTrue) / xTrue);
    }

    @Test
    public void testUniformScenario() {
        final List<Double> chain = MetropolisSampler.run(UNIFORM_DENSITY, 5, 0.5, JumpDistribution.DEFAULT, 0., 1., 0, SEED);
        Assert.assertEquals(chain.size(), 5);
        Assert.assertEquals((double) chain.get(0), 0.5);
        chain.forEach(theta -> Assert.assertTrue(0. <= theta && theta <= 1.));
    }

    @DataProvider(name = "chainLengthsAndBurnIns")
    public Object[][] chainLengthsAndBurnIns() {
        return new Object[][]{
                {1, 0},
                {2, 0},
                {2, 1},
                {10, 0},
                {10, 9},
                {100, 25},
                {1000, 999}
        };
    }

    @Test(dataProvider = "chainLengthsAndBurnIns")
    public void testLength(final int chainLength, final int burnIn) {
        final List<Double> chain = MetropolisSampler.run(BETA_DENSITY, chainLength, 0.5, JumpDistribution.DEFAULT, 0., 1., burnIn, SEED);
        Assert.assertEquals(chain.size(), chainLength - burnIn);
    }

    @Test
    public void testSingleStateChainIsInitialValue() {
        Assert.assertEquals(MetropolisSampler.run(BETA_DENSITY, 1, 0.3), Collections.singletonList(0.3));
    }

    @Test
    public void testBurnInDropsBeginningOfChain() {
        final MetropolisConfiguration configuration = new MetropolisConfiguration.Builder(BETA_DENSITY)
                .chainLength(200).space(0., 1.).seed(SEED).build();
        final List<Double> fullChain = MetropolisSampler.run(configuration);
        final List<Double> burnedChain = MetropolisSampler.run(configuration.toBuilder().burnIn(50).build());
        Assert.assertEquals(burnedChain, fullChain.subList(50, 200));
    }

    @Test
    public void testDeterminism() {
        final MetropolisConfiguration configuration = new MetropolisConfiguration.Builder(BETA_DENSITY)
                .chainLength(500).thetaInit(0.1).space(0., 1.).burnIn(5).seed(SEED).build();
        final List<Double> chain1 = MetropolisSampler.run(configuration);
        final List<Double> chain2 = MetropolisSampler.run(configuration);
        Assert.assertEquals(chain1, chain2);
        //rerunning a configuration derived with no updates reuses everything
        Assert.assertEquals(MetropolisSampler.run(configuration.withUpdates(Collections.emptyMap())), chain1);
        //a different seed gives a different chain
        Assert.assertNotEquals(MetropolisSampler.run(configuration.withUpdates(Collections.singletonMap("seed", SEED + 1))), chain1);
    }

    @Test
    public void testDomainInvariant() {
        final double spaceMin = 0.2;
        final double spaceMax = 0.9;
        final List<Double> chain = MetropolisSampler.run(BETA_DENSITY, 5000, 0.5, JumpDistribution.normal(0., 0.5),
                spaceMin, spaceMax, 0, SEED);
        chain.forEach(theta -> Assert.assertTrue(spaceMin <= theta && theta <= spaceMax));
    }

    @Test
    public void testDensityNotEvaluatedOutsideSpace() {
        final Function<Double, Double> density = theta -> {
            if (theta < 0. || theta > 1.) {
                throw new IllegalStateException("Density evaluated outside the space at " + theta);
            }
            return BETA_DISTRIBUTION.density(theta);
        };
        final MetropolisChain chain = MetropolisSampler.runWithStatistics(new MetropolisConfiguration.Builder(density)
                .chainLength(2000).jumpDistribution(JumpDistribution.normal(0., 1.)).space(0., 1.).seed(SEED).build());
        Assert.assertTrue(chain.numDomainRejections() > 0);
        Assert.assertEquals(chain.numProposals(), 1999);
        Assert.assertTrue(chain.numAccepted() <= chain.numProposals() - chain.numDomainRejections());
    }

    @Test
    public void testAlwaysAcceptsWhenDensityRatioAtLeastOne() {
        //density increases toward every proposal, since jumps are strictly positive
        final MetropolisChain chain = MetropolisSampler.runWithStatistics(new MetropolisConfiguration.Builder(Math::exp)
                .chainLength(100).thetaInit(0.).jumpDistribution(JumpDistribution.uniform(0.01, 0.5)).seed(SEED).build());
        Assert.assertEquals(chain.numAccepted(), 99);
        Assert.assertEquals(chain.acceptanceRate(), 1.);
        final List<Double> samples = chain.samples();
        for (int i = 1; i < samples.size(); i++) {
            Assert.assertTrue(samples.get(i) > samples.get(i - 1));
        }
    }

    @Test
    public void testMovesAwayFromZeroDensityState() {
        final Function<Double, Double> density = theta -> theta > 10. ? 1. : 0.;
        final List<Double> chain = MetropolisSampler.run(new MetropolisConfiguration.Builder(density)
                .chainLength(50).thetaInit(0.).seed(SEED).build());
        //every proposal from a zero-density state is accepted
        for (int i = 1; i < chain.size(); i++) {
            Assert.assertNotEquals(chain.get(i), chain.get(i - 1));
        }
    }

    @Test
    public void testRejectsMovesToZeroDensity() {
        final List<Double> chain = MetropolisSampler.run(new MetropolisConfiguration.Builder(UNIFORM_DENSITY)
                .chainLength(2000).jumpDistribution(JumpDistribution.normal(0., 1.)).seed(SEED).build());
        chain.forEach(theta -> Assert.assertTrue(0. <= theta && theta <= 1.));
    }

    @Test
    public void testMetropolisSamplingOfBetaDistribution() {
        final List<Double> samples = MetropolisSampler.run(BETA_DENSITY, 50000, 0.5, JumpDistribution.DEFAULT, 0., 1., 1000, 42L);
        final double sampleMean = new Mean().evaluate(Doubles.toArray(samples));
        final double sampleStandardDeviation = new StandardDeviation().evaluate(Doubles.toArray(samples));
        Assert.assertEquals(relativeError(sampleMean, BETA_DISTRIBUTION.getNumericalMean()), 0., 0.02);
        Assert.assertEquals(relativeError(sampleStandardDeviation, Math.sqrt(BETA_DISTRIBUTION.getNumericalVariance())), 0., 0.1);
    }

    @Test
    public void testMetropolisSamplingOfGammaDistribution() {
        //shifted gamma with shape 2, location 4 and scale 5, over a half-bounded space
        final GammaDistribution gamma = new GammaDistribution(2., 5.);
        final Function<Double, Double> density = theta -> theta < 4. ? 0. : gamma.density(theta - 4.);
        final List<Double> samples = MetropolisSampler.run(new MetropolisConfiguration.Builder(density)
                .chainLength(100000).thetaInit(10.).jumpDistribution(JumpDistribution.normal(0., 5.))
                .space(0., Double.POSITIVE_INFINITY).burnIn(1000).seed(42L).build());
        final double sampleMean = new Mean().evaluate(Doubles.toArray(samples));
        Assert.assertEquals(relativeError(sampleMean, 4. + gamma.getNumericalMean()), 0., 0.05);
        samples.forEach(theta -> Assert.assertTrue(theta >= 4.));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testDensityExceptionPropagates() {
        MetropolisSampler.run(new MetropolisConfiguration.Builder(theta -> {
            throw new IllegalStateException("density failure");
        }).chainLength(10).seed(SEED).build());
    }

    @Test(expectedExceptions = ConfigurationException.BadDensity.class)
    public void testNegativeDensity() {
        MetropolisSampler.run(theta -> -1., 10, 0.5);
    }

    @Test(expectedExceptions = ConfigurationException.BadDensity.class)
    public void testNaNDensity() {
        MetropolisSampler.run(theta -> Double.NaN, 10, 0.5);
    }

    @Test(expectedExceptions = ConfigurationException.BadDensity.class)
    public void testInfiniteInitialDensity() {
        MetropolisSampler.run(theta -> Double.POSITIVE_INFINITY, 100, 0.5);
    }

    @Test(expectedExceptions = ConfigurationException.BadDensity.class)
    public void testInfiniteProposedDensity() {
        //about a third of the proposals from 0.9 land above 1
        MetropolisSampler.run(theta -> theta > 1. ? Double.POSITIVE_INFINITY : 1., 1000, 0.9,
                JumpDistribution.DEFAULT, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, 0, SEED);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testNullDensity() {
        MetropolisSampler.run(null, 10, 0.5);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testBurnInNotLessThanChainLength() {
        MetropolisSampler.run(BETA_DENSITY, 10, 0.5, JumpDistribution.DEFAULT, 0., 1., 10, SEED);
    }
}
