package wrfcore.spectrum;

import org.junit.jupiter.api.Test;
import wrfcore.ShotFactory;
import wrfcore.config.FitOptions;

import static org.junit.jupiter.api.Assertions.*;

class GaussianFitterTest {

    private static final double A = 1e8;
    private static final double MU = 10.0;
    private static final double SIGMA = 0.5;

    private static Spectrum synthetic(long seed) {
        return ShotFactory.syntheticSpectrum("synthetic", A, MU, SIGMA, 8.0, 12.0, 81, 0.05, seed);
    }

    @Test
    void recoversKnownParameters() {
        Spectrum s = synthetic(42L);
        GaussianFitter fitter = new GaussianFitter(s);
        GaussFitResult r = fitter.fit(GaussianFitter.momentGuess(s));

        assertEquals(MU, r.getMean(), 0.02);
        assertEquals(SIGMA, r.getSigma(), 0.025);
        assertEquals(A, r.getAmplitude(), 0.03 * A);
        assertEquals(81, r.getBinsUsed());

        double peak = r.getAmplitude() / (r.getSigma() * Math.sqrt(2.0 * Math.PI));
        assertEquals(peak, r.evaluate(r.getMean()), 1e-9 * peak);
        assertTrue(r.evaluate(r.getMean() + 3 * r.getSigma()) < 0.02 * peak);
    }

    @Test
    void reducedChi2IsNearOneForScaledErrors() {
        for (long seed : new long[]{1L, 2L, 3L}) {
            Spectrum s = synthetic(seed);
            GaussFitResult r = new GaussianFitter(s).fit(GaussianFitter.momentGuess(s));
            assertTrue(r.getReducedChi2() > 0.5 && r.getReducedChi2() < 1.6,
                    "seed " + seed + ": chi2red=" + r.getReducedChi2());
        }
    }

    @Test
    void fitFromDefaultGuessConverges() {
        Spectrum s = synthetic(7L);
        GaussFitResult r = new GaussianFitter(s).fit();
        assertEquals(MU, r.getMean(), 0.05);
        assertTrue(r.getSigma() > 0.0);
    }

    @Test
    void uncertaintyHasExpectedSigns() {
        Spectrum s = synthetic(11L);
        GaussianFitter fitter = new GaussianFitter(s);
        GaussFitResult r = fitter.fitWithUncertainty(GaussianFitter.momentGuess(s));

        assertTrue(r.hasUncertainty());
        double[][] u = r.getUncertainty();
        for (int k = 0; k < 3; k++) {
            assertTrue(u[k][0] <= 0.0, "lower offset must be <= 0 for parameter " + k);
            assertTrue(u[k][1] >= 0.0, "upper offset must be >= 0 for parameter " + k);
        }
        // погрешность среднего порядка шума, а не ширины спектра
        double dMu = r.symmetricUncertainty(GaussianFitter.MEAN);
        assertTrue(dMu > 0.0 && dMu < 0.1, "dMu=" + dMu);
    }

    @Test
    void flatSpectrumIsStable() {
        int n = 21;
        double[] e = new double[n];
        double[] y = new double[n];
        double[] err = new double[n];
        for (int i = 0; i < n; i++) {
            e[i] = 5.0 + 0.5 * i;
            y[i] = 1000.0;
            err[i] = 10.0;
        }
        Spectrum flat = Spectrum.of("flat", e, y, err);
        GaussianFitter fitter = new GaussianFitter(flat);
        double[] guess = GaussianFitter.momentGuess(flat);
        GaussFitResult r = fitter.fit(guess);

        assertTrue(Double.isFinite(r.getMean()));
        assertTrue(Double.isFinite(r.getSigma()) && r.getSigma() > 0.0);
        assertTrue(Double.isFinite(r.getChi2()));
        assertTrue(r.getChi2() <= fitter.chi2(guess));
    }

    @Test
    void energyLimitsRestrictBins() {
        Spectrum s = synthetic(5L);
        GaussianFitter limited = new GaussianFitter(s, FitOptions.defaults().withLimits(8.99, 11.01));
        assertEquals(41, limited.binsUsed());
        GaussFitResult r = limited.fit(GaussianFitter.momentGuess(s));
        assertEquals(MU, r.getMean(), 0.03);
    }

    @Test
    void zeroErrorBinsAreSkipped() {
        double[] e = {9.0, 9.5, 10.0, 10.5, 11.0};
        double[] y = {1, 5, 10, 5, 1};
        double[] err = {0.0, 1.0, 1.0, 1.0, 0.0};
        GaussianFitter fitter = new GaussianFitter(Spectrum.of("s", e, y, err));
        assertEquals(3, fitter.binsUsed());
        // нет степеней свободы
        assertTrue(Double.isNaN(fitter.reducedChi2(new double[]{25.0, 10.0, 0.5})));
    }

    @Test
    void widthSearchReachesZeroSigma() {
        double[] best = {1e8, 10.0, 0.4};
        double[] bounds = GaussianFitter.searchBounds(best);
        assertEquals(1e8, bounds[GaussianFitter.AMPLITUDE], 0.0);
        assertEquals(0.4, bounds[GaussianFitter.MEAN], 0.0);
        assertEquals(0.4, bounds[GaussianFitter.SIGMA], 0.0);

        Spectrum s = synthetic(13L);
        GaussianFitter fitter = new GaussianFitter(s);
        GaussFitResult r = fitter.fitWithUncertainty(GaussianFitter.momentGuess(s));
        double[][] u = r.getUncertainty();
        assertTrue(u[GaussianFitter.SIGMA][0] >= -r.getSigma() && u[GaussianFitter.SIGMA][0] <= 0.0);
        assertTrue(Double.isFinite(u[GaussianFitter.SIGMA][1]));
    }

    @Test
    void tooFewBinsIsRejected() {
        double[] e = {9.0, 10.0, 11.0};
        double[] y = {1, 2, 1};
        double[] err = {1.0, 0.0, 1.0};
        assertThrows(IllegalArgumentException.class, () -> new GaussianFitter(Spectrum.of("s", e, y, err)));
    }

    @Test
    void chi2IsInfiniteForNonPositiveSigma() {
        Spectrum s = synthetic(3L);
        GaussianFitter fitter = new GaussianFitter(s);
        assertEquals(Double.POSITIVE_INFINITY, fitter.chi2(A, MU, 0.0));
        assertEquals(Double.POSITIVE_INFINITY, fitter.chi2(A, MU, -1.0));
    }

    @Test
    void spectrumValidatesOrderingAndWidths() {
        assertThrows(IllegalArgumentException.class,
                () -> Spectrum.of("bad", new double[]{2, 1}, new double[]{1, 1}, new double[]{1, 1}));
        Spectrum s = Spectrum.of("s", new double[]{1, 2, 4}, new double[]{1, 1, 1}, new double[]{1, 1, 1});
        assertEquals(1.0, s.binWidth(0));
        assertEquals(1.0, s.binWidth(1));
        assertEquals(2.0, s.binWidth(2));
        assertEquals(4.0, s.totalYield(), 1e-12);
    }
}
