package wrfcore.analysis;

import org.junit.jupiter.api.Test;
import wrfcore.ShotFactory;
import wrfcore.TestModels;
import wrfcore.config.ShellModelParameters;
import wrfcore.config.ShellModelParametersBuilder;
import wrfcore.config.ShellParamId;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SensitivityAnalyzerTest {

    /** Параметры по умолчанию, у которых ненулевая σ только у id. */
    private static ShellModelParameters onlySigma(ShellParamId id, double sigma) {
        ShellModelParametersBuilder b = ShellModelParametersBuilder.from(ShotFactory.defaultParams());
        for (ShellParamId other : ShellParamId.values()) {
            b.setUncertainty(other, 0.0);
        }
        b.setUncertainty(id, sigma);
        return b.build();
    }

    @Test
    void fullAnalysisGivesFiniteNonNegativeErrors() throws Exception {
        SensitivityAnalyzer sa = TestModels.sensitivity();

        RhoRWithError r = sa.calcRhoR(11.0);
        assertTrue(Double.isFinite(r.rhoR()));
        assertTrue(r.error() >= 0.0 && Double.isFinite(r.error()));
        assertEquals(ShellParamId.values().length, r.modelBudget().contributions().size());

        double sumSq = 0.0;
        for (ErrorContribution c : r.modelBudget().contributions()) {
            if (c.dropped()) continue;
            assertTrue(c.error() >= 0.0, c.name());
            sumSq += c.error() * c.error();
        }
        assertEquals(Math.sqrt(sumSq), r.modelBudget().total(), 1e-15);

        ValueWithError rcm = sa.calcRcm(11.0, 0.0, true);
        assertEquals(r.rcm(), rcm.value(), 0.0);
        assertTrue(rcm.error() >= 0.0 && Double.isFinite(rcm.error()));

        ValueWithError eout = sa.eoutWithError(0.05);
        assertEquals(sa.getNominal().eout(0.05), eout.value(), 0.0);
        assertTrue(eout.error() > 0.0);
    }

    @Test
    void energyUncertaintyOnlyAddsToTheModelError() throws Exception {
        SensitivityAnalyzer sa = TestModels.sensitivity();
        RhoRWithError noDe = sa.calcRhoR(11.0);
        RhoRWithError withDe = sa.calcRhoR(11.0, 0.2);
        assertEquals(noDe.rhoR(), withDe.rhoR(), 0.0);
        assertTrue(withDe.error() > noDe.error());
        assertEquals(noDe.modelBudget().total(), withDe.modelBudget().total(), 0.0);

        ValueWithError rcm0 = sa.calcRcm(11.0, 0.0, false);
        ValueWithError rcm1 = sa.calcRcm(11.0, 0.2, false);
        assertTrue(rcm1.error() > rcm0.error());
    }

    @Test
    void outOfRangeEnergyGivesNaN() throws Exception {
        SensitivityAnalyzer sa = TestModels.sensitivity();
        RhoRWithError r = sa.calcRhoR(30.0);
        assertTrue(Double.isNaN(r.rhoR()));
        assertTrue(Double.isNaN(r.rcm()));
        assertTrue(Double.isNaN(sa.rhoRParts(r.rcm())[0]));
    }

    @Test
    void largerSigmaGivesLargerError() {
        SensitivityAnalyzer small = SensitivityAnalyzer.build(onlySigma(ShellParamId.P0, 1.0));
        SensitivityAnalyzer large = SensitivityAnalyzer.build(onlySigma(ShellParamId.P0, 5.0));

        double eSmall = small.rhoRTotalWithError(0.05).error();
        double eLarge = large.rhoRTotalWithError(0.05).error();
        assertTrue(eSmall > 0.0);
        assertTrue(eLarge > eSmall);
        assertEquals(2, small.perturbedModelCount());
        assertTrue(small.failedParameters().isEmpty());
    }

    @Test
    void zeroSigmaParametersContributeNothing() {
        SensitivityAnalyzer sa = SensitivityAnalyzer.build(onlySigma(ShellParamId.P0, 1.0));
        ErrorBudget b = sa.calcError(TargetFunction.RHOR_TOTAL, 0.05, 0.0);
        for (ErrorContribution c : b.contributions()) {
            if (c.id() == ShellParamId.P0) {
                assertEquals(b.total(), c.error(), 0.0);
            } else {
                assertEquals(0.0, c.error(), 0.0);
                assertFalse(c.dropped());
            }
        }
    }

    @Test
    void invalidShiftIsDroppedFromTheSum() {
        // Te_Gas = 3 кэВ, -5 кэВ даёт отрицательную температуру
        SensitivityAnalyzer sa = SensitivityAnalyzer.build(onlySigma(ShellParamId.TE_GAS, 5.0));
        assertEquals(1, sa.perturbedModelCount());
        assertEquals(java.util.EnumSet.of(ShellParamId.TE_GAS), sa.failedParameters());

        ErrorBudget b = sa.calcError(TargetFunction.RHOR_TOTAL, 0.05, 0.0);
        assertEquals(1, b.droppedCount());
        assertEquals(0.0, b.total(), 0.0);
        assertTrue(Double.isFinite(sa.calcRhoR(11.0).rhoR()));
    }

    @Test
    void halfSpreadHandlesNaN() {
        assertEquals(1.5, SensitivityAnalyzer.halfSpread(1.0, 4.0, 2.0), 0.0);
        assertEquals(0.0, SensitivityAnalyzer.halfSpread(2.0, 2.0, 2.0), 0.0);
        assertTrue(Double.isNaN(SensitivityAnalyzer.halfSpread(1.0, Double.NaN, 2.0)));
        assertTrue(Double.isNaN(SensitivityAnalyzer.halfSpread(Double.NaN, 1.0, 2.0)));
    }

    @Test
    void finiteHalfSpreadDropsOutOfTableEnds() {
        assertEquals(1.5, SensitivityAnalyzer.finiteHalfSpread(2.0, 5.0, Double.NaN), 0.0);
        assertEquals(0.5, SensitivityAnalyzer.finiteHalfSpread(2.0, Double.NaN, 1.0), 0.0);
        assertEquals(0.0, SensitivityAnalyzer.finiteHalfSpread(2.0, Double.NaN, Double.NaN), 0.0);
        assertEquals(2.0, SensitivityAnalyzer.finiteHalfSpread(2.0, 5.0, 1.0), 0.0);
        assertTrue(Double.isNaN(SensitivityAnalyzer.finiteHalfSpread(Double.NaN, 1.0, 2.0)));
    }

    @Test
    void energyNearTableEdgesKeepsErrorFinite() throws Exception {
        SensitivityAnalyzer sa = TestModels.sensitivity();
        double low = sa.getNominal().minEout() + 0.05;
        double high = sa.getNominal().maxEout() - 0.05;

        for (double e1 : new double[]{low, high}) {
            RhoRWithError r = sa.calcRhoR(e1, 1.0);
            assertTrue(Double.isFinite(r.rhoR()), "E1=" + e1);
            assertTrue(Double.isFinite(r.error()), "E1=" + e1 + " error=" + r.error());
            assertTrue(r.error() >= r.modelBudget().total(), "E1=" + e1);
        }
    }

    @Test
    void parallelBuildMatchesSequential() throws Exception {
        ShellModelParameters p = onlySigma(ShellParamId.RHO_ABL_SCALE, 30e-4);
        SensitivityAnalyzer seq = SensitivityAnalyzer.build(p);
        ExecutorService ex = Executors.newFixedThreadPool(3);
        SensitivityAnalyzer par;
        try {
            par = SensitivityAnalyzer.build(p, ex, false);
        } finally {
            ex.shutdown();
        }
        RhoRWithError a = seq.calcRhoR(11.0, 0.1);
        RhoRWithError b = par.calcRhoR(11.0, 0.1);
        assertEquals(a.rhoR(), b.rhoR(), 0.0);
        assertEquals(a.rcm(), b.rcm(), 0.0);
        assertEquals(a.error(), b.error(), 0.0);
        assertEquals(seq.perturbedModelCount(), par.perturbedModelCount());
    }

    @Test
    void budgetScalesToMilligrams() {
        ErrorBudget b = new ErrorBudget(0.002, java.util.List.of(
                new ErrorContribution(ShellParamId.P0, "P0", 0.002, false),
                new ErrorContribution(ShellParamId.TE_GAS, "Te_Gas", Double.NaN, true)));
        ErrorBudget mg = b.scaled(1e3);
        assertEquals(2.0, mg.total(), 1e-12);
        assertEquals(2.0, mg.contributions().get(0).error(), 1e-12);
        assertTrue(Double.isNaN(mg.contributions().get(1).error()));
        assertEquals(1, mg.droppedCount());
    }
}
