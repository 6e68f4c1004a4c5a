package wrfcore.hohlraum;

import org.junit.jupiter.api.Test;
import wrfcore.ShotFactory;
import wrfcore.config.CorrectionOptions;
import wrfcore.config.FitOptions;
import wrfcore.engine.ErrorKind;
import wrfcore.engine.Result;
import wrfcore.physics.StoppingPowerLibrary;
import wrfcore.physics.WallMaterial;
import wrfcore.spectrum.Spectrum;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HohlraumCorrectorTest {

    private static final StoppingPowerLibrary LIB = StoppingPowerLibrary.coldMatter();

    private static Spectrum raw() {
        return ShotFactory.syntheticSpectrum("raw", 1e8, 10.0, 0.4, 7.5, 12.5, 51, 0.03, 99L);
    }

    @Test
    void correctedMeanExceedsRawMean() {
        HohlraumCorrector c = HohlraumCorrector.fromThickness(5.0, 0.0, 20.0, LIB, CorrectionOptions.defaults());
        HohlraumFit f = c.fit(raw());

        assertTrue(f.correctedFit().getMean() > f.rawFit().getMean());
        assertTrue(f.energyShift() > 0.0);
        assertEquals(0, f.guardedBins());
    }

    @Test
    void zeroThicknessLeavesSpectrumUnchanged() {
        HohlraumCorrector c = HohlraumCorrector.none(LIB, CorrectionOptions.defaults());
        Spectrum s = raw();
        Spectrum corr = c.correct(s);
        for (int i = 0; i < s.size(); i++) {
            assertEquals(s.energy(i), corr.energy(i), 1e-12);
            assertEquals(s.get(i).yield(), corr.get(i).yield(), 1e-6 * Math.abs(s.get(i).yield()) + 1e-12);
        }
    }

    @Test
    void shiftGoesThroughAllLayers() {
        HohlraumCorrector c = HohlraumCorrector.fromThickness(5.0, 3.0, 20.0, LIB, CorrectionOptions.defaults());
        double e = c.shiftEnergy(10.0);
        double manual = LIB.getGold().ein(LIB.getUranium().ein(LIB.getAluminum().ein(10.0, 20.0), 3.0), 5.0);
        assertEquals(manual, e, 1e-12);
        assertTrue(e > 10.0);
    }

    @Test
    void zeroYieldBinKeepsRawError() {
        double[] e = {9.0, 9.5, 10.0, 10.5, 11.0};
        double[] y = {100, 0, 300, 200, 100};
        double[] err = {10, 7, 15, 12, 10};
        Spectrum s = Spectrum.of("s", e, y, err);

        HohlraumCorrector c = HohlraumCorrector.fromThickness(10.0, 0.0, 0.0, LIB, CorrectionOptions.defaults());
        int[] guarded = new int[1];
        Spectrum corr = c.correct(s, c.getThickness(), guarded);

        assertEquals(1, guarded[0]);
        assertEquals(0.0, corr.get(1).yield());
        assertEquals(7.0, corr.get(1).error());
        // на остальных бинах относительная погрешность сохраняется
        assertEquals(10.0 / 100.0, corr.get(0).error() / corr.get(0).yield(), 1e-12);
    }

    @Test
    void thicknessFromConcentricWall() {
        WallGeometry wall = ShotFactory.cylindricalWall(0.3, 5.0, 0.0, 20.0, 0.0, 1.0);
        LineOfSight los = new LineOfSight(40.0, 50.0);
        List<Result<LayerThickness>> layers = HohlraumCorrector.layerThicknesses(wall, los, 20);

        assertEquals(2, layers.size());
        assertTrue(layers.get(0).isOk());
        assertTrue(layers.get(1).isOk());

        // путь луча через цилиндрический слой: dr / sin(theta)
        double expectedAu = 0.0;
        double[] angles = los.sampleAngles(20);
        for (double th : angles) expectedAu += 5e-4 / Math.sin(Math.toRadians(th));
        expectedAu /= angles.length;

        LayerThickness au = layers.get(0).get();
        assertEquals(WallMaterial.AU, au.material());
        assertEquals(expectedAu, au.meanCm(), 3e-6);
        assertTrue(au.stdCm() > 0.0);
        assertEquals(WallMaterial.AL, layers.get(1).get().material());

        HohlraumCorrector c = HohlraumCorrector.fromWall(wall, los, LIB, CorrectionOptions.defaults());
        assertEquals(ThicknessMode.FROM_WALL, c.getMode());
        assertEquals(expectedAu * 1e4, c.get(WallMaterial.AU), 0.03);
        assertEquals(0.0, c.get(WallMaterial.DU));
        assertTrue(c.getThickness().dAu() >= 1.0);
    }

    @Test
    void oddContourCountGivesInvalidGeometryForUnpairedContour() {
        List<WallPoint> pts = new ArrayList<>();
        for (int layer = 0; layer < 3; layer++) {
            double r = 0.3 + layer * 5e-4;
            pts.add(new WallPoint(layer, WallMaterial.AU, r, 0.0));
            pts.add(new WallPoint(layer, WallMaterial.AU, r, 1.0));
        }
        WallGeometry wall = new WallGeometry(pts);
        List<Result<LayerThickness>> layers = HohlraumCorrector.layerThicknesses(wall, new LineOfSight(40, 50), 10);

        assertEquals(2, layers.size());
        assertTrue(layers.get(0).isOk());
        assertFalse(layers.get(1).isOk());
        assertEquals(ErrorKind.INVALID_GEOMETRY, layers.get(1).getError());

        // пара без ошибки всё равно учитывается
        HohlraumCorrector c = HohlraumCorrector.fromWall(wall, new LineOfSight(40, 50), LIB, CorrectionOptions.defaults());
        assertTrue(c.get(WallMaterial.AU) > 0.0);
    }

    @Test
    void rayMissingTheWallIsInvalidGeometry() {
        WallGeometry wall = ShotFactory.cylindricalWall(0.3, 5.0, 0.0, 0.0, 2.0, 3.0);
        List<Result<LayerThickness>> layers = HohlraumCorrector.layerThicknesses(wall, new LineOfSight(40, 50), 10);
        assertEquals(1, layers.size());
        assertEquals(ErrorKind.INVALID_GEOMETRY, layers.get(0).getError());
    }

    @Test
    void bumpIsAddedToGoldAndClampedAtZero() {
        HohlraumCorrector up = HohlraumCorrector.fromThickness(5.0, 0.0, 0.0, LIB,
                CorrectionOptions.defaults().withBump(2.0));
        assertEquals(7.0, up.get(WallMaterial.AU), 1e-12);

        HohlraumCorrector down = HohlraumCorrector.fromThickness(5.0, 0.0, 0.0, LIB,
                CorrectionOptions.defaults().withBump(-10.0));
        assertEquals(0.0, down.get(WallMaterial.AU), 1e-12);
    }

    @Test
    void thicknessUncertaintyMovesCorrectedFit() {
        HohlraumCorrector c = HohlraumCorrector.fromThickness(5.0, 0.0, 20.0, LIB, CorrectionOptions.defaults());
        Spectrum s = raw();
        double[][] u = c.uncertainty(s);
        for (double[] row : u) {
            assertTrue(row[0] >= 0.0 && row[1] >= 0.0);
        }
        assertTrue(u[1][0] > 0.0 && u[1][1] > 0.0, "energy uncertainty must be positive");
    }

    @Test
    void onlyPositiveThicknessesAreShifted() {
        WallThickness t = new WallThickness(5.0, 0.0, 2.0, 1.0, 1.0, 3.0);
        WallThickness lo = t.shifted(-1.0);
        assertEquals(4.0, lo.au());
        assertEquals(0.0, lo.du());
        assertEquals(0.0, lo.al());
        WallThickness hi = t.shifted(+1.0);
        assertEquals(0.0, hi.du());
        assertEquals(5.0, hi.al());
    }

    @Test
    void fitLimitsAreMappedThroughTheWall() {
        CorrectionOptions opts = CorrectionOptions.defaults()
                .withFitOptions(CorrectionOptions.defaults().getFitOptions().withLimits(8.0, 12.0));
        HohlraumCorrector c = HohlraumCorrector.fromThickness(5.0, 0.0, 0.0, LIB, opts);
        FitOptions mapped = c.correctedFitOptions(opts.getFitOptions(), c.getThickness());
        assertEquals(c.shiftEnergy(8.0), mapped.getMinEnergy(), 1e-12);
        assertEquals(c.shiftEnergy(12.0), mapped.getMaxEnergy(), 1e-12);
    }
}
