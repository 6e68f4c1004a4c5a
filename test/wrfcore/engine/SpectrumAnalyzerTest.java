package wrfcore.engine;

import org.junit.jupiter.api.Test;
import wrfcore.ShotFactory;
import wrfcore.TestModels;
import wrfcore.hohlraum.LineOfSight;
import wrfcore.hohlraum.WallGeometry;
import wrfcore.physics.StoppingPowerLibrary;
import wrfcore.spectrum.Spectrum;

import java.util.ArrayList;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;
import static wrfcore.engine.AnalysisRecord.*;

class SpectrumAnalyzerTest {

    private static final double[] RANDOM = {1e6, 0.05, 0.02};
    private static final double[] SYSTEMATIC = {2e6, 0.1, 0.03};

    private static SpectrumAnalyzer analyzer() throws Exception {
        return new SpectrumAnalyzer(TestModels.sensitivity(), StoppingPowerLibrary.coldMatter());
    }

    private static Spectrum raw() {
        return ShotFactory.syntheticSpectrum("shot", 1e8, 10.0, 0.4, 7.5, 12.5, 51, 0.03, 7L);
    }

    @Test
    void noWallGivesZeroWallKeys() throws Exception {
        AnalysisRecord r = analyzer().analyze(AnalysisRequest.of(raw()).withErrors(RANDOM, SYSTEMATIC));

        assertEquals(KEYS, new ArrayList<>(r.keys()));
        for (String k : new String[]{AU, AU_UNC, DU, DU_UNC, AL, AL_UNC,
                HOHL_Y_POSUNC, HOHL_Y_NEGUNC, HOHL_E_POSUNC, HOHL_E_NEGUNC, HOHL_SIGMA_POSUNC, HOHL_SIGMA_NEGUNC}) {
            assertEquals(0.0, r.get(k), 0.0, k);
        }
        assertNull(r.getHohlraumFit());
        assertEquals(r.get(E_RAW), r.get(ENERGY), 0.0);

        // без фита и стенки случайная погрешность - входная
        assertEquals(RANDOM[0], r.get(YIELD_RAN_UNC), 0.0);
        assertEquals(RANDOM[1], r.get(ENERGY_RAN_UNC), 0.0);
        assertEquals(RANDOM[1], r.get(E_RAW_RAN_UNC), 0.0);
        assertEquals(SYSTEMATIC[1], r.get(ENERGY_SYS_UNC), 0.0);
        assertEquals(SYSTEMATIC[2], r.get(SIGMA_SYS_UNC), 0.0);

        assertEquals(10.0, r.get(ENERGY), 0.05);
        assertTrue(r.get(RHOR) > 0.0 && r.get(RHOR) < 300.0, "rhoR=" + r.get(RHOR));
        assertTrue(r.get(RHOR_RAN_UNC) > 0.0);
        assertTrue(r.get(RHOR_SYS_UNC) >= r.get(RHOR_MODEL_UNC));
        assertEquals(r.getRhoRBudget().total(), r.get(RHOR_MODEL_UNC), 1e-12);
        assertTrue(r.get(RCM) > 0.0 && r.get(RCM) < 900.0, "Rcm=" + r.get(RCM));
        assertTrue(r.get(RCM_SYS_UNC) >= r.get(RCM_MODEL_UNC));
    }

    @Test
    void explicitThicknessRaisesEnergy() throws Exception {
        AnalysisRecord r = analyzer().analyze(AnalysisRequest.of(raw())
                .withErrors(RANDOM, SYSTEMATIC)
                .withThickness(5.0, 0.0, 20.0)
                .withFitUncertainty(true));

        assertNotNull(r.getHohlraumFit());
        assertEquals(5.0, r.get(AU), 0.0);
        assertEquals(20.0, r.get(AL), 0.0);
        assertTrue(r.get(ENERGY) > r.get(E_RAW));
        assertTrue(r.get(HOHL_E_POSUNC) >= 0.0 && r.get(HOHL_E_NEGUNC) >= 0.0);

        // к входной случайной погрешности в квадратуре добавлены фит и стенка
        assertTrue(r.get(ENERGY_RAN_UNC) >= RANDOM[1]);
        assertTrue(r.get(YIELD_RAN_UNC) >= RANDOM[0]);
        assertEquals(RANDOM[1], r.get(E_RAW_RAN_UNC), 0.0);
        assertTrue(Double.isFinite(r.get(RHOR)));
    }

    @Test
    void wallGeometryGivesLayerThicknesses() throws Exception {
        WallGeometry wall = ShotFactory.cylindricalWall(0.3, 5.0, 0.0, 20.0, 0.0, 1.0);
        AnalysisRecord r = analyzer().analyze(AnalysisRequest.of(raw())
                .withWall(wall, new LineOfSight(40.0, 50.0)));

        // наклонный луч проходит слой длиннее его радиальной толщины
        assertTrue(r.get(AU) > 5.0, "Au=" + r.get(AU));
        assertTrue(r.get(AL) > 20.0, "Al=" + r.get(AL));
        assertEquals(0.0, r.get(DU), 0.0);
        assertTrue(r.get(AU_UNC) > 0.0);
        assertTrue(r.get(ENERGY) > r.get(E_RAW));
        assertFalse(r.getIssues().contains(ErrorKind.INVALID_GEOMETRY));
    }

    @Test
    void lowEnergyShotGivesNaNRhoR() throws Exception {
        Spectrum s = ShotFactory.syntheticSpectrum("slow", 1e8, 1.0, 0.1, 0.5, 1.5, 41, 0.03, 3L);
        AnalysisRecord r = analyzer().analyze(AnalysisRequest.of(s));
        // энергия ниже таблицы: ρR и Rcm не определены, спектральные поля заполнены
        assertTrue(Double.isFinite(r.get(ENERGY)));
        assertTrue(Double.isNaN(r.get(RHOR)) || r.get(RHOR) > 0.0);
        if (Double.isNaN(r.get(RHOR))) {
            assertTrue(r.getIssues().contains(ErrorKind.OUT_OF_RANGE_INPUT), r.getIssues().toString());
        }
        assertEquals(KEYS.size(), r.asMap().size());

        // пик у верхнего края таблицы: E + dE вне таблицы, погрешности остаются конечными
        Spectrum fast = ShotFactory.syntheticSpectrum("fast", 1e8, 14.0, 0.3, 12.5, 15.5, 61, 0.03, 5L);
        AnalysisRecord edge = analyzer().analyze(AnalysisRequest.of(fast)
                .withErrors(RANDOM, new double[]{2e6, 1.0, 0.03}));
        assertTrue(Double.isFinite(edge.get(RHOR)), "rhoR=" + edge.get(RHOR));
        assertTrue(Double.isFinite(edge.get(RHOR_SYS_UNC)), "rhoR sys=" + edge.get(RHOR_SYS_UNC));
        assertTrue(Double.isFinite(edge.get(RCM_SYS_UNC)), "Rcm sys=" + edge.get(RCM_SYS_UNC));
        assertTrue(edge.get(RHOR_SYS_UNC) >= edge.get(RHOR_MODEL_UNC));
        assertTrue(edge.get(RCM_SYS_UNC) >= edge.get(RCM_MODEL_UNC));
    }

    @Test
    void unknownKeyIsRejected() throws Exception {
        AnalysisRecord r = analyzer().analyze(AnalysisRequest.of(raw()));
        assertThrows(NoSuchElementException.class, () -> r.get("rhoR_total"));
        assertThrows(UnsupportedOperationException.class, () -> r.asMap().put(RHOR, 0.0));
    }

    @Test
    void requestValidation() {
        AnalysisRequest req = AnalysisRequest.of(raw());
        assertThrows(IllegalArgumentException.class, () -> req.withErrors(new double[]{1, 2}, new double[3]));
        assertThrows(IllegalArgumentException.class, () -> req.withErrors(new double[]{-1, 0, 0}, new double[3]));
        assertThrows(IllegalArgumentException.class, () -> req.withFitGuess(new double[]{1, 2}));
        assertThrows(NullPointerException.class, () -> req.withWall(null, new LineOfSight(40, 50)));
        assertFalse(req.hasWall());
        assertFalse(req.hasThickness());
        assertTrue(req.withThickness(1, 0, 0).hasThickness());
    }
}
