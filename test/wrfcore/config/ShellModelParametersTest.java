package wrfcore.config;

import org.junit.jupiter.api.Test;
import wrfcore.ShotFactory;

import static org.junit.jupiter.api.Assertions.*;

class ShellModelParametersTest {

    @Test
    void builderCopiesEveryField() {
        ShellModelParameters base = ShotFactory.defaultParams();
        ShellModelParameters copy = ShellModelParametersBuilder.from(base).build();
        for (ShellParamId id : ShellParamId.values()) {
            assertEquals(base.value(id), copy.value(id), id.name());
            assertEquals(base.getUncertainty(id), copy.getUncertainty(id), id.name());
        }
        assertEquals(base.getShellMaterial(), copy.getShellMaterial());
        assertEquals(base.getE0(), copy.getE0());
        assertEquals(base.getDedxModel(), copy.getDedxModel());
    }

    @Test
    void missingUncertaintiesTakePoolDefaults() {
        ShellModelParameters p = ShotFactory.defaultParams();
        for (ShellParameter sp : ShellParameterPool.all()) {
            assertEquals(sp.getDefaultUncertainty(), p.getUncertainty(sp.getId()), sp.getName());
        }
    }

    @Test
    void shiftedChangesOnlyOneParameter() {
        ShellModelParameters base = ShotFactory.defaultParams();
        ShellModelParameters shifted = ShellParameterPool.get(ShellParamId.P0).shifted(base, 5.0);

        assertEquals(55.0, shifted.getP0(), 1e-12);
        for (ShellParamId id : ShellParamId.values()) {
            if (id != ShellParamId.P0) assertEquals(base.value(id), shifted.value(id), id.name());
        }
        // исходный объект не меняется
        assertEquals(50.0, base.getP0(), 1e-12);
    }

    @Test
    void everyPoolEntryAppliesToItsOwnParameter() {
        ShellModelParameters base = ShotFactory.defaultParams();
        for (ShellParamId id : ShellParamId.values()) {
            double delta = 1e-3 * Math.max(1e-3, Math.abs(base.value(id)));
            ShellModelParameters s = ShellParameterPool.get(id).shifted(base, delta);
            assertEquals(base.value(id) + delta, s.value(id), 1e-12, id.name());
        }
    }

    @Test
    void invalidShiftIsRejected() {
        ShellModelParameters base = ShotFactory.defaultParams();
        ShellParameter te = ShellParameterPool.get(ShellParamId.TE_GAS);
        assertThrows(IllegalArgumentException.class, () -> te.shifted(base, -10.0));
        ShellParameter ro = ShellParameterPool.get(ShellParamId.RO);
        assertThrows(IllegalArgumentException.class, () -> ro.shifted(base, -0.05));
    }

    @Test
    void uncertaintyOverrideAndValidation() {
        ShellModelParameters p = ShellModelParametersBuilder.from(ShotFactory.defaultParams())
                .setUncertainty(ShellParamId.P0, 3.0)
                .build();
        assertEquals(3.0, p.getUncertainty(ShellParamId.P0));

        assertThrows(IllegalArgumentException.class, () -> ShellModelParametersBuilder.from(p)
                .setUncertainty(ShellParamId.P0, -1.0)
                .build());
        assertThrows(IllegalArgumentException.class, () -> ShellModelParametersBuilder.from(p)
                .setMRem(1.5)
                .build());
    }

    @Test
    void optionsDefaultsAndLimits() {
        FitOptions f = FitOptions.defaults();
        assertFalse(f.hasLimits());
        assertTrue(f.accepts(1.0));

        FitOptions limited = f.withLimits(8.0, 12.0);
        assertTrue(limited.hasLimits());
        assertTrue(limited.accepts(10.0));
        assertFalse(limited.accepts(7.9));
        assertFalse(limited.accepts(12.1));
        assertThrows(IllegalArgumentException.class, () -> f.withLimits(12.0, 8.0));

        CorrectionOptions c = CorrectionOptions.defaults();
        assertEquals(1.0, c.getDAuUm());
        assertEquals(1.0, c.getDDuUm());
        assertEquals(3.0, c.getDAlUm());
        assertEquals(0.0, c.getBumpAuUm());
    }
}
