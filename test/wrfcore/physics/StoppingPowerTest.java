package wrfcore.physics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoppingPowerTest {

    @Test
    void coldMatterLosesEnergyMonotonicallyWithThickness() {
        StoppingPower au = ColdMatterStoppingPower.gold();
        double prev = 12.0;
        for (double x : new double[]{5, 10, 20, 40, 80}) {
            double e = au.eout(12.0, x);
            assertTrue(e >= 0.0);
            assertTrue(e < prev, "Eout must decrease with thickness: x=" + x);
            prev = e;
        }
    }

    @Test
    void zeroThicknessKeepsEnergy() {
        StoppingPower al = ColdMatterStoppingPower.aluminum();
        assertEquals(10.0, al.eout(10.0, 0.0));
        assertEquals(10.0, al.ein(10.0, 0.0));
    }

    @Test
    void protonRangesOutInThickAluminum() {
        StoppingPower al = ColdMatterStoppingPower.aluminum();
        assertEquals(0.0, al.eout(3.0, 1000.0));
    }

    @Test
    void einInvertsEout() {
        StoppingPowerLibrary lib = StoppingPowerLibrary.coldMatter();
        for (WallMaterial m : WallMaterial.values()) {
            StoppingPower sp = lib.get(m);
            double out = sp.eout(12.0, 15.0);
            assertEquals(12.0, sp.ein(out, 15.0), 1e-4, m.getLabel());
        }
    }

    @Test
    void dedxIsNegativeInsideRange() {
        StoppingPower du = ColdMatterStoppingPower.depletedUranium();
        assertTrue(du.dEdx(5.0) < 0.0);
        assertTrue(du.dEdx(0.5) < 0.0);
        assertEquals(0.0, du.dEdx(0.0));
    }

    @Test
    void plasmaStopsProtonsAndRespectsRangeOut() {
        // водородная плазма 1 кэВ, 1e24 1/см³
        double me = PhysicalConstants.ME / PhysicalConstants.MP;
        StoppingPower lp = LiPetrassoStoppingPower.forProtons(
                new double[]{1.0, me}, new double[]{1.0, -1.0},
                new double[]{1.0, 1.0}, new double[]{1e24, 1e24});

        assertTrue(lp.dEdx(10.0) < 0.0);
        double thin = lp.eout(14.7, 10.0);
        double thick = lp.eout(14.7, 100.0);
        assertTrue(thin < 14.7);
        assertTrue(thick < thin);
        assertTrue(lp.eout(14.7, 1e7) == 0.0);
    }

    @Test
    void plasmaRejectsMismatchedSpecies() {
        assertThrows(IllegalArgumentException.class, () -> LiPetrassoStoppingPower.forProtons(
                new double[]{1.0}, new double[]{1.0, 2.0}, new double[]{1.0}, new double[]{1e24}));
    }

    @Test
    void tableIsLoadedAndInterpolated(@TempDir Path dir) throws IOException {
        Path f = dir.resolve("al.txt");
        Files.writeString(f, "# E(keV) S(keV/um)\n1000, 40\n5000;20\n10000 10\n");

        TabulatedStoppingPower t = TabulatedStoppingPower.load("Al", f);
        assertEquals(1.0, t.getEmin(), 1e-12);
        assertEquals(10.0, t.getEmax(), 1e-12);
        assertEquals(-0.015, t.dEdx(7.5), 1e-12);
        assertTrue(t.eout(10.0, 50.0) < 10.0);
    }

    @Test
    void badTableLineReportsLineNumber(@TempDir Path dir) throws IOException {
        Path f = dir.resolve("bad.txt");
        Files.writeString(f, "1000 40\nabc 20\n");
        IOException e = assertThrows(IOException.class, () -> TabulatedStoppingPower.load("Au", f));
        assertTrue(e.getMessage().contains("2"));
    }

    @Test
    void libraryFromTablesMapsMaterials(@TempDir Path dir) throws IOException {
        Path al = dir.resolve("al.txt");
        Path du = dir.resolve("du.txt");
        Path au = dir.resolve("au.txt");
        Files.writeString(al, "1000 10\n20000 5\n");
        Files.writeString(du, "1000 30\n20000 15\n");
        Files.writeString(au, "1000 40\n20000 20\n");

        StoppingPowerLibrary lib = StoppingPowerLibrary.fromTables(al, du, au);
        assertSame(lib.getAluminum(), lib.get(WallMaterial.AL));
        assertSame(lib.getUranium(), lib.get(WallMaterial.DU));
        assertSame(lib.getGold(), lib.get(WallMaterial.AU));
        assertTrue(lib.get(WallMaterial.AU).dEdx(10.0) < lib.get(WallMaterial.AL).dEdx(10.0));
    }
}
