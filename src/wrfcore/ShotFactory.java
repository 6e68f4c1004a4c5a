package wrfcore;

import wrfcore.config.*;
import wrfcore.hohlraum.WallGeometry;
import wrfcore.hohlraum.WallPoint;
import wrfcore.io.SpectrumCsvLoader;
import wrfcore.io.WallGeometryLoader;
import wrfcore.physics.WallMaterial;
import wrfcore.spectrum.GaussFitResult;
import wrfcore.spectrum.Spectrum;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public final class ShotFactory {

    private ShotFactory() {}

    public static LoadedShot load(Path spectrumPath, Path wallPath) throws IOException {
        Spectrum spectrum = new SpectrumCsvLoader().load(spectrumPath);
        WallGeometry wall = (wallPath == null) ? null : new WallGeometryLoader().load(wallPath);
        return new LoadedShot(spectrum, wall);
    }

    /** Номинальная капсула: CH, Ri=900 мкм, Ro=1100 мкм, D:3He = 0.3:0.7, 50 атм. */
    public static ShellModelParameters defaultParams() {
        return new ShellModelParameters(
                "CH",
                0.09, 0.11,
                0.3, 0.7, 50,
                3, 0.2, 0.3, 0.5,
                1.5, 0.1, 70e-4,
                0.005,
                40e-4, 0.175,
                14.7,
                DedxModel.LI_PETRASSO,
                null
        );
    }

    public static CorrectionOptions defaultCorrectionOptions() {
        return CorrectionOptions.defaults();
    }

    /**
     * Синтетический спектр: Гаусс (A, μ, σ) на n бинах в [eMin, eMax] с равномерным шумом
     * ±relNoise·(G + 1% пика). Погрешность бина равна СКО этого шума, поэтому chi2/N ≈ 1.
     */
    public static Spectrum syntheticSpectrum(String name,
                                             double amplitude, double mean, double sigma,
                                             double eMin, double eMax, int n,
                                             double relNoise, long seed) {
        Random rnd = new Random(seed);
        double peak = GaussFitResult.gaussian(mean, amplitude, mean, sigma);
        double step = (eMax - eMin) / (n - 1);

        double[] e = new double[n];
        double[] y = new double[n];
        double[] err = new double[n];
        for (int i = 0; i < n; i++) {
            e[i] = eMin + i * step;
            double g = GaussFitResult.gaussian(e[i], amplitude, mean, sigma);
            double scale = relNoise * (g + 0.01 * peak);
            y[i] = g + scale * (2.0 * rnd.nextDouble() - 1.0);
            err[i] = scale / Math.sqrt(3.0);
        }
        return Spectrum.of(name, e, y, err);
    }

    /**
     * Цилиндрическая стенка: слои Au, DU, Al (мкм) снаружи радиуса rInnerCm,
     * каждый слой - два вертикальных контура на отрезке z ∈ [zMin, zMax].
     * Слой нулевой толщины пропускается.
     */
    public static WallGeometry cylindricalWall(double rInnerCm,
                                               double auUm, double duUm, double alUm,
                                               double zMin, double zMax) {
        List<WallPoint> points = new ArrayList<>();
        double r = rInnerCm;
        int layer = 0;
        WallMaterial[] materials = {WallMaterial.AU, WallMaterial.DU, WallMaterial.AL};
        double[] thickness = {auUm, duUm, alUm};
        for (int m = 0; m < 3; m++) {
            if (!(thickness[m] > 0.0)) continue;
            double rOut = r + thickness[m] * 1e-4;
            addContour(points, layer++, materials[m], r, zMin, zMax);
            addContour(points, layer++, materials[m], rOut, zMin, zMax);
            r = rOut;
        }
        return new WallGeometry(points);
    }

    private static void addContour(List<WallPoint> points, int layer, WallMaterial m, double r, double zMin, double zMax) {
        points.add(new WallPoint(layer, m, r, zMin));
        points.add(new WallPoint(layer, m, r, 0.5 * (zMin + zMax)));
        points.add(new WallPoint(layer, m, r, zMax));
    }

    public record LoadedShot(Spectrum spectrum, WallGeometry wall) {}
}
