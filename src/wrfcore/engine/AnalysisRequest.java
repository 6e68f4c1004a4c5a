package wrfcore.engine;

import wrfcore.config.CorrectionOptions;
import wrfcore.hohlraum.LineOfSight;
import wrfcore.hohlraum.WallGeometry;
import wrfcore.spectrum.Spectrum;

import java.util.Objects;

/**
 * Входные данные анализа одного спектра (immutable).
 * <p>
 * Поправка на стенку: геометрия стенки + LOS, либо явные толщины, либо ничего.
 * Геометрия имеет приоритет над толщинами.
 */
public final class AnalysisRequest {

    /** Сырой спектр (после стенки) */
    private final Spectrum spectrum;

    /** Случайные 1σ погрешности спектра [dY, dE, dσ] */
    private final double[] random;

    /** Систематические погрешности спектра [dY, dE, dσ] */
    private final double[] systematic;

    /** Геометрия стенки хольраума или null */
    private final WallGeometry wall;

    /** Диапазон углов линии наблюдения (нужен вместе с wall) */
    private final LineOfSight los;

    /** Явные толщины [Au, DU, Al], мкм, или null */
    private final double[] thicknessUm;

    /** Поправка на стенку и настройки фитов */
    private final CorrectionOptions options;

    /** Добавлять ли погрешность фита по chi2 к случайной погрешности */
    private final boolean addFitUncertainty;

    /** Начальное приближение фита; null - по моментам спектра */
    private final double[] fitGuess;

    private AnalysisRequest(Spectrum spectrum,
                            double[] random,
                            double[] systematic,
                            WallGeometry wall,
                            LineOfSight los,
                            double[] thicknessUm,
                            CorrectionOptions options,
                            boolean addFitUncertainty,
                            double[] fitGuess) {
        this.spectrum = Objects.requireNonNull(spectrum, "spectrum");
        this.random = checkTriple(random, "random");
        this.systematic = checkTriple(systematic, "systematic");
        if (wall != null && los == null) {
            throw new IllegalArgumentException("wall geometry requires a line of sight");
        }
        this.wall = wall;
        this.los = los;
        this.thicknessUm = (thicknessUm == null) ? null : checkTriple(thicknessUm, "thickness");
        this.options = Objects.requireNonNull(options, "options");
        this.addFitUncertainty = addFitUncertainty;
        if (fitGuess != null && fitGuess.length != 3) {
            throw new IllegalArgumentException("fit guess must be [Y, E, sigma]");
        }
        this.fitGuess = (fitGuess == null) ? null : fitGuess.clone();
    }

    /** Спектр без поправки на стенку, без погрешностей спектра. */
    public static AnalysisRequest of(Spectrum spectrum) {
        return new AnalysisRequest(spectrum, new double[3], new double[3], null, null, null,
                CorrectionOptions.defaults(), false, null);
    }

    private static double[] checkTriple(double[] v, String what) {
        if (v == null || v.length != 3) {
            throw new IllegalArgumentException(what + " must have 3 components");
        }
        for (double x : v) {
            if (!(x >= 0.0)) throw new IllegalArgumentException(what + " components must be >= 0");
        }
        return v.clone();
    }

    public AnalysisRequest withErrors(double[] random, double[] systematic) {
        return new AnalysisRequest(spectrum, random, systematic, wall, los, thicknessUm, options, addFitUncertainty, fitGuess);
    }

    public AnalysisRequest withWall(WallGeometry wall, LineOfSight los) {
        return new AnalysisRequest(spectrum, random, systematic, Objects.requireNonNull(wall, "wall"),
                Objects.requireNonNull(los, "los"), thicknessUm, options, addFitUncertainty, fitGuess);
    }

    public AnalysisRequest withThickness(double auUm, double duUm, double alUm) {
        return new AnalysisRequest(spectrum, random, systematic, wall, los, new double[]{auUm, duUm, alUm},
                options, addFitUncertainty, fitGuess);
    }

    public AnalysisRequest withOptions(CorrectionOptions options) {
        return new AnalysisRequest(spectrum, random, systematic, wall, los, thicknessUm, options, addFitUncertainty, fitGuess);
    }

    public AnalysisRequest withFitUncertainty(boolean add) {
        return new AnalysisRequest(spectrum, random, systematic, wall, los, thicknessUm, options, add, fitGuess);
    }

    public AnalysisRequest withFitGuess(double[] guess) {
        return new AnalysisRequest(spectrum, random, systematic, wall, los, thicknessUm, options, addFitUncertainty, guess);
    }

    // --------- геттеры ---------

    public Spectrum getSpectrum() { return spectrum; }
    public double[] getRandom() { return random.clone(); }
    public double[] getSystematic() { return systematic.clone(); }
    public WallGeometry getWall() { return wall; }
    public LineOfSight getLos() { return los; }
    public double[] getThicknessUm() { return (thicknessUm == null) ? null : thicknessUm.clone(); }
    public CorrectionOptions getOptions() { return options; }
    public boolean isAddFitUncertainty() { return addFitUncertainty; }
    public double[] getFitGuess() { return (fitGuess == null) ? null : fitGuess.clone(); }

    public boolean hasWall() {
        return wall != null;
    }

    public boolean hasThickness() {
        return thicknessUm != null;
    }
}
