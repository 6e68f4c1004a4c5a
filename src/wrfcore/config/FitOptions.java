package wrfcore.config;

import java.util.Locale;

/**
 * Настройки фита Гаусса (immutable).
 */
public final class FitOptions {

    /** Начальное приближение [A, μ, σ] по умолчанию */
    public static final double[] DEFAULT_GUESS = {5e7, 10.0, 1.0};

    /** Считать chi2 только по бинам в окне ±5σ вокруг текущего среднего */
    private final boolean restrictChi2;

    /** Нижняя граница энергии для фита, МэВ (NaN - без ограничения) */
    private final double minEnergy;

    /** Верхняя граница энергии для фита, МэВ (NaN - без ограничения) */
    private final double maxEnergy;

    /** Начальное приближение [A, μ, σ] */
    private final double[] initialGuess;

    /** Максимум вычислений chi2 в симплекс-методе */
    private final int maxEvaluations;

    /** Печатать ли диагностику */
    private final boolean verbose;

    public FitOptions(boolean restrictChi2,
                      double minEnergy,
                      double maxEnergy,
                      double[] initialGuess,
                      int maxEvaluations,
                      boolean verbose) {
        if (initialGuess == null || initialGuess.length != 3) {
            throw new IllegalArgumentException("initialGuess must have 3 elements: A, mean, sigma");
        }
        if (!(initialGuess[2] > 0.0)) throw new IllegalArgumentException("initial sigma must be > 0");
        if (!Double.isNaN(minEnergy) && !Double.isNaN(maxEnergy) && maxEnergy <= minEnergy) {
            throw new IllegalArgumentException("maxEnergy <= minEnergy: " + minEnergy + ".." + maxEnergy);
        }
        if (maxEvaluations <= 0) throw new IllegalArgumentException("maxEvaluations must be > 0");
        this.restrictChi2 = restrictChi2;
        this.minEnergy = minEnergy;
        this.maxEnergy = maxEnergy;
        this.initialGuess = initialGuess.clone();
        this.maxEvaluations = maxEvaluations;
        this.verbose = verbose;
    }

    public static FitOptions defaults() {
        return new FitOptions(true, Double.NaN, Double.NaN, DEFAULT_GUESS,
                AnalysisConstants.SIMPLEX_MAX_EVAL, false);
    }

    public FitOptions withLimits(double minEnergy, double maxEnergy) {
        return new FitOptions(restrictChi2, minEnergy, maxEnergy, initialGuess, maxEvaluations, verbose);
    }

    public FitOptions withInitialGuess(double[] guess) {
        return new FitOptions(restrictChi2, minEnergy, maxEnergy, guess, maxEvaluations, verbose);
    }

    public FitOptions withRestrictChi2(boolean restrict) {
        return new FitOptions(restrict, minEnergy, maxEnergy, initialGuess, maxEvaluations, verbose);
    }

    public boolean isRestrictChi2() { return restrictChi2; }
    public double getMinEnergy() { return minEnergy; }
    public double getMaxEnergy() { return maxEnergy; }
    public double[] getInitialGuess() { return initialGuess.clone(); }
    public int getMaxEvaluations() { return maxEvaluations; }
    public boolean isVerbose() { return verbose; }

    public boolean hasLimits() {
        return !Double.isNaN(minEnergy) || !Double.isNaN(maxEnergy);
    }

    /** Входит ли энергия в диапазон фита. */
    public boolean accepts(double energy) {
        if (!Double.isNaN(minEnergy) && energy < minEnergy) return false;
        return Double.isNaN(maxEnergy) || energy <= maxEnergy;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "restrictChi2=%s limits=[%.3f, %.3f] guess=[%.3e, %.3f, %.3f]",
                restrictChi2, minEnergy, maxEnergy, initialGuess[0], initialGuess[1], initialGuess[2]);
    }
}
