package wrfcore.spectrum;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import wrfcore.config.AnalysisConstants;
import wrfcore.config.FitOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Фит спектра гауссианой минимизацией chi2 симплекс-методом Нелдера-Мида.
 * <p>
 * chi2 = Σ (G(x_i; A, μ, σ) - y_i)² / err_i². Бины с нулевой погрешностью и бины вне
 * энергетических границ не учитываются. При restrictChi2 сумма берётся только по бинам
 * в пределах 5σ от текущего среднего.
 * <p>
 * Асимметричная погрешность: для каждого параметра и каждого знака ищется сдвиг, при котором
 * chi2 (с переоптимизацией двух других параметров) вырастает ровно на 1.
 */
public final class GaussianFitter {

    public static final int AMPLITUDE = 0;
    public static final int MEAN = 1;
    public static final int SIGMA = 2;

    /** Минимум бинов в окне ±5σ; при меньшем числе chi2 считается бесконечным */
    private static final int MIN_BINS_IN_WINDOW = 3;

    /** Потолок функции в одномерном поиске (вместо бесконечного chi2) */
    private static final double DELTA_CHI2_CAP = 1e12;

    private static final double SIMPLEX_REL_TOL = 1e-10;
    private static final double SIMPLEX_ABS_TOL = 1e-12;

    private final Spectrum spectrum;
    private final FitOptions options;

    // бины, участвующие в фите
    private final double[] x;
    private final double[] y;
    private final double[] err;

    public GaussianFitter(Spectrum spectrum, FitOptions options) {
        this.spectrum = Objects.requireNonNull(spectrum, "spectrum");
        this.options = Objects.requireNonNull(options, "options");

        List<SpectrumBin> used = new ArrayList<>();
        for (SpectrumBin b : spectrum.getBins()) {
            if (b.error() > 0.0 && options.accepts(b.energy())) used.add(b);
        }
        if (used.size() < 3) {
            throw new IllegalArgumentException("need at least 3 bins with non-zero error inside fit limits, got "
                    + used.size() + " in " + spectrum);
        }
        int n = used.size();
        this.x = new double[n];
        this.y = new double[n];
        this.err = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = used.get(i).energy();
            y[i] = used.get(i).yield();
            err[i] = used.get(i).error();
        }
    }

    public GaussianFitter(Spectrum spectrum) {
        this(spectrum, FitOptions.defaults());
    }

    /** Фит с начальным приближением из настроек. */
    public GaussFitResult fit() {
        return fit(options.getInitialGuess());
    }

    /**
     * Фит с заданным начальным приближением [A, μ, σ].
     * Если симплекс не сошёлся за отведённое число вычислений, возвращается лучшая найденная точка
     * с признаком {@code converged == false}.
     */
    public GaussFitResult fit(double[] guess) {
        if (guess == null || guess.length != 3) {
            throw new IllegalArgumentException("guess must have 3 elements: A, mean, sigma");
        }
        MultivariateFunction objective = p -> chi2(p[AMPLITUDE], p[MEAN], p[SIGMA]);

        Minimum m = minimize(objective, guess, initialSteps(guess));
        if (m.converged()) {
            // повторный запуск из найденной точки: симплекс иногда останавливается раньше времени
            m = minimize(objective, m.point(), initialSteps(m.point()));
        }
        double[] p = m.point();

        if (options.isVerbose()) {
            System.out.printf("Gauss fit %s: A=%.4e mu=%.4f sigma=%.4f chi2=%.3f%n",
                    spectrum.getName(), p[AMPLITUDE], p[MEAN], p[SIGMA], m.value());
        }
        return new GaussFitResult(p[AMPLITUDE], p[MEAN], p[SIGMA],
                chi2(p[AMPLITUDE], p[MEAN], p[SIGMA]), x.length, m.converged(), null);
    }

    /** Фит и асимметричная погрешность за один вызов. */
    public GaussFitResult fitWithUncertainty(double[] guess) {
        GaussFitResult r = fit(guess);
        return r.withUncertainty(uncertainty(r));
    }

    /** Фит спектра с настройками по умолчанию. */
    public static GaussFitResult fit(Spectrum spectrum, double[] guess) {
        return new GaussianFitter(spectrum).fit(guess);
    }

    // =========================================================================
    // chi2
    // =========================================================================

    public double chi2(double a, double mu, double sigma) {
        if (!(sigma > 0.0) || !Double.isFinite(a) || !Double.isFinite(mu) || !Double.isFinite(sigma)) {
            return Double.POSITIVE_INFINITY;
        }
        double sum = 0.0;
        int used = 0;
        for (int i = 0; i < x.length; i++) {
            if (options.isRestrictChi2()
                    && Math.abs(x[i] - mu) / sigma > AnalysisConstants.CHI2_RESTRICT_SIGMAS) {
                continue;
            }
            double r = (GaussFitResult.gaussian(x[i], a, mu, sigma) - y[i]) / err[i];
            sum += r * r;
            used++;
        }
        if (options.isRestrictChi2() && used < MIN_BINS_IN_WINDOW) return Double.POSITIVE_INFINITY;
        return sum;
    }

    public double chi2(double[] p) {
        return chi2(p[AMPLITUDE], p[MEAN], p[SIGMA]);
    }

    /** chi2 / (N - 3), N - число бинов, участвующих в фите; NaN, если бинов не больше трёх. */
    public double reducedChi2(double[] p) {
        return (x.length > 3) ? chi2(p) / (x.length - 3) : Double.NaN;
    }

    public int binsUsed() {
        return x.length;
    }

    // =========================================================================
    // Погрешность
    // =========================================================================

    /**
     * Асимметричная погрешность [[-A, +A], [-μ, +μ], [-σ, +σ]].
     * Границы поиска сдвига: [0, A] для амплитуды, [0, σ] для среднего и ширины.
     * Если на границе chi2 не вырос на 1, погрешность равна границе.
     */
    public double[][] uncertainty(GaussFitResult fit) {
        double[] best = fit.getParameters();
        double chi2Best = chi2(best);
        double[] bounds = searchBounds(best);

        double[][] out = new double[3][2];
        for (int k = 0; k < 3; k++) {
            for (int s = 0; s < 2; s++) {
                double sign = (s == 0) ? -1.0 : 1.0;
                out[k][s] = sign * searchOffset(best, chi2Best, k, sign, bounds[k]);
            }
        }
        if (options.isVerbose()) {
            System.out.printf("Gauss fit %s uncertainty: A[%.3e, %.3e] mu[%.4f, %.4f] sigma[%.4f, %.4f]%n",
                    spectrum.getName(), out[0][0], out[0][1], out[1][0], out[1][1], out[2][0], out[2][1]);
        }
        return out;
    }

    static double[] searchBounds(double[] best) {
        return new double[]{
                Math.abs(best[AMPLITUDE]),
                Math.abs(best[SIGMA]),
                Math.abs(best[SIGMA])
        };
    }

    private double searchOffset(double[] best, double chi2Best, int k, double sign, double bound) {
        if (!(bound > 0.0)) return 0.0;

        UnivariateFunction f = d -> Math.min(
                deltaChi2(best, chi2Best, k, sign * d) - AnalysisConstants.DELTA_CHI2_ONE_SIGMA,
                DELTA_CHI2_CAP);

        double fLo = f.value(0.0);
        if (fLo >= 0.0) return 0.0;
        double fHi = f.value(bound);
        // нет смены знака - упираемся в границу
        if (!(fHi > 0.0)) return bound;

        BrentSolver solver = new BrentSolver(bound * 1e-6);
        try {
            return solver.solve(AnalysisConstants.SEARCH_MAX_EVAL, f, 0.0, bound);
        } catch (TooManyEvaluationsException e) {
            System.err.printf("Gauss fit %s: uncertainty search for parameter %d did not converge, using bound %.4g%n",
                    spectrum.getName(), k, bound);
            return bound;
        }
    }

    /**
     * Прирост chi2 при сдвиге параметра k на offset с переоптимизацией двух других.
     */
    private double deltaChi2(double[] best, double chi2Best, int k, double offset) {
        int i1 = (k + 1) % 3;
        int i2 = (k + 2) % 3;
        double fixed = best[k] + offset;
        // σ = 0 на границе поиска: chi2 не определён
        if (k == SIGMA && !(fixed > 0.0)) return Double.POSITIVE_INFINITY;

        MultivariateFunction reduced = q -> {
            double[] p = new double[3];
            p[k] = fixed;
            p[i1] = q[0];
            p[i2] = q[1];
            return chi2(p);
        };
        double[] start = {best[i1], best[i2]};
        double[] steps = {stepFor(i1, best), stepFor(i2, best)};

        Minimum m = minimize(reduced, start, steps);
        return m.value() - chi2Best;
    }

    // =========================================================================
    // Симплекс
    // =========================================================================

    private Minimum minimize(MultivariateFunction f, double[] start, double[] steps) {
        BestPointTracker tracked = new BestPointTracker(f);
        SimplexOptimizer optimizer = new SimplexOptimizer(SIMPLEX_REL_TOL, SIMPLEX_ABS_TOL);
        try {
            PointValuePair p = optimizer.optimize(
                    new MaxEval(options.getMaxEvaluations()),
                    new ObjectiveFunction(tracked),
                    GoalType.MINIMIZE,
                    new InitialGuess(start),
                    new NelderMeadSimplex(steps));
            return new Minimum(p.getPoint(), p.getValue(), true);
        } catch (TooManyEvaluationsException e) {
            System.err.printf("Gauss fit %s: simplex did not converge in %d evaluations, keeping best point%n",
                    spectrum.getName(), options.getMaxEvaluations());
            double[] bp = tracked.bestPoint();
            return (bp != null)
                    ? new Minimum(bp, tracked.bestValue(), false)
                    : new Minimum(start.clone(), f.value(start), false);
        }
    }

    private static double[] initialSteps(double[] p) {
        return new double[]{stepFor(AMPLITUDE, p), stepFor(MEAN, p), stepFor(SIGMA, p)};
    }

    private static double stepFor(int k, double[] p) {
        double sigma = Math.abs(p[SIGMA]);
        double step = switch (k) {
            case AMPLITUDE -> 0.1 * Math.abs(p[AMPLITUDE]);
            case MEAN, SIGMA -> 0.1 * sigma;
            default -> throw new IllegalArgumentException("parameter index " + k);
        };
        return (step > 0.0) ? step : 0.1;
    }

    private record Minimum(double[] point, double value, boolean converged) {
    }

    /** Запоминает лучшую точку, чтобы вернуть её при исчерпании лимита вычислений. */
    private static final class BestPointTracker implements MultivariateFunction {

        private final MultivariateFunction delegate;
        private double[] bestPoint;
        private double bestValue = Double.POSITIVE_INFINITY;

        BestPointTracker(MultivariateFunction delegate) {
            this.delegate = delegate;
        }

        @Override
        public double value(double[] point) {
            double v = delegate.value(point);
            if (v < bestValue) {
                bestValue = v;
                bestPoint = point.clone();
            }
            return v;
        }

        double[] bestPoint() {
            return bestPoint;
        }

        double bestValue() {
            return bestValue;
        }
    }

    /**
     * Начальное приближение по моментам спектра: полный выход, среднее и СКО энергии.
     * Отрицательные выходы не учитываются.
     */
    public static double[] momentGuess(Spectrum spectrum) {
        double s0 = 0.0, s1 = 0.0, s2 = 0.0, total = 0.0;
        for (int i = 0; i < spectrum.size(); i++) {
            SpectrumBin b = spectrum.get(i);
            double w = Math.max(b.yield(), 0.0);
            s0 += w;
            s1 += w * b.energy();
            s2 += w * b.energy() * b.energy();
            total += w * spectrum.binWidth(i);
        }
        if (!(s0 > 0.0)) return FitOptions.DEFAULT_GUESS.clone();
        double mean = s1 / s0;
        double var = s2 / s0 - mean * mean;
        double sigma = (var > 0.0) ? Math.sqrt(var) : spectrum.binWidth(0);
        return new double[]{total, mean, sigma};
    }
}
