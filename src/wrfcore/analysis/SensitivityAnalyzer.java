// File: wrfcore/analysis/SensitivityAnalyzer.java
package wrfcore.analysis;

import wrfcore.config.AnalysisConstants;
import wrfcore.config.ShellModelParameters;
import wrfcore.config.ShellParamId;
import wrfcore.config.ShellParameter;
import wrfcore.config.ShellParameterPool;
import wrfcore.engine.ErrorKind;
import wrfcore.engine.Result;
import wrfcore.model.ForwardRhoRModel;
import wrfcore.model.InverseRhoRSolver;
import wrfcore.model.RhoRSolution;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Анализ чувствительности модели ρR "по одному параметру".
 * <p>
 * Для каждого параметра с ненулевой 1σ строятся две модели: (номинал - σ) и (номинал + σ),
 * остальные параметры номинальные. Погрешность величины от параметра - половина разброса
 * {номинал, -σ, +σ}; полная погрешность модели - корень из суммы квадратов.
 * Если хотя бы одно из трёх значений NaN, параметр в сумму не входит.
 */
public final class SensitivityAnalyzer {

    private final ShellModelParameters params;
    private final InverseRhoRSolver nominal;

    /** [0] = -σ, [1] = +σ; только для параметров с σ > 0 */
    private final EnumMap<ShellParamId, List<Result<InverseRhoRSolver>>> perturbed;

    private final boolean verbose;

    private SensitivityAnalyzer(ShellModelParameters params,
                                InverseRhoRSolver nominal,
                                EnumMap<ShellParamId, List<Result<InverseRhoRSolver>>> perturbed,
                                boolean verbose) {
        this.params = params;
        this.nominal = nominal;
        this.perturbed = perturbed;
        this.verbose = verbose;
    }

    /** Последовательное построение всех моделей. */
    public static SensitivityAnalyzer build(ShellModelParameters params, boolean verbose) {
        Objects.requireNonNull(params, "params");
        InverseRhoRSolver nominal = new InverseRhoRSolver(new ForwardRhoRModel(params), verbose);

        EnumMap<ShellParamId, List<Result<InverseRhoRSolver>>> perturbed = new EnumMap<>(ShellParamId.class);
        for (ShellParamId id : ShellParamId.values()) {
            double sigma = params.getUncertainty(id);
            if (sigma <= 0.0) continue;
            List<Result<InverseRhoRSolver>> pair = new ArrayList<>(2);
            pair.add(buildPerturbed(params, id, -sigma));
            pair.add(buildPerturbed(params, id, +sigma));
            perturbed.put(id, pair);
        }
        return new SensitivityAnalyzer(params, nominal, perturbed, verbose);
    }

    public static SensitivityAnalyzer build(ShellModelParameters params) {
        return build(params, false);
    }

    /**
     * Построение моделей параллельно на переданном пуле. Результаты совпадают с последовательным
     * построением: каждая модель строится независимо, порядок суммирования фиксирован.
     */
    public static SensitivityAnalyzer build(ShellModelParameters params,
                                            ExecutorService executor,
                                            boolean verbose)
            throws InterruptedException, ExecutionException {
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(executor, "executor");

        Future<InverseRhoRSolver> nominalFuture =
                executor.submit(() -> new InverseRhoRSolver(new ForwardRhoRModel(params), verbose));

        Map<ShellParamId, List<Future<Result<InverseRhoRSolver>>>> futures = new EnumMap<>(ShellParamId.class);
        for (ShellParamId id : ShellParamId.values()) {
            double sigma = params.getUncertainty(id);
            if (sigma <= 0.0) continue;
            List<Future<Result<InverseRhoRSolver>>> pair = new ArrayList<>(2);
            pair.add(executor.submit(() -> buildPerturbed(params, id, -sigma)));
            pair.add(executor.submit(() -> buildPerturbed(params, id, +sigma)));
            futures.put(id, pair);
        }

        InverseRhoRSolver nominal = nominalFuture.get();
        EnumMap<ShellParamId, List<Result<InverseRhoRSolver>>> perturbed = new EnumMap<>(ShellParamId.class);
        for (Map.Entry<ShellParamId, List<Future<Result<InverseRhoRSolver>>>> e : futures.entrySet()) {
            List<Result<InverseRhoRSolver>> pair = new ArrayList<>(2);
            for (Future<Result<InverseRhoRSolver>> f : e.getValue()) {
                pair.add(f.get());
            }
            perturbed.put(e.getKey(), pair);
        }
        return new SensitivityAnalyzer(params, nominal, perturbed, verbose);
    }

    /**
     * Модель со сдвинутым параметром. Недопустимое значение (например, отрицательная температура)
     * даёт INVALID_PARAMETERS вместо исключения.
     */
    private static Result<InverseRhoRSolver> buildPerturbed(ShellModelParameters base, ShellParamId id, double delta) {
        ShellParameter p = ShellParameterPool.get(id);
        ShellModelParameters shifted;
        try {
            shifted = p.shifted(base, delta);
        } catch (IllegalArgumentException e) {
            System.err.printf(Locale.US, "Sensitivity: %s %+.4g is invalid (%s), parameter will be dropped%n",
                    p.getName(), delta, e.getMessage());
            return Result.fail(ErrorKind.INVALID_PARAMETERS, p.getName() + ": " + e.getMessage());
        }
        return Result.ok(new InverseRhoRSolver(new ForwardRhoRModel(shifted)));
    }

    // =========================================================================
    // Погрешности
    // =========================================================================

    /**
     * Модельная погрешность величины target при заданных Rcm и E1 (лишний аргумент игнорируется).
     */
    public ErrorBudget calcError(TargetFunction target, double rcm, double e1) {
        double nominalValue = target.apply(nominal, rcm, e1);
        if (verbose) {
            System.out.printf(Locale.US, "--- %s (Rcm=%.5f, E1=%.4f): nominal %.6g%n", target, rcm, e1, nominalValue);
        }

        double sumSq = 0.0;
        List<ErrorContribution> sources = new ArrayList<>();
        for (ShellParamId id : ShellParamId.values()) {
            String name = ShellParameterPool.get(id).getName();
            List<Result<InverseRhoRSolver>> pair = perturbed.get(id);
            if (pair == null) {
                sources.add(new ErrorContribution(id, name, 0.0, false));
                continue;
            }

            double minus = evaluate(pair.get(0), target, rcm, e1);
            double plus = evaluate(pair.get(1), target, rcm, e1);
            double err = halfSpread(nominalValue, minus, plus);

            if (Double.isNaN(err)) {
                sources.add(new ErrorContribution(id, name, Double.NaN, true));
                if (verbose) System.out.printf("%s: dropped (NaN)%n", name);
                continue;
            }
            sumSq += err * err;
            sources.add(new ErrorContribution(id, name, err, false));
            if (verbose) {
                System.out.printf(Locale.US, "%s: [%.6g, %.6g, %.6g] err=%.4g%n", name, minus, nominalValue, plus, err);
            }
        }
        return new ErrorBudget(Math.sqrt(sumSq), sources);
    }

    private static double evaluate(Result<InverseRhoRSolver> solver, TargetFunction target, double rcm, double e1) {
        if (!solver.isOk()) return Double.NaN;
        return target.apply(solver.get(), rcm, e1);
    }

    /** (max - min) / 2 по трём значениям; NaN, если хотя бы одно из них NaN. */
    static double halfSpread(double a, double b, double c) {
        if (Double.isNaN(a) || Double.isNaN(b) || Double.isNaN(c)) return Double.NaN;
        double max = Math.max(a, Math.max(b, c));
        double min = Math.min(a, Math.min(b, c));
        return (max - min) / 2.0;
    }

    /**
     * (max - min) / 2 по центральному значению и двум концам. Конец, равный NaN (энергия вне таблицы),
     * отбрасывается; NaN только если не определено центральное значение.
     */
    public static double finiteHalfSpread(double center, double a, double b) {
        if (Double.isNaN(center)) return Double.NaN;
        double max = center;
        double min = center;
        if (!Double.isNaN(a)) {
            max = Math.max(max, a);
            min = Math.min(min, a);
        }
        if (!Double.isNaN(b)) {
            max = Math.max(max, b);
            min = Math.min(min, b);
        }
        return (max - min) / 2.0;
    }

    /** Энергия на выходе по номинальной модели и её погрешность. */
    public ValueWithError eoutWithError(double rcm) {
        ErrorBudget b = calcError(TargetFunction.EOUT, rcm, 0.0);
        return new ValueWithError(nominal.eout(rcm), b.total(), b);
    }

    /** Полный ρR при заданном Rcm и его погрешность. */
    public ValueWithError rhoRTotalWithError(double rcm) {
        ErrorBudget b = calcError(TargetFunction.RHOR_TOTAL, rcm, 0.0);
        return new ValueWithError(nominal.rhoRTotal(rcm), b.total(), b);
    }

    /** {топливо с примесью, оболочка, абляционная масса} по номинальной модели, г/см². */
    public double[] rhoRParts(double rcm) {
        if (Double.isNaN(rcm)) return new double[]{Double.NaN, Double.NaN, Double.NaN};
        return nominal.rhoRParts(rcm);
    }

    public RhoRWithError calcRhoR(double e1) {
        return calcRhoR(e1, 0.0);
    }

    /**
     * ρR и Rcm для измеренной энергии E1 с погрешностью.
     * При dE > 0 к модельной погрешности в квадратуре добавляется полуразмах ρR(E1 - dE), ρR(E1), ρR(min(E1 + dE, E0));
     * конец вне таблицы в размах не входит.
     */
    public RhoRWithError calcRhoR(double e1, double dE) {
        RhoRSolution sol = nominal.calcRhoR(e1);
        ErrorBudget model = calcError(TargetFunction.CALC_RHOR, sol.rcm(), e1);

        double total = model.total();
        if (dE > 0.0) {
            double rhoRLow = nominal.calcRhoR(Math.min(e1 + dE, params.getE0())).rhoR();
            double rhoRHigh = nominal.calcRhoR(e1 - dE).rhoR();
            double spread = finiteHalfSpread(sol.rhoR(), rhoRLow, rhoRHigh);
            if (!Double.isNaN(spread)) {
                total = Math.sqrt(sq(spread) + sq(model.total()));
            }
        }
        return new RhoRWithError(sol.rhoR(), sol.rcm(), total, model);
    }

    /**
     * Rcm для измеренной энергии E1 с погрешностью: модельная часть (если includeModelError)
     * и часть от dE - Rcm сдвигается шагами 1 мкм, пока Eout не выйдет за E1 ± dE.
     */
    public ValueWithError calcRcm(double e1, double dE, boolean includeModelError) {
        double rcm = nominal.calcRhoR(e1).rcm();

        ErrorBudget model = includeModelError
                ? calcError(TargetFunction.CALC_RHOR_RCM, 0.0, e1)
                : ErrorBudget.EMPTY;

        double rcmLow = rcm;
        double eLow = e1;
        int steps = 0;
        while (eLow > e1 - dE && steps++ < AnalysisConstants.RCM_SCAN_MAX_STEPS) {
            rcmLow -= AnalysisConstants.RCM_SCAN_STEP_CM;
            eLow = nominal.eout(rcmLow);
        }

        double rcmHigh = rcm;
        double eHigh = e1;
        steps = 0;
        while (eHigh < e1 + dE && steps++ < AnalysisConstants.RCM_SCAN_MAX_STEPS) {
            rcmHigh += AnalysisConstants.RCM_SCAN_STEP_CM;
            eHigh = nominal.eout(rcmHigh);
        }

        double total = Math.sqrt(sq(model.total()) + 0.25 * sq(rcmHigh - rcmLow));
        return new ValueWithError(rcm, total, model);
    }

    // --------- геттеры ---------

    public ShellModelParameters getParameters() {
        return params;
    }

    public InverseRhoRSolver getNominal() {
        return nominal;
    }

    /** Число успешно построенных возмущённых моделей. */
    public int perturbedModelCount() {
        int n = 0;
        for (List<Result<InverseRhoRSolver>> pair : perturbed.values()) {
            for (Result<InverseRhoRSolver> r : pair) if (r.isOk()) n++;
        }
        return n;
    }

    /** Параметры, для которых хотя бы одна возмущённая модель не построена (INVALID_PARAMETERS). */
    public Set<ShellParamId> failedParameters() {
        Set<ShellParamId> ids = EnumSet.noneOf(ShellParamId.class);
        for (Map.Entry<ShellParamId, List<Result<InverseRhoRSolver>>> e : perturbed.entrySet()) {
            for (Result<InverseRhoRSolver> r : e.getValue()) if (!r.isOk()) ids.add(e.getKey());
        }
        return ids;
    }

    private static double sq(double v) {
        return v * v;
    }
}
