package wrfcore.hohlraum;

import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import wrfcore.config.AnalysisConstants;
import wrfcore.config.CorrectionOptions;
import wrfcore.config.FitOptions;
import wrfcore.engine.ErrorKind;
import wrfcore.engine.Result;
import wrfcore.physics.StoppingPowerLibrary;
import wrfcore.physics.WallMaterial;
import wrfcore.spectrum.GaussFitResult;
import wrfcore.spectrum.GaussianFitter;
import wrfcore.spectrum.Spectrum;
import wrfcore.spectrum.SpectrumBin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Поправка спектра на прохождение стенки хольраума.
 * <p>
 * Толщины Au/DU/Al либо считаются по геометрии стенки и диапазону LOS, либо задаются явно.
 * Энергия каждого бина пересчитывается на вход в стенку (Al, затем DU, затем Au),
 * выход масштабируется на отношение ширин сырого и исправленного бина.
 * Объект неизменяем: толщины считаются один раз в конструкторе.
 */
public final class HohlraumCorrector {

    private static final double BRENT_REL_TOL = 1e-10;

    private final StoppingPowerLibrary stopping;
    private final CorrectionOptions options;
    private final ThicknessMode mode;
    private final WallThickness thickness;
    private final List<Result<LayerThickness>> layers;

    private HohlraumCorrector(StoppingPowerLibrary stopping,
                              CorrectionOptions options,
                              ThicknessMode mode,
                              WallThickness thickness,
                              List<Result<LayerThickness>> layers) {
        this.stopping = Objects.requireNonNull(stopping, "stopping");
        this.options = Objects.requireNonNull(options, "options");
        this.mode = mode;
        this.thickness = thickness.withAuBump(options.getBumpAuUm());
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));

        if (options.isVerbose()) {
            System.out.printf("Hohlraum (%s): %s%n", mode, this.thickness);
        }
    }

    /** Толщины по геометрии стенки и диапазону углов LOS. */
    public static HohlraumCorrector fromWall(WallGeometry wall,
                                             LineOfSight los,
                                             StoppingPowerLibrary stopping,
                                             CorrectionOptions options) {
        Objects.requireNonNull(wall, "wall");
        Objects.requireNonNull(los, "los");
        List<Result<LayerThickness>> layers = layerThicknesses(wall, los, options.getAngleSamples());

        double au = 0, du = 0, al = 0;
        double varAu = 0, varDu = 0, varAl = 0;
        for (Result<LayerThickness> r : layers) {
            if (!r.isOk()) {
                System.err.println("Hohlraum: layer skipped - " + r.getMessage());
                continue;
            }
            LayerThickness t = r.get();
            double um = t.meanCm() * 1e4;
            double stdUm = t.stdCm() * 1e4;
            switch (t.material()) {
                case AU -> { au += um; varAu += stdUm * stdUm; }
                case DU -> { du += um; varDu += stdUm * stdUm; }
                case AL -> { al += um; varAl += stdUm * stdUm; }
            }
        }
        // погрешность: заданная 1σ и разброс толщины по углам в квадратуре
        WallThickness t = new WallThickness(au, du, al,
                Math.sqrt(sq(options.getDAuUm()) + varAu),
                Math.sqrt(sq(options.getDDuUm()) + varDu),
                Math.sqrt(sq(options.getDAlUm()) + varAl));
        return new HohlraumCorrector(stopping, options, ThicknessMode.FROM_WALL, t, layers);
    }

    /** Явно заданные толщины, мкм; погрешности из настроек. */
    public static HohlraumCorrector fromThickness(double auUm, double duUm, double alUm,
                                                  StoppingPowerLibrary stopping,
                                                  CorrectionOptions options) {
        if (auUm < 0 || duUm < 0 || alUm < 0) {
            throw new IllegalArgumentException("thickness must be >= 0: Au=" + auUm + " DU=" + duUm + " Al=" + alUm);
        }
        WallThickness t = new WallThickness(auUm, duUm, alUm,
                options.getDAuUm(), options.getDDuUm(), options.getDAlUm());
        return new HohlraumCorrector(stopping, options, ThicknessMode.FROM_EXPLICIT_THICKNESS, t, List.of());
    }

    /** Ни геометрия, ни толщины не заданы: нулевая стенка. */
    public static HohlraumCorrector none(StoppingPowerLibrary stopping, CorrectionOptions options) {
        return fromThickness(0, 0, 0, stopping, options);
    }

    // =========================================================================
    // Геометрия
    // =========================================================================

    /**
     * Толщина каждой пары контуров вдоль LOS.
     * Непарный последний контур и пары без пересечения с лучом дают INVALID_GEOMETRY,
     * остальные пары считаются как обычно.
     */
    public static List<Result<LayerThickness>> layerThicknesses(WallGeometry wall, LineOfSight los, int samples) {
        List<Result<LayerThickness>> out = new ArrayList<>();
        List<WallLayer> all = wall.getLayers();
        for (int i = 0; i < wall.pairCount(); i++) {
            out.add(layerThickness(i, all.get(2 * i), all.get(2 * i + 1), los, samples));
        }
        if (!wall.hasEvenLayerCount()) {
            WallLayer last = all.get(all.size() - 1);
            out.add(Result.fail(ErrorKind.INVALID_GEOMETRY,
                    "odd number of wall contours (" + all.size() + "), contour " + last.getIndex() + " has no pair"));
        }
        return out;
    }

    static Result<LayerThickness> layerThickness(int pair, WallLayer inner, WallLayer outer,
                                                 LineOfSight los, int samples) {
        if (!inner.isUsable() || !outer.isUsable()) {
            return Result.fail(ErrorKind.INVALID_GEOMETRY,
                    "layer pair " + pair + ": contour needs at least 2 points with distinct z");
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (double theta : los.sampleAngles(samples)) {
            Result<double[]> p1 = intersect(inner, theta);
            Result<double[]> p2 = intersect(outer, theta);
            if (!p1.isOk()) return Result.fail(p1.getError(), "layer pair " + pair + ": " + p1.getMessage());
            if (!p2.isOk()) return Result.fail(p2.getError(), "layer pair " + pair + ": " + p2.getMessage());
            double dz = p2.get()[1] - p1.get()[1];
            double dr = p2.get()[0] - p1.get()[0];
            stats.addValue(Math.sqrt(dz * dz + dr * dr));
        }
        double std = (stats.getN() > 1) ? stats.getStandardDeviation() : 0.0;
        return Result.ok(new LayerThickness(pair, inner.getMaterial(), stats.getMean(), std));
    }

    /**
     * Точка пересечения луча под углом theta с контуром: минимум |r_контура(z) - r_луча(z)|
     * на отрезке z контура. Возвращает (r, z).
     */
    static Result<double[]> intersect(WallLayer layer, double thetaDeg) {
        BrentOptimizer optimizer = new BrentOptimizer(BRENT_REL_TOL, AnalysisConstants.INTERSECTION_TOLERANCE_CM);
        UnivariatePointValuePair p;
        try {
            p = optimizer.optimize(
                    new MaxEval(AnalysisConstants.SEARCH_MAX_EVAL),
                    new UnivariateObjectiveFunction(
                            z -> Math.abs(layer.radiusAt(z) - LineOfSight.rayRadius(z, thetaDeg))),
                    GoalType.MINIMIZE,
                    new SearchInterval(layer.minZ(), layer.maxZ()));
        } catch (TooManyEvaluationsException e) {
            return Result.fail(ErrorKind.INVALID_GEOMETRY,
                    String.format("intersection search for contour %d at theta=%.3f did not converge",
                            layer.getIndex(), thetaDeg));
        }
        if (!(p.getValue() <= AnalysisConstants.INTERSECTION_MISS_CM)) {
            return Result.fail(ErrorKind.INVALID_GEOMETRY,
                    String.format("ray at theta=%.3f misses contour %d (closest %.3e cm)",
                            thetaDeg, layer.getIndex(), p.getValue()));
        }
        double z = p.getPoint();
        return Result.ok(new double[]{LineOfSight.rayRadius(z, thetaDeg), z});
    }

    // =========================================================================
    // Поправка спектра
    // =========================================================================

    /** Энергия до стенки для энергии e за стенкой (толщины этого объекта). */
    public double shiftEnergy(double e) {
        return shiftEnergy(e, thickness);
    }

    /** Энергия до стенки: Ein через Al, затем DU, затем Au. */
    public double shiftEnergy(double e, WallThickness t) {
        double out = e;
        out = stopping.getAluminum().ein(out, t.al());
        out = stopping.getUranium().ein(out, t.du());
        out = stopping.getGold().ein(out, t.au());
        return out;
    }

    public Spectrum correct(Spectrum raw) {
        return correct(raw, thickness, new int[1]);
    }

    /**
     * Исправленный спектр для толщин t. guarded[0] увеличивается на число бинов с нулевым выходом.
     */
    Spectrum correct(Spectrum raw, WallThickness t, int[] guarded) {
        List<SpectrumBin> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            SpectrumBin b = raw.get(i);
            double bin = raw.binWidth(i);
            double e = shiftEnergy(b.energy(), t);
            double newBin = shiftEnergy(b.energy() + bin / 2, t) - shiftEnergy(b.energy() - bin / 2, t);

            // "гармошка": выход на МэВ меняется вместе с шириной бина
            double y = b.yield() * bin / newBin;
            double err;
            if (b.yield() != 0.0) {
                err = b.error() * y / b.yield();
            } else {
                err = b.error();
                guarded[0]++;
            }
            out.add(new SpectrumBin(e, y, Math.abs(err)));
        }
        return new Spectrum(raw.getName() + " (corrected)", out);
    }

    /** Границы фита исправленного спектра: сырые границы, пересчитанные через стенку. */
    public FitOptions correctedFitOptions(FitOptions raw, WallThickness t) {
        if (!raw.hasLimits()) return raw;
        double lo = Double.isNaN(raw.getMinEnergy()) ? Double.NaN : shiftEnergy(raw.getMinEnergy(), t);
        double hi = Double.isNaN(raw.getMaxEnergy()) ? Double.NaN : shiftEnergy(raw.getMaxEnergy(), t);
        return raw.withLimits(lo, hi);
    }

    /** Поправка и фиты для номинальных толщин. */
    public HohlraumFit fit(Spectrum raw) {
        return fit(raw, thickness);
    }

    /**
     * Поправка и фиты для толщин t. Начальное приближение исправленного фита -
     * сырой фит со сдвинутым через стенку средним.
     */
    public HohlraumFit fit(Spectrum raw, WallThickness t) {
        FitOptions rawOptions = options.getFitOptions();
        GaussFitResult rawFit = new GaussianFitter(raw, rawOptions).fit();

        int[] guarded = new int[1];
        Spectrum corr = correct(raw, t, guarded);
        if (guarded[0] > 0 && options.isVerbose()) {
            System.out.printf("Hohlraum: %d zero-yield bins, raw error kept%n", guarded[0]);
        }

        double[] guess = {rawFit.getAmplitude(), shiftEnergy(rawFit.getMean(), t), rawFit.getSigma()};
        GaussFitResult corrFit = new GaussianFitter(corr, correctedFitOptions(rawOptions, t)).fit(guess);

        if (options.isVerbose()) {
            System.out.printf("Hohlraum fit: raw %s | corrected %s%n", rawFit, corrFit);
        }
        return new HohlraumFit(raw, corr, rawFit, corrFit, t, guarded[0]);
    }

    /**
     * Погрешность исправленного фита от погрешности толщин:
     * [[-dY, +dY], [-dE, +dE], [-dσ, +dσ]] - модули разности фитов при толщинах ∓σ и номинального фита.
     * Сдвигаются только материалы с положительной толщиной.
     */
    public double[][] uncertainty(Spectrum raw, HohlraumFit nominal) {
        double[] nom = nominal.correctedFit().getParameters();
        double[] lo = fit(raw, thickness.shifted(-1.0)).correctedFit().getParameters();
        double[] hi = fit(raw, thickness.shifted(+1.0)).correctedFit().getParameters();

        double[][] out = new double[3][2];
        for (int k = 0; k < 3; k++) {
            out[k][0] = Math.abs(lo[k] - nom[k]);
            out[k][1] = Math.abs(hi[k] - nom[k]);
        }
        return out;
    }

    public double[][] uncertainty(Spectrum raw) {
        return uncertainty(raw, fit(raw));
    }

    // --------- геттеры ---------

    public ThicknessMode getMode() {
        return mode;
    }

    public WallThickness getThickness() {
        return thickness;
    }

    public List<Result<LayerThickness>> getLayers() {
        return layers;
    }

    public CorrectionOptions getOptions() {
        return options;
    }

    public double get(WallMaterial m) {
        return thickness.get(m);
    }

    private static double sq(double v) {
        return v * v;
    }
}
