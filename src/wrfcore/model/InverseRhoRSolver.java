package wrfcore.model;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import wrfcore.config.AnalysisConstants;
import wrfcore.engine.ErrorKind;
import wrfcore.engine.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Обращение модели ρR: измеренная энергия → Rcm → ρR.
 * <p>
 * При построении Rcm уменьшается от Ri с шагом Rcm/50, пока энергия на выходе не упадёт до нуля;
 * получаются монотонные таблицы (Rcm, Eout, ρR) и линейные интерполяции Eout(Rcm), Rcm(Eout), ρR(Eout).
 * Таблица дополнена точкой (2·Ri, E0, 0) - несжатая капсула.
 * Таблицы неизменяемы; при смене параметров строится новый объект.
 */
public final class InverseRhoRSolver {

    private final ForwardRhoRModel model;

    private final double[] rcmTable;
    private final double[] eoutTable;
    private final double[] rhoRTable;

    /** null, если в таблице меньше двух точек */
    private final PolynomialSplineFunction eoutOfRcm;
    private final PolynomialSplineFunction rcmOfEout;
    private final PolynomialSplineFunction rhoROfEout;

    public InverseRhoRSolver(ForwardRhoRModel model) {
        this(model, false);
    }

    public InverseRhoRSolver(ForwardRhoRModel model, boolean verbose) {
        this.model = Objects.requireNonNull(model, "model");

        double ri = model.getParameters().getRi();
        List<double[]> points = new ArrayList<>();

        double r = ri;
        double dr = r / AnalysisConstants.TABLE_STEP_DIVISOR;
        while (points.size() < AnalysisConstants.MAX_TABLE_POINTS && model.isValidRadius(r)) {
            double e = model.eout(r);
            if (Double.isNaN(e)) break;
            points.add(new double[]{r, e, model.rhoRTotal(r)});
            if (e <= 0.0) break;

            r -= dr;
            dr = r / AnalysisConstants.TABLE_STEP_DIVISOR;
        }
        if (points.size() >= AnalysisConstants.MAX_TABLE_POINTS) {
            System.err.printf(Locale.US, "rhoR table: stopped at %d points, Rcm=%.5f cm, Eout still > 0%n",
                    points.size(), r);
        }

        // по возрастанию Rcm, самую сжатую точку отбрасываем
        List<double[]> ascending = new ArrayList<>();
        for (int i = points.size() - 2; i >= 0; i--) ascending.add(points.get(i));
        ascending.add(new double[]{2.0 * ri, model.getParameters().getE0(), 0.0});

        // интерполяции нужна строгая монотонность Eout по Rcm
        List<double[]> monotone = new ArrayList<>();
        for (double[] p : ascending) {
            if (monotone.isEmpty() || p[1] > monotone.get(monotone.size() - 1)[1]) {
                monotone.add(p);
            } else if (verbose) {
                System.out.printf(Locale.US, "rhoR table: dropped non-monotone point Rcm=%.5f Eout=%.4f%n", p[0], p[1]);
            }
        }

        int n = monotone.size();
        rcmTable = new double[n];
        eoutTable = new double[n];
        rhoRTable = new double[n];
        for (int i = 0; i < n; i++) {
            rcmTable[i] = monotone.get(i)[0];
            eoutTable[i] = monotone.get(i)[1];
            rhoRTable[i] = monotone.get(i)[2];
        }

        if (n >= 2) {
            LinearInterpolator li = new LinearInterpolator();
            eoutOfRcm = li.interpolate(rcmTable, eoutTable);
            rcmOfEout = li.interpolate(eoutTable, rcmTable);
            rhoROfEout = li.interpolate(eoutTable, rhoRTable);
        } else {
            System.err.println("rhoR table: fewer than 2 points, model cannot be inverted: " + model.getParameters());
            eoutOfRcm = null;
            rcmOfEout = null;
            rhoROfEout = null;
        }

        if (verbose) {
            System.out.printf(Locale.US, "rhoR table: %d points, Rcm %.5f..%.5f cm, Eout %.4f..%.4f MeV%n",
                    n, n > 0 ? rcmTable[0] : Double.NaN, n > 0 ? rcmTable[n - 1] : Double.NaN,
                    minEout(), maxEout());
        }
    }

    /** Энергия на выходе по таблице, МэВ; NaN вне таблицы. */
    public double eout(double rcm) {
        if (eoutOfRcm == null || !eoutOfRcm.isValidPoint(rcm)) return Double.NaN;
        return eoutOfRcm.value(rcm);
    }

    /**
     * ρR и Rcm для измеренной энергии E1. Rcm берётся из таблицы, ρR пересчитывается точно по модели.
     */
    public Result<RhoRSolution> solve(double e1) {
        if (rcmOfEout == null || Double.isNaN(e1) || e1 < minEout() || e1 > maxEout()) {
            return Result.fail(ErrorKind.OUT_OF_RANGE_INPUT, String.format(Locale.US,
                    "E=%.4f MeV outside table [%.4f, %.4f]", e1, minEout(), maxEout()));
        }
        double rcm = rcmOfEout.value(e1);
        return Result.ok(new RhoRSolution(model.rhoRTotal(rcm), rcm));
    }

    /** То же, что {@link #solve(double)}, но вне таблицы возвращает NaN. */
    public RhoRSolution calcRhoR(double e1) {
        return solve(e1).orElse(RhoRSolution.NAN);
    }

    /** ρR по грубой таблице (без точного пересчёта), г/см². */
    public double tableRhoR(double e1) {
        if (rhoROfEout == null || !rhoROfEout.isValidPoint(e1)) return Double.NaN;
        return rhoROfEout.value(e1);
    }

    public double rhoRTotal(double rcm) {
        return model.rhoRTotal(rcm);
    }

    public double[] rhoRParts(double rcm) {
        return model.rhoRParts(rcm);
    }

    public double minEout() {
        return eoutTable.length > 0 ? eoutTable[0] : Double.NaN;
    }

    public double maxEout() {
        return eoutTable.length > 0 ? eoutTable[eoutTable.length - 1] : Double.NaN;
    }

    /** Наибольший шаг таблицы по Rcm в окрестности rcm (между соседними узлами), см. */
    public double tableStepNear(double rcm) {
        double step = 0.0;
        for (int i = 1; i < rcmTable.length; i++) {
            if (rcmTable[i - 1] <= rcm && rcm <= rcmTable[i]) {
                step = Math.max(step, rcmTable[i] - rcmTable[i - 1]);
            }
        }
        return step;
    }

    public ForwardRhoRModel getModel() {
        return model;
    }

    public double[] getRcmTable() { return rcmTable.clone(); }
    public double[] getEoutTable() { return eoutTable.clone(); }
    public double[] getRhoRTable() { return rhoRTable.clone(); }

    public int tableSize() {
        return rcmTable.length;
    }
}
