// File: wrfcore/model/ForwardRhoRModel.java
package wrfcore.model;

import wrfcore.config.AnalysisConstants;
import wrfcore.config.DedxModel;
import wrfcore.config.ShellModelParameters;
import wrfcore.physics.LiPetrassoStoppingPower;
import wrfcore.physics.ShellMaterial;
import wrfcore.physics.StoppingPower;

import java.util.Arrays;
import java.util.Objects;

import static wrfcore.physics.PhysicalConstants.ME;
import static wrfcore.physics.PhysicalConstants.MP;

/**
 * Модель ρR из трёх частей (топливо с примесью, оболочка, абляционная масса).
 * <p>
 * Протон с энергией E0 проходит последовательно: газ с примесью материала оболочки (радиус Rcm - Tshell/2),
 * оболочку толщиной Tshell, экспоненциальный спад плотности абляционной массы от rho_Abl_Max до rho_Abl_Min
 * и плоский хвост rho_Abl_Min, внешний радиус которого задан сохранением массы.
 * <p>
 * Модель неизменяема: смена любого параметра означает построение нового экземпляра.
 * Все радиусы в см, энергии в МэВ, плотности в г/см³, ρR в г/см².
 */
public final class ForwardRhoRModel {

    /** Масса и заряд дейтрона и 3He, а.е.м. / e */
    private static final double A_D = 2.0;
    private static final double Z_D = 1.0;
    private static final double A_3HE = 3.0;
    private static final double Z_3HE = 2.0;

    private final ShellModelParameters params;
    private final ShellMaterial shell;

    /** Начальная плотность газа, г/см³ */
    private final double rho0Gas;

    /** Полная масса оболочки, г */
    private final double massShellTotal;

    /** Масса примеси в топливе, г */
    private final double massMixTotal;

    // полевые частицы: газ + примесь (D, 3He, ионы оболочки, электроны)
    private final double[] mfGasMix;
    private final double[] zfGasMix;
    private final double[] tfGasMix;

    // оболочка (ионы, электроны)
    private final double[] mfShell;
    private final double[] zfShell;
    private final double[] tfShell;

    // абляционная масса (ионы, электроны)
    private final double[] tfAbl;

    public ForwardRhoRModel(ShellModelParameters params) {
        this.params = Objects.requireNonNull(params, "params");
        this.shell = ShellMaterial.parse(params.getShellMaterial());

        this.rho0Gas = params.getP0() * ((params.getFD() / 2.0) * AnalysisConstants.RHO_D2_STP
                + params.getF3He() * AnalysisConstants.RHO_3HE_STP);
        this.massShellTotal = (4.0 * Math.PI / 3.0) * shell.getRho()
                * (Math.pow(params.getRo(), 3) - Math.pow(params.getRi(), 3));
        this.massMixTotal = massShellTotal * params.getMixF();

        int ns = shell.speciesCount();

        mfGasMix = new double[ns + 3];
        zfGasMix = new double[ns + 3];
        tfGasMix = new double[ns + 3];
        mfGasMix[0] = A_D;
        zfGasMix[0] = Z_D;
        tfGasMix[0] = params.getTeGas();
        mfGasMix[1] = A_3HE;
        zfGasMix[1] = Z_3HE;
        tfGasMix[1] = params.getTeGas();
        for (int i = 0; i < ns; i++) {
            mfGasMix[2 + i] = shell.getA(i);
            zfGasMix[2 + i] = shell.getZ(i);
            tfGasMix[2 + i] = params.getTeMix();
        }
        mfGasMix[ns + 2] = ME / MP;
        zfGasMix[ns + 2] = -1.0;
        tfGasMix[ns + 2] = params.getTeGas();

        mfShell = new double[ns + 1];
        zfShell = new double[ns + 1];
        tfShell = new double[ns + 1];
        tfAbl = new double[ns + 1];
        for (int i = 0; i < ns; i++) {
            mfShell[i] = shell.getA(i);
            zfShell[i] = shell.getZ(i);
        }
        mfShell[ns] = ME / MP;
        zfShell[ns] = -1.0;
        Arrays.fill(tfShell, params.getTeShell());
        Arrays.fill(tfAbl, params.getTeAbl());
    }

    // =========================================================================
    // Потери энергии
    // =========================================================================

    /**
     * Энергия протона на выходе из капсулы при радиусе оболочки Rcm, МэВ (не меньше 0).
     * NaN, если Rcm не больше половины толщины оболочки.
     */
    public double eout(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        double halfShell = params.getTShell() / 2.0;
        double e = params.getE0();

        // газ + примесь
        double lGas = Math.max(0.0, 1e4 * (rcm - halfShell));
        e = eoutGasMix(e, lGas, rcm);

        // оболочка
        double lShell = 1e4 * (rcm + halfShell) - lGas;
        e = eoutShell(e, lShell, rcm);

        // абляционная масса
        double[] r = ablatedRadii(rcm);
        e = eoutAbl(e, r[0], r[1], r[2], rcm);

        return Math.max(e, 0.0);
    }

    /** Потери в газе с примесью на пути x мкм. */
    public double eoutGasMix(double e, double xUm, double rcm) {
        if (e <= 0.0) return 0.0;
        double[] gas = nGas(rcm);
        double[] mix = nMix(rcm);
        int ns = shell.speciesCount();

        double[] nf = new double[ns + 3];
        nf[0] = gas[0] * params.getFD();
        nf[1] = gas[0] * params.getF3He();
        for (int i = 0; i < ns; i++) {
            nf[2 + i] = mix[0] * shell.getFraction(i);
        }
        nf[ns + 2] = gas[1] + mix[1];
        floorDensities(nf);

        return stopping(mfGasMix, zfGasMix, tfGasMix, nf).eout(e, xUm);
    }

    /** Потери в оболочке на пути x мкм. */
    public double eoutShell(double e, double xUm, double rcm) {
        if (e <= 0.0) return 0.0;
        double[] n = nShell(rcm);
        return stopping(mfShell, zfShell, tfShell, shellSpeciesDensities(n)).eout(e, xUm);
    }

    /**
     * Потери в абляционной массе: на экспоненциальном участке [r1, r2] - явная схема Эйлера
     * по STEPS_PER_REGION шагам (плотность меняется), на хвосте [r2, r3] - постоянная плотность rho_Abl_Min.
     */
    public double eoutAbl(double e, double r1, double r2, double r3, double rcm) {
        int steps = AnalysisConstants.STEPS_PER_REGION;
        if (r2 > r1) {
            double dr = (r2 - r1) / steps;
            for (int i = 0; i < steps && e > 0.0; i++) {
                double r = r1 + (r2 - r1) * i / (steps - 1);
                StoppingPower sp = stopping(mfShell, zfShell, tfAbl, shellSpeciesDensities(nAbl(r, rcm)));
                if (e >= sp.getEmin()) {
                    e += dr * 1e4 * sp.dEdx(e);
                }
            }
        }
        if (e <= 0.0) return 0.0;
        if (r3 > r2) {
            double[] n = numberDensities(params.getRhoAblMin());
            e = stopping(mfShell, zfShell, tfAbl, shellSpeciesDensities(n)).eout(e, 1e4 * (r3 - r2));
        }
        return Math.max(e, 0.0);
    }

    private double[] shellSpeciesDensities(double[] n) {
        int ns = shell.speciesCount();
        double[] nf = new double[ns + 1];
        for (int i = 0; i < ns; i++) {
            nf[i] = n[0] * shell.getFraction(i);
        }
        nf[ns] = n[1];
        floorDensities(nf);
        return nf;
    }

    private StoppingPower stopping(double[] mf, double[] zf, double[] tf, double[] nf) {
        DedxModel model = params.getDedxModel();
        return switch (model) {
            case LI_PETRASSO -> LiPetrassoStoppingPower.forProtons(mf, zf, tf, nf,
                    AnalysisConstants.RK4_STEPS_PER_REGION);
        };
    }

    private static void floorDensities(double[] nf) {
        for (int i = 0; i < nf.length; i++) {
            if (!(nf[i] > AnalysisConstants.MIN_NUMBER_DENSITY)) nf[i] = AnalysisConstants.MIN_NUMBER_DENSITY;
        }
    }

    // =========================================================================
    // Плотности и ρR
    // =========================================================================

    /** Rcm должен быть больше Tshell/2, иначе у газа нет объёма. */
    public boolean isValidRadius(double rcm) {
        return rcm > params.getTShell() / 2.0 && Double.isFinite(rcm);
    }

    private double gasRadius(double rcm) {
        return rcm - params.getTShell() / 2.0;
    }

    public double rhoGas(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        return rho0Gas * Math.pow(params.getRi() / gasRadius(rcm), 3);
    }

    public double rhoRGas(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        return gasRadius(rcm) * rhoGas(rcm);
    }

    /** {ni, ne} в газе, 1/см³. */
    public double[] nGas(double rcm) {
        double a = params.getFD() * A_D + params.getF3He() * A_3HE;
        double z = params.getFD() * Z_D + params.getF3He() * Z_3HE;
        double ni = (a > 0.0) ? rhoGas(rcm) / (a * MP) : 0.0;
        return new double[]{ni, z * ni};
    }

    public double rhoMix(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        double v = (4.0 * Math.PI / 3.0) * Math.pow(gasRadius(rcm), 3);
        return massMixTotal / v;
    }

    public double rhoRMix(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        return gasRadius(rcm) * rhoMix(rcm);
    }

    public double[] nMix(double rcm) {
        return numberDensities(rhoMix(rcm));
    }

    public double rhoShell(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        double half = params.getTShell() / 2.0;
        double m = massShellTotal * params.getMRem();
        double v = (4.0 * Math.PI / 3.0) * (Math.pow(rcm + half, 3) - Math.pow(rcm - half, 3));
        return m / v;
    }

    public double rhoRShell(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        return params.getTShell() * rhoShell(rcm);
    }

    public double[] nShell(double rcm) {
        return numberDensities(rhoShell(rcm));
    }

    /**
     * Радиусы профиля абляционной массы {r1, r2, r3}: начало, конец экспоненциального спада, конец хвоста.
     * Если масса спада уже больше доступной, хвоста нет (r3 = r2).
     */
    public double[] ablatedRadii(double rcm) {
        double m = massShellTotal * (1.0 - params.getMRem() - params.getMixF());
        double lambda = params.getRhoAblScale();
        double r1 = rcm + params.getTShell() / 2.0;
        double r2 = r1 + lambda * Math.log(params.getRhoAblMax() / params.getRhoAblMin());

        // масса экспоненциального участка: ∫ 4πr² ρmax exp(-(r-r1)/λ) dr от r1 до r2
        double m12 = params.getRhoAblMax() * 4.0 * Math.PI * lambda
                * (2 * lambda * lambda + 2 * r1 * lambda + r1 * r1
                - (2 * lambda * lambda + 2 * lambda * r2 + r2 * r2) * Math.exp((r1 - r2) / lambda));

        double r3;
        if (m12 < m) {
            double m23 = m - m12;
            r3 = Math.cbrt(r2 * r2 * r2 + 3.0 * m23 / (4.0 * Math.PI * params.getRhoAblMin()));
        } else {
            r3 = r2;
        }
        return new double[]{r1, Math.max(r2, r1), Math.max(r3, r2)};
    }

    /** Плотность абляционной массы на радиусе r. */
    public double rhoAbl(double r, double rcm) {
        double[] rr = ablatedRadii(rcm);
        if (rr[0] <= r && r < rr[1]) {
            return params.getRhoAblMax() * Math.exp(-(r - rr[0]) / params.getRhoAblScale());
        }
        if (rr[1] <= r && r <= rr[2]) {
            return params.getRhoAblMin();
        }
        return 0.0;
    }

    public double rhoRAbl(double rcm) {
        if (!isValidRadius(rcm)) return Double.NaN;
        double[] rr = ablatedRadii(rcm);
        double lambda = params.getRhoAblScale();
        double rhoR = params.getRhoAblMax() * lambda * (1.0 - Math.exp(-(rr[1] - rr[0]) / lambda));
        rhoR += (rr[2] - rr[1]) * params.getRhoAblMin();
        return rhoR;
    }

    public double[] nAbl(double r, double rcm) {
        return numberDensities(rhoAbl(r, rcm));
    }

    /** {ni, ne} для материала оболочки с плотностью rho. */
    private double[] numberDensities(double rho) {
        double ni = rho / (shell.getAvgA() * MP);
        return new double[]{ni, shell.getAvgZ() * ni};
    }

    /** Полный ρR = (газ + примесь) + оболочка + абляционная масса. */
    public double rhoRTotal(double rcm) {
        double[] p = rhoRParts(rcm);
        return p[0] + p[1] + p[2];
    }

    /** {топливо с примесью, оболочка, абляционная масса}, г/см². */
    public double[] rhoRParts(double rcm) {
        if (!isValidRadius(rcm)) return new double[]{Double.NaN, Double.NaN, Double.NaN};
        double fuel = rhoRGas(rcm) + rhoRMix(rcm);
        return new double[]{fuel, rhoRShell(rcm), rhoRAbl(rcm)};
    }

    // --------- геттеры ---------

    public ShellModelParameters getParameters() {
        return params;
    }

    public ShellMaterial getShell() {
        return shell;
    }

    public double getRho0Gas() {
        return rho0Gas;
    }

    public double getMassShellTotal() {
        return massShellTotal;
    }

    public double getMassMixTotal() {
        return massMixTotal;
    }
}
