package wrfcore.physics;

import static wrfcore.physics.PhysicalConstants.*;

/**
 * Тормозная способность холодного вещества (формула Бете) для протонов.
 * Ниже Emin формула Бете неприменима, там потери считаются пропорциональными скорости.
 */
public final class ColdMatterStoppingPower extends AbstractStoppingPower {

    public static final double DEFAULT_EMIN_MEV = 1.0;
    public static final double DEFAULT_EMAX_MEV = 100.0;

    private final String name;
    private final double z;
    private final double a;
    private final double densityGcc;
    private final double meanExcitationMeV;

    private final double emin;
    private final double emax;

    /** dE/dx на нижней границе, МэВ/мкм */
    private final double dedxAtEmin;

    /**
     * @param name              название материала
     * @param z                 атомный номер
     * @param a                 атомная масса, г/моль
     * @param densityGcc        плотность, г/см³
     * @param meanExcitationEv  средний потенциал ионизации I, эВ
     */
    public ColdMatterStoppingPower(String name, double z, double a, double densityGcc, double meanExcitationEv) {
        if (z <= 0 || a <= 0 || densityGcc <= 0 || meanExcitationEv <= 0) {
            throw new IllegalArgumentException("Z, A, density and I must be > 0 for " + name);
        }
        this.name = name;
        this.z = z;
        this.a = a;
        this.densityGcc = densityGcc;
        this.meanExcitationMeV = meanExcitationEv * 1e-6;
        this.emin = DEFAULT_EMIN_MEV;
        this.emax = DEFAULT_EMAX_MEV;
        this.dedxAtEmin = bethe(emin);
    }

    public static ColdMatterStoppingPower gold() {
        return new ColdMatterStoppingPower("Au", 79, 196.97, 19.32, 790.0);
    }

    public static ColdMatterStoppingPower depletedUranium() {
        return new ColdMatterStoppingPower("DU", 92, 238.03, 19.05, 890.0);
    }

    public static ColdMatterStoppingPower aluminum() {
        return new ColdMatterStoppingPower("Al", 13, 26.98, 2.70, 166.0);
    }

    @Override
    public double dEdx(double energyMeV) {
        if (energyMeV <= 0.0) return 0.0;
        if (energyMeV < emin) {
            return dedxAtEmin * Math.sqrt(energyMeV / emin);
        }
        return bethe(energyMeV);
    }

    private double bethe(double energyMeV) {
        double gamma = 1.0 + energyMeV / MP_C2_MEV;
        double beta2 = 1.0 - 1.0 / (gamma * gamma);
        double arg = 2.0 * ME_C2_MEV * beta2 * gamma * gamma / meanExcitationMeV;
        double bracket = Math.log(arg) - beta2;
        // МэВ·см²/г
        double massStopping = BETHE_K * (z / a) / beta2 * bracket;
        return -massStopping * densityGcc / UM_PER_CM;
    }

    public String getName() {
        return name;
    }

    public double getDensityGcc() {
        return densityGcc;
    }

    @Override
    public double getEmin() {
        return emin;
    }

    @Override
    public double getEmax() {
        return emax;
    }
}
