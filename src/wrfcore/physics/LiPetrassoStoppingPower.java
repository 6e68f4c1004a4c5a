package wrfcore.physics;

import org.apache.commons.math3.special.Erf;

import static wrfcore.physics.PhysicalConstants.*;

/**
 * Тормозная способность многокомпонентной плазмы по модели Li-Petrasso
 * (Phys. Rev. Lett. 70, 3059 (1993)).
 * <p>
 * Массы полевых частиц заданы в а.е.м. (для электронов me/mp), заряды в единицах e,
 * температуры в кэВ, концентрации в 1/см³.
 */
public final class LiPetrassoStoppingPower extends AbstractStoppingPower {

    public static final double EMIN_MEV = 0.01;
    public static final double EMAX_MEV = 30.0;

    /** Учёт коллективных эффектов */
    private static final boolean COLLECTIVE = true;

    private final double mt;
    private final double zt;

    private final double[] mf;
    private final double[] zf;
    private final double[] tf;
    private final double[] nf;

    public LiPetrassoStoppingPower(double mt, double zt,
                                   double[] mf, double[] zf, double[] tf, double[] nf) {
        this(mt, zt, mf, zf, tf, nf, DEFAULT_STEPS);
    }

    public LiPetrassoStoppingPower(double mt, double zt,
                                   double[] mf, double[] zf, double[] tf, double[] nf, int steps) {
        super(steps);
        if (mf.length != zf.length || mf.length != tf.length || mf.length != nf.length) {
            throw new IllegalArgumentException("field arrays must have equal length: "
                    + mf.length + "/" + zf.length + "/" + tf.length + "/" + nf.length);
        }
        for (int i = 0; i < mf.length; i++) {
            if (!(tf[i] > 0.0)) throw new IllegalArgumentException("Tf must be > 0, species " + i);
            if (!(nf[i] > 0.0)) throw new IllegalArgumentException("nf must be > 0, species " + i);
        }
        this.mt = mt;
        this.zt = zt;
        this.mf = mf.clone();
        this.zf = zf.clone();
        this.tf = tf.clone();
        this.nf = nf.clone();
    }

    /** Протон как пробная частица. */
    public static LiPetrassoStoppingPower forProtons(double[] mf, double[] zf, double[] tf, double[] nf) {
        return new LiPetrassoStoppingPower(1.0, 1.0, mf, zf, tf, nf);
    }

    public static LiPetrassoStoppingPower forProtons(double[] mf, double[] zf, double[] tf, double[] nf, int steps) {
        return new LiPetrassoStoppingPower(1.0, 1.0, mf, zf, tf, nf, steps);
    }

    @Override
    public double dEdx(double energyMeV) {
        if (energyMeV <= 0.0) return 0.0;
        double sum = 0.0;
        for (int i = 0; i < mf.length; i++) {
            sum += dEdrSingle(energyMeV, mf[i], zf[i], tf[i], nf[i]);
        }
        // МэВ/см -> МэВ/мкм
        return sum / UM_PER_CM;
    }

    /** Вклад одного сорта полевых частиц, МэВ/см. */
    private double dEdrSingle(double energyMeV, double mfi, double zfi, double tfi, double nfi) {
        double et = energyMeV * 1e3;
        double xtf = (mfi / mt) * (et / tfi);
        double ll = logLambda(et, mfi, zfi, tfi, nfi);

        double d = ll * chandrasekhar(xtf, mfi, ll);
        if (COLLECTIVE && xtf > 1.0 / 1.261) {
            d += 0.5 * Math.log(1.261 * xtf);
        }

        double vt = C * Math.sqrt(2.0 * et / (mt * MP_C2_KEV));
        double tmp = Math.pow(zt * E_CHARGE / vt, 2);
        double wpf2 = 4.0 * Math.PI * nfi * Math.pow(zfi * E_CHARGE, 2) / (mfi * MP);
        double ergPerCm = -tmp * wpf2 * d;
        return ergPerCm * ERG_TO_MEV;
    }

    private double logLambda(double etKev, double mfi, double zfi, double tfi, double nfi) {
        double mr = MP * mt * mfi / (mt + mfi);
        double u = Math.sqrt(2.0 * mt * MP * etKev * KEV_TO_ERG) / ((mt + mfi) * MP);
        double lambdaD = Math.sqrt((KB * tfi * KEV_TO_K) / (4.0 * Math.PI * nfi * Math.pow(E_CHARGE * zfi, 2)));
        double pPerp = zfi * E_CHARGE * zt * E_CHARGE / (mr * u * u);
        double pMin = Math.sqrt(pPerp * pPerp + Math.pow(HBAR / (2.0 * mr * u), 2));
        return 0.5 * Math.log(1.0 + Math.pow(lambdaD / pMin, 2));
    }

    private double chandrasekhar(double xtf, double mfi, double ll) {
        double rat = mfi / mt;
        double mu = 1.12838 * Math.sqrt(xtf) * Math.exp(-xtf);
        double erf = Erf.erf(Math.sqrt(xtf));
        return (erf - mu) - rat * (mu - erf / ll);
    }

    @Override
    protected double rangeOutEnergy() {
        return EMIN_MEV;
    }

    @Override
    public double getEmin() {
        return EMIN_MEV;
    }

    @Override
    public double getEmax() {
        return EMAX_MEV;
    }
}
