package wrfcore.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Параметры модели оболочки для одного выстрела (immutable).
 * Каждый варьируемый параметр несёт номинальное значение и фиксированную 1σ погрешность.
 * Изменить параметр = построить новый экземпляр через {@link ShellModelParametersBuilder}.
 */
public final class ShellModelParameters {

    /** Материал оболочки, см. ShellMaterial */
    private final String shellMaterial;

    /** Начальный внутренний радиус оболочки, см */
    private final double ri;

    /** Начальный внешний радиус оболочки, см */
    private final double ro;

    /** Атомная доля дейтерия в топливе */
    private final double fD;

    /** Атомная доля 3He в топливе */
    private final double f3He;

    /** Начальное давление газа, атм */
    private final double p0;

    /** Электронная температура газа, кэВ */
    private final double teGas;

    /** Электронная температура оболочки, кэВ */
    private final double teShell;

    /** Электронная температура абляционной массы, кэВ */
    private final double teAbl;

    /** Температура примеси (mix), кэВ */
    private final double teMix;

    /** Максимальная плотность абляционной массы, г/см³ */
    private final double rhoAblMax;

    /** Минимальная плотность абляционной массы, г/см³ */
    private final double rhoAblMin;

    /** Масштаб экспоненциального спада абляционной массы, см */
    private final double rhoAblScale;

    /** Доля массы оболочки, перемешанная в топливо */
    private final double mixF;

    /** Толщина оболочки в полёте, см */
    private final double tShell;

    /** Оставшаяся доля массы оболочки */
    private final double mRem;

    /** Начальная энергия протона, МэВ */
    private final double e0;

    /** Модель dE/dx для плазмы */
    private final DedxModel dedxModel;

    /** 1σ погрешности варьируемых параметров */
    private final EnumMap<ShellParamId, Double> uncertainties;

    public ShellModelParameters(String shellMaterial,
                                double ri,
                                double ro,
                                double fD,
                                double f3He,
                                double p0,

                                double teGas,
                                double teShell,
                                double teAbl,
                                double teMix,

                                double rhoAblMax,
                                double rhoAblMin,
                                double rhoAblScale,

                                double mixF,
                                double tShell,
                                double mRem,
                                double e0,
                                DedxModel dedxModel,
                                Map<ShellParamId, Double> uncertainties) {

        this.shellMaterial = Objects.requireNonNull(shellMaterial, "shellMaterial");
        if (!(ri > 0.0)) throw new IllegalArgumentException("Ri must be > 0: " + ri);
        if (!(ro > ri)) throw new IllegalArgumentException("Ro must be > Ri: Ro=" + ro + " Ri=" + ri);
        if (fD < 0.0 || f3He < 0.0) throw new IllegalArgumentException("fuel fractions must be >= 0");
        if (p0 < 0.0) throw new IllegalArgumentException("P0 must be >= 0: " + p0);
        if (!(teGas > 0.0 && teShell > 0.0 && teAbl > 0.0 && teMix > 0.0)) {
            throw new IllegalArgumentException("temperatures must be > 0");
        }
        if (!(rhoAblMax > 0.0 && rhoAblMin > 0.0 && rhoAblScale > 0.0)) {
            throw new IllegalArgumentException("ablated mass profile must be > 0");
        }
        if (mixF < 0.0) throw new IllegalArgumentException("MixF must be >= 0: " + mixF);
        if (!(tShell > 0.0)) throw new IllegalArgumentException("Tshell must be > 0: " + tShell);
        if (mRem < 0.0 || mRem > 1.0) throw new IllegalArgumentException("Mrem must be in [0,1]: " + mRem);
        if (!(e0 > 0.0)) throw new IllegalArgumentException("E0 must be > 0: " + e0);

        this.ri = ri;
        this.ro = ro;
        this.fD = fD;
        this.f3He = f3He;
        this.p0 = p0;
        this.teGas = teGas;
        this.teShell = teShell;
        this.teAbl = teAbl;
        this.teMix = teMix;
        this.rhoAblMax = rhoAblMax;
        this.rhoAblMin = rhoAblMin;
        this.rhoAblScale = rhoAblScale;
        this.mixF = mixF;
        this.tShell = tShell;
        this.mRem = mRem;
        this.e0 = e0;
        this.dedxModel = Objects.requireNonNull(dedxModel, "dedxModel");

        this.uncertainties = new EnumMap<>(ShellParamId.class);
        for (ShellParamId id : ShellParamId.values()) {
            Double s = (uncertainties == null) ? null : uncertainties.get(id);
            double sigma = (s != null) ? s : ShellParameterPool.get(id).getDefaultUncertainty();
            if (sigma < 0.0 || Double.isNaN(sigma)) {
                throw new IllegalArgumentException("uncertainty must be >= 0 for " + id + ": " + sigma);
            }
            this.uncertainties.put(id, sigma);
        }
    }

    /** Номинальное значение варьируемого параметра. */
    public double value(ShellParamId id) {
        return switch (id) {
            case RI -> ri;
            case RO -> ro;
            case FD -> fD;
            case F3HE -> f3He;
            case P0 -> p0;
            case TE_GAS -> teGas;
            case TE_SHELL -> teShell;
            case TE_ABL -> teAbl;
            case TE_MIX -> teMix;
            case RHO_ABL_MAX -> rhoAblMax;
            case RHO_ABL_MIN -> rhoAblMin;
            case RHO_ABL_SCALE -> rhoAblScale;
            case MIX_F -> mixF;
            case T_SHELL -> tShell;
            case M_REM -> mRem;
        };
    }

    /** 1σ погрешность параметра. */
    public double getUncertainty(ShellParamId id) {
        return uncertainties.get(id);
    }

    public Map<ShellParamId, Double> getUncertainties() {
        return Collections.unmodifiableMap(uncertainties);
    }

    // --------- геттеры ---------

    public String getShellMaterial() { return shellMaterial; }
    public double getRi() { return ri; }
    public double getRo() { return ro; }
    public double getFD() { return fD; }
    public double getF3He() { return f3He; }
    public double getP0() { return p0; }
    public double getTeGas() { return teGas; }
    public double getTeShell() { return teShell; }
    public double getTeAbl() { return teAbl; }
    public double getTeMix() { return teMix; }
    public double getRhoAblMax() { return rhoAblMax; }
    public double getRhoAblMin() { return rhoAblMin; }
    public double getRhoAblScale() { return rhoAblScale; }
    public double getMixF() { return mixF; }
    public double getTShell() { return tShell; }
    public double getMRem() { return mRem; }
    public double getE0() { return e0; }
    public DedxModel getDedxModel() { return dedxModel; }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US,
                "shell=%s Ri=%.4f Ro=%.4f fD=%.3f f3He=%.3f P0=%.2f Te=%.2f/%.2f/%.2f/%.2f "
                        + "rhoAbl=%.3f..%.3f/%.4f MixF=%.4f Tshell=%.4f Mrem=%.3f E0=%.2f",
                shellMaterial, ri, ro, fD, f3He, p0, teGas, teShell, teAbl, teMix,
                rhoAblMax, rhoAblMin, rhoAblScale, mixF, tShell, mRem, e0);
    }
}
