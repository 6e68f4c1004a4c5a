package wrfcore.config;

/**
 * Настройки поправки на стенку хольраума (immutable).
 */
public final class CorrectionOptions {

    /** 1σ погрешность толщины Au, мкм (используется, если не задана явно) */
    private final double dAuUm;

    /** 1σ погрешность толщины DU, мкм */
    private final double dDuUm;

    /** 1σ погрешность толщины Al, мкм */
    private final double dAlUm;

    /** Добавка к толщине Au ("bump"), мкм; итоговая толщина не меньше 0 */
    private final double bumpAuUm;

    /** Число углов в диапазоне LOS при расчёте толщины по геометрии */
    private final int angleSamples;

    /** Настройки фитов сырого и исправленного спектров */
    private final FitOptions fitOptions;

    /** Печатать ли диагностику */
    private final boolean verbose;

    public CorrectionOptions(double dAuUm,
                             double dDuUm,
                             double dAlUm,
                             double bumpAuUm,
                             int angleSamples,
                             FitOptions fitOptions,
                             boolean verbose) {
        if (dAuUm < 0 || dDuUm < 0 || dAlUm < 0) {
            throw new IllegalArgumentException("thickness uncertainties must be >= 0");
        }
        if (angleSamples < 2) throw new IllegalArgumentException("angleSamples must be >= 2");
        if (fitOptions == null) throw new IllegalArgumentException("fitOptions must not be null");
        this.dAuUm = dAuUm;
        this.dDuUm = dDuUm;
        this.dAlUm = dAlUm;
        this.bumpAuUm = bumpAuUm;
        this.angleSamples = angleSamples;
        this.fitOptions = fitOptions;
        this.verbose = verbose;
    }

    public static CorrectionOptions defaults() {
        return new CorrectionOptions(
                AnalysisConstants.DEFAULT_D_AU_UM,
                AnalysisConstants.DEFAULT_D_DU_UM,
                AnalysisConstants.DEFAULT_D_AL_UM,
                0.0,
                AnalysisConstants.LOS_ANGLE_SAMPLES,
                FitOptions.defaults(),
                false);
    }

    public CorrectionOptions withBump(double bumpAuUm) {
        return new CorrectionOptions(dAuUm, dDuUm, dAlUm, bumpAuUm, angleSamples, fitOptions, verbose);
    }

    public CorrectionOptions withFitOptions(FitOptions options) {
        return new CorrectionOptions(dAuUm, dDuUm, dAlUm, bumpAuUm, angleSamples, options, verbose);
    }

    public CorrectionOptions withVerbose(boolean v) {
        return new CorrectionOptions(dAuUm, dDuUm, dAlUm, bumpAuUm, angleSamples, fitOptions, v);
    }

    public double getDAuUm() { return dAuUm; }
    public double getDDuUm() { return dDuUm; }
    public double getDAlUm() { return dAlUm; }
    public double getBumpAuUm() { return bumpAuUm; }
    public int getAngleSamples() { return angleSamples; }
    public FitOptions getFitOptions() { return fitOptions; }
    public boolean isVerbose() { return verbose; }
}
