package wrfcore.config;

/**
 * Глобальные константы анализа.
 * Численные параметры моделей и алгоритмов должны находиться здесь.
 */
public final class AnalysisConstants {

    // =========================================================================
    // ===========================   МОДЕЛЬ rhoR  ==============================
    // =========================================================================

    /** Шагов по радиусу на одну область (газ, оболочка, части абляционного слоя) */
    public static final int STEPS_PER_REGION = 100;

    /** Шагов RK4 при прохождении однородной области (газ, оболочка, хвост абляционного слоя) */
    public static final int RK4_STEPS_PER_REGION = 50;

    /** Шаг таблицы по Rcm: dr = Rcm / TABLE_STEP_DIVISOR */
    public static final double TABLE_STEP_DIVISOR = 50.0;

    /** Предельное число точек в таблице Rcm-Eout-rhoR */
    public static final int MAX_TABLE_POINTS = 10_000;

    /** Минимальная концентрация частиц в плазме, 1/см³ (нулевая ломает модель dE/dx) */
    public static final double MIN_NUMBER_DENSITY = 1.0;

    /** Плотность D2 при н.у., г/см³ */
    public static final double RHO_D2_STP = 2 * 0.08988e-3;

    /** Плотность 3He при н.у., г/см³ */
    public static final double RHO_3HE_STP = (3.0 / 4.0) * 0.1786e-3;

    /** Шаг по Rcm при оценке ошибки Rcm от погрешности энергии, см */
    public static final double RCM_SCAN_STEP_CM = 1e-4;

    /** Предел числа шагов при таком сканировании */
    public static final int RCM_SCAN_MAX_STEPS = 100_000;

    // =========================================================================
    // ===========================   ФИТ ГАУССА  ===============================
    // =========================================================================

    /** Прирост chi2, задающий 1σ неопределённость параметра */
    public static final double DELTA_CHI2_ONE_SIGMA = 1.0;

    /** Окно учёта бинов в chi2 вокруг среднего, в σ */
    public static final double CHI2_RESTRICT_SIGMAS = 5.0;

    /** Максимум вычислений функции в симплекс-методе */
    public static final int SIMPLEX_MAX_EVAL = 20_000;

    /** Максимум вычислений функции в одномерном поиске */
    public static final int SEARCH_MAX_EVAL = 200;

    // =========================================================================
    // ===========================   ХОЛЬРАУМ  =================================
    // =========================================================================

    /** Точек по углу внутри диапазона LOS */
    public static final int LOS_ANGLE_SAMPLES = 50;

    /** Точность поиска пересечения луча со стенкой, см */
    public static final double INTERSECTION_TOLERANCE_CM = 1e-7;

    /** Допустимый промах при пересечении луча со стенкой, см */
    public static final double INTERSECTION_MISS_CM = 1e-4;

    /** Погрешности толщин Au, DU, Al по умолчанию, мкм */
    public static final double DEFAULT_D_AU_UM = 1.0;
    public static final double DEFAULT_D_DU_UM = 1.0;
    public static final double DEFAULT_D_AL_UM = 3.0;

    private AnalysisConstants() {}
}
