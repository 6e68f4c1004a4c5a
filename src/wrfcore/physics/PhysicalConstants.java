package wrfcore.physics;

/**
 * Физические константы в системе СГС.
 * Используются моделью тормозной способности плазмы и расчётом плотностей.
 */
public final class PhysicalConstants {

    /** Скорость света, см/с */
    public static final double C = 3e10;

    /** Масса электрона, г */
    public static final double ME = 9.109e-28;

    /** Масса протона, г */
    public static final double MP = 1.6726e-24;

    /** Энергия покоя протона, кэВ */
    public static final double MP_C2_KEV = 9.38e5;

    /** Энергия покоя электрона, МэВ */
    public static final double ME_C2_MEV = 0.510999;

    /** Энергия покоя протона, МэВ */
    public static final double MP_C2_MEV = 938.272;

    /** Постоянная Больцмана, эрг/К */
    public static final double KB = 1.381e-16;

    /** Постоянная Планка (приведённая), эрг·с */
    public static final double HBAR = 1.054e-27;

    /** Заряд электрона, ед. СГСЭ */
    public static final double E_CHARGE = 4.8e-10;

    /** 1 кэВ в кельвинах */
    public static final double KEV_TO_K = 1.16e7;

    /** 1 кэВ в эргах */
    public static final double KEV_TO_ERG = 1.602e-9;

    /** 1 эрг в МэВ */
    public static final double ERG_TO_MEV = 1e-13 / 1.602e-19;

    /** Коэффициент K формулы Бете, МэВ·см²/моль */
    public static final double BETHE_K = 0.307075;

    /** Микрометров в сантиметре */
    public static final double UM_PER_CM = 1e4;

    private PhysicalConstants() {}
}
