package wrfcore.config;

/**
 * Параметры модели оболочки, которые варьируются в анализе чувствительности.
 * Начальная энергия протона E0 сюда не входит - она считается точной.
 */
public enum ShellParamId {

    // Начальная геометрия и заполнение
    RI,
    RO,
    FD,
    F3HE,
    P0,

    // Электронные температуры
    TE_GAS,
    TE_SHELL,
    TE_ABL,
    TE_MIX,

    // Профиль абляционной массы
    RHO_ABL_MAX,
    RHO_ABL_MIN,
    RHO_ABL_SCALE,

    // Перемешивание и оболочка в полёте
    MIX_F,
    T_SHELL,
    M_REM
}
