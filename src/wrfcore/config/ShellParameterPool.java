package wrfcore.config;

import java.util.*;

/**
 * Каталог всех параметров модели оболочки, которые варьируются в анализе чувствительности.
 * Погрешности по умолчанию и логика применения задаются один раз здесь.
 */
public final class ShellParameterPool {

    private static final Map<ShellParamId, ShellParameter> PARAMS;

    static {
        Map<ShellParamId, ShellParameter> m = new EnumMap<>(ShellParamId.class);

        // ----- Начальная геометрия и заполнение -----
        m.put(ShellParamId.RI,
                new ShellParameter(ShellParamId.RI, "Ri", 5e-4,
                        (b, v) -> b.setRi(v)));
        m.put(ShellParamId.RO,
                new ShellParameter(ShellParamId.RO, "Ro", 5e-4,
                        (b, v) -> b.setRo(v)));
        m.put(ShellParamId.FD,
                new ShellParameter(ShellParamId.FD, "fD", 0.0,
                        (b, v) -> b.setFD(v)));
        m.put(ShellParamId.F3HE,
                new ShellParameter(ShellParamId.F3HE, "f3He", 0.0,
                        (b, v) -> b.setF3He(v)));
        m.put(ShellParamId.P0,
                new ShellParameter(ShellParamId.P0, "P0", 1.0,
                        (b, v) -> b.setP0(v)));

        // ----- Температуры -----
        m.put(ShellParamId.TE_GAS,
                new ShellParameter(ShellParamId.TE_GAS, "Te_Gas", 2.0,
                        (b, v) -> b.setTeGas(v)));
        m.put(ShellParamId.TE_SHELL,
                new ShellParameter(ShellParamId.TE_SHELL, "Te_Shell", 0.1,
                        (b, v) -> b.setTeShell(v)));
        m.put(ShellParamId.TE_ABL,
                new ShellParameter(ShellParamId.TE_ABL, "Te_Abl", 0.1,
                        (b, v) -> b.setTeAbl(v)));
        m.put(ShellParamId.TE_MIX,
                new ShellParameter(ShellParamId.TE_MIX, "Te_Mix", 0.2,
                        (b, v) -> b.setTeMix(v)));

        // ----- Абляционная масса -----
        m.put(ShellParamId.RHO_ABL_MAX,
                new ShellParameter(ShellParamId.RHO_ABL_MAX, "rho_Abl_Max", 0.5,
                        (b, v) -> b.setRhoAblMax(v)));
        m.put(ShellParamId.RHO_ABL_MIN,
                new ShellParameter(ShellParamId.RHO_ABL_MIN, "rho_Abl_Min", 0.05,
                        (b, v) -> b.setRhoAblMin(v)));
        m.put(ShellParamId.RHO_ABL_SCALE,
                new ShellParameter(ShellParamId.RHO_ABL_SCALE, "rho_Abl_Scale", 30e-4,
                        (b, v) -> b.setRhoAblScale(v)));

        // ----- Mix и оболочка в полёте -----
        m.put(ShellParamId.MIX_F,
                new ShellParameter(ShellParamId.MIX_F, "MixF", 0.005,
                        (b, v) -> b.setMixF(v)));
        m.put(ShellParamId.T_SHELL,
                new ShellParameter(ShellParamId.T_SHELL, "Tshell", 10e-4,
                        (b, v) -> b.setTShell(v)));
        m.put(ShellParamId.M_REM,
                new ShellParameter(ShellParamId.M_REM, "Mrem", 0.05,
                        (b, v) -> b.setMRem(v)));

        PARAMS = Collections.unmodifiableMap(m);
    }

    private ShellParameterPool() {}

    public static ShellParameter get(ShellParamId id) {
        ShellParameter p = PARAMS.get(id);
        if (p == null) throw new IllegalArgumentException("Unknown parameter: " + id);
        return p;
    }

    public static Collection<ShellParameter> all() {
        return PARAMS.values();
    }
}
