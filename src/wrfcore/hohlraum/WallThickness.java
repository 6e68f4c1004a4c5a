package wrfcore.hohlraum;

import wrfcore.physics.WallMaterial;

import java.util.Locale;

/**
 * Толщины Au, DU, Al (мкм) и их 1σ погрешности (мкм).
 */
public record WallThickness(double au, double du, double al,
                            double dAu, double dDu, double dAl) {

    public double get(WallMaterial m) {
        return switch (m) {
            case AU -> au;
            case DU -> du;
            case AL -> al;
        };
    }

    /** Сдвиг толщин на sign·σ; меняются только положительные толщины, результат не меньше 0. */
    public WallThickness shifted(double sign) {
        return new WallThickness(
                shift(au, dAu, sign),
                shift(du, dDu, sign),
                shift(al, dAl, sign),
                dAu, dDu, dAl);
    }

    private static double shift(double t, double d, double sign) {
        if (t <= 0.0) return t;
        return Math.max(t + sign * d, 0.0);
    }

    /** Копия с добавкой к Au (не меньше 0). */
    public WallThickness withAuBump(double bumpUm) {
        return new WallThickness(Math.max(au + bumpUm, 0.0), du, al, dAu, dDu, dAl);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Au=%.2f±%.2f DU=%.2f±%.2f Al=%.2f±%.2f um",
                au, dAu, du, dDu, al, dAl);
    }
}
