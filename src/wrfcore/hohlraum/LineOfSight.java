package wrfcore.hohlraum;

import java.util.Locale;

/**
 * Диапазон полярных углов линии наблюдения, градусы.
 * Луч из начала координат под полярным углом θ: r = z / tan(90° - θ).
 */
public record LineOfSight(double thetaMin, double thetaMax) {

    public LineOfSight {
        if (!Double.isFinite(thetaMin) || !Double.isFinite(thetaMax)) {
            throw new IllegalArgumentException("LOS angles must be finite");
        }
        if (thetaMax < thetaMin) {
            throw new IllegalArgumentException(String.format(Locale.US,
                    "thetaMax < thetaMin: %.3f < %.3f", thetaMax, thetaMin));
        }
    }

    /** r луча при заданном z. */
    public static double rayRadius(double z, double thetaDeg) {
        return z / Math.tan(Math.toRadians(90.0 - thetaDeg));
    }

    /**
     * n углов: θmin + j·(θmax - θmin)/n, j = 0..n-1.
     */
    public double[] sampleAngles(int n) {
        double[] out = new double[n];
        double d = (thetaMax - thetaMin) / n;
        for (int j = 0; j < n; j++) out[j] = thetaMin + j * d;
        return out;
    }
}
