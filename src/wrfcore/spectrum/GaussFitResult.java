package wrfcore.spectrum;

import java.util.Locale;

/**
 * Результат фита Гаусса (immutable).
 * Асимметричная погрешность хранится как [[-A, +A], [-μ, +μ], [-σ, +σ]] (отрицательная часть со знаком минус).
 */
public final class GaussFitResult {

    private final double amplitude;
    private final double mean;
    private final double sigma;

    private final double chi2;
    private final int binsUsed;

    /** false, если симплекс исчерпал лимит вычислений (результат - лучшая найденная точка) */
    private final boolean converged;

    /** null, пока погрешность не посчитана */
    private final double[][] uncertainty;

    public GaussFitResult(double amplitude, double mean, double sigma,
                          double chi2, int binsUsed, boolean converged,
                          double[][] uncertainty) {
        this.amplitude = amplitude;
        this.mean = mean;
        this.sigma = sigma;
        this.chi2 = chi2;
        this.binsUsed = binsUsed;
        this.converged = converged;
        this.uncertainty = (uncertainty == null) ? null : copy(uncertainty);
    }

    public GaussFitResult withUncertainty(double[][] unc) {
        if (unc == null || unc.length != 3) throw new IllegalArgumentException("uncertainty must be 3x2");
        return new GaussFitResult(amplitude, mean, sigma, chi2, binsUsed, converged, unc);
    }

    /** Гауссиана с параметрами фита в точке x. */
    public double evaluate(double x) {
        return gaussian(x, amplitude, mean, sigma);
    }

    /** G(x) = A·exp(-(x-μ)²/(2σ²)) / (σ·√(2π)); A - полный выход. */
    public static double gaussian(double x, double a, double mu, double sigma) {
        double t = (x - mu) / sigma;
        return a * Math.exp(-0.5 * t * t) / (Math.sqrt(2.0 * Math.PI) * sigma);
    }

    public double getAmplitude() { return amplitude; }
    public double getMean() { return mean; }
    public double getSigma() { return sigma; }

    public double[] getParameters() {
        return new double[]{amplitude, mean, sigma};
    }

    public double getChi2() { return chi2; }

    /** chi2 / (N - 3); NaN, если бинов не больше трёх. */
    public double getReducedChi2() {
        return (binsUsed > 3) ? chi2 / (binsUsed - 3) : Double.NaN;
    }

    public int getBinsUsed() { return binsUsed; }
    public boolean isConverged() { return converged; }

    public boolean hasUncertainty() {
        return uncertainty != null;
    }

    public double[][] getUncertainty() {
        return (uncertainty == null) ? null : copy(uncertainty);
    }

    /** Симметризованная погрешность параметра: (|-| + |+|) / 2. */
    public double symmetricUncertainty(int parameter) {
        if (uncertainty == null) return Double.NaN;
        return 0.5 * (Math.abs(uncertainty[parameter][0]) + Math.abs(uncertainty[parameter][1]));
    }

    private static double[][] copy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) out[i] = src[i].clone();
        return out;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Y=%.4e E=%.4f MeV sigma=%.4f MeV chi2red=%.3f%s",
                amplitude, mean, sigma, getReducedChi2(), converged ? "" : " (not converged)");
    }
}
