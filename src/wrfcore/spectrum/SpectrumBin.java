package wrfcore.spectrum;

/**
 * Бин спектра: энергия (МэВ), выход (1/МэВ), статистическая погрешность выхода.
 */
public record SpectrumBin(double energy, double yield, double error) {

    public SpectrumBin {
        if (!Double.isFinite(energy)) throw new IllegalArgumentException("energy must be finite: " + energy);
        if (error < 0.0) throw new IllegalArgumentException("error must be >= 0: " + error);
    }
}
