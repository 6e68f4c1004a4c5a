package wrfcore.spectrum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Спектр протонов: упорядоченная по энергии последовательность бинов.
 * Энергии строго возрастают, ширина бина определяется по соседним энергиям.
 */
public final class Spectrum {

    private final String name;
    private final List<SpectrumBin> bins;

    public Spectrum(String name, List<SpectrumBin> bins) {
        Objects.requireNonNull(bins, "bins");
        if (bins.size() < 2) {
            throw new IllegalArgumentException("spectrum needs at least 2 bins, got " + bins.size());
        }
        for (int i = 1; i < bins.size(); i++) {
            if (!(bins.get(i).energy() > bins.get(i - 1).energy())) {
                throw new IllegalArgumentException(String.format(
                        "energies must be strictly increasing: bin %d (%.4f) after %.4f",
                        i, bins.get(i).energy(), bins.get(i - 1).energy()));
            }
        }
        this.name = (name == null) ? "" : name;
        this.bins = Collections.unmodifiableList(new ArrayList<>(bins));
    }

    public Spectrum(List<SpectrumBin> bins) {
        this("", bins);
    }

    /** Спектр из трёх параллельных массивов. */
    public static Spectrum of(String name, double[] energy, double[] yield, double[] error) {
        if (energy.length != yield.length || energy.length != error.length) {
            throw new IllegalArgumentException("arrays must have equal length");
        }
        List<SpectrumBin> list = new ArrayList<>(energy.length);
        for (int i = 0; i < energy.length; i++) {
            list.add(new SpectrumBin(energy[i], yield[i], error[i]));
        }
        return new Spectrum(name, list);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return bins.size();
    }

    public SpectrumBin get(int i) {
        return bins.get(i);
    }

    public List<SpectrumBin> getBins() {
        return bins;
    }

    public double energy(int i) {
        return bins.get(i).energy();
    }

    /**
     * Ширина бина i: разность с предыдущей энергией (для первого бина - со следующей).
     */
    public double binWidth(int i) {
        if (i > 0) return bins.get(i).energy() - bins.get(i - 1).energy();
        return bins.get(1).energy() - bins.get(0).energy();
    }

    public double minEnergy() {
        return bins.get(0).energy();
    }

    public double maxEnergy() {
        return bins.get(bins.size() - 1).energy();
    }

    /** Полный выход: сумма yield * ширина бина. */
    public double totalYield() {
        double s = 0.0;
        for (int i = 0; i < bins.size(); i++) {
            s += bins.get(i).yield() * binWidth(i);
        }
        return s;
    }

    @Override
    public String toString() {
        return String.format("Spectrum[%s, %d bins, %.3f..%.3f MeV]", name, size(), minEnergy(), maxEnergy());
    }
}
