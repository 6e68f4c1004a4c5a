package wrfcore.physics;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Табличная тормозная способность: два столбца "энергия (кэВ), dE/dx (кэВ/мкм)".
 * Строки, начинающиеся с '#', и пустые строки пропускаются.
 */
public final class TabulatedStoppingPower extends AbstractStoppingPower {

    private final String name;
    private final PolynomialSplineFunction stopping;

    private final double eminKev;
    private final double emaxKev;

    public TabulatedStoppingPower(String name, double[] energyKev, double[] stoppingKevPerUm) {
        if (energyKev.length != stoppingKevPerUm.length) {
            throw new IllegalArgumentException("columns differ in length: "
                    + energyKev.length + " vs " + stoppingKevPerUm.length);
        }
        if (energyKev.length < 2) {
            throw new IllegalArgumentException("table " + name + " needs at least 2 rows");
        }
        this.name = name;
        this.stopping = new LinearInterpolator().interpolate(energyKev.clone(), stoppingKevPerUm.clone());
        this.eminKev = energyKev[0];
        this.emaxKev = energyKev[energyKev.length - 1];
    }

    public static TabulatedStoppingPower load(String name, Path path) throws IOException {
        List<double[]> rows = new ArrayList<>();

        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;

                String[] parts = line.split("[,;\\s]+");
                if (parts.length < 2) {
                    throw new IOException("Ожидалось 2 столбца в строке " + lineNo + " (" + path + ")");
                }
                try {
                    rows.add(new double[]{Double.parseDouble(parts[0]), Double.parseDouble(parts[1])});
                } catch (NumberFormatException e) {
                    throw new IOException("Не число в строке " + lineNo + " (" + path + "): " + line, e);
                }
            }
        }

        double[] e = new double[rows.size()];
        double[] s = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            e[i] = rows.get(i)[0];
            s[i] = rows.get(i)[1];
        }
        return new TabulatedStoppingPower(name, e, s);
    }

    @Override
    public double dEdx(double energyMeV) {
        if (energyMeV <= 0.0) return 0.0;
        double eKev = energyMeV * 1e3;

        double sKev;
        if (eKev < eminKev) {
            sKev = stopping.value(eminKev) * Math.sqrt(eKev / eminKev);
        } else if (eKev > emaxKev) {
            sKev = stopping.value(emaxKev);
        } else {
            sKev = stopping.value(eKev);
        }
        return -sKev / 1e3;
    }

    public String getName() {
        return name;
    }

    @Override
    public double getEmin() {
        return eminKev / 1e3;
    }

    @Override
    public double getEmax() {
        return emaxKev / 1e3;
    }
}
