package wrfcore.physics;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Состав материала оболочки для расчёта тормозной способности.
 * <p>
 * Спецификация: значения через дефис, каждое - необязательный молекулярный процент
 * и обозначение вещества. Известны соединения CH (пластик), CH2, HDC (алмаз), SiO2 (стекло)
 * и элементы H, Be, C, O, Si, Ge, W. Слова "with" и "and" игнорируются.
 * Например, "CH-with-2Ge" - пластик, легированный 2% германия.
 * Плотность берётся по первому компоненту.
 */
public final class ShellMaterial {

    private static final Map<String, Map<String, Double>> COMPOSITION = new HashMap<>();
    private static final Map<String, Double> DENSITY = new HashMap<>();
    private static final Map<String, Double> ELEMENT_A = new HashMap<>();
    private static final Map<String, Double> ELEMENT_Z = new HashMap<>();

    private static final Pattern PART = Pattern.compile("([0-9.]*)([A-Z].*)");

    static {
        COMPOSITION.put("CH", linked("C", 1.000, "H", 1.352, "O", 0.012));
        COMPOSITION.put("CH2", linked("C", 1.0, "H", 2.0));
        COMPOSITION.put("HDC", linked("C", 1.0));
        COMPOSITION.put("SiO2", linked("Si", 1.0, "O", 2.0));

        DENSITY.put("CH", 1.084);
        DENSITY.put("CH2", 1.084);
        DENSITY.put("HDC", 3.5);
        DENSITY.put("SiO2", 2.56);
        DENSITY.put("Be", 1.85);

        ELEMENT_A.put("H", 1.0);
        ELEMENT_A.put("Be", 9.0);
        ELEMENT_A.put("C", 12.0);
        ELEMENT_A.put("O", 16.0);
        ELEMENT_A.put("Si", 28.1);
        ELEMENT_A.put("Ge", 72.6);
        ELEMENT_A.put("W", 183.8);

        ELEMENT_Z.put("H", 1.0);
        ELEMENT_Z.put("Be", 4.0);
        ELEMENT_Z.put("C", 6.0);
        ELEMENT_Z.put("O", 8.0);
        ELEMENT_Z.put("Si", 14.0);
        ELEMENT_Z.put("Ge", 32.0);
        ELEMENT_Z.put("W", 74.0);
    }

    private final String specifier;
    private final double rho;
    private final double[] a;
    private final double[] z;
    private final double[] f;
    private final double avgA;
    private final double avgZ;

    private ShellMaterial(String specifier, double rho, double[] a, double[] z, double[] f) {
        this.specifier = specifier;
        this.rho = rho;
        this.a = a;
        this.z = z;
        this.f = f;

        double sa = 0.0, sz = 0.0;
        for (int i = 0; i < f.length; i++) {
            sa += a[i] * f[i];
            sz += z[i] * f[i];
        }
        this.avgA = sa;
        this.avgZ = sz;
    }

    public static ShellMaterial parse(String specifier) {
        Objects.requireNonNull(specifier, "specifier");
        String[] codes = specifier.split("-");

        List<String> elements = new ArrayList<>();
        List<Double> abundance = new ArrayList<>();
        double totalF = 0.0;
        Double rho = null;

        // разбираем с конца: у первого компонента доля = 1 - сумма остальных
        for (int k = codes.length - 1; k >= 0; k--) {
            String code = codes[k];
            boolean first = (k == 0);

            if (code.equals("with") || code.equals("and")) {
                if (first) {
                    throw new IllegalArgumentException("a material formula cannot start with " + code);
                }
                continue;
            }

            Matcher m = PART.matcher(code);
            if (!m.matches()) {
                throw new IllegalArgumentException("Could not parse '" + code + "' in '" + specifier + "'");
            }
            String compound = m.group(2);
            double moleculeF;
            if (!m.group(1).isEmpty()) {
                moleculeF = Double.parseDouble(m.group(1)) / 100.0;
                totalF += moleculeF;
            } else if (!first) {
                throw new IllegalArgumentException(
                        "a fraction must be specified for all components after the first: " + specifier);
            } else {
                moleculeF = 1.0 - totalF;
            }

            if (COMPOSITION.containsKey(compound)) {
                for (Map.Entry<String, Double> el : COMPOSITION.get(compound).entrySet()) {
                    elements.add(el.getKey());
                    abundance.add(moleculeF * el.getValue());
                }
            } else if (ELEMENT_Z.containsKey(compound)) {
                elements.add(compound);
                abundance.add(moleculeF);
            } else {
                throw new IllegalArgumentException("Unknown material '" + compound + "'");
            }

            if (first) {
                rho = DENSITY.get(compound);
                if (rho == null) {
                    throw new IllegalArgumentException("No density known for '" + compound + "'");
                }
            }
        }

        double total = 0.0;
        for (double v : abundance) total += v;

        int n = elements.size();
        double[] a = new double[n];
        double[] z = new double[n];
        double[] f = new double[n];
        for (int i = 0; i < n; i++) {
            a[i] = ELEMENT_A.get(elements.get(i));
            z[i] = ELEMENT_Z.get(elements.get(i));
            f[i] = abundance.get(i) / total;
        }
        return new ShellMaterial(specifier, rho, a, z, f);
    }

    private static Map<String, Double> linked(Object... kv) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], (Double) kv[i + 1]);
        }
        return m;
    }

    public String getSpecifier() { return specifier; }

    /** Плотность, г/см³ */
    public double getRho() { return rho; }

    public int speciesCount() { return f.length; }

    public double getA(int i) { return a[i]; }
    public double getZ(int i) { return z[i]; }

    /** Атомная доля сорта i */
    public double getFraction(int i) { return f[i]; }

    public double getAvgA() { return avgA; }
    public double getAvgZ() { return avgZ; }

    @Override
    public String toString() {
        return specifier;
    }
}
