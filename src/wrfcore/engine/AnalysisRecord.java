package wrfcore.engine;

import wrfcore.analysis.ErrorBudget;
import wrfcore.hohlraum.HohlraumFit;
import wrfcore.spectrum.GaussFitResult;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Результат анализа одного спектра: упорядоченный набор именованных чисел
 * плюс разбивка модельной погрешности ρR по параметрам (мг/см²).
 * Величина, которую не удалось вычислить, равна NaN.
 */
public final class AnalysisRecord {

    // ===== стенка =====
    public static final String AU = "Au";
    public static final String AU_UNC = "Au_unc";
    public static final String DU = "DU";
    public static final String DU_UNC = "DU_unc";
    public static final String AL = "Al";
    public static final String AL_UNC = "Al_unc";
    public static final String HOHL_Y_POSUNC = "Hohl_Y_posunc";
    public static final String HOHL_Y_NEGUNC = "Hohl_Y_negunc";
    public static final String HOHL_E_POSUNC = "Hohl_E_posunc";
    public static final String HOHL_E_NEGUNC = "Hohl_E_negunc";
    public static final String HOHL_SIGMA_POSUNC = "Hohl_sigma_posunc";
    public static final String HOHL_SIGMA_NEGUNC = "Hohl_sigma_negunc";

    // ===== спектр =====
    public static final String E_RAW = "E_raw";
    public static final String E_RAW_RAN_UNC = "E_raw_ran_unc";
    public static final String E_RAW_SYS_UNC = "E_raw_sys_unc";
    public static final String YIELD = "Yield";
    public static final String YIELD_RAN_UNC = "Yield_ran_unc";
    public static final String YIELD_SYS_UNC = "Yield_sys_unc";
    public static final String ENERGY = "Energy";
    public static final String ENERGY_RAN_UNC = "Energy_ran_unc";
    public static final String ENERGY_SYS_UNC = "Energy_sys_unc";
    public static final String SIGMA = "Sigma";
    public static final String SIGMA_RAN_UNC = "Sigma_ran_unc";
    public static final String SIGMA_SYS_UNC = "Sigma_sys_unc";

    // ===== ρR, мг/см² =====
    public static final String RHOR = "rhoR";
    public static final String RHOR_RAN_UNC = "rhoR_ran_unc";
    public static final String RHOR_SYS_UNC = "rhoR_sys_unc";
    public static final String RHOR_MODEL_UNC = "rhoR_model_unc";

    // ===== Rcm, мкм =====
    public static final String RCM = "Rcm";
    public static final String RCM_RAN_UNC = "Rcm_ran_unc";
    public static final String RCM_SYS_UNC = "Rcm_sys_unc";
    public static final String RCM_MODEL_UNC = "Rcm_model_unc";

    /** Все ключи в порядке записи */
    public static final List<String> KEYS = List.of(
            AU, AU_UNC, DU, DU_UNC, AL, AL_UNC,
            HOHL_Y_POSUNC, HOHL_Y_NEGUNC, HOHL_E_POSUNC, HOHL_E_NEGUNC, HOHL_SIGMA_POSUNC, HOHL_SIGMA_NEGUNC,
            E_RAW, E_RAW_RAN_UNC, E_RAW_SYS_UNC,
            YIELD, YIELD_RAN_UNC, YIELD_SYS_UNC,
            ENERGY, ENERGY_RAN_UNC, ENERGY_SYS_UNC,
            SIGMA, SIGMA_RAN_UNC, SIGMA_SYS_UNC,
            RHOR, RHOR_RAN_UNC, RHOR_SYS_UNC, RHOR_MODEL_UNC,
            RCM, RCM_RAN_UNC, RCM_SYS_UNC, RCM_MODEL_UNC
    );

    private final String name;
    private final Map<String, Double> values;
    private final ErrorBudget rhoRBudget;
    private final GaussFitResult rawFit;
    private final GaussFitResult fit;
    private final HohlraumFit hohlraumFit;
    private final Set<ErrorKind> issues;

    AnalysisRecord(String name,
                   Map<String, Double> values,
                   ErrorBudget rhoRBudget,
                   GaussFitResult rawFit,
                   GaussFitResult fit,
                   HohlraumFit hohlraumFit,
                   Set<ErrorKind> issues) {
        for (String k : KEYS) {
            if (!values.containsKey(k)) throw new IllegalArgumentException("missing key " + k);
        }
        this.name = name;
        LinkedHashMap<String, Double> ordered = new LinkedHashMap<>();
        for (String k : KEYS) ordered.put(k, values.get(k));
        this.values = Collections.unmodifiableMap(ordered);
        this.rhoRBudget = rhoRBudget;
        this.rawFit = rawFit;
        this.fit = fit;
        this.hohlraumFit = hohlraumFit;
        this.issues = issues.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ErrorKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(issues));
    }

    public double get(String key) {
        Double v = values.get(key);
        if (v == null) throw new NoSuchElementException("no such key: " + key);
        return v;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public String getName() { return name; }
    public ErrorBudget getRhoRBudget() { return rhoRBudget; }
    public GaussFitResult getRawFit() { return rawFit; }
    public GaussFitResult getFit() { return fit; }

    /** null, если поправка на стенку не делалась */
    public HohlraumFit getHohlraumFit() { return hohlraumFit; }

    /**
     * Численные проблемы, встреченные при анализе (фит не сошёлся, слой стенки пропущен,
     * энергия вне таблицы и т.п.). Анализ при этом всё равно доходит до конца.
     */
    public Set<ErrorKind> getIssues() { return issues; }

    @Override
    public String toString() {
        return issues.isEmpty() ? name + " " + values : name + " " + values + " issues=" + issues;
    }
}
