package wrfcore.engine;

import wrfcore.analysis.ErrorBudget;
import wrfcore.analysis.ErrorContribution;
import wrfcore.analysis.RhoRWithError;
import wrfcore.analysis.SensitivityAnalyzer;
import wrfcore.analysis.ValueWithError;
import wrfcore.config.CorrectionOptions;
import wrfcore.config.FitOptions;
import wrfcore.config.ShellParamId;
import wrfcore.hohlraum.HohlraumCorrector;
import wrfcore.hohlraum.HohlraumFit;
import wrfcore.hohlraum.WallThickness;
import wrfcore.model.InverseRhoRSolver;
import wrfcore.physics.StoppingPowerLibrary;
import wrfcore.spectrum.GaussFitResult;
import wrfcore.spectrum.GaussianFitter;
import wrfcore.spectrum.Spectrum;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static wrfcore.analysis.SensitivityAnalyzer.finiteHalfSpread;
import static wrfcore.engine.AnalysisRecord.*;

/**
 * Полный анализ спектра: поправка на стенку, фит Гаусса, ρR и Rcm с погрешностями.
 * Модели ρR (номинальная и возмущённые) строятся один раз и переиспользуются для всех спектров.
 */
public final class SpectrumAnalyzer {

    private final SensitivityAnalyzer sensitivity;
    private final StoppingPowerLibrary stopping;
    private final boolean verbose;

    public SpectrumAnalyzer(SensitivityAnalyzer sensitivity, StoppingPowerLibrary stopping, boolean verbose) {
        this.sensitivity = Objects.requireNonNull(sensitivity, "sensitivity");
        this.stopping = Objects.requireNonNull(stopping, "stopping");
        this.verbose = verbose;
    }

    public SpectrumAnalyzer(SensitivityAnalyzer sensitivity, StoppingPowerLibrary stopping) {
        this(sensitivity, stopping, false);
    }

    public AnalysisRecord analyze(AnalysisRequest req) {
        Spectrum raw = req.getSpectrum();
        double[] random = req.getRandom();
        double[] systematic = req.getSystematic();
        Map<String, Double> out = new HashMap<>();

        double[] guess = (req.getFitGuess() != null) ? req.getFitGuess() : GaussianFitter.momentGuess(raw);
        CorrectionOptions options = req.getOptions()
                .withFitOptions(req.getOptions().getFitOptions().withInitialGuess(guess));

        // 1) поправка на стенку
        long t1 = System.currentTimeMillis();
        HohlraumCorrector corrector = buildCorrector(req, options);
        HohlraumFit hf = null;
        double[][] uncHohl = null;
        Spectrum corr = raw;
        FitOptions corrOptions = options.getFitOptions();
        GaussFitResult rawFit;
        GaussFitResult fit;

        if (corrector != null) {
            hf = corrector.fit(raw);
            uncHohl = corrector.uncertainty(raw, hf);
            corr = hf.corrected();
            corrOptions = corrector.correctedFitOptions(options.getFitOptions(), corrector.getThickness())
                    .withInitialGuess(hf.correctedFit().getParameters());
            rawFit = hf.rawFit();
            fit = hf.correctedFit();

            WallThickness t = corrector.getThickness();
            out.put(AU, t.au());
            out.put(AU_UNC, t.dAu());
            out.put(DU, t.du());
            out.put(DU_UNC, t.dDu());
            out.put(AL, t.al());
            out.put(AL_UNC, t.dAl());
            out.put(HOHL_Y_POSUNC, uncHohl[0][0]);
            out.put(HOHL_Y_NEGUNC, uncHohl[0][1]);
            out.put(HOHL_E_POSUNC, uncHohl[1][0]);
            out.put(HOHL_E_NEGUNC, uncHohl[1][1]);
            out.put(HOHL_SIGMA_POSUNC, uncHohl[2][0]);
            out.put(HOHL_SIGMA_NEGUNC, uncHohl[2][1]);
            if (verbose) {
                System.out.printf(Locale.US, "%s: hohlraum %s, shift %.4f MeV (%.1f s)%n",
                        raw.getName(), t, hf.energyShift(), (System.currentTimeMillis() - t1) / 1000.0);
            }
        } else {
            rawFit = new GaussianFitter(raw, options.getFitOptions()).fit();
            fit = rawFit;
            for (String k : new String[]{AU, AU_UNC, DU, DU_UNC, AL, AL_UNC,
                    HOHL_Y_POSUNC, HOHL_Y_NEGUNC, HOHL_E_POSUNC, HOHL_E_NEGUNC, HOHL_SIGMA_POSUNC, HOHL_SIGMA_NEGUNC}) {
                out.put(k, 0.0);
            }
        }

        // 2) погрешности спектра
        double[] ran = random.clone();
        if (req.isAddFitUncertainty()) {
            GaussianFitter fitter = new GaussianFitter(corr, corrOptions);
            double[][] uncFit = fitter.uncertainty(fit);
            fit = fit.withUncertainty(uncFit);
            for (int k = 0; k < 3; k++) {
                ran[k] = Math.sqrt(sq(ran[k]) + 0.25 * sq(uncFit[k][0] - uncFit[k][1]));
            }
        }
        if (uncHohl != null) {
            for (int k = 0; k < 3; k++) {
                ran[k] = Math.sqrt(sq(ran[k]) + 0.25 * sq(uncHohl[k][0] + uncHohl[k][1]));
            }
        }

        out.put(E_RAW, rawFit.getMean());
        out.put(E_RAW_RAN_UNC, random[GaussianFitter.MEAN]);
        out.put(E_RAW_SYS_UNC, systematic[GaussianFitter.MEAN]);
        out.put(YIELD, fit.getAmplitude());
        out.put(YIELD_RAN_UNC, ran[GaussianFitter.AMPLITUDE]);
        out.put(YIELD_SYS_UNC, systematic[GaussianFitter.AMPLITUDE]);
        out.put(ENERGY, fit.getMean());
        out.put(ENERGY_RAN_UNC, ran[GaussianFitter.MEAN]);
        out.put(ENERGY_SYS_UNC, systematic[GaussianFitter.MEAN]);
        out.put(SIGMA, fit.getSigma());
        out.put(SIGMA_RAN_UNC, ran[GaussianFitter.SIGMA]);
        out.put(SIGMA_SYS_UNC, systematic[GaussianFitter.SIGMA]);

        double e = fit.getMean();
        double dERandom = ran[GaussianFitter.MEAN];
        double dESystematic = systematic[GaussianFitter.MEAN];
        InverseRhoRSolver nominal = sensitivity.getNominal();

        // 3) ρR, г/см² -> мг/см²
        RhoRWithError rr = sensitivity.calcRhoR(e);
        double rhoRModel = rr.modelBudget().total();
        // конец E ± dE вне таблицы в размах не входит
        double rhoREnergyRandom = finiteHalfSpread(rr.rhoR(),
                nominal.calcRhoR(e + dERandom).rhoR(), nominal.calcRhoR(e - dERandom).rhoR());
        double rhoREnergySys = finiteHalfSpread(rr.rhoR(),
                nominal.calcRhoR(e + dESystematic).rhoR(), nominal.calcRhoR(e - dESystematic).rhoR());

        out.put(RHOR, rr.rhoR() * 1e3);
        out.put(RHOR_RAN_UNC, rhoREnergyRandom * 1e3);
        out.put(RHOR_SYS_UNC, Math.sqrt(sq(rhoRModel) + sq(rhoREnergySys)) * 1e3);
        out.put(RHOR_MODEL_UNC, rhoRModel * 1e3);

        // 4) Rcm, см -> мкм
        ValueWithError rcm = sensitivity.calcRcm(e, 0.0, true);
        double rcmModel = rcm.error();
        double rcmEnergyRandom = finiteHalfSpread(rcm.value(),
                nominal.calcRhoR(e + dERandom).rcm(), nominal.calcRhoR(e - dERandom).rcm());
        double rcmEnergySys = finiteHalfSpread(rcm.value(),
                nominal.calcRhoR(e + dESystematic).rcm(), nominal.calcRhoR(e - dESystematic).rcm());

        out.put(RCM, rcm.value() * 1e4);
        out.put(RCM_RAN_UNC, rcmEnergyRandom * 1e4);
        out.put(RCM_SYS_UNC, Math.sqrt(sq(rcmModel) + sq(rcmEnergySys)) * 1e4);
        out.put(RCM_MODEL_UNC, rcmModel * 1e4);

        ErrorBudget budget = rr.modelBudget().scaled(1e3);
        if (verbose) {
            System.out.printf(Locale.US, "%s: E=%.4f MeV, rhoR=%.2f mg/cm2 (model %.2f), Rcm=%.1f um (%.1f s)%n",
                    raw.getName(), e, out.get(RHOR), out.get(RHOR_MODEL_UNC), out.get(RCM),
                    (System.currentTimeMillis() - t1) / 1000.0);
            if (budget.droppedCount() > 0) {
                System.out.printf("%s: %d model parameter(s) dropped from the error sum%n",
                        raw.getName(), budget.droppedCount());
            }
        }
        Set<ErrorKind> issues = collectIssues(corrector, hf, rawFit, fit, rr, budget);
        if (!issues.isEmpty()) {
            System.err.printf("%s: analysis completed with issues %s%n", raw.getName(), issues);
        }
        return new AnalysisRecord(raw.getName(), out, budget, rawFit, fit, hf, issues);
    }

    private Set<ErrorKind> collectIssues(HohlraumCorrector corrector,
                                         HohlraumFit hf,
                                         GaussFitResult rawFit,
                                         GaussFitResult fit,
                                         RhoRWithError rr,
                                         ErrorBudget budget) {
        Set<ErrorKind> issues = EnumSet.noneOf(ErrorKind.class);
        if (!rawFit.isConverged() || !fit.isConverged()) issues.add(ErrorKind.CONVERGENCE_FAILURE);
        if (corrector != null) {
            for (Result<?> layer : corrector.getLayers()) {
                if (!layer.isOk()) issues.add(layer.getError());
            }
        }
        if (hf != null && hf.guardedBins() > 0) issues.add(ErrorKind.DIVISION_GUARD);
        if (Double.isNaN(rr.rhoR())) issues.add(ErrorKind.OUT_OF_RANGE_INPUT);

        Set<ShellParamId> failed = sensitivity.failedParameters();
        if (!failed.isEmpty()) issues.add(ErrorKind.INVALID_PARAMETERS);
        // NaN у построенной возмущённой модели: E вне её таблицы
        for (ErrorContribution c : budget.contributions()) {
            if (c.dropped() && !failed.contains(c.id())) issues.add(ErrorKind.OUT_OF_RANGE_INPUT);
        }
        return issues;
    }

    private HohlraumCorrector buildCorrector(AnalysisRequest req, CorrectionOptions options) {
        if (req.hasWall()) {
            return HohlraumCorrector.fromWall(req.getWall(), req.getLos(), stopping, options);
        }
        if (req.hasThickness()) {
            double[] t = req.getThicknessUm();
            return HohlraumCorrector.fromThickness(t[0], t[1], t[2], stopping, options);
        }
        return null;
    }

    private static double sq(double v) {
        return v * v;
    }

    public SensitivityAnalyzer getSensitivity() {
        return sensitivity;
    }
}
