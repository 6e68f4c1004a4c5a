package wrfcore;

import wrfcore.analysis.SensitivityAnalyzer;
import wrfcore.config.ShellModelParameters;
import wrfcore.engine.AnalysisRecord;
import wrfcore.engine.AnalysisRequest;
import wrfcore.engine.SpectrumAnalyzer;
import wrfcore.hohlraum.LineOfSight;
import wrfcore.io.AnalysisExcelWriter;
import wrfcore.io.ResultsCsvWriter;
import wrfcore.physics.StoppingPowerLibrary;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main &lt;spectrum.csv&gt; [wall.csv thetaMin thetaMax] [out.xlsx]
 */
public class Main {

    public static void main(String[] args) {

        if (args.length < 1) {
            System.err.println("Usage: Main <spectrum.csv> [wall.csv thetaMin thetaMax] [out.xlsx]");
            System.exit(2);
        }

        Path spectrumPath = Paths.get(args[0]);
        Path wallPath = null;
        LineOfSight los = null;
        int next = 1;
        if (args.length >= 4) {
            wallPath = Paths.get(args[1]);
            los = new LineOfSight(Double.parseDouble(args[2]), Double.parseDouble(args[3]));
            next = 4;
        }
        Path xlsxPath = (args.length > next) ? Paths.get(args[next]) : null;

        int threads = Runtime.getRuntime().availableProcessors();

        try {
            // 1) входные данные
            ShotFactory.LoadedShot shot = ShotFactory.load(spectrumPath, wallPath);
            // 2) модель и её возмущения
            ShellModelParameters params = ShotFactory.defaultParams();
            SensitivityAnalyzer sensitivity;
            ExecutorService ex = Executors.newFixedThreadPool(threads);
            try {
                long t0 = System.currentTimeMillis();
                sensitivity = SensitivityAnalyzer.build(params, ex, false);
                System.out.printf(Locale.US, "rhoR models built: %d perturbed (%.1f s)%n",
                        sensitivity.perturbedModelCount(), (System.currentTimeMillis() - t0) / 1000.0);
            } finally {
                ex.shutdown();
            }
            // 3) анализ
            AnalysisRequest req = AnalysisRequest.of(shot.spectrum())
                    .withOptions(ShotFactory.defaultCorrectionOptions().withVerbose(true));
            if (shot.wall() != null) {
                req = req.withWall(shot.wall(), los);
            }
            SpectrumAnalyzer analyzer = new SpectrumAnalyzer(sensitivity, StoppingPowerLibrary.coldMatter(), true);
            AnalysisRecord rec = analyzer.analyze(req);

            Path csvPath = Paths.get(rec.getName() + "_Analysis.csv");
            ResultsCsvWriter.write(csvPath, params, rec);
            System.out.println("Saved: " + csvPath);
            if (xlsxPath != null) {
                AnalysisExcelWriter.writeXlsx(xlsxPath, params, List.of(rec));
                System.out.println("Saved: " + xlsxPath);
            }

        } catch (Exception e) {
            System.err.println("Ошибка: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
