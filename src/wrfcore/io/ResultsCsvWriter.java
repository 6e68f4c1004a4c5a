package wrfcore.io;

import wrfcore.analysis.ErrorContribution;
import wrfcore.config.ShellModelParameters;
import wrfcore.engine.AnalysisRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

public final class ResultsCsvWriter {

    private static final Locale RU = new Locale("ru", "RU");

    private ResultsCsvWriter() {}

    /**
     * Паспорт модели, затем строки "ключ;значение", разбивка модельной погрешности ρR
     * и, если были, численные проблемы анализа.
     */
    public static void write(Path path, ShellModelParameters params, AnalysisRecord record) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {

            w.write(csvCell(buildPassport(record.getName(), params)));
            w.newLine();

            w.write("key;value");
            w.newLine();
            for (Map.Entry<String, Double> e : record.asMap().entrySet()) {
                w.write(e.getKey() + ";" + fmt(e.getValue()));
                w.newLine();
            }

            w.newLine();
            w.write("rhoR model error (mg/cm2);value");
            w.newLine();
            for (ErrorContribution c : record.getRhoRBudget().contributions()) {
                w.write(c.name() + ";" + (c.dropped() ? "dropped" : fmt(c.error())));
                w.newLine();
            }

            if (!record.getIssues().isEmpty()) {
                w.newLine();
                w.write("issues;" + record.getIssues());
                w.newLine();
            }
        }
    }

    static String buildPassport(String name, ShellModelParameters p) {
        return String.format(RU,
                "shot=%s; shell=%s; Ri=%.1f um; Ro=%.1f um; fD=%.2f; f3He=%.2f; P0=%.1f atm; Tshell=%.1f um; Mrem=%.3f; E0=%.2f MeV; dEdx=%s",
                name,
                p.getShellMaterial(),
                p.getRi() * 1e4,
                p.getRo() * 1e4,
                p.getFD(),
                p.getF3He(),
                p.getP0(),
                p.getTShell() * 1e4,
                p.getMRem(),
                p.getE0(),
                p.getDedxModel()
        );
    }

    private static String csvCell(String s) {
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    private static String fmt(double v) {
        return Double.isNaN(v) ? "NaN" : String.format(RU, "%.6g", v);
    }
}
