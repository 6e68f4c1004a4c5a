package wrfcore.io;

import wrfcore.spectrum.Spectrum;
import wrfcore.spectrum.SpectrumBin;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка спектра: строки "энергия (МэВ), выход (1/МэВ), погрешность".
 * Строки-заголовки до первой строки данных и комментарии '#' пропускаются.
 */
public class SpectrumCsvLoader {

    public Spectrum load(Path path) throws IOException {
        String file = path.getFileName().toString();
        String name = file.contains(".") ? file.substring(0, file.lastIndexOf('.')) : file;
        return load(path, name);
    }

    public Spectrum load(Path path, String name) throws IOException {
        List<SpectrumBin> bins = new ArrayList<>();

        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (DelimitedLines.isComment(line)) continue;

                String[] parts = DelimitedLines.split(line);
                if (bins.isEmpty() && !DelimitedLines.isNumber(parts[0])) continue; // заголовок
                if (parts.length < 3) {
                    throw new IOException("Ожидалось 3 столбца в строке " + lineNo + " (" + path + ")");
                }
                try {
                    bins.add(new SpectrumBin(
                            Double.parseDouble(parts[0]),
                            Double.parseDouble(parts[1]),
                            Double.parseDouble(parts[2])));
                } catch (NumberFormatException e) {
                    throw new IOException("Не число в строке " + lineNo + " (" + path + "): " + line, e);
                } catch (IllegalArgumentException e) {
                    throw new IOException("Неверный бин в строке " + lineNo + " (" + path + "): " + e.getMessage(), e);
                }
            }
        }

        try {
            return new Spectrum(name, bins);
        } catch (IllegalArgumentException e) {
            throw new IOException("Неверный спектр (" + path + "): " + e.getMessage(), e);
        }
    }
}
