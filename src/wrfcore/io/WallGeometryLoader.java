package wrfcore.io;

import wrfcore.hohlraum.WallGeometry;
import wrfcore.hohlraum.WallPoint;
import wrfcore.physics.WallMaterial;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка геометрии стенки хольраума: строки "номер контура, материал (Au/DU/Al), r (см), z (см)".
 */
public class WallGeometryLoader {

    public WallGeometry load(Path path) throws IOException {
        List<WallPoint> points = new ArrayList<>();

        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (DelimitedLines.isComment(line)) continue;

                String[] parts = DelimitedLines.split(line);
                if (points.isEmpty() && !DelimitedLines.isNumber(parts[0])) continue; // заголовок
                if (parts.length < 4) {
                    throw new IOException("Ожидалось 4 столбца в строке " + lineNo + " (" + path + ")");
                }
                try {
                    points.add(new WallPoint(
                            Integer.parseInt(parts[0]),
                            WallMaterial.parse(parts[1]),
                            Double.parseDouble(parts[2]),
                            Double.parseDouble(parts[3])));
                } catch (IllegalArgumentException e) {
                    // NumberFormatException тоже сюда
                    throw new IOException("Ошибка в строке " + lineNo + " (" + path + "): " + e.getMessage(), e);
                }
            }
        }

        if (points.isEmpty()) {
            throw new IOException("Нет точек стенки (" + path + ")");
        }
        try {
            return new WallGeometry(points);
        } catch (IllegalArgumentException e) {
            throw new IOException("Неверная геометрия стенки (" + path + "): " + e.getMessage(), e);
        }
    }
}
