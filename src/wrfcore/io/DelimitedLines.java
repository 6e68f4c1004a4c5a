package wrfcore.io;

/**
 * Разбор строк табличных файлов.
 * Если в строке есть ';', разделитель - ';', а запятая считается десятичной;
 * иначе разделители - запятая и пробелы.
 */
final class DelimitedLines {

    private DelimitedLines() {}

    static String[] split(String line) {
        String s = line.trim();
        if (s.indexOf(';') >= 0) {
            String[] parts = s.split("\\s*;\\s*");
            for (int i = 0; i < parts.length; i++) parts[i] = parts[i].trim().replace(",", ".");
            return parts;
        }
        return s.split("[,\\s]+");
    }

    static boolean isComment(String line) {
        String s = line.trim();
        return s.isEmpty() || s.startsWith("#");
    }

    static boolean isNumber(String s) {
        try {
            Double.parseDouble(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
