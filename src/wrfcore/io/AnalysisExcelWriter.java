package wrfcore.io;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import wrfcore.analysis.ErrorContribution;
import wrfcore.config.ShellModelParameters;
import wrfcore.engine.AnalysisRecord;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class AnalysisExcelWriter {

    public static final String RESULTS_SHEET = "RESULTS";
    public static final String BUDGET_SHEET = "RHOR_BUDGET";

    private AnalysisExcelWriter() {}

    public static void writeXlsx(Path path,
                                 ShellModelParameters params,
                                 List<AnalysisRecord> records) throws IOException {

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle passportStyle = wb.createCellStyle();
            passportStyle.setWrapText(false);
            passportStyle.setVerticalAlignment(VerticalAlignment.TOP);

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle numberStyle = wb.createCellStyle();
            numberStyle.setAlignment(HorizontalAlignment.CENTER);
            numberStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            numberStyle.setDataFormat(df.getFormat("0.000"));

            // ===== RESULTS sheet =====
            Sheet res = wb.createSheet(RESULTS_SHEET);
            int r = 0;

            Row row0 = res.createRow(r++);
            Cell passportCell = row0.createCell(0);
            passportCell.setCellValue(ResultsCsvWriter.buildPassport("-", params));
            passportCell.setCellStyle(passportStyle);
            res.setColumnWidth(0, 16 * 256);

            Row hdr = res.createRow(r++);
            int c = writeHeader(hdr, 0, "name", headerStyle);
            for (String key : AnalysisRecord.KEYS) {
                c = writeHeader(hdr, c, key, headerStyle);
            }

            for (AnalysisRecord rec : records) {
                Row rr = res.createRow(r++);
                rr.createCell(0).setCellValue(rec.getName());
                int cc = 1;
                for (String key : AnalysisRecord.KEYS) {
                    writeNumber(rr, cc++, rec.get(key), numberStyle);
                }
            }
            setWidths(res, hdr.getLastCellNum(), 1);

            // ===== RHOR_BUDGET sheet: строки - параметры, столбцы - спектры =====
            Sheet budget = wb.createSheet(BUDGET_SHEET);
            Row bh = budget.createRow(0);
            c = writeHeader(bh, 0, "parameter", headerStyle);
            for (AnalysisRecord rec : records) {
                c = writeHeader(bh, c, rec.getName(), headerStyle);
            }

            if (!records.isEmpty()) {
                List<ErrorContribution> first = records.get(0).getRhoRBudget().contributions();
                for (int i = 0; i < first.size(); i++) {
                    Row br = budget.createRow(i + 1);
                    br.createCell(0).setCellValue(first.get(i).name());
                    for (int k = 0; k < records.size(); k++) {
                        List<ErrorContribution> cs = records.get(k).getRhoRBudget().contributions();
                        if (i >= cs.size()) continue;
                        ErrorContribution ec = cs.get(i);
                        if (ec.dropped()) {
                            br.createCell(k + 1).setCellValue("dropped");
                        } else {
                            writeNumber(br, k + 1, ec.error(), numberStyle);
                        }
                    }
                }
                Row total = budget.createRow(first.size() + 1);
                total.createCell(0).setCellValue("total");
                for (int k = 0; k < records.size(); k++) {
                    writeNumber(total, k + 1, records.get(k).getRhoRBudget().total(), numberStyle);
                }
            }
            setWidths(budget, bh.getLastCellNum(), 0);

            try (OutputStream os = Files.newOutputStream(path)) {
                wb.write(os);
            }
        }
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    // autoSizeColumn требует шрифтов AWT, на headless-машинах ширина фиксированная
    private static void setWidths(Sheet sh, int cols, int fromCol) {
        for (int i = fromCol; i < cols; i++) sh.setColumnWidth(i, 14 * 256);
    }
}
