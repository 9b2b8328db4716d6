package com.smartexpense.categorizer.service;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import com.smartexpense.categorizer.model.ImportSummary;
import com.smartexpense.categorizer.model.TrainingExample;
import com.smartexpense.categorizer.model.WordFrequency;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bulk training from labelled exports (CSV, XLSX, XLS) and CSV export of the training audit log.
 * <ul>
 *   <li>Columns are detected from the header row by name: description/desc/narration/note,
 *   merchant, category, id/transaction, weight.</li>
 *   <li>Rows without text, without a category or with a category over 255 characters are
 *   skipped, everything else is trained.</li>
 * </ul>
 */
@Slf4j
@Service
public class TrainingDataService {

    static final String[] EXPORT_HEADER = {"id", "transactionId", "text", "category", "createdAt"};

    private final CategorizationService categorizationService;
    private final FrequencyStore store;

    public TrainingDataService(CategorizationService categorizationService, FrequencyStore store) {
        this.categorizationService = categorizationService;
        this.store = store;
    }

    public ImportSummary importTrainingFile(MultipartFile file) throws IOException {
        List<LabelledRow> rows = parseFile(file);
        int trained = 0;
        for (LabelledRow row : rows) {
            if (!row.isUsable()) continue;
            categorizationService.trainOnTransaction(row.transactionId, row.note, row.merchant, row.category, row.weight);
            trained++;
        }
        ImportSummary summary = new ImportSummary(file.getOriginalFilename(), rows.size(), trained, rows.size() - trained);
        log.info("Imported {}: {} rows read, {} trained, {} skipped",
                summary.sourceFile(), summary.rowsRead(), summary.rowsTrained(), summary.rowsSkipped());
        return summary;
    }

    List<LabelledRow> parseFile(MultipartFile file) throws IOException {
        String name = file.getOriginalFilename() == null ? "" : file.getOriginalFilename();
        String ext = FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);
        switch (ext) {
            case "csv":
                return parseCsv(file, name);
            case "xlsx":
            case "xls":
                return parseExcel(file, name);
            default:
                throw new IllegalArgumentException("Unsupported file type: " + ext);
        }
    }

    private List<LabelledRow> parseCsv(MultipartFile file, String name) throws IOException {
        List<LabelledRow> list = new ArrayList<>();
        try (InputStream is = file.getInputStream();
             InputStreamReader isr = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(isr)) {

            String[] header = reader.readNext();
            if (header == null) return list;
            Map<String, Integer> idx = detectColumns(header);
            if (!idx.containsKey("category")) {
                throw new IOException("CSV has no category column: " + name);
            }
            String[] row;
            int line = 1;
            while ((row = reader.readNext()) != null) {
                line++;
                if (row.length == 0 || (row.length == 1 && row[0].isBlank())) continue;
                list.add(toRow(idx, row, name, line));
            }
        } catch (CsvValidationException e) {
            throw new IOException("CSV parse error", e);
        }
        return list;
    }

    private List<LabelledRow> parseExcel(MultipartFile file, String name) throws IOException {
        List<LabelledRow> list = new ArrayList<>();
        DataFormatter formatter = new DataFormatter(Locale.ROOT);
        try (InputStream is = file.getInputStream(); Workbook wb = WorkbookFactory.create(is)) {
            Sheet sheet = wb.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) return list;

            String[] header = cellsOf(headerRow, headerRow.getLastCellNum(), formatter);
            Map<String, Integer> idx = detectColumns(header);
            if (!idx.containsKey("category")) {
                throw new IOException("Sheet has no category column: " + name);
            }
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;
                list.add(toRow(idx, cellsOf(row, header.length, formatter), name, r + 1));
            }
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Excel parse error", e);
        }
        return list;
    }

    private String[] cellsOf(Row row, int width, DataFormatter formatter) {
        String[] cells = new String[Math.max(0, width)];
        for (int i = 0; i < cells.length; i++) {
            Cell c = row.getCell(i);
            cells[i] = c == null ? "" : formatter.formatCellValue(c);
        }
        return cells;
    }

    // header name -> column index; first matching column wins
    static Map<String, Integer> detectColumns(String[] header) {
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String h = header[i] == null ? "" : header[i].trim().toLowerCase(Locale.ROOT);
            if (h.contains("category")) idx.putIfAbsent("category", i);
            else if (h.contains("merchant") || h.contains("payee")) idx.putIfAbsent("merchant", i);
            else if (h.contains("desc") || h.contains("narration") || h.contains("note")) idx.putIfAbsent("note", i);
            else if (h.contains("weight")) idx.putIfAbsent("weight", i);
            else if (h.equals("id") || h.contains("transaction") || h.contains("txn")) idx.putIfAbsent("id", i);
        }
        return idx;
    }

    private LabelledRow toRow(Map<String, Integer> idx, String[] row, String sourceFile, int line) {
        LabelledRow r = new LabelledRow();
        r.note = cell(idx, row, "note");
        r.merchant = cell(idx, row, "merchant");
        r.category = cell(idx, row, "category");
        String id = cell(idx, row, "id");
        r.transactionId = id.isEmpty() ? "import:" + sourceFile + ":" + line : id;
        String weight = cell(idx, row, "weight");
        if (!weight.isEmpty()) {
            try {
                r.weight = Double.parseDouble(weight);
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable weight '{}' on line {} of {}", weight, line, sourceFile);
            }
        }
        return r;
    }

    private static String cell(Map<String, Integer> idx, String[] row, String column) {
        Integer i = idx.get(column);
        if (i == null || i >= row.length || row[i] == null) return "";
        return row[i].trim();
    }

    public byte[] exportTrainingExamplesCsv() throws IOException {
        List<TrainingExample> examples = store.listTrainingExamples();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CSVWriter writer = new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
            writer.writeNext(EXPORT_HEADER);
            for (TrainingExample e : examples) {
                writer.writeNext(new String[] {
                        e.getId(),
                        e.getTransactionId() == null ? "" : e.getTransactionId(),
                        e.getText() == null ? "" : e.getText(),
                        e.getCategory(),
                        e.getCreatedAt() == null ? "" : e.getCreatedAt().toString()
                });
            }
        }
        return out.toByteArray();
    }

    static final class LabelledRow {
        String transactionId;
        String note = "";
        String merchant = "";
        String category = "";
        double weight = 1;

        boolean isUsable() {
            return !category.isEmpty() && category.length() <= WordFrequency.KEY_LENGTH
                    && !(note.isEmpty() && merchant.isEmpty());
        }
    }
}
