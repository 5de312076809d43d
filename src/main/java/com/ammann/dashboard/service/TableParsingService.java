/* (C)2026 */
package com.ammann.dashboard.service;

import com.ammann.dashboard.exception.UnsupportedInputException;
import com.ammann.dashboard.exception.ValidationException;
import com.ammann.dashboard.model.RawTable;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.util.RecordFormatException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Parses uploaded file content into a {@link RawTable}.
 *
 * <p>Comma-separated files ({@code .csv}) and spreadsheets ({@code .xlsx}, {@code .xls}) are
 * supported. The first record (or the first row of the first sheet) is the header; every
 * further record becomes a row. CSV cells stay strings, spreadsheet cells keep their stored
 * type ({@link Double}, {@link String}, {@link Boolean} or {@link java.time.LocalDateTime}
 * for date-formatted numbers). Blank cells become {@code null}; all other type inference is
 * left to {@link DataCleaningService}.
 *
 * <p>A blank header cell is named {@code Unnamed: <index>}, with the zero-based column index.
 *
 * <p>The maximum accepted upload size is configurable via {@code dashboard.upload.max-bytes}.
 */
@ApplicationScoped
public class TableParsingService {

    private static final Logger LOG = Logger.getLogger(TableParsingService.class);

    static final long DEFAULT_MAX_BYTES = 50L * 1024 * 1024;
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String UNNAMED_PREFIX = "Unnamed: ";
    private static final List<String> SPREADSHEET_EXTENSIONS = List.of(".xlsx", ".xls");

    @ConfigProperty(name = "dashboard.upload.max-bytes", defaultValue = "52428800")
    long maxBytes = DEFAULT_MAX_BYTES;

    /**
     * Parses file content, choosing the format by file name extension.
     *
     * @param content  raw file bytes
     * @param filename original file name
     * @return parsed raw table
     * @throws ValidationException       if the file is empty, too large or of an unsupported format
     * @throws UnsupportedInputException if the content is structurally malformed
     */
    public RawTable parse(byte[] content, String filename) {
        if (filename == null || filename.isBlank()) {
            throw ValidationException.invalidParameter(
                    "filename", filename, "a file name ending in .csv, .xlsx or .xls");
        }
        String lowerName = filename.toLowerCase(Locale.ROOT);
        boolean spreadsheet = SPREADSHEET_EXTENSIONS.stream().anyMatch(lowerName::endsWith);
        if (!spreadsheet && !lowerName.endsWith(".csv")) {
            throw ValidationException.unsupportedFormat(filename);
        }
        if (content == null || content.length == 0) {
            throw new ValidationException(String.format("Uploaded file '%s' is empty", filename));
        }
        long limit = maxBytes > 0 ? maxBytes : DEFAULT_MAX_BYTES;
        if (content.length > limit) {
            throw ValidationException.invalidParameter(
                    "file", content.length + " bytes", "at most " + limit + " bytes");
        }

        RawTable table = spreadsheet ? parseSpreadsheet(content) : parseCsv(content);
        LOG.infof("Parsed '%s': %d rows x %d columns", filename, table.rowCount(), table.columnCount());
        return table;
    }

    /**
     * Parses CSV content whose first record is the header.
     *
     * @param content UTF-8 encoded CSV bytes, optionally starting with a byte order mark
     * @return parsed raw table
     * @throws UnsupportedInputException if the content has no header or cannot be read as CSV
     */
    public RawTable parseCsv(byte[] content) {
        CSVFormat format = CSVFormat.RFC4180.builder()
                .setIgnoreEmptyLines(true)
                .setIgnoreSurroundingSpaces(false)
                .build();

        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {

            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new UnsupportedInputException("CSV content has no header row");
            }

            List<String> header = new ArrayList<>();
            for (String name : records.next()) {
                header.add(headerName(stripByteOrderMark(name), header.size()));
            }

            List<List<Object>> rows = new ArrayList<>();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                List<Object> row = new ArrayList<>(record.size());
                for (String cell : record) {
                    row.add(cell.isEmpty() ? null : cell);
                }
                rows.add(row);
            }

            LOG.debugf("Read CSV header %s and %d records", header, rows.size());
            return RawTable.fromRows(header, rows);
        } catch (IOException | UncheckedIOException e) {
            throw new UnsupportedInputException("Unable to read CSV content: " + e.getMessage(), e);
        }
    }

    /**
     * Parses the first sheet of an Excel workbook whose first row is the header.
     *
     * @param content {@code .xlsx} or {@code .xls} bytes
     * @return parsed raw table
     * @throws UnsupportedInputException if the workbook cannot be read or has no header row
     */
    public RawTable parseSpreadsheet(byte[] content) {
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new UnsupportedInputException("Workbook has no sheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            int width = headerRow == null ? 0 : trimTrailingNulls(readRow(headerRow)).size();
            if (width == 0) {
                throw new UnsupportedInputException("Sheet '" + sheet.getSheetName() + "' has no header row");
            }

            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            List<String> header = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                header.add(headerName(formatter.formatCellValue(headerRow.getCell(c)), c));
            }

            List<List<Object>> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                rows.add(row == null ? new ArrayList<>() : trimTrailingNulls(readRow(row)));
            }

            LOG.debugf("Read sheet '%s' header %s and %d rows", sheet.getSheetName(), header, rows.size());
            return RawTable.fromRows(header, rows);
        } catch (IOException | EncryptedDocumentException | UnsupportedFileFormatException
                 | RecordFormatException e) {
            throw new UnsupportedInputException("Unable to read spreadsheet content: " + e.getMessage(), e);
        }
    }

    private static List<Object> readRow(Row row) {
        List<Object> cells = new ArrayList<>();
        for (int c = 0; c < row.getLastCellNum(); c++) {
            Cell cell = row.getCell(c);
            cells.add(cell == null ? null : cellValue(cell, cell.getCellType()));
        }
        return cells;
    }

    private static Object cellValue(Cell cell, CellType type) {
        return switch (type) {
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue()
                    : Double.valueOf(cell.getNumericCellValue());
            case STRING -> cell.getStringCellValue().isEmpty() ? null : cell.getStringCellValue();
            case BOOLEAN -> cell.getBooleanCellValue();
            case FORMULA -> cellValue(cell, cell.getCachedFormulaResultType());
            default -> null;
        };
    }

    private static List<Object> trimTrailingNulls(List<Object> cells) {
        int end = cells.size();
        while (end > 0 && cells.get(end - 1) == null) {
            end--;
        }
        return new ArrayList<>(cells.subList(0, end));
    }

    private static String headerName(String name, int index) {
        String trimmed = name == null ? "" : name.trim();
        return trimmed.isEmpty() ? UNNAMED_PREFIX + index : trimmed;
    }

    private static String stripByteOrderMark(String value) {
        return !value.isEmpty() && value.charAt(0) == BYTE_ORDER_MARK ? value.substring(1) : value;
    }
}
