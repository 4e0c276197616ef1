package com.ecoimpact.indicators.ingest;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * CSV(Commons CSV) / 엑셀(POI) 파일을 {@link TabularData} 로 읽는다.
 * 파싱 자체만 담당하고, 컬럼 의미는 각 Reader 가 해석한다.
 */
@Component
@Slf4j
public class TabularFileReader {

    public TabularData read(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            return readExcel(path);
        }
        return readCsv(path);
    }

    public TabularData readCsv(Path path) {
        // 엑셀에서 저장한 CSV 는 BOM 으로 시작하는 경우가 많다
        try (BOMInputStream in = BOMInputStream.builder().setInputStream(Files.newInputStream(path)).get();
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
             CSVParser parser = new CSVParser(reader, CSVFormat.DEFAULT
                     .builder()
                     .setHeader()
                     .setSkipHeaderRecord(true)
                     .setAllowMissingColumnNames(true)
                     .setIgnoreEmptyLines(true)
                     .setTrim(true)
                     .build())) {

            List<String> headers = new ArrayList<>(parser.getHeaderNames());
            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                for (String header : headers) {
                    String value = record.isSet(header) ? record.get(header) : null;
                    row.put(header, blankToNull(value));
                }
                rows.add(row);
            }
            log.debug("[ingest] read {} rows from {}", rows.size(), path);
            return new TabularData(path.toString(), headers, rows);
        } catch (IOException e) {
            log.error("[ingest] cannot read CSV file {}", path, e);
            throw new UncheckedIOException("Failed to read CSV file: " + path, e);
        }
    }

    public TabularData readExcel(Path path) {
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            Iterator<Row> rowIterator = sheet.iterator();
            if (!rowIterator.hasNext()) {
                return new TabularData(path.toString(), List.of(), List.of());
            }

            // 첫 행 = 헤더. 빈 헤더 칸(인덱스 컬럼 등)은 건너뛰고 나머지는 자기 열 번호로 읽는다
            Row headerRow = rowIterator.next();
            Map<Integer, String> headerByColumn = new LinkedHashMap<>();
            for (int col = Math.max(headerRow.getFirstCellNum(), 0); col < headerRow.getLastCellNum(); col++) {
                String name = blankToNull(getCellValueAsString(headerRow.getCell(col)));
                if (name != null) {
                    headerByColumn.put(col, name);
                }
            }
            List<String> headers = new ArrayList<>(headerByColumn.values());

            List<Map<String, String>> rows = new ArrayList<>();
            while (rowIterator.hasNext()) {
                Row row = rowIterator.next();
                Map<String, String> values = new LinkedHashMap<>();
                boolean empty = true;
                for (Map.Entry<Integer, String> column : headerByColumn.entrySet()) {
                    String value = blankToNull(getCellValueAsString(row.getCell(column.getKey())));
                    values.put(column.getValue(), value);
                    if (value != null) empty = false;
                }
                if (!empty) rows.add(values);
            }
            log.debug("[ingest] read {} rows from {}", rows.size(), path);
            return new TabularData(path.toString(), headers, rows);
        } catch (IOException e) {
            log.error("[ingest] cannot read Excel file {}", path, e);
            throw new UncheckedIOException("Failed to read Excel file: " + path, e);
        }
    }

    /**
     * 셀 값을 문자열로 변환. 숫자는 정수면 소수점 없이, 아니면 그대로 보존
     */
    private String getCellValueAsString(Cell cell) {
        if (cell == null) {
            return "";
        }

        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        return switch (type) {
            case STRING -> cell.getStringCellValue().trim();
            case NUMERIC -> formatNumber(cell.getNumericCellValue());
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> "";
        };
    }

    private String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
