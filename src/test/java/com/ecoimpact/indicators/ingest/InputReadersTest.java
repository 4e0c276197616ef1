package com.ecoimpact.indicators.ingest;

import com.ecoimpact.indicators.calc.AreaRow;
import com.ecoimpact.indicators.exception.SchemaException;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputReadersTest {

    private final TabularFileReader fileReader = new TabularFileReader();

    @TempDir
    Path dir;

    @Test
    void areaSummaryFromCsv_skipsRowsWithoutCode() throws IOException {
        Path csv = write("areas.csv", """
                gridcode,SUM_Area_Ha,OBJECTID
                11,100.5,1
                ,3.0,2
                13.0,,3
                """);

        List<AreaRow> rows = new AreaSummaryReader(fileReader).read(csv);

        assertThat(rows).containsExactly(new AreaRow(11, 100.5), new AreaRow(13, 0.0));
    }

    @Test
    void areaSummaryFromWorkbook() throws IOException {
        Path xlsx = dir.resolve("summary.xlsx");
        try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(xlsx)) {
            Sheet sheet = wb.createSheet("summary");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("gridcode");
            header.createCell(1).setCellValue("SUM_Area_Ha");
            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(11);
            first.createCell(1).setCellValue(1234.5678);
            Row second = sheet.createRow(2);
            second.createCell(0).setCellValue(193);
            second.createCell(1).setCellValue(0.25);
            wb.write(out);
        }

        List<AreaRow> rows = new AreaSummaryReader(fileReader).read(xlsx);

        assertThat(rows).containsExactly(new AreaRow(11, 1234.5678), new AreaRow(193, 0.25));
    }

    @Test
    void workbookWithBlankIndexHeader_readsEachColumnByItsOwnPosition() throws IOException {
        Path xlsx = dir.resolve("indexed.xlsx");
        try (XSSFWorkbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(xlsx)) {
            Sheet sheet = wb.createSheet("summary");
            // A1 비어 있음 (pandas to_excel 의 인덱스 컬럼)
            Row header = sheet.createRow(0);
            header.createCell(1).setCellValue("gridcode");
            header.createCell(2).setCellValue("SUM_Area_Ha");
            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(0);
            first.createCell(1).setCellValue(11);
            first.createCell(2).setCellValue(123.5);
            wb.write(out);
        }

        assertThat(fileReader.read(xlsx).headers()).containsExactly("gridcode", "SUM_Area_Ha");
        assertThat(new AreaSummaryReader(fileReader).read(xlsx)).containsExactly(new AreaRow(11, 123.5));
    }

    @Test
    void csvWithByteOrderMark_keepsFirstHeaderName() throws IOException {
        Path csv = write("bom.csv", "\uFEFFgridcode,SUM_Area_Ha\n11,100.0\n");

        assertThat(fileReader.read(csv).headers()).containsExactly("gridcode", "SUM_Area_Ha");
        assertThat(new AreaSummaryReader(fileReader).read(csv)).containsExactly(new AreaRow(11, 100.0));
    }

    @Test
    void missingColumnIsSchemaError() throws IOException {
        Path csv = write("areas.csv", """
                gridcode,Area
                11,1.0
                """);

        assertThatThrownBy(() -> new AreaSummaryReader(fileReader).read(csv))
                .isInstanceOf(SchemaException.class)
                .satisfies(e -> assertThat(((SchemaException) e).getMissingColumns()).containsExactly("SUM_Area_Ha"));
    }

    @Test
    void carbonPriceScheduleStripsCurrencyFormatting() throws IOException {
        Path csv = write("scc.csv", """
                Year,SCC
                2021,$252.00
                2030,"$1,234.50"
                """);

        NavigableMap<Integer, Double> schedule = new CarbonPriceScheduleReader(fileReader).read(csv);

        assertThat(schedule).containsExactly(Map.entry(2021, 252.0), Map.entry(2030, 1234.5));
    }

    @Test
    void wetlandValuesKeepFirstDuplicate() throws IOException {
        Path csv = write("wetlands.csv", """
                wetland_type,value
                Swamp,12000
                Marsh,"$8,500"
                Swamp,1
                """);

        Map<String, Double> values = new WetlandValueReader(fileReader).read(csv);

        assertThat(values).containsExactly(Map.entry("Swamp", 12000.0), Map.entry("Marsh", 8500.0));
    }

    @Test
    void nonNumericValueIsSchemaError() {
        assertThatThrownBy(() -> CellValues.parseDouble("test", "agc", "n/a"))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("agc");
        assertThatThrownBy(() -> CellValues.parseCode("test", "code", "11.5"))
                .isInstanceOf(SchemaException.class);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }
}
