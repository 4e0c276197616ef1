package com.ecoimpact.indicators.ingest;

import com.ecoimpact.indicators.calc.AreaRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 폴리곤 요약 시트(gridcode, SUM_Area_Ha) → 코드별 면적 행. 같은 코드의 합산은 계산기 쪽에서 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AreaSummaryReader {

    public static final String CODE_COLUMN = "gridcode";
    public static final String AREA_COLUMN = "SUM_Area_Ha";

    private final TabularFileReader fileReader;

    public List<AreaRow> read(Path path) {
        return read(fileReader.read(path));
    }

    public List<AreaRow> read(TabularData data) {
        data.requireColumns(List.of(CODE_COLUMN, AREA_COLUMN));

        List<AreaRow> rows = new ArrayList<>(data.size());
        int skipped = 0;
        for (var row : data.rows()) {
            String code = row.get(CODE_COLUMN);
            if (code == null) {
                skipped++;
                continue;
            }
            String area = row.get(AREA_COLUMN);
            rows.add(new AreaRow(
                    CellValues.parseCode(data.source(), CODE_COLUMN, code),
                    area == null ? 0.0 : CellValues.parseDouble(data.source(), AREA_COLUMN, area)));
        }
        if (skipped > 0) {
            log.warn("[ingest] {} rows without {} skipped in {}", skipped, CODE_COLUMN, data.source());
        }
        log.info("[ingest] area summary rows={} source={}", rows.size(), data.source());
        return rows;
    }
}
