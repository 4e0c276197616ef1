package com.ecoimpact.indicators.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 연도별 사회적 탄소비용 단가표 (Year, SCC). SCC 는 "$1,234" 같은 통화 문자열이다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CarbonPriceScheduleReader {

    public static final String YEAR_COLUMN = "Year";
    public static final String PRICE_COLUMN = "SCC";

    private final TabularFileReader fileReader;

    public NavigableMap<Integer, Double> read(Path path) {
        return read(fileReader.read(path));
    }

    public NavigableMap<Integer, Double> read(TabularData data) {
        data.requireColumns(List.of(YEAR_COLUMN, PRICE_COLUMN));

        NavigableMap<Integer, Double> schedule = new TreeMap<>();
        for (var row : data.rows()) {
            String year = row.get(YEAR_COLUMN);
            String price = row.get(PRICE_COLUMN);
            if (year == null || price == null) continue;
            schedule.put(
                    CellValues.parseCode(data.source(), YEAR_COLUMN, year),
                    CellValues.parseCurrency(data.source(), PRICE_COLUMN, price));
        }
        log.info("[ingest] carbon price schedule years={} range={}..{}",
                schedule.size(),
                schedule.isEmpty() ? "-" : schedule.firstKey(),
                schedule.isEmpty() ? "-" : schedule.lastKey());
        return schedule;
    }
}
