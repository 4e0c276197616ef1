package com.ecoimpact.indicators.ingest;

import com.ecoimpact.indicators.exception.SchemaException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 헤더가 있는 표 형식 원본 (CSV/엑셀). 빈 셀은 null 로 들어온다.
 *
 * @param source  로그/오류 메시지용 이름 (보통 파일 경로)
 * @param headers 헤더 순서 그대로
 * @param rows    헤더명 → 셀 값
 */
public record TabularData(String source, List<String> headers, List<Map<String, String>> rows) {

    public TabularData {
        headers = List.copyOf(headers);
        rows = List.copyOf(rows);
    }

    /** 필수 컬럼이 하나라도 없으면 SchemaException */
    public void requireColumns(Collection<String> required) {
        List<String> missing = required.stream()
                .filter(c -> !headers.contains(c))
                .toList();
        if (!missing.isEmpty()) {
            throw new SchemaException(source, missing);
        }
    }

    public int size() {
        return rows.size();
    }
}
