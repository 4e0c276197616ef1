package com.ecoimpact.indicators.ingest;

import com.ecoimpact.indicators.exception.SchemaException;

/**
 * 문자열 셀 값 → 숫자 변환
 */
public final class CellValues {

    private CellValues() {
    }

    public static double parseDouble(String source, String column, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new SchemaException(source + ": column '" + column + "' is not numeric: '" + value + "'");
        }
    }

    /** 엑셀에서 "11.0" 으로 읽히는 코드도 허용 */
    public static int parseCode(String source, String column, String value) {
        double d = parseDouble(source, column, value);
        if (d != Math.rint(d)) {
            throw new SchemaException(source + ": column '" + column + "' is not an integer code: '" + value + "'");
        }
        return (int) d;
    }

    /** "$1,234.50" → 1234.50 */
    public static double parseCurrency(String source, String column, String value) {
        String clean = value.replace("$", "").replace(",", "").trim();
        return parseDouble(source, column, clean);
    }
}
