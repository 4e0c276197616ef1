package com.ecoimpact.indicators.exception;

import java.util.List;

/**
 * 입력 원본에 필수 컬럼이 없거나 값 형식이 잘못된 경우. 어떤 변경도 일어나기 전에 던져진다.
 */
public class SchemaException extends IndicatorException {

    private final List<String> missingColumns;

    public SchemaException(String message) {
        super(message);
        this.missingColumns = List.of();
    }

    public SchemaException(String source, List<String> missingColumns) {
        super("Missing required columns in " + source + ": " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
