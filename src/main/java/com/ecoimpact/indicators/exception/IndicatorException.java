package com.ecoimpact.indicators.exception;

/**
 * 지표 계산 파이프라인에서 발생하는 모든 치명적 오류의 상위 타입
 */
public class IndicatorException extends RuntimeException {

    public IndicatorException(String message) {
        super(message);
    }

    public IndicatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
