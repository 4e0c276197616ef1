package com.ecoimpact.indicators.exception;

/**
 * 결과 테이블이 아직 참조 중이라 기준표를 비울 수 없는 경우
 */
public class ReferentialIntegrityException extends IndicatorException {

    public ReferentialIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
