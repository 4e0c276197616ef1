package com.ecoimpact.indicators.calc;

/**
 * 계산기가 만드는 결과 행의 공통 부분
 */
public interface IndicatorRow {

    int code();

    /** 기준표에 없는 코드면 null */
    String className();

    double areaHectares();

    default boolean matched() {
        return className() != null;
    }
}
