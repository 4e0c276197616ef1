package com.ecoimpact.indicators.report;

/**
 * 토지피복 클래스 단위로 묶은 집계 한 줄.
 *
 * @param metric            지표의 대표값 합계 (gha, tC, 통화 단위 가치, 면적가중 점수)
 * @param percentageOfArea  전체 면적 대비 비율
 * @param percentageOfTotal 대표값 합계 대비 비율 (점수형 지표는 0)
 */
public record ClassSummary(
        String className,
        double areaHectares,
        double metric,
        double percentageOfArea,
        double percentageOfTotal
) {
}
