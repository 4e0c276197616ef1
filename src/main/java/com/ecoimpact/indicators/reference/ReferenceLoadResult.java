package com.ecoimpact.indicators.reference;

/**
 * @param rowsRead         원본 행 수
 * @param rowsLoaded       기준표에 들어간 행 수
 * @param rowsDropped      null 값 때문에 버려진 행 수
 * @param overridesApplied 적용된 덮어쓰기 필드 수
 * @param cascaded         결과 테이블을 먼저 비워야 했는지
 */
public record ReferenceLoadResult(int rowsRead, int rowsLoaded, int rowsDropped, int overridesApplied, boolean cascaded) {
}
