package com.ecoimpact.indicators.calc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ecoimpact.indicators.calc.Fixtures.area;
import static com.ecoimpact.indicators.calc.Fixtures.reference;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AestheticQualityCalculatorTest {

    private final AestheticQualityCalculator calculator = new AestheticQualityCalculator();

    @Test
    void scoreCombinesNaturalnessAndRarity() {
        // 12: 0.5% → 희귀도 5, 13: 89.55% → 희귀도 1
        List<AestheticQualityRow> rows = calculator.calculate(
                List.of(area(11, 99.5), area(12, 5.0), area(13, 895.5)), reference());

        AestheticQualityRow wetland = rows.stream().filter(r -> r.code() == 12).findFirst().orElseThrow();
        assertThat(wetland.rarityScore()).isEqualTo(5);
        assertThat(wetland.aestheticScore()).isCloseTo(4.8 * 0.67 + 5 * 0.33, within(1e-9));

        AestheticQualityRow cropland = rows.stream().filter(r -> r.code() == 13).findFirst().orElseThrow();
        assertThat(cropland.rarityScore()).isEqualTo(1);
    }

    @Test
    void unknownCodesAreDroppedAndExcludedFromTheDenominator() {
        List<AestheticQualityRow> rows = calculator.calculate(
                List.of(area(11, 10.0), area(99, 990.0)), reference());

        assertThat(rows).singleElement().satisfies(r -> {
            assertThat(r.code()).isEqualTo(11);
            assertThat(r.percentageOfArea()).isCloseTo(100.0, within(1e-9));
            assertThat(r.rarityScore()).isEqualTo(1);
        });
    }

    @Test
    void zeroTotalAreaDoesNotFail() {
        List<AestheticQualityRow> rows = calculator.calculate(List.of(area(11, 0.0)), reference());

        assertThat(rows).singleElement().satisfies(r -> {
            assertThat(r.percentageOfArea()).isZero();
            assertThat(r.rarityScore()).isEqualTo(5);
        });
    }
}
