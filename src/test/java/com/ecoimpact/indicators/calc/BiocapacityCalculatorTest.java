package com.ecoimpact.indicators.calc;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ecoimpact.indicators.calc.Fixtures.area;
import static com.ecoimpact.indicators.calc.Fixtures.reference;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BiocapacityCalculatorTest {

    private final BiocapacityCalculator calculator = new BiocapacityCalculator();

    @Test
    void biocapacityIsAreaTimesFactor_andSameCodesAreSummed() {
        List<BiocapacityRow> rows = calculator.calculate(
                List.of(area(13, 800.0), area(11, 100.0), area(13, 200.0)), reference());

        assertThat(rows).extracting(BiocapacityRow::code).containsExactly(11, 13);
        BiocapacityRow cropland = rows.get(1);
        assertThat(cropland.areaHectares()).isEqualTo(1000.0);
        assertThat(cropland.biocapacityGha()).isCloseTo(2510.0, within(1e-9));
        assertThat(cropland.biocapacityCategory()).isEqualTo("Cropland Land");
    }

    @Test
    void percentagesSumToHundred() {
        List<BiocapacityRow> rows = calculator.calculate(
                List.of(area(11, 123.4567), area(12, 0.5), area(13, 9876.1)), reference());

        double sum = rows.stream().mapToDouble(BiocapacityRow::percentageOfTotal).sum();
        assertThat(sum).isCloseTo(100.0, within(1e-6));
    }

    @Test
    void unknownCodeIsKeptWithUndefinedValues() {
        List<BiocapacityRow> rows = calculator.calculate(
                List.of(area(11, 100.0), area(99, 10.0)), reference());

        BiocapacityRow unknown = rows.get(1);
        assertThat(unknown.code()).isEqualTo(99);
        assertThat(unknown.matched()).isFalse();
        assertThat(unknown.conversionFactor()).isNull();
        assertThat(unknown.biocapacityGha()).isNull();
        assertThat(unknown.percentageOfTotal()).isNull();
        assertThat(rows.get(0).percentageOfTotal()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void zeroTotalLeavesPercentagesUndefined() {
        List<BiocapacityRow> rows = calculator.calculate(List.of(area(11, 0.0)), reference());

        assertThat(rows).singleElement()
                .satisfies(r -> assertThat(r.percentageOfTotal()).isNull());
    }
}
