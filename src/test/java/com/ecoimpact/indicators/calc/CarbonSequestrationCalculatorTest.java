package com.ecoimpact.indicators.calc;

import com.ecoimpact.indicators.reference.ReferenceTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ecoimpact.indicators.calc.Fixtures.area;
import static com.ecoimpact.indicators.calc.Fixtures.entry;
import static com.ecoimpact.indicators.calc.Fixtures.reference;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CarbonSequestrationCalculatorTest {

    private final CarbonSequestrationCalculator calculator = new CarbonSequestrationCalculator();

    // 성분 합 2 tC/ha
    private final ReferenceTable twoTonnes = ReferenceTable.of(List.of(
            entry(21, "Meadow", 1.0, 0.5, 0.5, 0.5, 0.5, 3.0)));

    @Test
    void hundredTonnesOverFiftyHectares() {
        CarbonSequestrationRow row = calculator.calculate(List.of(area(21, 50.0)), twoTonnes).get(0);

        assertThat(row.totalCarbonTc()).isCloseTo(100.0, within(1e-9));
        assertThat(row.sscMillions()).isEqualTo(0.0252);
        assertThat(row.sscDensity()).isEqualTo(0.000504);
    }

    @Test
    void zeroAreaGivesZeroDensity() {
        CarbonSequestrationRow row = calculator.calculate(List.of(area(21, 0.0)), twoTonnes).get(0);

        assertThat(row.sscDensity()).isZero();
        assertThat(row.percentageOfTotal()).isZero();
    }

    @Test
    void percentagesSumToHundred() {
        List<CarbonSequestrationRow> rows = calculator.calculate(
                List.of(area(11, 10.0), area(12, 33.3333), area(13, 5000.0)), reference());

        double sum = rows.stream().mapToDouble(CarbonSequestrationRow::percentageOfTotal).sum();
        assertThat(sum).isCloseTo(100.0, within(1e-6));
    }

    @Test
    void unknownCodeContributesNothing() {
        List<CarbonSequestrationRow> rows = calculator.calculate(
                List.of(area(11, 10.0), area(99, 10.0)), reference());

        CarbonSequestrationRow unknown = rows.get(1);
        assertThat(unknown.matched()).isFalse();
        assertThat(unknown.agc()).isNull();
        assertThat(unknown.totalCarbonTc()).isZero();
        assertThat(rows.get(0).percentageOfTotal()).isCloseTo(100.0, within(1e-9));
    }
}
