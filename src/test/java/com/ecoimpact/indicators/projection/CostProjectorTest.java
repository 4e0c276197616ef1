package com.ecoimpact.indicators.projection;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CostProjectorTest {

    private final CostProjector projector = new CostProjector();

    private static NavigableMap<Integer, Double> schedule() {
        NavigableMap<Integer, Double> s = new TreeMap<>();
        s.put(2020, 240.0);
        s.put(2021, 252.0);
        s.put(2025, 300.0);
        return s;
    }

    @Test
    void startYearIsUndiscountedAndScaledByReferencePrice() {
        List<DiscountedCost> series = projector.project(25.2, schedule(), 2021, 2021, 0.02, 252.0);

        assertThat(series).singleElement().satisfies(p -> {
            assertThat(p.year()).isEqualTo(2021);
            assertThat(p.value()).isCloseTo(25.2, within(1e-9));
        });
    }

    @Test
    void missingYearFallsBackToLatestEarlierYear() {
        List<DiscountedCost> series = projector.project(252.0, schedule(), 2020, 2026, 0.0, 252.0);

        assertThat(series).extracting(DiscountedCost::year)
                .containsExactly(2020, 2021, 2022, 2023, 2024, 2025, 2026);
        // 2022..2024 는 2021 가격, 2026 은 2025 가격 (뒤쪽 연도를 쓰지 않는다)
        assertThat(series.get(2).value()).isCloseTo(252.0, within(1e-9));
        assertThat(series.get(4).value()).isCloseTo(252.0, within(1e-9));
        assertThat(series.get(6).value()).isCloseTo(300.0, within(1e-9));
    }

    @Test
    void discountCompoundsFromStartYear() {
        List<DiscountedCost> series = projector.project(252.0, schedule(), 2020, 2022, 0.02, 252.0);

        assertThat(series.get(0).value()).isCloseTo(240.0, within(1e-9));
        assertThat(series.get(2).value()).isCloseTo(252.0 / Math.pow(1.02, 2), within(1e-9));
    }

    @Test
    void yearBeforeScheduleIsRejected() {
        assertThatThrownBy(() -> projector.project(1.0, schedule(), 2019, 2021, 0.02, 252.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2019");
    }

    @Test
    void zeroAggregateGivesZeroSeries() {
        assertThat(projector.project(0.0, schedule(), 2020, 2030, 0.02, 252.0))
                .hasSize(11)
                .allSatisfy(p -> assertThat(p.value()).isZero());
    }
}
