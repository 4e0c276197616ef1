package com.ecoimpact.indicators.calc;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class RarityScaleTest {

    @ParameterizedTest
    @CsvSource({
            "0.0, 5",
            "1.0, 5",
            "1.0001, 4",
            "5.0, 4",
            "15.0, 3",
            "30.0, 2",
            "30.0001, 1",
            "100.0, 1"
    })
    void boundariesAreRightInclusive(double percentage, int expected) {
        assertThat(RarityScale.classify(percentage)).isEqualTo(expected);
    }
}
