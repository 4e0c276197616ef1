package com.ecoimpact.indicators.calc;

/**
 * 면적 비율(%) → 희귀도 1..5. 구간 오른쪽 끝 포함.
 * <pre>
 *  (-inf, 1]  → 5 (가장 희귀)
 *  (1, 5]     → 4
 *  (5, 15]    → 3
 *  (15, 30]   → 2
 *  (30, +inf) → 1 (가장 흔함)
 * </pre>
 */
public final class RarityScale {

    private static final double[] UPPER_BOUNDS = {1.0, 5.0, 15.0, 30.0};

    private RarityScale() {
    }

    public static int classify(double percentageOfArea) {
        for (int i = 0; i < UPPER_BOUNDS.length; i++) {
            if (percentageOfArea <= UPPER_BOUNDS[i]) {
                return 5 - i;
            }
        }
        return 1;
    }
}
