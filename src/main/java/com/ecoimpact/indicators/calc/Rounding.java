package com.ecoimpact.indicators.calc;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {

    private Rounding() {
    }

    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    /** DB 컬럼 scale 에 맞춘 BigDecimal. null 은 null 그대로 */
    public static BigDecimal toScale(Double value, int scale) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return null;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
