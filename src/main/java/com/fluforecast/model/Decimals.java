package com.fluforecast.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Half-to-even rounding of the exact binary value, so 2.675 rounds to 2.67 and 0.125 to 0.12. */
public final class Decimals {

    private Decimals() {
    }

    public static double round(double value, int places) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
    }
}
