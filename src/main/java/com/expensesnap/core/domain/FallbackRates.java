package com.expensesnap.core.domain;

import java.math.BigDecimal;
import java.util.Map;

public final class FallbackRates {

    public static final Map<String, BigDecimal> TABLE = Map.of(
            "USD", new BigDecimal("1"),
            "CAD", new BigDecimal("1.36"),
            "EUR", new BigDecimal("0.92"),
            "GBP", new BigDecimal("0.79"),
            "INR", new BigDecimal("83.5"),
            "AUD", new BigDecimal("1.53"),
            "JPY", new BigDecimal("149.5"),
            "CHF", new BigDecimal("0.88"),
            "SGD", new BigDecimal("1.34"),
            "AED", new BigDecimal("3.67"));

    private FallbackRates() {
    }
}
