package com.expensesnap.core.domain;

import java.math.BigDecimal;

/**
 * Structured receipt as returned by the extraction service, already sanitised:
 * monetary fields are non-negative with two decimals and the category is from the closed set.
 */
public record ExtractedReceipt(
        String date,
        String vendor,
        String location,
        ExpenseCategory category,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal tip,
        BigDecimal total,
        String paymentMethod,
        CurrencyCode currency,
        String items
) {
}
