package com.expensesnap.core.domain;

import com.expensesnap.core.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Partial edit of an expense. A null component leaves the stored value unchanged.
 * Only these fields are editable; converted totals, uploader and company are not.
 */
public record ExpenseUpdate(
        String date,
        String vendor,
        String location,
        String category,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal tip,
        BigDecimal total,
        String paymentMethod,
        String currency,
        String items
) {

    // expense.expense_date is VARCHAR(32)
    static final int MAX_DATE_LENGTH = 32;

    public ExpenseUpdate {
        if (date != null && date.length() > MAX_DATE_LENGTH) {
            throw new ValidationException("date must be at most " + MAX_DATE_LENGTH + " characters");
        }
        requireNonNegative("subtotal", subtotal);
        requireNonNegative("tax", tax);
        requireNonNegative("tip", tip);
        requireNonNegative("total", total);
        if (currency != null && !CurrencyCode.isValid(currency)) {
            throw new ValidationException("currency must be a 3-letter code: " + currency);
        }
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new ValidationException(field + " must not be negative");
        }
    }

    public boolean isEmpty() {
        return date == null && vendor == null && location == null && category == null
                && subtotal == null && tax == null && tip == null && total == null
                && paymentMethod == null && currency == null && items == null;
    }
}
