package com.expensesnap.core.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Builds dashboard totals from a scoped list of expenses. Holds no state.
 */
public class ExpenseAggregator {

    static final int RECENT_LIMIT = 10;
    static final String UNKNOWN = "Unknown";

    public enum Basis {
        /** Amounts in the single company's home currency. */
        HOME,
        /** Amounts in USD, used when the scope spans several companies. */
        USD
    }

    public DashboardSummary summarize(List<Expense> expenses, Basis basis, String currency) {
        Function<Expense, BigDecimal> amountOf = basis == Basis.HOME
                ? e -> e.getTotalHome() != null ? e.getTotalHome() : e.getTotal()
                : e -> e.getTotalUsd() != null ? e.getTotalUsd() : e.getTotal();

        BigDecimal total = BigDecimal.ZERO;
        Map<String, BigDecimal> byCategory = new LinkedHashMap<>();
        Map<String, BigDecimal> byMonth = new TreeMap<>();
        Map<String, BigDecimal> byUser = new LinkedHashMap<>();

        for (Expense e : expenses) {
            BigDecimal amount = amountOf.apply(e);
            total = total.add(amount);
            byCategory.merge(e.getCategory().label(), amount, BigDecimal::add);
            byMonth.merge(monthOf(e.getDate()), amount, BigDecimal::add);
            String user = e.getUploadedBy() == null || e.getUploadedBy().isBlank() ? UNKNOWN : e.getUploadedBy();
            byUser.merge(user, amount, BigDecimal::add);
        }

        List<Expense> recent = expenses.stream()
                .sorted(Comparator.comparing(Expense::getDate).reversed())
                .limit(RECENT_LIMIT)
                .toList();

        return new DashboardSummary(
                total.setScale(2, RoundingMode.HALF_UP),
                expenses.size(),
                byCategory,
                new LinkedHashMap<>(byMonth),
                byUser,
                recent,
                currency);
    }

    /** Up to the first seven characters of the stored date string, taken literally. */
    static String monthOf(String date) {
        if (date == null || date.isEmpty()) {
            return UNKNOWN;
        }
        return date.substring(0, Math.min(7, date.length()));
    }
}
