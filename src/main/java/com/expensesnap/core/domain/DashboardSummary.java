package com.expensesnap.core.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record DashboardSummary(
        BigDecimal total,
        int count,
        Map<String, BigDecimal> byCategory,
        Map<String, BigDecimal> byMonth,
        Map<String, BigDecimal> byUser,
        List<Expense> recent,
        String currency
) {
}
