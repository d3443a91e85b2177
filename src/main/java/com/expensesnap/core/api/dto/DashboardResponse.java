package com.expensesnap.core.api.dto;

import com.expensesnap.core.domain.DashboardSummary;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record DashboardResponse(
        BigDecimal total,
        int count,
        Map<String, BigDecimal> byCategory,
        Map<String, BigDecimal> byMonth,
        Map<String, BigDecimal> byUser,
        List<ExpenseResponse> recent,
        String currency
) {

    public static DashboardResponse from(DashboardSummary s) {
        return new DashboardResponse(s.total(), s.count(), s.byCategory(), s.byMonth(), s.byUser(),
                s.recent().stream().map(ExpenseResponse::from).toList(), s.currency());
    }
}
