package com.expensesnap.core.api.dto;

import com.expensesnap.core.application.ExpenseView;
import com.expensesnap.core.domain.Expense;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpenseResponse(
        UUID id,
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
        BigDecimal totalHome,
        BigDecimal totalUsd,
        String items,
        String uploadedBy,
        UUID companyId,
        String companyName,
        String receiptImage,
        OffsetDateTime createdAt
) {

    public static ExpenseResponse from(Expense e) {
        return from(e, null);
    }

    public static ExpenseResponse from(ExpenseView view) {
        return from(view.expense(), view.companyName());
    }

    private static ExpenseResponse from(Expense e, String companyName) {
        return new ExpenseResponse(e.getId(), e.getDate(), e.getVendor(), e.getLocation(),
                e.getCategory().label(), e.getSubtotal(), e.getTax(), e.getTip(), e.getTotal(),
                e.getPaymentMethod(), e.getCurrency().code(), e.getTotalHome(), e.getTotalUsd(),
                e.getItems(), e.getUploadedBy(), e.getCompanyId(), companyName, e.getImagePath(),
                e.getCreatedAt());
    }
}
