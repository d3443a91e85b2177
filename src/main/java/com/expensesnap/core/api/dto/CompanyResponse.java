package com.expensesnap.core.api.dto;

import com.expensesnap.core.application.CompanyService;
import com.expensesnap.core.domain.Company;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompanyResponse(
        UUID id,
        String name,
        String homeCurrency,
        OffsetDateTime createdAt,
        Long userCount,
        Long expenseCount,
        BigDecimal totalSpent
) {

    public static CompanyResponse from(Company c) {
        return new CompanyResponse(c.getId(), c.getName(), c.getHomeCurrency().code(), c.getCreatedAt(),
                null, null, null);
    }

    public static CompanyResponse from(CompanyService.CompanyOverview o) {
        Company c = o.company();
        return new CompanyResponse(c.getId(), c.getName(), c.getHomeCurrency().code(), c.getCreatedAt(),
                o.userCount(), o.expenseCount(), o.totalSpent());
    }
}
