package com.expensesnap.core.domain.ports;

import com.expensesnap.core.domain.Expense;
import com.expensesnap.core.domain.access.DataScope;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ExpenseRepository {
    Expense save(Expense expense);

    Optional<Expense> findById(UUID expenseId);

    /** Expenses in the scope ordered by date string, newest first. */
    List<Expense> findByScope(DataScope scope);

    void updateConvertedTotals(UUID expenseId, BigDecimal totalHome, BigDecimal totalUsd);

    void deleteById(UUID expenseId);

    long countByCompany(UUID companyId);

    BigDecimal sumTotalByCompany(UUID companyId);

    void deleteByCompany(UUID companyId);
}
