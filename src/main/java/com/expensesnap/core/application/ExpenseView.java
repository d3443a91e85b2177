package com.expensesnap.core.application;

import com.expensesnap.core.domain.Expense;

/** Expense row as listed, with the owning company's display name (null for unassigned rows). */
public record ExpenseView(Expense expense, String companyName) {
}
