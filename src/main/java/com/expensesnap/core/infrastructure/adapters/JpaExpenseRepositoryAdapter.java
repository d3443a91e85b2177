package com.expensesnap.core.infrastructure.adapters;

import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.Expense;
import com.expensesnap.core.domain.ExpenseCategory;
import com.expensesnap.core.domain.access.DataScope;
import com.expensesnap.core.domain.ports.ExpenseRepository;
import com.expensesnap.core.infrastructure.jpa.ExpenseEntity;
import com.expensesnap.core.infrastructure.jpa.SpringExpenseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaExpenseRepositoryAdapter implements ExpenseRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaExpenseRepositoryAdapter.class);

    private final SpringExpenseRepository expenses;

    public JpaExpenseRepositoryAdapter(SpringExpenseRepository expenses) {
        this.expenses = expenses;
    }

    @Override
    public Expense save(Expense expense) {
        ExpenseEntity e = new ExpenseEntity();
        e.setId(expense.getId());
        e.setDate(expense.getDate());
        e.setVendor(expense.getVendor());
        e.setLocation(expense.getLocation());
        e.setCategory(expense.getCategory().label());
        e.setSubtotal(expense.getSubtotal());
        e.setTax(expense.getTax());
        e.setTip(expense.getTip());
        e.setTotal(expense.getTotal());
        e.setPaymentMethod(expense.getPaymentMethod());
        e.setCurrency(expense.getCurrency().code());
        e.setTotalHome(expense.getTotalHome());
        e.setTotalUsd(expense.getTotalUsd());
        e.setItems(expense.getItems());
        e.setUploadedBy(expense.getUploadedBy());
        e.setCompanyId(expense.getCompanyId());
        e.setReceiptImage(expense.getImagePath());
        e.setCreatedAt(expense.getCreatedAt());
        expenses.save(e);
        log.debug("Saved expense {} for company {}", expense.getId(), expense.getCompanyId());
        return expense;
    }

    @Override
    public Optional<Expense> findById(UUID expenseId) {
        return expenses.findById(expenseId).map(this::toDomain);
    }

    @Override
    public List<Expense> findByScope(DataScope scope) {
        List<ExpenseEntity> rows = scope.isAll()
                ? expenses.findAllByOrderByDateDesc()
                : expenses.findByCompanyIdOrderByDateDesc(scope.getCompanyId());
        return rows.stream().map(this::toDomain).toList();
    }

    @Override
    @Transactional
    public void updateConvertedTotals(UUID expenseId, BigDecimal totalHome, BigDecimal totalUsd) {
        expenses.updateConvertedTotals(expenseId, totalHome, totalUsd);
    }

    @Override
    @Transactional
    public void deleteById(UUID expenseId) {
        expenses.deleteById(expenseId);
    }

    @Override
    public long countByCompany(UUID companyId) {
        return expenses.countByCompanyId(companyId);
    }

    @Override
    public BigDecimal sumTotalByCompany(UUID companyId) {
        BigDecimal sum = expenses.sumTotalByCompanyId(companyId);
        return sum == null ? BigDecimal.ZERO : sum;
    }

    @Override
    @Transactional
    public void deleteByCompany(UUID companyId) {
        int removed = expenses.deleteByCompanyId(companyId);
        log.debug("Removed {} expenses of company {}", removed, companyId);
    }

    private Expense toDomain(ExpenseEntity e) {
        return new Expense(
                e.getId(),
                e.getDate(),
                e.getVendor(),
                e.getLocation(),
                ExpenseCategory.fromLabel(e.getCategory()),
                e.getSubtotal(),
                e.getTax(),
                e.getTip(),
                e.getTotal(),
                e.getPaymentMethod(),
                CurrencyCode.parseOrDefault(e.getCurrency(), CurrencyCode.USD),
                e.getTotalHome(),
                e.getTotalUsd(),
                e.getItems(),
                e.getUploadedBy(),
                e.getCompanyId(),
                e.getReceiptImage(),
                e.getCreatedAt()
        );
    }
}
