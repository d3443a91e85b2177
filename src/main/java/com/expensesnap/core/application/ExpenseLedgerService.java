package com.expensesnap.core.application;

import com.expensesnap.core.domain.Company;
import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.DashboardSummary;
import com.expensesnap.core.domain.ExchangeRateSnapshot;
import com.expensesnap.core.domain.Expense;
import com.expensesnap.core.domain.ExpenseAggregator;
import com.expensesnap.core.domain.ExpenseUpdate;
import com.expensesnap.core.domain.access.CallerIdentity;
import com.expensesnap.core.domain.access.DataScope;
import com.expensesnap.core.domain.access.TenantAccessPolicy;
import com.expensesnap.core.domain.access.TenantOperation;
import com.expensesnap.core.domain.ports.CompanyRepository;
import com.expensesnap.core.domain.ports.ExpenseRepository;
import com.expensesnap.core.domain.ports.ReceiptImageStoragePort;
import com.expensesnap.core.exception.AccessDeniedException;
import com.expensesnap.core.exception.NotFoundException;
import com.expensesnap.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tenant-scoped reads and writes of expense records. Every method resolves the caller's
 * {@link DataScope} before touching a row.
 */
@Service
public class ExpenseLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseLedgerService.class);

    private final ExpenseRepository expenses;
    private final CompanyRepository companies;
    private final ReceiptImageStoragePort storage;
    private final CurrencyConversionService currency;

    private final TenantAccessPolicy policy = new TenantAccessPolicy();
    private final ExpenseAggregator aggregator = new ExpenseAggregator();

    public ExpenseLedgerService(ExpenseRepository expenses, CompanyRepository companies,
                                ReceiptImageStoragePort storage, CurrencyConversionService currency) {
        this.expenses = expenses;
        this.companies = companies;
        this.storage = storage;
        this.currency = currency;
    }

    @Transactional
    public Expense record(Expense expense) {
        Expense saved = expenses.save(expense);
        log.info("Recorded expense {} for company {} (total {} {})",
                saved.getId(), saved.getCompanyId(), saved.getTotal(), saved.getCurrency());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ExpenseView> list(CallerIdentity caller, UUID companyId) {
        DataScope scope = policy.require(caller, TenantOperation.READ_EXPENSES, companyId);
        Map<UUID, String> names = new HashMap<>();
        companies.findAll().forEach(c -> names.put(c.getId(), c.getName()));
        return expenses.findByScope(scope).stream()
                .map(e -> new ExpenseView(e, e.getCompanyId() == null ? null : names.get(e.getCompanyId())))
                .toList();
    }

    @Transactional(readOnly = true)
    public DashboardSummary dashboard(CallerIdentity caller, UUID companyId) {
        DataScope scope = policy.require(caller, TenantOperation.READ_EXPENSES, companyId);
        List<Expense> rows = expenses.findByScope(scope);
        if (scope.isAll()) {
            return aggregator.summarize(rows, ExpenseAggregator.Basis.USD, CurrencyCode.USD.code());
        }
        CurrencyCode home = companies.findById(scope.getCompanyId())
                .map(Company::getHomeCurrency)
                .orElse(CurrencyCode.USD);
        return aggregator.summarize(rows, ExpenseAggregator.Basis.HOME, home.code());
    }

    @Transactional
    public Expense update(CallerIdentity caller, UUID expenseId, ExpenseUpdate update) {
        policy.require(caller, TenantOperation.WRITE_EXPENSES);
        if (update == null || update.isEmpty()) {
            throw new ValidationException("No editable fields supplied");
        }
        Expense existing = loadForCaller(caller, TenantOperation.WRITE_EXPENSES, expenseId);
        Expense changed = existing.withChanges(update);
        expenses.save(changed);
        log.info("Expense {} updated by {}", expenseId, caller.userId());
        return changed;
    }

    @Transactional
    public void delete(CallerIdentity caller, UUID expenseId) {
        policy.require(caller, TenantOperation.DELETE_EXPENSES);
        Expense existing = loadForCaller(caller, TenantOperation.DELETE_EXPENSES, expenseId);
        expenses.deleteById(expenseId);
        deleteImageAfterCommit(existing.getImagePath());
        log.info("Expense {} deleted by {}", expenseId, caller.userId());
    }

    // A rolled back delete keeps its row, so the preview has to survive too
    private void deleteImageAfterCommit(String imagePath) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            storage.delete(imagePath);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                storage.delete(imagePath);
            }
        });
    }

    /**
     * Recomputes both converted totals of every expense in scope with the current rates.
     * Billed amounts are not touched, so running it twice with the same rates changes nothing.
     *
     * @return number of expenses rewritten
     */
    @Transactional
    public int recalculate(CallerIdentity caller, UUID companyId) {
        DataScope scope = policy.require(caller, TenantOperation.RECALCULATE, companyId);
        ExchangeRateSnapshot rates = currency.currentRates();

        Map<UUID, CurrencyCode> homeCurrencies = new HashMap<>();
        companies.findAll().forEach(c -> homeCurrencies.put(c.getId(), c.getHomeCurrency()));

        int touched = 0;
        for (Expense e : expenses.findByScope(scope)) {
            CurrencyCode home = e.getCompanyId() == null
                    ? CurrencyCode.USD
                    : homeCurrencies.getOrDefault(e.getCompanyId(), CurrencyCode.USD);
            BigDecimal totalHome = CurrencyConversionService.convert(e.getTotal(), e.getCurrency(), home, rates);
            BigDecimal totalUsd = CurrencyConversionService.convert(e.getTotal(), e.getCurrency(), CurrencyCode.USD, rates);
            expenses.updateConvertedTotals(e.getId(), totalHome, totalUsd);
            touched++;
        }
        log.info("Recalculated {} expenses in {} using {} rates", touched, scope, rates.getSource());
        return touched;
    }

    private Expense loadForCaller(CallerIdentity caller, TenantOperation operation, UUID expenseId) {
        Expense existing = expenses.findById(expenseId).orElse(null);
        if (existing == null) {
            if (caller.isSuperAdmin()) {
                throw new NotFoundException("Expense not found");
            }
            throw new AccessDeniedException("Access denied");
        }
        policy.requireRowAccess(caller, operation, existing.getCompanyId());
        return existing;
    }
}
