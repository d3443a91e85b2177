package com.expensesnap.core.application;

import com.expensesnap.core.IntegrationTestSupport;
import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.Company;
import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.DashboardSummary;
import com.expensesnap.core.domain.Expense;
import com.expensesnap.core.domain.ExpenseCategory;
import com.expensesnap.core.domain.ExpenseUpdate;
import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.access.CallerIdentity;
import com.expensesnap.core.domain.ports.ExpenseRepository;
import com.expensesnap.core.domain.ports.ReceiptImageStoragePort;
import com.expensesnap.core.exception.AccessDeniedException;
import com.expensesnap.core.exception.NotFoundException;
import com.expensesnap.core.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpenseLedgerServiceTest extends IntegrationTestSupport {

    @Autowired
    private ExpenseLedgerService ledger;

    @Autowired
    private ExpenseRepository expenses;

    @Autowired
    private ReceiptImageStoragePort storage;

    @Autowired
    private AppProperties props;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private Company acme;
    private Company globex;
    private CallerIdentity acmeMember;
    private CallerIdentity acmeAdmin;
    private CallerIdentity superAdmin;

    @BeforeEach
    void seed() {
        acme = company("Acme", "USD");
        globex = company("Globex", "EUR");
        acmeMember = caller(user("Bob", Role.MEMBER, acme.getId()));
        acmeAdmin = caller(user("Ann", Role.COMPANY_ADMIN, acme.getId()));
        superAdmin = caller(user("Root", Role.SUPER_ADMIN, null));
    }

    private Expense expense(UUID companyId, String date, String total, String currency,
                            String totalHome, String totalUsd) {
        return expenses.save(new Expense(UUID.randomUUID(), date, "Vendor " + date, "", ExpenseCategory.GROCERIES,
                null, null, null, new BigDecimal(total), "Cash", CurrencyCode.of(currency),
                totalHome == null ? null : new BigDecimal(totalHome),
                totalUsd == null ? null : new BigDecimal(totalUsd),
                "", "Bob", companyId, null, OffsetDateTime.now()));
    }

    @Test
    void listingIsConfinedToCallersCompany() {
        Expense a1 = expense(acme.getId(), "2024-03-01", "10.00", "USD", "10.00", "10.00");
        Expense a2 = expense(acme.getId(), "2024-03-05", "20.00", "USD", "20.00", "20.00");
        expense(globex.getId(), "2024-03-03", "30.00", "EUR", "30.00", "32.61");

        List<ExpenseView> mine = ledger.list(acmeMember, null);

        assertThat(mine).extracting(v -> v.expense().getId()).containsExactly(a2.getId(), a1.getId());
        assertThat(mine).extracting(ExpenseView::companyName).containsOnly("Acme");
        assertThatThrownBy(() -> ledger.list(acmeMember, globex.getId())).isInstanceOf(AccessDeniedException.class);
        assertThat(ledger.list(superAdmin, null)).hasSize(3);
        assertThat(ledger.list(superAdmin, globex.getId())).hasSize(1);
    }

    @Test
    void dashboardUsesHomeCurrencyForOneCompanyAndUsdForAll() {
        expense(acme.getId(), "2024-03-01", "10.00", "USD", "10.00", "10.00");
        expense(globex.getId(), "2024-04-03", "30.00", "EUR", "30.00", "32.61");

        DashboardSummary globexView = ledger.dashboard(superAdmin, globex.getId());
        assertThat(globexView.currency()).isEqualTo("EUR");
        assertThat(globexView.total()).isEqualByComparingTo("30.00");

        DashboardSummary all = ledger.dashboard(superAdmin, null);
        assertThat(all.currency()).isEqualTo("USD");
        assertThat(all.total()).isEqualByComparingTo("42.61");
        assertThat(all.byMonth()).containsOnlyKeys("2024-03", "2024-04");

        DashboardSummary acmeView = ledger.dashboard(acmeMember, null);
        assertThat(acmeView.count()).isEqualTo(1);
        assertThat(acmeView.byCategory().get("Groceries")).isEqualByComparingTo("10.00");
    }

    @Test
    void memberMayEditButNotDelete() {
        Expense e = expense(acme.getId(), "2024-03-01", "10.00", "USD", "10.00", "10.00");

        Expense edited = ledger.update(acmeMember, e.getId(), new ExpenseUpdate(null, "Corner Shop", null,
                "Shopping & Retail", null, null, null, null, null, null, null));

        assertThat(edited.getVendor()).isEqualTo("Corner Shop");
        assertThat(expenses.findById(e.getId()).orElseThrow().getCategory())
                .isEqualTo(ExpenseCategory.SHOPPING_AND_RETAIL);
        assertThatThrownBy(() -> ledger.delete(acmeMember, e.getId())).isInstanceOf(AccessDeniedException.class);
        assertThat(expenses.findById(e.getId())).isPresent();
    }

    @Test
    void editNeverTouchesConvertedTotals() {
        Expense e = expense(acme.getId(), "2024-03-01", "10.00", "USD", "10.00", "10.00");

        ledger.update(acmeAdmin, e.getId(), new ExpenseUpdate(null, null, null, null, null, null, null,
                new BigDecimal("99.00"), null, null, null));

        Expense stored = expenses.findById(e.getId()).orElseThrow();
        assertThat(stored.getTotal()).isEqualByComparingTo("99.00");
        assertThat(stored.getTotalUsd()).isEqualByComparingTo("10.00");
        assertThat(stored.getCompanyId()).isEqualTo(acme.getId());
    }

    @Test
    void emptyEditIsRejected() {
        Expense e = expense(acme.getId(), "2024-03-01", "10.00", "USD", "10.00", "10.00");

        assertThatThrownBy(() -> ledger.update(acmeMember, e.getId(), new ExpenseUpdate(null, null, null, null,
                null, null, null, null, null, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void crossCompanyRowsCannotBeEditedOrDeleted() {
        Expense foreign = expense(globex.getId(), "2024-03-01", "10.00", "EUR", "10.00", "10.87");
        ExpenseUpdate rename = new ExpenseUpdate(null, "Hacked", null, null, null, null, null, null, null, null, null);

        assertThatThrownBy(() -> ledger.update(acmeAdmin, foreign.getId(), rename))
                .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> ledger.delete(acmeAdmin, foreign.getId()))
                .isInstanceOf(AccessDeniedException.class);
        assertThat(expenses.findById(foreign.getId()).orElseThrow().getVendor()).isNotEqualTo("Hacked");
    }

    @Test
    void adminDeletesOwnCompanyRowAndSuperAdminSeesMissingRowsAsNotFound() {
        Expense e = expense(acme.getId(), "2024-03-01", "10.00", "USD", "10.00", "10.00");

        ledger.delete(acmeAdmin, e.getId());

        assertThat(expenses.findById(e.getId())).isEmpty();
        assertThatThrownBy(() -> ledger.delete(superAdmin, e.getId())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void storedImageIsRemovedOnlyOnceTheDeleteCommits() {
        String imagePath = storage.store(acme.getId(), new byte[]{1, 2, 3}, ".jpg");
        Path imageFile = Path.of(props.getStorage().getBasePath()).resolve(imagePath);
        Expense e = expenses.save(new Expense(UUID.randomUUID(), "2024-03-01", "Cafe", "", ExpenseCategory.OTHER,
                null, null, null, new BigDecimal("4.00"), "Cash", CurrencyCode.USD, new BigDecimal("4.00"),
                new BigDecimal("4.00"), "", "Ann", acme.getId(), imagePath, OffsetDateTime.now()));

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            ledger.delete(acmeAdmin, e.getId());
            status.setRollbackOnly();
        });

        assertThat(expenses.findById(e.getId())).isPresent();
        assertThat(imageFile).exists();

        ledger.delete(acmeAdmin, e.getId());

        assertThat(expenses.findById(e.getId())).isEmpty();
        assertThat(imageFile).doesNotExist();
    }

    @Test
    void recalculationIsIdempotent() {
        Expense eur = expense(globex.getId(), "2024-03-01", "12.50", "EUR", null, null);
        Expense usd = expense(globex.getId(), "2024-03-02", "9.20", "USD", null, null);

        int first = ledger.recalculate(superAdmin, globex.getId());
        Expense afterFirst = expenses.findById(usd.getId()).orElseThrow();
        int second = ledger.recalculate(superAdmin, globex.getId());
        Expense afterSecond = expenses.findById(usd.getId()).orElseThrow();

        assertThat(first).isEqualTo(2);
        assertThat(second).isEqualTo(2);
        // 9.20 USD into EUR at the fallback rate 0.92
        assertThat(afterFirst.getTotalHome()).isEqualByComparingTo("8.46");
        assertThat(afterFirst.getTotalUsd()).isEqualByComparingTo("9.20");
        assertThat(afterSecond.getTotalHome()).isEqualByComparingTo(afterFirst.getTotalHome());
        assertThat(afterSecond.getTotalUsd()).isEqualByComparingTo(afterFirst.getTotalUsd());
        Expense eurAfter = expenses.findById(eur.getId()).orElseThrow();
        assertThat(eurAfter.getTotal()).isEqualByComparingTo("12.50");
        assertThat(eurAfter.getTotalHome()).isEqualByComparingTo("12.50");
        assertThat(eurAfter.getTotalUsd()).isEqualByComparingTo("13.59");
    }

    @Test
    void membersCannotRecalculate() {
        assertThatThrownBy(() -> ledger.recalculate(acmeMember, null)).isInstanceOf(AccessDeniedException.class);
        assertThat(ledger.recalculate(acmeAdmin, null)).isZero();
    }
}
