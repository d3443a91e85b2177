package com.expensesnap.core.domain;

import com.expensesnap.core.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpenseTest {

    private final Expense base = new Expense(UUID.randomUUID(), "2024-03-02", "Cafe", "Berlin",
            ExpenseCategory.FOOD_AND_DINING, new BigDecimal("10"), new BigDecimal("1.5"), null,
            new BigDecimal("12.5"), "Visa", CurrencyCode.of("eur"), new BigDecimal("13.59"),
            new BigDecimal("13.59"), "Coffee", "Ann", UUID.randomUUID(), "x/y.jpg", OffsetDateTime.now());

    @Test
    void amountsAreNormalizedToTwoDecimals() {
        assertThat(base.getTotal()).isEqualTo(new BigDecimal("12.50"));
        assertThat(base.getTip()).isEqualTo(new BigDecimal("0.00"));
        assertThat(base.getCurrency().code()).isEqualTo("EUR");
    }

    @Test
    void editKeepsConvertedTotalsAndOwnership() {
        Expense edited = base.withChanges(new ExpenseUpdate(null, "Bistro", null, "groceries", null, null, null,
                new BigDecimal("20"), null, "gbp", null));

        assertThat(edited.getVendor()).isEqualTo("Bistro");
        assertThat(edited.getCategory()).isEqualTo(ExpenseCategory.GROCERIES);
        assertThat(edited.getTotal()).isEqualByComparingTo("20.00");
        assertThat(edited.getCurrency().code()).isEqualTo("GBP");
        assertThat(edited.getLocation()).isEqualTo("Berlin");
        assertThat(edited.getTotalUsd()).isEqualByComparingTo("13.59");
        assertThat(edited.getCompanyId()).isEqualTo(base.getCompanyId());
        assertThat(edited.getUploadedBy()).isEqualTo("Ann");
    }

    @Test
    void unknownCategoryBecomesOther() {
        Expense edited = base.withChanges(new ExpenseUpdate(null, null, null, "Spaceships", null, null, null,
                null, null, null, null));

        assertThat(edited.getCategory()).isEqualTo(ExpenseCategory.OTHER);
    }

    @Test
    void updateRejectsNegativeAmountsAndBadCurrency() {
        assertThatThrownBy(() -> new ExpenseUpdate(null, null, null, null, null, null, null,
                new BigDecimal("-1"), null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new ExpenseUpdate(null, null, null, null, null, null, null,
                null, null, "EURO", null))
                .isInstanceOf(ValidationException.class);
        assertThat(new ExpenseUpdate(null, null, null, null, null, null, null, null, null, null, null).isEmpty())
                .isTrue();
    }

    @Test
    void updateRejectsDatesLongerThanTheStoredColumn() {
        String tooLong = "2024-03-02 at the counter, table 12";

        assertThatThrownBy(() -> new ExpenseUpdate(tooLong, null, null, null, null, null, null,
                null, null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("date");
        assertThat(new ExpenseUpdate("x".repeat(32), null, null, null, null, null, null,
                null, null, null, null).date()).hasSize(32);
    }

    @Test
    void currencyCodeParsingIsLenientOnlyWhereAsked() {
        assertThat(CurrencyCode.parseOrDefault("", CurrencyCode.USD)).isEqualTo(CurrencyCode.USD);
        assertThat(CurrencyCode.parseOrDefault("€", CurrencyCode.USD)).isEqualTo(CurrencyCode.USD);
        assertThat(CurrencyCode.parseOrDefault(" jpy ", CurrencyCode.USD).code()).isEqualTo("JPY");
        assertThatThrownBy(() -> CurrencyCode.of("12$")).isInstanceOf(IllegalArgumentException.class);
    }
}
