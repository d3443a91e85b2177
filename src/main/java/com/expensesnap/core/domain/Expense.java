package com.expensesnap.core.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.UUID;

public class Expense {

    private final UUID id;
    private final String date;
    private final String vendor;
    private final String location;
    private final ExpenseCategory category;
    private final BigDecimal subtotal;
    private final BigDecimal tax;
    private final BigDecimal tip;
    private final BigDecimal total;
    private final String paymentMethod;
    private final CurrencyCode currency;
    private final BigDecimal totalHome;
    private final BigDecimal totalUsd;
    private final String items;
    private final String uploadedBy;
    private final UUID companyId;
    private final String imagePath;
    private final OffsetDateTime createdAt;

    public Expense(UUID id, String date, String vendor, String location, ExpenseCategory category,
                   BigDecimal subtotal, BigDecimal tax, BigDecimal tip, BigDecimal total,
                   String paymentMethod, CurrencyCode currency, BigDecimal totalHome, BigDecimal totalUsd,
                   String items, String uploadedBy, UUID companyId, String imagePath, OffsetDateTime createdAt) {
        this.id = id;
        this.date = date == null ? "" : date;
        this.vendor = vendor;
        this.location = location;
        this.category = category == null ? ExpenseCategory.OTHER : category;
        this.subtotal = money(subtotal);
        this.tax = money(tax);
        this.tip = money(tip);
        this.total = money(total);
        this.paymentMethod = paymentMethod;
        this.currency = currency == null ? CurrencyCode.USD : currency;
        this.totalHome = totalHome;
        this.totalUsd = totalUsd;
        this.items = items;
        this.uploadedBy = uploadedBy;
        this.companyId = companyId;
        this.imagePath = imagePath;
        this.createdAt = createdAt;
    }

    private static BigDecimal money(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(2) : value.setScale(2, RoundingMode.HALF_UP);
    }

    /** Applies an edit. Converted totals are carried over untouched. */
    public Expense withChanges(ExpenseUpdate update) {
        return new Expense(id,
                update.date() != null ? update.date() : date,
                update.vendor() != null ? update.vendor() : vendor,
                update.location() != null ? update.location() : location,
                update.category() != null ? ExpenseCategory.fromLabel(update.category()) : category,
                update.subtotal() != null ? update.subtotal() : subtotal,
                update.tax() != null ? update.tax() : tax,
                update.tip() != null ? update.tip() : tip,
                update.total() != null ? update.total() : total,
                update.paymentMethod() != null ? update.paymentMethod() : paymentMethod,
                update.currency() != null ? CurrencyCode.of(update.currency()) : currency,
                totalHome, totalUsd,
                update.items() != null ? update.items() : items,
                uploadedBy, companyId, imagePath, createdAt);
    }

    public UUID getId() {
        return id;
    }

    public String getDate() {
        return date;
    }

    public String getVendor() {
        return vendor;
    }

    public String getLocation() {
        return location;
    }

    public ExpenseCategory getCategory() {
        return category;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public BigDecimal getTax() {
        return tax;
    }

    public BigDecimal getTip() {
        return tip;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public CurrencyCode getCurrency() {
        return currency;
    }

    public BigDecimal getTotalHome() {
        return totalHome;
    }

    public BigDecimal getTotalUsd() {
        return totalUsd;
    }

    public String getItems() {
        return items;
    }

    public String getUploadedBy() {
        return uploadedBy;
    }

    public UUID getCompanyId() {
        return companyId;
    }

    public String getImagePath() {
        return imagePath;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
