package com.expensesnap.core.infrastructure.jpa;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "expense")
public class ExpenseEntity {

    @Id
    private UUID id;

    // Free text as extracted; "YYYY-MM-DD" when the receipt shows a date, empty otherwise
    @Column(name = "expense_date", length = 32)
    private String date;

    @Column(length = 300)
    private String vendor;

    @Column(length = 300)
    private String location;

    @Column(length = 64)
    private String category;

    @Column(precision = 18, scale = 2)
    private BigDecimal subtotal;

    @Column(precision = 18, scale = 2)
    private BigDecimal tax;

    @Column(precision = 18, scale = 2)
    private BigDecimal tip;

    @Column(precision = 18, scale = 2)
    private BigDecimal total;

    @Column(name = "payment_method", length = 100)
    private String paymentMethod;

    @Column(length = 3)
    private String currency;

    @Column(name = "total_home", precision = 18, scale = 2)
    private BigDecimal totalHome;

    @Column(name = "total_usd", precision = 18, scale = 2)
    private BigDecimal totalUsd;

    @Column(name = "line_items", columnDefinition = "TEXT")
    private String items;

    @Column(name = "uploaded_by", length = 200)
    private String uploadedBy;

    @Column(name = "company_id")
    private UUID companyId;

    @Column(name = "receipt_image", length = 300)
    private String receiptImage;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public ExpenseEntity() {}

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public String getVendor() { return vendor; }
    public void setVendor(String vendor) { this.vendor = vendor; }

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public BigDecimal getSubtotal() { return subtotal; }
    public void setSubtotal(BigDecimal subtotal) { this.subtotal = subtotal; }

    public BigDecimal getTax() { return tax; }
    public void setTax(BigDecimal tax) { this.tax = tax; }

    public BigDecimal getTip() { return tip; }
    public void setTip(BigDecimal tip) { this.tip = tip; }

    public BigDecimal getTotal() { return total; }
    public void setTotal(BigDecimal total) { this.total = total; }

    public String getPaymentMethod() { return paymentMethod; }
    public void setPaymentMethod(String paymentMethod) { this.paymentMethod = paymentMethod; }

    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }

    public BigDecimal getTotalHome() { return totalHome; }
    public void setTotalHome(BigDecimal totalHome) { this.totalHome = totalHome; }

    public BigDecimal getTotalUsd() { return totalUsd; }
    public void setTotalUsd(BigDecimal totalUsd) { this.totalUsd = totalUsd; }

    public String getItems() { return items; }
    public void setItems(String items) { this.items = items; }

    public String getUploadedBy() { return uploadedBy; }
    public void setUploadedBy(String uploadedBy) { this.uploadedBy = uploadedBy; }

    public UUID getCompanyId() { return companyId; }
    public void setCompanyId(UUID companyId) { this.companyId = companyId; }

    public String getReceiptImage() { return receiptImage; }
    public void setReceiptImage(String receiptImage) { this.receiptImage = receiptImage; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }
}
