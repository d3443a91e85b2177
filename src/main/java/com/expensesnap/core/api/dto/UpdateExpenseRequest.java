package com.expensesnap.core.api.dto;

import com.expensesnap.core.domain.ExpenseUpdate;

import java.math.BigDecimal;

/** Any field left out of the JSON body keeps its stored value. */
public class UpdateExpenseRequest {
  public String date;
  public String vendor;
  public String location;
  public String category;
  public BigDecimal subtotal;
  public BigDecimal tax;
  public BigDecimal tip;
  public BigDecimal total;
  public String paymentMethod;
  public String currency;
  public String items;

  public ExpenseUpdate toUpdate() {
    return new ExpenseUpdate(date, vendor, location, category, subtotal, tax, tip, total,
            paymentMethod, currency, items);
  }
}
