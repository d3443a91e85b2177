package com.expensesnap.core.api.dto;

import jakarta.validation.constraints.Size;

public class CompanyRequest {
  @Size(max=200) public String name;
  public String homeCurrency;
}
