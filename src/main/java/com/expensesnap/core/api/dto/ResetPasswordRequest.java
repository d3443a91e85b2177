package com.expensesnap.core.api.dto;

public class ResetPasswordRequest {
  public String password;
}
