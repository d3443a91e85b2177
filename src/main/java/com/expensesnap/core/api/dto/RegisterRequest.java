package com.expensesnap.core.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public class RegisterRequest {
  @Size(max=200) public String name;
  @Email @Size(max=320) public String email;
  public String password;
  public String inviteCode;
}
