package com.expensesnap.core.api.dto;

import java.util.UUID;

public class InviteRequest {
  public UUID companyId;
  public String role;
}
