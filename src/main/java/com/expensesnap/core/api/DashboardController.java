package com.expensesnap.core.api;

import com.expensesnap.core.api.dto.DashboardResponse;
import com.expensesnap.core.application.ExpenseLedgerService;
import com.expensesnap.core.domain.access.CallerIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Tag(name = "Dashboard")
@SecurityRequirement(name = "Bearer Authentication")
public class DashboardController {

    private final ExpenseLedgerService ledger;

    public DashboardController(ExpenseLedgerService ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Totals by category, month and uploader",
            description = "A single company is summed in its home currency, all companies together in USD.")
    public DashboardResponse dashboard(@AuthenticationPrincipal CallerIdentity caller,
                                       @RequestParam(value = "companyId", required = false) UUID companyId) {
        return DashboardResponse.from(ledger.dashboard(caller, companyId));
    }
}
