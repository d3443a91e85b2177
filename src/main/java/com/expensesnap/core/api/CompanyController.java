package com.expensesnap.core.api;

import com.expensesnap.core.api.dto.CompanyRequest;
import com.expensesnap.core.api.dto.CompanyResponse;
import com.expensesnap.core.application.CompanyService;
import com.expensesnap.core.domain.access.CallerIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/companies")
@Tag(name = "Companies", description = "Tenant management")
@SecurityRequirement(name = "Bearer Authentication")
public class CompanyController {

    private final CompanyService companies;

    public CompanyController(CompanyService companies) {
        this.companies = companies;
    }

    @GetMapping
    @Operation(summary = "List companies with user count, expense count and total spent")
    public List<CompanyResponse> list(@AuthenticationPrincipal CallerIdentity caller) {
        return companies.list(caller).stream().map(CompanyResponse::from).toList();
    }

    @PostMapping
    @Operation(summary = "Create a company and its first admin invite code")
    public ResponseEntity<Map<String, Object>> create(@AuthenticationPrincipal CallerIdentity caller,
                                                      @Valid @RequestBody CompanyRequest req) {
        CompanyService.CompanyCreated created = companies.create(caller, req.name, req.homeCurrency);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("company", CompanyResponse.from(created.company()));
        body.put("invite_code", created.adminInviteCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Rename a company or change its home currency")
    public CompanyResponse update(@AuthenticationPrincipal CallerIdentity caller,
                                  @PathVariable("id") UUID id,
                                  @Valid @RequestBody CompanyRequest req) {
        return CompanyResponse.from(companies.update(caller, id, req.name, req.homeCurrency));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a company with its users, invites and expenses")
    public Map<String, Object> delete(@AuthenticationPrincipal CallerIdentity caller, @PathVariable("id") UUID id) {
        companies.delete(caller, id);
        return Map.of("deleted", id);
    }
}
