package com.expensesnap.core.api;

import com.expensesnap.core.api.dto.LoginRequest;
import com.expensesnap.core.api.dto.RegisterRequest;
import com.expensesnap.core.api.dto.UserResponse;
import com.expensesnap.core.application.AccountService;
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
import java.util.Map;

@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Registration by invite code and bearer token login")
public class AuthController {

    private final AccountService accounts;

    public AuthController(AccountService accounts) {
        this.accounts = accounts;
    }

    @PostMapping("/register")
    @Operation(summary = "Register an account",
            description = "The first account becomes super admin. Every later account needs an unused invite code.")
    public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody RegisterRequest req) {
        AccountService.Registration reg = accounts.register(req.name, req.email, req.password, req.inviteCode);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", UserResponse.from(reg.user()));
        body.put("company_name", reg.companyName());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/login")
    @Operation(summary = "Exchange email and password for a bearer token")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest req) {
        AccountService.LoginResult result = accounts.login(req.email, req.password);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("access_token", result.token());
        body.put("token_type", "Bearer");
        body.put("expires_in_seconds", result.expiresInSeconds());
        body.put("user", UserResponse.from(result.user()));
        body.put("company_name", result.companyName());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/whoami")
    @Operation(summary = "Current caller and company name")
    @SecurityRequirement(name = "Bearer Authentication")
    public ResponseEntity<Map<String, Object>> whoami(@AuthenticationPrincipal CallerIdentity caller) {
        AccountService.Registration me = accounts.whoami(caller);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", UserResponse.from(me.user()));
        body.put("company_name", me.companyName());
        return ResponseEntity.ok(body);
    }
}
