package com.expensesnap.core.application;

import com.expensesnap.core.config.JwtService;
import com.expensesnap.core.domain.Company;
import com.expensesnap.core.domain.InviteCode;
import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.domain.access.CallerIdentity;
import com.expensesnap.core.domain.ports.CompanyRepository;
import com.expensesnap.core.domain.ports.InviteCodeRepository;
import com.expensesnap.core.domain.ports.UserAccountRepository;
import com.expensesnap.core.exception.NotFoundException;
import com.expensesnap.core.exception.UnauthorizedException;
import com.expensesnap.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final int MIN_PASSWORD_LENGTH = 6;
    static final String ALL_COMPANIES = "All Companies";

    private final UserAccountRepository users;
    private final InviteCodeRepository invites;
    private final CompanyRepository companies;
    private final PasswordEncoder encoder;
    private final JwtService jwt;
    private final Clock clock;

    public AccountService(UserAccountRepository users, InviteCodeRepository invites, CompanyRepository companies,
                          PasswordEncoder encoder, JwtService jwt, Clock clock) {
        this.users = users;
        this.invites = invites;
        this.companies = companies;
        this.encoder = encoder;
        this.jwt = jwt;
        this.clock = clock;
    }

    public record Registration(UserAccount user, String companyName) {}

    public record LoginResult(String token, long expiresInSeconds, UserAccount user, String companyName) {}

    /**
     * The very first account becomes super admin without a company. Every later account needs
     * an unused invite code, which is consumed in the same transaction that creates the user.
     */
    @Transactional
    public Registration register(String name, String email, String password, String inviteCode) {
        String cleanName = name == null ? "" : name.trim();
        String cleanEmail = normalizeEmail(email);
        if (cleanName.isEmpty() || cleanEmail.isEmpty() || password == null || password.isEmpty()) {
            throw new ValidationException("All fields are required");
        }
        requirePasswordStrength(password);
        if (users.existsByEmail(cleanEmail)) {
            throw new ValidationException("Email already registered");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (users.count() == 0) {
            UserAccount admin = users.save(new UserAccount(UUID.randomUUID(), cleanName, cleanEmail,
                    encoder.encode(password), Role.SUPER_ADMIN, null, now));
            log.info("First account {} registered as super admin", cleanEmail);
            return new Registration(admin, ALL_COMPANIES);
        }

        if (inviteCode == null || inviteCode.isBlank()) {
            throw new ValidationException("Invite code required. Ask your admin for one.");
        }
        String code = inviteCode.trim();
        InviteCode invite = invites.findUnused(code)
                .orElseThrow(() -> new NotFoundException("Invalid or already used invite code"));

        UserAccount user = users.save(new UserAccount(UUID.randomUUID(), cleanName, cleanEmail,
                encoder.encode(password), invite.getRole(), invite.getCompanyId(), now));
        if (!invites.consume(code, user.getId(), now)) {
            // Lost a race with another registration; the rollback removes the new user
            throw new NotFoundException("Invalid or already used invite code");
        }

        String companyName = companies.findById(invite.getCompanyId()).map(Company::getName).orElse("");
        log.info("Account {} registered as {} in company {}", cleanEmail, invite.getRole(), invite.getCompanyId());
        return new Registration(user, companyName);
    }

    @Transactional(readOnly = true)
    public LoginResult login(String email, String password) {
        UserAccount user = users.findByEmail(normalizeEmail(email))
                .filter(u -> password != null && encoder.matches(password, u.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("Failed login for {}", email);
                    return new UnauthorizedException("Invalid email or password");
                });
        String token = jwt.generateToken(user);
        log.info("Login successful for {}", user.getEmail());
        return new LoginResult(token, jwt.getTtlSeconds(), user, companyNameOf(user.getCompanyId()));
    }

    @Transactional(readOnly = true)
    public Registration whoami(CallerIdentity caller) {
        UserAccount user = users.findById(caller.userId())
                .orElseThrow(() -> new UnauthorizedException("Account no longer exists"));
        return new Registration(user, companyNameOf(user.getCompanyId()));
    }

    static void requirePasswordStrength(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new ValidationException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
    }

    private String companyNameOf(UUID companyId) {
        if (companyId == null) {
            return ALL_COMPANIES;
        }
        return companies.findById(companyId).map(Company::getName).orElse("");
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
