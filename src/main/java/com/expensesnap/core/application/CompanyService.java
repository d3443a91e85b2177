package com.expensesnap.core.application;

import com.expensesnap.core.domain.Company;
import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.InviteCode;
import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.access.CallerIdentity;
import com.expensesnap.core.domain.access.TenantAccessPolicy;
import com.expensesnap.core.domain.access.TenantOperation;
import com.expensesnap.core.domain.ports.CompanyRepository;
import com.expensesnap.core.domain.ports.ExpenseRepository;
import com.expensesnap.core.domain.ports.InviteCodeRepository;
import com.expensesnap.core.domain.ports.UserAccountRepository;
import com.expensesnap.core.exception.NotFoundException;
import com.expensesnap.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Service
public class CompanyService {

    private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

    private final CompanyRepository companies;
    private final UserAccountRepository users;
    private final ExpenseRepository expenses;
    private final InviteCodeRepository invites;
    private final InviteCodeGenerator codes;
    private final Clock clock;

    private final TenantAccessPolicy policy = new TenantAccessPolicy();

    public CompanyService(CompanyRepository companies, UserAccountRepository users, ExpenseRepository expenses,
                          InviteCodeRepository invites, InviteCodeGenerator codes, Clock clock) {
        this.companies = companies;
        this.users = users;
        this.expenses = expenses;
        this.invites = invites;
        this.codes = codes;
        this.clock = clock;
    }

    public record CompanyOverview(Company company, long userCount, long expenseCount, BigDecimal totalSpent) {}

    public record CompanyCreated(Company company, String adminInviteCode) {}

    @Transactional(readOnly = true)
    public List<CompanyOverview> list(CallerIdentity caller) {
        policy.require(caller, TenantOperation.MANAGE_COMPANIES);
        return companies.findAll().stream()
                .map(c -> new CompanyOverview(c,
                        users.countByCompany(c.getId()),
                        expenses.countByCompany(c.getId()),
                        expenses.sumTotalByCompany(c.getId())))
                .toList();
    }

    /** Creates the company together with a single-use invite for its first company admin. */
    @Transactional
    public CompanyCreated create(CallerIdentity caller, String name, String homeCurrency) {
        policy.require(caller, TenantOperation.MANAGE_COMPANIES);
        String cleanName = name == null ? "" : name.trim();
        if (cleanName.isEmpty()) {
            throw new ValidationException("Company name required");
        }
        CurrencyCode currency = homeCurrency == null || homeCurrency.isBlank()
                ? CurrencyCode.USD
                : parseCurrency(homeCurrency);

        OffsetDateTime now = OffsetDateTime.now(clock);
        Company company = companies.save(new Company(UUID.randomUUID(), cleanName, currency, now));
        String code = codes.next();
        invites.save(new InviteCode(code, company.getId(), Role.COMPANY_ADMIN, caller.userId(), null, null, now));
        log.info("Company '{}' ({}) created by {}", cleanName, company.getId(), caller.userId());
        return new CompanyCreated(company, code);
    }

    @Transactional
    public Company update(CallerIdentity caller, UUID companyId, String name, String homeCurrency) {
        policy.require(caller, TenantOperation.COMPANY_SETTINGS, companyId);
        Company existing = companies.findById(companyId)
                .orElseThrow(() -> new NotFoundException("Company not found"));

        String newName = null;
        if (name != null) {
            newName = name.trim();
            if (newName.isEmpty()) {
                throw new ValidationException("Company name required");
            }
        }
        CurrencyCode newCurrency = homeCurrency == null ? null : parseCurrency(homeCurrency);
        Company updated = companies.save(existing.withSettings(newName, newCurrency));
        log.info("Company {} settings updated by {}", companyId, caller.userId());
        return updated;
    }

    /** Hard delete of the company with its expenses, users and invite codes. */
    @Transactional
    public void delete(CallerIdentity caller, UUID companyId) {
        policy.require(caller, TenantOperation.MANAGE_COMPANIES);
        if (companies.findById(companyId).isEmpty()) {
            throw new NotFoundException("Company not found");
        }
        expenses.deleteByCompany(companyId);
        invites.deleteByCompany(companyId);
        users.deleteByCompany(companyId);
        companies.deleteById(companyId);
        log.info("Company {} deleted by {}", companyId, caller.userId());
    }

    private static CurrencyCode parseCurrency(String value) {
        try {
            return CurrencyCode.of(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }
}
