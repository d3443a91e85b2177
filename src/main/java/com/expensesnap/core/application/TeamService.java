package com.expensesnap.core.application;

import com.expensesnap.core.domain.InviteCode;
import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.domain.access.CallerIdentity;
import com.expensesnap.core.domain.access.DataScope;
import com.expensesnap.core.domain.access.TeamAction;
import com.expensesnap.core.domain.access.TenantAccessPolicy;
import com.expensesnap.core.domain.access.TenantOperation;
import com.expensesnap.core.domain.ports.CompanyRepository;
import com.expensesnap.core.domain.ports.InviteCodeRepository;
import com.expensesnap.core.domain.ports.UserAccountRepository;
import com.expensesnap.core.exception.NotFoundException;
import com.expensesnap.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Invites and team membership. Company admins only ever act inside their own company.
 */
@Service
public class TeamService {

    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    private final UserAccountRepository users;
    private final InviteCodeRepository invites;
    private final CompanyRepository companies;
    private final InviteCodeGenerator codes;
    private final PasswordEncoder encoder;
    private final Clock clock;

    private final TenantAccessPolicy policy = new TenantAccessPolicy();

    public TeamService(UserAccountRepository users, InviteCodeRepository invites, CompanyRepository companies,
                       InviteCodeGenerator codes, PasswordEncoder encoder, Clock clock) {
        this.users = users;
        this.invites = invites;
        this.companies = companies;
        this.codes = codes;
        this.encoder = encoder;
        this.clock = clock;
    }

    public record TeamOverview(List<UserAccount> users, List<InviteCode> pendingInvites) {}

    /**
     * A super admin must name the company and may invite a company admin or a member; a
     * company admin always invites a member of their own company.
     */
    @Transactional
    public InviteCode createInvite(CallerIdentity caller, UUID companyId, String requestedRole) {
        if (caller.isSuperAdmin() && companyId == null) {
            policy.require(caller, TenantOperation.MANAGE_INVITES);
            throw new ValidationException("Select a company");
        }
        DataScope scope = policy.require(caller, TenantOperation.MANAGE_INVITES, companyId);
        UUID targetCompany = scope.getCompanyId();
        if (companies.findById(targetCompany).isEmpty()) {
            throw new NotFoundException("Company not found");
        }

        Role role = Role.MEMBER;
        if (caller.isSuperAdmin()) {
            role = Role.fromWireName(requestedRole)
                    .filter(r -> r == Role.COMPANY_ADMIN || r == Role.MEMBER)
                    .orElse(Role.MEMBER);
        }

        InviteCode invite = invites.save(new InviteCode(codes.next(), targetCompany, role, caller.userId(),
                null, null, OffsetDateTime.now(clock)));
        log.info("Invite for {} in company {} created by {}", role, targetCompany, caller.userId());
        return invite;
    }

    @Transactional(readOnly = true)
    public TeamOverview team(CallerIdentity caller, UUID companyId) {
        DataScope scope = policy.require(caller, TenantOperation.MANAGE_TEAM, companyId);
        return new TeamOverview(users.findByScope(scope), invites.findPending(scope));
    }

    @Transactional
    public void removeMember(CallerIdentity caller, UUID userId) {
        UserAccount target = loadTarget(caller, TeamAction.REMOVE, userId);
        users.deleteById(target.getId());
        log.info("User {} removed by {}", userId, caller.userId());
    }

    @Transactional
    public void resetPassword(CallerIdentity caller, UUID userId, String newPassword) {
        policy.require(caller, TenantOperation.MANAGE_TEAM);
        String password = newPassword == null ? "" : newPassword.trim();
        AccountService.requirePasswordStrength(password);
        UserAccount target = loadTarget(caller, TeamAction.RESET_PASSWORD, userId);
        users.updatePasswordHash(target.getId(), encoder.encode(password));
        log.info("Password of user {} reset by {}", userId, caller.userId());
    }

    private UserAccount loadTarget(CallerIdentity caller, TeamAction action, UUID userId) {
        UserAccount target = users.findById(userId).orElse(null);
        policy.requireTeamTarget(caller, action, userId, target);
        if (target == null) {
            throw new NotFoundException("User not found");
        }
        return target;
    }
}
