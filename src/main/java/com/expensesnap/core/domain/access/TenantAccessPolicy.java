package com.expensesnap.core.domain.access;

import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.exception.AccessDeniedException;
import com.expensesnap.core.exception.ValidationException;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Role x company authorization. Pure: every answer depends only on the arguments.
 *
 * <p>A super admin may do anything; a target company narrows the scope, no target means all
 * companies. A company admin may do anything but manage companies, and only inside their own
 * company. A member may read and write expenses of their own company.
 */
public class TenantAccessPolicy {

    private static final Set<TenantOperation> MEMBER_OPERATIONS =
            EnumSet.of(TenantOperation.READ_EXPENSES, TenantOperation.WRITE_EXPENSES);

    public AccessDecision authorize(CallerIdentity caller, TenantOperation operation, UUID targetCompanyId) {
        if (caller == null || caller.role() == null) {
            return AccessDecision.deny("Not authenticated");
        }
        if (caller.role() == Role.SUPER_ADMIN) {
            return AccessDecision.allow(targetCompanyId == null ? DataScope.all() : DataScope.company(targetCompanyId));
        }
        if (operation == TenantOperation.MANAGE_COMPANIES) {
            return AccessDecision.deny("Super admin only");
        }
        if (caller.role() == Role.MEMBER && !MEMBER_OPERATIONS.contains(operation)) {
            return AccessDecision.deny("Admin access required");
        }
        if (caller.companyId() == null) {
            return AccessDecision.deny("Account is not assigned to a company");
        }
        if (targetCompanyId != null && !targetCompanyId.equals(caller.companyId())) {
            return AccessDecision.deny("Access denied");
        }
        return AccessDecision.allow(DataScope.company(caller.companyId()));
    }

    public AccessDecision authorize(CallerIdentity caller, TenantOperation operation) {
        return authorize(caller, operation, null);
    }

    /** Same as {@link #authorize} but throws on denial and returns the granted scope. */
    public DataScope require(CallerIdentity caller, TenantOperation operation, UUID targetCompanyId) {
        AccessDecision decision = authorize(caller, operation, targetCompanyId);
        if (!decision.allowed()) {
            throw new AccessDeniedException(decision.reason());
        }
        return decision.scope();
    }

    public DataScope require(CallerIdentity caller, TenantOperation operation) {
        return require(caller, operation, null);
    }

    /**
     * Checks a team-management action on {@code target}. Acting on one's own account is a
     * validation error; acting on an account outside the caller's company is denied.
     * A missing target is reported as denied to non super admins.
     */
    public void requireTeamTarget(CallerIdentity caller, TeamAction action, UUID targetUserId, UserAccount target) {
        require(caller, TenantOperation.MANAGE_TEAM);
        if (caller.userId().equals(targetUserId)) {
            throw new ValidationException(action.selfTargetMessage());
        }
        if (caller.isSuperAdmin()) {
            return;
        }
        if (target == null || !caller.companyId().equals(target.getCompanyId())) {
            throw new AccessDeniedException("Access denied");
        }
    }

    /** Checks that a row owned by {@code rowCompanyId} falls inside what the caller may touch. */
    public void requireRowAccess(CallerIdentity caller, TenantOperation operation, UUID rowCompanyId) {
        DataScope scope = require(caller, operation);
        if (!scope.includes(rowCompanyId)) {
            throw new AccessDeniedException("Access denied");
        }
    }
}
