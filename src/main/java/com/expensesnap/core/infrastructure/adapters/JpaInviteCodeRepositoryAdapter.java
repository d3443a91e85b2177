package com.expensesnap.core.infrastructure.adapters;

import com.expensesnap.core.domain.InviteCode;
import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.access.DataScope;
import com.expensesnap.core.domain.ports.InviteCodeRepository;
import com.expensesnap.core.infrastructure.jpa.InviteCodeEntity;
import com.expensesnap.core.infrastructure.jpa.SpringInviteCodeRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaInviteCodeRepositoryAdapter implements InviteCodeRepository {

    private final SpringInviteCodeRepository invites;

    public JpaInviteCodeRepositoryAdapter(SpringInviteCodeRepository invites) {
        this.invites = invites;
    }

    @Override
    public InviteCode save(InviteCode invite) {
        InviteCodeEntity e = new InviteCodeEntity();
        e.setCode(invite.getCode());
        e.setCompanyId(invite.getCompanyId());
        e.setRole(invite.getRole().wireName());
        e.setCreatedBy(invite.getCreatedBy());
        e.setUsedBy(invite.getUsedBy());
        e.setUsedAt(invite.getUsedAt());
        e.setCreatedAt(invite.getCreatedAt());
        invites.save(e);
        return invite;
    }

    @Override
    public Optional<InviteCode> findUnused(String code) {
        return invites.findByCodeAndUsedByIsNull(code).map(this::toDomain);
    }

    @Override
    @Transactional
    public boolean consume(String code, UUID userId, OffsetDateTime usedAt) {
        return invites.markUsed(code, userId, usedAt) == 1;
    }

    @Override
    public List<InviteCode> findPending(DataScope scope) {
        List<InviteCodeEntity> rows = scope.isAll()
                ? invites.findByUsedByIsNullOrderByCreatedAtAsc()
                : invites.findByCompanyIdAndUsedByIsNullOrderByCreatedAtAsc(scope.getCompanyId());
        return rows.stream().map(this::toDomain).toList();
    }

    @Override
    @Transactional
    public void deleteByCompany(UUID companyId) {
        invites.deleteByCompanyId(companyId);
    }

    private InviteCode toDomain(InviteCodeEntity e) {
        return new InviteCode(e.getCode(), e.getCompanyId(),
                Role.fromWireName(e.getRole()).orElse(Role.MEMBER),
                e.getCreatedBy(), e.getUsedBy(), e.getUsedAt(), e.getCreatedAt());
    }
}
