package com.expensesnap.core.domain.ports;

import com.expensesnap.core.domain.InviteCode;
import com.expensesnap.core.domain.access.DataScope;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface InviteCodeRepository {
    InviteCode save(InviteCode invite);

    /** Returns the code only while it is still unused. */
    Optional<InviteCode> findUnused(String code);

    /**
     * Marks the code as used by {@code userId}. Implemented as a single conditional update so
     * that exactly one concurrent caller wins.
     *
     * @return true when this call consumed the code
     */
    boolean consume(String code, UUID userId, OffsetDateTime usedAt);

    List<InviteCode> findPending(DataScope scope);

    void deleteByCompany(UUID companyId);
}
