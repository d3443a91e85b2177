package com.expensesnap.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringInviteCodeRepository extends JpaRepository<InviteCodeEntity, String> {

    Optional<InviteCodeEntity> findByCodeAndUsedByIsNull(String code);

    List<InviteCodeEntity> findByUsedByIsNullOrderByCreatedAtAsc();

    List<InviteCodeEntity> findByCompanyIdAndUsedByIsNullOrderByCreatedAtAsc(UUID companyId);

    // Conditional on used_by still being null: at most one caller gets a row count of 1
    @Modifying
    @Query("UPDATE InviteCodeEntity i SET i.usedBy = :userId, i.usedAt = :usedAt " +
            "WHERE i.code = :code AND i.usedBy IS NULL")
    int markUsed(@Param("code") String code, @Param("userId") UUID userId, @Param("usedAt") OffsetDateTime usedAt);

    @Modifying
    @Query("DELETE FROM InviteCodeEntity i WHERE i.companyId = :companyId")
    int deleteByCompanyId(@Param("companyId") UUID companyId);
}
