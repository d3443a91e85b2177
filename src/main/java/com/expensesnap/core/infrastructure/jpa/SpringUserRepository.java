package com.expensesnap.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringUserRepository extends JpaRepository<UserEntity, UUID> {

    Optional<UserEntity> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    long countByCompanyId(UUID companyId);

    List<UserEntity> findAllByOrderByCreatedAtAsc();

    List<UserEntity> findByCompanyIdOrderByCreatedAtAsc(UUID companyId);

    @Modifying
    @Query("UPDATE UserEntity u SET u.passwordHash = :hash WHERE u.id = :id")
    int updatePasswordHash(@Param("id") UUID id, @Param("hash") String hash);

    @Modifying
    @Query("DELETE FROM UserEntity u WHERE u.companyId = :companyId")
    int deleteByCompanyId(@Param("companyId") UUID companyId);
}
