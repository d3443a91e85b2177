package com.expensesnap.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public interface SpringExpenseRepository extends JpaRepository<ExpenseEntity, UUID> {

    List<ExpenseEntity> findAllByOrderByDateDesc();

    List<ExpenseEntity> findByCompanyIdOrderByDateDesc(UUID companyId);

    long countByCompanyId(UUID companyId);

    @Query("SELECT COALESCE(SUM(e.total), 0) FROM ExpenseEntity e WHERE e.companyId = :companyId")
    BigDecimal sumTotalByCompanyId(@Param("companyId") UUID companyId);

    @Modifying
    @Query("UPDATE ExpenseEntity e SET e.totalHome = :home, e.totalUsd = :usd WHERE e.id = :id")
    int updateConvertedTotals(@Param("id") UUID id, @Param("home") BigDecimal home, @Param("usd") BigDecimal usd);

    @Modifying
    @Query("DELETE FROM ExpenseEntity e WHERE e.companyId = :companyId")
    int deleteByCompanyId(@Param("companyId") UUID companyId);
}
