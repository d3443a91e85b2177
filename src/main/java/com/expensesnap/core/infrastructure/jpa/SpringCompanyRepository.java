package com.expensesnap.core.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringCompanyRepository extends JpaRepository<CompanyEntity, UUID> {

    List<CompanyEntity> findAllByOrderByCreatedAtAsc();
}
