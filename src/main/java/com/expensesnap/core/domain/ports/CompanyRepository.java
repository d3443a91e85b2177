package com.expensesnap.core.domain.ports;

import com.expensesnap.core.domain.Company;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CompanyRepository {
    Company save(Company company);

    Optional<Company> findById(UUID companyId);

    List<Company> findAll();

    void deleteById(UUID companyId);
}
