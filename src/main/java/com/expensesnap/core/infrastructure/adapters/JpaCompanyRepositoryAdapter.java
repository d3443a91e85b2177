package com.expensesnap.core.infrastructure.adapters;

import com.expensesnap.core.domain.Company;
import com.expensesnap.core.domain.CurrencyCode;
import com.expensesnap.core.domain.ports.CompanyRepository;
import com.expensesnap.core.infrastructure.jpa.CompanyEntity;
import com.expensesnap.core.infrastructure.jpa.SpringCompanyRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaCompanyRepositoryAdapter implements CompanyRepository {

    private final SpringCompanyRepository companies;

    public JpaCompanyRepositoryAdapter(SpringCompanyRepository companies) {
        this.companies = companies;
    }

    @Override
    public Company save(Company company) {
        CompanyEntity e = new CompanyEntity();
        e.setId(company.getId());
        e.setName(company.getName());
        e.setHomeCurrency(company.getHomeCurrency().code());
        e.setCreatedAt(company.getCreatedAt());
        companies.save(e);
        return company;
    }

    @Override
    public Optional<Company> findById(UUID companyId) {
        return companies.findById(companyId).map(this::toDomain);
    }

    @Override
    public List<Company> findAll() {
        return companies.findAllByOrderByCreatedAtAsc().stream().map(this::toDomain).toList();
    }

    @Override
    @Transactional
    public void deleteById(UUID companyId) {
        companies.deleteById(companyId);
    }

    private Company toDomain(CompanyEntity e) {
        return new Company(e.getId(), e.getName(),
                CurrencyCode.parseOrDefault(e.getHomeCurrency(), CurrencyCode.USD), e.getCreatedAt());
    }
}
