package com.expensesnap.core.infrastructure.adapters;

import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.domain.access.DataScope;
import com.expensesnap.core.domain.ports.UserAccountRepository;
import com.expensesnap.core.infrastructure.jpa.SpringUserRepository;
import com.expensesnap.core.infrastructure.jpa.UserEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaUserAccountRepositoryAdapter implements UserAccountRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaUserAccountRepositoryAdapter.class);

    private final SpringUserRepository users;

    public JpaUserAccountRepositoryAdapter(SpringUserRepository users) {
        this.users = users;
    }

    @Override
    public UserAccount save(UserAccount user) {
        UserEntity e = new UserEntity();
        e.setId(user.getId());
        e.setName(user.getName());
        e.setEmail(user.getEmail());
        e.setPasswordHash(user.getPasswordHash());
        e.setRole(user.getRole().wireName());
        e.setCompanyId(user.getCompanyId());
        e.setCreatedAt(user.getCreatedAt());
        users.save(e);
        return user;
    }

    @Override
    public Optional<UserAccount> findById(UUID userId) {
        return users.findById(userId).map(this::toDomain);
    }

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        return users.findByEmailIgnoreCase(email).map(this::toDomain);
    }

    @Override
    public boolean existsByEmail(String email) {
        return users.existsByEmailIgnoreCase(email);
    }

    @Override
    public long count() {
        return users.count();
    }

    @Override
    public long countByCompany(UUID companyId) {
        return users.countByCompanyId(companyId);
    }

    @Override
    public List<UserAccount> findByScope(DataScope scope) {
        List<UserEntity> rows = scope.isAll()
                ? users.findAllByOrderByCreatedAtAsc()
                : users.findByCompanyIdOrderByCreatedAtAsc(scope.getCompanyId());
        return rows.stream().map(this::toDomain).toList();
    }

    @Override
    @Transactional
    public void updatePasswordHash(UUID userId, String passwordHash) {
        users.updatePasswordHash(userId, passwordHash);
    }

    @Override
    @Transactional
    public void deleteById(UUID userId) {
        users.deleteById(userId);
    }

    @Override
    @Transactional
    public void deleteByCompany(UUID companyId) {
        int removed = users.deleteByCompanyId(companyId);
        log.debug("Removed {} users of company {}", removed, companyId);
    }

    private UserAccount toDomain(UserEntity e) {
        Role role = Role.fromWireName(e.getRole()).orElseGet(() -> {
            log.warn("User {} has unknown role '{}', treating as member", e.getId(), e.getRole());
            return Role.MEMBER;
        });
        return new UserAccount(e.getId(), e.getName(), e.getEmail(), e.getPasswordHash(), role,
                e.getCompanyId(), e.getCreatedAt());
    }
}
