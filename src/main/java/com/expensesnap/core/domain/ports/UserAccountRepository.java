package com.expensesnap.core.domain.ports;

import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.domain.access.DataScope;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface UserAccountRepository {
    UserAccount save(UserAccount user);

    Optional<UserAccount> findById(UUID userId);

    /** Case-insensitive lookup. */
    Optional<UserAccount> findByEmail(String email);

    boolean existsByEmail(String email);

    long count();

    long countByCompany(UUID companyId);

    /** Users visible in the scope, oldest first. */
    List<UserAccount> findByScope(DataScope scope);

    void updatePasswordHash(UUID userId, String passwordHash);

    void deleteById(UUID userId);

    void deleteByCompany(UUID companyId);
}
