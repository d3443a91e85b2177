package com.expensesnap.core.config;

import com.expensesnap.core.domain.Role;
import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.domain.ports.UserAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Optionally seeds the super admin on an empty database, for deployments where nobody
 * should be able to claim the first registration.
 */
@Configuration
public class BootstrapAdminRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminRunner.class);

    @Bean
    ApplicationRunner seedSuperAdmin(
            UserAccountRepository users,
            PasswordEncoder encoder,
            @Value("${bootstrap.admin.email:}") String adminEmail,
            @Value("${bootstrap.admin.password:}") String adminPassword,
            @Value("${bootstrap.admin.name:Administrator}") String adminName
    ) {
        return args -> {
            if (adminEmail == null || adminEmail.isBlank() || adminPassword == null || adminPassword.isBlank()) {
                log.debug("Bootstrap admin not configured; the first registration becomes super admin");
                return;
            }
            if (users.count() > 0) {
                log.info("Users already exist, skipping bootstrap admin {}", adminEmail);
                return;
            }

            UserAccount admin = new UserAccount(UUID.randomUUID(), adminName,
                    adminEmail.trim().toLowerCase(Locale.ROOT), encoder.encode(adminPassword),
                    Role.SUPER_ADMIN, null, OffsetDateTime.now());
            users.save(admin);
            log.info("Bootstrap super admin created: {}", admin.getEmail());
        };
    }
}
