package com.expensesnap.core.application;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;

/** URL-safe random tokens of 8 random bytes (11 characters). */
@Component
public class InviteCodeGenerator {

    private static final int TOKEN_BYTES = 8;

    private final SecureRandom random = new SecureRandom();

    public String next() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
