package com.expensesnap.core.config;

import com.expensesnap.core.domain.UserAccount;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final Key key;
    private final long ttlSeconds;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    /* ------------------------ token creation ------------------------ */

    public String generateToken(UserAccount user) {
        Instant now = Instant.now();
        Date iat = Date.from(now);
        Date exp = Date.from(now.plusSeconds(ttlSeconds));

        log.debug("Generating JWT token for user: {}, role: {}, company: {}",
                user.getEmail(), user.getRole(), user.getCompanyId());

        return Jwts.builder()
                .setSubject(user.getEmail())
                .setIssuedAt(iat)
                .setExpiration(exp)
                .claim("userId", user.getId().toString())
                .claim("role", user.getRole().wireName())
                .claim("companyId", user.getCompanyId() == null ? null : user.getCompanyId().toString())
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }

    /** User id carried by a valid, unexpired token. */
    public Optional<UUID> getUserId(String token) {
        try {
            Object userId = parse(token).getBody().get("userId");
            return userId == null ? Optional.empty() : Optional.of(UUID.fromString(String.valueOf(userId)));
        } catch (Exception e) {
            log.warn("Rejected JWT token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> getSubject(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject());
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
