package com.expensesnap.core.config;

import com.expensesnap.core.domain.UserAccount;
import com.expensesnap.core.domain.access.CallerIdentity;
import com.expensesnap.core.domain.ports.UserAccountRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the bearer token to a {@link CallerIdentity}. The account is reloaded on every
 * request, so removed users and changed roles take effect immediately.
 */
public class JwtAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    private final JwtService jwt;
    private final UserAccountRepository users;

    public JwtAuthFilter(JwtService jwt, UserAccountRepository users) {
        this.jwt = jwt;
        this.users = users;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest req) {
        String path = req.getRequestURI();

        if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
            return true;
        }
        if (path.equals("/auth/login") || path.equals("/auth/register")) {
            return true;
        }
        if (path.startsWith("/v3/api-docs") || path.startsWith("/swagger-ui") || path.equals("/swagger-ui.html")) {
            return true;
        }
        return path.equals("/actuator/health") || path.equals("/actuator/info");
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain chain) throws IOException, ServletException {

        final String path = request.getRequestURI();
        final String method = request.getMethod();

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith("Bearer ")) {
            log.debug("JwtAuthFilter: No bearer token for {} {}", method, path);
            // Spring Security's entry point answers 401
            chain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(7).trim();
        Optional<UUID> userId = jwt.getUserId(token);
        if (userId.isEmpty()) {
            log.warn("JwtAuthFilter: Invalid or expired token for {} {}", method, path);
            chain.doFilter(request, response);
            return;
        }

        Optional<UserAccount> account = users.findById(userId.get());
        if (account.isEmpty()) {
            log.warn("JwtAuthFilter: Token refers to unknown user {} for {} {}", userId.get(), method, path);
            chain.doFilter(request, response);
            return;
        }

        UserAccount user = account.get();
        CallerIdentity caller = new CallerIdentity(user.getId(), user.getName(), user.getEmail(),
                user.getRole(), user.getCompanyId());
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                caller, null, List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name())));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("JwtAuthFilter: Authenticated {} ({}) for {} {}", user.getEmail(), user.getRole(), method, path);

        chain.doFilter(request, response);
    }
}
