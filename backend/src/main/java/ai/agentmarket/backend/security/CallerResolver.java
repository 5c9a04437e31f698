package ai.agentmarket.backend.security;

import ai.agentmarket.backend.service.exception.MarketplaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns the Spring Security authentication into a {@link CallerIdentity}.
 * The identity is the token subject; request bodies never name the caller.
 */
@Slf4j
@Component
public class CallerResolver {

    private final String adminAuthority;
    private final Set<String> adminSubjects;

    public CallerResolver(
            @Value("${marketplace.security.admin-role:DISPUTE_ADMIN}") String adminRole,
            @Value("${marketplace.security.admin-subjects:}") String[] adminSubjects) {
        this.adminAuthority = "ROLE_" + adminRole;
        this.adminSubjects = Arrays.stream(adminSubjects)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public CallerIdentity resolve(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw MarketplaceException.unauthorized("Authentication required");
        }

        String subject;
        if (authentication.getPrincipal() instanceof Jwt) {
            Jwt jwt = (Jwt) authentication.getPrincipal();
            subject = jwt.getSubject();
        } else {
            subject = authentication.getName();
        }
        if (subject == null || subject.isBlank()) {
            throw MarketplaceException.unauthorized("Token has no subject");
        }

        boolean admin = adminSubjects.contains(subject) || authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(adminAuthority::equals);
        log.debug("Resolved caller {} (admin: {})", subject, admin);
        return new CallerIdentity(subject, admin);
    }
}
