package ai.agentmarket.backend.security;

import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallerResolverTest {

    private final CallerResolver resolver = new CallerResolver("DISPUTE_ADMIN", new String[] {"ops-bot", " "});

    @Test
    void subjectBecomesCallerId() {
        CallerIdentity caller = resolver.resolve(new JwtAuthenticationToken(jwt("client-1"), List.of()));

        assertThat(caller.getId()).isEqualTo("client-1");
        assertThat(caller.isAdmin()).isFalse();
    }

    @Test
    void jwtSubjectWinsOverAuthenticationName() {
        CallerIdentity caller = resolver.resolve(new JwtAuthenticationToken(jwt("agent-7"), List.of(), "display-name"));

        assertThat(caller.getId()).isEqualTo("agent-7");
    }

    @Test
    void nonJwtPrincipalFallsBackToAuthenticationName() {
        CallerIdentity caller = resolver.resolve(new UsernamePasswordAuthenticationToken("client-2", "n/a", List.of()));

        assertThat(caller.getId()).isEqualTo("client-2");
        assertThat(caller.isAdmin()).isFalse();
    }

    @Test
    void adminByRoleOrConfiguredSubject() {
        CallerIdentity byRole = resolver.resolve(new JwtAuthenticationToken(jwt("moderator"),
                List.of(new SimpleGrantedAuthority("ROLE_DISPUTE_ADMIN"))));
        CallerIdentity bySubject = resolver.resolve(new JwtAuthenticationToken(jwt("ops-bot"), List.of()));

        assertThat(byRole.isAdmin()).isTrue();
        assertThat(bySubject.isAdmin()).isTrue();
    }

    @Test
    void unauthenticatedTokenIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(new JwtAuthenticationToken(jwt("client-1"))))
                .isInstanceOf(MarketplaceException.class);
    }

    @Test
    void missingAuthenticationIsUnauthorized() {
        assertThatThrownBy(() -> resolver.resolve(null))
                .isInstanceOf(MarketplaceException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.UNAUTHORIZED);
    }

    private static Jwt jwt(String subject) {
        return Jwt.withTokenValue("token")
                .header("alg", "HS256")
                .subject(subject)
                .issuedAt(Instant.EPOCH)
                .expiresAt(Instant.EPOCH.plusSeconds(3600))
                .build();
    }
}
