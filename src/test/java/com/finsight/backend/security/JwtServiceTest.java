package com.finsight.backend.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Date;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import com.finsight.backend.entities.User;
import com.finsight.backend.enums.Role;

import io.jsonwebtoken.ExpiredJwtException;

class JwtServiceTest {

    // HS256 requires a sufficiently long key; use 32+ bytes.
    private static final String SECRET = "01234567890123456789012345678901";

    @Test
    void generateToken_usesConfiguredExpiration() {
        JwtService jwtService = new JwtService(SECRET, 3_600_000L);

        String token = jwtService.generateToken(user("user@example.com"));
        assertNotNull(token);

        Date issuedAt = jwtService.extractClaim(token, c -> c.getIssuedAt());
        Date expiration = jwtService.extractClaim(token, c -> c.getExpiration());

        long deltaMs = expiration.getTime() - issuedAt.getTime();
        assertTrue(Math.abs(deltaMs - 3_600_000L) < 2_000L, "token expiration should be ~1h");
    }

    @Test
    void generateToken_carriesEmailAndRole() {
        JwtService jwtService = new JwtService(SECRET, 3_600_000L);
        User user = user("asha@example.com");

        String token = jwtService.generateToken(user);

        assertEquals("asha@example.com", jwtService.extractUsername(token));
        assertEquals("USER", jwtService.extractClaim(token, c -> c.get("role", String.class)));
        assertEquals(user.getId().toString(), jwtService.extractClaim(token, c -> c.get("id", String.class)));
    }

    @Test
    void isTokenValid_checksSubject() {
        JwtService jwtService = new JwtService(SECRET, 3_600_000L);
        String token = jwtService.generateToken(user("asha@example.com"));

        assertTrue(jwtService.isTokenValid(token, details("asha@example.com")));
        assertFalse(jwtService.isTokenValid(token, details("other@example.com")));
    }

    @Test
    void extractUsername_expiredToken_throws() {
        JwtService jwtService = new JwtService(SECRET, -1_000L);
        String token = jwtService.generateToken(user("asha@example.com"));

        assertThrows(ExpiredJwtException.class, () -> jwtService.extractUsername(token));
    }

    private static User user(String email) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setEmail(email);
        user.setRole(Role.USER);
        return user;
    }

    private static UserDetails details(String email) {
        return org.springframework.security.core.userdetails.User.withUsername(email)
                .password("x")
                .authorities(List.of(new SimpleGrantedAuthority("ROLE_USER")))
                .build();
    }
}
