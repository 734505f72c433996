package com.has.global.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

public class JwtProviderTest {

    private static final String SECRET = "test-secret-key-for-has-backend-must-be-32-bytes-long";

    private JwtProvider jwtProvider;

    @BeforeEach
    void setUp() {
        jwtProvider = new JwtProvider();
        ReflectionTestUtils.setField(jwtProvider, "secret", SECRET);
        ReflectionTestUtils.setField(jwtProvider, "expirationMs", 60_000L);
        jwtProvider.init();
    }

    @Test
    void createToken_RoundTripsUserIdAndRole() {
        String token = jwtProvider.createToken(42L, "PROVIDER");

        assertTrue(jwtProvider.validateToken(token));
        assertEquals(42L, jwtProvider.getUserId(token));
        assertEquals("PROVIDER", jwtProvider.getRole(token));
    }

    @Test
    void validateToken_Garbage_ReturnsFalse() {
        assertFalse(jwtProvider.validateToken("not.a.token"));
        assertFalse(jwtProvider.validateToken(""));
    }

    @Test
    void validateToken_Expired_ReturnsFalse() {
        String expired = Jwts.builder()
                .subject("42")
                .claim("role", "SEEKER")
                .issuedAt(new Date(System.currentTimeMillis() - 120_000))
                .expiration(new Date(System.currentTimeMillis() - 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertFalse(jwtProvider.validateToken(expired));
    }

    @Test
    void validateToken_SignedWithOtherKey_ReturnsFalse() {
        String forged = Jwts.builder()
                .subject("1")
                .claim("role", "ADMIN")
                .signWith(Keys.hmacShaKeyFor("another-secret-key-that-is-long-enough-32b".getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertFalse(jwtProvider.validateToken(forged));
    }
}
