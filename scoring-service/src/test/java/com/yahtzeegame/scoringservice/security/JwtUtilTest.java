package com.yahtzeegame.scoringservice.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JwtUtilTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hs256";

    private final JwtUtil jwtUtil = new JwtUtil(SECRET);

    private static String token(String secret, Long playerId) {
        return Jwts.builder()
                .claim("user_id", playerId)
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    @Test
    void testRoundTrip() {
        String token = token(SECRET, 42L);
        assertEquals(42L, jwtUtil.extractPlayerId("Bearer " + token));
    }

    @Test
    void testStringClaim() {
        String token = Jwts.builder()
                .claim("user_id", "17")
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
        assertEquals(17L, jwtUtil.extractPlayerId("Bearer " + token));
    }

    @Test
    void testMissingHeader() {
        assertThrows(UnauthorizedException.class, () -> jwtUtil.extractPlayerId(null));
        assertThrows(UnauthorizedException.class, () -> jwtUtil.extractPlayerId("Basic abc"));
    }

    @Test
    void testWrongSignature() {
        String token = token("another-secret-key-that-is-long-enough-too", 42L);
        assertThrows(UnauthorizedException.class, () -> jwtUtil.extractPlayerId("Bearer " + token));
    }

    @Test
    void testGarbageToken() {
        assertThrows(UnauthorizedException.class, () -> jwtUtil.extractPlayerId("Bearer not-a-token"));
    }

    @Test
    void testMissingClaim() {
        String token = Jwts.builder()
                .subject("someone")
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
        UnauthorizedException ex = assertThrows(UnauthorizedException.class,
                () -> jwtUtil.extractPlayerId("Bearer " + token));
        assertTrue(ex.getMessage().contains("user_id"));
    }
}
