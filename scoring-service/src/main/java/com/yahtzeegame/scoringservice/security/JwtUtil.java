package com.yahtzeegame.scoringservice.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Resolves which player a request belongs to from a signed bearer token.
 */
@Component
public class JwtUtil {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String PLAYER_CLAIM = "user_id";

    private final SecretKey secretKey;

    public JwtUtil(@Value("${jwt.secret}") String secret) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Player id from an {@code Authorization} header value.
     *
     * @throws UnauthorizedException if the header is missing, malformed or not signed by us
     */
    public Long extractPlayerId(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Missing bearer token");
        }
        String token = authHeader.substring(BEARER_PREFIX.length());

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid token: " + e.getMessage(), e);
        }

        Object playerId = claims.get(PLAYER_CLAIM);
        if (playerId instanceof Number) {
            return ((Number) playerId).longValue();
        } else if (playerId instanceof String) {
            try {
                return Long.parseLong((String) playerId);
            } catch (NumberFormatException e) {
                throw new UnauthorizedException("Invalid " + PLAYER_CLAIM + " claim in token", e);
            }
        }
        throw new UnauthorizedException("Token has no " + PLAYER_CLAIM + " claim");
    }
}
