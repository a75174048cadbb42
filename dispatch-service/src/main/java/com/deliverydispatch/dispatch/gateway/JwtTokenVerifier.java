package com.deliverydispatch.dispatch.gateway;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.exception.AuthenticationException;
import com.deliverydispatch.shared.enums.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HMAC-signed JWTs: {@code sub} carries the user id, {@code role} the user's role.
 */
@Component
public class JwtTokenVerifier implements TokenVerifier {

    public static final String ROLE_CLAIM = "role";

    private final SecretKey key;

    public JwtTokenVerifier(DispatchProperties properties) {
        String secret = properties.getAuth().getJwtSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("dispatch.auth.jwt-secret must be configured");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public AuthenticatedUser verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Token is missing");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthenticationException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new AuthenticationException("Invalid token", e);
        }

        long userId;
        try {
            userId = Long.parseLong(claims.getSubject());
        } catch (NumberFormatException e) {
            throw new AuthenticationException("Token subject is not a user id", false);
        }

        UserRole role;
        try {
            role = UserRole.fromClaim(claims.get(ROLE_CLAIM, String.class));
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Token carries no valid role", false);
        }
        return new AuthenticatedUser(userId, role);
    }
}
