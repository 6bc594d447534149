package com.NutriCare.diet_backend.config;

import com.NutriCare.diet_backend.enums.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Verifies bearer tokens issued by the hospital identity service. Tokens are never issued here.
 */
@Component
public class JwtTokenValidator {

    private final SecretKey signingKey;

    public JwtTokenValidator(@Value("${app.security.jwt.secret}") String secret) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws io.jsonwebtoken.JwtException when the token is expired, malformed or wrongly signed
     */
    public Claims validate(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    // Accepts "roles": ["ADMIN", ...] or a single "role": "dietitian"; unknown names are dropped.
    public List<Role> extractRoles(Claims claims) {
        List<Role> roles = new ArrayList<>();
        Object claim = claims.get("roles");
        if (claim == null) {
            claim = claims.get("role");
        }
        if (claim instanceof Collection) {
            for (Object value : (Collection<?>) claim) {
                addRole(roles, value);
            }
        } else {
            addRole(roles, claim);
        }
        return roles;
    }

    private void addRole(List<Role> roles, Object value) {
        Role role = value == null ? null : Role.fromClaim(value.toString());
        if (role != null && !roles.contains(role)) {
            roles.add(role);
        }
    }
}
