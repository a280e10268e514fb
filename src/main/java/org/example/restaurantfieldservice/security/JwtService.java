package org.example.restaurantfieldservice.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.example.restaurantfieldservice.entity.AppUser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and parses the HMAC-signed bearer tokens. A token carries everything
 * a request needs to build its session, so resolving it does not touch the database.
 */
@Component
public class JwtService {

    static final String CLAIM_USER_ID = "userId";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_ROLE = "role";

    @Value("${app.security.jwt.secret}")
    private String jwtSecret;

    @Value("${app.security.jwt.expiration-hours:12}")
    private int expirationHours = 12;

    public JwtService() {
    }

    JwtService(String jwtSecret, int expirationHours) {
        this.jwtSecret = jwtSecret;
        this.expirationHours = expirationHours;
    }

    private SecretKey getSigningKey() {
        return Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    public IssuedToken issue(AppUser user) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + expirationHours * 3600 * 1000L);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .id(tokenId)
                .subject(user.getEmail())
                .claim(CLAIM_USER_ID, user.getId())
                .claim(CLAIM_NAME, user.getName())
                .claim(CLAIM_ROLE, user.getRole().name())
                .issuedAt(now)
                .expiration(expiry)
                .signWith(getSigningKey())
                .compact();
        return new IssuedToken(token, tokenId, expiry.toInstant());
    }

    /**
     * @throws io.jsonwebtoken.JwtException if the token is malformed, tampered with or expired
     */
    public Claims parse(String token) {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    @Getter
    @AllArgsConstructor
    public static class IssuedToken {
        private final String token;
        private final String tokenId;
        private final Instant expiresAt;
    }
}
