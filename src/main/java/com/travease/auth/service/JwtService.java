package com.travease.auth.service;

import com.travease.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;

/**
 * Issues and reads the signed session tokens handed out after a successful OTP verification.
 */
@Service
public class JwtService {

    private static final Logger logger = LoggerFactory.getLogger(JwtService.class);

    /**
     * Fallback for {@code jwt.secret}. Only accepted in development mode; deployed environments
     * must supply their own secret through the JWT_SECRET environment variable.
     */
    public static final String DEVELOPMENT_SECRET = "default_jwt_secret_for_development";

    static final String CLAIM_USER_ID = "id";
    static final String CLAIM_PHONE_NUMBER = "phoneNumber";

    private final SecretKey key;
    private final Duration sessionTokenTtl;

    @Autowired
    public JwtService(@Value("${jwt.secret:" + DEVELOPMENT_SECRET + "}") String secretKey,
                      AuthProperties authProperties) {
        this(secretKey, authProperties.getSessionTokenTtl(), authProperties.isDevelopmentMode());
    }

    public JwtService(String secretKey, Duration sessionTokenTtl, boolean developmentMode) {
        if (DEVELOPMENT_SECRET.equals(secretKey)) {
            if (!developmentMode) {
                throw new IllegalStateException("jwt.secret must be set when development mode is off");
            }
            logger.warn("Signing session tokens with the built-in development secret");
        }
        if (secretKey.length() < 32) {
            throw new IllegalArgumentException("JWT secret key must be at least 32 characters (was " + secretKey.length() + ")");
        }
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
        this.sessionTokenTtl = sessionTokenTtl;
    }

    public String generateSessionToken(String userId, String phoneNumber) {
        Date now = new Date();
        return Jwts.builder()
                .subject(userId)
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_PHONE_NUMBER, phoneNumber)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + sessionTokenTtl.toMillis()))
                .signWith(key)
                .compact();
    }

    public String extractUserId(String token) {
        return extractClaims(token).getSubject();
    }

    public String extractPhoneNumber(String token) {
        return extractClaims(token).get(CLAIM_PHONE_NUMBER, String.class);
    }

    public boolean isTokenValid(String token) {
        try {
            Claims claims = extractClaims(token);
            return !claims.getExpiration().before(new Date());
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims extractClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
