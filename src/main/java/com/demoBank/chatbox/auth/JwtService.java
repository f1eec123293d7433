package com.demoBank.chatbox.auth;

import com.demoBank.chatbox.common.exception.ErrorCode;
import com.demoBank.chatbox.config.ChatboxProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validates HS256 bearer tokens and extracts {@link AuthClaims}.
 * 
 * The signing secret is checked when the bean is created; a missing, short or guessable
 * secret stops the application from starting.
 */
@Slf4j
@Service
public class JwtService {
    
    static final int MIN_SECRET_LENGTH = 32;
    static final List<String> WEAK_SECRET_PATTERNS = List.of(
            "secret", "test", "test123", "password", "admin", "changeme",
            "default", "example", "demo", "12345", "placeholder");
    
    private final SecretKey signingKey;
    
    @Autowired
    public JwtService(ChatboxProperties properties) {
        this(properties.getJwt().getSecret());
    }
    
    public JwtService(String secret) {
        validateSecret(secret);
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
    
    /**
     * Parses and validates a token.
     * 
     * @param token Compact JWS string
     * @return Claims of the authenticated user
     * @throws UnauthorizedException if the token is invalid, expired or lacks required claims
     */
    public AuthClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, ErrorCode.INVALID_TOKEN.getDefaultMessage());
        }
        
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new UnauthorizedException(ErrorCode.EXPIRED_TOKEN, ErrorCode.EXPIRED_TOKEN.getDefaultMessage(), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, ErrorCode.INVALID_TOKEN.getDefaultMessage(), e);
        }
        
        Object userId = claims.get("user_id");
        if (!(userId instanceof String userIdValue) || userIdValue.isBlank()) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, "user_id claim missing or invalid");
        }
        
        Object name = claims.get("name");
        String displayName = name instanceof String nameValue && !nameValue.isBlank() ? nameValue : userIdValue;
        
        return AuthClaims.builder()
                .userId(userIdValue)
                .name(displayName)
                .roles(extractRoles(claims.get("roles")))
                .build();
    }
    
    private List<String> extractRoles(Object rolesClaim) {
        if (!(rolesClaim instanceof List<?> rawRoles)) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, "roles claim must be an array of strings");
        }
        List<String> roles = new ArrayList<>(rawRoles.size());
        for (Object role : rawRoles) {
            if (!(role instanceof String roleValue)) {
                throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, "roles claim must be an array of strings");
            }
            roles.add(roleValue);
        }
        return List.copyOf(roles);
    }
    
    static void validateSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret is required. Set chatbox.jwt.secret (CHATBOX_JWT_SECRET)");
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(String.format(
                    "JWT secret must be at least %d characters (got %d). Generate one with: openssl rand -base64 32",
                    MIN_SECRET_LENGTH, secret.length()));
        }
        String lower = secret.toLowerCase(Locale.ROOT);
        for (String weak : WEAK_SECRET_PATTERNS) {
            if (lower.contains(weak)) {
                throw new IllegalStateException("JWT secret appears to be weak (contains '" + weak 
                        + "'). Use a cryptographically random secret");
            }
        }
    }
}
