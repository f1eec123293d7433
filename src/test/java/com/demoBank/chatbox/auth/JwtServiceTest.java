package com.demoBank.chatbox.auth;

import com.demoBank.chatbox.common.exception.ErrorCode;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    static final String SECRET = "k9Lq2Vx7Rp4Zm8Wn3Bt6Yc1Hd5Jf0Gs2Qa";

    private JwtService jwtService;
    private SecretKey key;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService(SECRET);
        key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Valid token yields user id, name and roles")
    void parse_validToken() {
        String token = Jwts.builder()
                .claim("user_id", "user-42")
                .claim("name", "Dana")
                .claim("roles", List.of("user", "chat_admin"))
                .expiration(Date.from(Instant.now().plusSeconds(300)))
                .signWith(key)
                .compact();

        AuthClaims claims = jwtService.parse(token);

        assertThat(claims.getUserId()).isEqualTo("user-42");
        assertThat(claims.getName()).isEqualTo("Dana");
        assertThat(claims.getRoles()).containsExactly("user", "chat_admin");
        assertThat(claims.isAdmin()).isTrue();
    }

    @Test
    @DisplayName("Name defaults to the user id")
    void parse_missingName_defaultsToUserId() {
        String token = Jwts.builder()
                .claim("user_id", "user-42")
                .claim("roles", List.of("user"))
                .signWith(key)
                .compact();

        AuthClaims claims = jwtService.parse(token);

        assertThat(claims.getName()).isEqualTo("user-42");
        assertThat(claims.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("Expired token is rejected as expired")
    void parse_expired() {
        String token = Jwts.builder()
                .claim("user_id", "user-42")
                .claim("roles", List.of("user"))
                .expiration(Date.from(Instant.now().minusSeconds(60)))
                .signWith(key)
                .compact();

        assertThatThrownBy(() -> jwtService.parse(token))
                .isInstanceOf(UnauthorizedException.class)
                .extracting(e -> ((UnauthorizedException) e).getCode())
                .isEqualTo(ErrorCode.EXPIRED_TOKEN);
    }

    @Test
    @DisplayName("Token signed with another key is rejected")
    void parse_wrongSignature() {
        SecretKey otherKey = Keys.hmacShaKeyFor("Zq8Wm3Nv6Tb1Xc4Lp7Rk2Hj5Fg9Ds0Ay3Ue".getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .claim("user_id", "user-42")
                .claim("roles", List.of("admin"))
                .signWith(otherKey)
                .compact();

        assertThatThrownBy(() -> jwtService.parse(token))
                .isInstanceOf(UnauthorizedException.class)
                .extracting(e -> ((UnauthorizedException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_TOKEN);
    }

    @Test
    @DisplayName("Missing user_id or roles claims are rejected")
    void parse_missingClaims() {
        String noUser = Jwts.builder().claim("roles", List.of("user")).signWith(key).compact();
        String noRoles = Jwts.builder().claim("user_id", "user-42").signWith(key).compact();
        String badRoles = Jwts.builder().claim("user_id", "user-42").claim("roles", "admin").signWith(key).compact();

        assertThatThrownBy(() -> jwtService.parse(noUser)).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> jwtService.parse(noRoles)).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> jwtService.parse(badRoles)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("Garbage and blank tokens are rejected")
    void parse_garbage() {
        assertThatThrownBy(() -> jwtService.parse("not-a-jwt")).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> jwtService.parse(" ")).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("Missing, short or guessable secrets stop startup")
    void constructor_rejectsWeakSecrets() {
        assertThatThrownBy(() -> new JwtService((String) null)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new JwtService("tooShort1")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new JwtService("my-super-long-secret-value-for-prod-use"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("weak");
    }
}
