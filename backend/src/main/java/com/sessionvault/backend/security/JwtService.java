package com.sessionvault.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;
 
import com.sessionvault.backend.auth.config.AuthProperties;
import com.sessionvault.backend.auth.domain.UserRole; 

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access Token(JWT) 발급/검증 서비스
 * 
 * - HTTP(상태코드/응답)는 모른다. "유효/무효"만 판단한다.
 * - DB/네트워크 접근 없이 서명 검증만으로 판단하므로 매 요청 호출해도 된다.
 * - 검증 실패는 InvalidJwtException(런타임)으로 통일해서 던지고, 필터가 401 ACCESS_INVALID로 변환한다.
 * - secret이 없거나 짧으면 생성자에서 실패한다 (= 애플리케이션 기동 실패).
 * 
 * Access Token:
 * - 짧은 수명(분 단위), 서버에 저장하지 않고 폐기 경로도 없다.
 * - access 쿠키 또는 Authorization: Bearer 헤더로 전달된다.
 * 
 * JWT 구조: header.payload.signature
 * - payload 클레임: iss / sub(userId) / role / iat / exp
 * - signature: HMAC-SHA256
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String ROLE_CLAIM = "role";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;


    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;

        // secret length 검증 + 키 생성
        this.key = buildHmacKey(jwtProps.secret()); 

        // issuer(iss) 고정(requireIssuer)로 타 서비스 토큰을 차단한다.
        this.parser = buildParser(jwtProps.issuer(), this.key, this.clock);
    }


    /** userId/role 기반 Access JWT 발급 */
    public String issueAccessToken(Long userId, UserRole role) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());
        
        return Jwts.builder()
                .setIssuer(jwtProps.issuer())                // iss
                .setSubject(String.valueOf(userId))          // sub
                .claim(ROLE_CLAIM, role.name())              // role: "USER"
                .setIssuedAt(Date.from(now))                 // iat
                .setExpiration(Date.from(exp))               // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();               
    }
    
    /**
     * Access Token 검증 후 클레임 반환
     * 
     * 서명 불일치 / 형식 오류 / issuer 불일치 / 만료 → InvalidJwtException
     */
    public AccessClaims verifyAccessToken(String token) {
        try {
            if (token == null || token.isBlank()) {
                throw new JwtException("token is null or blank");
            }

            // 서명/만료/issuer/포맷 검증 (하나라도 실패하면 JwtException)
            Jws<Claims> jws = parser.parseClaimsJws(token);
            Claims claims = jws.getBody();

            // 클레임에서 userId, role 꺼내기
            Long userId = parseUserId(claims.getSubject());
            UserRole role = parseRole(claims.get(ROLE_CLAIM, String.class));

            return new AccessClaims(
                    userId,
                    role,
                    toInstant(claims.getIssuedAt()),
                    toInstant(claims.getExpiration())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e);
        }
    }


    private static SecretKey buildHmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(key)
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    private static Instant toInstant(Date date) {
        if (date == null) {
            throw new JwtException("iat/exp claim missing");
        }
        return date.toInstant();
    }

    // subject:userId -> Long userId 파싱
    private static Long parseUserId(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new JwtException("subject (userId) is missing");
        }
        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException e) {
            throw new JwtException("subject is not a valid Long: " + sub, e);
        }
    }

    /** role claim → enum ("USER" / "ADMIN") */
    private static UserRole parseRole(String roleRaw) {
        if (roleRaw == null || roleRaw.isBlank()) {
            throw new JwtException("role claim missing");
        }

        try {
            return UserRole.valueOf(roleRaw);
        } catch (IllegalArgumentException e) {
            throw new JwtException("role claim invalid: " + roleRaw, e);
        }
    }

    /** JWT 검증 실패 (Filter에서 잡아서 401 ACCESS_INVALID로 변환) */
    public static class InvalidJwtException extends RuntimeException {
        public InvalidJwtException(String message, Throwable cause) {
            super(message, cause);
        }
    }

}
