package com.sessionvault.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;


/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml (+ application-test.yml) 의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.
  규칙 위반(시크릿 누락, TTL 역전 등)은 부팅 실패로 이어진다.

  app:
    auth:
      jwt:
        issuer: sessionvault
        access-ttl-seconds: 900
        secret: ${APP_AUTH_JWT_SECRET}

      refresh:
        ttl-seconds: 1209600
        cleanup:
          cron: "0 0 4 * * *"
          retention-seconds: 86400

      cookie:
        access-name: access_token
        access-path: /
        refresh-name: refresh_token
        refresh-path: /auth
        same-site: Lax
        secure: true
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt,
                             @Valid @NotNull Refresh refresh,
                             @Valid @NotNull Cookie cookie) {

    /**
     * Access Token(JWT) 관련 설정
     * - issuer: 토큰 발급자 식별자
     * - accessTtlSeconds: Access Token 수명 (= access 쿠키 Max-Age)
     * - secret: HS256 서명을 위한 비밀키 문자열
     */
    public record Jwt(
        @NotBlank String issuer,
        @Min(1) long accessTtlSeconds,
        @NotBlank @Size(min = 32) String secret
    ) {}


    /**
     * Refresh Token 관련 설정
     * - ttlSeconds: refresh 세션 수명 (= refresh 쿠키 Max-Age)
     * - cleanup: 만료 row 정리 배치 설정
     */
    public record Refresh(
            @Min(1) long ttlSeconds,
            @Valid @NotNull Cleanup cleanup
    ) {}

    /**
     * - cron: 스프링 cron 표현식 ("-" 이면 스케줄 비활성)
     * - retentionSeconds: 만료 후에도 이 시간만큼은 row를 남겨둔다 (만료 직후 재사용 탐지용)
     */
    public record Cleanup(
            @NotBlank String cron,
            @Min(0) long retentionSeconds
    ) {}

    /**
     * 세션 쿠키 설정 (access/refresh 둘 다 HttpOnly)
     * - accessPath: access 쿠키는 모든 API 요청에 실려야 하므로 보통 "/"
     * - refreshPath: refresh 쿠키는 /auth 범위에만 전송
     * - sameSite / secure: 두 쿠키 공통
     */
    public record Cookie(
            @NotBlank String accessName,

            @NotBlank @Pattern(regexp = "^/.*", message = "accessPath must start with '/'")
            String accessPath,

            @NotBlank String refreshName,

            // 최소 형식만 강제: "/"로 시작 (오타로 "auth" 같은 값 들어오는 것 방지)
            @NotBlank @Pattern(regexp = "^/.*", message = "refreshPath must start with '/'")
            String refreshPath,

            @NotNull SameSite sameSite,

            boolean secure
    ) {}

    // refresh가 access보다 짧으면 로테이션 의미가 없다
    @AssertTrue(message = "refresh.ttlSeconds must be greater than jwt.accessTtlSeconds")
    public boolean isRefreshOutlivesAccess() {
        if (jwt == null || refresh == null) return true; // @NotNull이 따로 잡는다
        return refresh.ttlSeconds() > jwt.accessTtlSeconds();
    }

    // SameSite는 오타가 치명적이라 enum으로 고정
    public enum SameSite {
        Lax, Strict, None
    }
}
