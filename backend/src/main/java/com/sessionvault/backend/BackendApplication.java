package com.sessionvault.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.sessionvault.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[로컬 수동 확인] (MySQL 기동 + APP_AUTH_JWT_SECRET 설정 후)
================================================================================
# 로그인 (access/refresh 쿠키를 파일에 저장)
curl -i -X POST "http://localhost:8080/auth/login" \
  -H "Content-Type: application/json" \
  -d '{"email":"user@example.com","password":"password1!"}' \
  -c /tmp/sv_cookie.txt

# 내 정보 (access 쿠키로 인증)
curl -i "http://localhost:8080/auth/me" -b /tmp/sv_cookie.txt

# refresh 로테이션 (old refresh 쿠키 → new 쿠키 쌍)
curl -i -X POST "http://localhost:8080/auth/refresh" \
  -b /tmp/sv_cookie.txt -c /tmp/sv_cookie_new.txt

# old 쿠키로 다시 refresh → 401 REFRESH_REUSED + 해당 유저 세션 전부 폐기
curl -i -X POST "http://localhost:8080/auth/refresh" -b /tmp/sv_cookie.txt

# 로그아웃 (항상 204 + 쿠키 삭제)
curl -i -X POST "http://localhost:8080/auth/logout" -b /tmp/sv_cookie_new.txt

# DB 확인
mysql -usessionvault -p sessionvault -e "select id, user_id, issued_at, expires_at, revoked_at, revoke_reason, replaced_by_id from refresh_tokens;"
*/

/**
 * Spring Boot 부팅 시작점
 * - com.sessionvault.backend.* (auth, security, global) 전부 컴포넌트 스캔 대상.
 *
 * 설정 값 주입 흐름:
 *    (OS 환경변수) -> application.yml -> @ConfigurationProperties(AuthProperties)
 * - ${ENV:default}: 환경변수 우선, 없으면 default
 * - APP_AUTH_JWT_SECRET는 default가 없다. 없으면 바인딩/검증 단계에서 부팅 실패.
 *
 * UserDetailsServiceAutoConfiguration 제외:
 * - 인증은 JwtAuthenticationFilter + AuthSessionService가 담당하므로
 *   스프링 기본 인메모리 유저(+ generated password 로그)는 필요 없다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
