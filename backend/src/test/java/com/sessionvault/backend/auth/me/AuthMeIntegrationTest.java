package com.sessionvault.backend.auth.me;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sessionvault.backend.auth.AbstractAuthIntegrationTest;
import com.sessionvault.backend.auth.domain.User;
import com.sessionvault.backend.auth.domain.UserRole;
import com.sessionvault.backend.auth.domain.UserStatus;
import com.sessionvault.backend.auth.support.AuthFlowSupport;
import com.sessionvault.backend.auth.support.AuthHttpSupport;
import com.sessionvault.backend.auth.support.AuthHttpSupport.SessionCookies;
import com.sessionvault.backend.global.ErrorCode;
import com.sessionvault.backend.infra.TestClockConfig;

/**
 * /auth/me 통합 테스트 (SecurityFilterChain + Controller + Service까지 포함)
 *
 * [JwtAuthenticationFilter]
 * - 토큰 없음 → 통과 → anyRequest().authenticated()에 걸려 EntryPoint가 401(AUTH_REQUIRED)
 * - 토큰 있음 + 검증 실패 → Filter에서 즉시 401(ACCESS_INVALID)
 *
 * [AuthMeController] -> [MeService]
 * - DB에서 user 없으면 USER_NOT_FOUND, ACTIVE가 아니면 ACCOUNT_DISABLED
 */
@DisplayName("[Auth][Me] 내 정보 조회(/auth/me) 통합 테스트")
class AuthMeIntegrationTest extends AbstractAuthIntegrationTest {

    private User user;

    @BeforeEach
    void seedUser() {
        user = createDefaultUser();
    }

    // =============================================================
    // 1) 인증 자체가 성립하지 않는 케이스 (EntryPoint -> AUTH_REQUIRED)
    // =============================================================

    @Test
    @DisplayName("me: 토큰 없음 → 401 AUTH_REQUIRED")
    void me_requires_auth_without_token() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, null), ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("me: Bearer가 아닌 Authorization → 401 AUTH_REQUIRED")
    void me_requires_auth_when_non_bearer_header() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "Basic abcdefg"), ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("me: Authorization='Bearer ' (토큰 공백) → 401 AUTH_REQUIRED")
    void me_requires_auth_when_bearer_token_blank() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "Bearer "), ErrorCode.AUTH_REQUIRED);
    }

    // ============================================================
    // 2) 토큰은 있는데 invalid인 케이스 (Filter -> ACCESS_INVALID)
    // ============================================================

    @Test
    @DisplayName("me: JWT 형식 아님 → 401 ACCESS_INVALID")
    void me_rejects_malformed_jwt() throws Exception {
        AuthHttpSupport.expectErrorWithCode(AuthHttpSupport.performMe(mvc, "Bearer not-a-jwt"), ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("me: refresh 토큰 문자열을 access처럼 사용 → 401 ACCESS_INVALID")
    void me_rejects_refresh_token_used_as_access() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.refreshRaw())),
                ErrorCode.ACCESS_INVALID
        );
    }

    @Test
    @DisplayName("me: 만료된 access 쿠키 → 401 ACCESS_INVALID")
    void me_rejects_expired_access_cookie() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        TestClockConfig.TEST_CLOCK.advance(Duration.ofSeconds(901));

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMeWithCookie(mvc, login.accessToken()),
                ErrorCode.ACCESS_INVALID
        );
    }

    // ============================================================
    // 3) 인증은 성공했지만 DB 상태에서 막히는 케이스 (MeService)
    // ============================================================

    @Test
    @DisplayName("me: 토큰은 유효하지만 DB에 유저 없음 → USER_NOT_FOUND")
    void me_returns_user_not_found_when_user_deleted() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        // refresh_tokens는 FK CASCADE로 같이 지워진다
        jdbcTemplate.update("delete from users where id = ?", user.getId());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.USER_NOT_FOUND
        );
    }

    @Test
    @DisplayName("me: 토큰은 유효하지만 정지 계정 → 403 ACCOUNT_DISABLED")
    void me_blocks_suspended_user() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        updateUserStatus(user.getId(), UserStatus.SUSPENDED.name());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.ACCOUNT_DISABLED
        );
    }

    // ==========================================================
    // 4) 성공 케이스
    // ==========================================================

    @Test
    @DisplayName("me: Bearer 헤더 → 200 + 사용자 정보")
    void me_returns_user_info_with_bearer() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.userId").value(user.getId()))
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.nickname").value(NICKNAME))
                .andExpect(jsonPath("$.role").value(UserRole.USER.name()))
                .andExpect(jsonPath("$.status").value(UserStatus.ACTIVE.name()))
                .andExpect(jsonPath("$.lastLoginAt").isNotEmpty());
    }

    @Test
    @DisplayName("me: access 쿠키만으로도 인증된다")
    void me_returns_user_info_with_cookie() throws Exception {
        SessionCookies login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.performMeWithCookie(mvc, login.accessToken())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value(EMAIL));
    }

    @Test
    @DisplayName("me: activeSessions = 폐기/만료되지 않은 refresh 수")
    void me_counts_active_sessions() throws Exception {
        SessionCookies a = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        SessionCookies b = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        SessionCookies rotated = AuthFlowSupport.refreshOk(mvc, a.refreshRaw());

        meBy(rotated.accessToken()).andExpect(jsonPath("$.activeSessions").value(2));

        AuthHttpSupport.performLogout(mvc, b.refreshRaw()).andExpect(status().isNoContent());
        meBy(rotated.accessToken()).andExpect(jsonPath("$.activeSessions").value(1));

        // 로그아웃 이후에도 access token은 만료 전까지 유효하다
        meBy(b.accessToken()).andExpect(status().isOk());
    }

    private ResultActions meBy(String accessToken) throws Exception {
        return AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(accessToken))
                .andExpect(status().isOk());
    }
}
