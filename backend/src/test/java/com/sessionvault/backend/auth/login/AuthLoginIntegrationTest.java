package com.sessionvault.backend.auth.login;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.ResultActions;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sessionvault.backend.auth.AbstractAuthIntegrationTest;
import com.sessionvault.backend.auth.domain.User;
import com.sessionvault.backend.auth.domain.UserStatus;
import com.sessionvault.backend.auth.support.AuthFlowSupport;
import com.sessionvault.backend.auth.support.AuthHttpSupport;
import com.sessionvault.backend.auth.support.AuthHttpSupport.SessionCookies;
import com.sessionvault.backend.auth.token.domain.RefreshToken;
import com.sessionvault.backend.global.ErrorCode;
import com.sessionvault.backend.infra.TestClockConfig;


/**
 * POST /auth/login 통합 테스트
 *
 * 1) 입력 검증(@Valid → 400)
 * 2) 유저 조회 / 비밀번호 검증 (둘 다 INVALID_CREDENTIALS)
 * 3) 계정 상태(ACTIVE)
 * 4) 성공: 신원 바디 + access/refresh 쿠키 + 새 계보의 루트 row
 */
@DisplayName("[Auth][Login] 로그인 통합 테스트")
class AuthLoginIntegrationTest extends AbstractAuthIntegrationTest {

    private User user;

    @BeforeEach
    void seedUser() {
        user = createDefaultUser();
    }

    @Test
    @DisplayName("email blank → 400 VALIDATION_ERROR + Set-Cookie 없음")
    void blank_email_is_400_and_no_cookie() throws Exception {
        ResultActions actions = AuthHttpSupport.performLogin(mvc, "   ", PASSWORD);

        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.VALIDATION_ERROR);
        actions.andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE)); 
    }

    @Test
    @DisplayName("password blank → 400 + Set-Cookie 없음")
    void blank_password_is_400_and_no_cookie() throws Exception {
        ResultActions actions = AuthHttpSupport.performLogin(mvc, EMAIL, "   ");

        actions.andExpect(status().isBadRequest());
        actions.andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
    }

    @Test
    @DisplayName("존재하지 않는 이메일 → 401 INVALID_CREDENTIALS + Set-Cookie 없음 + refresh row 없음")
    void unknown_email_is_invalid_credentials() throws Exception {
        ResultActions actions = AuthHttpSupport.performLogin(mvc, "noone@example.com", "whatever123!");

        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.INVALID_CREDENTIALS);
        actions.andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
        assertThat(refreshTokenRepository.count()).isZero();
    }

    @Test
    @DisplayName("비밀번호 틀림 → 401 INVALID_CREDENTIALS (이메일 없음과 같은 응답)")
    void wrong_password_is_invalid_credentials() throws Exception {
        ResultActions actions = AuthHttpSupport.performLogin(mvc, EMAIL, "wrong-password");

        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.INVALID_CREDENTIALS);
        actions.andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
        assertThat(refreshTokenRepository.count()).isZero();
    }

    @Test
    @DisplayName("비활성 계정 → 403 ACCOUNT_DISABLED + Set-Cookie 없음")
    void non_active_is_account_disabled() throws Exception {
        updateUserStatus(user.getId(), UserStatus.SUSPENDED.name());

        ResultActions actions = AuthHttpSupport.performLogin(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.ACCOUNT_DISABLED);
        actions.andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
        assertThat(refreshTokenRepository.count()).isZero();
    }

    @Test
    @DisplayName("login 성공: 바디는 신원 정보만, 토큰은 쿠키로만 내려간다")
    void success_body_has_identity_only() throws Exception {
        SessionCookies session = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        assertThat(session.body().path("userId").asLong()).isEqualTo(user.getId());
        assertThat(session.body().path("email").asText()).isEqualTo(EMAIL);
        assertThat(session.body().path("nickname").asText()).isEqualTo(NICKNAME);
        assertThat(session.body().path("role").asText()).isEqualTo("USER");
        assertThat(session.body().has("accessToken")).isFalse();
        assertThat(session.body().has("refreshToken")).isFalse();
    }

    @Test
    @DisplayName("login 성공: 쿠키 정책 (HttpOnly, SameSite, Path, Max-Age = 토큰 수명)")
    void success_cookie_policy() throws Exception {
        SessionCookies session = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        String accessLine = AuthHttpSupport.findSetCookieLine(session.setCookieHeaders(), AuthHttpSupport.ACCESS_COOKIE);
        String refreshLine = AuthHttpSupport.findSetCookieLine(session.setCookieHeaders(), AuthHttpSupport.REFRESH_COOKIE);

        // application-test.yml: access 900s, refresh 86400s
        AuthHttpSupport.assertSessionCookiePolicy(accessLine, "/", 900);
        AuthHttpSupport.assertSessionCookiePolicy(refreshLine, "/auth", 86400);
    }

    @Test
    @DisplayName("login 성공: DB에는 raw가 아닌 해시만 저장 + 루트 row(revoked_at=null, replaced_by=null)")
    void success_creates_root_record() throws Exception {
        SessionCookies session = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        RefreshToken row = findByRaw(session.refreshRaw());
        LocalDateTime now = LocalDateTime.now(TestClockConfig.TEST_CLOCK);

        assertThat(row.getUserId()).isEqualTo(user.getId());
        assertThat(row.getTokenHash()).hasSize(64).isNotEqualTo(session.refreshRaw());
        assertThat(row.getRevokedAt()).isNull();
        assertThat(row.getReplacedById()).isNull();
        assertThat(row.getIssuedAt()).isEqualTo(now);
        assertThat(row.getExpiresAt()).isEqualTo(now.plusSeconds(86400));
        assertThat(row.getUserAgent()).isEqualTo("JUnit/5");
    }

    @Test
    @DisplayName("login 성공: 이메일 normalize(공백/대소문자) 되어도 성공 + last_login_at 기록")
    void success_email_normalized() throws Exception {
        String weirdEmail = "   " + EMAIL.toUpperCase() + "   ";

        SessionCookies session = AuthFlowSupport.loginOk(mvc, weirdEmail, PASSWORD);

        assertThat(session.accessToken()).isNotBlank();
        assertThat(userRepository.findById(user.getId()).orElseThrow().getLastLoginAt())
                .isEqualTo(LocalDateTime.now(TestClockConfig.TEST_CLOCK));
    }

    @Test
    @DisplayName("login 2번: 서로 다른 두 계보(루트 row 2개, 둘 다 활성)")
    void each_login_starts_new_lineage() throws Exception {
        SessionCookies first = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        SessionCookies second = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        assertThat(first.refreshRaw()).isNotEqualTo(second.refreshRaw());
        assertThat(activeCountOf(user.getId())).isEqualTo(2);
    }
}
