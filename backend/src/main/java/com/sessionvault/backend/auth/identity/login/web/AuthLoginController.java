package com.sessionvault.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionvault.backend.auth.identity.login.dto.LoginRequest;
import com.sessionvault.backend.auth.session.dto.SessionResponse;
import com.sessionvault.backend.auth.session.service.AuthSessionService;
import com.sessionvault.backend.auth.session.service.AuthSessionService.SessionResult;
import com.sessionvault.backend.auth.token.domain.ClientOrigin;
import com.sessionvault.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API
 *
 * - 요청(JSON) 검증: @Valid DTO
 * - 핵심 로직: AuthSessionService로 위임(인증/정책/토큰 발급)
 * - 응답 변환:
 *   - 신원 정보: 바디
 *   - access / refresh token: HttpOnly 쿠키
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final AuthSessionService authSessionService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/login")
    public SessionResponse login(
            @Valid @RequestBody LoginRequest req,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        SessionResult result = authSessionService.login(
                req.email(),
                req.password(),
                ClientOrigin.from(request)
        );

        cookieUtils.setSessionCookies(response, result.accessToken(), result.refreshRaw());
        return result.identity();
    }
}
