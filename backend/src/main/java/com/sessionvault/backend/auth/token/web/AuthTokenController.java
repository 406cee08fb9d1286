package com.sessionvault.backend.auth.token.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionvault.backend.auth.session.dto.SessionResponse;
import com.sessionvault.backend.auth.session.service.AuthSessionService;
import com.sessionvault.backend.auth.session.service.AuthSessionService.SessionResult;
import com.sessionvault.backend.auth.token.domain.ClientOrigin;
import com.sessionvault.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/refresh
 * 
 * Reads refresh raw from HttpOnly cookie and performs rotation.
 * On success the response has the same shape as login: identity body + new cookie pair.
 * 
 * Failures (NOT_FOUND / EXPIRED / REUSED / ROTATION_CONFLICT) all surface as 401 with one message.
 * Cookies are left untouched on failure.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final AuthSessionService authSessionService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/refresh")
    public SessionResponse refresh(HttpServletRequest request, HttpServletResponse response) {
        String refreshRaw = cookieUtils.readRefreshCookie(request);

        SessionResult result = authSessionService.refresh(refreshRaw, ClientOrigin.from(request));

        cookieUtils.setSessionCookies(response, result.accessToken(), result.refreshRaw());
        return result.identity();
    }
}
