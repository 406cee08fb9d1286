package com.sessionvault.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.sessionvault.backend.auth.session.service.AuthSessionService;
import com.sessionvault.backend.auth.token.support.AuthCookieUtils;
import com.sessionvault.backend.global.ApiException;
import com.sessionvault.backend.global.ErrorCode;
import com.sessionvault.backend.security.AuthPrincipal;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;


/**
 * POST: /auth/logout
 * 
 * Logout is idempotent:
 * - no cookie / unknown cookie / already-revoked => still 204
 * - always clears both session cookies on the client
 *
 * POST: /auth/logout-all (authenticated)
 * - revokes every active refresh token of the caller, then clears cookies
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {
    
    private final AuthSessionService authSessionService;
    private final AuthCookieUtils cookieUtils;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(HttpServletRequest request, HttpServletResponse response) {
        authSessionService.logout(cookieUtils.readRefreshCookie(request));

        // 클라이언트는 항상 '삭제' Set-Cookie를 받는다 (멱등)
        cookieUtils.clearSessionCookies(response);
    }

    @PostMapping("/logout-all")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logoutAll(@AuthenticationPrincipal AuthPrincipal principal, HttpServletResponse response) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        authSessionService.logoutAll(principal.userId());
        cookieUtils.clearSessionCookies(response);
    }
}
