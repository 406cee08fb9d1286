package com.sessionvault.backend.auth.token.support;

import java.time.Duration;
import java.util.Arrays;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.sessionvault.backend.auth.config.AuthProperties;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 세션 쿠키(access / refresh) 유틸
 *
 * - 두 토큰 모두 HttpOnly 쿠키로만 내려 JS 접근을 막는다(XSS 완화).
 * - cookie 옵션(path/samesite/secure/maxAge)을 한 곳에서 통일한다.
 * - Max-Age는 각 토큰의 수명과 정확히 같다.
 *   access: path=/ , Max-Age=accessTtlSeconds
 *   refresh: path=/auth , Max-Age=refresh.ttlSeconds
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    private final AuthProperties props;

    /** Refresh 쿠키 읽기 (없으면 null) */
    public String readRefreshCookie(HttpServletRequest request) {
        return readCookie(request, props.cookie().refreshName());
    }

    /** Access 쿠키 읽기 (없으면 null) */
    public String readAccessCookie(HttpServletRequest request) {
        return readCookie(request, props.cookie().accessName());
    }

    /** 로그인/refresh 성공 시 두 쿠키를 함께 세팅 */
    public void setSessionCookies(HttpServletResponse response, String accessToken, String refreshRaw) {
        if (accessToken == null || accessToken.isBlank()) return;
        if (refreshRaw == null || refreshRaw.isBlank()) return;

        AuthProperties.Cookie c = props.cookie();

        ResponseCookie access = baseCookie(c.accessName(), accessToken, c.accessPath())
                .maxAge(Duration.ofSeconds(props.jwt().accessTtlSeconds()))
                .build();
        ResponseCookie refresh = baseCookie(c.refreshName(), refreshRaw, c.refreshPath())
                .maxAge(Duration.ofSeconds(props.refresh().ttlSeconds()))
                .build();

        response.addHeader(HttpHeaders.SET_COOKIE, access.toString());
        response.addHeader(HttpHeaders.SET_COOKIE, refresh.toString());
    }

    /** 두 쿠키 삭제 (속성(path/sameSite/secure)이 같아야 브라우저가 제대로 삭제함) */
    public void clearSessionCookies(HttpServletResponse response) {
        AuthProperties.Cookie c = props.cookie();

        ResponseCookie access = baseCookie(c.accessName(), "", c.accessPath())
                .maxAge(Duration.ZERO) // 즉시 만료
                .build();
        ResponseCookie refresh = baseCookie(c.refreshName(), "", c.refreshPath())
                .maxAge(Duration.ZERO)
                .build();

        response.addHeader(HttpHeaders.SET_COOKIE, access.toString());
        response.addHeader(HttpHeaders.SET_COOKIE, refresh.toString());
    }

    private ResponseCookie.ResponseCookieBuilder baseCookie(String name, String value, String path) {
        AuthProperties.Cookie c = props.cookie();
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(c.secure())
                .path(path)
                .sameSite(c.sameSite().name());
    }

    private static String readCookie(HttpServletRequest request, String cookieName) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null || cookies.length == 0) return null;

        return Arrays.stream(cookies)
                .filter(cookie -> cookieName.equals(cookie.getName()))
                .map(Cookie::getValue)
                .map(v -> v == null ? null : v.trim())
                .filter(v -> v != null && !v.isBlank())
                .findFirst()
                .orElse(null);
    }
}
