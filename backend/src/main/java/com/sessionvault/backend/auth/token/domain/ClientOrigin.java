package com.sessionvault.backend.auth.token.domain;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 발급 요청의 출처 (감사 메타데이터)
 * - User-Agent 헤더, 원격 주소
 * - 인가 판단에는 절대 쓰지 않는다.
 */
public record ClientOrigin(String userAgent, String ipAddress) {

    private static final ClientOrigin UNKNOWN = new ClientOrigin(null, null);

    public static ClientOrigin unknown() {
        return UNKNOWN;
    }

    public static ClientOrigin from(HttpServletRequest request) {
        if (request == null) return UNKNOWN;
        return new ClientOrigin(request.getHeader("User-Agent"), request.getRemoteAddr());
    }
}
