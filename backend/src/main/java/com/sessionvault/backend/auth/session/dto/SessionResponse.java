package com.sessionvault.backend.auth.session.dto;

import java.util.Objects;

import com.sessionvault.backend.auth.domain.User;

/**
 * 로그인 / refresh 응답 바디 (신원 정보만)
 *
 * - access token, refresh token은 바디에 넣지 않고 HttpOnly 쿠키(Set-Cookie)로만 내려간다.
 */
public record SessionResponse(
        Long userId,
        String email,
        String nickname,
        String role
) {
    public static SessionResponse from(User user) {
        Objects.requireNonNull(user, "user must not be null");
        return new SessionResponse(user.getId(), user.getEmail(), user.getNickname(), user.getRole().name());
    }
}
