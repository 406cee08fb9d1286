package com.sessionvault.backend.auth.identity.me.dto;

import java.time.LocalDateTime;
import java.util.Objects;

import com.sessionvault.backend.auth.domain.User;

/**
 * 내 정보 + 현재 살아있는 세션(활성 refresh token) 수
 */
public record MeResponse (
    Long userId,
    String email,
    String nickname,
    String role,
    String status,
    LocalDateTime lastLoginAt,
    long activeSessions
) {

    public static MeResponse of(User user, long activeSessions) {
        Objects.requireNonNull(user, "user must not be null");

        return new MeResponse(
                user.getId(),
                user.getEmail(),
                user.getNickname(),
                user.getRole().name(),
                user.getStatus().name(),
                user.getLastLoginAt(),
                activeSessions
        );
    }
}
