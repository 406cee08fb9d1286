package com.sessionvault.backend.security;

import java.time.Instant;

import com.sessionvault.backend.auth.domain.UserRole;

/**
 * 검증이 끝난 Access Token의 클레임 {sub, role, iat, exp}
 */
public record AccessClaims(Long userId, UserRole role, Instant issuedAt, Instant expiresAt) {

    public AuthPrincipal toPrincipal() {
        return new AuthPrincipal(userId, role);
    }
}
