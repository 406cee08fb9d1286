package com.sessionvault.backend.security;

import com.sessionvault.backend.auth.domain.UserRole;

/**
 * SecurityContext에 들어가는 인증 주체 (AccessClaims에서 만든다)
 *
 * - userId: JWT sub
 * - role: 인가용 역할, Spring Security 권한 문자열은 ROLE_* 규칙
 */
public record AuthPrincipal(Long userId, UserRole role) {

    public AuthPrincipal {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");
    }

    public String authority() {
        return "ROLE_" + role.name();
    }
}
