package com.sessionvault.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 제출된 refresh 토큰의 판정 결과 (닫힌 열거)
 *
 * 판정 순서가 곧 정책이다:
 * 1) UNKNOWN  - 해시와 일치하는 row 없음 (위조 토큰과 동일 취급, 부수효과 없음)
 * 2) REVOKED  - row는 있으나 revoked_at != null → 재사용 신호
 * 3) EXPIRED  - 활성이지만 now > expires_at
 * 4) VALID    - 활성 + 미만료 → 로테이션 진행
 *
 * 만료되었으면서 이미 폐기된 토큰은 REVOKED 로 판정된다.
 * (만료까지 기다리는 것으로 재사용 감지를 우회할 수 없다)
 */
public enum RefreshTokenState {
    UNKNOWN,
    REVOKED,
    EXPIRED,
    VALID;

    public static RefreshTokenState classify(RefreshToken token, LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");

        if (token == null) return UNKNOWN;
        if (token.isRevoked()) return REVOKED;
        if (token.isExpired(now)) return EXPIRED;
        return VALID;
    }
}
