package com.sessionvault.backend.auth.token.exception;

import com.sessionvault.backend.global.ApiException;
import com.sessionvault.backend.global.ErrorCode;

import lombok.Getter;

/**
 * 폐기된 refresh 토큰이 다시 제출됨 (REFRESH_REUSED)
 *
 * 이 예외가 만들어졌다는 것은 해당 유저의 활성 세션 일괄 폐기가 "이미 수행되었다"는 뜻이다.
 * 호출자는 다시 폐기를 시도할 필요가 없다.
 * - revokedSessionCount: 이번 재사용 감지로 끊긴 활성 세션 수 (0일 수도 있음)
 */
@Getter
public class RefreshTokenReusedException extends ApiException {

    private final Long userId;
    private final int revokedSessionCount;

    public RefreshTokenReusedException(Long userId, int revokedSessionCount) {
        super(ErrorCode.REFRESH_REUSED);
        this.userId = userId;
        this.revokedSessionCount = revokedSessionCount;
    }
}
