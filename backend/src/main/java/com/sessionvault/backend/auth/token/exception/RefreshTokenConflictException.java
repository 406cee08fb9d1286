package com.sessionvault.backend.auth.token.exception;

import com.sessionvault.backend.global.ApiException;
import com.sessionvault.backend.global.ErrorCode;

/**
 * token_hash UNIQUE 제약 충돌 (REFRESH_TOKEN_CONFLICT)
 *
 * - 새로 만든 난수의 해시가 이미 존재하는 경우. 덮어쓰지 않고 insert 자체를 실패시킨다.
 * - RefreshTokenService가 난수를 다시 만들어 한 번 재시도하고, 그래도 실패하면 그대로 전파한다.
 */
public class RefreshTokenConflictException extends ApiException {

    public RefreshTokenConflictException(Throwable cause) {
        super(ErrorCode.REFRESH_TOKEN_CONFLICT, cause);
    }
}
