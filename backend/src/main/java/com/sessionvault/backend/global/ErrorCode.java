package com.sessionvault.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - status/message는 정책에 따라 바뀔 수 있지만, code는 최대한 고정한다.
 * - refresh 실패는 전부 401 + 동일 메시지로 뭉갠다. (공격 감지와 단순 만료를 외부에서 구분 못하게)
 *   단, code는 운영/디버깅을 위해 구분해서 내려준다.
 */
public enum ErrorCode {

    // Login
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "이메일 또는 비밀번호가 올바르지 않습니다."),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN,
            "사용할 수 없는 계정 상태입니다."),

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 유효하지 않습니다."),

    // Refresh token (보안상 메시지 뭉개기)
    REFRESH_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "세션이 만료되었습니다. 다시 로그인해주세요."),
    REFRESH_EXPIRED(HttpStatus.UNAUTHORIZED,
            "세션이 만료되었습니다. 다시 로그인해주세요."),
    REFRESH_REUSED(HttpStatus.UNAUTHORIZED,
            "세션이 만료되었습니다. 다시 로그인해주세요."),
    REFRESH_ROTATION_CONFLICT(HttpStatus.UNAUTHORIZED,
            "세션이 만료되었습니다. 다시 로그인해주세요."),

    // 256bit 난수 해시 충돌 (사실상 발생 불가, 재시도 후에도 실패하면 서버 오류)
    REFRESH_TOKEN_CONFLICT(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다."),

    // User / Data consistency
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "사용자를 찾을 수 없습니다."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
