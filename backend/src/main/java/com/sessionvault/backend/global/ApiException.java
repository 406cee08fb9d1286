package com.sessionvault.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 비즈니스 로직에서 사용하는 커스텀 예외 (중앙화된 ErrorCode 기반)
 * 
 * - 서비스/도메인 정책 위반을 ErrorCode로 표현한다.
 * - 전역 핸들러(GlobalExceptionHandler) / 보안 레이어(SecurityErrorWriter)가
 *   이 예외를 ApiError로 직렬화해 응답 포맷을 고정한다.
 *
 * 사용:
 *   throw new ApiException(ErrorCode.REFRESH_EXPIRED);
 *
 * 의미가 더 필요한 경우(부수효과를 이미 수행했다 등)는 하위 클래스로 표현한다.
 * - RefreshTokenReusedException, RefreshTokenConflictException
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status; // ex: HttpStatus.UNAUTHORIZED
    private final String code;       // ex: "REFRESH_EXPIRED"
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null, null);
    }

    public ApiException(ErrorCode errorCode, Throwable cause) {
        this(errorCode, null, null, cause);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Object details, Throwable cause) {
        // super(...)는 첫 줄이어야 해서 errorCode null 검사보다 앞에 둘 수밖에 없음.
        super(resolveMessage(errorCode, messageOverride), cause);

        if (errorCode == null) 
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.details = details;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return (errorCode == null) ? null : errorCode.defaultMessage();
    }
}
