package com.sessionvault.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;


/**
 * 공통 API 에러 응답 DTO
 * 
 * 원칙:
 * - 모든 레이어(ControllerAdvice / EntryPoint / Filter)에서 에러 응답은
 *   항상 동일한 JSON 스키마를 유지한다.
 *
 * 필드:
 * - code: 클라이언트 분기용 안정 식별자 (ErrorCode.name())
 * - message: 사용자 메시지(정책/로케일에 따라 바뀔 수 있음)
 * - details: 추가 정보(필요 시만, 내부 구현 정보는 절대 넣지 않는다)
 * 
 * @JsonInclude(NON_NULL): null인 필드는 JSON에서 제외
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "REFRESH_REUSED"
        String message, // ex: "세션이 만료되었습니다. 다시 로그인해주세요."
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getDetails());
    }
}
