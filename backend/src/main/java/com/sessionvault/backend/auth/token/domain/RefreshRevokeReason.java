package com.sessionvault.backend.auth.token.domain;

/**
 * RefreshToken 폐기(Revoke) 사유 (감사용 기록)
 * 
 * ROTATED: 정상 로테이션으로 이전 토큰을 폐기함 (replaced_by_id 가 함께 채워짐)
 * LOGOUT: 사용자가 명시적으로 로그아웃
 * LOGOUT_ALL: 모든 기기에서 로그아웃
 * REUSE_DETECTED: 폐기된 토큰이 다시 제출되어 해당 유저의 활성 세션을 전부 끊음
 */
public enum RefreshRevokeReason { ROTATED, LOGOUT, LOGOUT_ALL, REUSE_DETECTED }
