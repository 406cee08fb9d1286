package com.sessionvault.backend.auth.domain;

/**
 * 계정 상태
 * 
 * ACTIVE: 로그인/refresh 허용
 * SUSPENDED: 운영자가 정지한 계정 (로그인, refresh 모두 ACCOUNT_DISABLED)
 * WITHDRAWN: 탈퇴 처리된 계정
 */
public enum UserStatus { ACTIVE, SUSPENDED, WITHDRAWN }
