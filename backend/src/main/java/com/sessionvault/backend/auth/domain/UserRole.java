package com.sessionvault.backend.auth.domain;

/**
 * 인가용 역할. access token의 role 클레임에 name() 그대로 실린다.
 */
public enum UserRole { USER, ADMIN }
