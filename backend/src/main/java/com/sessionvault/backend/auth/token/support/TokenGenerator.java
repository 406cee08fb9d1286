package com.sessionvault.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 원문 생성기
 * 
 * - SecureRandom 32바이트(256bit): 예측 불가능 + 사실상 충돌 불가
 * - Base64 URL-safe: 쿠키/헤더에 안전한 문자셋 (-, _) 사용, padding 제거 → 43자
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    static final int TOKEN_BYTES = 32;

    private final SecureRandom secureRandom;

    /** Refresh Token raw 생성 */
    public String generateRefreshToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
