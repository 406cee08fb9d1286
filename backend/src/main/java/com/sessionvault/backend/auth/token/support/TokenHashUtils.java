package com.sessionvault.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 토큰 해시 유틸
 * 
 * - refresh token "원문"이 DB에 저장되면 유출 시 바로 악용 가능
 * - 그래서 DB에는 "해시(token_hash)"만 저장하고, 저장과 조회 모두 같은 함수를 쓴다.
 *   : incoming raw token -> (sha256Hex) -> DB token_hash와 비교
 * - 결정적: 같은 입력은 항상 같은 64자 소문자 hex
 */
public final class TokenHashUtils {
    private TokenHashUtils() {}

    private static final HexFormat HEX = HexFormat.of(); // 소문자

    /**
     * raw 문자열을 SHA-256 해시 후 hex(64 chars) 문자열로 반환
     */
    public static String sha256Hex(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw token must not be null/blank");
        }

        return HEX.formatHex(sha256(raw.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256이 없으면 JVM/환경 자체가 비정상에 가깝다.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
