package com.sessionvault.backend.auth.identity.login.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.sessionvault.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * [로그인 요청 DTO]
 * - email/password는 기본 형식 검증만 수행한다.
 * - 소문자 normalize는 서비스(AuthSessionService)에서 수행한다.
 */
public record LoginRequest(
    
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @Email 
        @NotBlank 
        @Size(max = 255)
        String email,
        
        @NotBlank 
        @Size(max = 72) // BCrypt 입력 한계
        String password
) {}
