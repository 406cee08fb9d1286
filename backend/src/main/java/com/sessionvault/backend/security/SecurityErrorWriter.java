package com.sessionvault.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sessionvault.backend.global.ApiError;
import com.sessionvault.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Security 레이어(필터/EntryPoint)용 ApiError 응답 작성기
 * 
 * Security Filter Chain에서 차단되는 요청은 @Controller까지 오지 않아서 GlobalExceptionHandler가 못 잡는다.
 * 여기서 같은 JSON 포맷({code, message})으로 직접 쓴다.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {
    
    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        // 이미 다른 필터가 응답을 만들어버린 경우라면 건드리지 않음
        if (response.isCommitted()) 
            return;

        // 인증 실패 응답은 캐시 금지
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");

        response.setStatus(errorCode.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        
        objectMapper.writeValue(response.getWriter(), ApiError.of(errorCode));
    }
}
