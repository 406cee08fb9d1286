package com.sessionvault.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.sessionvault.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor; 

/**
 * 보호 리소스(/auth/me, /auth/logout-all ...)에 access token 없이 접근 → 401 AUTH_REQUIRED
 *
 * 토큰이 있는데 invalid인 경우는 JwtAuthenticationFilter가 먼저 ACCESS_INVALID로 끝낸다.
 */
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
