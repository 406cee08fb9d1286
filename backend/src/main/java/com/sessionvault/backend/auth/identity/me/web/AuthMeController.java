package com.sessionvault.backend.auth.identity.me.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionvault.backend.auth.identity.me.dto.MeResponse;
import com.sessionvault.backend.auth.identity.me.service.MeService;
import com.sessionvault.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * GET /auth/me
 * 
 * - JwtAuthenticationFilter가 Access Token(헤더 또는 쿠키)을 검증하면 principal이 주입된다.
 * - 인증이 없으면 SecurityConfig의 EntryPoint에서 먼저 막힌다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthMeController {
    
    private final MeService meService;

    @GetMapping("/me")
    public MeResponse me(@AuthenticationPrincipal AuthPrincipal principal) {
        return meService.me(principal); 
    }
}
