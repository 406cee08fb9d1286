package com.sessionvault.backend.security;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import com.sessionvault.backend.auth.token.support.AuthCookieUtils;
import com.sessionvault.backend.global.ErrorCode;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * "Security Filter Chain"에서 "JWT 기반 인증"을 수행하는 인증 필터
 * 
 * 역할:
 * - Access Token을 꺼낸다. (Authorization: Bearer 헤더 우선, 없으면 access 쿠키)
 * - JwtService로 JWT 서명/만료/issuer를 검증해서 AuthPrincipal(userId, role)을 얻는다.
 * - 검증이 성공하면 SecurityContext에 Authentication을 세팅한다.
 * 
 * 정책:
 * - 토큰이 "없으면" 통과한다. (차단은 SecurityConfig의 인가 규칙 + EntryPoint가 담당)
 * - 토큰이 "있는데 유효하지 않으면" 여기서 401 ACCESS_INVALID로 종료한다.
 * - 세션 엔드포인트(login/refresh/logout)는 검사하지 않는다.
 *   만료된 access 쿠키가 같이 실려 와도 refresh가 막히면 안 되기 때문.
 */
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {
    
    private static final String BEARER_PREFIX = "Bearer ";
    private static final Set<String> SKIP_PATHS = Set.of("/auth/login", "/auth/refresh", "/auth/logout");

    // context path만 뺀 경로. servletPath는 DispatcherServlet 매핑에 따라 비어 있을 수 있다.
    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    private final JwtService jwtService;
    private final AuthCookieUtils cookieUtils;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return SKIP_PATHS.contains(PATH_HELPER.getPathWithinApplication(request));
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 이미 인증이 만들어진 요청이면 중복 처리하지 않는다.
        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = resolveToken(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        AuthPrincipal principal;
        try {
            principal = jwtService.verifyAccessToken(token).toPrincipal();
        } catch (JwtService.InvalidJwtException ex) {
            // "토큰이 있는데 invalid"면 여기서 응답을 확정하고 끝낸다.
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ErrorCode.ACCESS_INVALID);
            return;
        }

        var authorities = List.of(new SimpleGrantedAuthority(principal.authority()));
        var authentication = new UsernamePasswordAuthenticationToken(principal, null, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

        SecurityContextHolder.getContext().setAuthentication(authentication);
        filterChain.doFilter(request, response);
    }

    /**
     * 1) Authorization: Bearer <token>
     * 2) access 쿠키
     * 둘 다 없으면 null
     */
    private String resolveToken(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            if (!token.isBlank()) return token;
        }
        return cookieUtils.readAccessCookie(request);
    }
}
