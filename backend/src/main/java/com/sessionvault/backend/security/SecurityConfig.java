package com.sessionvault.backend.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.sessionvault.backend.auth.token.support.AuthCookieUtils;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - JWT 인증: JwtAuthenticationFilter
 * - 인증 필요 리소스 접근 시 인증 없으면: RestAuthEntryPoint (AUTH_REQUIRED)
 * - 토큰은 있는데 invalid면: JwtAuthenticationFilter (ACCESS_INVALID)
 * 
 * - JwtAuthenticationFilter가 Authorization 헤더 / access 쿠키를 검사하고 유효하면 SecurityContext에 인증 정보를 세팅한다.
 * - authorizeHttpRequest에서 "인증 필요"인 요청인데 인증이 없으면 EntryPoint가 401 Unauthorized 응답을 내려준다.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final AuthCookieUtils authCookieUtils;
    private final SecurityErrorWriter securityErrorWriter;

    @Bean
    RestAuthEntryPoint restAuthEntryPoint() {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter() {
        return new JwtAuthenticationFilter(jwtService, authCookieUtils, securityErrorWriter);
    }

    // @Bean Filter는 서블릿 컨테이너에도 자동 등록되므로, Security 체인 안에서만 돌도록 끈다.
    @Bean
    FilterRegistrationBean<JwtAuthenticationFilter> jwtAuthenticationFilterRegistration(JwtAuthenticationFilter filter) {
        FilterRegistrationBean<JwtAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable()) // CSRF 비활성화 - 쿠키는 SameSite로 제한하고 서버 세션(JSESSIONID)은 쓰지 않는다.
                .httpBasic(b -> b.disable()) // HTTP Basic 인증 비활성화 - Authorization: Basic ... 방식 사용 안 함
                .formLogin(f -> f.disable()) // formLogin 비활성화 - 스프링 기본 로그인 페이지 사용 안 함

                // 세션 사용 안 함 - 로그인 상태를 서버 세션에 저장하지 않음
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                
                // 인증 실패(= 인증 없이 보호 리소스 접근) 응답 방식 커스터마이즈 - 401 Unauthorized
                .exceptionHandling(eh -> eh.authenticationEntryPoint(restAuthEntryPoint()))

                // JWT 필터 등록: UsernamePasswordAuthenticationFilter 전에 실행되도록 설정
                .addFilterBefore(
                        jwtAuthenticationFilter(),
                        UsernamePasswordAuthenticationFilter.class
                )

                // URL별 접근 정책(인가)
                .authorizeHttpRequests(auth -> auth
                        // 스프링 내부 에러 페이지 접근 허용
                        .requestMatchers("/error").permitAll()

                        // Liveness/Readiness Probe
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()

                        // 인증 필요 없는 세션 엔드포인트 (refresh 쿠키 자체가 자격 증명)
                        .requestMatchers("/auth/login").permitAll()
                        .requestMatchers("/auth/refresh").permitAll()
                        .requestMatchers("/auth/logout").permitAll()

                        // 그 외는 인증 필요 (/auth/me, /auth/logout-all 포함)
                        .anyRequest().authenticated()
                )
                .build(); // SecurityFilterChain 생성
    }
}
