package com.sessionvault.backend.auth.session.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionvault.backend.auth.domain.User;
import com.sessionvault.backend.auth.repo.UserRepository;
import com.sessionvault.backend.auth.session.dto.SessionResponse;
import com.sessionvault.backend.auth.token.domain.ClientOrigin;
import com.sessionvault.backend.auth.token.service.RefreshTokenService;
import com.sessionvault.backend.auth.token.service.RefreshTokenService.Issued;
import com.sessionvault.backend.auth.token.service.RefreshTokenService.RotateResult;
import com.sessionvault.backend.global.ApiException;
import com.sessionvault.backend.global.ErrorCode;
import com.sessionvault.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 유스케이스 (login / refresh / logout / logout-all)
 *
 * 계약:
 * - 이메일은 trim + 소문자 normalize 후 조회한다.
 * - "이메일 없음"과 "비밀번호 불일치"는 동일 에러(INVALID_CREDENTIALS)로 처리해 계정 유무 추측을 어렵게 한다.
 * - ACTIVE 계정만 로그인 허용(그 외는 ACCOUNT_DISABLED).
 * - 성공 시 신원 정보 + access token + refresh raw를 돌려준다. (토큰 → 쿠키 변환은 컨트롤러 담당)
 * - refresh 실패는 RefreshTokenService의 ApiException을 그대로 전파한다.
 *
 * 토큰 발급:
 * 1) JwtService: Access Token(JWT) 서명/클레임 생성
 * 2) RefreshTokenService: Refresh Token 발급(로그인 = 새 계보의 루트) / 로테이션
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthSessionService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;

    private final Clock clock;

    @Transactional
    public SessionResult login(String rawEmail, String rawPassword, ClientOrigin origin) {
        // 컨트롤러 @Valid가 있어도 서비스에서 한 번 더 막는다.
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        String email = normalizeEmail(rawEmail);

        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        String accessToken = jwtService.issueAccessToken(user.getId(), user.getRole());
        Issued refresh = refreshTokenService.issue(user.getId(), origin);

        // 영속 상태의 User → 더티체킹으로 커밋 시 반영
        user.markLoggedIn(LocalDateTime.now(clock));

        log.info("로그인 성공: userId={}, refreshTokenId={}", user.getId(), refresh.tokenId());
        return new SessionResult(SessionResponse.from(user), accessToken, refresh.raw());
    }

    /**
     * refresh 토큰 로테이션
     * - 쿠키 없음은 REFRESH_NOT_FOUND
     * - 재사용 감지 시 RefreshTokenReusedException (일괄 폐기는 이미 커밋된 상태)
     */
    public SessionResult refresh(String refreshRaw, ClientOrigin origin) {
        RotateResult rotated = refreshTokenService.rotate(refreshRaw, origin);
        return new SessionResult(SessionResponse.from(rotated.user()), rotated.accessToken(), rotated.newRefreshRaw());
    }

    /** 멱등: 토큰 없음 / 미발급 / 이미 폐기 모두 정상 종료 */
    public void logout(String refreshRaw) {
        refreshTokenService.revokeIfPresent(refreshRaw);
    }

    public int logoutAll(Long userId) {
        int revoked = refreshTokenService.revokeAllForUser(userId);
        log.info("전체 로그아웃: userId={}, revoked={}", userId, revoked);
        return revoked;
    }

    private static String normalizeEmail(String rawEmail) {
        return rawEmail.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** 컨트롤러가 HTTP 응답(바디 + Set-Cookie)으로 변환하기 위한 결과 */
    public record SessionResult(SessionResponse identity, String accessToken, String refreshRaw) {}
}
