package com.sessionvault.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionvault.backend.auth.domain.User;
import com.sessionvault.backend.auth.identity.me.dto.MeResponse;
import com.sessionvault.backend.auth.repo.UserRepository;
import com.sessionvault.backend.auth.token.service.RefreshTokenService;
import com.sessionvault.backend.global.ApiException;
import com.sessionvault.backend.global.ErrorCode;
import com.sessionvault.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/** 
 * 내 정보 조회 유스케이스 (access token으로 보호되는 리소스)
 *
 * 정책:
 * - 인증이 없으면 AUTH_REQUIRED
 * - 토큰은 유효하지만 사용자 없음 -> USER_NOT_FOUND
 * - 계정 상태가 ACTIVE가 아니면 -> ACCOUNT_DISABLED
 *
 * access token은 폐기 경로가 없으므로, 로그아웃 직후에도 만료 전까지는 여기 접근이 된다.
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;
    private final RefreshTokenService refreshTokenService;

    @Transactional(readOnly = true)
    public MeResponse me(AuthPrincipal principal) {
        if (principal == null || principal.userId() == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        User user = userRepository.findById(principal.userId())
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        return MeResponse.of(user, refreshTokenService.countActiveSessions(user.getId()));
    }
}
