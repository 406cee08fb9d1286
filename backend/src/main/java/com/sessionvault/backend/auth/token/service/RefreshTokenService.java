package com.sessionvault.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.sessionvault.backend.auth.config.AuthProperties;
import com.sessionvault.backend.auth.domain.User;
import com.sessionvault.backend.auth.repo.UserRepository;
import com.sessionvault.backend.auth.token.domain.ClientOrigin;
import com.sessionvault.backend.auth.token.domain.RefreshRevokeReason;
import com.sessionvault.backend.auth.token.domain.RefreshToken;
import com.sessionvault.backend.auth.token.domain.RefreshTokenState;
import com.sessionvault.backend.auth.token.exception.RefreshTokenConflictException;
import com.sessionvault.backend.auth.token.exception.RefreshTokenReusedException;
import com.sessionvault.backend.auth.token.store.RefreshTokenStore;
import com.sessionvault.backend.auth.token.support.TokenGenerator;
import com.sessionvault.backend.auth.token.support.TokenHashUtils;
import com.sessionvault.backend.global.ApiException;
import com.sessionvault.backend.global.ErrorCode;
import com.sessionvault.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 발급/로테이션 서비스 (세션 상태 머신)
 * 
 * - DB에는 refresh raw를 저장하지 않고 sha256(token_hash)만 저장한다.
 * - 제출된 토큰은 RefreshTokenState로 판정하고, 상태마다 처리 분기가 하나씩 있다.
 *   UNKNOWN → REFRESH_NOT_FOUND (부수효과 없음)
 *   REVOKED → 해당 유저 활성 세션 전부 폐기 후 REFRESH_REUSED
 *   EXPIRED → REFRESH_EXPIRED (다른 세션은 건드리지 않음)
 *   VALID   → 로테이션
 * 
 * 동시성:
 * - VALID 분기에서 old row를 SELECT ... FOR UPDATE로 다시 읽는다.
 * - 같은 토큰으로 동시에 들어온 두 요청 중 늦은 쪽은 잠금이 풀린 뒤 "이미 폐기됨"을 보고
 *   아무것도 만들지 않고 REFRESH_ROTATION_CONFLICT로 끝난다. (부모 하나에 활성 자식 둘은 불가능)
 *
 * 재사용 감지의 일괄 폐기는 예외를 던지기 전에 커밋되어야 하므로 noRollbackFor로 롤백 대상에서 뺀다.
 */ 
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshTokenStore refreshTokenStore;
    private final UserRepository userRepository;

    private final JwtService jwtService;

    private final TokenGenerator tokenGenerator;

    private final AuthProperties props;       
    private final Clock clock;                 

    /**
     * 새 계보의 루트 refresh 발급 (로그인)
     * - raw는 쿠키로 내려줘야 하므로 반환하고, DB에는 해시만 남긴다.
     */
    @Transactional
    public Issued issue(Long userId, ClientOrigin origin) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        LocalDateTime now = LocalDateTime.now(clock);
        return issueAt(userId, origin, now).issued();
    }

    @Transactional(noRollbackFor = RefreshTokenReusedException.class)
    public RotateResult rotate(String oldRefreshRaw, ClientOrigin origin) {
        if (oldRefreshRaw == null || oldRefreshRaw.isBlank()) {
            throw new ApiException(ErrorCode.REFRESH_NOT_FOUND);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String hash = TokenHashUtils.sha256Hex(oldRefreshRaw);
        RefreshToken presented = refreshTokenStore.findAnyByDigest(hash).orElse(null);

        RefreshToken parent = switch (RefreshTokenState.classify(presented, now)) {
            case UNKNOWN -> throw new ApiException(ErrorCode.REFRESH_NOT_FOUND);
            case REVOKED -> throw reuseDetected(presented, now);
            case EXPIRED -> throw new ApiException(ErrorCode.REFRESH_EXPIRED);
            case VALID -> refreshTokenStore.lockForRotation(presented);
        };

        // 잠금 대기 중 다른 요청이 먼저 로테이션/로그아웃함
        if (parent.isRevoked()) {
            log.warn("refresh 로테이션 경합: 이미 폐기된 토큰 tokenId={}, userId={}, reason={}",
                    parent.getId(), parent.getUserId(), parent.getRevokeReason());
            throw new ApiException(ErrorCode.REFRESH_ROTATION_CONFLICT);
        }

        // role/status는 항상 DB에서 다시 읽는다 (role 변경은 다음 로테이션부터 반영)
        User user = userRepository.findById(parent.getUserId())
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_NOT_FOUND));
        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
        }

        // 자식 insert(flush) → 부모 폐기 순서. 둘 다 같은 트랜잭션.
        IssuedRow child = issueAt(parent.getUserId(), origin, now);
        refreshTokenStore.supersede(parent, child.row(), now);

        String accessToken = jwtService.issueAccessToken(user.getId(), user.getRole());

        log.debug("refresh 로테이션: userId={}, parentId={}, childId={}",
                user.getId(), parent.getId(), child.row().getId());

        return new RotateResult(user, accessToken, child.issued().raw());
    }

    /**
     * 로그아웃: 활성 row면 LOGOUT으로 폐기 (멱등)
     * 쿠키 없음 / 미발급 / 이미 폐기 → 아무것도 하지 않는다.
     */
    @Transactional
    public void revokeIfPresent(String refreshRaw) {
        if (refreshRaw == null || refreshRaw.isBlank()) return;

        String hash = TokenHashUtils.sha256Hex(refreshRaw);

        refreshTokenStore.findActiveByDigestForUpdate(hash).ifPresent(token -> {
            LocalDateTime now = LocalDateTime.now(clock);
            refreshTokenStore.revoke(token, now, RefreshRevokeReason.LOGOUT);
        });
    }

    /** 모든 기기 로그아웃. @return 폐기된 세션 수 */
    @Transactional
    public int revokeAllForUser(Long userId) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        LocalDateTime now = LocalDateTime.now(clock);
        return refreshTokenStore.revokeAllActiveForOwner(userId, now, RefreshRevokeReason.LOGOUT_ALL);
    }

    @Transactional(readOnly = true)
    public long countActiveSessions(Long userId) {
        return refreshTokenStore.countActiveForOwner(userId, LocalDateTime.now(clock));
    }

    /**
     * 폐기된 토큰의 재제출: 탈취된 사본인지 늦게 도착한 정상 재시도인지 구분할 수 없으므로
     * 해당 유저의 활성 세션을 전부 끊는다. 예외 생성 전에 폐기를 먼저 수행한다.
     */
    private RefreshTokenReusedException reuseDetected(RefreshToken presented, LocalDateTime now) {
        Long userId = presented.getUserId();
        int revoked = refreshTokenStore.revokeAllActiveForOwner(userId, now, RefreshRevokeReason.REUSE_DETECTED);

        log.warn("refresh 재사용 감지: userId={}, tokenId={}, revokeReason={}, 폐기된 활성 세션={}",
                userId, presented.getId(), presented.getRevokeReason(), revoked);

        return new RefreshTokenReusedException(userId, revoked);
    }

    /**
     * 난수 생성 → 해시 → insert
     * 해시 충돌 시 난수를 새로 만들어 한 번만 재시도한다.
     */
    private IssuedRow issueAt(Long userId, ClientOrigin origin, LocalDateTime now) {
        LocalDateTime expiresAt = now.plusSeconds(props.refresh().ttlSeconds());

        try {
            return insertNew(userId, origin, now, expiresAt);
        } catch (RefreshTokenConflictException first) {
            log.warn("refresh token_hash 충돌, 재생성 후 재시도: userId={}", userId);
            return insertNew(userId, origin, now, expiresAt);
        }
    }

    private IssuedRow insertNew(Long userId, ClientOrigin origin, LocalDateTime now, LocalDateTime expiresAt) {
        String raw = tokenGenerator.generateRefreshToken();
        if (raw == null || raw.isBlank()) {
            throw new IllegalStateException("generated refresh token is blank");
        }

        RefreshToken row = RefreshToken.issue(userId, TokenHashUtils.sha256Hex(raw), now, expiresAt, origin);
        RefreshToken saved = refreshTokenStore.insert(row);
        return new IssuedRow(saved, new Issued(raw, saved.getId(), expiresAt));
    }

    private record IssuedRow(RefreshToken row, Issued issued) {}

    public record Issued(String raw, Long tokenId, LocalDateTime expiresAt) {}
    public record RotateResult(User user, String accessToken, String newRefreshRaw) {}
}
