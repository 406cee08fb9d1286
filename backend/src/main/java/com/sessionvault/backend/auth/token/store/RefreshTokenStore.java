package com.sessionvault.backend.auth.token.store;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import com.sessionvault.backend.auth.token.domain.RefreshRevokeReason;
import com.sessionvault.backend.auth.token.domain.RefreshToken;
import com.sessionvault.backend.auth.token.exception.RefreshTokenConflictException;
import com.sessionvault.backend.auth.token.repo.RefreshTokenRepository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 저장소 계약
 *
 * - 영속성만 담당한다. 어떤 토큰을 받아줄지/폐기할지 같은 규칙은 RefreshTokenService가 결정한다.
 * - 트랜잭션 경계는 호출자(서비스)의 @Transactional을 따른다.
 *
 * 동시성:
 * - lockForRotation(): 이미 읽은 row를 SELECT ... FOR UPDATE로 다시 읽어 최신 상태 + 행 잠금을 얻는다.
 *   같은 토큰에 대한 두 rotate는 여기서 직렬화된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefreshTokenStore {

    private static final String TOKEN_HASH_UNIQUE = "uq_refresh_token_hash";

    private final RefreshTokenRepository refreshTokenRepository;
    private final EntityManager entityManager;

    /**
     * 신규 row insert (즉시 flush → id 확정)
     *
     * token_hash가 이미 있으면 덮어쓰지 않고 RefreshTokenConflictException.
     * - 1차: exists 조회로 선검사
     * - 2차: 선검사 이후 경합으로 UNIQUE 제약 위반이 나도 같은 예외로 변환
     */
    public RefreshToken insert(RefreshToken token) {
        Objects.requireNonNull(token, "token must not be null");

        if (refreshTokenRepository.existsByTokenHash(token.getTokenHash())) {
            throw new RefreshTokenConflictException(
                    new IllegalStateException("token_hash already exists (pre-check)"));
        }

        try {
            return refreshTokenRepository.saveAndFlush(token);
        } catch (DataIntegrityViolationException e) {
            if (isTokenHashViolation(e)) {
                throw new RefreshTokenConflictException(e);
            }
            throw e;
        }
    }

    public Optional<RefreshToken> findActiveByDigest(String tokenHash) {
        return refreshTokenRepository.findByTokenHashAndRevokedAtIsNull(tokenHash);
    }

    public Optional<RefreshToken> findAnyByDigest(String tokenHash) {
        return refreshTokenRepository.findByTokenHash(tokenHash);
    }

    public Optional<RefreshToken> findActiveByDigestForUpdate(String tokenHash) {
        return refreshTokenRepository.findActiveByTokenHashForUpdate(tokenHash);
    }

    /**
     * 이미 조회한 row에 행 잠금을 걸고 DB의 최신 상태로 다시 읽는다.
     * 잠금을 기다리는 동안 다른 트랜잭션이 폐기했다면 반환 후 isRevoked()가 true.
     */
    public RefreshToken lockForRotation(RefreshToken token) {
        entityManager.refresh(token, LockModeType.PESSIMISTIC_WRITE);
        return token;
    }

    /** 로테이션 외 사유로 폐기 (replaced_by_id 없음). 이미 폐기된 row는 그대로 둔다. */
    public void revoke(RefreshToken token, LocalDateTime now, RefreshRevokeReason reason) {
        token.revoke(now, reason);
        refreshTokenRepository.flush();
    }

    /** 로테이션 폐기: parent.revoked_at + parent.replaced_by_id = child.id */
    public void supersede(RefreshToken parent, RefreshToken child, LocalDateTime now) {
        parent.markRotated(now, child);
        refreshTokenRepository.flush();
    }

    /** @return 이번 호출로 폐기된 row 수 */
    public int revokeAllActiveForOwner(Long userId, LocalDateTime now, RefreshRevokeReason reason) {
        return refreshTokenRepository.revokeAllActiveByUserId(userId, now, reason);
    }

    /** @return 삭제된 row 수 */
    public int deleteExpiredBefore(LocalDateTime cutoff) {
        return refreshTokenRepository.deleteAllExpiredBefore(cutoff);
    }

    public long countActiveForOwner(Long userId, LocalDateTime now) {
        return refreshTokenRepository.countActiveByUserId(userId, now);
    }

    private static boolean isTokenHashViolation(DataIntegrityViolationException e) {
        String msg = e.getMostSpecificCause().getMessage();
        boolean matched = msg != null && msg.toLowerCase(Locale.ROOT).contains(TOKEN_HASH_UNIQUE);
        if (!matched) {
            log.debug("token_hash 외 제약 위반: {}", msg);
        }
        return matched;
    }
}
