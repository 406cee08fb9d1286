package com.sessionvault.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.sessionvault.backend.auth.token.domain.RefreshRevokeReason;
import com.sessionvault.backend.auth.token.domain.RefreshToken;

import jakarta.persistence.LockModeType;

/**
 * refresh_tokens 접근 계층 (규칙 없음, 조회/변경 쿼리만)
 * 비즈니스 규칙은 RefreshTokenService, 저장소 계약은 RefreshTokenStore가 가진다.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    /** 폐기 여부와 무관하게 조회 ("없음"과 "이미 사용됨"을 구분하기 위함) */
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    /** revoked_at IS NULL 인 row만 */
    Optional<RefreshToken> findByTokenHashAndRevokedAtIsNull(String tokenHash);

    boolean existsByTokenHash(String tokenHash);

    List<RefreshToken> findAllByUserIdOrderByIdAsc(Long userId);

    /**
     * logout 동시성 방어용 Row Lock 조회 (활성 row만)
     *
     * - PESSIMISTIC_WRITE = (대부분 DB에서) SELECT ... FOR UPDATE
     * - 같은 row를 잠그는 rotate와 직렬화된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from RefreshToken r where r.tokenHash = :tokenHash and r.revokedAt is null")
    Optional<RefreshToken> findActiveByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

    /**
     * 유저의 활성 세션 일괄 폐기 (재사용 감지, logout-all)
     *
     * - revoked_at IS NULL 조건이 있어 이미 폐기된 row는 건드리지 않는다. (여러 번 실행해도 결과 동일)
     * - replaced_by_id는 세팅하지 않는다.
     * - bulk update는 영속성 컨텍스트를 우회하므로 실행 전 flush, 실행 후 clear.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.revokedAt = :now,
                   r.revokeReason = :reason
             where r.userId = :userId
               and r.revokedAt is null
            """)
    int revokeAllActiveByUserId(
            @Param("userId") Long userId,
            @Param("now") LocalDateTime now,
            @Param("reason") RefreshRevokeReason reason
    );

    /** expires_at < cutoff 인 row 일괄 삭제 (이미 사용 불가능한 row만 대상) */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RefreshToken r where r.expiresAt < :cutoff")
    int deleteAllExpiredBefore(@Param("cutoff") LocalDateTime cutoff);

    @Query("""
            select count(r) from RefreshToken r
             where r.userId = :userId
               and r.revokedAt is null
               and r.expiresAt >= :now
            """)
    long countActiveByUserId(@Param("userId") Long userId, @Param("now") LocalDateTime now);
}
