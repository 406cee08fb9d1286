package com.sessionvault.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_tokens 테이블 매핑 엔티티 (서버가 관리하는 로그인 세션 1건)
 *
 * - Access Token(JWT)은 서버에 저장하지 않음(Stateless)
 * - Refresh Token은 발급된 모든 이력을 row로 남기고 상태를 DB로 관리한다.
 *
 * 불변 조건:
 * 1) refresh raw(원문)은 DB에 절대 저장하지 않는다. (token_hash만 저장, UNIQUE)
 * 2) revoked_at은 한 번만 채워지고 다시 null이 되지 않는다.
 * 3) replaced_by_id는 "로테이션으로 폐기될 때"만 채워진다. (logout / 재사용 대응 폐기는 null 유지)
 *    가리키는 row는 항상 같은 user_id의, 나중에 생성된 row다.
 *
 * 로테이션 계보(lineage):
 *   A(ROTATED, replaced_by=B) → B(ROTATED, replaced_by=C) → C(active)
 *
 * 인덱스:
 * - uq_refresh_token_hash: 쿠키 원문을 해싱한 값이 곧 조회 키
 * - idx_refresh_user_id: 유저 단위 일괄 폐기(재사용 감지, logout-all)
 * - idx_refresh_expires_at: 만료 row 정리 배치
 */
@Getter
@Entity
@Table(
    name = "refresh_tokens",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_refresh_token_hash", columnNames = "token_hash")
    },
    indexes = {
        @Index(name = "idx_refresh_user_id", columnList = "user_id"),
        @Index(name = "idx_refresh_expires_at", columnList = "expires_at"),
        @Index(name = "idx_refresh_replaced_by", columnList = "replaced_by_id")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA가 리플렉션으로 객체 생성
public class RefreshToken {

    // ---- constants (DB 제약과 반드시 맞춰야 함) ----
    public static final int TOKEN_HASH_LEN = 64;      // sha256 hex
    public static final int USER_AGENT_MAX = 255;
    public static final int IP_ADDRESS_MAX = 45;      // IPv6 최대 길이

    private static final String HEX64_REGEX = "^[0-9a-f]{64}$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, updatable = false, length = TOKEN_HASH_LEN, columnDefinition = "char(64)")
    private String tokenHash;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private LocalDateTime issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private LocalDateTime expiresAt;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    // 감사용. 엔진의 판단 기준은 revoked_at 하나뿐이다.
    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 30)
    private RefreshRevokeReason revokeReason;

    // 로테이션으로 이 row를 대체한 새 row의 id
    @Column(name = "replaced_by_id")
    private Long replacedById;

    // ---- audit only (인가 판단에 쓰지 않음) ----
    @Column(name = "user_agent", length = USER_AGENT_MAX, updatable = false)
    private String userAgent;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX, updatable = false)
    private String ipAddress;


    // ========= factory =========

    // 발급 팩토리 메서드 (referenced by RefreshTokenService.class)
    public static RefreshToken issue(
            Long userId,
            String tokenHash,
            LocalDateTime now,
            LocalDateTime expiresAt,
            ClientOrigin origin
    ) {
        require(userId != null, "userId must not be null");
        require(now != null, "now must not be null");
        require(expiresAt != null, "expiresAt must not be null");
        require(expiresAt.isAfter(now), "expiresAt must be after now");

        String h = requireTokenHash(tokenHash);
        ClientOrigin o = (origin == null) ? ClientOrigin.unknown() : origin;

        RefreshToken rt = new RefreshToken();
        rt.userId = userId;
        rt.tokenHash = h;
        rt.issuedAt = now;
        rt.expiresAt = expiresAt;
        rt.userAgent = trimToNullAndMax(o.userAgent(), USER_AGENT_MAX);
        rt.ipAddress = trimToNullAndMax(o.ipAddress(), IP_ADDRESS_MAX);
        return rt;
    }

    /**
     * revoke: 멱등. 이미 revoked면 변경하지 않는다.
     * (rotate/logout 동시성은 store의 SELECT ... FOR UPDATE로 직렬화한다.)
     */
    public void revoke(LocalDateTime now, RefreshRevokeReason reason) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(reason, "reason must not be null");

        if (this.revokedAt != null) return;
        this.revokedAt = now;
        this.revokeReason = reason;
    }

    /**
     * 로테이션 폐기: revoked_at + replaced_by_id를 한 번에 세팅한다.
     * 이미 폐기된 row에 호출되면 호출자 버그이므로 예외.
     */
    public void markRotated(LocalDateTime now, RefreshToken successor) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(successor, "successor must not be null");
        require(successor.getId() != null, "successor must be persisted first");
        require(userId.equals(successor.getUserId()), "successor must belong to the same user");
        if (isRevoked()) {
            throw new IllegalStateException("refresh token already revoked: id=" + id);
        }

        this.revokedAt = now;
        this.revokeReason = RefreshRevokeReason.ROTATED;
        this.replacedById = successor.getId();
    }


    // ========= domain =========

    /** now가 expires_at을 "지난" 경우만 만료 (경계값 now == expires_at 은 아직 유효) */
    public boolean isExpired(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        return now.isAfter(expiresAt);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isActive(LocalDateTime now) {
        return !isRevoked() && !isExpired(now);
    }


    // ========= helpers =========
    private static String requireTokenHash(String tokenHash) {
        require(tokenHash != null, "tokenHash must not be null");
        String h = tokenHash.trim();
        require(h.length() == TOKEN_HASH_LEN, "tokenHash must be 64 chars");
        require(h.matches(HEX64_REGEX), "tokenHash must be lowercase hex(64)");
        return h;
    }

    private static String trimToNullAndMax(String v, int max) {
        if (v == null) return null;
        String t = v.trim();
        if (t.isEmpty()) return null;
        return t.length() <= max ? t : t.substring(0, max);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
