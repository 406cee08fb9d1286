package com.sessionvault.backend.auth.token.store;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import com.sessionvault.backend.auth.AbstractAuthIntegrationTest;
import com.sessionvault.backend.auth.domain.User;
import com.sessionvault.backend.auth.token.domain.ClientOrigin;
import com.sessionvault.backend.auth.token.domain.RefreshRevokeReason;
import com.sessionvault.backend.auth.token.domain.RefreshToken;
import com.sessionvault.backend.auth.token.exception.RefreshTokenConflictException;
import com.sessionvault.backend.auth.token.support.TokenHashUtils;

/**
 * 저장소 계약 (규칙 없이 영속성만) 검증.
 * 테스트마다 트랜잭션 롤백.
 */
@Transactional
@DisplayName("[Auth][Store] RefreshTokenStore 저장소 계약")
class RefreshTokenStoreIntegrationTest extends AbstractAuthIntegrationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 0, 0);

    @Autowired RefreshTokenStore store;

    private User user;

    @BeforeEach
    void setUp() {
        user = createDefaultUser();
    }

    @Test
    @DisplayName("insert: 같은 token_hash는 덮어쓰지 않고 RefreshTokenConflictException")
    void insert_rejects_duplicate_digest() {
        String digest = TokenHashUtils.sha256Hex("same-secret");
        RefreshToken first = store.insert(newRow(digest));

        assertThatThrownBy(() -> store.insert(newRow(digest)))
                .isInstanceOf(RefreshTokenConflictException.class);

        assertThat(first.getId()).isNotNull();
        assertThat(tokensOf(user.getId())).hasSize(1);
    }

    @Test
    @DisplayName("findActiveByDigest는 폐기 row를 숨기고, findAnyByDigest는 그대로 돌려준다")
    void active_lookup_hides_revoked_rows() {
        String digest = TokenHashUtils.sha256Hex("secret");
        RefreshToken row = store.insert(newRow(digest));

        assertThat(store.findActiveByDigest(digest)).isPresent();

        store.revoke(row, NOW, RefreshRevokeReason.LOGOUT);

        assertThat(store.findActiveByDigest(digest)).isEmpty();
        assertThat(store.findAnyByDigest(digest)).get()
                .extracting(RefreshToken::getRevokeReason)
                .isEqualTo(RefreshRevokeReason.LOGOUT);
        assertThat(store.findAnyByDigest(TokenHashUtils.sha256Hex("other"))).isEmpty();
    }

    @Test
    @DisplayName("supersede: 부모 revoked_at + replaced_by = 자식 id, 자식은 활성")
    void supersede_links_parent_to_child() {
        RefreshToken parent = store.insert(newRow(TokenHashUtils.sha256Hex("p")));
        RefreshToken child = store.insert(newRow(TokenHashUtils.sha256Hex("c")));

        store.supersede(parent, child, NOW);

        assertThat(parent.getReplacedById()).isEqualTo(child.getId());
        assertThat(child.getId()).isGreaterThan(parent.getId());
        assertThat(store.countActiveForOwner(user.getId(), NOW)).isEqualTo(1);
    }

    @Test
    @DisplayName("revokeAllActiveForOwner: 활성 row 수만 반환, 두 번째 호출은 0")
    void revoke_all_counts_only_active_rows() {
        store.insert(newRow(TokenHashUtils.sha256Hex("a")));
        store.insert(newRow(TokenHashUtils.sha256Hex("b")));
        RefreshToken done = store.insert(newRow(TokenHashUtils.sha256Hex("c")));
        store.revoke(done, NOW, RefreshRevokeReason.LOGOUT);

        assertThat(store.revokeAllActiveForOwner(user.getId(), NOW, RefreshRevokeReason.LOGOUT_ALL)).isEqualTo(2);
        assertThat(store.revokeAllActiveForOwner(user.getId(), NOW, RefreshRevokeReason.LOGOUT_ALL)).isZero();
        assertThat(store.countActiveForOwner(user.getId(), NOW)).isZero();
    }

    private RefreshToken newRow(String digest) {
        return RefreshToken.issue(user.getId(), digest, NOW, NOW.plusDays(1), ClientOrigin.unknown());
    }
}
