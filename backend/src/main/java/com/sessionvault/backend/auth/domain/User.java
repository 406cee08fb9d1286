package com.sessionvault.backend.auth.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * users 테이블 = 세션 엔진이 참조하는 "신원 저장소"
 *
 * 가입/프로필 수정은 이 서비스의 범위 밖이고, 여기서는 읽기 위주로 쓴다.
 *
 * 로그인 흐름:
 * - AuthSessionService.login()에서 email로 조회 → password_hash 비교 → status 확인
 *
 * 로테이션 흐름:
 * - RefreshTokenService.rotate()에서 id로 다시 조회해 최신 role/status를 읽는다.
 *   (role 변경은 다음 refresh 때 access token에 반영된다)
 *
 * 삭제:
 * - refresh_tokens.user_id FK가 ON DELETE CASCADE 라서 유저 삭제 시 세션 row도 같이 사라진다.
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uq_users_nickname", columnNames = "nickname")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // PK. JWT의 sub(subject), refresh_tokens.user_id

    @Column(nullable = false, length = 255)
    private String email; // 로그인 ID (Unique, 소문자 normalize 상태로 저장)

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // BCrypt 해시 (원문 저장 금지)

    @Column(nullable = false, length = 30) 
    private String nickname;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role; // access token의 role 클레임

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status; // ACTIVE만 로그인/로테이션 허용

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    public static User create(String email, String passwordHash, String nickname) {
        return create(email, passwordHash, nickname, UserRole.USER);
    }

    public static User create(String email, String passwordHash, String nickname, UserRole role) {
        User u = new User();
        u.email = email;
        u.passwordHash = passwordHash;
        u.nickname = nickname;
        u.role = role;
        u.status = UserStatus.ACTIVE;
        u.lastLoginAt = null;
        return u;
    }

    public void markLoggedIn(LocalDateTime now) {
        lastLoginAt = now;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public Long getId() {return id;}
    public UserStatus getStatus() {return status;}
    public UserRole getRole() {return role;}
    public String getPasswordHash() {return passwordHash;}
    public String getEmail() {return email;}
    public String getNickname() {return nickname;}
    public LocalDateTime getLastLoginAt() {return lastLoginAt;}
}
