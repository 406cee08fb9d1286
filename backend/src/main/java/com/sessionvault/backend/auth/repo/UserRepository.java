package com.sessionvault.backend.auth.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.sessionvault.backend.auth.domain.User;

/**
 * 세션 엔진 입장에서의 외부 협력자 (신원 조회)
 * - findByEmail: 로그인 시 자격 증명 조회
 * - findById: 로테이션 시 최신 role/status 재조회
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);
}
