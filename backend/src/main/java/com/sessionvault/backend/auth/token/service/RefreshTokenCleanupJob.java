package com.sessionvault.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.sessionvault.backend.auth.config.AuthProperties;
import com.sessionvault.backend.auth.token.store.RefreshTokenStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 만료된 refresh row 정리 배치
 *
 * - expires_at < (now - retention) 인 row를 삭제한다.
 * - 만료 판정은 요청 시점에 타임스탬프 비교로 하므로, 이 배치가 돌지 않아도 정합성에는 영향이 없다.
 * - retention 동안은 만료 직후의 ROTATED row가 남아 있어서, 그 토큰의 재제출도 재사용으로 감지된다.
 * - cron = "-" 이면 비활성화 (테스트 프로필)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefreshTokenCleanupJob {

    private final RefreshTokenStore refreshTokenStore;
    private final AuthProperties props;
    private final Clock clock;

    @Scheduled(cron = "${app.auth.refresh.cleanup.cron}")
    @Transactional
    public int sweep() {
        LocalDateTime cutoff = LocalDateTime.now(clock)
                .minusSeconds(props.refresh().cleanup().retentionSeconds());

        int deleted = refreshTokenStore.deleteExpiredBefore(cutoff);
        log.info("만료 refresh token 정리: cutoff={}, deleted={}", cutoff, deleted);
        return deleted;
    }
}
