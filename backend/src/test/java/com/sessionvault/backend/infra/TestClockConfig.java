package com.sessionvault.backend.infra;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 통합 테스트용 시계
 *
 * - access(15분) / refresh(1일) 만료, 보관 기간 sweep은 전부 이 시계를 앞으로 돌려서 재현한다.
 * - AbstractIntegrationTest가 매 테스트 전에 reset()으로 기준 시각에 되돌린다.
 */
@TestConfiguration
public class TestClockConfig {

    public static final ZoneId TEST_ZONE = ZoneId.of("Asia/Seoul");

    // 월요일 오전 9시 30분 (KST). 날짜가 넘어가는 만료 계산도 같이 보이도록 자정은 피한다.
    public static final Instant SESSION_EPOCH =
            LocalDateTime.of(2026, 3, 2, 9, 30).atZone(TEST_ZONE).toInstant();

    public static final MutableClock TEST_CLOCK = new MutableClock(SESSION_EPOCH, TEST_ZONE);

    public static void reset() {
        TEST_CLOCK.set(SESSION_EPOCH);
    }

    @Bean
    @Primary // AuthModuleConfig의 KST 시계 대신 주입
    Clock clock() {
        return TEST_CLOCK;
    }

    /**
     * 테스트 스레드와 MockMvc 요청 스레드가 같이 읽으므로 현재 시각은 AtomicReference로 들고 있는다.
     */
    public static final class MutableClock extends Clock {
        private final ZoneId zone;
        private final AtomicReference<Instant> current;

        public MutableClock(Instant start, ZoneId zone) {
            this.zone = zone;
            this.current = new AtomicReference<>(start);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId otherZone) {
            if (zone.equals(otherZone)) {
                return this;
            }
            return new MutableClock(current.get(), otherZone);
        }

        @Override
        public Instant instant() {
            return current.get();
        }

        public void set(Instant instant) {
            current.set(instant);
        }

        /** 만료 경계 테스트용. 음수 Duration은 받지 않는다. */
        public void advance(Duration step) {
            if (step.isNegative()) {
                throw new IllegalArgumentException("clock cannot move backwards: " + step);
            }
            current.updateAndGet(at -> at.plus(step));
        }
    }
}
