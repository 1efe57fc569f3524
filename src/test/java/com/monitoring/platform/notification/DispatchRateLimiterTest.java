package com.monitoring.platform.notification;

import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchRateLimiterTest {

    private MutableClock clock;
    private DispatchRateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(0L);
        limiter = new DispatchRateLimiter(clock, Duration.ofSeconds(300));
    }

    private static NotificationPayload payload(String source, String title) {
        return NotificationPayload.builder()
                .title(title)
                .message("m")
                .severity(Severity.HIGH)
                .source(source)
                .timestamp(Instant.EPOCH)
                .build();
    }

    @Test
    void limitsSameSourceAndTitleWithinWindow() {
        NotificationPayload p = payload("svcA", "X");
        assertThat(limiter.isRateLimited(p)).isFalse();
        limiter.recordSuccess(p);

        clock.set(Instant.ofEpochSecond(100));
        assertThat(limiter.isRateLimited(p)).isTrue();

        clock.set(Instant.ofEpochSecond(299));
        assertThat(limiter.isRateLimited(p)).isTrue();

        clock.set(Instant.ofEpochSecond(300));
        assertThat(limiter.isRateLimited(p)).isFalse();
    }

    @Test
    void reservationBlocksSameKeyUntilReleased() {
        NotificationPayload p = payload("svcA", "X");

        assertThat(limiter.tryAcquire(p)).isTrue();
        assertThat(limiter.tryAcquire(p)).isFalse();
        assertThat(limiter.tryAcquire(payload("svcA", "Y"))).isTrue();

        limiter.release(p);
        assertThat(limiter.tryAcquire(p)).isTrue();
    }

    @Test
    void recordedSuccessTurnsReservationIntoRateLimit() {
        NotificationPayload p = payload("svcA", "X");
        assertThat(limiter.tryAcquire(p)).isTrue();
        limiter.recordSuccess(p);
        limiter.release(p);

        clock.set(Instant.ofEpochSecond(100));
        assertThat(limiter.tryAcquire(p)).isFalse();

        clock.set(Instant.ofEpochSecond(300));
        assertThat(limiter.tryAcquire(p)).isTrue();
    }

    @Test
    void otherTitlesAndSourcesAreIndependent() {
        limiter.recordSuccess(payload("svcA", "X"));

        assertThat(limiter.isRateLimited(payload("svcA", "Y"))).isFalse();
        assertThat(limiter.isRateLimited(payload("svcB", "X"))).isFalse();
    }

    @Test
    void entriesOlderThanTwoWindowsArePrunedOnWrite() {
        limiter.recordSuccess(payload("svcA", "old"));
        clock.set(Instant.ofEpochSecond(400));
        limiter.recordSuccess(payload("svcA", "mid"));
        assertThat(limiter.size()).isEqualTo(2);

        clock.set(Instant.ofEpochSecond(600));
        limiter.recordSuccess(payload("svcA", "new"));

        assertThat(limiter.size()).isEqualTo(2);
    }
}
