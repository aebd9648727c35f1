package com.ryuqq.agentica.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 직접 전진시키는 {@link Clock}.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class ManualClock extends Clock {

    private volatile Instant now;
    private final ZoneId zone;

    public ManualClock() {
        this(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    }

    public ManualClock(Instant start, ZoneId zone) {
        if (start == null || zone == null) {
            throw new IllegalArgumentException("start and zone cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    /**
     * 시계를 전진.
     *
     * @param duration 전진할 시간 (음수 불가)
     */
    public synchronized void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative (current: " + duration + ")");
        }
        now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ManualClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
