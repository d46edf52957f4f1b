package com.my.logbook.domain.model;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 동기화 조회 구간을 반열린 구간 [start, end)로 묶어 검증하고 전달하기 위함.
 */
public record TimeRange(OffsetDateTime start, OffsetDateTime end) {
    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("종료 시간이 시작 시간보다 이를 수 없습니다.");
        }
    }

    public static TimeRange around(OffsetDateTime now, int pastDays, int futureDays) {
        return new TimeRange(now.minusDays(pastDays), now.plusDays(futureDays));
    }

    public static TimeRange following(OffsetDateTime now, Duration length) {
        return new TimeRange(now, now.plus(length));
    }

    public boolean contains(OffsetDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
