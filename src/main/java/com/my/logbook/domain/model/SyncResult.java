package com.my.logbook.domain.model;

import java.util.List;

/**
 * 왜: 부분 실패가 있어도 성공한 계정의 일정과 실패 건수를 함께 돌려주기 위함.
 */
public record SyncResult(
        List<CalendarEvent> events,
        int successfulCount,
        int failedCount,
        int totalCount,
        List<AccountFailure> failures
) {
    public SyncResult {
        events = events == null ? List.of() : List.copyOf(events);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static SyncResult empty() {
        return new SyncResult(List.of(), 0, 0, 0, List.of());
    }

    public String summary() {
        return successfulCount + "/" + totalCount + " calendars connected";
    }
}
