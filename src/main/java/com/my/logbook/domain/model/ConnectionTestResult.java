package com.my.logbook.domain.model;

import java.util.List;

public record ConnectionTestResult(
        boolean success,
        String message,
        List<CalendarEvent> events,
        int successfulCount,
        int failedCount,
        int totalCount
) {
    public ConnectionTestResult {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ConnectionTestResult failure(String message) {
        return new ConnectionTestResult(false, message, List.of(), 0, 0, 0);
    }
}
