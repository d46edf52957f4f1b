package com.my.logbook.domain.model;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 동기화로 얻은 일정 하나를 출처 계정 정보와 함께 표현하기 위함. 저장하지 않는 일시적 값이다.
 */
public record CalendarEvent(
        String id,
        String title,
        OffsetDateTime start,
        OffsetDateTime end,
        String description,
        String location,
        List<String> attendees,
        boolean allDay,
        CalendarProvider sourceProvider,
        String sourceAccountId,
        String sourceAccountName
) {
    public static final String UNTITLED = "No Title";

    public static final Comparator<CalendarEvent> BY_START = Comparator.comparing(CalendarEvent::start);

    public CalendarEvent {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(sourceProvider, "sourceProvider");
        title = title == null || title.isBlank() ? UNTITLED : title;
        description = description == null ? "" : description;
        location = location == null ? "" : location;
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
    }
}
