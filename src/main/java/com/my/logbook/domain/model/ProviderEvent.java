package com.my.logbook.domain.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 왜: 제공자별 원본 이벤트를 공통 필드로만 옮겨 담아 EventFetcher가 출처 정보를 붙이기 전 단계로 쓰기 위함.
 */
public record ProviderEvent(
        String id,
        String title,
        OffsetDateTime start,
        OffsetDateTime end,
        String description,
        String location,
        List<String> attendees,
        boolean allDay
) {
    public ProviderEvent {
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
    }
}
