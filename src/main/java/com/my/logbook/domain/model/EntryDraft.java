package com.my.logbook.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 캘린더 일정을 로그북 항목 저장소가 받는 형태로 넘기기 위함. 저장은 저장소 쪽 책임이다.
 */
public record EntryDraft(
        String type,
        String content,
        String project,
        List<String> tags,
        List<String> jira,
        List<String> people,
        EntryMetadata metadata
) {
    public EntryDraft {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(metadata, "metadata");
        tags = tags == null ? List.of() : List.copyOf(tags);
        jira = jira == null ? List.of() : List.copyOf(jira);
        people = people == null ? List.of() : List.copyOf(people);
    }

    public record EntryMetadata(
            String sourceEventId,
            CalendarProvider provider,
            String location,
            long duration,
            CalendarEvent raw
    ) {
    }
}
