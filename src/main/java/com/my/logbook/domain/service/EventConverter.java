package com.my.logbook.domain.service;

import com.my.logbook.domain.model.CalendarEvent;
import com.my.logbook.domain.model.EntryDraft;

import java.time.Duration;
import java.util.List;

/**
 * 왜: 캘린더 일정을 로그북 회의 항목 초안으로 옮기기 위함. 저장하지 않으므로 같은 일정에 몇 번 호출해도 같은 결과다.
 */
public class EventConverter {

    public static final String ENTRY_TYPE = "Meeting";
    public static final String PROJECT = "Calendar Sync";

    public EntryDraft toEntry(CalendarEvent event) {
        String content = event.description().isBlank()
                ? event.title()
                : event.title() + " - " + event.description();
        return new EntryDraft(
                ENTRY_TYPE,
                content,
                PROJECT,
                List.of(event.sourceProvider().key(), "calendar", "meeting"),
                List.of(),
                event.attendees(),
                new EntryDraft.EntryMetadata(
                        event.id(),
                        event.sourceProvider(),
                        event.location(),
                        durationMinutes(event),
                        event)
        );
    }

    static long durationMinutes(CalendarEvent event) {
        return Math.round(Duration.between(event.start(), event.end()).getSeconds() / 60.0);
    }
}
