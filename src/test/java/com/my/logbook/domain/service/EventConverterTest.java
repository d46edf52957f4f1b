package com.my.logbook.domain.service;

import com.my.logbook.domain.model.CalendarEvent;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.EntryDraft;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventConverterTest {

    private static final OffsetDateTime START = OffsetDateTime.of(2026, 3, 2, 10, 0, 0, 0, ZoneOffset.ofHours(9));

    private final EventConverter converter = new EventConverter();

    @Test
    void convertsMeetingToEntryDraft() {
        CalendarEvent event = new CalendarEvent("evt-1", "Weekly sync", START, START.plusMinutes(45),
                "Agenda", "Room 3", List.of("bob@example.com"), false,
                CalendarProvider.MICROSOFT, "cal_1", "Work");

        EntryDraft entry = converter.toEntry(event);

        assertThat(entry.type()).isEqualTo("Meeting");
        assertThat(entry.content()).isEqualTo("Weekly sync - Agenda");
        assertThat(entry.project()).isEqualTo("Calendar Sync");
        assertThat(entry.tags()).containsExactly("microsoft", "calendar", "meeting");
        assertThat(entry.jira()).isEmpty();
        assertThat(entry.people()).containsExactly("bob@example.com");
        assertThat(entry.metadata().sourceEventId()).isEqualTo("evt-1");
        assertThat(entry.metadata().provider()).isEqualTo(CalendarProvider.MICROSOFT);
        assertThat(entry.metadata().location()).isEqualTo("Room 3");
        assertThat(entry.metadata().duration()).isEqualTo(45);
        assertThat(entry.metadata().raw()).isSameAs(event);
    }

    @Test
    void omitsEmptyDescriptionFromContent() {
        CalendarEvent event = new CalendarEvent("evt-2", null, START, START.plusSeconds(90),
                null, null, null, false, CalendarProvider.GOOGLE, "cal_1", "Work");

        EntryDraft entry = converter.toEntry(event);

        assertThat(entry.content()).isEqualTo(CalendarEvent.UNTITLED);
        assertThat(entry.metadata().duration()).isEqualTo(2);
        assertThat(converter.toEntry(event)).isEqualTo(entry);
    }

    @Test
    void durationCoversZeroLengthAndMultiDayEvents() {
        CalendarEvent instant = new CalendarEvent("evt-3", "Reminder", START, START,
                null, null, null, false, CalendarProvider.GOOGLE, "cal_1", "Work");
        CalendarEvent offsite = new CalendarEvent("evt-4", "Offsite", START, START.plusDays(2).plusHours(3),
                null, null, null, false, CalendarProvider.GOOGLE, "cal_1", "Work");

        assertThat(converter.toEntry(instant).metadata().duration()).isZero();
        assertThat(converter.toEntry(offsite).metadata().duration()).isEqualTo(2 * 24 * 60 + 180);
    }
}
