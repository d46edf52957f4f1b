package com.my.logbook.domain.service;

import com.my.logbook.domain.exception.CalendarFetchException;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarEvent;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.ProviderEvent;
import com.my.logbook.domain.model.TimeRange;
import com.my.logbook.domain.port.out.CalendarProviderPort;

import java.util.List;
import java.util.Map;

/**
 * 왜: 계정 하나의 일정을 제공자 API에서 가져와 출처 정보를 붙이고 시작 시각 순으로 정렬하기 위함.
 */
public class EventFetcher {

    private final Map<CalendarProvider, CalendarProviderPort> providerPorts;

    public EventFetcher(Map<CalendarProvider, CalendarProviderPort> providerPorts) {
        this.providerPorts = Map.copyOf(providerPorts);
    }

    public List<CalendarEvent> fetch(CalendarAccount account, TimeRange window) {
        if (account.accessToken() == null || account.accessToken().isBlank()) {
            throw new CalendarFetchException(account.provider().key() + " 캘린더의 액세스 토큰이 없습니다.");
        }
        CalendarProviderPort port = providerPorts.get(account.provider());
        if (port == null) {
            throw new CalendarFetchException("지원하지 않는 캘린더 제공자입니다: " + account.provider().key());
        }
        List<ProviderEvent> raw;
        try {
            raw = port.listEvents(account.accessToken(), account.calendarRef(), window);
        } catch (CalendarFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalendarFetchException(account.provider().key() + " 일정 조회 실패: " + e.getMessage(), e);
        }
        return raw.stream()
                .filter(event -> event.start() != null)
                .map(event -> tag(account, event))
                .sorted(CalendarEvent.BY_START)
                .toList();
    }

    private static CalendarEvent tag(CalendarAccount account, ProviderEvent event) {
        return new CalendarEvent(
                event.id(),
                event.title(),
                event.start(),
                event.end() != null ? event.end() : event.start(),
                event.description(),
                event.location(),
                event.attendees(),
                event.allDay(),
                account.provider(),
                account.id(),
                account.displayName()
        );
    }
}
