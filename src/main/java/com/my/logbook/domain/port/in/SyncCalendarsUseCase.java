package com.my.logbook.domain.port.in;

import com.my.logbook.domain.model.CalendarEvent;
import com.my.logbook.domain.model.ConnectionTestResult;
import com.my.logbook.domain.model.SyncResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface SyncCalendarsUseCase {

    /**
     * 이미 진행 중인 동기화가 있으면 SyncInProgressException 으로 즉시 거절한다.
     */
    CompletableFuture<SyncResult> syncAll();

    CompletableFuture<List<CalendarEvent>> getUpcomingEvents(int hours);

    CompletableFuture<ConnectionTestResult> testConnection();
}
