package com.my.logbook.domain.service;

import com.my.logbook.domain.exception.SyncInProgressException;
import com.my.logbook.domain.exception.SyncNotConfiguredException;
import com.my.logbook.domain.model.AccountPatch;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarEvent;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.ConnectionTestResult;
import com.my.logbook.domain.model.ProviderEvent;
import com.my.logbook.domain.model.SyncResult;
import com.my.logbook.domain.model.SyncSettings;
import com.my.logbook.domain.model.TimeRange;
import com.my.logbook.domain.model.TokenBundle;
import com.my.logbook.domain.port.out.CalendarProviderPort;
import com.my.logbook.domain.port.out.ClockPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SyncSchedulerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 2, 9, 0, 0, 0, ZoneOffset.ofHours(9));

    private CalendarProviderPort googlePort;
    private CalendarProviderPort microsoftPort;
    private InMemoryConfigStore store;
    private CalendarRegistry registry;
    private ClockPort clockPort;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        googlePort = mock(CalendarProviderPort.class);
        microsoftPort = mock(CalendarProviderPort.class);
        clockPort = mock(ClockPort.class);
        when(clockPort.now()).thenReturn(NOW);
        store = new InMemoryConfigStore();
        registry = new CalendarRegistry(store, clockPort);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void mergesSuccessfulAccountsWhenOneFails() throws Exception {
        addGoogle();
        CalendarAccount microsoft = addMicrosoft();
        when(googlePort.listEvents(eq("g-token"), eq("primary"), any())).thenReturn(List.of(
                event("g2", NOW.plusHours(3), false),
                event("g1", NOW.plusHours(1), false)));
        when(microsoftPort.listEvents(eq("m-token"), eq("primary"), any()))
                .thenThrow(new IllegalStateException("graph 503"));

        SyncResult result = scheduler(Duration.ofSeconds(5)).syncAll().get(2, TimeUnit.SECONDS);

        assertThat(result.successfulCount()).isEqualTo(1);
        assertThat(result.failedCount()).isEqualTo(1);
        assertThat(result.totalCount()).isEqualTo(2);
        assertThat(result.events()).extracting(CalendarEvent::id).containsExactly("g1", "g2");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.accountId()).isEqualTo(microsoft.id());
            assertThat(failure.error()).contains("graph 503");
        });
        assertThat(result.summary()).isEqualTo("1/2 calendars connected");
        assertThat(registry.getConfig().lastSyncAt()).isEqualTo(NOW);
    }

    @Test
    void fetchesEverySourceOverConfiguredWindow() throws Exception {
        addGoogle();
        registry.updateSettings(new SyncSettings(null, null, null, 3, 10));
        when(googlePort.listEvents(any(), any(), any())).thenReturn(List.of());

        scheduler(Duration.ofSeconds(5)).syncAll().get(2, TimeUnit.SECONDS);

        ArgumentCaptor<TimeRange> window = ArgumentCaptor.forClass(TimeRange.class);
        verify(googlePort).listEvents(eq("g-token"), eq("primary"), window.capture());
        assertThat(window.getValue()).isEqualTo(new TimeRange(NOW.minusDays(3), NOW.plusDays(10)));
    }

    @Test
    void recordsLastSyncEvenWhenEveryAccountFails() throws Exception {
        addGoogle();
        when(googlePort.listEvents(any(), any(), any())).thenThrow(new IllegalStateException("401"));
        SyncScheduler scheduler = scheduler(Duration.ofSeconds(5));

        SyncResult result = scheduler.syncAll().get(2, TimeUnit.SECONDS);

        assertThat(result.successfulCount()).isZero();
        assertThat(result.events()).isEmpty();
        assertThat(registry.getConfig().lastSyncAt()).isEqualTo(NOW);
        assertThat(scheduler.lastSyncFailed()).isTrue();
    }

    @Test
    void rejectsSecondSyncWhileOneIsRunning() throws Exception {
        addGoogle();
        CountDownLatch release = new CountDownLatch(1);
        when(googlePort.listEvents(any(), any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of(event("g1", NOW.plusHours(1), false));
        });
        SyncScheduler scheduler = scheduler(Duration.ofSeconds(5));

        CompletableFuture<SyncResult> first = scheduler.syncAll();
        assertThat(scheduler.isSyncInProgress()).isTrue();
        assertThatThrownBy(scheduler::syncAll).isInstanceOf(SyncInProgressException.class);

        release.countDown();
        assertThat(first.get(2, TimeUnit.SECONDS).events()).hasSize(1);
        await().atMost(Duration.ofSeconds(1)).until(() -> !scheduler.isSyncInProgress());
        assertThat(scheduler.syncAll().get(2, TimeUnit.SECONDS).successfulCount()).isEqualTo(1);
    }

    @Test
    void disabledRegistryCannotSync() {
        SyncScheduler scheduler = scheduler(Duration.ofSeconds(5));

        assertThatThrownBy(scheduler::syncAll).isInstanceOf(SyncNotConfiguredException.class);
        assertThat(scheduler.getUpcomingEvents(24).join()).isEmpty();
        assertThat(scheduler.isSyncInProgress()).isFalse();
    }

    @Test
    void upcomingKeepsHalfOpenHorizon() {
        addGoogle();
        when(googlePort.listEvents(any(), any(), any())).thenReturn(List.of(
                event("past", NOW.minusHours(1), false),
                event("now", NOW, false),
                event("soon", NOW.plusHours(1), false),
                event("edge", NOW.plusHours(24), false)));

        List<CalendarEvent> upcoming = scheduler(Duration.ofSeconds(5)).getUpcomingEvents(24).join();

        assertThat(upcoming).extracting(CalendarEvent::id).containsExactly("now", "soon");
    }

    @Test
    void upcomingRejectsNonPositiveHours() {
        assertThatThrownBy(() -> scheduler(Duration.ofSeconds(5)).getUpcomingEvents(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void allDayEventsFollowSetting() {
        addGoogle();
        when(googlePort.listEvents(any(), any(), any())).thenReturn(List.of(
                event("timed", NOW.plusHours(2), false),
                event("holiday", NOW.plusDays(1), true)));
        SyncScheduler scheduler = scheduler(Duration.ofSeconds(5));

        assertThat(scheduler.syncAll().join().events()).extracting(CalendarEvent::id).containsExactly("timed");

        registry.updateSettings(new SyncSettings(null, null, true, null, null));
        assertThat(scheduler.syncAll().join().events()).extracting(CalendarEvent::id).containsExactly("timed", "holiday");
    }

    @Test
    void slowAccountTimesOutWithoutBlockingOthers() throws Exception {
        addGoogle();
        addMicrosoft();
        CountDownLatch release = new CountDownLatch(1);
        when(googlePort.listEvents(any(), any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        when(microsoftPort.listEvents(any(), any(), any())).thenReturn(List.of(event("m1", NOW.plusHours(1), false)));

        try {
            SyncResult result = scheduler(Duration.ofMillis(200)).syncAll().get(2, TimeUnit.SECONDS);

            assertThat(result.successfulCount()).isEqualTo(1);
            assertThat(result.events()).extracting(CalendarEvent::id).containsExactly("m1");
            assertThat(result.failures()).singleElement()
                    .satisfies(failure -> assertThat(failure.error()).contains("시간 초과"));
        } finally {
            release.countDown();
        }
    }

    @Test
    void cancellingSyncReleasesGuardWithoutRecordingLastSync() {
        addGoogle();
        CountDownLatch release = new CountDownLatch(1);
        when(googlePort.listEvents(any(), any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        SyncScheduler scheduler = scheduler(Duration.ofSeconds(5));

        try {
            CompletableFuture<SyncResult> running = scheduler.syncAll();
            assertThat(running.cancel(true)).isTrue();

            assertThat(scheduler.isSyncInProgress()).isFalse();
            assertThat(registry.getConfig().lastSyncAt()).isNull();
        } finally {
            release.countDown();
        }
    }

    @Test
    void skipsDisabledAccounts() {
        addGoogle();
        CalendarAccount microsoft = addMicrosoft();
        registry.updateAccount(microsoft.id(), AccountPatch.enabled(false));
        when(googlePort.listEvents(any(), any(), any())).thenReturn(List.of());

        SyncResult result = scheduler(Duration.ofSeconds(5)).syncAll().join();

        assertThat(result.totalCount()).isEqualTo(1);
        verify(microsoftPort, never()).listEvents(any(), any(), any());
    }

    @Test
    void connectionTestProbesNextDayWithoutTouchingLastSync() {
        addGoogle();
        when(googlePort.listEvents(any(), any(), any())).thenReturn(List.of(event("g1", NOW.plusHours(1), true)));

        ConnectionTestResult result = scheduler(Duration.ofSeconds(5)).testConnection().join();

        assertThat(result.success()).isTrue();
        assertThat(result.message()).isEqualTo("google 캘린더 서비스: 1/1 calendars connected");
        assertThat(result.events()).hasSize(1);
        assertThat(registry.getConfig().lastSyncAt()).isNull();
        ArgumentCaptor<TimeRange> window = ArgumentCaptor.forClass(TimeRange.class);
        verify(googlePort).listEvents(any(), any(), window.capture());
        assertThat(window.getValue()).isEqualTo(new TimeRange(NOW, NOW.plusHours(24)));
    }

    @Test
    void connectionTestWithoutAccountsFails() {
        ConnectionTestResult result = scheduler(Duration.ofSeconds(5)).testConnection().join();

        assertThat(result.success()).isFalse();
        assertThat(result.totalCount()).isZero();
    }

    private SyncScheduler scheduler(Duration fetchTimeout) {
        EventFetcher fetcher = new EventFetcher(Map.of(
                CalendarProvider.GOOGLE, googlePort,
                CalendarProvider.MICROSOFT, microsoftPort));
        return new SyncScheduler(registry, fetcher, clockPort, executor, fetchTimeout);
    }

    private CalendarAccount addGoogle() {
        return registry.addAccount(new TokenBundle(CalendarProvider.GOOGLE, "g-token", null, "alice@gmail.com", null));
    }

    private CalendarAccount addMicrosoft() {
        return registry.addAccount(new TokenBundle(CalendarProvider.MICROSOFT, "m-token", null, "alice@outlook.com", null));
    }

    private static ProviderEvent event(String id, OffsetDateTime start, boolean allDay) {
        return new ProviderEvent(id, "Meeting " + id, start, start.plusMinutes(30), null, null, List.of(), allDay);
    }
}
