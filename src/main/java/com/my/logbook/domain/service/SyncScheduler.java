package com.my.logbook.domain.service;

import com.my.logbook.domain.exception.SyncInProgressException;
import com.my.logbook.domain.exception.SyncNotConfiguredException;
import com.my.logbook.domain.model.AccountFailure;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarEvent;
import com.my.logbook.domain.model.ConnectionTestResult;
import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.model.SyncResult;
import com.my.logbook.domain.model.TimeRange;
import com.my.logbook.domain.port.in.SyncCalendarsUseCase;
import com.my.logbook.domain.port.out.ClockPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 왜: 활성화된 모든 계정에 일정 조회를 병렬로 보내고, 한 계정의 실패가 나머지를 막지 않도록 결과를 모아 합치기 위함.
 * <p>
 * 동시에 하나의 syncAll 만 진행된다. 계정별 조회가 모두 끝난 뒤에 한 번만 정렬하고 마지막 동기화 시각을 기록한다.
 */
public class SyncScheduler implements SyncCalendarsUseCase {

    private static final Logger log = Logger.getLogger(SyncScheduler.class);
    private static final Duration PROBE_LENGTH = Duration.ofHours(24);

    private final CalendarRegistry registry;
    private final EventFetcher eventFetcher;
    private final ClockPort clockPort;
    private final Executor executor;
    private final Duration fetchTimeout;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile boolean lastSyncFailed = false;

    public SyncScheduler(CalendarRegistry registry,
                         EventFetcher eventFetcher,
                         ClockPort clockPort,
                         Executor executor,
                         Duration fetchTimeout) {
        this.registry = registry;
        this.eventFetcher = eventFetcher;
        this.clockPort = clockPort;
        this.executor = executor;
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public CompletableFuture<SyncResult> syncAll() {
        SyncConfig config = registry.getConfig();
        if (!config.enabled()) {
            throw new SyncNotConfiguredException();
        }
        if (!inFlight.compareAndSet(false, true)) {
            throw new SyncInProgressException();
        }
        OffsetDateTime now = clockPort.now();
        TimeRange window = TimeRange.around(now, config.pastWindowDays(), config.futureWindowDays());
        FanOut fanOut;
        try {
            fanOut = launch(enabledAccounts(config), window);
        } catch (RuntimeException e) {
            inFlight.set(false);
            throw e;
        }

        CompletableFuture<SyncResult> result = new CompletableFuture<>();
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                fanOut.cancel();
                log.info("캘린더 동기화가 취소되었습니다.");
            }
            inFlight.set(false);
        });
        fanOut.settled().whenComplete((outcomes, error) -> {
            if (result.isDone()) {
                return;
            }
            if (error != null) {
                lastSyncFailed = true;
                result.completeExceptionally(error);
                return;
            }
            SyncResult merged = merge(outcomes, config.includeAllDayEvents());
            try {
                // 전부 실패해도 시도 자체를 동기화로 기록한다.
                registry.setLastSync(now);
            } catch (RuntimeException e) {
                lastSyncFailed = true;
                result.completeExceptionally(e);
                return;
            }
            lastSyncFailed = merged.totalCount() > 0 && merged.successfulCount() == 0;
            log.infof("캘린더 동기화 완료: 일정 %d건, %s", merged.events().size(), merged.summary());
            result.complete(merged);
        });
        return result;
    }

    @Override
    public CompletableFuture<List<CalendarEvent>> getUpcomingEvents(int hours) {
        if (hours <= 0) {
            throw new IllegalArgumentException("조회 시간은 0보다 커야 합니다: " + hours);
        }
        if (!registry.getConfig().enabled()) {
            return CompletableFuture.completedFuture(List.of());
        }
        TimeRange horizon = TimeRange.following(clockPort.now(), Duration.ofHours(hours));
        return syncAll().thenApply(result -> result.events().stream()
                .filter(event -> horizon.contains(event.start()))
                .toList());
    }

    /**
     * 앞으로 24시간 구간을 조회해 계정별 연결 상태를 점검한다. 마지막 동기화 시각은 바꾸지 않는다.
     */
    @Override
    public CompletableFuture<ConnectionTestResult> testConnection() {
        SyncConfig config = registry.getConfig();
        if (!config.enabled() || config.accounts().isEmpty()) {
            return CompletableFuture.completedFuture(
                    ConnectionTestResult.failure("캘린더 동기화가 설정되지 않았습니다."));
        }
        TimeRange window = TimeRange.following(clockPort.now(), PROBE_LENGTH);
        String providers = config.accounts().stream()
                .map(account -> account.provider().key())
                .distinct()
                .collect(Collectors.joining(", "));
        return launch(enabledAccounts(config), window).settled().thenApply(outcomes -> {
            SyncResult merged = merge(outcomes, true);
            return new ConnectionTestResult(
                    merged.successfulCount() > 0,
                    providers + " 캘린더 서비스: " + merged.summary(),
                    merged.events(),
                    merged.successfulCount(),
                    merged.failedCount(),
                    merged.totalCount());
        });
    }

    public boolean isSyncInProgress() {
        return inFlight.get();
    }

    /**
     * 마지막 syncAll 이 저장에 실패했거나 대상 계정이 모두 실패했는지 여부.
     */
    public boolean lastSyncFailed() {
        return lastSyncFailed;
    }

    private static List<CalendarAccount> enabledAccounts(SyncConfig config) {
        return config.accounts().stream()
                .filter(CalendarAccount::enabled)
                .toList();
    }

    private FanOut launch(List<CalendarAccount> accounts, TimeRange window) {
        List<CompletableFuture<List<CalendarEvent>>> fetches = accounts.stream()
                .map(account -> CompletableFuture
                        .supplyAsync(() -> eventFetcher.fetch(account, window), executor)
                        .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS))
                .toList();
        List<CompletableFuture<AccountOutcome>> outcomes = new ArrayList<>(accounts.size());
        for (int i = 0; i < accounts.size(); i++) {
            CalendarAccount account = accounts.get(i);
            outcomes.add(fetches.get(i).handle((events, error) -> toOutcome(account, events, error)));
        }
        return new FanOut(fetches, outcomes);
    }

    private AccountOutcome toOutcome(CalendarAccount account, List<CalendarEvent> events, Throwable error) {
        if (error == null) {
            return new AccountOutcome(account, events, null);
        }
        String reason = describe(unwrap(error));
        log.warnf("캘린더 조회 실패: provider=%s account=%s error=%s", account.provider().key(), account.id(), reason);
        return new AccountOutcome(account, List.of(),
                new AccountFailure(account.provider(), account.id(), account.displayName(), reason));
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "조회 시간 초과(" + fetchTimeout.toSeconds() + "초)";
        }
        if (error instanceof CancellationException) {
            return "조회가 취소되었습니다.";
        }
        return Objects.requireNonNullElse(error.getMessage(), error.getClass().getSimpleName());
    }

    private static SyncResult merge(List<AccountOutcome> outcomes, boolean includeAllDayEvents) {
        List<CalendarEvent> events = outcomes.stream()
                .filter(AccountOutcome::succeeded)
                .flatMap(outcome -> outcome.events().stream())
                .filter(event -> includeAllDayEvents || !event.allDay())
                .sorted(CalendarEvent.BY_START)
                .toList();
        List<AccountFailure> failures = outcomes.stream()
                .filter(outcome -> !outcome.succeeded())
                .map(AccountOutcome::failure)
                .toList();
        int successful = outcomes.size() - failures.size();
        return new SyncResult(events, successful, failures.size(), outcomes.size(), failures);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private record AccountOutcome(CalendarAccount account, List<CalendarEvent> events, AccountFailure failure) {
        boolean succeeded() {
            return failure == null;
        }
    }

    private record FanOut(List<CompletableFuture<List<CalendarEvent>>> fetches,
                          List<CompletableFuture<AccountOutcome>> outcomes) {

        CompletableFuture<List<AccountOutcome>> settled() {
            return CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new))
                    .thenApply(ignored -> outcomes.stream().map(CompletableFuture::join).toList());
        }

        void cancel() {
            fetches.forEach(fetch -> fetch.cancel(true));
        }
    }
}
