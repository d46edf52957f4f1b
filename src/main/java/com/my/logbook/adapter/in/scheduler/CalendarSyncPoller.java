package com.my.logbook.adapter.in.scheduler;

import com.my.logbook.config.AppConfig;
import com.my.logbook.domain.exception.SyncInProgressException;
import com.my.logbook.domain.exception.SyncNotConfiguredException;
import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.model.SyncStatus;
import com.my.logbook.domain.port.out.ClockPort;
import com.my.logbook.domain.service.CalendarRegistry;
import com.my.logbook.domain.service.SyncScheduler;
import com.my.logbook.domain.service.SyncStatusResolver;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 자동 동기화를 켠 경우 마지막 동기화가 주기를 넘기면 백그라운드에서 다시 동기화하기 위함.
 * <p>
 * 주기는 실행 중에 바뀔 수 있으므로 1분마다 상태만 확인하고, 실제 동기화 여부는 상태 계산 결과로 정한다.
 */
@Startup
@ApplicationScoped
public class CalendarSyncPoller {

    private static final Logger log = Logger.getLogger(CalendarSyncPoller.class);
    private static final long CHECK_INTERVAL_SECONDS = 60;

    private final SyncScheduler syncScheduler;
    private final CalendarRegistry registry;
    private final SyncStatusResolver statusResolver;
    private final ClockPort clockPort;
    private final boolean autoSync;
    private ScheduledExecutorService executor;

    @Inject
    public CalendarSyncPoller(SyncScheduler syncScheduler,
                              CalendarRegistry registry,
                              SyncStatusResolver statusResolver,
                              ClockPort clockPort,
                              AppConfig appConfig) {
        this.syncScheduler = syncScheduler;
        this.registry = registry;
        this.statusResolver = statusResolver;
        this.clockPort = clockPort;
        this.autoSync = appConfig.calendar().autoSync();
    }

    @PostConstruct
    void start() {
        if (!autoSync) {
            log.info("자동 캘린더 동기화가 꺼져 있습니다.");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "calendar-sync-poller");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::pollSafely, CHECK_INTERVAL_SECONDS, CHECK_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    void pollSafely() {
        try {
            SyncConfig config = registry.getConfig();
            if (!config.enabled()) {
                return;
            }
            SyncStatus status = statusResolver.resolve(config, clockPort.now()).status();
            if (status != SyncStatus.NEVER_SYNCED && status != SyncStatus.STALE) {
                return;
            }
            syncScheduler.syncAll().whenComplete((result, error) -> {
                if (error != null) {
                    log.warnf("자동 캘린더 동기화 실패: %s", error.getMessage());
                }
            });
        } catch (SyncInProgressException | SyncNotConfiguredException e) {
            log.debugf("자동 캘린더 동기화 건너뜀: %s", e.getMessage());
        } catch (Exception e) {
            log.warnf("자동 캘린더 동기화 중 예외: %s", e.getMessage());
        }
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
