package com.my.logbook.config;

import com.my.logbook.adapter.out.clock.OffsetClockAdapter;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.port.out.AuthWindowPort;
import com.my.logbook.domain.port.out.CalendarProviderPort;
import com.my.logbook.domain.port.out.ClockPort;
import com.my.logbook.domain.port.out.ConfigStorePort;
import com.my.logbook.domain.port.out.OAuthMessageChannel;
import com.my.logbook.domain.service.AuthorizationCoordinator;
import com.my.logbook.domain.service.AuthorizationStateRegistry;
import com.my.logbook.domain.service.CalendarRegistry;
import com.my.logbook.domain.service.EventConverter;
import com.my.logbook.domain.service.EventFetcher;
import com.my.logbook.domain.service.OAuthCallbackService;
import com.my.logbook.domain.service.SyncScheduler;
import com.my.logbook.domain.service.SyncStatusResolver;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    private static final Logger log = Logger.getLogger(DomainConfig.class);

    private volatile ScheduledExecutorService authTimer;
    private volatile ExecutorService fetchPool;

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.of(ZoneId.of(appConfig.timezone()));
    }

    @Produces
    @Singleton
    public CalendarRegistry calendarRegistry(ConfigStorePort configStorePort, ClockPort clockPort) {
        return new CalendarRegistry(configStorePort, clockPort);
    }

    /**
     * 시간 초과로 대기를 포기한 뒤에도 늦게 온 콜백을 전역 리스너가 받을 수 있도록 state 는 인증 대기 시간의 두 배 동안 유효하다.
     */
    @Produces
    @Singleton
    public AuthorizationStateRegistry authorizationStateRegistry(ClockPort clockPort, AppConfig appConfig) {
        return new AuthorizationStateRegistry(clockPort,
                Duration.ofSeconds(appConfig.calendar().authTimeoutSeconds()).multipliedBy(2));
    }

    @Produces
    @Singleton
    @Startup
    public AuthorizationCoordinator authorizationCoordinator(Instance<CalendarProviderPort> providerPorts,
                                                             AuthWindowPort authWindowPort,
                                                             OAuthMessageChannel messageChannel,
                                                             CalendarRegistry registry,
                                                             AuthorizationStateRegistry stateRegistry,
                                                             AppConfig appConfig) {
        authTimer = Executors.newSingleThreadScheduledExecutor(daemonThreads("oauth-timeout-"));
        AuthorizationCoordinator coordinator = new AuthorizationCoordinator(
                byProvider(providerPorts),
                authWindowPort,
                messageChannel,
                registry,
                stateRegistry,
                authTimer,
                Duration.ofSeconds(appConfig.calendar().authTimeoutSeconds()));
        coordinator.registerGlobalListener();
        return coordinator;
    }

    @Produces
    @Singleton
    public OAuthCallbackService oauthCallbackService(Instance<CalendarProviderPort> providerPorts,
                                                     OAuthMessageChannel messageChannel,
                                                     AuthorizationStateRegistry stateRegistry) {
        return new OAuthCallbackService(byProvider(providerPorts), messageChannel, stateRegistry);
    }

    @Produces
    @Singleton
    public SyncScheduler syncScheduler(Instance<CalendarProviderPort> providerPorts,
                                       CalendarRegistry registry,
                                       ClockPort clockPort,
                                       AppConfig appConfig) {
        fetchPool = Executors.newFixedThreadPool(appConfig.calendar().fetchParallelism(), daemonThreads("calendar-fetch-"));
        return new SyncScheduler(
                registry,
                new EventFetcher(byProvider(providerPorts)),
                clockPort,
                fetchPool,
                Duration.ofSeconds(appConfig.calendar().fetchTimeoutSeconds()));
    }

    @Produces
    @Singleton
    public SyncStatusResolver syncStatusResolver() {
        return new SyncStatusResolver();
    }

    @Produces
    @Singleton
    public EventConverter eventConverter() {
        return new EventConverter();
    }

    @PreDestroy
    void stop() {
        shutdown(authTimer, "oauth-timeout");
        shutdown(fetchPool, "calendar-fetch");
    }

    private static void shutdown(ExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        log.infof("%s 실행기를 종료했습니다.", name);
    }

    private static Map<CalendarProvider, CalendarProviderPort> byProvider(Instance<CalendarProviderPort> ports) {
        Map<CalendarProvider, CalendarProviderPort> byProvider = new EnumMap<>(CalendarProvider.class);
        for (CalendarProviderPort port : ports) {
            byProvider.put(port.provider(), port);
        }
        return byProvider;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
