package com.my.logbook.adapter.in.rest;

import com.my.logbook.config.AppConfig;
import com.my.logbook.domain.exception.AccountNotFoundException;
import com.my.logbook.domain.model.AccountPatch;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarEvent;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.ConnectionTestResult;
import com.my.logbook.domain.model.EntryDraft;
import com.my.logbook.domain.model.PendingAuthorization;
import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.model.SyncResult;
import com.my.logbook.domain.model.SyncSettings;
import com.my.logbook.domain.model.SyncStatusReport;
import com.my.logbook.domain.port.in.LinkCalendarUseCase;
import com.my.logbook.domain.port.out.ClockPort;
import com.my.logbook.domain.service.CalendarRegistry;
import com.my.logbook.domain.service.EventConverter;
import com.my.logbook.domain.service.SyncScheduler;
import com.my.logbook.domain.service.SyncStatusResolver;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 계정 연결, 설정 변경, 동기화 실행을 HTTP로 노출해 화면 쪽이 도메인 서비스를 직접 알지 않도록 하기 위함.
 */
@Path("/calendar")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CalendarResource {

    private static final Logger log = Logger.getLogger(CalendarResource.class);

    private final LinkCalendarUseCase linkCalendarUseCase;
    private final CalendarRegistry registry;
    private final SyncScheduler syncScheduler;
    private final SyncStatusResolver statusResolver;
    private final EventConverter eventConverter;
    private final ClockPort clockPort;
    private final long authTimeoutSeconds;

    @Inject
    public CalendarResource(LinkCalendarUseCase linkCalendarUseCase,
                            CalendarRegistry registry,
                            SyncScheduler syncScheduler,
                            SyncStatusResolver statusResolver,
                            EventConverter eventConverter,
                            ClockPort clockPort,
                            AppConfig appConfig) {
        this.linkCalendarUseCase = linkCalendarUseCase;
        this.registry = registry;
        this.syncScheduler = syncScheduler;
        this.statusResolver = statusResolver;
        this.eventConverter = eventConverter;
        this.clockPort = clockPort;
        this.authTimeoutSeconds = appConfig.calendar().authTimeoutSeconds();
    }

    /**
     * 인증 창을 띄우고 바로 반환한다. 연결 결과는 계정 목록으로 확인한다.
     */
    @POST
    @Path("/link/{provider}")
    public Response link(@PathParam("provider") String providerKey) {
        CalendarProvider provider = CalendarProvider.fromKey(providerKey);
        PendingAuthorization pending = linkCalendarUseCase.initiate(provider);
        pending.result().whenComplete((account, error) -> {
            if (error != null) {
                log.infof("%s 캘린더 연결이 완료되지 않았습니다: %s", provider.key(), error.getMessage());
            }
        });
        return Response.accepted(new LinkResponse(provider.key(), pending.authorizationUrl().toString(), authTimeoutSeconds))
                .build();
    }

    @GET
    @Path("/accounts")
    public List<AccountView> accounts() {
        return registry.listAccounts().stream()
                .map(AccountView::from)
                .toList();
    }

    @PATCH
    @Path("/accounts/{id}")
    public AccountView updateAccount(@PathParam("id") String accountId, AccountPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("수정할 내용이 없습니다.");
        }
        return AccountView.from(registry.updateAccount(accountId, patch));
    }

    @DELETE
    @Path("/accounts/{id}")
    public Response removeAccount(@PathParam("id") String accountId) {
        if (!registry.removeAccount(accountId)) {
            throw new AccountNotFoundException(accountId);
        }
        return Response.noContent().build();
    }

    @PUT
    @Path("/settings")
    public SettingsView updateSettings(SyncSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("변경할 설정이 없습니다.");
        }
        return SettingsView.from(registry.updateSettings(settings));
    }

    @GET
    @Path("/settings")
    public SettingsView settings() {
        return SettingsView.from(registry.getConfig());
    }

    @DELETE
    public Response reset() {
        registry.reset();
        return Response.noContent().build();
    }

    @POST
    @Path("/sync")
    public CompletionStage<SyncResult> sync() {
        return syncScheduler.syncAll();
    }

    @GET
    @Path("/upcoming")
    public CompletionStage<List<CalendarEvent>> upcoming(@QueryParam("hours") @DefaultValue("24") int hours) {
        return syncScheduler.getUpcomingEvents(hours);
    }

    @GET
    @Path("/test")
    public CompletionStage<ConnectionTestResult> testConnection() {
        return syncScheduler.testConnection();
    }

    @GET
    @Path("/status")
    public SyncStatusReport status() {
        return statusResolver.resolve(registry.getConfig(), clockPort.now(), syncScheduler.lastSyncFailed());
    }

    @POST
    @Path("/entries")
    public List<EntryDraft> toEntries(List<CalendarEvent> events) {
        if (events == null) {
            return List.of();
        }
        return events.stream()
                .map(eventConverter::toEntry)
                .toList();
    }

    public record LinkResponse(String provider, String authorizationUrl, long expiresInSeconds) {
    }

    /**
     * 토큰을 제외한 계정 정보.
     */
    public record AccountView(String id,
                              CalendarProvider provider,
                              String displayName,
                              String email,
                              String calendarRef,
                              boolean enabled,
                              OffsetDateTime linkedAt,
                              OffsetDateTime updatedAt) {
        static AccountView from(CalendarAccount account) {
            return new AccountView(account.id(), account.provider(), account.displayName(), account.email(),
                    account.calendarRef(), account.enabled(), account.linkedAt(), account.updatedAt());
        }
    }

    public record SettingsView(boolean enabled,
                               int accountCount,
                               int syncIntervalMinutes,
                               OffsetDateTime lastSyncAt,
                               boolean autoCreateEntries,
                               boolean includeAllDayEvents,
                               int pastWindowDays,
                               int futureWindowDays) {
        static SettingsView from(SyncConfig config) {
            return new SettingsView(config.enabled(), config.accounts().size(), config.syncIntervalMinutes(),
                    config.lastSyncAt(), config.autoCreateEntries(), config.includeAllDayEvents(),
                    config.pastWindowDays(), config.futureWindowDays());
        }
    }
}
