package com.my.logbook.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 왜: 동기화 설정 전체를 하나의 불변 스냅샷으로 다뤄 레지스트리가 교체 방식으로만 갱신하도록 하기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncConfig(
        boolean enabled,
        List<CalendarAccount> accounts,
        int syncIntervalMinutes,
        OffsetDateTime lastSyncAt,
        boolean autoCreateEntries,
        boolean includeAllDayEvents,
        int pastWindowDays,
        int futureWindowDays
) {
    public static final int DEFAULT_SYNC_INTERVAL_MINUTES = 15;
    public static final int DEFAULT_PAST_WINDOW_DAYS = 7;
    public static final int DEFAULT_FUTURE_WINDOW_DAYS = 30;

    public SyncConfig {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public static SyncConfig defaults() {
        return new SyncConfig(false, List.of(), DEFAULT_SYNC_INTERVAL_MINUTES, null,
                true, false, DEFAULT_PAST_WINDOW_DAYS, DEFAULT_FUTURE_WINDOW_DAYS);
    }

    public SyncConfig withAccounts(List<CalendarAccount> updated) {
        return new SyncConfig(!updated.isEmpty(), updated, syncIntervalMinutes, lastSyncAt,
                autoCreateEntries, includeAllDayEvents, pastWindowDays, futureWindowDays);
    }

    public SyncConfig withLastSyncAt(OffsetDateTime timestamp) {
        return new SyncConfig(enabled, accounts, syncIntervalMinutes, timestamp,
                autoCreateEntries, includeAllDayEvents, pastWindowDays, futureWindowDays);
    }

    public SyncConfig withSettings(SyncSettings settings) {
        return new SyncConfig(enabled, accounts,
                settings.syncIntervalMinutes() != null ? settings.syncIntervalMinutes() : syncIntervalMinutes,
                lastSyncAt,
                settings.autoCreateEntries() != null ? settings.autoCreateEntries() : autoCreateEntries,
                settings.includeAllDayEvents() != null ? settings.includeAllDayEvents() : includeAllDayEvents,
                settings.pastWindowDays() != null ? settings.pastWindowDays() : pastWindowDays,
                settings.futureWindowDays() != null ? settings.futureWindowDays() : futureWindowDays);
    }
}
