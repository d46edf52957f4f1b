package com.my.logbook.domain.service;

import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.model.SyncStatus;
import com.my.logbook.domain.model.SyncStatusReport;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * 왜: 설정과 현재 시각만으로 화면에 보여줄 동기화 상태를 계산하기 위함. 부수 효과가 없다.
 */
public class SyncStatusResolver {

    static final Duration RECENT_THRESHOLD = Duration.ofMinutes(5);

    public SyncStatusReport resolve(SyncConfig config, OffsetDateTime now) {
        return resolve(config, now, false);
    }

    /**
     * @param hardError 호출자가 판단한 치명적 상태(예: 마지막 점검에서 모든 계정 실패). 경과 시간으로는 ERROR 를 만들지 않는다.
     */
    public SyncStatusReport resolve(SyncConfig config, OffsetDateTime now, boolean hardError) {
        if (!config.enabled()) {
            return new SyncStatusReport(SyncStatus.DISABLED, "캘린더 동기화가 비활성화되어 있습니다.", null);
        }
        if (hardError) {
            return new SyncStatusReport(SyncStatus.ERROR, "캘린더 연결 상태를 확인하는 중 오류가 발생했습니다.", config.lastSyncAt());
        }
        OffsetDateTime lastSync = config.lastSyncAt();
        if (lastSync == null) {
            return new SyncStatusReport(SyncStatus.NEVER_SYNCED, "아직 캘린더를 동기화한 적이 없습니다.", null);
        }
        Duration elapsed = Duration.between(lastSync, now);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        long minutes = elapsed.toMinutes();
        Duration interval = Duration.ofMinutes(config.syncIntervalMinutes());
        if (elapsed.compareTo(RECENT_THRESHOLD) < 0) {
            return new SyncStatusReport(SyncStatus.SYNCED, "방금 동기화했습니다.", lastSync);
        }
        if (elapsed.compareTo(interval) < 0) {
            return new SyncStatusReport(SyncStatus.SYNCED, minutes + "분 전에 동기화했습니다.", lastSync);
        }
        return new SyncStatusReport(SyncStatus.STALE, "마지막 동기화가 " + minutes + "분 전입니다.", lastSync);
    }
}
