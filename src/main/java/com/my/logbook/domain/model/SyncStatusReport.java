package com.my.logbook.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 왜: 상태 값과 화면용 안내 문구, 마지막 동기화 시각을 함께 전달하기 위함.
 */
public record SyncStatusReport(SyncStatus status, String message, OffsetDateTime lastSyncAt) {
    public SyncStatusReport {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(message, "message");
    }
}
