package com.my.logbook.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 왜: 사용자가 조정할 수 있는 동기화 옵션만 분리해 계정 목록이나 활성 상태를 실수로 덮어쓰지 않게 하기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncSettings(
        Integer syncIntervalMinutes,
        Boolean autoCreateEntries,
        Boolean includeAllDayEvents,
        Integer pastWindowDays,
        Integer futureWindowDays
) {
    public SyncSettings {
        requirePositive("syncIntervalMinutes", syncIntervalMinutes);
        requireNonNegative("pastWindowDays", pastWindowDays);
        requireNonNegative("futureWindowDays", futureWindowDays);
    }

    private static void requirePositive(String name, Integer value) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(name + " 값은 0보다 커야 합니다: " + value);
        }
    }

    private static void requireNonNegative(String name, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " 값은 음수일 수 없습니다: " + value);
        }
    }
}
