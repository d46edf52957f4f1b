package com.my.logbook.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 왜: 연동 가능한 캘린더 제공자를 고정된 집합으로 제한하고, 콜백 메시지 타입 접두사를 한 곳에서 관리하기 위함.
 */
public enum CalendarProvider {
    GOOGLE("google", "Google Calendar"),
    MICROSOFT("microsoft", "Microsoft Calendar");

    private final String key;
    private final String defaultDisplayName;

    CalendarProvider(String key, String defaultDisplayName) {
        this.key = key;
        this.defaultDisplayName = defaultDisplayName;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String defaultDisplayName() {
        return defaultDisplayName;
    }

    public String successMessageType() {
        return name() + "_OAUTH_SUCCESS";
    }

    public String errorMessageType() {
        return name() + "_OAUTH_ERROR";
    }

    @JsonCreator
    public static CalendarProvider fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("캘린더 제공자가 비어 있습니다.");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CalendarProvider provider : values()) {
            if (provider.key.equals(normalized)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("지원하지 않는 캘린더 제공자입니다: " + value);
    }
}
