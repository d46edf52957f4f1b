package com.my.logbook.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SyncStatus {
    DISABLED,
    NEVER_SYNCED,
    SYNCED,
    STALE,
    ERROR;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
