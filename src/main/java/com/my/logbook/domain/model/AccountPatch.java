package com.my.logbook.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.OffsetDateTime;

/**
 * 왜: 계정 수정 요청에서 바꿀 필드만 골라 병합하기 위함. null 필드는 기존 값을 유지한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountPatch(
        String displayName,
        String accessToken,
        String refreshToken,
        String calendarRef,
        Boolean enabled
) {
    public static AccountPatch enabled(boolean enabled) {
        return new AccountPatch(null, null, null, null, enabled);
    }

    public CalendarAccount applyTo(CalendarAccount account, OffsetDateTime now) {
        return account.apply(this, now);
    }
}
