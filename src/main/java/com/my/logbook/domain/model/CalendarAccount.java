package com.my.logbook.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Objects;

/**
 * 왜: 연결된 캘린더 계정 하나를 불변 값으로 표현해 레지스트리 밖에서 상태가 바뀌지 않도록 하기 위함.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalendarAccount(
        String id,
        CalendarProvider provider,
        String displayName,
        String email,
        String accessToken,
        String refreshToken,
        String calendarRef,
        boolean enabled,
        OffsetDateTime linkedAt,
        OffsetDateTime updatedAt
) {
    public static final String PRIMARY_CALENDAR = "primary";

    public CalendarAccount {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(provider, "provider");
        if (id.isBlank()) {
            throw new IllegalArgumentException("계정 ID는 비어 있을 수 없습니다.");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = provider.defaultDisplayName();
        }
        if (calendarRef == null || calendarRef.isBlank()) {
            calendarRef = PRIMARY_CALENDAR;
        }
    }

    public boolean sameIdentity(CalendarProvider otherProvider, String otherEmail) {
        if (email == null || otherEmail == null) {
            return false;
        }
        return provider == otherProvider
                && email.trim().toLowerCase(Locale.ROOT).equals(otherEmail.trim().toLowerCase(Locale.ROOT));
    }

    CalendarAccount apply(AccountPatch patch, OffsetDateTime now) {
        return new CalendarAccount(
                id,
                provider,
                patch.displayName() != null ? patch.displayName() : displayName,
                email,
                patch.accessToken() != null ? patch.accessToken() : accessToken,
                patch.refreshToken() != null ? patch.refreshToken() : refreshToken,
                patch.calendarRef() != null ? patch.calendarRef() : calendarRef,
                patch.enabled() != null ? patch.enabled() : enabled,
                linkedAt,
                now
        );
    }

    @Override
    public String toString() {
        // 토큰은 로그에 남기지 않는다.
        return "CalendarAccount[id=" + id + ", provider=" + provider.key() + ", email=" + email
                + ", displayName=" + displayName + ", enabled=" + enabled + "]";
    }
}
