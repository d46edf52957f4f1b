package com.my.logbook.domain.model;

import java.util.Objects;

/**
 * 왜: 인증 코드 교환 결과를 레지스트리에 넘길 단일 구조로 묶기 위함.
 */
public record TokenBundle(
        CalendarProvider provider,
        String accessToken,
        String refreshToken,
        String email,
        String name
) {
    public TokenBundle {
        Objects.requireNonNull(provider, "provider");
        email = email == null || email.isBlank() ? null : email.trim();
        name = name == null || name.isBlank() ? null : name.trim();
    }

    @Override
    public String toString() {
        return "TokenBundle[provider=" + provider.key() + ", email=" + email + ", name=" + name + "]";
    }
}
