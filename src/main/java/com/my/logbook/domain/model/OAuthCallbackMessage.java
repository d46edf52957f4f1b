package com.my.logbook.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 인증 창이 콜백 이후 전달하는 구조화된 메시지를 표현하기 위함.
 * type 은 {@code <PROVIDER>_OAUTH_SUCCESS} 또는 {@code <PROVIDER>_OAUTH_ERROR} 형식이다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthCallbackMessage(
        String type,
        String accessToken,
        String refreshToken,
        String email,
        String name,
        String error
) {
    public OAuthCallbackMessage {
        Objects.requireNonNull(type, "type");
    }

    public static OAuthCallbackMessage success(TokenBundle bundle) {
        return new OAuthCallbackMessage(bundle.provider().successMessageType(),
                bundle.accessToken(), bundle.refreshToken(), bundle.email(), bundle.name(), null);
    }

    public static OAuthCallbackMessage error(CalendarProvider provider, String error) {
        return new OAuthCallbackMessage(provider.errorMessageType(), null, null, null, null, error);
    }

    public boolean isSuccessFor(CalendarProvider provider) {
        return provider.successMessageType().equals(type);
    }

    public boolean isErrorFor(CalendarProvider provider) {
        return provider.errorMessageType().equals(type);
    }

    /**
     * 성공 메시지일 때 해당 제공자를 돌려준다. 오류나 알 수 없는 타입이면 비어 있다.
     */
    public Optional<CalendarProvider> successProvider() {
        for (CalendarProvider provider : CalendarProvider.values()) {
            if (isSuccessFor(provider)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    public TokenBundle toTokenBundle(CalendarProvider provider) {
        return new TokenBundle(provider, accessToken, refreshToken, email, name);
    }

    @Override
    public String toString() {
        return "OAuthCallbackMessage[type=" + type + ", email=" + email + ", error=" + error + "]";
    }
}
