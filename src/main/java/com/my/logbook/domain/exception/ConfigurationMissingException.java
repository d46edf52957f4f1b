package com.my.logbook.domain.exception;

import com.my.logbook.domain.model.CalendarProvider;

/**
 * 왜: 클라이언트 ID 같은 필수 설정이 없을 때 인증 창을 열기 전에 명확히 실패시키기 위함.
 */
public class ConfigurationMissingException extends RuntimeException {

    private final CalendarProvider provider;

    public ConfigurationMissingException(CalendarProvider provider, String setting) {
        super(provider.key() + " OAuth 설정이 없습니다. " + setting + " 값을 설정해주세요.");
        this.provider = provider;
    }

    public CalendarProvider provider() {
        return provider;
    }
}
