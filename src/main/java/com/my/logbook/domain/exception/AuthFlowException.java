package com.my.logbook.domain.exception;

import com.my.logbook.domain.model.CalendarProvider;

/**
 * 왜: 사용자가 다시 시도하면 되는 인증 흐름 실패를 한 계열로 묶기 위함.
 */
public abstract class AuthFlowException extends RuntimeException {

    private final CalendarProvider provider;

    protected AuthFlowException(CalendarProvider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public CalendarProvider provider() {
        return provider;
    }
}
