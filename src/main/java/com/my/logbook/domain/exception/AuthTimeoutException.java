package com.my.logbook.domain.exception;

import com.my.logbook.domain.model.CalendarProvider;

import java.time.Duration;

public class AuthTimeoutException extends AuthFlowException {

    public AuthTimeoutException(CalendarProvider provider, Duration timeout) {
        super(provider, provider.key() + " 인증 시간이 초과되었습니다(" + timeout.toSeconds() + "초). 다시 시도해주세요.");
    }
}
