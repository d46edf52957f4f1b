package com.my.logbook.domain.exception;

import com.my.logbook.domain.model.CalendarProvider;

public class AuthDeniedException extends AuthFlowException {

    private final String reason;

    public AuthDeniedException(CalendarProvider provider, String reason) {
        super(provider, provider.key() + " 인증이 거부되었습니다: " + reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
