package com.my.logbook.domain.exception;

import com.my.logbook.domain.model.CalendarProvider;

/**
 * 왜: 같은 제공자와 이메일 조합이 이미 연결되어 있음을 사용자에게 알리기 위함.
 */
public class DuplicateAccountException extends RuntimeException {

    private final CalendarProvider provider;
    private final String email;

    public DuplicateAccountException(CalendarProvider provider, String email) {
        super(provider.key() + " 캘린더(" + email + ")는 이미 연결되어 있습니다.");
        this.provider = provider;
        this.email = email;
    }

    public CalendarProvider provider() {
        return provider;
    }

    public String email() {
        return email;
    }
}
