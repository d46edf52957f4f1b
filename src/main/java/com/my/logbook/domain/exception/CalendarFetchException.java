package com.my.logbook.domain.exception;

/**
 * 왜: 한 계정의 일정 조회 실패를 표현해 동기화 집계에서 해당 계정만 실패로 기록하기 위함.
 */
public class CalendarFetchException extends RuntimeException {
    public CalendarFetchException(String message) {
        super(message);
    }

    public CalendarFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
