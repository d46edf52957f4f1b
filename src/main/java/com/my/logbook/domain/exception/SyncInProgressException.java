package com.my.logbook.domain.exception;

public class SyncInProgressException extends RuntimeException {
    public SyncInProgressException() {
        super("이미 캘린더 동기화가 진행 중입니다.");
    }
}
