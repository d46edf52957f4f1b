package com.my.logbook.domain.exception;

public class SyncNotConfiguredException extends RuntimeException {
    public SyncNotConfiguredException() {
        super("캘린더 동기화가 설정되지 않았습니다. 먼저 캘린더를 연결해주세요.");
    }
}
