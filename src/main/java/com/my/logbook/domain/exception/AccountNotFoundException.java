package com.my.logbook.domain.exception;

public class AccountNotFoundException extends RuntimeException {
    public AccountNotFoundException(String accountId) {
        super("캘린더 계정을 찾을 수 없습니다: " + accountId);
    }
}
