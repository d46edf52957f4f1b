package com.my.logbook.domain.model;

/**
 * 왜: 동기화 중 실패한 계정을 결과에 남겨 다음 주기 재시도와 사용자 안내에 쓰기 위함.
 */
public record AccountFailure(CalendarProvider provider, String accountId, String accountName, String error) {
}
