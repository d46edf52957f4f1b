package com.my.logbook.domain.exception;

/**
 * 왜: 설정 저장 실패를 호출자에게 알리되, 이전에 저장된 상태는 그대로 유효함을 보장하기 위함.
 */
public class ConfigPersistenceException extends RuntimeException {
    public ConfigPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
