package com.my.logbook.domain.port.out;

import com.my.logbook.domain.model.SyncConfig;

import java.util.Optional;

/**
 * 왜: 동기화 설정 blob 의 저장 매체를 추상화해 레지스트리만 이 포트를 통해 읽고 쓰도록 하기 위함.
 */
public interface ConfigStorePort {

    /**
     * 저장된 설정이 없으면 비어 있는 Optional 을 돌려준다.
     */
    Optional<SyncConfig> load();

    /**
     * 저장에 실패하면 {@link com.my.logbook.domain.exception.ConfigPersistenceException} 을 던지며,
     * 이때 이전에 저장된 내용은 손상되지 않아야 한다.
     */
    void save(SyncConfig config);
}
