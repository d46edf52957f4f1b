package com.my.logbook.domain.service;

import com.my.logbook.domain.exception.AccountNotFoundException;
import com.my.logbook.domain.exception.DuplicateAccountException;
import com.my.logbook.domain.model.AccountPatch;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.model.SyncSettings;
import com.my.logbook.domain.model.TokenBundle;
import com.my.logbook.domain.port.out.ClockPort;
import com.my.logbook.domain.port.out.ConfigStorePort;
import org.jboss.logging.Logger;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 동기화 설정의 유일한 소유자로서 계정 고유성, 활성 상태, 마지막 동기화 시각 규칙을 한 곳에서 지키기 위함.
 * <p>
 * 모든 변경은 내부 잠금 안에서 새 스냅샷을 만들어 저장한 뒤에만 교체한다. 저장에 실패하면 기존 스냅샷이 유지된다.
 */
public class CalendarRegistry {

    private static final Logger log = Logger.getLogger(CalendarRegistry.class);

    private final ConfigStorePort configStore;
    private final ClockPort clockPort;
    private final ReentrantLock gate = new ReentrantLock();
    private volatile SyncConfig current;

    public CalendarRegistry(ConfigStorePort configStore, ClockPort clockPort) {
        this.configStore = configStore;
        this.clockPort = clockPort;
        this.current = configStore.load()
                .map(CalendarRegistry::normalize)
                .orElseGet(SyncConfig::defaults);
    }

    public CalendarAccount addAccount(TokenBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        gate.lock();
        try {
            SyncConfig config = current;
            if (bundle.email() != null && config.accounts().stream()
                    .anyMatch(account -> account.sameIdentity(bundle.provider(), bundle.email()))) {
                throw new DuplicateAccountException(bundle.provider(), bundle.email());
            }
            OffsetDateTime now = clockPort.now();
            CalendarAccount account = new CalendarAccount(
                    nextId(now),
                    bundle.provider(),
                    bundle.name(),
                    bundle.email(),
                    bundle.accessToken(),
                    bundle.refreshToken(),
                    CalendarAccount.PRIMARY_CALENDAR,
                    true,
                    now,
                    now
            );
            List<CalendarAccount> updated = new ArrayList<>(config.accounts());
            updated.add(account);
            commit(config.withAccounts(updated));
            log.infof("캘린더 계정 추가: id=%s provider=%s email=%s", account.id(), account.provider().key(), account.email());
            return account;
        } finally {
            gate.unlock();
        }
    }

    /**
     * 마지막 계정을 지우면 동기화가 비활성화된다. 없는 ID면 아무것도 저장하지 않고 false 를 돌려준다.
     */
    public boolean removeAccount(String accountId) {
        gate.lock();
        try {
            SyncConfig config = current;
            List<CalendarAccount> remaining = config.accounts().stream()
                    .filter(account -> !account.id().equals(accountId))
                    .toList();
            if (remaining.size() == config.accounts().size()) {
                return false;
            }
            commit(config.withAccounts(remaining));
            log.infof("캘린더 계정 제거: id=%s (남은 계정 %d개)", accountId, remaining.size());
            return true;
        } finally {
            gate.unlock();
        }
    }

    public CalendarAccount updateAccount(String accountId, AccountPatch patch) {
        Objects.requireNonNull(patch, "patch");
        gate.lock();
        try {
            SyncConfig config = current;
            List<CalendarAccount> updated = new ArrayList<>(config.accounts());
            for (int i = 0; i < updated.size(); i++) {
                if (updated.get(i).id().equals(accountId)) {
                    CalendarAccount merged = patch.applyTo(updated.get(i), clockPort.now());
                    updated.set(i, merged);
                    commit(config.withAccounts(updated));
                    return merged;
                }
            }
            throw new AccountNotFoundException(accountId);
        } finally {
            gate.unlock();
        }
    }

    public List<CalendarAccount> listAccounts() {
        return List.copyOf(current.accounts());
    }

    public Optional<CalendarAccount> findAccount(String accountId) {
        return current.accounts().stream()
                .filter(account -> account.id().equals(accountId))
                .findFirst();
    }

    public SyncConfig getConfig() {
        return current;
    }

    /**
     * 이미 기록된 시각보다 이른 값은 무시한다.
     */
    public void setLastSync(OffsetDateTime timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        gate.lock();
        try {
            SyncConfig config = current;
            if (config.lastSyncAt() != null && timestamp.isBefore(config.lastSyncAt())) {
                log.debugf("이전 시각으로의 동기화 기록을 무시합니다: %s < %s", timestamp, config.lastSyncAt());
                return;
            }
            commit(config.withLastSyncAt(timestamp));
        } finally {
            gate.unlock();
        }
    }

    public SyncConfig updateSettings(SyncSettings settings) {
        Objects.requireNonNull(settings, "settings");
        gate.lock();
        try {
            SyncConfig next = current.withSettings(settings);
            commit(next);
            return next;
        } finally {
            gate.unlock();
        }
    }

    /**
     * 모든 계정 연결을 끊고 기본 설정으로 되돌린다.
     */
    public void reset() {
        gate.lock();
        try {
            commit(SyncConfig.defaults());
            log.info("캘린더 설정을 초기화했습니다.");
        } finally {
            gate.unlock();
        }
    }

    private void commit(SyncConfig next) {
        configStore.save(next);
        current = next;
    }

    /**
     * 저장된 값이 규칙을 어기면 바로잡는다. 활성 상태는 계정 유무를 따르고, 범위를 벗어난 주기와 조회 구간은 기본값으로 되돌린다.
     */
    static SyncConfig normalize(SyncConfig loaded) {
        int interval = loaded.syncIntervalMinutes() > 0
                ? loaded.syncIntervalMinutes() : SyncConfig.DEFAULT_SYNC_INTERVAL_MINUTES;
        int pastDays = loaded.pastWindowDays() >= 0 ? loaded.pastWindowDays() : SyncConfig.DEFAULT_PAST_WINDOW_DAYS;
        int futureDays = loaded.futureWindowDays() >= 0
                ? loaded.futureWindowDays() : SyncConfig.DEFAULT_FUTURE_WINDOW_DAYS;
        SyncConfig normalized = new SyncConfig(!loaded.accounts().isEmpty(), loaded.accounts(), interval,
                loaded.lastSyncAt(), loaded.autoCreateEntries(), loaded.includeAllDayEvents(), pastDays, futureDays);
        if (!normalized.equals(loaded)) {
            log.warnf("저장된 캘린더 설정을 보정했습니다: interval=%d, past=%d, future=%d, enabled=%s",
                    interval, pastDays, futureDays, normalized.enabled());
        }
        return normalized;
    }

    private static String nextId(OffsetDateTime now) {
        return "cal_" + now.toInstant().toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
