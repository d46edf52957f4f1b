package com.my.logbook.domain.service;

import com.my.logbook.domain.exception.AccountNotFoundException;
import com.my.logbook.domain.exception.ConfigPersistenceException;
import com.my.logbook.domain.exception.DuplicateAccountException;
import com.my.logbook.domain.model.AccountPatch;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.model.SyncSettings;
import com.my.logbook.domain.model.TokenBundle;
import com.my.logbook.domain.port.out.ClockPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CalendarRegistryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 2, 9, 0, 0, 0, ZoneOffset.ofHours(9));

    private InMemoryConfigStore store;
    private ClockPort clockPort;
    private CalendarRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigStore();
        clockPort = mock(ClockPort.class);
        when(clockPort.now()).thenReturn(NOW);
        registry = new CalendarRegistry(store, clockPort);
    }

    @Test
    void startsWithDefaultsWhenNothingStored() {
        SyncConfig config = registry.getConfig();

        assertThat(config.enabled()).isFalse();
        assertThat(config.accounts()).isEmpty();
        assertThat(config.syncIntervalMinutes()).isEqualTo(15);
        assertThat(config.autoCreateEntries()).isTrue();
        assertThat(config.includeAllDayEvents()).isFalse();
        assertThat(config.pastWindowDays()).isEqualTo(7);
        assertThat(config.futureWindowDays()).isEqualTo(30);
        assertThat(config.lastSyncAt()).isNull();
    }

    @Test
    void addAccountEnablesSyncAndPersists() {
        CalendarAccount account = registry.addAccount(google("alice@example.com", null));

        assertThat(account.id()).startsWith("cal_" + NOW.toInstant().toEpochMilli() + "_");
        assertThat(account.displayName()).isEqualTo("Google Calendar");
        assertThat(account.calendarRef()).isEqualTo(CalendarAccount.PRIMARY_CALENDAR);
        assertThat(account.enabled()).isTrue();
        assertThat(account.linkedAt()).isEqualTo(NOW);
        assertThat(registry.getConfig().enabled()).isTrue();
        assertThat(store.stored().accounts()).containsExactly(account);
    }

    @Test
    void rejectsSameProviderAndEmailIgnoringCase() {
        registry.addAccount(google("alice@example.com", "Alice"));

        assertThatThrownBy(() -> registry.addAccount(google("ALICE@example.com", "Other")))
                .isInstanceOf(DuplicateAccountException.class);
        assertThat(registry.listAccounts()).hasSize(1);
    }

    @Test
    void allowsSameEmailOnDifferentProviders() {
        registry.addAccount(google("alice@example.com", null));
        registry.addAccount(new TokenBundle(CalendarProvider.MICROSOFT, "m-token", null, "alice@example.com", null));

        assertThat(registry.listAccounts())
                .extracting(CalendarAccount::provider)
                .containsExactly(CalendarProvider.GOOGLE, CalendarProvider.MICROSOFT);
    }

    @Test
    void accountsWithoutEmailAreNeverDuplicates() {
        registry.addAccount(google(null, null));
        registry.addAccount(google("  ", null));

        assertThat(registry.listAccounts()).hasSize(2);
    }

    @Test
    void removingLastAccountDisablesSync() {
        CalendarAccount account = registry.addAccount(google("alice@example.com", null));

        assertThat(registry.removeAccount(account.id())).isTrue();

        assertThat(registry.getConfig().enabled()).isFalse();
        assertThat(store.stored().accounts()).isEmpty();
    }

    @Test
    void removingOneOfSeveralAccountsKeepsSyncEnabled() {
        CalendarAccount alice = registry.addAccount(google("alice@example.com", null));
        CalendarAccount bob = registry.addAccount(new TokenBundle(CalendarProvider.MICROSOFT, "m-token", null, "bob@outlook.com", null));

        assertThat(registry.removeAccount(alice.id())).isTrue();

        assertThat(registry.getConfig().enabled()).isTrue();
        assertThat(registry.listAccounts()).containsExactly(bob);
        assertThat(store.stored()).isEqualTo(registry.getConfig());
        assertThat(store.stored().enabled()).isTrue();
    }

    @Test
    void concurrentAddsAreSerialized() throws Exception {
        int identities = 8;
        int attemptsPerIdentity = 3;
        ExecutorService executor = Executors.newFixedThreadPool(identities * attemptsPerIdentity);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger added = new AtomicInteger();
        AtomicInteger duplicates = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int attempt = 0; attempt < attemptsPerIdentity; attempt++) {
                for (int i = 0; i < identities; i++) {
                    String email = "user" + i + "@example.com";
                    futures.add(executor.submit(() -> {
                        start.await(5, TimeUnit.SECONDS);
                        try {
                            registry.addAccount(google(email, null));
                            added.incrementAndGet();
                        } catch (DuplicateAccountException e) {
                            duplicates.incrementAndGet();
                        }
                        return null;
                    }));
                }
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(added.get()).isEqualTo(identities);
        assertThat(duplicates.get()).isEqualTo(identities * (attemptsPerIdentity - 1));
        assertThat(registry.listAccounts())
                .hasSize(identities)
                .extracting(CalendarAccount::email)
                .doesNotHaveDuplicates();
        assertThat(registry.listAccounts()).extracting(CalendarAccount::id).doesNotHaveDuplicates();
        assertThat(store.stored().accounts()).containsExactlyElementsOf(registry.listAccounts());
        assertThat(store.saveCount()).isEqualTo(identities);
    }

    @Test
    void removingUnknownAccountChangesNothing() {
        registry.addAccount(google("alice@example.com", null));
        int saves = store.saveCount();

        assertThat(registry.removeAccount("cal_missing")).isFalse();

        assertThat(store.saveCount()).isEqualTo(saves);
        assertThat(registry.listAccounts()).hasSize(1);
    }

    @Test
    void updateMergesOnlyGivenFields() {
        CalendarAccount account = registry.addAccount(google("alice@example.com", "Alice"));
        OffsetDateTime later = NOW.plusMinutes(3);
        when(clockPort.now()).thenReturn(later);

        CalendarAccount updated = registry.updateAccount(account.id(),
                new AccountPatch("Work", null, null, null, false));

        assertThat(updated.displayName()).isEqualTo("Work");
        assertThat(updated.enabled()).isFalse();
        assertThat(updated.accessToken()).isEqualTo("g-token");
        assertThat(updated.linkedAt()).isEqualTo(NOW);
        assertThat(updated.updatedAt()).isEqualTo(later);
        assertThat(registry.findAccount(account.id())).contains(updated);
    }

    @Test
    void updateOfUnknownAccountFails() {
        assertThatThrownBy(() -> registry.updateAccount("cal_missing", AccountPatch.enabled(false)))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void lastSyncNeverMovesBackwards() {
        registry.setLastSync(NOW);
        registry.setLastSync(NOW.minusMinutes(10));

        assertThat(registry.getConfig().lastSyncAt()).isEqualTo(NOW);

        registry.setLastSync(NOW.plusMinutes(1));
        assertThat(registry.getConfig().lastSyncAt()).isEqualTo(NOW.plusMinutes(1));
    }

    @Test
    void failedSaveKeepsPreviousSnapshot() {
        registry.addAccount(google("alice@example.com", null));
        store.failOnSave(true);

        assertThatThrownBy(() -> registry.addAccount(google("bob@example.com", null)))
                .isInstanceOf(ConfigPersistenceException.class);

        assertThat(registry.listAccounts()).extracting(CalendarAccount::email).containsExactly("alice@example.com");
    }

    @Test
    void normalizesEnabledFlagOnLoad() {
        SyncConfig inconsistent = new SyncConfig(true, List.of(), 15, null, true, false, 7, 30);

        CalendarRegistry loaded = new CalendarRegistry(new InMemoryConfigStore(inconsistent), clockPort);

        assertThat(loaded.getConfig().enabled()).isFalse();
    }

    @Test
    void outOfRangeStoredValuesFallBackToDefaults() {
        SyncConfig partial = new SyncConfig(false, List.of(), 0, null, true, false, -1, -3);

        SyncConfig loaded = new CalendarRegistry(new InMemoryConfigStore(partial), clockPort).getConfig();

        assertThat(loaded.syncIntervalMinutes()).isEqualTo(SyncConfig.DEFAULT_SYNC_INTERVAL_MINUTES);
        assertThat(loaded.pastWindowDays()).isEqualTo(SyncConfig.DEFAULT_PAST_WINDOW_DAYS);
        assertThat(loaded.futureWindowDays()).isEqualTo(SyncConfig.DEFAULT_FUTURE_WINDOW_DAYS);
    }

    @Test
    void zeroDayWindowsAreKept() {
        SyncConfig narrow = new SyncConfig(false, List.of(), 5, null, true, false, 0, 0);

        SyncConfig loaded = new CalendarRegistry(new InMemoryConfigStore(narrow), clockPort).getConfig();

        assertThat(loaded).isEqualTo(narrow);
    }

    @Test
    void updatesSettingsAndKeepsAccounts() {
        registry.addAccount(google("alice@example.com", null));

        SyncConfig updated = registry.updateSettings(new SyncSettings(30, null, true, null, 14));

        assertThat(updated.syncIntervalMinutes()).isEqualTo(30);
        assertThat(updated.includeAllDayEvents()).isTrue();
        assertThat(updated.autoCreateEntries()).isTrue();
        assertThat(updated.pastWindowDays()).isEqualTo(7);
        assertThat(updated.futureWindowDays()).isEqualTo(14);
        assertThat(updated.accounts()).hasSize(1);
        assertThat(store.stored()).isEqualTo(updated);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new SyncSettings(0, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetRestoresDefaults() {
        registry.addAccount(google("alice@example.com", null));
        registry.setLastSync(NOW);

        registry.reset();

        assertThat(registry.getConfig()).isEqualTo(SyncConfig.defaults());
        assertThat(store.stored()).isEqualTo(SyncConfig.defaults());
    }

    private static TokenBundle google(String email, String name) {
        return new TokenBundle(CalendarProvider.GOOGLE, "g-token", "g-refresh", email, name);
    }
}
