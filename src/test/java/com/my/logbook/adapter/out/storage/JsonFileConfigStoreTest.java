package com.my.logbook.adapter.out.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.my.logbook.domain.exception.ConfigPersistenceException;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.SyncConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileConfigStoreTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 2, 9, 0, 0, 0, ZoneOffset.ofHours(9));

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path configPath;
    private JsonFileConfigStore store;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        configPath = tempDir.resolve("nested").resolve("calendarConfig.json");
        store = new JsonFileConfigStore(configPath, objectMapper);
    }

    @Test
    void missingFileLoadsNothing() {
        assertThat(store.load()).isEmpty();
    }

    @Test
    void savesAndLoadsAccountsAndSettings() throws Exception {
        CalendarAccount account = new CalendarAccount("cal_1", CalendarProvider.MICROSOFT, "Work", "alice@outlook.com",
                "access", "refresh", "primary", true, NOW, NOW);
        SyncConfig config = SyncConfig.defaults().withAccounts(List.of(account)).withLastSyncAt(NOW);

        store.save(config);
        SyncConfig loaded = store.load().orElseThrow();

        assertThat(loaded.enabled()).isTrue();
        assertThat(loaded.accounts()).singleElement().satisfies(stored -> {
            assertThat(stored.id()).isEqualTo("cal_1");
            assertThat(stored.provider()).isEqualTo(CalendarProvider.MICROSOFT);
            assertThat(stored.refreshToken()).isEqualTo("refresh");
            assertThat(stored.linkedAt().toInstant()).isEqualTo(NOW.toInstant());
        });
        assertThat(loaded.lastSyncAt().toInstant()).isEqualTo(NOW.toInstant());
        assertThat(loaded.syncIntervalMinutes()).isEqualTo(15);
        assertThat(Files.readString(configPath)).contains("\"provider\" : \"microsoft\"");
    }

    @Test
    void overwritesWithoutLeavingTempFiles() throws Exception {
        store.save(SyncConfig.defaults());
        store.save(SyncConfig.defaults().withLastSyncAt(NOW));

        try (Stream<Path> files = Files.list(configPath.getParent())) {
            assertThat(files).containsExactly(configPath);
        }
        assertThat(store.load().orElseThrow().lastSyncAt()).isNotNull();
    }

    @Test
    void corruptFileIsSetAsideAndLoadsNothing() throws Exception {
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{not json");

        assertThat(store.load()).isEmpty();

        assertThat(configPath).doesNotExist();
        assertThat(configPath.resolveSibling("calendarConfig.json.corrupt")).hasContent("{not json");
    }

    @Test
    void nonObjectJsonIsTreatedAsCorrupt() throws Exception {
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "[]");

        assertThat(store.load()).isEmpty();
        assertThat(configPath.resolveSibling("calendarConfig.json.corrupt")).exists();
    }

    @Test
    void missingFieldsFallBackToDefaults() throws Exception {
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"includeAllDayEvents\": true}");

        SyncConfig loaded = store.load().orElseThrow();

        assertThat(loaded.includeAllDayEvents()).isTrue();
        assertThat(loaded.syncIntervalMinutes()).isEqualTo(SyncConfig.DEFAULT_SYNC_INTERVAL_MINUTES);
        assertThat(loaded.pastWindowDays()).isEqualTo(SyncConfig.DEFAULT_PAST_WINDOW_DAYS);
        assertThat(loaded.futureWindowDays()).isEqualTo(SyncConfig.DEFAULT_FUTURE_WINDOW_DAYS);
        assertThat(loaded.autoCreateEntries()).isTrue();
        assertThat(loaded.accounts()).isEmpty();
    }

    @Test
    void unreadablePathIsReported() throws Exception {
        Files.createDirectories(configPath);

        assertThatThrownBy(() -> store.load()).isInstanceOf(ConfigPersistenceException.class);
    }
}
