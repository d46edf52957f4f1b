package com.my.logbook.adapter.out.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.my.logbook.config.AppConfig;
import com.my.logbook.domain.exception.ConfigPersistenceException;
import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.port.out.ConfigStorePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 왜: 동기화 설정을 하나의 JSON 파일로 보관하되, 임시 파일에 쓴 뒤 교체해 저장 실패가 기존 파일을 망가뜨리지 않게 하기 위함.
 * <p>
 * 파일에 없는 항목은 기본값으로 채운다. JSON 으로 읽을 수 없는 파일은 {@code .corrupt} 로 옮겨 두고 저장된 설정이 없는 것으로 본다.
 */
@ApplicationScoped
public class JsonFileConfigStore implements ConfigStorePort {

    private static final Logger log = Logger.getLogger(JsonFileConfigStore.class);

    private final Path configPath;
    private final ObjectMapper objectMapper;

    @Inject
    public JsonFileConfigStore(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Path.of(appConfig.storage().configPath()), objectMapper);
    }

    public JsonFileConfigStore(Path configPath, ObjectMapper objectMapper) {
        this.configPath = configPath.toAbsolutePath();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SyncConfig> load() {
        if (!Files.exists(configPath)) {
            return Optional.empty();
        }
        try {
            JsonNode stored = objectMapper.readTree(configPath.toFile());
            if (stored == null || !stored.isObject()) {
                quarantine("JSON 객체가 아닙니다");
                return Optional.empty();
            }
            ObjectNode merged = objectMapper.valueToTree(SyncConfig.defaults());
            merged.setAll((ObjectNode) stored);
            return Optional.of(objectMapper.treeToValue(merged, SyncConfig.class));
        } catch (JsonProcessingException e) {
            quarantine(e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new ConfigPersistenceException("캘린더 설정 로드 실패: " + configPath, e);
        }
    }

    @Override
    public void save(SyncConfig config) {
        Path temp = null;
        try {
            Files.createDirectories(configPath.getParent());
            temp = Files.createTempFile(configPath.getParent(), configPath.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), config);
            replace(temp);
        } catch (IOException e) {
            ConfigPersistenceException failure = new ConfigPersistenceException("캘린더 설정 저장 실패: " + configPath, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    private void quarantine(String reason) {
        Path corrupt = configPath.resolveSibling(configPath.getFileName() + ".corrupt");
        try {
            Files.move(configPath, corrupt, StandardCopyOption.REPLACE_EXISTING);
            log.warnf("캘린더 설정 파일을 읽을 수 없어 기본 설정으로 시작합니다: %s (원본 보관: %s, 원인: %s)",
                    configPath, corrupt, reason);
        } catch (IOException e) {
            throw new ConfigPersistenceException("손상된 캘린더 설정 보관 실패: " + configPath, e);
        }
    }

    private void replace(Path temp) throws IOException {
        try {
            Files.move(temp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, configPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
