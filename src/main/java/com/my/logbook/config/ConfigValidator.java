package com.my.logbook.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = "prod".equals(LaunchMode.current().getDefaultProfile());
        boolean googleReady = isPresent("GOOGLE_CLIENT_ID", appConfig.calendar().google().clientId());
        boolean microsoftReady = isPresent("MICROSOFT_CLIENT_ID", appConfig.calendar().microsoft().clientId());
        if (!googleReady && !microsoftReady) {
            String message = "연결 가능한 캘린더 제공자가 없습니다. GOOGLE_CLIENT_ID 또는 MICROSOFT_CLIENT_ID 를 설정해주세요.";
            if (isProd) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
        validateStorage(appConfig.storage().configPath(), isProd);
    }

    private boolean isPresent(String name, Optional<String> value) {
        if (value.filter(v -> !v.isBlank()).isEmpty()) {
            log.warnf("필수 설정이 비어 있습니다: %s", name);
            return false;
        }
        return true;
    }

    private void validateStorage(String path, boolean strict) {
        Path parent = Path.of(path).toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            String message = "설정 저장 경로를 만들 수 없습니다: CALENDAR_CONFIG_PATH=" + path;
            if (strict) {
                throw new IllegalStateException(message, e);
            }
            log.warn(message);
        }
    }
}
