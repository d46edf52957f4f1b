package com.my.logbook.adapter.out.health;

import com.my.logbook.config.AppConfig;
import com.my.logbook.domain.model.SyncConfig;
import com.my.logbook.domain.model.SyncStatusReport;
import com.my.logbook.domain.port.out.ClockPort;
import com.my.logbook.domain.service.CalendarRegistry;
import com.my.logbook.domain.service.SyncScheduler;
import com.my.logbook.domain.service.SyncStatusResolver;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Readiness
@ApplicationScoped
public class CalendarSyncReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;
    private final CalendarRegistry registry;
    private final SyncScheduler syncScheduler;
    private final SyncStatusResolver statusResolver;
    private final ClockPort clockPort;

    public CalendarSyncReadinessCheck(AppConfig appConfig,
                                      CalendarRegistry registry,
                                      SyncScheduler syncScheduler,
                                      SyncStatusResolver statusResolver,
                                      ClockPort clockPort) {
        this.appConfig = appConfig;
        this.registry = registry;
        this.syncScheduler = syncScheduler;
        this.statusResolver = statusResolver;
        this.clockPort = clockPort;
    }

    @Override
    public HealthCheckResponse call() {
        Path storageDir = Path.of(appConfig.storage().configPath()).toAbsolutePath().getParent();
        boolean storageOk = storageDir != null && Files.isDirectory(storageDir) && Files.isWritable(storageDir);
        boolean googleConfigured = isPresent(appConfig.calendar().google().clientId());
        boolean microsoftConfigured = isPresent(appConfig.calendar().microsoft().clientId());
        SyncConfig config = registry.getConfig();
        SyncStatusReport report = statusResolver.resolve(config, clockPort.now(), syncScheduler.lastSyncFailed());
        return HealthCheckResponse.named("calendar-sync-readiness")
                .withData("storageDir", String.valueOf(storageDir))
                .withData("storageWritable", storageOk)
                .withData("googleConfigured", googleConfigured)
                .withData("microsoftConfigured", microsoftConfigured)
                .withData("accounts", config.accounts().size())
                .withData("syncStatus", report.status().key())
                .withData("syncInProgress", syncScheduler.isSyncInProgress())
                .status(storageOk && (googleConfigured || microsoftConfigured))
                .build();
    }

    private static boolean isPresent(Optional<String> value) {
        return value.filter(v -> !v.isBlank()).isPresent();
    }
}
