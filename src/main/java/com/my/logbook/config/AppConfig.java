package com.my.logbook.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    @WithDefault("Asia/Seoul")
    String timezone();

    StorageConfig storage();

    CalendarConfig calendar();

    interface StorageConfig {
        @WithName("config-path")
        @WithDefault("./data/calendarConfig.json")
        String configPath();
    }

    interface CalendarConfig {
        @WithName("redirect-base-url")
        @WithDefault("http://localhost:8080")
        String redirectBaseUrl();

        @WithName("auth-timeout-seconds")
        @WithDefault("300")
        int authTimeoutSeconds();

        @WithName("fetch-timeout-seconds")
        @WithDefault("30")
        int fetchTimeoutSeconds();

        @WithName("fetch-parallelism")
        @WithDefault("4")
        int fetchParallelism();

        @WithName("max-results")
        @WithDefault("100")
        int maxResults();

        @WithName("auto-sync")
        @WithDefault("false")
        boolean autoSync();

        GoogleConfig google();

        MicrosoftConfig microsoft();
    }

    interface GoogleConfig {
        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();
    }

    interface MicrosoftConfig {
        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        @WithName("tenant-id")
        @WithDefault("common")
        String tenantId();

        @WithName("login-base-url")
        @WithDefault("https://login.microsoftonline.com")
        String loginBaseUrl();

        @WithName("graph-base-url")
        @WithDefault("https://graph.microsoft.com/v1.0")
        String graphBaseUrl();
    }
}
