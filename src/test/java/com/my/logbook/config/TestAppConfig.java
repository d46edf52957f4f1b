package com.my.logbook.config;

import java.util.Optional;

public class TestAppConfig implements AppConfig {

    private final String configPath;
    private final boolean autoSync;
    private final Optional<String> googleClientId;
    private final Optional<String> microsoftClientId;

    public TestAppConfig(String configPath, boolean autoSync, String googleClientId, String microsoftClientId) {
        this.configPath = configPath;
        this.autoSync = autoSync;
        this.googleClientId = Optional.ofNullable(googleClientId);
        this.microsoftClientId = Optional.ofNullable(microsoftClientId);
    }

    public static TestAppConfig defaults() {
        return new TestAppConfig("target/test-data/calendarConfig.json", false, "google-client", "ms-client");
    }

    @Override
    public String timezone() {
        return "Asia/Seoul";
    }

    @Override
    public StorageConfig storage() {
        return () -> configPath;
    }

    @Override
    public CalendarConfig calendar() {
        return new CalendarConfig() {
            @Override
            public String redirectBaseUrl() {
                return "http://localhost:8080";
            }

            @Override
            public int authTimeoutSeconds() {
                return 300;
            }

            @Override
            public int fetchTimeoutSeconds() {
                return 30;
            }

            @Override
            public int fetchParallelism() {
                return 4;
            }

            @Override
            public int maxResults() {
                return 100;
            }

            @Override
            public boolean autoSync() {
                return autoSync;
            }

            @Override
            public GoogleConfig google() {
                return new GoogleConfig() {
                    @Override
                    public Optional<String> clientId() {
                        return googleClientId;
                    }

                    @Override
                    public Optional<String> clientSecret() {
                        return Optional.of("google-secret");
                    }
                };
            }

            @Override
            public MicrosoftConfig microsoft() {
                return new MicrosoftConfig() {
                    @Override
                    public Optional<String> clientId() {
                        return microsoftClientId;
                    }

                    @Override
                    public Optional<String> clientSecret() {
                        return Optional.of("ms-secret");
                    }

                    @Override
                    public String tenantId() {
                        return "common";
                    }

                    @Override
                    public String loginBaseUrl() {
                        return "https://login.microsoftonline.com";
                    }

                    @Override
                    public String graphBaseUrl() {
                        return "https://graph.microsoft.com/v1.0";
                    }
                };
            }
        };
    }
}
