package com.my.logbook.adapter.out.google;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeRequestUrl;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeTokenRequest;
import com.google.api.client.googleapis.auth.oauth2.GoogleTokenResponse;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.CalendarScopes;
import com.google.api.services.calendar.model.CalendarListEntry;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.Events;
import com.my.logbook.config.AppConfig;
import com.my.logbook.domain.exception.CalendarFetchException;
import com.my.logbook.domain.exception.ConfigurationMissingException;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.ProviderEvent;
import com.my.logbook.domain.model.TimeRange;
import com.my.logbook.domain.model.TokenBundle;
import com.my.logbook.domain.port.out.CalendarProviderPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 구글 OAuth/Calendar 연동을 도메인 포트 계약에 맞게 구현하여 읽기 전용 범위와 시간대 정책을 일관되게 적용하기 위함.
 */
@ApplicationScoped
public class GoogleCalendarAdapter implements CalendarProviderPort {

    private static final Logger log = Logger.getLogger(GoogleCalendarAdapter.class);

    private static final List<String> SCOPES = List.of(CalendarScopes.CALENDAR_READONLY);
    private static final String CALLBACK_PATH = "/oauth/google/callback";
    private static final String APP_NAME = "logbook-calendar-sync";

    private final AppConfig.GoogleConfig googleConfig;
    private final String redirectUri;
    private final ZoneId zoneId;
    private final int maxResults;
    private final int timeoutMillis;
    private final JacksonFactory jsonFactory;
    private final NetHttpTransport httpTransport;

    @Inject
    public GoogleCalendarAdapter(AppConfig appConfig) {
        this.googleConfig = appConfig.calendar().google();
        this.redirectUri = appConfig.calendar().redirectBaseUrl() + CALLBACK_PATH;
        this.zoneId = ZoneId.of(appConfig.timezone());
        this.maxResults = appConfig.calendar().maxResults();
        this.timeoutMillis = appConfig.calendar().fetchTimeoutSeconds() * 1000;
        this.jsonFactory = JacksonFactory.getDefaultInstance();
        try {
            this.httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("구글 클라이언트 초기화 실패", e);
        }
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.GOOGLE;
    }

    @Override
    public URI authorizationUrl(String state) {
        return URI.create(new GoogleAuthorizationCodeRequestUrl(requireClientId(), redirectUri, SCOPES)
                .setAccessType("offline")
                .setState(state)
                .set("prompt", "consent")
                .build());
    }

    @Override
    public TokenBundle exchangeAuthCode(String authCode) {
        String clientSecret = googleConfig.clientSecret()
                .filter(secret -> !secret.isBlank())
                .orElseThrow(() -> new ConfigurationMissingException(CalendarProvider.GOOGLE, "GOOGLE_CLIENT_SECRET"));
        try {
            GoogleTokenResponse tokens = new GoogleAuthorizationCodeTokenRequest(
                    httpTransport, jsonFactory, requireClientId(), clientSecret, authCode, redirectUri)
                    .execute();
            // 기본 캘린더 ID가 계정 이메일이다.
            CalendarListEntry primary = client(tokens.getAccessToken())
                    .calendarList()
                    .get(CalendarAccount.PRIMARY_CALENDAR)
                    .execute();
            log.infof("구글 인증 코드 교환 완료: %s", primary.getId());
            return new TokenBundle(CalendarProvider.GOOGLE, tokens.getAccessToken(), tokens.getRefreshToken(),
                    primary.getId(), primary.getSummary());
        } catch (IOException e) {
            throw new IllegalStateException("구글 인증 코드 교환 실패", e);
        }
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, retryOn = UncheckedIOException.class)
    public List<ProviderEvent> listEvents(String accessToken, String calendarRef, TimeRange window) {
        try {
            Events events = client(accessToken).events()
                    .list(calendarRef)
                    .setTimeMin(new DateTime(window.start().toInstant().toEpochMilli()))
                    .setTimeMax(new DateTime(window.end().toInstant().toEpochMilli()))
                    .setMaxResults(maxResults)
                    .setSingleEvents(true)
                    .setOrderBy("startTime")
                    .execute();
            List<Event> items = Optional.ofNullable(events.getItems()).orElse(List.of());
            log.debugf("구글 캘린더 일정 %d건 조회", items.size());
            return items.stream()
                    .map(this::toProviderEvent)
                    .flatMap(Optional::stream)
                    .toList();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 401 || e.getStatusCode() == 403) {
                throw new CalendarFetchException("구글 캘린더 접근이 거부되었습니다(status=" + e.getStatusCode() + ")", e);
            }
            throw new UncheckedIOException("구글 캘린더 일정 조회 실패", e);
        } catch (IOException e) {
            throw new UncheckedIOException("구글 캘린더 일정 조회 실패", e);
        }
    }

    Optional<ProviderEvent> toProviderEvent(Event event) {
        EventDateTime start = event.getStart();
        if (start == null) {
            return Optional.empty();
        }
        boolean allDay = start.getDateTime() == null && start.getDate() != null;
        OffsetDateTime startAt = toOffset(start);
        if (startAt == null) {
            return Optional.empty();
        }
        OffsetDateTime endAt = event.getEnd() != null ? toOffset(event.getEnd()) : null;
        List<String> attendees = Optional.ofNullable(event.getAttendees()).orElse(List.of()).stream()
                .map(EventAttendee::getEmail)
                .filter(Objects::nonNull)
                .toList();
        return Optional.of(new ProviderEvent(
                event.getId(),
                event.getSummary(),
                startAt,
                endAt,
                event.getDescription(),
                event.getLocation(),
                attendees,
                allDay));
    }

    private OffsetDateTime toOffset(EventDateTime value) {
        if (value.getDateTime() != null) {
            DateTime dateTime = value.getDateTime();
            return OffsetDateTime.ofInstant(Instant.ofEpochMilli(dateTime.getValue()),
                    ZoneOffset.ofTotalSeconds(dateTime.getTimeZoneShift() * 60));
        }
        if (value.getDate() != null) {
            // 종일 일정은 날짜만 오므로 설정된 시간대의 자정으로 맞춘다.
            LocalDate date = LocalDate.parse(value.getDate().toStringRfc3339());
            return date.atStartOfDay(zoneId).toOffsetDateTime();
        }
        return null;
    }

    private Calendar client(String accessToken) {
        Credential credential = new Credential(BearerToken.authorizationHeaderAccessMethod())
                .setAccessToken(accessToken);
        HttpRequestInitializer initializer = request -> {
            credential.initialize(request);
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
        };
        return new Calendar.Builder(httpTransport, jsonFactory, initializer)
                .setApplicationName(APP_NAME)
                .build();
    }

    private String requireClientId() {
        return googleConfig.clientId()
                .filter(id -> !id.isBlank())
                .orElseThrow(() -> new ConfigurationMissingException(CalendarProvider.GOOGLE, "GOOGLE_CLIENT_ID"));
    }
}
