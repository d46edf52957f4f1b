package com.my.logbook.adapter.out.microsoft;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.client.auth.oauth2.AuthorizationCodeRequestUrl;
import com.google.api.client.auth.oauth2.AuthorizationCodeTokenRequest;
import com.google.api.client.auth.oauth2.ClientParametersAuthentication;
import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestFactory;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.jackson2.JacksonFactory;
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
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: Microsoft Graph 캘린더를 구글과 같은 포트 계약으로 노출해 동기화 코드가 제공자를 구분하지 않도록 하기 위함.
 */
@ApplicationScoped
public class MicrosoftGraphCalendarAdapter implements CalendarProviderPort {

    private static final Logger log = Logger.getLogger(MicrosoftGraphCalendarAdapter.class);

    private static final List<String> SCOPES = List.of("offline_access", "https://graph.microsoft.com/Calendars.Read");
    private static final String CALLBACK_PATH = "/oauth/microsoft/callback";
    // Graph가 UTC 기준 로컬 시각을 돌려주도록 요청한다.
    private static final String PREFER_UTC = "outlook.timezone=\"UTC\"";
    private static final DateTimeFormatter GRAPH_QUERY_TIME = DateTimeFormatter.ISO_INSTANT;

    private final AppConfig.MicrosoftConfig microsoftConfig;
    private final String redirectUri;
    private final ZoneId zoneId;
    private final int maxResults;
    private final int timeoutMillis;
    private final ObjectMapper objectMapper;
    private final JacksonFactory jsonFactory;
    private final NetHttpTransport httpTransport;

    @Inject
    public MicrosoftGraphCalendarAdapter(AppConfig appConfig, ObjectMapper objectMapper) {
        this.microsoftConfig = appConfig.calendar().microsoft();
        this.redirectUri = appConfig.calendar().redirectBaseUrl() + CALLBACK_PATH;
        this.zoneId = ZoneId.of(appConfig.timezone());
        this.maxResults = appConfig.calendar().maxResults();
        this.timeoutMillis = appConfig.calendar().fetchTimeoutSeconds() * 1000;
        this.objectMapper = objectMapper;
        this.jsonFactory = JacksonFactory.getDefaultInstance();
        this.httpTransport = new NetHttpTransport();
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.MICROSOFT;
    }

    @Override
    public URI authorizationUrl(String state) {
        return URI.create(new AuthorizationCodeRequestUrl(endpoint("authorize"), requireClientId())
                .setRedirectUri(redirectUri)
                .setScopes(SCOPES)
                .setState(state)
                .set("response_mode", "query")
                .build());
    }

    @Override
    public TokenBundle exchangeAuthCode(String authCode) {
        String clientSecret = microsoftConfig.clientSecret()
                .filter(secret -> !secret.isBlank())
                .orElseThrow(() -> new ConfigurationMissingException(CalendarProvider.MICROSOFT, "MICROSOFT_CLIENT_SECRET"));
        try {
            TokenResponse tokens = new AuthorizationCodeTokenRequest(
                    httpTransport, jsonFactory, new GenericUrl(endpoint("token")), authCode)
                    .setRedirectUri(redirectUri)
                    .setScopes(SCOPES)
                    .setClientAuthentication(new ClientParametersAuthentication(requireClientId(), clientSecret))
                    .execute();
            GraphCalendar calendar = get(tokens.getAccessToken(),
                    new GenericUrl(microsoftConfig.graphBaseUrl() + "/me/calendar"), GraphCalendar.class);
            GraphEmailAddress owner = calendar.owner();
            String email = owner != null ? owner.address() : null;
            String name = owner != null ? owner.name() : null;
            log.infof("마이크로소프트 인증 코드 교환 완료: %s", email);
            return new TokenBundle(CalendarProvider.MICROSOFT, tokens.getAccessToken(), tokens.getRefreshToken(), email, name);
        } catch (IOException e) {
            throw new IllegalStateException("마이크로소프트 인증 코드 교환 실패", e);
        }
    }

    @Override
    @Retry(maxRetries = 2, delay = 500, retryOn = UncheckedIOException.class)
    public List<ProviderEvent> listEvents(String accessToken, String calendarRef, TimeRange window) {
        GenericUrl url = new GenericUrl(calendarViewUrl(calendarRef));
        url.set("startDateTime", GRAPH_QUERY_TIME.format(window.start().toInstant()));
        url.set("endDateTime", GRAPH_QUERY_TIME.format(window.end().toInstant()));
        url.set("$top", maxResults);
        url.set("$orderby", "start/dateTime");
        try {
            GraphEventPage page = get(accessToken, url, GraphEventPage.class);
            List<GraphEvent> items = Optional.ofNullable(page.value()).orElse(List.of());
            log.debugf("마이크로소프트 캘린더 일정 %d건 조회", items.size());
            return items.stream()
                    .map(event -> toProviderEvent(event, zoneId))
                    .flatMap(Optional::stream)
                    .toList();
        } catch (HttpResponseException e) {
            if (e.getStatusCode() == 401 || e.getStatusCode() == 403) {
                throw new CalendarFetchException("마이크로소프트 캘린더 접근이 거부되었습니다(status=" + e.getStatusCode() + ")", e);
            }
            throw new UncheckedIOException("마이크로소프트 캘린더 일정 조회 실패", e);
        } catch (IOException e) {
            throw new UncheckedIOException("마이크로소프트 캘린더 일정 조회 실패", e);
        }
    }

    static Optional<ProviderEvent> toProviderEvent(GraphEvent event, ZoneId zoneId) {
        OffsetDateTime start = toOffset(event.start(), event.allDay(), zoneId);
        if (start == null) {
            return Optional.empty();
        }
        OffsetDateTime end = toOffset(event.end(), event.allDay(), zoneId);
        List<String> attendees = Optional.ofNullable(event.attendees()).orElse(List.of()).stream()
                .map(GraphAttendee::emailAddress)
                .filter(Objects::nonNull)
                .map(GraphEmailAddress::address)
                .filter(Objects::nonNull)
                .toList();
        String location = event.location() != null ? event.location().displayName() : null;
        return Optional.of(new ProviderEvent(
                event.id(),
                event.subject(),
                start,
                end,
                event.bodyPreview(),
                location,
                attendees,
                event.allDay()));
    }

    private static OffsetDateTime toOffset(GraphDateTime value, boolean allDay, ZoneId zoneId) {
        if (value == null || value.dateTime() == null || value.dateTime().isBlank()) {
            return null;
        }
        LocalDateTime local = LocalDateTime.parse(value.dateTime());
        if (allDay) {
            // 종일 일정은 날짜만 의미가 있으므로 설정된 시간대의 자정으로 맞춘다.
            return local.toLocalDate().atStartOfDay(zoneId).toOffsetDateTime();
        }
        return local.atOffset(ZoneOffset.UTC);
    }

    private String calendarViewUrl(String calendarRef) {
        if (calendarRef == null || CalendarAccount.PRIMARY_CALENDAR.equals(calendarRef)) {
            return microsoftConfig.graphBaseUrl() + "/me/calendarView";
        }
        return microsoftConfig.graphBaseUrl() + "/me/calendars/"
                + URLEncoder.encode(calendarRef, StandardCharsets.UTF_8) + "/calendarView";
    }

    private <T> T get(String accessToken, GenericUrl url, Class<T> type) throws IOException {
        HttpRequestFactory factory = httpTransport.createRequestFactory(request -> {
            request.getHeaders().setAuthorization("Bearer " + accessToken);
            request.getHeaders().set("Prefer", PREFER_UTC);
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
        });
        HttpRequest request = factory.buildGetRequest(url);
        HttpResponse response = request.execute();
        try (InputStream body = response.getContent()) {
            return objectMapper.readValue(body, type);
        } finally {
            response.disconnect();
        }
    }

    private String endpoint(String action) {
        return microsoftConfig.loginBaseUrl() + "/" + microsoftConfig.tenantId() + "/oauth2/v2.0/" + action;
    }

    private String requireClientId() {
        return microsoftConfig.clientId()
                .filter(id -> !id.isBlank())
                .orElseThrow(() -> new ConfigurationMissingException(CalendarProvider.MICROSOFT, "MICROSOFT_CLIENT_ID"));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphEventPage(List<GraphEvent> value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphEvent(String id,
                      String subject,
                      String bodyPreview,
                      GraphDateTime start,
                      GraphDateTime end,
                      GraphLocation location,
                      List<GraphAttendee> attendees,
                      @JsonProperty("isAllDay") boolean allDay) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphDateTime(String dateTime, String timeZone) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphLocation(String displayName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphAttendee(GraphEmailAddress emailAddress) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphEmailAddress(String name, String address) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GraphCalendar(String id, String name, GraphEmailAddress owner) {
    }
}
