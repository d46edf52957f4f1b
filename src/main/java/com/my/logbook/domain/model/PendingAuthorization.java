package com.my.logbook.domain.model;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 왜: 진행 중인 인증 시도를 호출자에게 돌려주어 결과 대기와 취소를 할 수 있게 하기 위함.
 * 취소는 호출 범위 리스너 해제일 뿐이며 인증 창은 건드리지 않는다.
 */
public final class PendingAuthorization {

    private final CalendarProvider provider;
    private final URI authorizationUrl;
    private final CompletableFuture<CalendarAccount> result;

    public PendingAuthorization(CalendarProvider provider, URI authorizationUrl, CompletableFuture<CalendarAccount> result) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.authorizationUrl = Objects.requireNonNull(authorizationUrl, "authorizationUrl");
        this.result = Objects.requireNonNull(result, "result");
    }

    public CalendarProvider provider() {
        return provider;
    }

    public URI authorizationUrl() {
        return authorizationUrl;
    }

    public CompletableFuture<CalendarAccount> result() {
        return result;
    }

    public boolean cancel() {
        return result.cancel(false);
    }

    public boolean isDone() {
        return result.isDone();
    }
}
