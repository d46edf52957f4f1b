package com.my.logbook.domain.model;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 왜: 같은 콜백 메시지를 여러 구독자가 받더라도 계정 추가는 한 번만 일어나도록
 * 처리 여부와 처리 결과를 메시지 옆에 함께 보관하기 위함.
 */
public final class OAuthMessageEnvelope {

    private final OAuthCallbackMessage message;
    private final AtomicBoolean handled = new AtomicBoolean(false);
    private final CompletableFuture<CalendarAccount> outcome = new CompletableFuture<>();

    public OAuthMessageEnvelope(OAuthCallbackMessage message) {
        this.message = Objects.requireNonNull(message, "message");
    }

    public OAuthCallbackMessage message() {
        return message;
    }

    public boolean isHandled() {
        return handled.get();
    }

    /**
     * 처음 호출한 쪽만 handler 를 실행하고, 이후 호출은 같은 결과를 공유한다.
     */
    public CompletableFuture<CalendarAccount> handleOnce(Supplier<CalendarAccount> handler) {
        if (handled.compareAndSet(false, true)) {
            try {
                outcome.complete(handler.get());
            } catch (RuntimeException e) {
                outcome.completeExceptionally(e);
            }
        }
        return outcome;
    }

    public CompletableFuture<CalendarAccount> outcome() {
        return outcome;
    }
}
