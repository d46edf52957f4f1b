package com.my.logbook.domain.service;

import com.my.logbook.domain.exception.AuthDeniedException;
import com.my.logbook.domain.exception.AuthTimeoutException;
import com.my.logbook.domain.exception.ConfigurationMissingException;
import com.my.logbook.domain.exception.DuplicateAccountException;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.OAuthCallbackMessage;
import com.my.logbook.domain.model.OAuthMessageEnvelope;
import com.my.logbook.domain.model.PendingAuthorization;
import com.my.logbook.domain.port.in.LinkCalendarUseCase;
import com.my.logbook.domain.port.out.AuthWindowPort;
import com.my.logbook.domain.port.out.CalendarProviderPort;
import com.my.logbook.domain.port.out.OAuthMessageChannel;
import org.jboss.logging.Logger;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 왜: 제공자별 인증 코드 흐름을 시작하고, 메시지 채널로 들어온 결과를 계정 등록까지 한 번만 이어주기 위함.
 * <p>
 * 완료 신호는 메시지 도착 또는 시간 초과뿐이다. 인증 창의 상태는 확인하지 않으며 창을 강제로 닫지도 않는다.
 * 프로세스 전역 리스너와 호출 범위 리스너가 같은 메시지를 받아도 {@link OAuthMessageEnvelope#handleOnce}
 * 덕분에 계정 추가는 한 번만 실행되고, 두 리스너 모두 같은 결과를 본다.
 */
public class AuthorizationCoordinator implements LinkCalendarUseCase {

    private static final Logger log = Logger.getLogger(AuthorizationCoordinator.class);

    private final Map<CalendarProvider, CalendarProviderPort> providerPorts;
    private final AuthWindowPort authWindowPort;
    private final OAuthMessageChannel messageChannel;
    private final CalendarRegistry registry;
    private final AuthorizationStateRegistry stateRegistry;
    private final ScheduledExecutorService timer;
    private final Duration authTimeout;
    private final AtomicReference<OAuthMessageChannel.Subscription> globalSubscription = new AtomicReference<>();

    public AuthorizationCoordinator(Map<CalendarProvider, CalendarProviderPort> providerPorts,
                                    AuthWindowPort authWindowPort,
                                    OAuthMessageChannel messageChannel,
                                    CalendarRegistry registry,
                                    AuthorizationStateRegistry stateRegistry,
                                    ScheduledExecutorService timer,
                                    Duration authTimeout) {
        this.providerPorts = Map.copyOf(providerPorts);
        this.authWindowPort = authWindowPort;
        this.messageChannel = messageChannel;
        this.registry = registry;
        this.stateRegistry = stateRegistry;
        this.timer = timer;
        this.authTimeout = authTimeout;
    }

    /**
     * 프로세스 전역 리스너를 한 번만 등록한다. 진행 중인 initiate 호출이 없어도 성공 메시지를 계정으로 반영한다.
     */
    public void registerGlobalListener() {
        if (globalSubscription.get() != null) {
            return;
        }
        OAuthMessageChannel.Subscription subscription = messageChannel.subscribe(this::onGlobalMessage);
        if (!globalSubscription.compareAndSet(null, subscription)) {
            subscription.close();
            return;
        }
        log.info("전역 OAuth 메시지 리스너를 등록했습니다.");
    }

    @Override
    public PendingAuthorization initiate(CalendarProvider provider) {
        CalendarProviderPort port = providerPorts.get(provider);
        if (port == null) {
            throw new ConfigurationMissingException(provider, "provider adapter");
        }
        String state = stateRegistry.issue(provider);
        CompletableFuture<CalendarAccount> result = new CompletableFuture<>();
        URI authorizationUrl;
        ScheduledFuture<?> timeoutTask;
        try {
            authorizationUrl = port.authorizationUrl(state);
            timeoutTask = timer.schedule(() -> {
                if (result.completeExceptionally(new AuthTimeoutException(provider, authTimeout))) {
                    log.warnf("%s 인증 응답이 %d초 안에 도착하지 않았습니다.", provider.key(), authTimeout.toSeconds());
                }
            }, authTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            stateRegistry.revoke(state);
            throw e;
        }

        OAuthMessageChannel.Subscription subscription =
                messageChannel.subscribe(envelope -> onCallScopedMessage(provider, envelope, result));
        result.whenComplete((account, error) -> {
            subscription.close();
            timeoutTask.cancel(false);
            // 취소된 요청의 state 만 폐기한다. 시간 초과된 state 는 ttl 까지 유효하다.
            if (result.isCancelled()) {
                stateRegistry.revoke(state);
            }
        });

        try {
            authWindowPort.open(provider, authorizationUrl);
        } catch (RuntimeException e) {
            result.cancel(false);
            throw e;
        }
        log.infof("%s 인증 창을 열었습니다.", provider.key());
        return new PendingAuthorization(provider, authorizationUrl, result);
    }

    private void onGlobalMessage(OAuthMessageEnvelope envelope) {
        envelope.message().successProvider().ifPresent(provider -> claim(provider, envelope));
    }

    private void onCallScopedMessage(CalendarProvider provider,
                                     OAuthMessageEnvelope envelope,
                                     CompletableFuture<CalendarAccount> result) {
        OAuthCallbackMessage message = envelope.message();
        if (message.isSuccessFor(provider)) {
            claim(provider, envelope).whenComplete((account, error) -> {
                if (error != null) {
                    result.completeExceptionally(unwrap(error));
                } else {
                    result.complete(account);
                }
            });
        } else if (message.isErrorFor(provider)) {
            log.warnf("%s 인증 실패 메시지를 받았습니다: %s", provider.key(), message.error());
            result.completeExceptionally(new AuthDeniedException(provider, message.error()));
        }
    }

    private CompletableFuture<CalendarAccount> claim(CalendarProvider provider, OAuthMessageEnvelope envelope) {
        return envelope.handleOnce(() -> {
            try {
                return registry.addAccount(envelope.message().toTokenBundle(provider));
            } catch (DuplicateAccountException e) {
                log.infof("이미 연결된 %s 캘린더입니다: %s", provider.key(), e.email());
                throw e;
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
