package com.my.logbook.domain.port.out;

import com.my.logbook.domain.model.OAuthCallbackMessage;
import com.my.logbook.domain.model.OAuthMessageEnvelope;

import java.util.function.Consumer;

/**
 * 왜: 인증 창과 애플리케이션 사이의 메시지 전달을 단일 발행/구독 채널로 모으기 위함.
 * 발행된 메시지는 구독자마다 정확히 한 번 전달된다.
 */
public interface OAuthMessageChannel {

    OAuthMessageEnvelope publish(OAuthCallbackMessage message);

    Subscription subscribe(Consumer<OAuthMessageEnvelope> listener);

    int subscriberCount();

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
