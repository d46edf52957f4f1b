package com.my.logbook.adapter.out.messaging;

import com.my.logbook.domain.model.OAuthCallbackMessage;
import com.my.logbook.domain.model.OAuthMessageEnvelope;
import com.my.logbook.domain.port.out.OAuthMessageChannel;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 왜: 콜백 메시지를 프로세스 안에서 구독자마다 정확히 한 번씩 전달하기 위함.
 * 한 구독자의 예외가 다른 구독자 전달을 막지 않는다.
 */
@ApplicationScoped
public class InProcessOAuthMessageChannel implements OAuthMessageChannel {

    private static final Logger log = Logger.getLogger(InProcessOAuthMessageChannel.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    @Override
    public OAuthMessageEnvelope publish(OAuthCallbackMessage message) {
        OAuthMessageEnvelope envelope = new OAuthMessageEnvelope(message);
        log.debugf("OAuth 메시지 발행: type=%s, 구독자 %d개", message.type(), registrations.size());
        for (Registration registration : registrations) {
            registration.deliver(envelope);
        }
        return envelope;
    }

    @Override
    public Subscription subscribe(Consumer<OAuthMessageEnvelope> listener) {
        Registration registration = new Registration(listener);
        registrations.add(registration);
        return registration;
    }

    @Override
    public int subscriberCount() {
        return registrations.size();
    }

    private final class Registration implements Subscription {

        private final Consumer<OAuthMessageEnvelope> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(Consumer<OAuthMessageEnvelope> listener) {
            this.listener = listener;
        }

        private void deliver(OAuthMessageEnvelope envelope) {
            if (!active.get()) {
                return;
            }
            try {
                listener.accept(envelope);
            } catch (RuntimeException e) {
                log.warnf(e, "OAuth 메시지 처리 중 예외: type=%s", envelope.message().type());
            }
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
            }
        }
    }
}
