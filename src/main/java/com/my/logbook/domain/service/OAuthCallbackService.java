package com.my.logbook.domain.service;

import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.OAuthCallbackMessage;
import com.my.logbook.domain.model.OAuthMessageEnvelope;
import com.my.logbook.domain.port.in.CompleteAuthorizationUseCase;
import com.my.logbook.domain.port.out.CalendarProviderPort;
import com.my.logbook.domain.port.out.OAuthMessageChannel;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * 왜: 콜백 페이지가 받은 인증 코드를 토큰으로 교환하고 결과를 성공/오류 메시지로 채널에 발행하기 위함.
 * <p>
 * 발급하지 않았거나 만료된 state 의 콜백은 코드 교환도 발행도 하지 않는다.
 */
public class OAuthCallbackService implements CompleteAuthorizationUseCase {

    private static final Logger log = Logger.getLogger(OAuthCallbackService.class);

    private final Map<CalendarProvider, CalendarProviderPort> providerPorts;
    private final OAuthMessageChannel messageChannel;
    private final AuthorizationStateRegistry stateRegistry;

    public OAuthCallbackService(Map<CalendarProvider, CalendarProviderPort> providerPorts,
                                OAuthMessageChannel messageChannel,
                                AuthorizationStateRegistry stateRegistry) {
        this.providerPorts = Map.copyOf(providerPorts);
        this.messageChannel = messageChannel;
        this.stateRegistry = stateRegistry;
    }

    @Override
    public OAuthMessageEnvelope complete(CalendarProvider provider, String authCode, String error, String state) {
        if (!stateRegistry.consume(provider, state)) {
            log.warnf("%s 콜백의 state 가 유효하지 않아 무시합니다.", provider.key());
            return new OAuthMessageEnvelope(
                    OAuthCallbackMessage.error(provider, "유효하지 않거나 만료된 인증 요청입니다. 다시 연결해 주세요."));
        }
        return messageChannel.publish(toMessage(provider, authCode, error));
    }

    private OAuthCallbackMessage toMessage(CalendarProvider provider, String authCode, String error) {
        if (error != null && !error.isBlank()) {
            log.warnf("%s 인증 콜백 오류: %s", provider.key(), error);
            return OAuthCallbackMessage.error(provider, error);
        }
        if (authCode == null || authCode.isBlank()) {
            return OAuthCallbackMessage.error(provider, "인증 코드가 없습니다.");
        }
        CalendarProviderPort port = providerPorts.get(provider);
        if (port == null) {
            return OAuthCallbackMessage.error(provider, "지원하지 않는 캘린더 제공자입니다.");
        }
        try {
            return OAuthCallbackMessage.success(port.exchangeAuthCode(authCode));
        } catch (RuntimeException e) {
            log.warnf(e, "%s 인증 코드 교환 실패", provider.key());
            return OAuthCallbackMessage.error(provider, "인증 코드 교환 실패: " + e.getMessage());
        }
    }
}
