package com.my.logbook.domain.service;

import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.port.out.ClockPort;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 콜백이 실제로 시작한 인증 요청에서 온 것인지 확인하기 위해 initiate 마다 일회용 state 값을 발급하고 검증하기 위함.
 * <p>
 * state 는 한 번만 소비할 수 있고 ttl 이 지나면 폐기된다.
 */
public class AuthorizationStateRegistry {

    private static final Logger log = Logger.getLogger(AuthorizationStateRegistry.class);
    private static final int STATE_BYTES = 24;

    private final ClockPort clockPort;
    private final Duration ttl;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, IssuedState> issued = new ConcurrentHashMap<>();

    public AuthorizationStateRegistry(ClockPort clockPort, Duration ttl) {
        this.clockPort = clockPort;
        this.ttl = ttl;
    }

    public String issue(CalendarProvider provider) {
        cleanup();
        byte[] bytes = new byte[STATE_BYTES];
        random.nextBytes(bytes);
        String state = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        issued.put(state, new IssuedState(provider, clockPort.now().plus(ttl)));
        return state;
    }

    /**
     * 발급된 적 있고 만료되지 않았으며 같은 제공자의 state 일 때만 true. 확인한 state 는 다시 쓸 수 없다.
     */
    public boolean consume(CalendarProvider provider, String state) {
        if (state == null || state.isBlank()) {
            return false;
        }
        IssuedState found = issued.remove(state);
        if (found == null) {
            return false;
        }
        if (found.provider() != provider) {
            log.warnf("다른 제공자의 state 로 콜백이 들어왔습니다: 발급=%s, 콜백=%s", found.provider().key(), provider.key());
            return false;
        }
        return !clockPort.now().isAfter(found.expiresAt());
    }

    public void revoke(String state) {
        if (state != null) {
            issued.remove(state);
        }
    }

    int pendingCount() {
        cleanup();
        return issued.size();
    }

    private void cleanup() {
        OffsetDateTime now = clockPort.now();
        issued.entrySet().removeIf(entry -> now.isAfter(entry.getValue().expiresAt()));
    }

    private record IssuedState(CalendarProvider provider, OffsetDateTime expiresAt) {
    }
}
