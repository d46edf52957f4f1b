package com.my.logbook.domain.port.out;

import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.ProviderEvent;
import com.my.logbook.domain.model.TimeRange;
import com.my.logbook.domain.model.TokenBundle;

import java.net.URI;
import java.util.List;

/**
 * 왜: 제공자별 OAuth/캘린더 API 연동을 추상화하여 도메인이 외부 SDK 세부 구현에 의존하지 않도록 하기 위함.
 */
public interface CalendarProviderPort {

    CalendarProvider provider();

    /**
     * 왜: 사용자가 직접 승인할 인증 링크를 만들기 위함. 클라이언트 ID가 없으면 ConfigurationMissingException.
     * state 는 콜백에서 그대로 돌아와야 하는 일회용 값이다.
     */
    URI authorizationUrl(String state);

    /**
     * 왜: 콜백으로 받은 인증 코드를 토큰과 계정 식별 정보로 교환하기 위함.
     */
    TokenBundle exchangeAuthCode(String authCode);

    /**
     * 왜: 읽기 전용 범위에서 한 계정의 일정을 조회하기 위함.
     */
    List<ProviderEvent> listEvents(String accessToken, String calendarRef, TimeRange window);
}
