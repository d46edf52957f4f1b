package com.my.logbook.domain.port.in;

import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.OAuthMessageEnvelope;

/**
 * 왜: 콜백 페이지가 받은 코드/오류를 메시지 채널로 넘기는 단일 경로를 제공하기 위함.
 * 돌려받은 봉투의 처리 결과로 콜백 페이지가 실제 연결 여부를 보여준다.
 */
public interface CompleteAuthorizationUseCase {
    OAuthMessageEnvelope complete(CalendarProvider provider, String authCode, String error, String state);
}
