package com.my.logbook.domain.port.out;

import com.my.logbook.domain.model.CalendarProvider;

import java.net.URI;

/**
 * 왜: 인증 URL을 별도 대화형 창으로 여는 방식을 도메인에서 분리하기 위함.
 * 창의 닫힘 여부는 알 수 없다고 가정한다.
 */
public interface AuthWindowPort {
    void open(CalendarProvider provider, URI authorizationUrl);
}
