package com.my.logbook.domain.port.in;

import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.PendingAuthorization;

/**
 * 왜: 캘린더 연결 요청을 도메인 진입점 하나로 수렴시켜 인증 흐름과 계정 등록을 일관되게 처리하기 위함.
 */
public interface LinkCalendarUseCase {
    PendingAuthorization initiate(CalendarProvider provider);
}
