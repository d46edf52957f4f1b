package com.my.logbook.adapter.in.rest;

import com.my.logbook.domain.exception.AccountNotFoundException;
import com.my.logbook.domain.exception.AuthDeniedException;
import com.my.logbook.domain.exception.AuthTimeoutException;
import com.my.logbook.domain.exception.CalendarFetchException;
import com.my.logbook.domain.exception.ConfigurationMissingException;
import com.my.logbook.domain.exception.DuplicateAccountException;
import com.my.logbook.domain.exception.SyncInProgressException;
import com.my.logbook.domain.exception.SyncNotConfiguredException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.concurrent.CompletionException;

/**
 * 왜: 도메인 예외를 일관된 HTTP 상태와 오류 본문으로 바꿔 호출 측이 메시지 문자열에 의존하지 않도록 하기 위함.
 */
@Provider
public class DomainExceptionMapper implements ExceptionMapper<RuntimeException> {

    private static final Logger log = Logger.getLogger(DomainExceptionMapper.class);

    @Override
    public Response toResponse(RuntimeException exception) {
        Throwable error = unwrap(exception);
        if (error instanceof WebApplicationException web) {
            return web.getResponse();
        }
        int status = statusOf(error);
        if (status >= 500) {
            log.errorf(error, "요청 처리 실패: %s", error.getMessage());
        } else {
            log.debugf("요청 거부(status=%d): %s", status, error.getMessage());
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorBody(codeOf(error), error.getMessage()))
                .build();
    }

    static int statusOf(Throwable error) {
        if (error instanceof IllegalArgumentException) {
            return 400;
        }
        if (error instanceof AuthDeniedException) {
            return 401;
        }
        if (error instanceof AccountNotFoundException) {
            return 404;
        }
        if (error instanceof AuthTimeoutException) {
            return 408;
        }
        if (error instanceof DuplicateAccountException || error instanceof SyncInProgressException) {
            return 409;
        }
        if (error instanceof SyncNotConfiguredException) {
            return 422;
        }
        if (error instanceof CalendarFetchException) {
            return 502;
        }
        if (error instanceof ConfigurationMissingException) {
            return 503;
        }
        return 500;
    }

    private static String codeOf(Throwable error) {
        String name = error.getClass().getSimpleName();
        return name.endsWith("Exception") ? name.substring(0, name.length() - "Exception".length()) : name;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public record ErrorBody(String error, String message) {
    }
}
