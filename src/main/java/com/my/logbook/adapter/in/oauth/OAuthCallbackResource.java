package com.my.logbook.adapter.in.oauth;

import com.my.logbook.domain.exception.DuplicateAccountException;
import com.my.logbook.domain.model.CalendarAccount;
import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.model.OAuthCallbackMessage;
import com.my.logbook.domain.model.OAuthMessageEnvelope;
import com.my.logbook.domain.port.in.CompleteAuthorizationUseCase;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 왜: 제공자가 리다이렉트하는 같은 출처의 콜백 페이지에서 인증 코드를 교환하고, 결과를 대기 중인 연결 흐름에 알리기 위함.
 */
@Path("/oauth/{provider}/callback")
public class OAuthCallbackResource {

    private final CompleteAuthorizationUseCase completeAuthorizationUseCase;

    @Inject
    public OAuthCallbackResource(CompleteAuthorizationUseCase completeAuthorizationUseCase) {
        this.completeAuthorizationUseCase = completeAuthorizationUseCase;
    }

    @GET
    @Produces(MediaType.TEXT_HTML)
    public String callback(@PathParam("provider") String providerKey,
                           @QueryParam("code") String code,
                           @QueryParam("error") String error,
                           @QueryParam("error_description") String errorDescription,
                           @QueryParam("state") String state) {
        CalendarProvider provider = CalendarProvider.fromKey(providerKey);
        String reason = errorDescription != null && !errorDescription.isBlank() ? errorDescription : error;
        OAuthMessageEnvelope envelope = completeAuthorizationUseCase.complete(provider, code, reason, state);
        return render(provider, envelope);
    }

    /**
     * 토큰 교환이 성공해도 계정 등록 결과에 따라 완료, 이미 연결됨, 실패 중 하나를 보여준다.
     */
    static String render(CalendarProvider provider, OAuthMessageEnvelope envelope) {
        OAuthCallbackMessage message = envelope.message();
        String providerName = escape(provider.defaultDisplayName());
        if (!message.isSuccessFor(provider)) {
            return page("연결 실패", providerName + " 연결에 실패했습니다: " + escape(message.error()));
        }
        CompletableFuture<CalendarAccount> outcome = envelope.outcome();
        if (!outcome.isDone() || outcome.isCancelled()) {
            return page("연결 실패", providerName + " 인증은 끝났지만 계정 등록을 처리하지 못했습니다. 다시 연결해 주세요.");
        }
        try {
            outcome.join();
            return page("연결 완료", providerName + " 계정이 연결되었습니다. 이 창을 닫아도 됩니다.");
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DuplicateAccountException) {
                DuplicateAccountException duplicate = (DuplicateAccountException) cause;
                return page("이미 연결된 계정", providerName + " 계정(" + escape(duplicate.email())
                        + ")은 이미 연결되어 있습니다. 이 창을 닫아도 됩니다.");
            }
            return page("연결 실패", providerName + " 계정을 등록하지 못했습니다: " + escape(cause.getMessage()));
        }
    }

    private static String page(String title, String body) {
        return "<!DOCTYPE html><html lang=\"ko\"><head><meta charset=\"utf-8\"><title>" + title + "</title></head>"
                + "<body><h1>" + title + "</h1><p>" + body + "</p></body></html>";
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
