package com.my.logbook.adapter.out.window;

import com.my.logbook.domain.model.CalendarProvider;
import com.my.logbook.domain.port.out.AuthWindowPort;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

/**
 * 왜: 인증 URL을 시스템 브라우저 창으로 열기 위함. 화면이 없는 환경에서는 사용자가 직접 열 수 있도록 링크를 남긴다.
 */
@ApplicationScoped
public class BrowserAuthWindowAdapter implements AuthWindowPort {

    private static final Logger log = Logger.getLogger(BrowserAuthWindowAdapter.class);

    @Override
    public void open(CalendarProvider provider, URI authorizationUrl) {
        if (canBrowse()) {
            try {
                Desktop.getDesktop().browse(authorizationUrl);
                return;
            } catch (IOException | UnsupportedOperationException e) {
                log.warnf("브라우저를 열지 못했습니다: %s", e.getMessage());
            }
        }
        log.infof("🔑 %s 인증 링크: %s", provider.defaultDisplayName(), authorizationUrl);
    }

    private static boolean canBrowse() {
        return !GraphicsEnvironment.isHeadless()
                && Desktop.isDesktopSupported()
                && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE);
    }
}
