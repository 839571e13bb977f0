package com.vouch.auth.infrastructure.notify;

import com.vouch.auth.domain.model.RequestSecurityContext;
import com.vouch.auth.domain.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Development notifier: writes codes and links to the log instead of sending them.
 * Never enable outside local environments.
 */
@Component
@ConditionalOnProperty(prefix = "vouch.notifier", name = "type", havingValue = "logging")
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public void sendPasswordResetCode(String email, String code, RequestSecurityContext securityContext) {
        log.info("[DEV_NOTIFY] Password reset code | email={} | code={} | ip={} | userAgent={}",
                email, code, securityContext.getRequestIp(), securityContext.getUserAgent());
    }

    @Override
    public void sendEmailVerification(String email, String verificationUrl) {
        log.info("[DEV_NOTIFY] Email verification link | email={} | url={}", email, verificationUrl);
    }
}
