package com.vouch.auth.domain.notify;

import com.vouch.auth.domain.model.RequestSecurityContext;

/**
 * Hands a freshly issued code or link to the delivery channel.
 * Implementations report failure by throwing
 * {@link com.vouch.auth.domain.exception.NotifyException} and never retry internally.
 */
public interface Notifier {

    void sendPasswordResetCode(String email, String code, RequestSecurityContext securityContext);

    void sendEmailVerification(String email, String verificationUrl);
}
