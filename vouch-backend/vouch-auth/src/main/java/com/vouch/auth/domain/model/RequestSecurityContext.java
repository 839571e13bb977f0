package com.vouch.auth.domain.model;

import java.time.Instant;

/**
 * Request metadata handed to the notifier so the recipient can tell
 * where a password reset originated.
 */
public class RequestSecurityContext {

    private final String requestIp;
    private final String userAgent;
    private final Instant requestTime;

    public RequestSecurityContext(String requestIp, String userAgent, Instant requestTime) {
        this.requestIp = requestIp;
        this.userAgent = userAgent;
        this.requestTime = requestTime;
    }

    public String getRequestIp() {
        return requestIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Instant getRequestTime() {
        return requestTime;
    }
}
