package com.vouch.auth.domain.constants;

public final class TokenConstants {

    // Private constructor prevents instantiation
    private TokenConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static final String HASH_ALGORITHM = "SHA-256";
    public static final int HASH_HEX_LENGTH = 64;
    public static final int TOKEN_BYTE_LENGTH = 32;
    public static final int MIN_CODE_LENGTH = 1;
    public static final int MAX_CODE_LENGTH = 10;
    public static final int BCRYPT_COST_FACTOR = 12;

    public static final int MAX_EMAIL_LENGTH = 254;
    public static final int MAX_REQUEST_IP_LENGTH = 45;
    public static final int MAX_USER_AGENT_LENGTH = 512;

    // Header names set by the upstream gateway after it authenticates a caller
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLES_HEADER = "X-User-Roles";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    // Redis Key Prefixes
    public static final String REDIS_RATE_LIMIT_PREFIX = "vouch:ratelimit:";
}
