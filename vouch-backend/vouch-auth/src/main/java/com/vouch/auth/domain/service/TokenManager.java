package com.vouch.auth.domain.service;

import com.vouch.auth.config.TokenProperties;
import com.vouch.auth.domain.exception.InvalidEmailException;
import com.vouch.auth.domain.exception.InvalidTokenException;
import com.vouch.auth.domain.exception.NotifyException;
import com.vouch.auth.domain.exception.StoreException;
import com.vouch.auth.domain.exception.TokenExpiredException;
import com.vouch.auth.domain.model.EmailVerificationResult;
import com.vouch.auth.domain.model.FlowType;
import com.vouch.auth.domain.model.RequestSecurityContext;
import com.vouch.auth.domain.notify.Notifier;
import com.vouch.auth.domain.notify.VerificationUrlBuilder;
import com.vouch.auth.domain.ratelimit.RateLimiter;
import com.vouch.auth.domain.store.TokenStore;
import com.vouch.auth.domain.utils.CryptoUtils;
import com.vouch.auth.domain.utils.EmailAddressValidator;
import com.vouch.auth.infrastructure.entity.EmailTokenEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static com.vouch.auth.domain.constants.TokenConstants.MAX_REQUEST_IP_LENGTH;
import static com.vouch.auth.domain.constants.TokenConstants.MAX_USER_AGENT_LENGTH;

/**
 * Token Manager - issuance and verification for password-reset codes
 * and email-verification links.
 *
 * Issuance: validate email -> rate limit -> generate -> hash -> persist -> notify.
 * Persistence commits before the notifier runs, so a delivery failure leaves a usable token.
 * Verification: lookup -> expiry -> constant-time compare -> atomic mark-used.
 */
@Service
@Slf4j
public class TokenManager {

    private final TokenStore tokenStore;
    private final RateLimiter rateLimiter;
    private final SecretGenerator secretGenerator;
    private final CryptoUtils cryptoUtils;
    private final EmailAddressValidator emailValidator;
    private final Notifier notifier;
    private final VerificationUrlBuilder urlBuilder;
    private final TokenProperties properties;
    private final Clock clock;
    private final TransactionTemplate serializableTransaction;

    public TokenManager(TokenStore tokenStore,
                        RateLimiter rateLimiter,
                        SecretGenerator secretGenerator,
                        CryptoUtils cryptoUtils,
                        EmailAddressValidator emailValidator,
                        Notifier notifier,
                        VerificationUrlBuilder urlBuilder,
                        TokenProperties properties,
                        Clock clock,
                        PlatformTransactionManager transactionManager) {
        this.tokenStore = tokenStore;
        this.rateLimiter = rateLimiter;
        this.secretGenerator = secretGenerator;
        this.cryptoUtils = cryptoUtils;
        this.emailValidator = emailValidator;
        this.notifier = notifier;
        this.urlBuilder = urlBuilder;
        this.properties = properties;
        this.clock = clock;
        this.serializableTransaction = new TransactionTemplate(transactionManager);
        this.serializableTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
    }

    /* ================= PASSWORD RESET ================= */

    /**
     * Issue a password-reset code and hand it to the notifier.
     * Returns normally, without persisting or notifying, when no account uses the email.
     */
    public void requestPasswordReset(String email, String requestIp, String userAgent) {
        String normalizedEmail = emailValidator.normalize(email);
        log.info("[RESET_REQUEST_START] Password reset requested | email={} | ip={}", normalizedEmail, requestIp);

        Optional<IssuedSecret> issued = runIssuance(() -> {
            rateLimiter.checkRateLimit(normalizedEmail, FlowType.PASSWORD_RESET);

            String code = secretGenerator.generateNumericCode(properties.getPasswordReset().getCodeLength());
            String codeHash = cryptoUtils.hashSecret(code);

            Optional<UUID> userId = tokenStore.findUserIdByEmail(normalizedEmail);
            if (userId.isEmpty()) {
                log.info("[RESET_UNKNOWN_EMAIL] No account for email, nothing issued | email={}", normalizedEmail);
                return Optional.empty();
            }

            EmailTokenEntity token = tokenStore.save(buildToken(codeHash, userId.get(), normalizedEmail,
                    FlowType.PASSWORD_RESET, properties.getPasswordReset().getTtl(), requestIp, userAgent));
            return Optional.of(new IssuedSecret(code, token));
        });

        if (issued.isEmpty()) {
            return;
        }

        EmailTokenEntity token = issued.get().token;
        log.info("[RESET_CODE_ISSUED] Reset code stored | userId={} | tokenId={} | expiresAt={}",
                token.getUserId(), token.getId(), token.getExpiresAt());

        RequestSecurityContext securityContext = new RequestSecurityContext(
                token.getRequestIp(), token.getUserAgent(), token.getCreatedAt());
        deliver(FlowType.PASSWORD_RESET, normalizedEmail,
                () -> notifier.sendPasswordResetCode(normalizedEmail, issued.get().rawSecret, securityContext));

        log.info("[RESET_REQUEST_SUCCESS] Reset code handed to notifier | userId={}", token.getUserId());
    }

    /**
     * Verify a password-reset code against the newest unused record for the email.
     *
     * @return the owning user id; the record and any older unused codes for the email are used afterwards
     */
    public UUID verifyPasswordResetCode(String email, String code) {
        String normalizedEmail = emailValidator.normalize(email);
        if (code == null || code.isBlank()) {
            throw new InvalidTokenException("Reset code is required");
        }

        EmailTokenEntity token = tokenStore.findLatestUnused(normalizedEmail, FlowType.PASSWORD_RESET)
                .orElseThrow(() -> {
                    log.warn("[RESET_CODE_NOT_FOUND] No unused reset code | email={}", normalizedEmail);
                    return new InvalidTokenException("Invalid or expired reset code");
                });

        Instant now = clock.instant();
        if (now.isAfter(token.getExpiresAt())) {
            log.warn("[RESET_CODE_EXPIRED] Reset code expired | tokenId={} | expiresAt={}",
                    token.getId(), token.getExpiresAt());
            throw new TokenExpiredException("Reset code has expired");
        }

        String providedHash = cryptoUtils.hashSecret(code);
        if (!cryptoUtils.constantTimeEquals(providedHash, token.getTokenHash())) {
            recordMismatch(token, now);
            throw new InvalidTokenException("Invalid or expired reset code");
        }

        if (!tokenStore.markUsedAndRevokeOthers(token.getId(), normalizedEmail, FlowType.PASSWORD_RESET, now)) {
            log.warn("[RESET_CODE_RACE] Code consumed by a concurrent request | tokenId={}", token.getId());
            throw new InvalidTokenException("Invalid or expired reset code");
        }

        log.info("[RESET_CODE_VERIFIED] Reset code verified | userId={} | tokenId={}",
                token.getUserId(), token.getId());
        return token.getUserId();
    }

    /* ================= EMAIL VERIFICATION ================= */

    /**
     * Issue an email-verification link for an existing user, always to the account's own address.
     * A supplied {@code email} is optional and must name that address.
     */
    public void requestEmailVerification(UUID userId, String email, String requestIp, String userAgent) {
        if (userId == null) {
            throw new IllegalArgumentException("User id is required for email verification");
        }
        String normalizedEmail = resolveAccountEmail(userId, email);
        log.info("[VERIFICATION_REQUEST_START] Email verification requested | userId={} | email={}",
                userId, normalizedEmail);

        IssuedSecret issued = runIssuance(() -> {
            rateLimiter.checkRateLimit(normalizedEmail, FlowType.EMAIL_VERIFICATION);

            String rawToken = secretGenerator.generateOpaqueToken();
            String tokenHash = cryptoUtils.hashSecret(rawToken);

            EmailTokenEntity token = tokenStore.save(buildToken(tokenHash, userId, normalizedEmail,
                    FlowType.EMAIL_VERIFICATION, properties.getEmailVerification().getTtl(), requestIp, userAgent));
            return new IssuedSecret(rawToken, token);
        });

        log.info("[VERIFICATION_TOKEN_ISSUED] Verification token stored | userId={} | tokenId={} | hash={}...",
                userId, issued.token.getId(), issued.token.getTokenHash().substring(0, 8));

        String verificationUrl = urlBuilder.buildVerificationUrl(issued.rawSecret);
        deliver(FlowType.EMAIL_VERIFICATION, normalizedEmail,
                () -> notifier.sendEmailVerification(normalizedEmail, verificationUrl));

        log.info("[VERIFICATION_REQUEST_SUCCESS] Verification link handed to notifier | userId={}", userId);
    }

    /**
     * Consume an email-verification token and mark the owner's email verified.
     * Only the first successful call for a user sets the verified timestamp.
     */
    public EmailVerificationResult verifyEmailToken(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new InvalidTokenException("Verification token is required");
        }

        String tokenHash = cryptoUtils.hashSecret(rawToken);
        log.info("[VERIFY_EMAIL_START] Email verification initiated | hash={}...", tokenHash.substring(0, 8));

        EmailTokenEntity token = tokenStore.findUnusedByHash(tokenHash, FlowType.EMAIL_VERIFICATION)
                .orElseThrow(() -> {
                    log.warn("[TOKEN_INVALID] No unused verification token | hash={}...", tokenHash.substring(0, 8));
                    return new InvalidTokenException("Invalid or expired verification token");
                });

        Instant now = clock.instant();
        if (now.isAfter(token.getExpiresAt())) {
            log.warn("[TOKEN_EXPIRED] Verification token expired | tokenId={} | expiresAt={}",
                    token.getId(), token.getExpiresAt());
            throw new TokenExpiredException("Verification token has expired");
        }

        if (!cryptoUtils.constantTimeEquals(tokenHash, token.getTokenHash())) {
            throw new InvalidTokenException("Invalid or expired verification token");
        }

        if (!tokenStore.markUsed(token.getId(), now)) {
            log.warn("[TOKEN_RACE] Verification token consumed by a concurrent request | tokenId={}", token.getId());
            throw new InvalidTokenException("Invalid or expired verification token");
        }

        boolean addressCurrent = tokenStore.findUserEmail(token.getUserId())
                .map(accountEmail -> accountEmail.equalsIgnoreCase(token.getEmail()))
                .orElse(false);
        if (!addressCurrent) {
            log.warn("[TOKEN_ADDRESS_STALE] Link address no longer matches the account | userId={} | tokenId={}",
                    token.getUserId(), token.getId());
            throw new InvalidTokenException("Invalid or expired verification token");
        }

        boolean newlyVerified = tokenStore.markEmailVerifiedIfUnset(token.getUserId(), token.getEmail(), now);
        Instant verifiedAt = newlyVerified
                ? now
                : tokenStore.findEmailVerifiedAt(token.getUserId()).orElse(null);

        log.info("[EMAIL_VERIFIED] Email verification completed | userId={} | newlyVerified={}",
                token.getUserId(), newlyVerified);
        return new EmailVerificationResult(token.getUserId(), token.getEmail(), newlyVerified, verifiedAt);
    }

    /* ================= HELPERS ================= */

    private String resolveAccountEmail(UUID userId, String requestedEmail) {
        String accountEmail = tokenStore.findUserEmail(userId)
                .map(emailValidator::normalize)
                .orElseThrow(() -> new IllegalArgumentException("No account for user id " + userId));

        if (requestedEmail != null && !requestedEmail.isBlank()
                && !emailValidator.normalize(requestedEmail).equals(accountEmail)) {
            log.warn("[VERIFICATION_ADDRESS_MISMATCH] Requested address is not the account address | userId={}", userId);
            throw new InvalidEmailException("Email does not match the signed-in account");
        }
        return accountEmail;
    }

    private void recordMismatch(EmailTokenEntity token, Instant now) {
        int attempts = tokenStore.recordFailedAttempt(token.getId());
        int maxAttempts = properties.getPasswordReset().getMaxAttempts();

        if (attempts >= maxAttempts) {
            tokenStore.markUsed(token.getId(), now);
            log.warn("[RESET_CODE_BURNED] Max attempts reached, code invalidated | tokenId={} | attempts={}",
                    token.getId(), attempts);
            return;
        }
        log.warn("[RESET_CODE_INVALID] Reset code mismatch | tokenId={} | attempts={}/{}",
                token.getId(), attempts, maxAttempts);
    }

    /**
     * Run the rate-limit check and insert, inside one serializable transaction when strict mode is on.
     */
    private <T> T runIssuance(Supplier<T> issuance) {
        if (!properties.getRateLimit().isStrict()) {
            return issuance.get();
        }
        try {
            return serializableTransaction.execute(status -> issuance.get());
        } catch (TransactionException | DataAccessException e) {
            log.error("[ISSUANCE_TX_FAILED] Serializable issuance did not commit | error={}", e.getMessage(), e);
            throw new StoreException("Token issuance could not be committed", e);
        }
    }

    private void deliver(FlowType flowType, String email, Runnable delivery) {
        try {
            delivery.run();
        } catch (NotifyException e) {
            log.error("[NOTIFY_FAILED] Delivery failed, token kept | flow={} | email={} | error={}",
                    flowType, email, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[NOTIFY_FAILED] Delivery failed, token kept | flow={} | email={} | error={}",
                    flowType, email, e.getMessage(), e);
            throw new NotifyException("Failed to deliver " + flowType + " message", e);
        }
    }

    private EmailTokenEntity buildToken(String tokenHash, UUID userId, String email, FlowType type,
                                        Duration ttl, String requestIp, String userAgent) {
        Instant now = clock.instant();

        EmailTokenEntity token = new EmailTokenEntity();
        token.setTokenHash(tokenHash);
        token.setUserId(userId);
        token.setEmail(email);
        token.setType(type);
        token.setCreatedAt(now);
        token.setExpiresAt(now.plus(ttl));
        token.setUsed(false);
        token.setFailedAttempts(0);
        token.setRequestIp(truncate(requestIp, MAX_REQUEST_IP_LENGTH));
        token.setUserAgent(truncate(userAgent, MAX_USER_AGENT_LENGTH));
        return token;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static final class IssuedSecret {
        private final String rawSecret;
        private final EmailTokenEntity token;

        private IssuedSecret(String rawSecret, EmailTokenEntity token) {
            this.rawSecret = rawSecret;
            this.token = token;
        }
    }
}
