package com.vouch.auth.flow;

import com.vouch.auth.api.dto.PasswordResetConfirmRequestDto;
import com.vouch.auth.config.TokenProperties;
import com.vouch.auth.domain.exception.InvalidEmailException;
import com.vouch.auth.domain.exception.InvalidTokenException;
import com.vouch.auth.domain.exception.RateLimitExceededException;
import com.vouch.auth.domain.exception.TokenExpiredException;
import com.vouch.auth.domain.model.AccountStatus;
import com.vouch.auth.domain.model.EmailVerificationResult;
import com.vouch.auth.domain.model.FlowType;
import com.vouch.auth.domain.notify.Notifier;
import com.vouch.auth.domain.ratelimit.StoreWindowRateLimiter;
import com.vouch.auth.domain.service.PasswordResetService;
import com.vouch.auth.domain.service.SecretGenerator;
import com.vouch.auth.domain.service.TokenManager;
import com.vouch.auth.domain.service.UserService;
import com.vouch.auth.domain.utils.CryptoUtils;
import com.vouch.auth.domain.utils.EmailAddressValidator;
import com.vouch.auth.infrastructure.entity.EmailTokenEntity;
import com.vouch.auth.infrastructure.entity.UserEntity;
import com.vouch.auth.infrastructure.notify.ConfiguredVerificationUrlBuilder;
import com.vouch.auth.infrastructure.repository.EmailTokenRepository;
import com.vouch.auth.infrastructure.repository.UserRepository;
import com.vouch.auth.infrastructure.store.JpaTokenStore;
import com.vouch.auth.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.transaction.PlatformTransactionManager;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Issuance and verification against a real database, with time moved by hand.
 */
@DataJpaTest
@Import(JpaTokenStore.class)
class TokenLifecycleFlowTest {

    private static final Instant START = Instant.parse("2026-03-02T10:00:00Z");
    private static final String EMAIL = "erin@example.com";

    @Autowired JpaTokenStore tokenStore;
    @Autowired EmailTokenRepository tokenRepository;
    @Autowired UserRepository userRepository;
    @Autowired TestEntityManager entityManager;
    @Autowired PlatformTransactionManager transactionManager;

    private final CryptoUtils cryptoUtils = new CryptoUtils();

    private MutableClock clock;
    private Notifier notifier;
    private TokenManager tokenManager;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        notifier = mock(Notifier.class);
        TokenProperties properties = new TokenProperties();

        tokenManager = new TokenManager(
                tokenStore,
                new StoreWindowRateLimiter(tokenStore, properties, clock),
                new SecretGenerator(new SecureRandom()),
                cryptoUtils,
                new EmailAddressValidator(),
                notifier,
                new ConfiguredVerificationUrlBuilder(properties),
                properties,
                clock,
                transactionManager);

        UserEntity user = new UserEntity();
        user.setId(UUID.randomUUID());
        user.setEmail(EMAIL);
        user.setPasswordHash(new BCryptPasswordEncoder(4).encode("old-password-1"));
        user.setStatus(AccountStatus.PENDING_EMAIL_VERIFICATION.toString());
        user.setCreatedAt(START.minus(Duration.ofDays(2)));
        user.setUpdatedAt(START.minus(Duration.ofDays(2)));
        userId = entityManager.persistAndFlush(user).getId();
    }

    @Test
    void fourth_reset_request_in_an_hour_is_limited_and_allowed_again_after_the_window() {
        for (int i = 0; i < 3; i++) {
            tokenManager.requestPasswordReset(EMAIL, "203.0.113.7", "Mozilla/5.0");
            clock.advance(Duration.ofMinutes(1));
        }

        assertThrows(RateLimitExceededException.class,
                () -> tokenManager.requestPasswordReset(EMAIL, "203.0.113.7", "Mozilla/5.0"));
        assertThat(tokenRepository.count()).isEqualTo(3);

        clock.advance(Duration.ofMinutes(61));
        tokenManager.requestPasswordReset(EMAIL, "203.0.113.7", "Mozilla/5.0");

        assertThat(tokenRepository.count()).isEqualTo(4);
        verify(notifier, times(4)).sendPasswordResetCode(eq(EMAIL), any(), any());
    }

    @Test
    void stored_record_never_contains_the_plain_code() {
        String code = requestResetCode();

        List<EmailTokenEntity> tokens = tokenRepository.findAll();
        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getTokenHash()).hasSize(64).isNotEqualTo(code).isEqualTo(cryptoUtils.hashSecret(code));
    }

    @Test
    void wrong_code_keeps_record_unused_then_correct_code_succeeds_once() {
        String code = requestResetCode();
        String wrong = code.equals("000000") ? "111111" : "000000";

        assertThrows(InvalidTokenException.class, () -> tokenManager.verifyPasswordResetCode(EMAIL, wrong));
        EmailTokenEntity afterMiss = tokenRepository.findAll().get(0);
        assertThat(afterMiss.isUsed()).isFalse();
        assertThat(afterMiss.getFailedAttempts()).isEqualTo(1);

        assertThat(tokenManager.verifyPasswordResetCode(EMAIL, code)).isEqualTo(userId);
        assertThat(tokenRepository.findAll().get(0).isUsed()).isTrue();

        assertThrows(InvalidTokenException.class, () -> tokenManager.verifyPasswordResetCode(EMAIL, code));
    }

    @Test
    void newer_code_supersedes_an_older_one() {
        String first = requestResetCode();
        clock.advance(Duration.ofMinutes(1));
        String second = requestResetCode();

        if (!first.equals(second)) {
            assertThrows(InvalidTokenException.class, () -> tokenManager.verifyPasswordResetCode(EMAIL, first));
        }
        assertThat(tokenManager.verifyPasswordResetCode(EMAIL, second)).isEqualTo(userId);
    }

    @Test
    void successful_reset_retires_every_older_code() {
        String first = requestResetCode();
        clock.advance(Duration.ofMinutes(1));
        String second = requestResetCode();

        assertThat(tokenManager.verifyPasswordResetCode(EMAIL, second)).isEqualTo(userId);

        assertThrows(InvalidTokenException.class, () -> tokenManager.verifyPasswordResetCode(EMAIL, first));
        assertThat(tokenRepository.findAll()).allMatch(EmailTokenEntity::isUsed);
    }

    @Test
    void code_is_expired_after_fifteen_minutes() {
        String code = requestResetCode();

        clock.advance(Duration.ofMinutes(16));

        assertThrows(TokenExpiredException.class, () -> tokenManager.verifyPasswordResetCode(EMAIL, code));
    }

    @Test
    void five_wrong_codes_burn_the_record() {
        String code = requestResetCode();
        String wrong = code.equals("000000") ? "111111" : "000000";

        for (int i = 0; i < 5; i++) {
            assertThrows(InvalidTokenException.class, () -> tokenManager.verifyPasswordResetCode(EMAIL, wrong));
        }

        assertThat(tokenRepository.findAll().get(0).isUsed()).isTrue();
        assertThrows(InvalidTokenException.class, () -> tokenManager.verifyPasswordResetCode(EMAIL, code));
    }

    @Test
    void unknown_email_gets_no_record_and_no_message() {
        tokenManager.requestPasswordReset("nobody@example.com", null, null);

        assertThat(tokenRepository.count()).isZero();
        verifyNoInteractions(notifier);
    }

    @Test
    void confirmed_reset_stores_a_new_bcrypt_password() {
        PasswordResetService resetService = new PasswordResetService(tokenManager, new UserService(userRepository, clock));
        String code = requestResetCode();

        PasswordResetConfirmRequestDto request = new PasswordResetConfirmRequestDto();
        request.setEmail(EMAIL);
        request.setCode(code);
        request.setNewPassword("new-password-2");
        resetService.confirmReset(request);

        UserEntity user = entityManager.find(UserEntity.class, userId);
        assertThat(new BCryptPasswordEncoder().matches("new-password-2", user.getPasswordHash())).isTrue();
    }

    @Test
    void email_verification_sets_timestamp_once_and_replay_is_rejected() {
        String firstToken = requestVerificationToken();

        EmailVerificationResult first = tokenManager.verifyEmailToken(firstToken);
        assertThat(first.getUserId()).isEqualTo(userId);
        assertThat(first.isNewlyVerified()).isTrue();
        assertThat(first.getVerifiedAt()).isEqualTo(START);

        clock.advance(Duration.ofMinutes(5));
        assertThrows(InvalidTokenException.class, () -> tokenManager.verifyEmailToken(firstToken));
        assertThat(userRepository.findEmailVerifiedAtByUserId(userId)).contains(START);
        assertThat(entityManager.find(UserEntity.class, userId).getStatus()).isEqualTo(AccountStatus.ACTIVE.toString());

        String secondToken = requestVerificationToken();
        EmailVerificationResult second = tokenManager.verifyEmailToken(secondToken);
        assertThat(second.isNewlyVerified()).isFalse();
        assertThat(second.getVerifiedAt()).isEqualTo(START);
    }

    @Test
    void verification_cannot_be_sent_to_an_address_the_account_does_not_own() {
        assertThrows(InvalidEmailException.class,
                () -> tokenManager.requestEmailVerification(userId, "attacker@example.org", "203.0.113.7", "Mozilla/5.0"));

        assertThat(tokenRepository.count()).isZero();
        verifyNoInteractions(notifier);
        assertThat(userRepository.findEmailVerifiedAtByUserId(userId)).isEmpty();
    }

    @Test
    void link_sent_before_an_address_change_does_not_verify_the_new_address() {
        String token = requestVerificationToken();

        UserEntity user = entityManager.find(UserEntity.class, userId);
        user.setEmail("erin.new@example.com");
        entityManager.persistAndFlush(user);
        entityManager.clear();

        assertThrows(InvalidTokenException.class, () -> tokenManager.verifyEmailToken(token));
        assertThat(userRepository.findEmailVerifiedAtByUserId(userId)).isEmpty();
    }

    @Test
    void verification_request_without_an_address_uses_the_account_address() {
        reset(notifier);
        tokenManager.requestEmailVerification(userId, null, null, null);

        verify(notifier).sendEmailVerification(eq(EMAIL), any());
        assertThat(tokenRepository.findAll()).extracting(EmailTokenEntity::getEmail).containsExactly(EMAIL);
    }

    @Test
    void verification_link_expires_after_forty_eight_hours() {
        String token = requestVerificationToken();

        clock.advance(Duration.ofHours(48).plusSeconds(1));

        assertThrows(TokenExpiredException.class, () -> tokenManager.verifyEmailToken(token));
        assertThat(userRepository.findEmailVerifiedAtByUserId(userId)).isEmpty();
    }

    @Test
    void reset_code_cannot_be_used_as_a_verification_token() {
        String code = requestResetCode();

        assertThrows(InvalidTokenException.class, () -> tokenManager.verifyEmailToken(code));
        assertThat(tokenStore.countActiveByType(clock.instant())).containsEntry(FlowType.PASSWORD_RESET, 1L);
    }

    private String requestResetCode() {
        reset(notifier);
        tokenManager.requestPasswordReset(EMAIL, "203.0.113.7", "Mozilla/5.0");
        ArgumentCaptor<String> code = ArgumentCaptor.forClass(String.class);
        verify(notifier).sendPasswordResetCode(eq(EMAIL), code.capture(), any());
        return code.getValue();
    }

    private String requestVerificationToken() {
        reset(notifier);
        tokenManager.requestEmailVerification(userId, EMAIL, "203.0.113.7", "Mozilla/5.0");
        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(notifier).sendEmailVerification(eq(EMAIL), url.capture());
        assertThat(url.getValue()).startsWith("https://app.vouch.dev/verify?token=");
        return url.getValue().substring(url.getValue().indexOf("token=") + "token=".length());
    }
}
