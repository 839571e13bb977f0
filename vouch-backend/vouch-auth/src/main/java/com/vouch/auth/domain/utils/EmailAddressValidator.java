package com.vouch.auth.domain.utils;

import com.vouch.auth.domain.exception.InvalidEmailException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.vouch.auth.domain.constants.TokenConstants.MAX_EMAIL_LENGTH;

/**
 * Syntax check plus a block list of domains that never route to a real mailbox.
 * Domains must end in an alphabetic TLD, so IP literals are rejected by the pattern.
 */
@Component
public class EmailAddressValidator {

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[A-Z0-9._%+-]+@[A-Z0-9-]+(\\.[A-Z0-9-]+)*\\.[A-Z]{2,}$", Pattern.CASE_INSENSITIVE);

    private static final List<String> BLOCKED_DOMAINS = List.of("localhost", "localdomain");

    private static final List<String> BLOCKED_SUFFIXES = List.of(
            ".localhost", ".localdomain", ".local", ".internal", ".intranet", ".lan", ".home.arpa", ".invalid");

    /**
     * Validate and normalize (trim, lower-case) an email address.
     *
     * @throws InvalidEmailException if the address is unusable
     */
    public String normalize(String rawEmail) {
        if (rawEmail == null || rawEmail.isBlank()) {
            throw new InvalidEmailException("Email address is required");
        }
        // header injection
        if (rawEmail.indexOf('\r') >= 0 || rawEmail.indexOf('\n') >= 0) {
            throw new InvalidEmailException("Email address contains line breaks");
        }

        String email = rawEmail.trim().toLowerCase(Locale.ROOT);
        if (email.length() > MAX_EMAIL_LENGTH || !EMAIL_PATTERN.matcher(email).matches()) {
            throw new InvalidEmailException("Email address is malformed");
        }

        String domain = email.substring(email.indexOf('@') + 1);
        if (BLOCKED_DOMAINS.contains(domain) || BLOCKED_SUFFIXES.stream().anyMatch(domain::endsWith)) {
            throw new InvalidEmailException("Email domain is not routable");
        }
        return email;
    }

    public boolean isValid(String rawEmail) {
        try {
            normalize(rawEmail);
            return true;
        } catch (InvalidEmailException e) {
            return false;
        }
    }
}
