package com.github.StefanRichterHuber.GpgKeyService.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;

/**
 * A user id of a key, e.g. "Full Name (comment) &lt;email@example.com&gt;".
 *
 * @param userId the raw user id
 * @param email  the email address contained in the user id, null if none
 */
public record IdentityClaim(String userId, String email) {

    /**
     * "Full Name (comment) &lt;email@example.com&gt;"
     */
    private static final Pattern USER_ID_WITH_EMAIL = Pattern
            .compile("^.+ <([A-Z0-9a-z._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,64})>$");

    /**
     * Extracts the email address of a user id. The address must match the
     * expected "Name &lt;email&gt;" form and pass the strict RFC 822 check of
     * {@link InternetAddress}.
     */
    public static IdentityClaim of(final String userId) {
        if (userId == null) {
            return new IdentityClaim("", null);
        }
        final Matcher matcher = USER_ID_WITH_EMAIL.matcher(userId.trim());
        if (!matcher.matches()) {
            return new IdentityClaim(userId, null);
        }
        final String email = matcher.group(1);
        try {
            new InternetAddress(email, true).validate();
            return new IdentityClaim(userId, email);
        } catch (AddressException e) {
            return new IdentityClaim(userId, null);
        }
    }

    public boolean hasEmail() {
        return email != null;
    }
}
