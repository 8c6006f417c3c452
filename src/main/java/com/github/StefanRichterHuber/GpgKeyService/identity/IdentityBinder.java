package com.github.StefanRichterHuber.GpgKeyService.identity;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.jboss.logging.Logger;

import com.github.StefanRichterHuber.GpgKeyService.config.GpgKeyConfig;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.UnverifiedIdentityException;
import com.github.StefanRichterHuber.GpgKeyService.models.VerifiedEmail;
import com.github.StefanRichterHuber.GpgKeyService.parser.IdentityClaim;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Binds the identities of a key to the verified email addresses of its owner. A
 * key is accepted only if every identity is backed by a verified address.
 */
@ApplicationScoped
public class IdentityBinder {

    @Inject
    GpgKeyConfig config;

    @Inject
    Logger logger;

    /**
     * Binds the identities of a key submitted by the given owner.
     *
     * @param ownerId    The submitting owner, used for logging.
     * @param identities The identities of the key.
     * @param emails     The email addresses of the owner.
     * @return The bound email addresses, never empty.
     * @throws UnverifiedIdentityException If an identity is not backed by a
     *                                     verified email address.
     */
    public List<String> bind(final long ownerId, final List<IdentityClaim> identities,
            final Collection<VerifiedEmail> emails) {
        try {
            final List<String> bound = bind(identities, emails, config.rejectIdentitiesWithoutEmail());
            logger.debugf("Bound emails %s for owner %d", bound, ownerId);
            return bound;
        } catch (UnverifiedIdentityException e) {
            logger.warnf("Rejected key for owner %d: %s", ownerId, e.getMessage());
            throw e;
        }
    }

    /**
     * Binds identities to verified email addresses. Matching is exact and case
     * sensitive. Each address is returned once, in the order of the identities.
     *
     * @param identities                 The identities of the key.
     * @param emails                     The email addresses of the owner.
     * @param rejectIdentitiesWithoutEmail Whether an identity without an email
     *                                   address rejects the key, or is ignored.
     * @return The bound email addresses, never empty.
     */
    public static List<String> bind(final List<IdentityClaim> identities, final Collection<VerifiedEmail> emails,
            final boolean rejectIdentitiesWithoutEmail) {
        if (identities == null || identities.isEmpty()) {
            throw new UnverifiedIdentityException("", "Key does not contain any identity");
        }
        final Collection<VerifiedEmail> ownerEmails = emails != null ? emails : List.of();

        final Set<String> bound = new LinkedHashSet<>();
        for (IdentityClaim identity : identities) {
            if (!identity.hasEmail()) {
                if (rejectIdentitiesWithoutEmail) {
                    throw new UnverifiedIdentityException(identity.userId(),
                            String.format("Identity '%s' does not contain an email address", identity.userId()));
                }
                continue;
            }
            final Optional<String> match = ownerEmails.stream()
                    .filter(VerifiedEmail::verified)
                    .map(VerifiedEmail::address)
                    .filter(identity.email()::equals)
                    .findFirst();
            if (match.isEmpty()) {
                throw new UnverifiedIdentityException(identity.email(),
                        String.format("Email %s is not a verified email address of the owner", identity.email()));
            }
            bound.add(match.get());
        }

        if (bound.isEmpty()) {
            throw new UnverifiedIdentityException("", "Key does not contain any identity with an email address");
        }
        return List.copyOf(bound);
    }
}
