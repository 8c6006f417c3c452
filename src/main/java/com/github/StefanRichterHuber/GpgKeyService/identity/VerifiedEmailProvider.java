package com.github.StefanRichterHuber.GpgKeyService.identity;

import java.util.List;

import com.github.StefanRichterHuber.GpgKeyService.models.VerifiedEmail;

/**
 * Looks up the email addresses registered for an account.
 */
public interface VerifiedEmailProvider {

    /**
     * Returns all email addresses of the given owner together with their
     * verification state.
     *
     * @param ownerId The account id.
     * @return The email addresses, empty if the owner has none.
     */
    List<VerifiedEmail> findByOwner(long ownerId);
}
