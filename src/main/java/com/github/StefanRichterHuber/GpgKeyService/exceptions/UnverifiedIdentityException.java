package com.github.StefanRichterHuber.GpgKeyService.exceptions;

/**
 * An identity of the submitted key is not backed by a verified email address of
 * the submitting owner.
 */
public class UnverifiedIdentityException extends GpgKeyException {

    private final String identity;

    public UnverifiedIdentityException(String identity, String message) {
        super(message);
        this.identity = identity;
    }

    /**
     * The offending email address, or the whole user id if it carries no email.
     */
    public String getIdentity() {
        return identity;
    }
}
