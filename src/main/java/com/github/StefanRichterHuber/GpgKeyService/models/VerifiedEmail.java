package com.github.StefanRichterHuber.GpgKeyService.models;

/**
 * An email address registered for an account, together with the result of the
 * platform's email verification.
 */
public record VerifiedEmail(String address, boolean verified) {
}
