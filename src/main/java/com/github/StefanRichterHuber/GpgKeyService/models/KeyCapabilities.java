package com.github.StefanRichterHuber.GpgKeyService.models;

/**
 * What a single public key (primary key or subkey) may be used for.
 */
public record KeyCapabilities(boolean canSign, boolean canEncryptComms, boolean canEncryptStorage,
        boolean canCertify) {

    public static final KeyCapabilities NONE = new KeyCapabilities(false, false, false, false);
}
