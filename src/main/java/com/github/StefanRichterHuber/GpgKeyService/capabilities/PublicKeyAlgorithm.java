package com.github.StefanRichterHuber.GpgKeyService.capabilities;

import java.util.Arrays;
import java.util.Optional;

/**
 * OpenPGP public key algorithms (RFC 4880, RFC 9580) and the operations they
 * support.
 */
public enum PublicKeyAlgorithm {
    RSA_GENERAL(1, true, true),
    RSA_ENCRYPT(2, false, true),
    RSA_SIGN(3, true, false),
    ELGAMAL_ENCRYPT(16, false, true),
    DSA(17, true, false),
    ECDH(18, false, true),
    ECDSA(19, true, false),
    ELGAMAL_GENERAL(20, true, true),
    EDDSA_LEGACY(22, true, false),
    X25519(25, false, true),
    X448(26, false, true),
    ED25519(27, true, false),
    ED448(28, true, false);

    private final int id;
    private final boolean canSign;
    private final boolean canEncrypt;

    PublicKeyAlgorithm(int id, boolean canSign, boolean canEncrypt) {
        this.id = id;
        this.canSign = canSign;
        this.canEncrypt = canEncrypt;
    }

    public int id() {
        return id;
    }

    public boolean canSign() {
        return canSign;
    }

    public boolean canEncrypt() {
        return canEncrypt;
    }

    public static Optional<PublicKeyAlgorithm> fromId(int id) {
        return Arrays.stream(values()).filter(algorithm -> algorithm.id == id).findFirst();
    }
}
