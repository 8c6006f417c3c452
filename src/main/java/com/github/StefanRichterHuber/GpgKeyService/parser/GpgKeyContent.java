package com.github.StefanRichterHuber.GpgKeyService.parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;

import org.bouncycastle.bcpg.BCPGInputStream;
import org.bouncycastle.bcpg.Packet;
import org.bouncycastle.bcpg.PublicKeyPacket;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.operator.KeyFingerPrintCalculator;
import org.bouncycastle.openpgp.operator.bc.BcKeyFingerprintCalculator;

import com.github.StefanRichterHuber.GpgKeyService.exceptions.MalformedKeyException;

/**
 * Conversions between BouncyCastle public keys and their stored form: the key
 * id as 16 upper case hex digits and the public key packet as base64.
 */
public final class GpgKeyContent {

    static final KeyFingerPrintCalculator FINGERPRINT_CALCULATOR = new BcKeyFingerprintCalculator();

    private GpgKeyContent() {
    }

    /**
     * Renders a 64 bit key id as 16 upper case hex digits.
     */
    public static String keyIdString(long keyId) {
        return String.format("%016X", keyId);
    }

    /**
     * Normalizes a user supplied key id (optional "0x" prefix, any case).
     */
    public static String normalizeKeyId(final String keyId) {
        if (keyId == null) {
            throw new IllegalArgumentException("keyId must not be null");
        }
        String trimmed = keyId.trim();
        if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
            trimmed = trimmed.substring(2);
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    /**
     * Serializes the public key packet (without user ids and signatures) of the
     * given key to base64.
     */
    public static String encode(final PGPPublicKey key) {
        try {
            return Base64.getEncoder().encodeToString(key.getPublicKeyPacket().getEncoded());
        } catch (IOException e) {
            throw new MalformedKeyException(
                    String.format("Failed to serialize public key packet of key %s", keyIdString(key.getKeyID())), e);
        }
    }

    /**
     * Reconstructs the public key from its stored base64 packet.
     */
    public static PGPPublicKey decode(final String content) {
        if (content == null || content.isEmpty()) {
            throw new MalformedKeyException("Key content must not be null or empty");
        }
        final byte[] raw;
        try {
            raw = Base64.getDecoder().decode(content);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException("Key content is not valid base64", e);
        }
        try (BCPGInputStream in = new BCPGInputStream(new ByteArrayInputStream(raw))) {
            final Packet packet = in.readPacket();
            if (!(packet instanceof PublicKeyPacket)) {
                throw new MalformedKeyException("Key content is not a public key packet");
            }
            return new PGPPublicKey((PublicKeyPacket) packet, FINGERPRINT_CALCULATOR);
        } catch (IOException | PGPException e) {
            throw new MalformedKeyException("Failed to decode public key packet", e);
        }
    }

    /**
     * The creation time declared by the key.
     */
    public static Instant creationTime(final PGPPublicKey key) {
        return key.getCreationTime().toInstant();
    }

    /**
     * The expiry declared by the key's self signature or binding signature, null
     * if the key does not expire.
     */
    public static Instant expirationTime(final PGPPublicKey key) {
        final long validSeconds = key.getValidSeconds();
        if (validSeconds <= 0) {
            return null;
        }
        return creationTime(key).plusSeconds(validSeconds);
    }
}
