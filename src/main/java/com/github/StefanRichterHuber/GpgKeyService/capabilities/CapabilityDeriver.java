package com.github.StefanRichterHuber.GpgKeyService.capabilities;

import java.util.Iterator;
import java.util.Optional;
import java.util.OptionalInt;

import org.bouncycastle.bcpg.sig.KeyFlags;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureSubpacketVector;

import com.github.StefanRichterHuber.GpgKeyService.models.KeyCapabilities;

/**
 * Derives the capabilities of a public key from its algorithm and the key flags
 * declared in its most recent self signature (primary key) or binding
 * signature (subkey). Unknown algorithms have no capabilities.
 */
public final class CapabilityDeriver {

    private CapabilityDeriver() {
    }

    /**
     * Derives the capabilities of a primary key or subkey.
     *
     * @param key          The key to inspect.
     * @param primaryKeyId The key id of the primary key issuing the self and
     *                     binding signatures.
     */
    public static KeyCapabilities derive(final PGPPublicKey key, final long primaryKeyId) {
        return derive(key.getAlgorithm(), declaredKeyFlags(key, primaryKeyId));
    }

    /**
     * Derives capabilities from an algorithm id and the declared key flags. If
     * key flags are declared, a capability requires both the algorithm and the
     * flag.
     */
    public static KeyCapabilities derive(final int algorithmId, final OptionalInt declaredKeyFlags) {
        final Optional<PublicKeyAlgorithm> algorithm = PublicKeyAlgorithm.fromId(algorithmId);
        if (algorithm.isEmpty()) {
            return KeyCapabilities.NONE;
        }
        final boolean sign = algorithm.get().canSign();
        final boolean encrypt = algorithm.get().canEncrypt();

        if (declaredKeyFlags.isEmpty()) {
            return new KeyCapabilities(sign, encrypt, encrypt, sign);
        }
        final int flags = declaredKeyFlags.getAsInt();
        return new KeyCapabilities(
                sign && (flags & KeyFlags.SIGN_DATA) != 0,
                encrypt && (flags & KeyFlags.ENCRYPT_COMMS) != 0,
                encrypt && (flags & KeyFlags.ENCRYPT_STORAGE) != 0,
                sign && (flags & KeyFlags.CERTIFY_OTHER) != 0);
    }

    /**
     * Key flags of the most recent self signature (primary key) or binding
     * signature (subkey) issued by the primary key that declares key flags. A
     * newer signature supersedes older ones, also when it narrows the flags.
     * Empty if no such signature declares key flags.
     */
    static OptionalInt declaredKeyFlags(final PGPPublicKey key, final long primaryKeyId) {
        PGPSignature latest = null;
        int latestFlags = 0;

        final Iterator<PGPSignature> signatures = key.getSignatures();
        while (signatures.hasNext()) {
            final PGPSignature signature = signatures.next();
            if (!isSelfOrBindingSignature(signature, key.isMasterKey())) {
                continue;
            }
            // Signatures carrying only an issuer fingerprint report key id 0
            if (signature.getKeyID() != primaryKeyId && signature.getKeyID() != 0L) {
                continue;
            }
            final PGPSignatureSubpacketVector hashed = signature.getHashedSubPackets();
            final int keyFlags = hashed != null ? hashed.getKeyFlags() : 0;
            if (keyFlags == 0) {
                continue;
            }
            if (latest == null || signature.getCreationTime().after(latest.getCreationTime())) {
                latest = signature;
                latestFlags = keyFlags;
            }
        }
        return latest != null ? OptionalInt.of(latestFlags) : OptionalInt.empty();
    }

    private static boolean isSelfOrBindingSignature(final PGPSignature signature, final boolean primaryKey) {
        final int type = signature.getSignatureType();
        if (!primaryKey) {
            return type == PGPSignature.SUBKEY_BINDING;
        }
        return type == PGPSignature.POSITIVE_CERTIFICATION
                || type == PGPSignature.CASUAL_CERTIFICATION
                || type == PGPSignature.NO_CERTIFICATION
                || type == PGPSignature.DEFAULT_CERTIFICATION
                || type == PGPSignature.DIRECT_KEY;
    }
}
