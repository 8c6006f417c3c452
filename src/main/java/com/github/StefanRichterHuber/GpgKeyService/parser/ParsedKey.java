package com.github.StefanRichterHuber.GpgKeyService.parser;

import java.util.List;

import org.bouncycastle.openpgp.PGPPublicKey;

/**
 * Structural content of an armored public key block.
 *
 * @param primaryKey          the primary key of the first key ring
 * @param subkeys             the subkeys of the first key ring
 * @param identities          the user ids of the primary key
 * @param ignoredKeyRingCount number of further key rings in the block, which
 *                            are not used
 */
public record ParsedKey(
        PGPPublicKey primaryKey,
        List<PGPPublicKey> subkeys,
        List<IdentityClaim> identities,
        int ignoredKeyRingCount) {

    public ParsedKey {
        subkeys = List.copyOf(subkeys);
        identities = List.copyOf(identities);
    }

    public String keyId() {
        return GpgKeyContent.keyIdString(primaryKey.getKeyID());
    }
}
