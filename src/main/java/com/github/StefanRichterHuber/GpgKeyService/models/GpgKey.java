package com.github.StefanRichterHuber.GpgKeyService.models;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A stored GPG key: either a primary key (primaryKeyId is null) with its bound
 * emails and subkeys, or a subkey.
 */
public record GpgKey(
        long id,
        long ownerId,
        String keyId,
        String primaryKeyId,
        String content,
        Instant created,
        Instant expires,
        Instant added,
        List<String> emails,
        List<GpgKey> subkeys,
        boolean canSign,
        boolean canEncryptComms,
        boolean canEncryptStorage,
        boolean canCertify) {

    public GpgKey {
        emails = emails != null ? List.copyOf(emails) : List.of();
        subkeys = subkeys != null ? List.copyOf(subkeys) : List.of();
    }

    public boolean isPrimary() {
        return primaryKeyId == null;
    }

    public Optional<Instant> expiry() {
        return Optional.ofNullable(expires);
    }

    public KeyCapabilities capabilities() {
        return new KeyCapabilities(canSign, canEncryptComms, canEncryptStorage, canCertify);
    }
}
