package com.github.StefanRichterHuber.GpgKeyService.models;

import java.time.Instant;
import java.util.List;

/**
 * A decoded and validated key (primary key or subkey) ready to be persisted.
 *
 * @param keyId        16 hex digit key id
 * @param content      base64 encoded public key packet
 * @param created      creation time declared by the key
 * @param expires      expiry declared by the key, null if the key does not
 *                     expire
 * @param capabilities derived capabilities
 * @param emails       bound email addresses, empty for subkeys
 */
public record PreparedKey(
        String keyId,
        String content,
        Instant created,
        Instant expires,
        KeyCapabilities capabilities,
        List<String> emails) {

    public PreparedKey {
        if (keyId == null || keyId.isEmpty()) {
            throw new IllegalArgumentException("keyId must not be null or empty");
        }
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("content must not be null or empty");
        }
        if (created == null) {
            throw new IllegalArgumentException("created must not be null");
        }
        capabilities = capabilities != null ? capabilities : KeyCapabilities.NONE;
        emails = emails != null ? List.copyOf(emails) : List.of();
    }
}
