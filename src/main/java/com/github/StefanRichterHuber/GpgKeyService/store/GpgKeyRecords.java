package com.github.StefanRichterHuber.GpgKeyService.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.github.StefanRichterHuber.GpgKeyService.models.GpgKey;
import com.github.StefanRichterHuber.GpgKeyService.models.KeyCapabilities;
import com.github.StefanRichterHuber.GpgKeyService.models.PreparedKey;

/**
 * Conversion between the stored representation of a key ({@link GpgKeyEntity},
 * timestamps as epoch seconds) and its view ({@link GpgKey}, timestamps as
 * {@link Instant}).
 */
public final class GpgKeyRecords {

    private GpgKeyRecords() {
    }

    public static long toEpochSeconds(final Instant instant) {
        return instant.getEpochSecond();
    }

    public static Instant fromEpochSeconds(final long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds);
    }

    /**
     * Null safe variant for optional timestamps such as the expiry.
     */
    public static Long toNullableEpochSeconds(final Instant instant) {
        return instant != null ? instant.getEpochSecond() : null;
    }

    public static Instant fromNullableEpochSeconds(final Long epochSeconds) {
        return epochSeconds != null ? Instant.ofEpochSecond(epochSeconds) : null;
    }

    /**
     * Creates the entity of a new key.
     *
     * @param ownerId      The owner of the key.
     * @param primaryKeyId The key id of the primary key, null for a primary key.
     * @param key          The key to store.
     * @param added        The ingestion time.
     */
    public static GpgKeyEntity toEntity(final long ownerId, final String primaryKeyId, final PreparedKey key,
            final Instant added) {
        final GpgKeyEntity entity = new GpgKeyEntity();
        entity.setOwnerId(ownerId);
        entity.setKeyId(key.keyId());
        entity.setPrimaryKeyId(primaryKeyId);
        entity.setContent(key.content());
        entity.setCreatedUnix(toEpochSeconds(key.created()));
        entity.setExpiresUnix(toNullableEpochSeconds(key.expires()));
        entity.setAddedUnix(toEpochSeconds(added));
        entity.setEmails(primaryKeyId == null ? new ArrayList<>(key.emails()) : new ArrayList<>());

        final KeyCapabilities capabilities = key.capabilities();
        entity.setCanSign(capabilities.canSign());
        entity.setCanEncryptComms(capabilities.canEncryptComms());
        entity.setCanEncryptStorage(capabilities.canEncryptStorage());
        entity.setCanCertify(capabilities.canCertify());
        return entity;
    }

    /**
     * Creates the view of a stored key.
     *
     * @param entity  The stored key.
     * @param subkeys The stored subkeys of the key, empty for a subkey.
     */
    public static GpgKey toGpgKey(final GpgKeyEntity entity, final List<GpgKeyEntity> subkeys) {
        final List<GpgKey> subkeyViews = subkeys.stream()
                .map(subkey -> toGpgKey(subkey, List.of()))
                .toList();
        return new GpgKey(
                entity.getId(),
                entity.getOwnerId(),
                entity.getKeyId(),
                entity.getPrimaryKeyId(),
                entity.getContent(),
                fromEpochSeconds(entity.getCreatedUnix()),
                fromNullableEpochSeconds(entity.getExpiresUnix()),
                fromEpochSeconds(entity.getAddedUnix()),
                entity.getEmails(),
                subkeyViews,
                entity.isCanSign(),
                entity.isCanEncryptComms(),
                entity.isCanEncryptStorage(),
                entity.isCanCertify());
    }
}
