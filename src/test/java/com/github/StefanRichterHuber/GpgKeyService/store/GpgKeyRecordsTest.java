package com.github.StefanRichterHuber.GpgKeyService.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.github.StefanRichterHuber.GpgKeyService.models.GpgKey;
import com.github.StefanRichterHuber.GpgKeyService.models.KeyCapabilities;
import com.github.StefanRichterHuber.GpgKeyService.models.PreparedKey;

public class GpgKeyRecordsTest {

    private static final Instant CREATED = Instant.parse("2024-03-01T10:15:30Z");
    private static final Instant EXPIRES = Instant.parse("2027-03-01T10:15:30Z");
    private static final Instant ADDED = Instant.parse("2024-05-02T08:00:00Z");

    @Test
    public void testEpochSeconds() {
        assertEquals(1709288130L, GpgKeyRecords.toEpochSeconds(CREATED));
        assertEquals(CREATED, GpgKeyRecords.fromEpochSeconds(1709288130L));
        assertNull(GpgKeyRecords.toNullableEpochSeconds(null));
        assertNull(GpgKeyRecords.fromNullableEpochSeconds(null));
        assertEquals(EXPIRES, GpgKeyRecords.fromNullableEpochSeconds(GpgKeyRecords.toNullableEpochSeconds(EXPIRES)));
    }

    @Test
    public void testPrimaryKeyEntity() {
        final PreparedKey key = new PreparedKey("0123456789ABCDEF", "Y29udGVudA==", CREATED, EXPIRES,
                new KeyCapabilities(false, false, false, true), List.of("a@example.com", "b@example.com"));

        final GpgKeyEntity entity = GpgKeyRecords.toEntity(42, null, key, ADDED);

        assertEquals(42, entity.getOwnerId());
        assertEquals("0123456789ABCDEF", entity.getKeyId());
        assertNull(entity.getPrimaryKeyId());
        assertTrue(entity.isPrimary());
        assertEquals("Y29udGVudA==", entity.getContent());
        assertEquals(CREATED.getEpochSecond(), entity.getCreatedUnix());
        assertEquals(EXPIRES.getEpochSecond(), entity.getExpiresUnix());
        assertEquals(ADDED.getEpochSecond(), entity.getAddedUnix());
        assertEquals(List.of("a@example.com", "b@example.com"), entity.getEmails());
        assertTrue(entity.isCanCertify());
        assertFalse(entity.isCanSign());
    }

    @Test
    public void testSubkeyEntityHasNoEmails() {
        final PreparedKey key = new PreparedKey("FEDCBA9876543210", "c3Via2V5", CREATED, null,
                new KeyCapabilities(false, true, true, false), List.of("a@example.com"));

        final GpgKeyEntity entity = GpgKeyRecords.toEntity(42, "0123456789ABCDEF", key, ADDED);

        assertEquals("0123456789ABCDEF", entity.getPrimaryKeyId());
        assertFalse(entity.isPrimary());
        assertNull(entity.getExpiresUnix());
        assertTrue(entity.getEmails().isEmpty());
    }

    @Test
    public void testToGpgKey() {
        final PreparedKey primaryKey = new PreparedKey("0123456789ABCDEF", "cHJpbWFyeQ==", CREATED, EXPIRES,
                new KeyCapabilities(false, false, false, true), List.of("a@example.com"));
        final PreparedKey subkey = new PreparedKey("FEDCBA9876543210", "c3Via2V5", CREATED, null,
                new KeyCapabilities(false, true, true, false), List.of());

        final GpgKey key = GpgKeyRecords.toGpgKey(GpgKeyRecords.toEntity(42, null, primaryKey, ADDED),
                List.of(GpgKeyRecords.toEntity(42, "0123456789ABCDEF", subkey, ADDED)));

        assertTrue(key.isPrimary());
        assertEquals(42, key.ownerId());
        assertEquals(CREATED, key.created());
        assertEquals(EXPIRES, key.expiry().orElseThrow());
        assertEquals(ADDED, key.added());
        assertEquals(List.of("a@example.com"), key.emails());
        assertEquals(new KeyCapabilities(false, false, false, true), key.capabilities());

        assertEquals(1, key.subkeys().size());
        final GpgKey subkeyView = key.subkeys().get(0);
        assertFalse(subkeyView.isPrimary());
        assertEquals("0123456789ABCDEF", subkeyView.primaryKeyId());
        assertTrue(subkeyView.expiry().isEmpty());
        assertTrue(subkeyView.subkeys().isEmpty());
        assertEquals(new KeyCapabilities(false, true, true, false), subkeyView.capabilities());
    }
}
