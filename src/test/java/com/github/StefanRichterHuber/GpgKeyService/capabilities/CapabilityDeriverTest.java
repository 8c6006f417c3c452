package com.github.StefanRichterHuber.GpgKeyService.capabilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.OptionalInt;

import org.bouncycastle.bcpg.sig.KeyFlags;
import org.junit.jupiter.api.Test;

import com.github.StefanRichterHuber.GpgKeyService.TestKeys;
import com.github.StefanRichterHuber.GpgKeyService.models.KeyCapabilities;
import com.github.StefanRichterHuber.GpgKeyService.parser.ArmoredKeyDecoder;
import com.github.StefanRichterHuber.GpgKeyService.parser.ParsedKey;

public class CapabilityDeriverTest {

    @Test
    public void testAlgorithmWithoutKeyFlags() {
        assertEquals(new KeyCapabilities(true, true, true, true),
                CapabilityDeriver.derive(PublicKeyAlgorithm.RSA_GENERAL.id(), OptionalInt.empty()));
        assertEquals(new KeyCapabilities(false, true, true, false),
                CapabilityDeriver.derive(PublicKeyAlgorithm.RSA_ENCRYPT.id(), OptionalInt.empty()));
        assertEquals(new KeyCapabilities(true, false, false, true),
                CapabilityDeriver.derive(PublicKeyAlgorithm.DSA.id(), OptionalInt.empty()));
        assertEquals(new KeyCapabilities(false, true, true, false),
                CapabilityDeriver.derive(PublicKeyAlgorithm.ECDH.id(), OptionalInt.empty()));
        assertEquals(new KeyCapabilities(true, false, false, true),
                CapabilityDeriver.derive(PublicKeyAlgorithm.EDDSA_LEGACY.id(), OptionalInt.empty()));
    }

    @Test
    public void testKeyFlagsRestrictAlgorithm() {
        assertEquals(new KeyCapabilities(false, false, false, true),
                CapabilityDeriver.derive(PublicKeyAlgorithm.EDDSA_LEGACY.id(), OptionalInt.of(KeyFlags.CERTIFY_OTHER)));
        assertEquals(new KeyCapabilities(false, true, false, false),
                CapabilityDeriver.derive(PublicKeyAlgorithm.ECDH.id(), OptionalInt.of(KeyFlags.ENCRYPT_COMMS)));
        assertEquals(new KeyCapabilities(true, false, true, false),
                CapabilityDeriver.derive(PublicKeyAlgorithm.RSA_GENERAL.id(),
                        OptionalInt.of(KeyFlags.SIGN_DATA | KeyFlags.ENCRYPT_STORAGE)));
    }

    @Test
    public void testKeyFlagsDoNotExtendAlgorithm() {
        // A DSA key cannot encrypt, whatever it declares
        assertEquals(KeyCapabilities.NONE, CapabilityDeriver.derive(PublicKeyAlgorithm.DSA.id(),
                OptionalInt.of(KeyFlags.ENCRYPT_COMMS | KeyFlags.ENCRYPT_STORAGE)));
        assertEquals(KeyCapabilities.NONE, CapabilityDeriver.derive(PublicKeyAlgorithm.X25519.id(),
                OptionalInt.of(KeyFlags.SIGN_DATA | KeyFlags.CERTIFY_OTHER)));
    }

    @Test
    public void testUnknownAlgorithm() {
        assertEquals(KeyCapabilities.NONE, CapabilityDeriver.derive(99, OptionalInt.empty()));
        assertEquals(KeyCapabilities.NONE, CapabilityDeriver.derive(99, OptionalInt.of(0xFF)));
        assertTrue(PublicKeyAlgorithm.fromId(99).isEmpty());
        assertEquals(PublicKeyAlgorithm.ED25519, PublicKeyAlgorithm.fromId(27).orElseThrow());
    }

    @Test
    public void testGeneratedKey() throws Exception {
        final ParsedKey parsedKey = ArmoredKeyDecoder.parse(TestKeys.generateCertificate("Alice <a@example.com>"));
        final long primaryKeyId = parsedKey.primaryKey().getKeyID();

        final KeyCapabilities primary = CapabilityDeriver.derive(parsedKey.primaryKey(), primaryKeyId);
        assertTrue(primary.canCertify());
        assertFalse(primary.canEncryptComms());

        final List<KeyCapabilities> subkeys = parsedKey.subkeys().stream()
                .map(subkey -> CapabilityDeriver.derive(subkey, primaryKeyId))
                .toList();
        assertTrue(subkeys.stream().anyMatch(KeyCapabilities::canSign));
        assertTrue(subkeys.stream().anyMatch(KeyCapabilities::canEncryptComms));
        assertTrue(subkeys.stream().noneMatch(KeyCapabilities::canCertify));
    }

    @Test
    public void testDeclaredKeyFlagsOfGeneratedKey() throws Exception {
        final ParsedKey parsedKey = ArmoredKeyDecoder.parse(TestKeys.generateCertificate("Alice <a@example.com>"));
        final long primaryKeyId = parsedKey.primaryKey().getKeyID();

        final OptionalInt primaryFlags = CapabilityDeriver.declaredKeyFlags(parsedKey.primaryKey(), primaryKeyId);
        assertTrue(primaryFlags.isPresent());
        assertTrue((primaryFlags.getAsInt() & KeyFlags.CERTIFY_OTHER) != 0);

        parsedKey.subkeys().forEach(subkey -> assertTrue(
                CapabilityDeriver.declaredKeyFlags(subkey, primaryKeyId).isPresent()));
    }

    @Test
    public void testNewerSelfSignatureNarrowsFlags() throws Exception {
        final Instant created = Instant.now().minus(1, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        final ParsedKey parsedKey = ArmoredKeyDecoder.parse(TestKeys.generateRecertifiedRsaCertificate(
                "Alice <a@example.com>", created, KeyFlags.CERTIFY_OTHER | KeyFlags.SIGN_DATA,
                KeyFlags.CERTIFY_OTHER));
        final long primaryKeyId = parsedKey.primaryKey().getKeyID();

        assertEquals(OptionalInt.of(KeyFlags.CERTIFY_OTHER),
                CapabilityDeriver.declaredKeyFlags(parsedKey.primaryKey(), primaryKeyId));
        assertEquals(new KeyCapabilities(false, false, false, true),
                CapabilityDeriver.derive(parsedKey.primaryKey(), primaryKeyId));
    }

    @Test
    public void testNewerSelfSignatureWidensFlags() throws Exception {
        final Instant created = Instant.now().minus(1, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);
        final ParsedKey parsedKey = ArmoredKeyDecoder.parse(TestKeys.generateRecertifiedRsaCertificate(
                "Alice <a@example.com>", created, KeyFlags.CERTIFY_OTHER,
                KeyFlags.CERTIFY_OTHER | KeyFlags.SIGN_DATA | KeyFlags.ENCRYPT_COMMS));
        final long primaryKeyId = parsedKey.primaryKey().getKeyID();

        assertEquals(new KeyCapabilities(true, true, false, true),
                CapabilityDeriver.derive(parsedKey.primaryKey(), primaryKeyId));
    }

    @Test
    public void testSubkeyBindingFlags() throws Exception {
        final ParsedKey parsedKey = ArmoredKeyDecoder.parse(TestKeys.generateRsaCertificate("Alice <a@example.com>",
                Instant.now().truncatedTo(ChronoUnit.SECONDS), null, null));
        final long primaryKeyId = parsedKey.primaryKey().getKeyID();

        assertEquals(new KeyCapabilities(true, false, false, true),
                CapabilityDeriver.derive(parsedKey.primaryKey(), primaryKeyId));
        assertEquals(new KeyCapabilities(false, true, true, false),
                CapabilityDeriver.derive(parsedKey.subkeys().get(0), primaryKeyId));
    }
}
