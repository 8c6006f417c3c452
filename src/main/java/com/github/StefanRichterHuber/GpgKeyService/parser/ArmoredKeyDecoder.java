package com.github.StefanRichterHuber.GpgKeyService.parser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPPublicKeyRingCollection;
import org.bouncycastle.openpgp.PGPUtil;
import org.jboss.logging.Logger;

import com.github.StefanRichterHuber.GpgKeyService.config.GpgKeyConfig;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.MalformedKeyException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Decodes an ASCII armored OpenPGP public key block into its primary key,
 * subkeys and user ids. Performs no I/O and no verification of identities.
 */
@ApplicationScoped
public class ArmoredKeyDecoder {

    /**
     * Regex to find the public key block (DOTALL mode allows . to match newlines)
     */
    private static final Pattern PGP_PUBLIC_KEY_PATTERN = Pattern.compile(
            "(-----BEGIN PGP PUBLIC KEY BLOCK-----.*?-----END PGP PUBLIC KEY BLOCK-----)",
            Pattern.DOTALL);

    @Inject
    GpgKeyConfig config;

    @Inject
    Logger logger;

    /**
     * Decodes the given armored key, enforcing the configured size limit.
     *
     * @param armoredKey The ASCII armored public key block.
     * @return The parsed key.
     * @throws MalformedKeyException If the text is not a parseable public key
     *                               block.
     */
    public ParsedKey decode(final String armoredKey) {
        if (armoredKey != null && armoredKey.length() > config.maxArmoredLength()) {
            logger.warnf("Rejected armored key of %d characters (limit %d)", armoredKey.length(),
                    config.maxArmoredLength());
            throw new MalformedKeyException(String.format("Armored key exceeds the maximum length of %d characters",
                    config.maxArmoredLength()));
        }
        final ParsedKey parsedKey;
        try {
            parsedKey = parse(armoredKey);
        } catch (MalformedKeyException e) {
            logger.warnf("Rejected malformed armored key: %s", e.getMessage());
            throw e;
        }
        if (parsedKey.ignoredKeyRingCount() > 0) {
            logger.warnf("Armored key block contains %d additional key rings. Only key %s is used.",
                    parsedKey.ignoredKeyRingCount(), parsedKey.keyId());
        }
        logger.debugf("Decoded key %s with %d subkeys and %d identities", parsedKey.keyId(),
                parsedKey.subkeys().size(), parsedKey.identities().size());
        return parsedKey;
    }

    /**
     * Parses an ASCII armored public key block. Only the first key ring of the
     * block is used.
     *
     * @param armoredKey The ASCII armored public key block.
     * @return The parsed key.
     * @throws MalformedKeyException If the text is not a parseable public key
     *                               block or contains no key.
     */
    public static ParsedKey parse(final String armoredKey) {
        if (armoredKey == null || armoredKey.isBlank()) {
            throw new MalformedKeyException("Armored key must not be null or empty");
        }
        final Matcher matcher = PGP_PUBLIC_KEY_PATTERN.matcher(armoredKey);
        if (!matcher.find()) {
            throw new MalformedKeyException("No PGP PUBLIC KEY BLOCK found in the provided text");
        }
        final byte[] block = matcher.group(1).getBytes(StandardCharsets.UTF_8);

        final List<PGPPublicKeyRing> keyRings = new ArrayList<>();
        try (InputStream in = PGPUtil.getDecoderStream(new ByteArrayInputStream(block))) {
            final PGPPublicKeyRingCollection collection = new PGPPublicKeyRingCollection(in,
                    GpgKeyContent.FINGERPRINT_CALCULATOR);
            collection.getKeyRings().forEachRemaining(keyRings::add);
        } catch (IOException | PGPException e) {
            throw new MalformedKeyException(String.format("Failed to parse PGP public key block: %s", e.getMessage()),
                    e);
        } catch (RuntimeException e) {
            // BouncyCastle reports some corrupt packets with unchecked exceptions
            throw new MalformedKeyException(String.format("Failed to parse PGP public key block: %s", e), e);
        }

        if (keyRings.isEmpty()) {
            throw new MalformedKeyException("PGP public key block does not contain any key");
        }

        final PGPPublicKeyRing keyRing = keyRings.get(0);
        final PGPPublicKey primaryKey = keyRing.getPublicKey();

        final List<PGPPublicKey> subkeys = new ArrayList<>();
        final Iterator<PGPPublicKey> keys = keyRing.getPublicKeys();
        while (keys.hasNext()) {
            final PGPPublicKey key = keys.next();
            if (!key.isMasterKey()) {
                subkeys.add(key);
            }
        }

        final List<IdentityClaim> identities = new ArrayList<>();
        final Iterator<String> userIds = primaryKey.getUserIDs();
        while (userIds.hasNext()) {
            identities.add(IdentityClaim.of(userIds.next()));
        }

        return new ParsedKey(primaryKey, subkeys, identities, keyRings.size() - 1);
    }
}
