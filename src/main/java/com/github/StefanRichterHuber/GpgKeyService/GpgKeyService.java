package com.github.StefanRichterHuber.GpgKeyService;

import java.util.List;
import java.util.concurrent.locks.Lock;

import org.bouncycastle.openpgp.PGPPublicKey;
import org.jboss.logging.Logger;

import com.github.StefanRichterHuber.GpgKeyService.capabilities.CapabilityDeriver;
import com.github.StefanRichterHuber.GpgKeyService.config.GpgKeyConfig;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.AccessDeniedException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.GpgKeyStorageException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.KeyIdConflictException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.KeyNotFoundException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.MalformedKeyException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.UnverifiedIdentityException;
import com.github.StefanRichterHuber.GpgKeyService.identity.IdentityBinder;
import com.github.StefanRichterHuber.GpgKeyService.identity.VerifiedEmailProvider;
import com.github.StefanRichterHuber.GpgKeyService.models.GpgKey;
import com.github.StefanRichterHuber.GpgKeyService.models.PreparedKey;
import com.github.StefanRichterHuber.GpgKeyService.models.Requestor;
import com.github.StefanRichterHuber.GpgKeyService.models.VerifiedEmail;
import com.github.StefanRichterHuber.GpgKeyService.parser.ArmoredKeyDecoder;
import com.github.StefanRichterHuber.GpgKeyService.parser.GpgKeyContent;
import com.github.StefanRichterHuber.GpgKeyService.parser.ParsedKey;
import com.github.StefanRichterHuber.GpgKeyService.store.GpgKeyStore;
import com.google.common.util.concurrent.Striped;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;

/**
 * Manages the GPG keys of user accounts: adds armored public keys bound to the
 * verified emails of their owner, looks them up and deletes them.
 */
@ApplicationScoped
public class GpgKeyService {

    @Inject
    Logger logger;

    @Inject
    GpgKeyConfig config;

    @Inject
    ArmoredKeyDecoder decoder;

    @Inject
    IdentityBinder identityBinder;

    @Inject
    VerifiedEmailProvider verifiedEmailProvider;

    @Inject
    GpgKeyStore store;

    /**
     * Serializes inserts of the same primary key id. Held until the insert
     * transaction has committed.
     */
    private Striped<Lock> insertLocks;

    @PostConstruct
    void init() {
        insertLocks = Striped.lock(config.insertLockStripes());
    }

    /**
     * Adds a new GPG key for the given owner.
     *
     * @param ownerId    The owner of the key.
     * @param armoredKey The ASCII armored public key block.
     * @return The stored primary key with its subkeys.
     * @throws MalformedKeyException       If the text is not a public key block.
     * @throws UnverifiedIdentityException If an identity of the key is not a
     *                                     verified email of the owner.
     * @throws KeyIdConflictException      If the key is already registered.
     * @throws GpgKeyStorageException      If the key could not be stored.
     */
    public GpgKey addKey(final long ownerId, final String armoredKey) {
        if (armoredKey == null) {
            throw new IllegalArgumentException("armoredKey must not be null");
        }

        // Decoding, binding and deriving happen outside of any transaction
        final ParsedKey parsedKey = decoder.decode(armoredKey);
        final List<VerifiedEmail> ownerEmails = verifiedEmailProvider.findByOwner(ownerId);
        final List<String> emails = identityBinder.bind(ownerId, parsedKey.identities(), ownerEmails);

        final long primaryKeyId = parsedKey.primaryKey().getKeyID();
        final PreparedKey primaryKey = prepare(parsedKey.primaryKey(), primaryKeyId, emails);
        final List<PreparedKey> subkeys = parsedKey.subkeys().stream()
                .map(subkey -> prepare(subkey, primaryKeyId, List.of()))
                .toList();

        final Lock lock = insertLocks.get(primaryKey.keyId());
        lock.lock();
        try {
            final GpgKey key = store.insert(ownerId, primaryKey, subkeys);
            logger.infof("GPG key %s with %d subkeys added for owner %d (emails %s)", key.keyId(),
                    key.subkeys().size(), ownerId, key.emails());
            return key;
        } catch (PersistenceException e) {
            logger.errorf(e, "Failed to add GPG key %s for owner %d", primaryKey.keyId(), ownerId);
            throw new GpgKeyStorageException(String.format("Failed to add GPG key %s", primaryKey.keyId()), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the key with the given id, a primary key with its subkeys.
     *
     * @throws KeyNotFoundException If there is no such key.
     */
    public GpgKey getKey(final long id) {
        try {
            return store.get(id);
        } catch (PersistenceException e) {
            logger.errorf(e, "Failed to read GPG key %d", id);
            throw new GpgKeyStorageException(String.format("Failed to read GPG key %d", id), e);
        }
    }

    /**
     * Lists all primary keys of the given owner, with their subkeys, ordered by
     * id.
     */
    public List<GpgKey> listKeys(final long ownerId) {
        try {
            final List<GpgKey> keys = store.listByOwner(ownerId);
            logger.debugf("Listed %d GPG keys of owner %d", keys.size(), ownerId);
            return keys;
        } catch (PersistenceException e) {
            logger.errorf(e, "Failed to list GPG keys of owner %d", ownerId);
            throw new GpgKeyStorageException(String.format("Failed to list GPG keys of owner %d", ownerId), e);
        }
    }

    /**
     * Lists the primary keys of the given owner, ordered by id.
     *
     * @param ownerId  The owner.
     * @param page     The 1-based page. Pages starting beyond the largest
     *                 supported offset are rejected.
     * @param pageSize The page size. Values below 1 select the default page
     *                 size, values above the configured maximum are capped.
     */
    public List<GpgKey> listKeys(final long ownerId, final int page, final int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        final int size = pageSize < 1 ? config.defaultPageSize() : Math.min(pageSize, config.maxPageSize());
        final long offset = (long) (page - 1) * size;
        if (offset > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(String.format("page %d is out of range for page size %d", page, size));
        }
        try {
            final List<GpgKey> keys = store.listByOwner(ownerId, (int) offset, size);
            logger.debugf("Listed %d GPG keys of owner %d (page %d, size %d)", keys.size(), ownerId, page, size);
            return keys;
        } catch (PersistenceException e) {
            logger.errorf(e, "Failed to list GPG keys of owner %d", ownerId);
            throw new GpgKeyStorageException(String.format("Failed to list GPG keys of owner %d", ownerId), e);
        }
    }

    /**
     * Returns all keys (primary keys and subkeys) with the given key id, e.g. the
     * issuer of a signature.
     *
     * @param keyId The key id as hex digits, optionally prefixed with "0x".
     */
    public List<GpgKey> findByKeyId(final String keyId) {
        final String normalized = GpgKeyContent.normalizeKeyId(keyId);
        try {
            return store.findByKeyId(normalized);
        } catch (PersistenceException e) {
            logger.errorf(e, "Failed to look up GPG key %s", normalized);
            throw new GpgKeyStorageException(String.format("Failed to look up GPG key %s", normalized), e);
        }
    }

    /**
     * Deletes a key. Deleting a primary key deletes its subkeys as well. Deleting
     * a key that does not exist succeeds without changes.
     *
     * @param requestor The account requesting the deletion.
     * @param id        The id of the key.
     * @throws AccessDeniedException If the requestor neither owns the key nor is
     *                               an administrator.
     */
    public void deleteKey(final Requestor requestor, final long id) {
        final int deleted;
        try {
            deleted = store.delete(requestor, id);
        } catch (PersistenceException e) {
            logger.errorf(e, "Failed to delete GPG key %d", id);
            throw new GpgKeyStorageException(String.format("Failed to delete GPG key %d", id), e);
        }
        if (deleted > 0) {
            logger.infof("GPG key %d deleted by user %d (%d records)", id, requestor.id(), deleted);
        }
    }

    private static PreparedKey prepare(final PGPPublicKey key, final long primaryKeyId, final List<String> emails) {
        return new PreparedKey(
                GpgKeyContent.keyIdString(key.getKeyID()),
                GpgKeyContent.encode(key),
                GpgKeyContent.creationTime(key),
                GpgKeyContent.expirationTime(key),
                CapabilityDeriver.derive(key, primaryKeyId),
                emails);
    }
}
