package com.github.StefanRichterHuber.GpgKeyService.store;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import com.github.StefanRichterHuber.GpgKeyService.exceptions.AccessDeniedException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.GpgKeyStorageException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.KeyIdConflictException;
import com.github.StefanRichterHuber.GpgKeyService.exceptions.KeyNotFoundException;
import com.github.StefanRichterHuber.GpgKeyService.models.GpgKey;
import com.github.StefanRichterHuber.GpgKeyService.models.PreparedKey;
import com.github.StefanRichterHuber.GpgKeyService.models.Requestor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;

/**
 * Persists primary keys and their subkeys as linked {@link GpgKeyEntity} rows.
 * Each write operation is one transaction: either the whole hierarchy is
 * written (or removed), or nothing is.
 */
@ApplicationScoped
public class GpgKeyStore {

    /**
     * SQLState of a unique constraint violation (PostgreSQL and H2).
     */
    private static final String UNIQUE_VIOLATION = "23505";

    @Inject
    Logger logger;

    @Inject
    EntityManager entityManager;

    @Inject
    Clock clock;

    /**
     * Inserts a primary key and its subkeys.
     *
     * @param ownerId    The owner of the key.
     * @param primaryKey The primary key, carrying the bound emails.
     * @param subkeys    The subkeys of the primary key.
     * @return The stored primary key with its subkeys.
     * @throws KeyIdConflictException If the key id of the primary key or of one
     *                                of its subkeys is already registered.
     */
    @Transactional
    public GpgKey insert(final long ownerId, final PreparedKey primaryKey, final List<PreparedKey> subkeys) {
        if (primaryKey == null) {
            throw new IllegalArgumentException("primaryKey must not be null");
        }
        if (primaryKey.emails().isEmpty()) {
            throw new IllegalArgumentException("primaryKey must carry at least one bound email");
        }
        final List<PreparedKey> preparedSubkeys = subkeys != null ? subkeys : List.of();

        final List<String> keyIds = new ArrayList<>();
        keyIds.add(primaryKey.keyId());
        preparedSubkeys.forEach(subkey -> keyIds.add(subkey.keyId()));

        final List<String> registered = entityManager
                .createQuery("select k.keyId from GpgKeyEntity k where k.keyId in :keyIds", String.class)
                .setParameter("keyIds", keyIds)
                .getResultList();
        if (!registered.isEmpty()) {
            logger.warnf("Rejected key %s for owner %d: key id %s is already registered", primaryKey.keyId(),
                    ownerId, registered.get(0));
            throw new KeyIdConflictException(registered.get(0));
        }

        final Instant added = clock.instant();
        final GpgKeyEntity primaryEntity = GpgKeyRecords.toEntity(ownerId, null, primaryKey, added);
        final List<GpgKeyEntity> subkeyEntities = preparedSubkeys.stream()
                .map(subkey -> GpgKeyRecords.toEntity(ownerId, primaryKey.keyId(), subkey, added))
                .toList();
        try {
            entityManager.persist(primaryEntity);
            subkeyEntities.forEach(entityManager::persist);
            entityManager.flush();
        } catch (PersistenceException e) {
            if (isUniqueViolation(e)) {
                logger.warnf("Rejected key %s for owner %d: key id already registered concurrently",
                        primaryKey.keyId(), ownerId);
                throw new KeyIdConflictException(primaryKey.keyId(), e);
            }
            logger.errorf(e, "Failed to store key %s for owner %d", primaryKey.keyId(), ownerId);
            throw new GpgKeyStorageException(String.format("Failed to store key %s", primaryKey.keyId()), e);
        }

        logger.debugf("Stored key %s (id %d) with %d subkeys for owner %d", primaryKey.keyId(),
                primaryEntity.getId(), subkeyEntities.size(), ownerId);
        return GpgKeyRecords.toGpgKey(primaryEntity, subkeyEntities);
    }

    /**
     * Returns the key with the given id. A primary key is returned with its
     * subkeys.
     *
     * @throws KeyNotFoundException If there is no such key.
     */
    @Transactional
    public GpgKey get(final long id) {
        final GpgKeyEntity entity = entityManager.find(GpgKeyEntity.class, id);
        if (entity == null) {
            logger.debugf("GPG key with id %d not found", id);
            throw new KeyNotFoundException(id);
        }
        return GpgKeyRecords.toGpgKey(entity, findSubkeys(entity));
    }

    /**
     * Lists all primary keys of an owner, with their subkeys, ordered by id.
     */
    @Transactional
    public List<GpgKey> listByOwner(final long ownerId) {
        final List<GpgKeyEntity> primaryKeys = entityManager
                .createQuery("select k from GpgKeyEntity k where k.ownerId = :ownerId and k.primaryKeyId is null "
                        + "order by k.id", GpgKeyEntity.class)
                .setParameter("ownerId", ownerId)
                .getResultList();
        return withSubkeys(ownerId, primaryKeys);
    }

    /**
     * Lists one page of the primary keys of an owner, with their subkeys, ordered
     * by id.
     *
     * @param ownerId    The owner.
     * @param offset     Number of primary keys to skip.
     * @param maxResults Maximum number of primary keys to return.
     */
    @Transactional
    public List<GpgKey> listByOwner(final long ownerId, final int offset, final int maxResults) {
        final List<GpgKeyEntity> primaryKeys = entityManager
                .createQuery("select k from GpgKeyEntity k where k.ownerId = :ownerId and k.primaryKeyId is null "
                        + "order by k.id", GpgKeyEntity.class)
                .setParameter("ownerId", ownerId)
                .setFirstResult(offset)
                .setMaxResults(maxResults)
                .getResultList();
        return withSubkeys(ownerId, primaryKeys);
    }

    /**
     * Returns all keys (primary keys and subkeys) with the given key id.
     */
    @Transactional
    public List<GpgKey> findByKeyId(final String keyId) {
        return entityManager
                .createQuery("select k from GpgKeyEntity k where k.keyId = :keyId order by k.id", GpgKeyEntity.class)
                .setParameter("keyId", keyId)
                .getResultList()
                .stream()
                .map(entity -> GpgKeyRecords.toGpgKey(entity, findSubkeys(entity)))
                .toList();
    }

    /**
     * Deletes a key. Deleting a primary key also deletes all its subkeys,
     * deleting a subkey only deletes the subkey.
     *
     * @param requestor The account requesting the deletion.
     * @param id        The id of the key.
     * @return The number of deleted rows, 0 if the key does not exist.
     * @throws AccessDeniedException If the requestor neither owns the key nor is
     *                               an administrator.
     */
    @Transactional
    public int delete(final Requestor requestor, final long id) {
        if (requestor == null) {
            throw new IllegalArgumentException("requestor must not be null");
        }
        final GpgKeyEntity target = entityManager.find(GpgKeyEntity.class, id, LockModeType.PESSIMISTIC_WRITE);
        if (target == null) {
            logger.debugf("GPG key with id %d does not exist. Nothing to delete.", id);
            return 0;
        }
        if (!requestor.mayModify(target.getOwnerId())) {
            logger.warnf("User %d denied to delete GPG key %d of owner %d", requestor.id(), id,
                    target.getOwnerId());
            throw new AccessDeniedException(requestor.id(), id);
        }

        final List<GpgKeyEntity> subkeys = target.isPrimary()
                ? entityManager
                        .createQuery("select k from GpgKeyEntity k where k.ownerId = :ownerId "
                                + "and k.primaryKeyId = :primaryKeyId", GpgKeyEntity.class)
                        .setParameter("ownerId", target.getOwnerId())
                        .setParameter("primaryKeyId", target.getKeyId())
                        .setLockMode(LockModeType.PESSIMISTIC_WRITE)
                        .getResultList()
                : List.of();
        try {
            subkeys.forEach(entityManager::remove);
            entityManager.remove(target);
            entityManager.flush();
        } catch (PersistenceException e) {
            logger.errorf(e, "Failed to delete GPG key %d", id);
            throw new GpgKeyStorageException(String.format("Failed to delete GPG key %d", id), e);
        }
        return subkeys.size() + 1;
    }

    private List<GpgKey> withSubkeys(final long ownerId, final List<GpgKeyEntity> primaryKeys) {
        if (primaryKeys.isEmpty()) {
            return List.of();
        }
        final Map<String, List<GpgKeyEntity>> subkeysByPrimaryKeyId = entityManager
                .createQuery("select k from GpgKeyEntity k where k.ownerId = :ownerId "
                        + "and k.primaryKeyId in :primaryKeyIds order by k.id", GpgKeyEntity.class)
                .setParameter("ownerId", ownerId)
                .setParameter("primaryKeyIds", primaryKeys.stream().map(GpgKeyEntity::getKeyId).toList())
                .getResultList()
                .stream()
                .collect(Collectors.groupingBy(GpgKeyEntity::getPrimaryKeyId));

        return primaryKeys.stream()
                .map(primaryKey -> GpgKeyRecords.toGpgKey(primaryKey,
                        subkeysByPrimaryKeyId.getOrDefault(primaryKey.getKeyId(), List.of())))
                .toList();
    }

    private List<GpgKeyEntity> findSubkeys(final GpgKeyEntity entity) {
        if (!entity.isPrimary()) {
            return List.of();
        }
        return entityManager
                .createQuery("select k from GpgKeyEntity k where k.ownerId = :ownerId "
                        + "and k.primaryKeyId = :primaryKeyId order by k.id", GpgKeyEntity.class)
                .setParameter("ownerId", entity.getOwnerId())
                .setParameter("primaryKeyId", entity.getKeyId())
                .getResultList();
    }

    /**
     * Whether the failure is caused by a violated unique constraint, i.e. a key id
     * inserted by a concurrent transaction. Other integrity violations (not null,
     * foreign keys) are storage failures.
     */
    static boolean isUniqueViolation(final Throwable failure) {
        Throwable cause = failure;
        while (cause != null) {
            if (cause instanceof SQLException
                    && UNIQUE_VIOLATION.equals(((SQLException) cause).getSQLState())) {
                return true;
            }
            cause = cause.getCause() != cause ? cause.getCause() : null;
        }
        return false;
    }
}
