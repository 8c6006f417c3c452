package com.github.StefanRichterHuber.GpgKeyService.store;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

/**
 * One row per primary key or subkey. Timestamps are stored as epoch seconds,
 * see {@link GpgKeyRecords} for the conversion.
 */
@Entity
@Table(name = "gpg_key", indexes = {
        @Index(name = "idx_gpg_key_owner_id", columnList = "owner_id"),
        @Index(name = "idx_gpg_key_primary_key_id", columnList = "primary_key_id")
})
public class GpgKeyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private long ownerId;

    @Column(name = "key_id", nullable = false, unique = true, updatable = false, length = 16)
    private String keyId;

    @Column(name = "primary_key_id", updatable = false, length = 16)
    private String primaryKeyId;

    @Column(name = "content", nullable = false, updatable = false, length = 16384)
    private String content;

    @Column(name = "created_unix", nullable = false, updatable = false)
    private long createdUnix;

    @Column(name = "expires_unix", updatable = false)
    private Long expiresUnix;

    @Column(name = "added_unix", nullable = false, updatable = false)
    private long addedUnix;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "gpg_key_email", joinColumns = @JoinColumn(name = "gpg_key_id"))
    @OrderColumn(name = "email_order")
    @Column(name = "email", nullable = false)
    private List<String> emails = new ArrayList<>();

    @Column(name = "can_sign", nullable = false, updatable = false)
    private boolean canSign;

    @Column(name = "can_encrypt_comms", nullable = false, updatable = false)
    private boolean canEncryptComms;

    @Column(name = "can_encrypt_storage", nullable = false, updatable = false)
    private boolean canEncryptStorage;

    @Column(name = "can_certify", nullable = false, updatable = false)
    private boolean canCertify;

    public Long getId() {
        return id;
    }

    public long getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(long ownerId) {
        this.ownerId = ownerId;
    }

    public String getKeyId() {
        return keyId;
    }

    public void setKeyId(String keyId) {
        this.keyId = keyId;
    }

    public String getPrimaryKeyId() {
        return primaryKeyId;
    }

    public void setPrimaryKeyId(String primaryKeyId) {
        this.primaryKeyId = primaryKeyId;
    }

    public boolean isPrimary() {
        return primaryKeyId == null;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public long getCreatedUnix() {
        return createdUnix;
    }

    public void setCreatedUnix(long createdUnix) {
        this.createdUnix = createdUnix;
    }

    public Long getExpiresUnix() {
        return expiresUnix;
    }

    public void setExpiresUnix(Long expiresUnix) {
        this.expiresUnix = expiresUnix;
    }

    public long getAddedUnix() {
        return addedUnix;
    }

    public void setAddedUnix(long addedUnix) {
        this.addedUnix = addedUnix;
    }

    public List<String> getEmails() {
        return emails;
    }

    public void setEmails(List<String> emails) {
        this.emails = emails;
    }

    public boolean isCanSign() {
        return canSign;
    }

    public void setCanSign(boolean canSign) {
        this.canSign = canSign;
    }

    public boolean isCanEncryptComms() {
        return canEncryptComms;
    }

    public void setCanEncryptComms(boolean canEncryptComms) {
        this.canEncryptComms = canEncryptComms;
    }

    public boolean isCanEncryptStorage() {
        return canEncryptStorage;
    }

    public void setCanEncryptStorage(boolean canEncryptStorage) {
        this.canEncryptStorage = canEncryptStorage;
    }

    public boolean isCanCertify() {
        return canCertify;
    }

    public void setCanCertify(boolean canCertify) {
        this.canCertify = canCertify;
    }
}
