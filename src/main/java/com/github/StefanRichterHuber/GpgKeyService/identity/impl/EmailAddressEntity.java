package com.github.StefanRichterHuber.GpgKeyService.identity.impl;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

/**
 * Email address of an account, maintained by the platform's account system.
 */
@Entity
@Table(name = "email_address", indexes = @Index(name = "idx_email_address_owner_id", columnList = "owner_id"))
public class EmailAddressEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private long ownerId;

    @Column(name = "email", nullable = false)
    private String email;

    @Column(name = "activated", nullable = false)
    private boolean activated;

    protected EmailAddressEntity() {
    }

    public EmailAddressEntity(long ownerId, String email, boolean activated) {
        this.ownerId = ownerId;
        this.email = email;
        this.activated = activated;
    }

    public Long getId() {
        return id;
    }

    public long getOwnerId() {
        return ownerId;
    }

    public String getEmail() {
        return email;
    }

    public boolean isActivated() {
        return activated;
    }

    public void setActivated(boolean activated) {
        this.activated = activated;
    }
}
