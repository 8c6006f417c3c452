package com.github.StefanRichterHuber.GpgKeyService.identity.impl;

import java.util.List;

import org.jboss.logging.Logger;

import com.github.StefanRichterHuber.GpgKeyService.identity.VerifiedEmailProvider;
import com.github.StefanRichterHuber.GpgKeyService.models.VerifiedEmail;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;

/**
 * Reads the email addresses of an account from the platform's email_address
 * table.
 */
@ApplicationScoped
public class JpaVerifiedEmailProvider implements VerifiedEmailProvider {

    @Inject
    Logger logger;

    @Inject
    EntityManager entityManager;

    @Override
    @Transactional
    public List<VerifiedEmail> findByOwner(long ownerId) {
        final List<VerifiedEmail> emails = entityManager
                .createQuery("select e from EmailAddressEntity e where e.ownerId = :ownerId order by e.id",
                        EmailAddressEntity.class)
                .setParameter("ownerId", ownerId)
                .getResultList()
                .stream()
                .map(e -> new VerifiedEmail(e.getEmail(), e.isActivated()))
                .toList();
        logger.debugf("Found %d email addresses for owner %d", emails.size(), ownerId);
        return emails;
    }
}
