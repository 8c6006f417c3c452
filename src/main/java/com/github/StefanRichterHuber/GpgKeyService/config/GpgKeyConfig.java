package com.github.StefanRichterHuber.GpgKeyService.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "gpg-keys")
public interface GpgKeyConfig {

    /**
     * Maximum number of characters accepted for an armored public key block.
     */
    @WithDefault("65536")
    int maxArmoredLength();

    /**
     * Whether an identity (user id) without a parseable email address rejects
     * the whole key. If false, such identities are ignored, but at least one
     * identity must still be bound to a verified email.
     */
    @WithDefault("true")
    boolean rejectIdentitiesWithoutEmail();

    /**
     * Page size used when listing keys without an explicit page size.
     */
    @WithDefault("50")
    int defaultPageSize();

    /**
     * Upper bound for the page size of a key listing.
     */
    @WithDefault("200")
    int maxPageSize();

    /**
     * Number of lock stripes serializing concurrent inserts of the same key id.
     */
    @WithDefault("64")
    int insertLockStripes();
}
