package com.github.StefanRichterHuber.GpgKeyService.models;

/**
 * The account issuing a request, as identified by the calling layer.
 */
public record Requestor(long id, boolean admin) {

    public static Requestor user(long id) {
        return new Requestor(id, false);
    }

    public static Requestor administrator(long id) {
        return new Requestor(id, true);
    }

    /**
     * Whether this requestor may modify keys owned by the given account.
     */
    public boolean mayModify(long ownerId) {
        return admin || id == ownerId;
    }
}
