package com.github.StefanRichterHuber.GpgKeyService.exceptions;

/**
 * The requestor neither owns the key nor holds administrative privilege.
 */
public class AccessDeniedException extends GpgKeyException {

    private final long requestorId;
    private final long id;

    public AccessDeniedException(long requestorId, long id) {
        super(String.format("User %d does not have access to GPG key %d", requestorId, id));
        this.requestorId = requestorId;
        this.id = id;
    }

    public long getRequestorId() {
        return requestorId;
    }

    public long getId() {
        return id;
    }
}
