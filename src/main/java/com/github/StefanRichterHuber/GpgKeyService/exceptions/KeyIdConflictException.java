package com.github.StefanRichterHuber.GpgKeyService.exceptions;

public class KeyIdConflictException extends GpgKeyException {

    private final String keyId;

    public KeyIdConflictException(String keyId) {
        super(String.format("A key with the key id %s is already registered", keyId));
        this.keyId = keyId;
    }

    public KeyIdConflictException(String keyId, Throwable cause) {
        super(String.format("A key with the key id %s is already registered", keyId), cause);
        this.keyId = keyId;
    }

    public String getKeyId() {
        return keyId;
    }
}
