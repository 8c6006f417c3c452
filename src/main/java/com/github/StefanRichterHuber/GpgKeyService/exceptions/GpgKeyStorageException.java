package com.github.StefanRichterHuber.GpgKeyService.exceptions;

/**
 * Opaque wrapper for failures of the underlying relational store.
 */
public class GpgKeyStorageException extends GpgKeyException {

    public GpgKeyStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
