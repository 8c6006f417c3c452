package com.github.StefanRichterHuber.GpgKeyService.exceptions;

/**
 * Base class of all failures reported by the key service. Unchecked, so every
 * failure inside a transactional method rolls the transaction back.
 */
public abstract class GpgKeyException extends RuntimeException {

    protected GpgKeyException(String message) {
        super(message);
    }

    protected GpgKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
