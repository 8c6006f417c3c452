package com.github.StefanRichterHuber.GpgKeyService.exceptions;

/**
 * The submitted text does not decode to at least one OpenPGP public key.
 */
public class MalformedKeyException extends GpgKeyException {

    public MalformedKeyException(String message) {
        super(message);
    }

    public MalformedKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
