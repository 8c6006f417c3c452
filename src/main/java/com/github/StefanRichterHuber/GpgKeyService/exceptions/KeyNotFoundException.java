package com.github.StefanRichterHuber.GpgKeyService.exceptions;

public class KeyNotFoundException extends GpgKeyException {

    private final long id;

    public KeyNotFoundException(long id) {
        super(String.format("GPG key with id %d does not exist", id));
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
