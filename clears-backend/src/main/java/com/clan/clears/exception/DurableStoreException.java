package com.clan.clears.exception;

public class DurableStoreException extends RuntimeException {

    public DurableStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
