package com.robusta.sandbox.rdb;

public class InitializationException extends DbControllerException {
    public InitializationException(String message) {
        super(message);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
