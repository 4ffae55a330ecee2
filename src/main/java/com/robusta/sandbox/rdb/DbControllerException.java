package com.robusta.sandbox.rdb;

public class DbControllerException extends RuntimeException {
    public DbControllerException(String message) {
        super(message);
    }

    public DbControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
