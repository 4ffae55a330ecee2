package com.robusta.sandbox.rdb;

public class NotInitializedException extends DbControllerException {
    public NotInitializedException() {
        super("The controller is not initialized");
    }
}
