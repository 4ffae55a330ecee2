package com.robusta.sandbox.rdb;

public class NonErrorFailurePayloadException extends DbControllerException {
    private final Throwable payload;

    public NonErrorFailurePayloadException(Throwable payload) {
        super(String.format("The failure [%s] is not an error object", payload), payload);
        this.payload = payload;
    }

    public Throwable getPayload() {
        return payload;
    }
}
