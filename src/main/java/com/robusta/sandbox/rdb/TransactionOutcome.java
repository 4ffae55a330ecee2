package com.robusta.sandbox.rdb;

public enum TransactionOutcome {
    COMMIT,
    ROLLBACK
}
