package com.robusta.sandbox.rdb;

/**
 * The original failure is the {@link #getCause() cause}; the rollback failure is also suppressed.
 */
public class CompositeFailureException extends DbControllerException {
    private final Throwable originalCause;
    private final Throwable rollbackCause;

    public CompositeFailureException(Throwable originalCause, Throwable rollbackCause) {
        super(String.format("Transaction has error: %s. Rollback has error too: %s",
                originalCause, rollbackCause), originalCause);
        this.originalCause = originalCause;
        this.rollbackCause = rollbackCause;
        addSuppressed(rollbackCause);
    }

    public Throwable getOriginalCause() {
        return originalCause;
    }

    public Throwable getRollbackCause() {
        return rollbackCause;
    }
}
