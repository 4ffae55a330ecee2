package com.robusta.sandbox.rdb;

import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkArgument;

public final class FailureHandlers {
    private FailureHandlers() {
    }

    /**
     * Builds a handler storing the failure into the given slot, so the caller can inspect it after the
     * operation returns.
     * <p>
     * Only {@link Exception}s are captured. Any other payload, typically a {@link Error}, makes the
     * handler throw {@link NonErrorFailurePayloadException}.
     */
    public static DbController.FailureHandler captureFailureInto(final AtomicReference<Exception> slot) {
        checkArgument(slot != null, "A valid slot is required to capture failures into");
        return new CapturingFailureHandler(slot);
    }

    private static class CapturingFailureHandler implements DbController.FailureHandler {
        private final AtomicReference<Exception> slot;

        CapturingFailureHandler(AtomicReference<Exception> slot) {
            this.slot = slot;
        }

        @Override
        public void onFailure(Throwable failure) {
            if (!(failure instanceof Exception)) {
                throw new NonErrorFailurePayloadException(failure);
            }
            slot.set((Exception) failure);
        }
    }
}
