package com.pubsub.engine.delivery;

/**
 * Outcome of delivering one entry to every listener of its stream.
 */
public class DispatchResult {

    private final int invoked;
    private final int failed;

    public DispatchResult(int invoked, int failed) {
        this.invoked = invoked;
        this.failed = failed;
    }

    public int getInvoked() {
        return invoked;
    }

    public int getFailed() {
        return failed;
    }

    /**
     * True only if no listener raised.
     */
    public boolean isSuccess() {
        return failed == 0;
    }

    @Override
    public String toString() {
        return "DispatchResult{invoked=" + invoked + ", failed=" + failed + "}";
    }
}
