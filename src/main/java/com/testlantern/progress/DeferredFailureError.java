package com.testlantern.progress;

/**
 * Fails a test whose scenario completed but was flagged along the way.
 *
 * Kept distinct from a plain {@link AssertionError} so reports and listeners can tell
 * "finished with warnings" apart from "stopped on a failure".
 */
public class DeferredFailureError extends AssertionError {

    public DeferredFailureError(String message) {
        super(message);
    }
}
