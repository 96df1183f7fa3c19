package com.testlantern.progress;

import org.testng.Assert;

/**
 * Reports scenario outcomes to TestNG.
 *
 *   pass             -- returns normally
 *   deferredFailure  -- throws {@link DeferredFailureError} ("Lantern Deferred Failure: ...")
 *   failure          -- {@link Assert#fail(String)} ("Lantern Failure: ...")
 */
public class TestNGReporter implements HarnessReporter {

    public static final String FAILURE_PREFIX          = "Lantern Failure: ";
    public static final String DEFERRED_FAILURE_PREFIX = "Lantern Deferred Failure: ";

    @Override
    public void pass() {
        // nothing to do
    }

    @Override
    public void deferredFailure(String messages) {
        throw new DeferredFailureError(DEFERRED_FAILURE_PREFIX + messages);
    }

    @Override
    public void failure(String messages) {
        Assert.fail(FAILURE_PREFIX + messages);
    }
}
