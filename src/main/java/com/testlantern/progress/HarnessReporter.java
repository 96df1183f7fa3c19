package com.testlantern.progress;

/**
 * The host test harness's pass / fail primitives.
 *
 * {@link ProgressFinisher} maps PASSING, FLAGGING and FAILING onto these three calls.
 * The default implementation is {@link TestNGReporter}.
 */
public interface HarnessReporter {

    /** The scenario passed; nothing to report. */
    void pass();

    /** The scenario ran to the end but raised recoverable problems along the way. */
    void deferredFailure(String messages);

    /** The scenario stopped on a fatal problem. */
    void failure(String messages);
}
