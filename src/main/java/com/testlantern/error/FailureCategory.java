package com.testlantern.error;

/**
 * Classifies why a scenario step could not complete.
 *
 *   ELEMENT_NOT_READY   -- an element failed its readiness criteria
 *   INCORRECT_SCREEN    -- the expected screen never became active
 *   WARNING             -- recoverable; the scenario continues but is flagged
 *   VERIFICATION_FAILED -- a polled condition did not reach its desired value in time
 *   DEVELOPER_ERROR     -- the library was misused (e.g. a composite of zero actions)
 *   UNKNOWN             -- anything else
 */
public enum FailureCategory {
    ELEMENT_NOT_READY,
    INCORRECT_SCREEN,
    WARNING,
    VERIFICATION_FAILED,
    DEVELOPER_ERROR,
    UNKNOWN
}
