package com.testlantern.progress;

/**
 * Custom handling of a scenario's final progress before it is reported to the test
 * harness -- e.g. attaching a screenshot of a failure state or sending a notification.
 */
@FunctionalInterface
public interface ResultHandler<T> {
    void handleTestResult(TestProgress<T> progress);
}
