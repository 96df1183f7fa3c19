package com.testlantern.progress;

/**
 * The work an {@link Action} performs: takes the current test state and returns the
 * next one.
 *
 * Tasks signal problems by throwing. A {@link com.testlantern.error.ScenarioException}
 * with category WARNING flags the scenario and lets it continue; any other exception
 * (or a failed assertion) ends it.
 */
@FunctionalInterface
public interface ActionTask<T> {
    T apply(T state) throws Exception;
}
