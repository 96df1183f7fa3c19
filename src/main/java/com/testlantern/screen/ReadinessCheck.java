package com.testlantern.screen;

import com.testlantern.core.LanternConfig;
import com.testlantern.error.FailureCategory;
import com.testlantern.error.ScenarioException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Checks an element against {@link ElementReadiness} criteria before an action uses it,
 * so the scenario fails with a reason instead of a bare driver error.
 *
 * Conditions are checked in order: exists, inMainWindow, hittable. The first unmet one
 * is reported.
 */
public class ReadinessCheck {

    private static final Logger log = LoggerFactory.getLogger(ReadinessCheck.class);

    public static final String DEFAULT_DESCRIPTION = "Failed readiness check";

    private final Waiter waiter;

    public ReadinessCheck(LanternConfig config) {
        this(new Waiter(config));
    }

    public ReadinessCheck(Waiter waiter) {
        this.waiter = Objects.requireNonNull(waiter, "waiter must not be null");
    }

    /**
     * @throws ScenarioException ELEMENT_NOT_READY with
     *         {@code "<description>; element not ready: <reason>"}
     */
    public void ready(ElementProbe probe, ElementReadiness criteria, String description) {
        String reason = unmetCondition(probe, criteria);
        if (reason != null) {
            throw ScenarioException.elementNotReady(description + "; element not ready: " + reason);
        }
    }

    public void ready(ElementProbe probe, ElementReadiness criteria) {
        ready(probe, criteria, DEFAULT_DESCRIPTION);
    }

    public void ready(ElementProbe probe) {
        ready(probe, ElementReadiness.defaults());
    }

    /**
     * Polls until {@link #ready} passes. On timeout the most recent readiness message is
     * raised, or the waiter's own message if the element was never checked.
     *
     * @throws ScenarioException ELEMENT_NOT_READY when the timeout expires
     */
    public void whenReady(ElementProbe probe, ElementReadiness criteria, Duration timeout) {
        AtomicReference<String> lastMessage = new AtomicReference<>();
        try {
            waiter.waitFor(timeout, true, "element readiness", () -> {
                try {
                    ready(probe, criteria);
                    return true;
                } catch (ScenarioException e) {
                    if (!e.is(FailureCategory.ELEMENT_NOT_READY)) throw e;
                    lastMessage.set(e.getMessage());
                    return false;
                }
            });
        } catch (ScenarioException e) {
            if (!e.is(FailureCategory.VERIFICATION_FAILED)) throw e;
            String message = lastMessage.get() != null ? lastMessage.get() : e.getMessage();
            log.debug("ReadinessCheck: gave up after {}ms -- {}", timeout.toMillis(), message);
            throw ScenarioException.elementNotReady(message);
        }
    }

    public void whenReady(ElementProbe probe, Duration timeout) {
        whenReady(probe, ElementReadiness.defaults(), timeout);
    }

    private static String unmetCondition(ElementProbe probe, ElementReadiness criteria) {
        if (criteria.exists() && !probe.exists()) {
            return "element does not exist";
        }
        if (criteria.inMainWindow() && !probe.isInMainWindow()) {
            return "element is not within the bounds of the main window";
        }
        if (criteria.hittable() && !probe.isHittable()) {
            return "element is not hittable";
        }
        return null;
    }
}
