package com.testlantern.screen;

import com.testlantern.core.LanternConfig;
import com.testlantern.error.ScenarioException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.support.ui.FluentWait;
import org.openqa.selenium.support.ui.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polls a condition until it reaches a desired value or a timeout expires.
 *
 * Built on Selenium's {@link FluentWait}. The clock and sleeper are injectable so that
 * callers (and tests) can run the same logic without real sleeping.
 */
public class Waiter {

    private final Duration pollInterval;
    private final Clock    clock;
    private final Sleeper  sleeper;

    public Waiter(LanternConfig config) {
        this(config.getPollInterval());
    }

    public Waiter(Duration pollInterval) {
        this(pollInterval, Clock.systemDefaultZone(), Sleeper.SYSTEM_SLEEPER);
    }

    public Waiter(Duration pollInterval, Clock clock, Sleeper sleeper) {
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.clock        = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper      = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Polls {@code probe} until it returns {@code desired}. The probe is always asked
     * at least once, even with a zero timeout.
     *
     * @throws ScenarioException VERIFICATION_FAILED when the timeout expires,
     *                           UNKNOWN when the thread is interrupted
     */
    public <V> void waitFor(Duration timeout, V desired, String what, Supplier<V> probe) {
        if (!pollUntil(timeout, () -> Objects.equals(desired, probe.get()))) {
            throw ScenarioException.verificationFailed(
                what + " did not become " + desired + " within " + timeout.toMillis() + "ms");
        }
    }

    /**
     * Polls {@code condition} until it holds. Exceptions thrown by the condition end the
     * wait and propagate unchanged.
     *
     * @return false when {@code timeout} expired first
     * @throws ScenarioException UNKNOWN when the thread is interrupted
     */
    boolean pollUntil(Duration timeout, BooleanSupplier condition) {
        FluentWait<BooleanSupplier> wait = new FluentWait<>(condition, clock, sleeper)
            .withTimeout(timeout)
            .pollingEvery(pollInterval);
        try {
            wait.until(BooleanSupplier::getAsBoolean);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (WebDriverException e) {
            // FluentWait reports an interrupted sleep this way, with the flag already restored
            if (!Thread.currentThread().isInterrupted()) throw e;
            throw ScenarioException.unknown("Interrupted while polling", e);
        }
    }

    /** Current reading of the wait clock. */
    Instant now() {
        return clock.instant();
    }
}
