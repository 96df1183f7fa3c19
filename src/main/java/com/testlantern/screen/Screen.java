package com.testlantern.screen;

import com.testlantern.core.LanternConfig;
import com.testlantern.error.FailureCategory;
import com.testlantern.error.ScenarioException;
import com.testlantern.progress.Action;
import com.testlantern.progress.ActionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * A UI context that actions expect to run on.
 *
 * <p>What makes the screen "active" is a probe supplied by the caller; how long to wait
 * for it is the screen's {@link ActivationPolicy}, chosen at construction.
 *
 * <pre>
 *   Screen home = Screen.builder("Home")
 *       .policy(ActivationPolicy.delayed(Duration.ofSeconds(3)))
 *       .activeWhen(() -&gt; driver.isShowing("Home"))
 *       .build();
 *
 *   Action&lt;AppState&gt; enterName = home.action("enterName", state -&gt; {
 *       driver.type("name", state.userName());
 *       return state;
 *   });
 * </pre>
 *
 * The screen also builds actions tied to itself, so the evaluator knows which screen
 * to check before running them.
 */
public class Screen {

    private static final Logger log = LoggerFactory.getLogger(Screen.class);

    /** A step that neither reads nor writes the test state. */
    @FunctionalInterface
    public interface Step {
        void run() throws Exception;
    }

    private final String           label;
    private final ActivationPolicy policy;
    private final BooleanSupplier  activeProbe;
    private final BooleanSupplier  transientProbe;
    private final Waiter           waiter;

    private Screen(Builder b) {
        this.label          = Objects.requireNonNull(b.label, "label must not be null");
        this.policy         = b.policy != null ? b.policy : ActivationPolicy.immediate();
        this.activeProbe    = b.activeProbe != null ? b.activeProbe : () -> true;
        this.transientProbe = b.transientProbe != null ? b.transientProbe : () -> false;
        this.waiter         = b.waiter != null ? b.waiter : new Waiter(LanternConfig.DEFAULT_POLL_INTERVAL);
    }

    /** A screen that is always active. */
    public static Screen immediate(String label) {
        return builder(label).build();
    }

    // ── State ─────────────────────────────────────────────────────────────────

    public String           getLabel()  { return label; }
    public ActivationPolicy getPolicy() { return policy; }

    /** Instantaneous check; an IMMEDIATE screen is always active. */
    public boolean isActive() {
        return policy.getKind() == ActivationPolicy.Kind.IMMEDIATE || activeProbe.getAsBoolean();
    }

    /** True while the transient indicator is showing. */
    public boolean isTransientActive() {
        return transientProbe.getAsBoolean();
    }

    /**
     * Returns once the screen is active, waiting as its policy allows.
     *
     * @throws ScenarioException INCORRECT_SCREEN when the wait runs out
     */
    public void becomesActive() {
        switch (policy.getKind()) {
            case IMMEDIATE -> { }
            case DELAYED -> {
                try {
                    waiter.waitFor(policy.getTimeout(), true, "[" + label + " isActive]", this::isActive);
                } catch (ScenarioException e) {
                    if (!e.is(FailureCategory.VERIFICATION_FAILED)) throw e;
                    throw ScenarioException.incorrectScreen(e.getMessage());
                }
            }
            case WITH_TRANSIENT -> awaitThroughTransient(true);
        }
    }

    // ── Action builders ───────────────────────────────────────────────────────

    /** An action tied to this screen that reads and/or writes the test state. */
    public <T> Action<T> action(String actionLabel, ActionTask<T> task) {
        return new Action<>(actionLabel, this, task);
    }

    /** An action tied to this screen that leaves the test state alone. */
    public <T> Action<T> step(String actionLabel, Step step) {
        return action(actionLabel, state -> {
            step.run();
            return state;
        });
    }

    /**
     * Chains {@code actions} into one action tied to this screen; each task receives the
     * state the previous one returned.
     *
     * @throws ScenarioException DEVELOPER_ERROR when {@code actions} is empty
     */
    public <T> Action<T> composite(String actionLabel, List<Action<T>> actions) {
        if (actions == null || actions.isEmpty()) {
            throw ScenarioException.developerError(
                "Trying to make a composite action '" + actionLabel + "' on " + label + " from none");
        }
        if (actions.size() == 1) return actions.get(0);

        List<Action<T>> parts = List.copyOf(actions);
        return action(actionLabel, state -> {
            T s = state;
            for (Action<T> part : parts) {
                s = part.getTask().apply(s);
            }
            return s;
        });
    }

    /** Passes when this screen becomes active. */
    public <T> Action<T> verifyIsActive() {
        return step("verifyIsActive", () -> { });
    }

    /**
     * Passes once this screen is no longer active. The action runs on an always-active
     * stand-in screen so the evaluator's screen check does not demand the opposite.
     */
    public <T> Action<T> verifyNotActive() {
        Screen standIn = Screen.immediate("null screen");
        return new Action<>("verifyNotActive", standIn, state -> {
            awaitInactive();
            return state;
        });
    }

    private void awaitInactive() {
        switch (policy.getKind()) {
            case IMMEDIATE -> throw ScenarioException.incorrectScreen(label + " is always active");
            case DELAYED -> {
                try {
                    waiter.waitFor(policy.getTimeout(), false, "[" + label + " isActive]", this::isActive);
                } catch (ScenarioException e) {
                    if (!e.is(FailureCategory.VERIFICATION_FAILED)) throw e;
                    throw ScenarioException.incorrectScreen(label + " failed to become inactive");
                }
            }
            case WITH_TRANSIENT -> awaitThroughTransient(false);
        }
    }

    // ── Transient polling ─────────────────────────────────────────────────────

    /**
     * Waits up to the hard timeout. Each sighting of the transient indicator restarts
     * the soft window; the soft window running out also ends the wait.
     */
    private void awaitThroughTransient(boolean desiredActive) {
        Instant[] softStart = { waiter.now() };
        boolean reached = waiter.pollUntil(policy.getHardTimeout(), () -> {
            Instant now = waiter.now();
            if (isTransientActive()) {
                softStart[0] = now;
                return false;
            }
            if (activeProbe.getAsBoolean() == desiredActive) return true;
            if (Duration.between(softStart[0], now).compareTo(policy.getSoftTimeout()) >= 0) {
                throw transientTimeout(desiredActive, "soft");
            }
            return false;
        });
        if (!reached) throw transientTimeout(desiredActive, "hard");
    }

    private ScenarioException transientTimeout(boolean desiredActive, String which) {
        log.debug("Screen: {} {} timeout waiting for active={}", label, which, desiredActive);
        return desiredActive
            ? ScenarioException.incorrectScreen("[" + label + " becomesActive] failed " + which + " timeout")
            : ScenarioException.incorrectScreen(label + " failed to become inactive");
    }

    @Override
    public String toString() {
        return label;
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder(String label) { return new Builder(label); }

    public static class Builder {
        private final String    label;
        private ActivationPolicy policy;
        private BooleanSupplier  activeProbe;
        private BooleanSupplier  transientProbe;
        private Waiter           waiter;

        private Builder(String label) { this.label = label; }

        public Builder policy(ActivationPolicy p)          { this.policy = p; return this; }
        public Builder activeWhen(BooleanSupplier probe)   { this.activeProbe = probe; return this; }
        public Builder transientWhen(BooleanSupplier p)    { this.transientProbe = p; return this; }
        public Builder waiter(Waiter w)                    { this.waiter = w; return this; }
        public Screen build()                              { return new Screen(this); }
    }
}
