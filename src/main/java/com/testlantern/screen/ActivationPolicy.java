package com.testlantern.screen;

import com.testlantern.core.LanternConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * How a {@link Screen} decides that it has become active.
 *
 *   IMMEDIATE       -- always active (more like a gesture than a screen); no waiting
 *   DELAYED         -- may take a moment of animation to appear; polled up to a timeout
 *   WITH_TRANSIENT  -- appears once a transient indicator (e.g. a spinner) goes away.
 *                      The soft timeout restarts whenever the transient is seen; the
 *                      hard timeout bounds the whole wait.
 *
 * Immutable -- use the static factories.
 */
public final class ActivationPolicy {

    public enum Kind { IMMEDIATE, DELAYED, WITH_TRANSIENT }

    private static final ActivationPolicy IMMEDIATE_POLICY =
        new ActivationPolicy(Kind.IMMEDIATE, Duration.ZERO, Duration.ZERO);

    private final Kind     kind;
    private final Duration timeout;      // DELAYED: the timeout; WITH_TRANSIENT: the soft timeout
    private final Duration hardTimeout;  // WITH_TRANSIENT only

    private ActivationPolicy(Kind kind, Duration timeout, Duration hardTimeout) {
        this.kind        = kind;
        this.timeout     = Objects.requireNonNull(timeout, "timeout must not be null");
        this.hardTimeout = Objects.requireNonNull(hardTimeout, "hardTimeout must not be null");
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ActivationPolicy immediate() {
        return IMMEDIATE_POLICY;
    }

    public static ActivationPolicy delayed(Duration timeout) {
        return new ActivationPolicy(Kind.DELAYED, timeout, Duration.ZERO);
    }

    public static ActivationPolicy delayed(LanternConfig config) {
        return delayed(config.getScreenTimeout());
    }

    public static ActivationPolicy withTransient(Duration softTimeout, Duration hardTimeout) {
        return new ActivationPolicy(Kind.WITH_TRANSIENT, softTimeout, hardTimeout);
    }

    public static ActivationPolicy withTransient(LanternConfig config) {
        return withTransient(config.getTransientSoftTimeout(), config.getTransientHardTimeout());
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Kind     getKind()        { return kind; }
    public Duration getTimeout()     { return timeout; }
    public Duration getSoftTimeout() { return timeout; }
    public Duration getHardTimeout() { return hardTimeout; }

    @Override
    public String toString() {
        return switch (kind) {
            case DELAYED        -> "DELAYED(" + timeout.toMillis() + "ms)";
            case WITH_TRANSIENT -> "WITH_TRANSIENT(soft=" + timeout.toMillis() + "ms, hard=" + hardTimeout.toMillis() + "ms)";
            case IMMEDIATE      -> "IMMEDIATE";
        };
    }
}
