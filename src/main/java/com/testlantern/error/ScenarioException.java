package com.testlantern.error;

import java.util.Optional;

/**
 * Categorized failure raised by action tasks, screens and readiness checks.
 *
 * <p>Use the static factories. The {@link com.testlantern.progress.ProgressEvaluator}
 * inspects {@link #getCategory()} to decide whether the scenario is merely flagged
 * (WARNING) or fails outright (everything else).
 *
 * <h3>Carrying state out of a warning</h3>
 * A task that wants to record progress it made before warning can attach the
 * updated state; the evaluator continues from it instead of the prior state:
 * <pre>
 *   throw ScenarioException.warning("Banner was already dismissed", state.withBannerSeen());
 * </pre>
 */
public class ScenarioException extends RuntimeException {

    private final FailureCategory category;
    private final Object          carriedState; // non-null only for warnings that carry state

    private ScenarioException(FailureCategory category, String message, Object carriedState, Throwable cause) {
        super(message, cause);
        this.category     = category;
        this.carriedState = carriedState;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ScenarioException warning(String message) {
        return new ScenarioException(FailureCategory.WARNING, message, null, null);
    }

    public static ScenarioException warning(String message, Object updatedState) {
        return new ScenarioException(FailureCategory.WARNING, message, updatedState, null);
    }

    public static ScenarioException incorrectScreen(String message) {
        return new ScenarioException(FailureCategory.INCORRECT_SCREEN, message, null, null);
    }

    public static ScenarioException elementNotReady(String message) {
        return new ScenarioException(FailureCategory.ELEMENT_NOT_READY, message, null, null);
    }

    public static ScenarioException verificationFailed(String message) {
        return new ScenarioException(FailureCategory.VERIFICATION_FAILED, message, null, null);
    }

    public static ScenarioException developerError(String message) {
        return new ScenarioException(FailureCategory.DEVELOPER_ERROR, message, null, null);
    }

    public static ScenarioException unknown(String message, Throwable cause) {
        return new ScenarioException(FailureCategory.UNKNOWN, message, null, cause);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public FailureCategory getCategory() { return category; }

    public boolean is(FailureCategory c) { return category == c; }

    /** The state a warning task reached before raising, if it supplied one. */
    public Optional<Object> getCarriedState() {
        return Optional.ofNullable(carriedState);
    }

    /** The carried state, when there is one and it is a {@code type}. */
    public <S> Optional<S> getCarriedState(Class<S> type) {
        return getCarriedState().filter(type::isInstance).map(type::cast);
    }

    @Override
    public String toString() {
        return String.format("ScenarioException{category=%s, message='%s'}", category, getMessage());
    }
}
