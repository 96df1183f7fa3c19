package com.testlantern.progress;

import com.testlantern.error.ScenarioException;
import com.testlantern.screen.Screen;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Applies {@link Action}s to a {@link TestProgress}, one at a time, producing a new
 * progress value each time.
 *
 * ## Applying one action
 *
 *   1. A FAILING progress is returned unchanged; the action is not touched.
 *   2. With screen checking on and a screen named by the action, the screen must
 *      become active first. If it does not, the progress becomes FAILING with the
 *      state unchanged and the task never runs.
 *   3. The task runs against the current state:
 *        WARNING           -> FLAGGING, continuing from the state the warning carried
 *                             (or the prior state); a carried state of the wrong
 *                             class is a developer error -> FAILING
 *        INCORRECT_SCREEN  -> FAILING
 *        other categories  -> FAILING with the exception's own message
 *        anything else     -> FAILING with "Caught error: ..."
 *        success           -> PASSING if nothing was ever flagged, else FLAGGING
 *
 * A later success never clears an earlier flag. Messages are only ever appended.
 *
 * ## Folding a scenario
 *
 *   {@link #run} starts from PASSING and applies every action in order. Once the
 *   progress is FAILING the remaining actions are never invoked.
 *
 * Stateless and synchronous -- the evaluator itself never waits; any waiting happens
 * inside {@link Screen#becomesActive()} or the tasks.
 */
public class ProgressEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ProgressEvaluator.class);

    static final String CAUGHT_ERROR = "Caught error: ";

    // ── Primary API ───────────────────────────────────────────────────────────

    /** Applies an action, checking its screen first. */
    public <T> TestProgress<T> apply(TestProgress<T> progress, Action<T> action) {
        return applyAction(progress, action, true);
    }

    /** Applies an action without checking its screen. */
    public <T> TestProgress<T> blindly(TestProgress<T> progress, Action<T> action) {
        return applyAction(progress, action, false);
    }

    /**
     * Folds {@code actions} over a PASSING progress holding {@code initialState},
     * checking each action's screen.
     */
    public <T> TestProgress<T> run(T initialState, List<Action<T>> actions) {
        TestProgress<T> progress = TestProgress.passing(initialState);
        for (int i = 0; i < actions.size(); i++) {
            if (progress.isFailing()) {
                log.info("ProgressEvaluator: FAILING -- skipping {} remaining action(s)", actions.size() - i);
                break;
            }
            progress = apply(progress, actions.get(i));
        }
        log.info("ProgressEvaluator: scenario finished {} with {} message(s)",
            progress.getStatus(), progress.getMessages().size());
        return progress;
    }

    public <T> TestProgress<T> applyAction(TestProgress<T> progress, Action<T> action, boolean checkScreen) {
        if (progress.isFailing()) {
            return progress;
        }

        T state = progress.getState();
        log.info("ProgressEvaluator: Applying {}", action.description());

        // a screen that never shows up is fatal, whatever the task would have done
        Optional<Screen> screen = action.getScreen();
        if (checkScreen && screen.isPresent()) {
            try {
                screen.get().becomesActive();
            } catch (ScenarioException e) {
                return failing(progress, state, decorate(action, "failed screen check", e.getMessage()));
            } catch (RuntimeException e) {
                return failing(progress, state, CAUGHT_ERROR + e);
            }
        }

        T next;
        try {
            next = action.getTask().apply(state);
        } catch (ScenarioException e) {
            return switch (e.getCategory()) {
                case WARNING          -> flagWarning(progress, action, state, e);
                case INCORRECT_SCREEN -> failing(progress, state, decorate(action, "failed screen check", e.getMessage()));
                default               -> failing(progress, state, String.valueOf(e.getMessage()));
            };
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failing(progress, state, CAUGHT_ERROR + e);
        } catch (Exception | AssertionError e) {
            return failing(progress, state, CAUGHT_ERROR + e);
        }

        if (progress.getMessages().isEmpty()) {
            return TestProgress.passing(next);
        }
        return TestProgress.flagging(next, progress.getMessages());
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    /**
     * FLAGGING, continuing from the carried state. A carried state that is not of the
     * prior state's class fails the scenario instead, keeping the prior state.
     */
    private static <T> TestProgress<T> flagWarning(TestProgress<T> progress, Action<T> action, T state,
                                                   ScenarioException e) {
        String msg = decorate(action, "warning", e.getMessage());
        Optional<Object> carried = e.getCarriedState();
        if (carried.isEmpty()) {
            log.warn("ProgressEvaluator: FLAGGING -- {}", msg);
            return TestProgress.flagging(state, progress.messagesPlus(msg));
        }
        Object next = carried.get();
        if (state != null && !state.getClass().isInstance(next)) {
            return failing(progress, state, msg + "; developer error: carried a "
                + next.getClass().getSimpleName() + " state where "
                + state.getClass().getSimpleName() + " was expected");
        }
        log.warn("ProgressEvaluator: FLAGGING -- {}", msg);
        return TestProgress.flagging(ProgressEvaluator.<T>sameStateType(next), progress.messagesPlus(msg));
    }

    // checked against the prior state's class by the caller
    private static <T> T sameStateType(Object value) {
        return (T) value;
    }

    private static String decorate(Action<?> action, String what, String message) {
        return action.getLabel() + " " + what + ": " + message;
    }

    private static <T> TestProgress<T> failing(TestProgress<T> progress, T state, String message) {
        log.info("ProgressEvaluator: FAILING -- {}", message);
        return TestProgress.failing(state, progress.messagesPlus(message));
    }
}
