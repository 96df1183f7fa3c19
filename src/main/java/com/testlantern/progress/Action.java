package com.testlantern.progress;

import com.testlantern.screen.Screen;

import java.util.Objects;
import java.util.Optional;

/**
 * One labelled step of a scenario.
 *
 * <p>An action optionally names the {@link Screen} it expects to run on. When the
 * evaluator applies it with screen checking, that screen must become active before
 * the task runs.
 *
 * Immutable.
 */
public final class Action<T> {

    private final String        label;
    private final Screen        screen;   // null for screenless actions
    private final ActionTask<T> task;

    public Action(String label, Screen screen, ActionTask<T> task) {
        this.label  = Objects.requireNonNull(label, "label must not be null");
        this.screen = screen;
        this.task   = Objects.requireNonNull(task, "task must not be null");
    }

    /** An action with no screen precondition. */
    public static <T> Action<T> screenless(String label, ActionTask<T> task) {
        return new Action<>(label, null, task);
    }

    public String           getLabel()  { return label; }
    public Optional<Screen> getScreen() { return Optional.ofNullable(screen); }
    public ActionTask<T>    getTask()   { return task; }

    /** {@code "Screen.label"}, or {@code "<screenless> label"}. */
    public String description() {
        return screen != null
            ? screen.getLabel() + "." + label
            : "<screenless> " + label;
    }

    @Override
    public String toString() {
        return "Action{" + description() + "}";
    }
}
