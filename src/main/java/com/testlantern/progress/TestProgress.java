package com.testlantern.progress;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * How far a scenario has got: the current test state plus every diagnostic
 * collected on the way.
 *
 *   PASSING   -- nothing has gone wrong; no messages
 *   FLAGGING  -- at least one recoverable problem; later actions still run
 *   FAILING   -- a fatal problem; absorbing, no further action changes it
 *
 * <p>Immutable -- use the static factories. Each applied action produces a new
 * instance; messages are kept in the order they were raised.
 *
 * @param <T> the scenario's own test-state type
 */
public final class TestProgress<T> {

    public enum Status { PASSING, FLAGGING, FAILING }

    private final Status       status;
    private final T            state;
    private final List<String> messages;

    private TestProgress(Status status, T state, List<String> messages) {
        this.status   = status;
        this.state    = state;
        this.messages = List.copyOf(messages);
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static <T> TestProgress<T> passing(T state) {
        return new TestProgress<>(Status.PASSING, state, List.of());
    }

    public static <T> TestProgress<T> flagging(T state, List<String> messages) {
        return new TestProgress<>(Status.FLAGGING, state, requireMessages(messages));
    }

    public static <T> TestProgress<T> failing(T state, List<String> messages) {
        return new TestProgress<>(Status.FAILING, state, requireMessages(messages));
    }

    private static List<String> requireMessages(List<String> messages) {
        Objects.requireNonNull(messages, "messages must not be null");
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("a flagging or failing progress needs at least one message");
        }
        return messages;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Status       getStatus()   { return status; }
    public T            getState()    { return state; }
    public List<String> getMessages() { return messages; }

    public boolean isPassing()  { return status == Status.PASSING; }
    public boolean isFlagging() { return status == Status.FLAGGING; }
    public boolean isFailing()  { return status == Status.FAILING; }

    /** The messages so far with {@code message} added at the end. */
    List<String> messagesPlus(String message) {
        List<String> out = new ArrayList<>(messages.size() + 1);
        out.addAll(messages);
        out.add(message);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestProgress)) return false;
        TestProgress<?> that = (TestProgress<?>) o;
        return status == that.status
            && Objects.equals(state, that.state)
            && messages.equals(that.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, state, messages);
    }

    @Override
    public String toString() {
        return messages.isEmpty()
            ? String.format("TestProgress{%s, state=%s}", status, state)
            : String.format("TestProgress{%s, state=%s, messages=%s}", status, state, messages);
    }
}
