package com.testlantern.screen;

/**
 * Which readiness conditions an element must meet before an action touches it.
 *
 * @param exists       the element is present in the UI
 * @param inMainWindow the element's frame lies within the main window's frame
 * @param hittable     the element can receive a tap
 */
public record ElementReadiness(boolean exists, boolean inMainWindow, boolean hittable) {

    private static final ElementReadiness DEFAULTS = new ElementReadiness(true, false, true);

    /** Exists and hittable. */
    public static ElementReadiness defaults() {
        return DEFAULTS;
    }

    public static ElementReadiness existsOnly() {
        return new ElementReadiness(true, false, false);
    }

    public static ElementReadiness all() {
        return new ElementReadiness(true, true, true);
    }

    public ElementReadiness withInMainWindow() {
        return new ElementReadiness(exists, true, hittable);
    }
}
