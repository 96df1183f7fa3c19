package com.testlantern.screen;

import com.testlantern.tree.Geometry;

import java.util.Optional;

/**
 * Live view of one UI element, supplied by whatever drives the application.
 */
public interface ElementProbe {

    boolean exists();

    boolean isHittable();

    /** The element's frame, when it exists. */
    Optional<Geometry> frame();

    /** The frame of the application's main window. */
    Optional<Geometry> windowFrame();

    /** True when the element exists and its frame lies within the main window. */
    default boolean isInMainWindow() {
        if (!exists()) return false;
        Optional<Geometry> window = windowFrame();
        Optional<Geometry> own    = frame();
        return window.isPresent() && own.isPresent() && window.get().contains(own.get());
    }
}
