package com.testlantern.tree;

/**
 * Frame of an element as reported in a dump: origin plus size.
 */
public record Geometry(double x, double y, double width, double height) {

    /** True when {@code other} lies entirely within this frame. */
    public boolean contains(Geometry other) {
        if (other == null) return false;
        return other.x >= x
            && other.y >= y
            && other.x + other.width  <= x + width
            && other.y + other.height <= y + height;
    }

    @Override
    public String toString() {
        return String.format("{{%s, %s}, {%s, %s}}", x, y, width, height);
    }
}
