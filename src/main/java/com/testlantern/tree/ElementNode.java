package com.testlantern.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One element of a UI hierarchy reconstructed from a debug dump.
 *
 * <p>Nodes are created by {@link DebugLineParser} and linked together by
 * {@link DebugTreeParser}; once the parser returns, a tree is never changed again.
 * The public API is read-only.
 *
 * <p>Equality is identity. Handles come from the dump and are not guaranteed to be
 * unique or stable between two dumps of the same screen.
 */
public class ElementNode {

    /** Where a node sits among the same-type children of its parent. */
    public record IndexMembership(OptionalInt ordinal, int cohortSize) {}

    private final ElementType type;
    private final long        handle;        // unsigned, as printed in the dump
    private final Geometry    geometry;      // null when the dump line carried none
    private final boolean     mainWindow;
    private final long        traits;
    private final String      label;
    private final String      identifier;
    private final String      value;
    private final String      placeholderValue;
    private final int         depth;
    private final String      source;

    private ElementNode             parent;
    private final List<ElementNode> children = new ArrayList<>();

    private ElementNode(Builder b) {
        this.type             = b.type != null ? b.type : ElementType.OTHER;
        this.handle           = b.handle;
        this.geometry         = b.geometry;
        this.mainWindow       = b.mainWindow;
        this.traits           = b.traits;
        this.label            = b.label;
        this.identifier       = b.identifier;
        this.value            = b.value;
        this.placeholderValue = b.placeholderValue;
        this.depth            = b.depth;
        this.source           = b.source != null ? b.source : "";
    }

    // ── Tree assembly (parser only) ───────────────────────────────────────────

    void attachChild(ElementNode child) {
        child.parent = this;
        children.add(child);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public ElementType        getType()             { return type; }
    public long               getHandle()           { return handle; }
    public Optional<Geometry> getGeometry()         { return Optional.ofNullable(geometry); }
    public boolean            isMainWindow()        { return mainWindow; }
    public long               getTraits()           { return traits; }
    public Optional<String>   getLabel()            { return Optional.ofNullable(label); }
    public Optional<String>   getIdentifier()       { return Optional.ofNullable(identifier); }
    public Optional<String>   getValue()            { return Optional.ofNullable(value); }
    public Optional<String>   getPlaceholderValue() { return Optional.ofNullable(placeholderValue); }
    public int                getDepth()            { return depth; }
    public String             getSource()           { return source; }
    public Optional<ElementNode> getParent()        { return Optional.ofNullable(parent); }
    public List<ElementNode>  getChildren()         { return Collections.unmodifiableList(children); }

    public boolean isRoot() { return parent == null; }

    /**
     * The key used to tell this element apart from its siblings: the identifier if
     * present, otherwise the label.
     */
    public Optional<String> getIndex() {
        return identifier != null ? Optional.of(identifier) : Optional.ofNullable(label);
    }

    /** Hex form of the handle, as it appeared in the dump. */
    public String getHandleHex() {
        return "0x" + Long.toHexString(handle);
    }

    // ── Navigation ────────────────────────────────────────────────────────────

    /** Children of the given type, in dump order. */
    public List<ElementNode> childrenOfType(ElementType t) {
        List<ElementNode> out = new ArrayList<>();
        for (ElementNode c : children) {
            if (c.type == t) out.add(c);
        }
        return out;
    }

    /**
     * Children of the given type keyed by their index. Children without an index are
     * left out; when two children share an index the later one wins.
     */
    public Map<String, ElementNode> childrenByIndex(ElementType t) {
        Map<String, ElementNode> out = new LinkedHashMap<>();
        for (ElementNode c : children) {
            if (c.type != t) continue;
            c.getIndex().ifPresent(idx -> out.put(idx, c));
        }
        return out;
    }

    /**
     * Ordinal of this node among its parent's children of the same type, plus the size
     * of that cohort. A root is reported as the only member of its cohort.
     */
    public IndexMembership numericIndexMembership() {
        if (parent == null) return new IndexMembership(OptionalInt.of(0), 1);
        List<ElementNode> cohort = parent.childrenOfType(type);
        int idx = cohort.indexOf(this);
        if (idx < 0) return new IndexMembership(OptionalInt.empty(), 0);
        return new IndexMembership(OptionalInt.of(idx), cohort.size());
    }

    /** This node and all of its descendants, depth-first, parents before children. */
    public List<ElementNode> preorder() {
        List<ElementNode> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(ElementNode node, List<ElementNode> out) {
        out.add(node);
        for (ElementNode c : node.children) collect(c, out);
    }

    // ── Description ───────────────────────────────────────────────────────────

    public String describe() {
        return String.format("%s - label: %s identifier: %s value: %s",
            type.debugName(), label, identifier, value);
    }

    /** Indented, one line per node. */
    public String describeTree() {
        StringBuilder sb = new StringBuilder();
        for (ElementNode n : preorder()) {
            sb.append(" ".repeat(Math.max(0, n.depth))).append(n.describe()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ElementNode{type=%s, handle=%s, depth=%d, index=%s}",
            type, getHandleHex(), depth, getIndex().orElse(null));
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private ElementType type = ElementType.OTHER;
        private long        handle;
        private Geometry    geometry;
        private boolean     mainWindow;
        private long        traits;
        private String      label;
        private String      identifier;
        private String      value;
        private String      placeholderValue;
        private int         depth;
        private String      source;

        public Builder type(ElementType t)              { this.type = t; return this; }
        public Builder handle(long h)                   { this.handle = h; return this; }
        public Builder geometry(Geometry g)             { this.geometry = g; return this; }
        public Builder mainWindow(boolean b)            { this.mainWindow = b; return this; }
        public Builder traits(long t)                   { this.traits = t; return this; }
        public Builder label(String s)                  { this.label = s; return this; }
        public Builder identifier(String s)             { this.identifier = s; return this; }
        public Builder value(String s)                  { this.value = s; return this; }
        public Builder placeholderValue(String s)       { this.placeholderValue = s; return this; }
        public Builder depth(int d)                     { this.depth = d; return this; }
        public Builder source(String s)                 { this.source = s; return this; }
        public ElementNode build()                      { return new ElementNode(this); }
    }
}
