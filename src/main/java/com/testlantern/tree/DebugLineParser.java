package com.testlantern.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one line of an element dump into a standalone {@link ElementNode}.
 *
 * ## Line grammar
 *
 * <pre>
 *   &lt;markers&gt;&lt;TYPE&gt; 0x&lt;hex&gt;: [&lt;special&gt;][{{x, y}, {w, h}}][, key: 'value']*
 * </pre>
 *
 *   markers   run of spaces and arrows; two characters per level, so depth = len/2 - 1
 *   TYPE      dump type name, resolved through {@link ElementType#fromDebugName}
 *   hex       element handle, unsigned
 *   special   free text before the frame (or before the first key when there is no
 *             frame); may hold "Main Window" and "traits: N"
 *   frame     outer braces optional; any coordinate that is not a number drops the frame
 *   key       label | identifier | value | placeholderValue
 *
 * A line that does not fit the grammar, or whose marker run is shorter than two
 * characters, is rejected.
 */
public class DebugLineParser {

    private static final Logger log = LoggerFactory.getLogger(DebugLineParser.class);

    private static final Pattern LINE = Pattern.compile(
        "^([ →]*)(\\S+) 0x([0-9a-fA-F]+):\\s?(.*)$");

    private static final String NUM = "(-?[\\d.]+)";
    private static final Pattern FRAME = Pattern.compile(
        "\\{?\\{" + NUM + ", " + NUM + "\\}, \\{" + NUM + ", " + NUM + "\\}\\}?");

    private static final Pattern MAIN_WINDOW = Pattern.compile("Main Window");
    private static final Pattern TRAITS      = Pattern.compile("traits: (\\d+)");

    private static final Pattern EXTRA_KEY = Pattern.compile(
        "(?:^|[\\s,])(?:label|identifier|value|placeholderValue):");

    private static final Pattern LABEL             = extraPattern("label");
    private static final Pattern IDENTIFIER        = extraPattern("identifier");
    private static final Pattern VALUE             = extraPattern("value");
    private static final Pattern PLACEHOLDER_VALUE = extraPattern("placeholderValue");

    /** Outcome of one line: exactly one of node / reason is set. */
    record Attempt(ElementNode node, String reason) {
        static Attempt ok(ElementNode n)       { return new Attempt(n, null); }
        static Attempt rejected(String why)    { return new Attempt(null, why); }
        boolean isOk()                         { return node != null; }
    }

    /**
     * Parses a single dump line.
     *
     * @return the node, or empty when the line does not fit the grammar
     */
    public Optional<ElementNode> parse(String line) {
        return Optional.ofNullable(attempt(line).node());
    }

    Attempt attempt(String line) {
        if (line == null) return Attempt.rejected("null line");

        Matcher m = LINE.matcher(line);
        if (!m.matches()) {
            return Attempt.rejected("does not match the dump line grammar");
        }

        int depth = (m.group(1).length() / 2) - 1;
        if (depth < 0) {
            return Attempt.rejected("missing depth markers");
        }

        long handle;
        try {
            handle = Long.parseUnsignedLong(m.group(3), 16);
        } catch (NumberFormatException e) {
            return Attempt.rejected("handle 0x" + m.group(3) + " is out of range");
        }

        String typeName = m.group(2);
        ElementType type = ElementType.fromDebugName(typeName);
        if (type == ElementType.OTHER && !ElementType.isKnownDebugName(typeName)) {
            log.debug("DebugLineParser: unknown element type '{}' treated as Other", typeName);
        }

        String rest = m.group(4);
        String special;
        String extras;
        Geometry geometry = null;

        Matcher frame = FRAME.matcher(rest);
        if (frame.find()) {
            special  = rest.substring(0, frame.start());
            extras   = rest.substring(frame.end());
            geometry = parseGeometry(frame);
        } else {
            // without a frame, special text stops where the first key starts
            Matcher key = EXTRA_KEY.matcher(rest);
            special = key.find() ? rest.substring(0, key.start()) : rest;
            extras  = rest;
        }

        ElementNode node = ElementNode.builder()
            .type(type)
            .handle(handle)
            .depth(depth)
            .geometry(geometry)
            .mainWindow(MAIN_WINDOW.matcher(special).find())
            .traits(parseTraits(special))
            .label(extra(extras, LABEL))
            .identifier(extra(extras, IDENTIFIER))
            .value(extra(extras, VALUE))
            .placeholderValue(extra(extras, PLACEHOLDER_VALUE))
            .source(line)
            .build();
        return Attempt.ok(node);
    }

    // ── Field helpers ─────────────────────────────────────────────────────────

    private static Geometry parseGeometry(Matcher frame) {
        try {
            return new Geometry(
                Double.parseDouble(frame.group(1)),
                Double.parseDouble(frame.group(2)),
                Double.parseDouble(frame.group(3)),
                Double.parseDouble(frame.group(4)));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long parseTraits(String special) {
        Matcher t = TRAITS.matcher(special);
        if (!t.find()) return 0L;
        try { return Long.parseUnsignedLong(t.group(1)); }
        catch (NumberFormatException e) { return 0L; }
    }

    private static Pattern extraPattern(String key) {
        return Pattern.compile("(?:^|[\\s,])" + key + ":\\s*'([^']*)'(?=,|$)");
    }

    private static String extra(String text, Pattern key) {
        Matcher m = key.matcher(text);
        return m.find() ? m.group(1) : null;
    }
}
