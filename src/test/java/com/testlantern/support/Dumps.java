package com.testlantern.support;

/**
 * Captured dump text shared by unit tests and step definitions.
 */
public final class Dumps {

    private Dumps() {}

    /** Login screen: three buttons (one keyed), one label, inside a main window. */
    public static final String LOGIN_TREE = String.join("\n",
        " →Application 0x7f81: {{0.0, 0.0}, {375.0, 667.0}}, label: 'Demo'",
        "    Window 0x7f82: Main Window, {{0.0, 0.0}, {375.0, 667.0}}",
        "      Other 0x7f83: {{0.0, 0.0}, {375.0, 667.0}}",
        "        Button 0x7f84: traits: 1, {{10.0, 20.0}, {100.0, 44.0}}, identifier: 'login', label: 'Log in'",
        "        Button 0x7f85: {{10.0, 70.0}, {100.0, 44.0}}",
        "        Button 0x7f86: {{10.0, 120.0}, {100.0, 44.0}}",
        "        StaticText 0x7f87: {{10.0, 170.0}, {100.0, 20.0}}");

    /** A full debug description with the login tree as its element subtree. */
    public static final String LOGIN_DESCRIPTION = String.join("\n",
        "Attributes: Application, 0x7f81, pid: 4242, label: 'Demo'",
        "Element subtree:",
        LOGIN_TREE,
        "Path to element:",
        " →Application, 0x7f81, pid: 4242, label: 'Demo'",
        "Query chain:",
        " →Find: Target Application 'com.example.demo'");

    /** Accessors for {@link #LOGIN_TREE} with app name "app", in dump order. */
    public static final String[] LOGIN_ACCESSORS = {
        "app",
        "app",
        "app.buttons[\"login\"]",
        "app.buttons.elementAtIndex(1)",
        "app.buttons.elementAtIndex(2)",
        "app.staticTexts"
    };
}
