package com.testlantern.tree;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * The kinds of UI element that can appear in a debug dump.
 *
 * Each constant carries the name used for it in the dump text. Lookup in the other
 * direction goes through {@link #fromDebugName}, which falls back to {@link #OTHER}
 * for names it does not know.
 */
public enum ElementType {

    OTHER("Other"),
    APPLICATION("Application"),
    ACTIVITY_INDICATOR("ActivityIndicator"),
    ALERT("Alert"),
    BUTTON("Button"),
    BROWSER("Browser"),
    CELL("Cell"),
    CHECK_BOX("CheckBox"),
    COLLECTION_VIEW("CollectionView"),
    COLOR_WELL("ColorWell"),
    COMBO_BOX("ComboBox"),
    DATE_PICKER("DatePicker"),
    DECREMENT_ARROW("DecrementArrow"),
    DIALOG("Dialog"),
    DISCLOSURE_TRIANGLE("DisclosureTriangle"),
    DOCK_ITEM("DockItem"),
    DRAWER("Drawer"),
    GRID("Grid"),
    GROUP("Group"),
    HANDLE("Handle"),
    HELP_TAG("HelpTag"),
    ICON("Icon"),
    IMAGE("Image"),
    INCREMENT_ARROW("IncrementArrow"),
    KEY("Key"),
    KEYBOARD("Keyboard"),
    LAYOUT_AREA("LayoutArea"),
    LAYOUT_ITEM("LayoutItem"),
    LEVEL_INDICATOR("LevelIndicator"),
    LINK("Link"),
    MAP("Map"),
    MATTE("Matte"),
    MENU("Menu"),
    MENU_BAR("MenuBar"),
    MENU_BAR_ITEM("MenuBarItem"),
    MENU_BUTTON("MenuButton"),
    MENU_ITEM("MenuItem"),
    NAVIGATION_BAR("NavigationBar"),
    OUTLINE("Outline"),
    OUTLINE_ROW("OutlineRow"),
    PAGE_INDICATOR("PageIndicator"),
    PICKER("Picker"),
    PICKER_WHEEL("PickerWheel"),
    POPOVER("Popover"),
    POP_UP_BUTTON("PopUpButton"),
    PROGRESS_INDICATOR("ProgressIndicator"),
    RADIO_BUTTON("RadioButton"),
    RADIO_GROUP("RadioGroup"),
    RATING_INDICATOR("RatingIndicator"),
    RELEVANCE_INDICATOR("RelevanceIndicator"),
    RULER("Ruler"),
    RULER_MARKER("RulerMarker"),
    SCROLL_BAR("ScrollBar"),
    SCROLL_VIEW("ScrollView"),
    SEARCH_FIELD("SearchField"),
    SECURE_TEXT_FIELD("SecureTextField"),
    SEGMENTED_CONTROL("SegmentedControl"),
    SHEET("Sheet"),
    SLIDER("Slider"),
    SPLIT_GROUP("SplitGroup"),
    SPLITTER("Splitter"),
    STATIC_TEXT("StaticText"),
    STATUS_BAR("StatusBar"),
    STEPPER("Stepper"),
    SWITCH("Switch"),
    TAB("Tab"),
    TAB_BAR("TabBar"),
    TAB_GROUP("TabGroup"),
    TABLE("Table"),
    TABLE_COLUMN("TableColumn"),
    TABLE_ROW("TableRow"),
    TEXT_FIELD("TextField"),
    TEXT_VIEW("TextView"),
    TIMELINE("Timeline"),
    TOGGLE("Toggle"),
    TOOLBAR("Toolbar"),
    TOOLBAR_BUTTON("ToolbarButton"),
    VALUE_INDICATOR("ValueIndicator"),
    WEB_VIEW("WebView"),
    WINDOW("Window");

    private static final Map<String, ElementType> BY_DEBUG_NAME;
    private static final Map<ElementType, String> IRREGULAR_PLURALS;

    static {
        Map<String, ElementType> byName = new HashMap<>();
        for (ElementType t : values()) {
            byName.put(t.debugName, t);
        }
        BY_DEBUG_NAME = Collections.unmodifiableMap(byName);

        Map<ElementType, String> plurals = new HashMap<>();
        plurals.put(CHECK_BOX, "checkBoxes");
        plurals.put(COMBO_BOX, "comboBoxes");
        plurals.put(SWITCH,    "switches");
        IRREGULAR_PLURALS = Collections.unmodifiableMap(plurals);
    }

    private final String debugName;

    ElementType(String debugName) {
        this.debugName = debugName;
    }

    /** The name this type carries in dump text, e.g. {@code "StaticText"}. */
    public String debugName() { return debugName; }

    /**
     * Resolves a dump type name. Unknown names map to {@link #OTHER}.
     */
    public static ElementType fromDebugName(String name) {
        if (name == null) return OTHER;
        return BY_DEBUG_NAME.getOrDefault(name, OTHER);
    }

    /** True when {@code name} is a type name this table knows. */
    public static boolean isKnownDebugName(String name) {
        return name != null && BY_DEBUG_NAME.containsKey(name);
    }

    /**
     * The plural query name used in locator paths, e.g. {@code "staticTexts"},
     * {@code "checkBoxes"}.
     */
    public String queryName() {
        String irregular = IRREGULAR_PLURALS.get(this);
        if (irregular != null) return irregular;
        return Character.toLowerCase(debugName.charAt(0)) + debugName.substring(1) + "s";
    }
}
