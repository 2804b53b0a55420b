package com.alchemist.model;

/**
 * The three element tokens a caster can combine into a spell.
 */
public enum Element {
    FIRE("fire"),
    WATER("water"),
    STONE("stone");

    private final String label;

    Element(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    public static Element fromLabel(String value) {
        for (Element element : values()) {
            if (element.label.equalsIgnoreCase(value) || element.name().equalsIgnoreCase(value)) {
                return element;
            }
        }
        throw new IllegalArgumentException("Unknown element: " + value);
    }
}
