package com.radioss.translator.deck.config;

import java.util.Locale;

/**
 * Unit systems the starter header can declare. Input and work units are written identically.
 */
public enum UnitSystem {
    SI("Mg", "mm", "s"),
    IMPERIAL("lb", "in", "s");

    private final String mass;
    private final String length;
    private final String time;

    UnitSystem(String mass, String length, String time) {
        this.mass = mass;
        this.length = length;
        this.time = time;
    }

    public String getMass() {
        return mass;
    }

    public String getLength() {
        return length;
    }

    public String getTime() {
        return time;
    }

    public static UnitSystem fromName(String name) {
        if (name == null || name.isBlank()) {
            return SI;
        }
        return UnitSystem.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
