package com.example.groceryopt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Gender {
    MALE, FEMALE;

    /** Case-insensitive parse; requirement tables key their groups by these labels. */
    @JsonCreator
    public static Gender parse(String s) {
        if (s == null) throw new IllegalArgumentException("Gender is required.");
        switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "male": case "m": return MALE;
            case "female": case "f": return FEMALE;
            default: throw new IllegalArgumentException("Unknown gender: " + s);
        }
    }

    @JsonValue
    public String label() { return name().toLowerCase(Locale.ROOT); }
}
