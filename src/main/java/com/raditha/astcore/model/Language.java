package com.raditha.astcore.model;

/**
 * Source language of a token list. Decides the keyword set and a few
 * classification rules.
 */
public enum Language {
    C,
    CPP;

    /**
     * Parse a configuration value ("c", "cpp", "c++"), falling back to CPP.
     */
    public static Language fromString(String value) {
        if (value == null) {
            return CPP;
        }
        return "c".equalsIgnoreCase(value.trim()) ? C : CPP;
    }
}
