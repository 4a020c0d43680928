package com.proseparser.ast;

import java.util.Locale;

/**
 * Type words accepted after {@code as [a|an]} in a declaration. Purely cosmetic:
 * nothing checks values against them.
 */
public enum TypeTag {
    INTEGER,
    NUMBER,
    STRING,
    BOOLEAN,
    LIST;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the tag for a type word, or null if the word names no type
     */
    public static TypeTag fromKeyword(String word) {
        for (TypeTag tag : values()) {
            if (tag.keyword().equalsIgnoreCase(word)) {
                return tag;
            }
        }
        return null;
    }
}
