package io.github.manjago.pseudomem.lang;

import org.jetbrains.annotations.Nullable;

/**
 * Declarable data types.
 */
public enum DataType {
    INTEGER,
    REAL,
    STRING,
    CHAR,
    BOOLEAN,
    ARRAY,
    POINTER_TO_INTEGER,
    POINTER_TO_REAL,
    POINTER_TO_CHAR,
    VOID_POINTER;

    public boolean isPointer() {
        return this == POINTER_TO_INTEGER || this == POINTER_TO_REAL
                || this == POINTER_TO_CHAR || this == VOID_POINTER;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == REAL;
    }

    public boolean isText() {
        return this == STRING || this == CHAR;
    }

    /**
     * Resolve a type keyword, or null if the word does not name a type.
     */
    public static @Nullable DataType fromKeyword(String word) {
        for (DataType type : values()) {
            if (type.name().equals(word)) {
                return type;
            }
        }
        return null;
    }
}
