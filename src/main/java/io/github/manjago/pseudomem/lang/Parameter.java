package io.github.manjago.pseudomem.lang;

import org.jetbrains.annotations.Nullable;

/**
 * Formal parameter of a procedure or function.
 *
 * @param elementType element type when {@code type} is ARRAY, otherwise null
 * @param byRef true for BYREF (alias the caller's variable), false for BYVAL (copy)
 */
public record Parameter(String name, DataType type, @Nullable DataType elementType, boolean byRef) {

    @Override
    public String toString() {
        String typeText = type == DataType.ARRAY ? "ARRAY OF " + elementType : type.name();
        return (byRef ? "BYREF " : "BYVAL ") + name + " : " + typeText;
    }
}
