package io.github.manjago.pseudomem.lang;

/**
 * OPENFILE modes.
 */
public enum FileMode {
    READ,
    WRITE,
    APPEND
}
