package com.sdkforge.core.emitter;

/**
 * Indentation unit used by emitted source.
 */
public enum IndentStyle {
    /** {@code indentSize} spaces per level */
    SPACES,

    /** One tab per level */
    TABS
}
