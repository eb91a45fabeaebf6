package com.sdkforge.core.emitter;

/**
 * Formatting options of an emitter, fixed for the whole run.
 *
 * @param indentStyle indentation unit
 * @param indentSize spaces per level when {@code indentStyle} is {@link IndentStyle#SPACES}
 * @param lineWidth target line width; informational, lines are never wrapped
 * @param trailingNewline whether output ends with a newline
 * @param statementTerminators whether statements end with the target terminator
 */
public record EmitterOptions(
    IndentStyle indentStyle,
    int indentSize,
    int lineWidth,
    boolean trailingNewline,
    boolean statementTerminators
) {
    public static final int DEFAULT_INDENT_SIZE = 2;
    public static final int DEFAULT_LINE_WIDTH = 100;

    /**
     * Compact constructor with validation.
     */
    public EmitterOptions {
        if (indentStyle == null) {
            indentStyle = IndentStyle.SPACES;
        }
        if (indentSize <= 0) {
            throw new IllegalArgumentException("indentSize must be greater than 0, was " + indentSize);
        }
        if (lineWidth <= 0) {
            throw new IllegalArgumentException("lineWidth must be greater than 0, was " + lineWidth);
        }
    }

    /**
     * Creates the default options: two spaces, width 100, trailing newline, terminators on.
     *
     * @return default options
     */
    public static EmitterOptions defaults() {
        return new EmitterOptions(IndentStyle.SPACES, DEFAULT_INDENT_SIZE, DEFAULT_LINE_WIDTH, true, true);
    }

    /**
     * Returns the text of one indentation level.
     *
     * @return tab or spaces
     */
    public String indentUnit() {
        return indentStyle == IndentStyle.TABS ? "\t" : " ".repeat(indentSize);
    }
}
