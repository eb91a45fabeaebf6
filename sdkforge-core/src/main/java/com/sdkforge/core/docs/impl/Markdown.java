package com.sdkforge.core.docs.impl;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Markdown formatting helpers shared by the section builders.
 */
final class Markdown {

    static final String H1 = "# ";
    static final String H2 = "## ";
    static final String H3 = "### ";
    static final String H4 = "#### ";
    static final String FENCE = "```";
    static final String PIPE = "|";
    static final String NEWLINE = "\n";
    static final String SECTION_SEPARATOR = "\n\n";
    static final String BULLET = "- ";
    static final String RULE = "---";

    private Markdown() {
        // Utility class
    }

    /**
     * Joins sections with a blank line, dropping empty ones.
     */
    static String sections(String... sections) {
        return sections(Arrays.asList(sections));
    }

    static String sections(List<String> sections) {
        return sections.stream()
            .filter(section -> section != null && !section.isBlank())
            .collect(Collectors.joining(SECTION_SEPARATOR));
    }

    static String lines(String... lines) {
        return String.join(NEWLINE, lines);
    }

    static String lines(List<String> lines) {
        return String.join(NEWLINE, lines);
    }

    static String codeBlock(String language, String code) {
        return FENCE + (language != null ? language : "") + NEWLINE + code + NEWLINE + FENCE;
    }

    static String codeBlock(String language, List<String> code) {
        return codeBlock(language, lines(code));
    }

    static String bullets(List<String> items) {
        return items.stream().map(item -> BULLET + item).collect(Collectors.joining(NEWLINE));
    }

    static String link(String text, String target) {
        return "[" + text + "](" + target + ")";
    }

    static String bold(String text) {
        return "**" + text + "**";
    }

    static String code(String text) {
        return "`" + text + "`";
    }

    static void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(' ').append(col).append(' ').append(PIPE);
        }
        sb.append(NEWLINE);
    }

    static void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        for (int i = 0; i < columnCount; i++) {
            sb.append("------").append(PIPE);
        }
        sb.append(NEWLINE);
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }

    static String nullSafe(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
