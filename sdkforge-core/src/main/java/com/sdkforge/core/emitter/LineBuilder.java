package com.sdkforge.core.emitter;

import com.sdkforge.core.ast.DocComment;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates rendered source lines while tracking the current indentation level.
 *
 * <p>The indentation level never drops below zero: {@link #outdent()} at level zero is a
 * no-op. Empty lines are never indented.
 *
 * <p>Not thread-safe. Each emission run creates its own instance.
 */
public final class LineBuilder {

    private static final String DOC_START = "/**";
    private static final String BLOCK_START = "/*";
    private static final String DOC_LINE = " * ";
    private static final String DOC_SEPARATOR = " *";
    private static final String DOC_END = " */";

    private final EmitterOptions options;
    private final String indentUnit;
    private final List<String> lines = new ArrayList<>();
    private int indentLevel;

    /**
     * Creates a builder with the given formatting options.
     *
     * @param options formatting options
     */
    public LineBuilder(EmitterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.indentUnit = options.indentUnit();
    }

    /**
     * Appends one line at the current indentation.
     *
     * @param text line content
     * @return this builder
     */
    public LineBuilder line(String text) {
        if (text == null || text.isEmpty()) {
            lines.add("");
        } else {
            lines.add(indentUnit.repeat(indentLevel) + text);
        }
        return this;
    }

    /**
     * Appends several lines at the current indentation.
     *
     * @param texts line contents
     * @return this builder
     */
    public LineBuilder lines(List<String> texts) {
        texts.forEach(this::line);
        return this;
    }

    /**
     * Appends a comment, either one {@code //} line or a plain {@code /*} block comment with
     * one line per text line. Documentation comments go through {@link #docBlock(DocComment)}.
     *
     * @param text comment text
     * @param multiline whether to use a block comment
     * @return this builder
     */
    public LineBuilder comment(String text, boolean multiline) {
        if (multiline) {
            line(BLOCK_START);
            text.lines().forEach(l -> line(DOC_LINE + l));
            line(DOC_END);
        } else {
            line("// " + text);
        }
        return this;
    }

    /**
     * Appends a structured documentation comment.
     *
     * <p>Absent sections are skipped. A separator line is written before the parameter,
     * throws and example groups only when something precedes them in the block.
     *
     * @param doc documentation comment
     * @return this builder
     */
    public LineBuilder docBlock(DocComment doc) {
        List<String> body = new ArrayList<>();

        if (!isBlank(doc.description())) {
            doc.description().lines().forEach(l -> body.add(l));
        }

        List<String> params = doc.params().stream()
            .filter(p -> !isBlank(p.name()))
            .map(p -> "@param " + braced(p.type()) + p.name() + suffix(p.description()))
            .toList();
        if (!params.isEmpty()) {
            separate(body);
            body.addAll(params);
        }

        if (doc.returns() != null && !doc.returns().isEmpty()) {
            String type = isBlank(doc.returns().type()) ? "" : " {" + doc.returns().type() + "}";
            body.add("@returns" + type + suffix(doc.returns().description()));
        }

        List<String> throwsList = doc.throwsList().stream()
            .filter(t -> !isBlank(t))
            .map(t -> "@throws {" + t + "}")
            .toList();
        if (!throwsList.isEmpty()) {
            separate(body);
            body.addAll(throwsList);
        }

        if (doc.deprecated()) {
            body.add("@deprecated");
        }

        if (!isBlank(doc.example())) {
            separate(body);
            body.add("@example");
            doc.example().lines().forEach(l -> body.add(l));
        }

        line(DOC_START);
        body.forEach(l -> line(l.isEmpty() ? DOC_SEPARATOR : DOC_LINE + l));
        line(DOC_END);
        return this;
    }

    /**
     * Increases the indentation level by one.
     *
     * @return this builder
     */
    public LineBuilder indent() {
        indentLevel++;
        return this;
    }

    /**
     * Decreases the indentation level by one, stopping at zero.
     *
     * @return this builder
     */
    public LineBuilder outdent() {
        indentLevel = Math.max(0, indentLevel - 1);
        return this;
    }

    /**
     * Runs {@code body} one level deeper. The previous level is restored afterwards,
     * also when {@code body} throws.
     *
     * @param body callback appending the nested lines
     * @return this builder
     */
    public LineBuilder block(Runnable body) {
        int saved = indentLevel;
        indentLevel++;
        try {
            body.run();
        } finally {
            indentLevel = saved;
        }
        return this;
    }

    /**
     * Appends an empty line.
     *
     * @return this builder
     */
    public LineBuilder blank() {
        lines.add("");
        return this;
    }

    public int indentLevel() {
        return indentLevel;
    }

    /**
     * Returns a snapshot of the lines written so far.
     *
     * @return immutable copy of the lines
     */
    public List<String> lines() {
        return List.copyOf(lines);
    }

    /**
     * Counts lines wider than the configured line width.
     *
     * @return number of overlong lines
     */
    public long overlongLineCount() {
        return lines.stream().filter(l -> l.length() > options.lineWidth()).count();
    }

    /**
     * Joins the lines with {@code \n}, adding a final newline when configured and missing.
     *
     * @return rendered text
     */
    @Override
    public String toString() {
        String text = String.join("\n", lines);
        if (options.trailingNewline() && !text.endsWith("\n")) {
            text += "\n";
        }
        return text;
    }

    // Empty entries in a doc body stand for the " *" separator
    private static void separate(List<String> body) {
        if (!body.isEmpty()) {
            body.add("");
        }
    }

    private static String braced(String type) {
        return isBlank(type) ? "" : "{" + type + "} ";
    }

    private static String suffix(String description) {
        return isBlank(description) ? "" : " " + description;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
