package com.sdkforge.core.docs.impl;

import static com.sdkforge.core.docs.impl.Markdown.H1;
import static com.sdkforge.core.docs.impl.Markdown.H2;
import static com.sdkforge.core.docs.impl.Markdown.H3;

import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.docs.SectionBuilder;
import com.sdkforge.core.model.CodeExample;
import com.sdkforge.core.model.Difficulty;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the usage examples page, one section per populated difficulty tier.
 */
public class ExamplesBuilder implements SectionBuilder {

    public static final String ID = "examples";

    static final String NO_EXAMPLES = "No examples available yet. See the quickstart guide to get started.";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String build(DocumentationContext context) {
        String title = H1 + "Usage Examples" + Markdown.SECTION_SEPARATOR + "Complete code examples for common tasks.";
        if (context.examples().isEmpty()) {
            return Markdown.sections(title, NO_EXAMPLES);
        }

        List<String> sections = new ArrayList<>();
        sections.add(title);
        for (Difficulty difficulty : Difficulty.values()) {
            sections.add(buildTier(context.examples(), difficulty));
        }
        return Markdown.sections(sections);
    }

    private String buildTier(List<CodeExample> examples, Difficulty difficulty) {
        List<CodeExample> tier = examples.stream()
            .filter(example -> example.difficulty() == difficulty)
            .toList();
        if (tier.isEmpty()) {
            return "";
        }

        List<String> parts = new ArrayList<>();
        parts.add(H2 + tierTitle(difficulty) + Markdown.SECTION_SEPARATOR + tierIntro(difficulty));
        tier.forEach(example -> parts.add(buildExample(example)));
        return Markdown.sections(parts);
    }

    static String tierTitle(Difficulty difficulty) {
        return switch (difficulty) {
            case BEGINNER -> "Beginner Examples";
            case INTERMEDIATE -> "Intermediate Examples";
            case ADVANCED -> "Advanced Examples";
        };
    }

    private static String tierIntro(Difficulty difficulty) {
        return switch (difficulty) {
            case BEGINNER -> "Great for learning the basics.";
            case INTERMEDIATE -> "Build on the basics with more complex scenarios.";
            case ADVANCED -> "Patterns for complex use cases.";
        };
    }

    private String buildExample(CodeExample example) {
        List<String> lines = new ArrayList<>();
        lines.add(H3 + example.title());
        if (!example.description().isBlank()) {
            lines.add("");
            lines.add(example.description());
        }
        lines.add("");
        lines.add(Markdown.codeBlock(example.language(), example.code()));

        if (example.output() != null && !example.output().isBlank()) {
            lines.add("");
            lines.add(Markdown.bold("Output:"));
            lines.add("");
            lines.add(Markdown.codeBlock("", example.output()));
        }
        if (example.explanation() != null && !example.explanation().isBlank()) {
            lines.add("");
            lines.add(Markdown.bold("Explanation:"));
            lines.add("");
            lines.add(example.explanation());
        }
        return Markdown.lines(lines);
    }
}
