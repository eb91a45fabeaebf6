package com.sdkforge.core.docs.impl;

import static com.sdkforge.core.docs.impl.Markdown.H1;
import static com.sdkforge.core.docs.impl.Markdown.H2;
import static com.sdkforge.core.docs.impl.Markdown.H3;

import com.sdkforge.core.docs.DocumentationConfig;
import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.docs.SectionBuilder;
import com.sdkforge.core.model.MethodDescriptor;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the quickstart guide: prerequisites, setup, a first request and a few common tasks.
 */
public class QuickstartBuilder implements SectionBuilder {

    public static final String ID = "quickstart";

    static final int MAX_COMMON_TASKS = 3;
    static final String NO_SETUP_REQUIRED = "No setup required!";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String build(DocumentationContext context) {
        return Markdown.sections(
            buildTitle(context.config()),
            buildPrerequisites(context),
            buildSetup(context),
            buildFirstRequest(context),
            buildCommonTasks(context),
            buildNextSteps()
        );
    }

    private String buildTitle(DocumentationConfig config) {
        return Markdown.lines(
            H1 + config.sdkName() + " Quickstart",
            "",
            "Get up and running with the SDK in a few minutes."
        );
    }

    private String buildPrerequisites(DocumentationContext context) {
        List<String> items = new ArrayList<>();
        String runtime = runtimeRequirement(context.config());
        if (!runtime.isEmpty()) {
            items.add(runtime);
        }
        items.addAll(context.prerequisites());
        items.add(context.config().authRequired()
            ? "An API key, exported as " + Markdown.code(Snippets.API_KEY_ENV)
            : NO_SETUP_REQUIRED);
        return H2 + "Prerequisites" + Markdown.SECTION_SEPARATOR + Markdown.bullets(items);
    }

    static String runtimeRequirement(DocumentationConfig config) {
        return switch (Snippets.Language.of(config)) {
            case TYPESCRIPT, JAVASCRIPT -> "Node.js 18+";
            case PYTHON -> "Python 3.8+";
            case GO -> "Go 1.20+";
            case RUST -> "Rust 1.70+ with Cargo";
            case JAVA -> "Java 17+ with Maven";
            case UNKNOWN -> "";
        };
    }

    private String buildSetup(DocumentationContext context) {
        List<String> lines = new ArrayList<>();
        int step = 1;
        lines.add(H2 + "Installation & Setup");
        lines.add("");
        lines.add(H3 + "Step " + step++ + ": Install the SDK");
        lines.add("");
        String install = Snippets.installBlock(context.config());
        lines.add(install.isEmpty() ? "Add " + Markdown.code(context.config().sdkName()) + " to your project." : install);

        if (context.config().authRequired()) {
            lines.add("");
            lines.add(H3 + "Step " + step++ + ": Set Your Credentials");
            lines.add("");
            lines.add(Markdown.codeBlock("bash", "export " + Snippets.API_KEY_ENV + "=\"your-api-key-here\""));
        }
        for (String setupStep : context.setupSteps()) {
            lines.add("");
            lines.add(H3 + "Step " + step++ + ": " + setupStep);
        }
        return Markdown.lines(lines);
    }

    private String buildFirstRequest(DocumentationContext context) {
        List<MethodDescriptor> first = context.firstMethod().map(List::of).orElse(List.of());
        return Markdown.lines(
            H2 + "Your First Request",
            "",
            Snippets.program(context, first)
        );
    }

    private String buildCommonTasks(DocumentationContext context) {
        List<MethodDescriptor> methods = context.methods().values().stream()
            .limit(MAX_COMMON_TASKS)
            .toList();
        if (methods.isEmpty()) {
            return "";
        }

        List<String> lines = new ArrayList<>();
        lines.add(H2 + "Common Tasks");
        for (int i = 0; i < methods.size(); i++) {
            MethodDescriptor method = methods.get(i);
            lines.add("");
            lines.add(H3 + "Example " + (i + 1) + ": " + method.name());
            if (method.description() != null && !method.description().isBlank()) {
                lines.add("");
                lines.add(method.description());
            }
            lines.add("");
            lines.add(Markdown.codeBlock(Snippets.fence(context.config()), Snippets.callLines(context, method)));
        }
        return Markdown.lines(lines);
    }

    private String buildNextSteps() {
        return H2 + "Next Steps" + Markdown.SECTION_SEPARATOR + Markdown.bullets(List.of(
            "Set up " + Markdown.link("authentication", "./AUTHENTICATION.md") + " if needed",
            "Browse " + Markdown.link("usage examples", "./EXAMPLES.md"),
            "Learn about " + Markdown.link("error handling", "./ERROR_HANDLING.md"),
            "Look up every method in the " + Markdown.link("API reference", "./API_REFERENCE.md")
        ));
    }
}
