package com.sdkforge.core.docs.impl;

import static com.sdkforge.core.docs.impl.Markdown.H1;
import static com.sdkforge.core.docs.impl.Markdown.H2;

import com.sdkforge.core.docs.DocumentationConfig;
import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.docs.SectionBuilder;
import com.sdkforge.core.model.ErrorDescriptor;
import com.sdkforge.core.model.MethodDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the SDK README.
 *
 * <p>The quick-links list is computed from the sections that were actually rendered, so a
 * link never points at a missing anchor: installation is empty for unknown target
 * languages and error handling is empty when the plan declares no errors.
 */
public class ReadmeBuilder implements SectionBuilder {

    public static final String ID = "readme";

    static final String INSTALLATION_TITLE = "Installation";
    static final String QUICK_START_TITLE = "Quick Start";
    static final String ERROR_HANDLING_TITLE = "Error Handling";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String build(DocumentationContext context) {
        String installation = buildInstallation(context.config());
        String quickStart = buildQuickStart(context);
        String errorHandling = buildErrorHandling(context);

        return Markdown.sections(
            buildHeader(context.config()),
            buildQuickLinks(context.config(), installation, quickStart, errorHandling),
            buildFeatures(context),
            installation,
            quickStart,
            errorHandling,
            buildDocumentationLinks(context.config()),
            buildLicense()
        );
    }

    private String buildHeader(DocumentationConfig config) {
        List<String> lines = new ArrayList<>();
        lines.add(H1 + config.sdkName());
        if (!config.description().isBlank()) {
            lines.add("");
            lines.add(config.description());
        }
        lines.add("");
        lines.add(Markdown.bold("Version:") + " " + config.sdkVersion());
        return Markdown.lines(lines);
    }

    private String buildQuickLinks(DocumentationConfig config, String installation, String quickStart,
                                   String errorHandling) {
        List<String> links = new ArrayList<>();
        addAnchorLink(links, INSTALLATION_TITLE, installation);
        addAnchorLink(links, QUICK_START_TITLE, quickStart);
        addAnchorLink(links, ERROR_HANDLING_TITLE, errorHandling);
        if (config.authRequired()) {
            links.add(Markdown.link("Authentication", "./docs/AUTHENTICATION.md"));
        }
        if (config.repositoryUrl() != null) {
            links.add(Markdown.link("Repository", config.repositoryUrl()));
        }
        if (config.docsBaseUrl() != null) {
            links.add(Markdown.link("Full Documentation", config.docsBaseUrl()));
        }
        if (links.isEmpty()) {
            return "";
        }
        return H2 + "Quick Links" + Markdown.SECTION_SEPARATOR + Markdown.bullets(links);
    }

    private static void addAnchorLink(List<String> links, String title, String section) {
        if (!section.isBlank()) {
            links.add(Markdown.link(title, "#" + anchor(title)));
        }
    }

    static String anchor(String title) {
        return title.toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    private String buildFeatures(DocumentationContext context) {
        List<String> features = new ArrayList<>();
        int methods = context.methods().size();
        int types = context.types().size();
        if (methods > 0) {
            features.add(methods + (methods == 1 ? " API method" : " API methods"));
        }
        if (types > 0) {
            features.add(types + (types == 1 ? " typed model" : " typed models"));
        }
        if (!context.errors().isEmpty()) {
            features.add("Typed errors for every documented failure");
        }
        if (context.config().authRequired()) {
            features.add("Built-in " + context.config().authMethod().id() + " authentication");
        }
        if (features.isEmpty()) {
            return "";
        }
        return H2 + "Features" + Markdown.SECTION_SEPARATOR + Markdown.bullets(features);
    }

    private String buildInstallation(DocumentationConfig config) {
        String block = Snippets.installBlock(config);
        if (block.isEmpty()) {
            return "";
        }
        return H2 + INSTALLATION_TITLE + Markdown.SECTION_SEPARATOR + block;
    }

    private String buildQuickStart(DocumentationContext context) {
        Optional<MethodDescriptor> first = context.firstMethod();
        String program = Snippets.program(context, first.map(List::of).orElse(List.of()));
        return Markdown.lines(
            H2 + QUICK_START_TITLE,
            "",
            program,
            "",
            Markdown.link("Read the full quickstart guide", "./docs/QUICKSTART.md")
        );
    }

    private String buildErrorHandling(DocumentationContext context) {
        if (context.errors().isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(H2).append(ERROR_HANDLING_TITLE).append(Markdown.SECTION_SEPARATOR);
        sb.append("Every failure is raised as a subclass of `SDKError`:").append(Markdown.SECTION_SEPARATOR);
        Markdown.appendTableRow(sb, "Code", "Error Class", "Description");
        Markdown.appendTableDivider(sb, 3);
        for (ErrorDescriptor error : context.errors().values()) {
            Markdown.appendTableRow(sb,
                Markdown.code(error.code()),
                Markdown.escape(Snippets.errorClass(error)),
                Markdown.escape(Markdown.nullSafe(error.description(), "-")));
        }
        sb.append(Markdown.NEWLINE).append(Markdown.link("Error handling guide", "./docs/ERROR_HANDLING.md"));
        return sb.toString();
    }

    private String buildDocumentationLinks(DocumentationConfig config) {
        List<String> links = new ArrayList<>();
        links.add(Markdown.link("Quickstart Guide", "./docs/QUICKSTART.md"));
        if (config.authRequired()) {
            links.add(Markdown.link("Authentication Guide", "./docs/AUTHENTICATION.md"));
        }
        links.add(Markdown.link("Usage Examples", "./docs/EXAMPLES.md"));
        links.add(Markdown.link("API Reference", "./docs/API_REFERENCE.md"));
        links.add(Markdown.link("Error Handling", "./docs/ERROR_HANDLING.md"));
        return H2 + "Documentation" + Markdown.SECTION_SEPARATOR + Markdown.bullets(links);
    }

    private String buildLicense() {
        return H2 + "License" + Markdown.SECTION_SEPARATOR
            + "This SDK is released under the license declared in its package manifest.";
    }
}
