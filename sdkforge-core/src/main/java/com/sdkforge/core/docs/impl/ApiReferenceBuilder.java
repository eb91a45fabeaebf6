package com.sdkforge.core.docs.impl;

import static com.sdkforge.core.docs.impl.Markdown.H1;
import static com.sdkforge.core.docs.impl.Markdown.H2;
import static com.sdkforge.core.docs.impl.Markdown.H3;

import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.docs.SectionBuilder;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.model.ParameterDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the API reference: one entry per plan method with its parameter table, return type
 * and HTTP endpoint.
 */
public class ApiReferenceBuilder implements SectionBuilder {

    public static final String ID = "api-reference";

    static final String NO_METHODS = "No methods documented.";

    private static final String DASH_VALUE = "-";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String build(DocumentationContext context) {
        String title = H1 + "API Reference";
        if (context.methods().isEmpty()) {
            return Markdown.sections(title, NO_METHODS);
        }

        List<String> sections = new ArrayList<>();
        sections.add(title + Markdown.SECTION_SEPARATOR + "Methods of " + Markdown.code(context.clientClassName()) + ".");
        for (MethodDescriptor method : context.methods().values()) {
            sections.add(buildMethod(method));
        }
        return String.join(Markdown.SECTION_SEPARATOR + Markdown.RULE + Markdown.SECTION_SEPARATOR, sections);
    }

    private String buildMethod(MethodDescriptor method) {
        StringBuilder sb = new StringBuilder();
        sb.append(H2).append(method.name()).append("()").append(Markdown.SECTION_SEPARATOR);
        if (method.description() != null && !method.description().isBlank()) {
            sb.append(method.description()).append(Markdown.SECTION_SEPARATOR);
        }

        if (!method.parameters().isEmpty()) {
            sb.append(H3).append("Parameters").append(Markdown.SECTION_SEPARATOR);
            Markdown.appendTableRow(sb, "Name", "Type", "Required", "Description");
            Markdown.appendTableDivider(sb, 4);
            for (ParameterDescriptor parameter : method.parameters()) {
                Markdown.appendTableRow(sb,
                    Markdown.code(parameter.name()),
                    Markdown.code(Markdown.escape(Markdown.nullSafe(parameter.type(), "any"))),
                    parameter.optional() ? "No" : "Yes",
                    Markdown.escape(Markdown.nullSafe(parameter.description(), DASH_VALUE)));
            }
            sb.append(Markdown.NEWLINE);
        }

        sb.append(H3).append("Returns").append(Markdown.SECTION_SEPARATOR);
        String returnType = Markdown.nullSafe(method.returnType(), "void");
        sb.append(Markdown.code(method.async() ? "Promise<" + returnType + ">" : returnType));

        if (method.endpoint() != null && !method.endpoint().isBlank()) {
            String verb = Markdown.nullSafe(method.httpMethod(), "GET").toUpperCase(Locale.ROOT);
            sb.append(Markdown.SECTION_SEPARATOR).append(H3).append("Endpoint").append(Markdown.SECTION_SEPARATOR);
            sb.append(Markdown.code(verb + " " + method.endpoint()));
        }
        if (method.requiresAuth()) {
            sb.append(Markdown.SECTION_SEPARATOR).append("Requires authentication.");
        }
        return sb.toString();
    }
}
