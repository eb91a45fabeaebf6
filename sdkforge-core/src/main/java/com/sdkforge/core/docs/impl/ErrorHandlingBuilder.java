package com.sdkforge.core.docs.impl;

import static com.sdkforge.core.docs.impl.Markdown.H1;
import static com.sdkforge.core.docs.impl.Markdown.H2;
import static com.sdkforge.core.docs.impl.Markdown.H3;
import static com.sdkforge.core.docs.impl.Markdown.H4;

import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.docs.SectionBuilder;
import com.sdkforge.core.model.ErrorDescriptor;
import com.sdkforge.core.model.MethodDescriptor;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the error handling guide.
 *
 * <p>Plan errors are grouped by {@link ErrorCategory}. Without plan errors a generic
 * taxonomy is rendered instead. Recovery strategies and best practices are always present.
 */
public class ErrorHandlingBuilder implements SectionBuilder {

    public static final String ID = "error-handling";

    private static final String DASH_VALUE = "-";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String build(DocumentationContext context) {
        return Markdown.sections(
            H1 + "Error Handling" + Markdown.SECTION_SEPARATOR + "Understanding and handling errors from the SDK.",
            context.errors().isEmpty() ? buildGenericErrors() : buildErrorTypes(context),
            buildRecoveryStrategies(context),
            buildBestPractices()
        );
    }

    private String buildErrorTypes(DocumentationContext context) {
        Map<ErrorCategory, List<ErrorDescriptor>> byCategory = new EnumMap<>(ErrorCategory.class);
        for (ErrorDescriptor error : context.errors().values()) {
            byCategory.computeIfAbsent(ErrorCategory.classify(error), key -> new ArrayList<>()).add(error);
        }

        List<String> lines = new ArrayList<>();
        lines.add(H2 + "Error Types");
        byCategory.forEach((category, errors) -> {
            lines.add("");
            lines.add(H3 + category.title());
            errors.forEach(error -> appendError(lines, error));
        });
        return Markdown.lines(lines);
    }

    private void appendError(List<String> lines, ErrorDescriptor error) {
        lines.add("");
        lines.add(H4 + error.code());
        lines.add("");
        lines.add(Markdown.bold("Error class:") + " " + Markdown.code(Snippets.errorClass(error)));
        if (error.statusCode() > 0) {
            lines.add("");
            lines.add(Markdown.bold("HTTP status:") + " " + error.statusCode());
        }
        lines.add("");
        lines.add(Markdown.bold("Description:") + " " + Markdown.nullSafe(error.description(), DASH_VALUE));
        lines.add("");
        lines.add(Markdown.bold("Cause:") + " " + Markdown.nullSafe(error.cause(), DASH_VALUE));
        lines.add("");
        lines.add(Markdown.bold("Solution:") + " " + Markdown.nullSafe(error.remedy(), DASH_VALUE));
        if (error.example() != null && !error.example().isBlank()) {
            lines.add("");
            lines.add(Markdown.bold("Example:"));
            lines.add("");
            lines.add(Markdown.codeBlock("typescript", error.example()));
        }
    }

    private String buildGenericErrors() {
        return Markdown.lines(
            H2 + "Common Error Types",
            "",
            H3 + ErrorCategory.NETWORK.title(),
            "",
            Markdown.bullets(List.of("Connection timeouts", "DNS resolution failures")),
            "",
            H3 + ErrorCategory.AUTHENTICATION.title(),
            "",
            Markdown.bullets(List.of("Invalid credentials", "Expired tokens", "Insufficient permissions")),
            "",
            H3 + ErrorCategory.VALIDATION.title(),
            "",
            Markdown.bullets(List.of("Invalid parameters", "Missing required fields", "Type mismatches")),
            "",
            H3 + ErrorCategory.RATE_LIMIT.title(),
            "",
            Markdown.bullets(List.of("Too many requests in a short period")),
            "",
            H3 + ErrorCategory.SERVER.title(),
            "",
            Markdown.bullets(List.of("5xx responses", "Service unavailable"))
        );
    }

    private String buildRecoveryStrategies(DocumentationContext context) {
        String call = context.firstMethod()
            .map(MethodDescriptor::name)
            .map(name -> "client." + name)
            .orElse("request");
        List<String> detection = new ArrayList<>();
        detection.add("try {");
        detection.add("  const result = await withRetry(() => " + call + "());");
        detection.add("} catch (error) {");
        String keyword = "if";
        for (ErrorDescriptor error : context.errors().values()) {
            detection.add("  " + keyword + " (error instanceof " + Snippets.errorClass(error) + ") {");
            detection.add("    // " + Markdown.nullSafe(error.remedy(), "handle " + error.code()));
            keyword = "} else if";
        }
        if (context.errors().isEmpty()) {
            detection.add("  if (error instanceof SDKError) {");
            detection.add("    console.error(error.code, error.statusCode);");
        }
        detection.add("  } else {");
        detection.add("    throw error;");
        detection.add("  }");
        detection.add("}");

        return Markdown.lines(
            H2 + "Recovery Strategies",
            "",
            H3 + "Retry Logic",
            "",
            "Retry transient failures with exponential backoff:",
            "",
            Markdown.codeBlock("typescript", List.of(
                "async function withRetry<T>(fn: () => Promise<T>, maxRetries = 3): Promise<T> {",
                "  for (let attempt = 0; ; attempt++) {",
                "    try {",
                "      return await fn();",
                "    } catch (error) {",
                "      if (attempt >= maxRetries - 1) throw error;",
                "      await new Promise((resolve) => setTimeout(resolve, 100 * 2 ** attempt));",
                "    }",
                "  }",
                "}"
            )),
            "",
            H3 + "Error Detection",
            "",
            Markdown.codeBlock("typescript", detection)
        );
    }

    private String buildBestPractices() {
        return H2 + "Best Practices" + Markdown.SECTION_SEPARATOR + Markdown.bullets(List.of(
            "Always wrap API calls in try/catch",
            "Branch on the error class to pick a recovery strategy",
            "Use exponential backoff for retries",
            "Log errors with their code and context",
            "Never expose internal error details to end users"
        ));
    }
}
