package com.sdkforge.core.docs;

import com.sdkforge.core.docs.impl.ApiReferenceBuilder;
import com.sdkforge.core.docs.impl.AuthenticationBuilder;
import com.sdkforge.core.docs.impl.ErrorHandlingBuilder;
import com.sdkforge.core.docs.impl.ExamplesBuilder;
import com.sdkforge.core.docs.impl.QuickstartBuilder;
import com.sdkforge.core.docs.impl.ReadmeBuilder;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the full documentation set for a {@link DocumentationContext}.
 *
 * <p>Each document comes from its own {@link SectionBuilder}; the builders read the same
 * context, so every method and parameter name they show comes from the plan.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * DocumentationContext context = DocumentationContext.from(
 *     DocumentationConfig.fromPlan(plan), plan, examples);
 * GeneratedOutput docs = new DocumentationGenerator().generateAll(context).toOutput();
 * }</pre>
 */
public class DocumentationGenerator {

    private static final Logger log = LoggerFactory.getLogger(DocumentationGenerator.class);

    private final SectionBuilder readme;
    private final SectionBuilder quickstart;
    private final SectionBuilder authentication;
    private final SectionBuilder examples;
    private final SectionBuilder errorHandling;
    private final SectionBuilder apiReference;

    public DocumentationGenerator() {
        this(new ReadmeBuilder(), new QuickstartBuilder(), new AuthenticationBuilder(),
            new ExamplesBuilder(), new ErrorHandlingBuilder(), new ApiReferenceBuilder());
    }

    public DocumentationGenerator(SectionBuilder readme, SectionBuilder quickstart, SectionBuilder authentication,
                                  SectionBuilder examples, SectionBuilder errorHandling,
                                  SectionBuilder apiReference) {
        this.readme = Objects.requireNonNull(readme, "readme must not be null");
        this.quickstart = Objects.requireNonNull(quickstart, "quickstart must not be null");
        this.authentication = Objects.requireNonNull(authentication, "authentication must not be null");
        this.examples = Objects.requireNonNull(examples, "examples must not be null");
        this.errorHandling = Objects.requireNonNull(errorHandling, "errorHandling must not be null");
        this.apiReference = Objects.requireNonNull(apiReference, "apiReference must not be null");
    }

    /**
     * Renders all six documents.
     *
     * @param context documentation context
     * @return generated documentation
     */
    public GeneratedDocumentation generateAll(DocumentationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        log.info("Generating documentation for {} ({} methods, {} errors, {} examples)",
            context.config().sdkName(), context.methods().size(), context.errors().size(),
            context.examples().size());

        return new GeneratedDocumentation(
            build(readme, context),
            build(quickstart, context),
            build(authentication, context),
            build(examples, context),
            build(errorHandling, context),
            build(apiReference, context)
        );
    }

    private static String build(SectionBuilder builder, DocumentationContext context) {
        String content = builder.build(context);
        log.debug("Section '{}' rendered ({} chars)", builder.id(), content.length());
        return content;
    }
}
