package com.sdkforge.core.docs;

/**
 * Renders one documentation document from a {@link DocumentationContext}.
 *
 * <p>Builders are stateless and never fail on missing data: absent methods, errors or
 * examples lead to fallback text or to omitted sub-sections.
 */
public interface SectionBuilder {

    /**
     * Returns the section identifier (e.g. "readme", "error-handling").
     *
     * @return section id
     */
    String id();

    /**
     * Renders the section as Markdown.
     *
     * @param context documentation context
     * @return Markdown text, empty when the section has nothing to say
     */
    String build(DocumentationContext context);
}
