package com.sdkforge.core.docs;

import com.sdkforge.core.model.Audience;
import com.sdkforge.core.model.AuthMethod;
import com.sdkforge.core.model.DesignPlan;
import java.util.Objects;

/**
 * Settings shared by all documentation section builders.
 *
 * @param sdkName package name shown in headings and install commands
 * @param sdkVersion SDK version
 * @param description one-line SDK description
 * @param audience target reader level
 * @param targetLanguageId language of the SDK (e.g. "typescript", "python")
 * @param authRequired whether calls need credentials
 * @param authMethod credential mechanism
 * @param repositoryUrl source repository link, may be null
 * @param docsBaseUrl hosted documentation link, may be null
 */
public record DocumentationConfig(
    String sdkName,
    String sdkVersion,
    String description,
    Audience audience,
    String targetLanguageId,
    boolean authRequired,
    AuthMethod authMethod,
    String repositoryUrl,
    String docsBaseUrl
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentationConfig {
        Objects.requireNonNull(sdkName, "sdkName must not be null");
        if (sdkVersion == null || sdkVersion.isBlank()) {
            sdkVersion = "1.0.0";
        }
        if (description == null) {
            description = "";
        }
        if (audience == null) {
            audience = Audience.INTERMEDIATE;
        }
        if (targetLanguageId == null || targetLanguageId.isBlank()) {
            targetLanguageId = DesignPlan.DEFAULT_LANGUAGE;
        }
        if (authMethod == null) {
            authMethod = AuthMethod.NONE;
        }
        repositoryUrl = blankToNull(repositoryUrl);
        docsBaseUrl = blankToNull(docsBaseUrl);
    }

    /**
     * Derives a configuration from the plan, without repository or documentation links.
     *
     * @param plan design plan
     * @return documentation config
     */
    public static DocumentationConfig fromPlan(DesignPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        String name = plan.product() != null && plan.product().name() != null ? plan.product().name() : "sdk";
        return new DocumentationConfig(
            name,
            plan.product() != null ? plan.product().version() : null,
            plan.product() != null ? plan.product().description() : null,
            plan.audience(),
            plan.targetLanguageId(),
            plan.auth().required(),
            plan.auth().method(),
            null,
            null
        );
    }

    /**
     * Returns a copy with the given links.
     *
     * @param repositoryUrl source repository link, may be null
     * @param docsBaseUrl hosted documentation link, may be null
     * @return new config
     */
    public DocumentationConfig withLinks(String repositoryUrl, String docsBaseUrl) {
        return new DocumentationConfig(sdkName, sdkVersion, description, audience, targetLanguageId,
            authRequired, authMethod, repositoryUrl, docsBaseUrl);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
