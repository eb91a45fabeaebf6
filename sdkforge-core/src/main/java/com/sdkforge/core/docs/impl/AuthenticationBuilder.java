package com.sdkforge.core.docs.impl;

import static com.sdkforge.core.docs.impl.Markdown.H1;
import static com.sdkforge.core.docs.impl.Markdown.H2;
import static com.sdkforge.core.docs.impl.Markdown.H3;

import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.docs.SectionBuilder;
import com.sdkforge.core.model.AuthMethod;
import java.util.List;

/**
 * Builds the authentication guide. SDKs without required authentication get a short
 * "no authentication" page instead.
 */
public class AuthenticationBuilder implements SectionBuilder {

    public static final String ID = "authentication";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String build(DocumentationContext context) {
        if (!context.config().authRequired()) {
            return buildNoAuthRequired(context);
        }
        return Markdown.sections(
            H1 + "Authentication" + Markdown.SECTION_SEPARATOR
                + context.config().sdkName() + " requires credentials for every authenticated call.",
            buildMechanism(context),
            buildSetupGuide(),
            buildBestPractices(),
            buildTroubleshooting()
        );
    }

    private String buildMechanism(DocumentationContext context) {
        AuthMethod method = context.config().authMethod();
        return switch (method) {
            case API_KEY -> buildApiKey(context);
            case OAUTH -> buildOAuth(context);
            case WALLET -> buildWallet(context);
            case NONE -> "";
        };
    }

    private String buildApiKey(DocumentationContext context) {
        return Markdown.lines(
            H2 + "API Key Authentication",
            "",
            H3 + "Get Your API Key",
            "",
            "1. Sign in to your provider dashboard",
            "2. Open the API keys page",
            "3. Generate a new key and store it securely",
            "",
            H3 + "Using Your API Key",
            "",
            "The client sends the key as a bearer token on every request.",
            "",
            Snippets.program(context, List.of()),
            "",
            H3 + "Environment Variables",
            "",
            Markdown.codeBlock("bash", "echo \"" + Snippets.API_KEY_ENV + "=your-api-key-here\" >> .env")
        );
    }

    private String buildOAuth(DocumentationContext context) {
        return Markdown.lines(
            H2 + "OAuth 2.0 Authentication",
            "",
            H3 + "Authorization Flow",
            "",
            "1. Redirect the user to the authorization endpoint",
            "2. The user grants permission",
            "3. Receive the authorization code",
            "4. Exchange the code for an access token",
            "",
            H3 + "Implementation",
            "",
            "Pass the access token to the client in place of an API key:",
            "",
            Snippets.program(context, List.of())
        );
    }

    private String buildWallet(DocumentationContext context) {
        return Markdown.lines(
            H2 + "Wallet Authentication",
            "",
            H3 + "Supported Wallets",
            "",
            Markdown.bullets(List.of("MetaMask", "WalletConnect", "Coinbase Wallet")),
            "",
            H3 + "Connect Wallet",
            "",
            "Sign requests with the connected wallet's credentials:",
            "",
            Snippets.program(context, List.of())
        );
    }

    private String buildSetupGuide() {
        return Markdown.lines(
            H2 + "Setup Guide",
            "",
            H3 + "Development Environment",
            "",
            "1. Create a `.env.local` file",
            "2. Add your credentials",
            "3. Load it in your application",
            "",
            H3 + "Production Environment",
            "",
            Markdown.bullets(List.of(
                "Store secrets in environment variables",
                "Use a secrets manager",
                "Never commit credentials to version control"
            ))
        );
    }

    private String buildBestPractices() {
        return H2 + "Security Best Practices" + Markdown.SECTION_SEPARATOR + Markdown.bullets(List.of(
            "Never hardcode credentials",
            "Rotate keys regularly",
            "Restrict key permissions to what the application needs",
            "Revoke compromised keys immediately"
        ));
    }

    private String buildTroubleshooting() {
        return Markdown.lines(
            H2 + "Troubleshooting",
            "",
            H3 + "Invalid Credentials",
            "",
            Markdown.bullets(List.of(
                "Check that the key was copied completely",
                "Check the environment variable name (" + Markdown.code(Snippets.API_KEY_ENV) + ")"
            )),
            "",
            H3 + "Authentication Is Required But Not Configured",
            "",
            "The client raises `ConfigError` when a method needs credentials and none were supplied."
        );
    }

    private String buildNoAuthRequired(DocumentationContext context) {
        return Markdown.lines(
            H1 + "Authentication",
            "",
            context.config().sdkName() + " requires no authentication.",
            "",
            "Import the SDK and create a client:",
            "",
            Snippets.program(context, List.of())
        );
    }
}
