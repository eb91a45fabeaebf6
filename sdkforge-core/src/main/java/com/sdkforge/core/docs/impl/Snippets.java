package com.sdkforge.core.docs.impl;

import com.sdkforge.core.docs.DocumentationConfig;
import com.sdkforge.core.docs.DocumentationContext;
import com.sdkforge.core.model.ErrorDescriptor;
import com.sdkforge.core.model.MethodDescriptor;
import com.sdkforge.core.model.ParameterDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Language-specific code snippets for install commands, client construction and method
 * calls. Method and parameter names are always taken verbatim from the plan.
 */
final class Snippets {

    static final String API_KEY_ENV = "API_KEY";
    static final String BASE_ERROR = "SDKError";

    private Snippets() {
        // Utility class
    }

    /**
     * Target languages with snippet support.
     */
    enum Language {
        TYPESCRIPT("typescript"),
        JAVASCRIPT("javascript"),
        PYTHON("python"),
        GO("go"),
        RUST("rust"),
        JAVA("java"),
        UNKNOWN("");

        private final String fence;

        Language(String fence) {
            this.fence = fence;
        }

        String fence() {
            return fence;
        }

        boolean isScript() {
            return this == TYPESCRIPT || this == JAVASCRIPT;
        }

        static Language of(DocumentationConfig config) {
            String id = config.targetLanguageId().trim().toLowerCase(Locale.ROOT);
            return switch (id) {
                case "typescript", "ts" -> TYPESCRIPT;
                case "javascript", "js" -> JAVASCRIPT;
                case "python", "py" -> PYTHON;
                case "go", "golang" -> GO;
                case "rust" -> RUST;
                case "java" -> JAVA;
                default -> UNKNOWN;
            };
        }
    }

    /**
     * Returns the package-manager invocation, or an empty string when the language has none.
     */
    static String installCommand(DocumentationConfig config) {
        String name = config.sdkName();
        return switch (Language.of(config)) {
            case TYPESCRIPT, JAVASCRIPT -> "npm install " + name;
            case PYTHON -> "pip install " + name;
            case GO -> "go get " + goModule(config);
            case RUST -> "cargo add " + name;
            case JAVA, UNKNOWN -> "";
        };
    }

    /**
     * Returns a fenced install block, or an empty string for unknown languages.
     */
    static String installBlock(DocumentationConfig config) {
        Language language = Language.of(config);
        if (language == Language.JAVA) {
            return Markdown.codeBlock("xml", List.of(
                "<dependency>",
                "  <groupId>" + javaGroupId(config) + "</groupId>",
                "  <artifactId>" + config.sdkName() + "</artifactId>",
                "  <version>" + config.sdkVersion() + "</version>",
                "</dependency>"
            ));
        }
        String command = installCommand(config);
        return command.isEmpty() ? "" : Markdown.codeBlock("bash", command);
    }

    static String importLine(DocumentationContext context) {
        String client = context.clientClassName();
        DocumentationConfig config = context.config();
        return switch (Language.of(config)) {
            case TYPESCRIPT, JAVASCRIPT -> "import { " + client + ", createDefaultConfig } from \""
                + config.sdkName() + "\";";
            case PYTHON -> "from " + pythonModule(config) + " import " + client;
            case GO -> "import \"" + goModule(config) + "\"";
            case RUST -> "use " + pythonModule(config) + "::" + client + ";";
            case JAVA -> "import " + javaGroupId(config) + "." + client + ";";
            case UNKNOWN -> "// import " + client + " from " + config.sdkName();
        };
    }

    static String clientLine(DocumentationContext context) {
        String client = context.clientClassName();
        boolean auth = context.config().authRequired();
        return switch (Language.of(context.config())) {
            case TYPESCRIPT, JAVASCRIPT -> auth
                ? "const client = new " + client + "(createDefaultConfig(process.env." + API_KEY_ENV + " ?? \"\"));"
                : "const client = new " + client + "(createDefaultConfig());";
            case PYTHON -> auth
                ? "client = " + client + "(api_key=os.environ[\"" + API_KEY_ENV + "\"])"
                : "client = " + client + "()";
            default -> "// create a " + client + (auth ? " with your " + API_KEY_ENV : "");
        };
    }

    /**
     * Returns the statements calling the given method: one declaration per parameter, the
     * call itself and a print of the result.
     */
    static List<String> callLines(DocumentationContext context, MethodDescriptor method) {
        Language language = Language.of(context.config());
        List<String> lines = new ArrayList<>();
        String arguments = method.parameters().stream()
            .map(ParameterDescriptor::name)
            .collect(Collectors.joining(", "));

        if (language.isScript()) {
            for (ParameterDescriptor parameter : method.parameters()) {
                lines.add("const " + parameter.name() + " = " + parameter.exampleValue() + ";");
            }
            lines.add("const result = " + (method.async() ? "await " : "") + "client." + method.name()
                + "(" + arguments + ");");
            lines.add("console.log(result);");
        } else if (language == Language.PYTHON) {
            for (ParameterDescriptor parameter : method.parameters()) {
                lines.add(parameter.name() + " = " + pythonValue(parameter.exampleValue()));
            }
            lines.add("result = client." + method.name() + "(" + arguments + ")");
            lines.add("print(result)");
        } else {
            lines.add("// result = client." + method.name() + "(" + arguments + ")");
        }
        return lines;
    }

    /**
     * Returns a complete program: import, client construction and the given calls.
     */
    static String program(DocumentationContext context, List<MethodDescriptor> methods) {
        Language language = Language.of(context.config());
        List<String> lines = new ArrayList<>();
        if (language == Language.PYTHON && context.config().authRequired()) {
            lines.add("import os");
        }
        lines.add(importLine(context));
        lines.add("");
        lines.add(clientLine(context));
        for (MethodDescriptor method : methods) {
            lines.add("");
            lines.addAll(callLines(context, method));
        }
        return Markdown.codeBlock(language.fence(), lines);
    }

    /**
     * Returns the error class to show for a descriptor, the base class when the code yields
     * no identifier.
     */
    static String errorClass(ErrorDescriptor error) {
        String name = error.className();
        return name.isEmpty() ? BASE_ERROR : name;
    }

    static String fence(DocumentationConfig config) {
        return Language.of(config).fence();
    }

    private static String pythonValue(String value) {
        return "true".equals(value) ? "True" : value;
    }

    private static String pythonModule(DocumentationConfig config) {
        return config.sdkName().replaceAll("[^A-Za-z0-9]+", "_").toLowerCase(Locale.ROOT);
    }

    private static String goModule(DocumentationConfig config) {
        String repository = config.repositoryUrl();
        if (repository != null) {
            return repository.replaceFirst("^https?://", "");
        }
        return "github.com/" + config.sdkName();
    }

    private static String javaGroupId(DocumentationConfig config) {
        return "com." + pythonModule(config).replace("_", "");
    }
}
