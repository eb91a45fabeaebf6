package com.sdkforge.core.docs;

import com.sdkforge.core.renderer.GeneratedFile;
import com.sdkforge.core.renderer.GeneratedOutput;
import java.util.ArrayList;
import java.util.List;

/**
 * The six documentation documents of one generation run. Empty strings stand for documents
 * that were not produced.
 *
 * @param readme README
 * @param quickstart quickstart guide
 * @param authentication authentication guide
 * @param examples usage examples
 * @param errorHandling error handling guide
 * @param apiReference API reference
 */
public record GeneratedDocumentation(
    String readme,
    String quickstart,
    String authentication,
    String examples,
    String errorHandling,
    String apiReference
) {
    public static final String README_PATH = "README.md";
    public static final String QUICKSTART_PATH = "docs/QUICKSTART.md";
    public static final String AUTHENTICATION_PATH = "docs/AUTHENTICATION.md";
    public static final String EXAMPLES_PATH = "docs/EXAMPLES.md";
    public static final String ERROR_HANDLING_PATH = "docs/ERROR_HANDLING.md";
    public static final String API_REFERENCE_PATH = "docs/API_REFERENCE.md";

    /**
     * Compact constructor mapping null documents to empty ones.
     */
    public GeneratedDocumentation {
        readme = readme != null ? readme : "";
        quickstart = quickstart != null ? quickstart : "";
        authentication = authentication != null ? authentication : "";
        examples = examples != null ? examples : "";
        errorHandling = errorHandling != null ? errorHandling : "";
        apiReference = apiReference != null ? apiReference : "";
    }

    /**
     * Maps the documents to files, skipping empty ones.
     *
     * @return documentation files
     */
    public GeneratedOutput toOutput() {
        List<GeneratedFile> files = new ArrayList<>();
        addIfPresent(files, README_PATH, readme);
        addIfPresent(files, QUICKSTART_PATH, quickstart);
        addIfPresent(files, AUTHENTICATION_PATH, authentication);
        addIfPresent(files, EXAMPLES_PATH, examples);
        addIfPresent(files, ERROR_HANDLING_PATH, errorHandling);
        addIfPresent(files, API_REFERENCE_PATH, apiReference);
        return new GeneratedOutput(files);
    }

    private static void addIfPresent(List<GeneratedFile> files, String path, String content) {
        if (!content.isBlank()) {
            files.add(GeneratedFile.markdown(path, content.endsWith("\n") ? content : content + "\n"));
        }
    }
}
