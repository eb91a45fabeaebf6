package com.sdkforge.core.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.sdkforge.core.model.CodeExample;
import com.sdkforge.core.model.DesignPlan;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads design plans and code examples from JSON files.
 *
 * <p>Unlike {@link ConfigLoader} there are no defaults: a missing or unparsable plan is an
 * error. Unknown properties are ignored and enum values match case-insensitively.
 */
public final class DesignPlanLoader {

    private static final Logger log = LoggerFactory.getLogger(DesignPlanLoader.class);
    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private DesignPlanLoader() {
        // Utility class
    }

    /**
     * Loads a design plan.
     *
     * @param planPath path to the plan JSON
     * @return design plan
     * @throws IllegalStateException if the file is missing or not a valid plan
     */
    public static DesignPlan load(Path planPath) {
        DesignPlan plan = read(planPath, new TypeReference<DesignPlan>() { }, "design plan");
        log.info("Loaded design plan '{}' with {} method(s), {} type(s), {} error(s)",
            plan.product() != null ? plan.product().name() : null,
            plan.methods().size(), plan.types().size(), plan.errors().size());
        return plan;
    }

    /**
     * Loads a JSON array of code examples.
     *
     * @param examplesPath path to the examples JSON, may be null
     * @return examples, empty when no path is given
     * @throws IllegalStateException if the file is missing or invalid
     */
    public static List<CodeExample> loadExamples(Path examplesPath) {
        if (examplesPath == null) {
            return List.of();
        }
        List<CodeExample> examples = read(examplesPath, new TypeReference<List<CodeExample>>() { }, "examples");
        log.info("Loaded {} code example(s) from {}", examples.size(), examplesPath);
        return List.copyOf(examples);
    }

    private static <T> T read(Path path, TypeReference<T> type, String what) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Cannot read " + what + ": file not found: " + path);
        }
        try {
            T value = JSON_MAPPER.readValue(path.toFile(), type);
            if (value == null) {
                throw new IllegalStateException("Cannot read " + what + ": file is empty: " + path);
            }
            return value;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + what + " from " + path + ": " + e.getMessage(), e);
        }
    }
}
