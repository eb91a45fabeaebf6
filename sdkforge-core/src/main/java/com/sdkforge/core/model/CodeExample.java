package com.sdkforge.core.model;

import java.util.Objects;

/**
 * A usage example rendered by the examples guide.
 *
 * @param title example title
 * @param description short description
 * @param language fence language of the code block
 * @param code example code
 * @param difficulty difficulty tier
 * @param output optional sample output
 * @param explanation optional explanation
 */
public record CodeExample(
    String title,
    String description,
    String language,
    String code,
    Difficulty difficulty,
    String output,
    String explanation
) {
    /**
     * Compact constructor with validation.
     */
    public CodeExample {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(code, "code must not be null");
        if (description == null) {
            description = "";
        }
        if (language == null) {
            language = "";
        }
        if (difficulty == null) {
            difficulty = Difficulty.BEGINNER;
        }
    }
}
