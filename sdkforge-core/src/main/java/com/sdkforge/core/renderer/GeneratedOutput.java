package com.sdkforge.core.renderer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered collection of generated files.
 *
 * @param files generated files, in emission order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput empty() {
        return new GeneratedOutput(List.of());
    }

    /**
     * Combines this output with {@code other}. A file of {@code other} replaces a file of
     * this output with the same path, keeping its original position.
     *
     * @param other output to add
     * @return merged output
     */
    public GeneratedOutput merge(GeneratedOutput other) {
        Objects.requireNonNull(other, "other must not be null");
        Map<String, GeneratedFile> byPath = new LinkedHashMap<>();
        files.forEach(file -> byPath.put(file.relativePath(), file));
        other.files().forEach(file -> byPath.put(file.relativePath(), file));
        return new GeneratedOutput(new ArrayList<>(byPath.values()));
    }

    /**
     * Finds a file by its relative path.
     *
     * @param relativePath path to look up
     * @return matching file, if any
     */
    public Optional<GeneratedFile> find(String relativePath) {
        return files.stream()
            .filter(file -> file.relativePath().equals(relativePath))
            .findFirst();
    }

    public List<String> paths() {
        return files.stream().map(GeneratedFile::relativePath).toList();
    }
}
