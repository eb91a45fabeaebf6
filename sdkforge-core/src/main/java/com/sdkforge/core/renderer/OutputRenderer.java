package com.sdkforge.core.renderer;

/**
 * Writes generated SDK files to a destination.
 *
 * <p>Implementations report IO failures as {@link IllegalStateException} naming the path
 * that could not be written.
 *
 * @see com.sdkforge.core.renderer.impl.FileSystemRenderer
 * @see com.sdkforge.core.renderer.impl.ConsoleRenderer
 */
public interface OutputRenderer {

    /**
     * Returns the renderer identifier used on the command line (e.g. "filesystem").
     *
     * @return renderer id
     */
    String getId();

    /**
     * Renders every file of {@code output}.
     *
     * @param output files to render
     * @param context output directory and renderer settings
     * @throws IllegalStateException if a file cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
