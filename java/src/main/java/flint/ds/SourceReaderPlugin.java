package flint.ds;

import java.io.File;
import java.io.IOException;

/**
 * Plugin interface for handling different source file formats.
 * Implementations are registered via ServiceLoader.
 */
public interface SourceReaderPlugin {

    /**
     * Get the priority of this plugin. Higher priority plugins are checked first.
     * @return Priority value (higher = checked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * File-type marker this plugin handles (e.g. "csv"); a file name containing the
     * marker is offered to the plugin
     * @return the marker
     */
    String marker();

    /**
     * Check if this plugin can handle the given file.
     * @param file The file to check
     * @return true if this plugin can handle the file
     */
    default boolean supports(File file) {
        return file.getName().toLowerCase(java.util.Locale.ROOT).contains(marker());
    }

    /**
     * Open a source.
     * @param file   The file to open
     * @param index  Index choice, {@link IndexChoice#AUTO} to detect
     * @param logger The logger to use
     * @return The opened reader
     * @throws IOException if opening fails
     */
    SourceReader open(File file, IndexChoice index, Logger logger) throws IOException;
}
