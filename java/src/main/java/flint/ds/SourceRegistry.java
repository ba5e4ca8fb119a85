package flint.ds;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Source lookup table for one root directory.
 *
 * Enumerating a folder creates a reader for every supported file not seen before,
 * keyed by folder and file name; readers are kept for the life of the registry. A file that fails to open stays
 * listed, its failure is reported when the source is resolved, and the next
 * enumeration tries to open it again.
 */
public final class SourceRegistry {
    private final File root;
    private final Map<String, SourceReaderPlugin> catalog;
    private final Map<String, SourceReader> readers = new ConcurrentHashMap<>();
    private final Map<String, DatasourceException> failures = new ConcurrentHashMap<>();
    private final Logger logger;

    /**
     * @param root      directory containing the source folders
     * @param filetypes enabled file-type markers, e.g. ["csv"]
     * @param logger    logger
     */
    public SourceRegistry(final File root, final Collection<String> filetypes, final Logger logger) {
        this.root = root;
        this.catalog = SourceReader.PluginRegistry.catalog(filetypes);
        this.logger = logger;
        if (catalog.isEmpty())
            logger.error("no reader plugin for file types %s", filetypes);
    }

    public File root() {
        return root;
    }

    /**
     * @return true if {@code folder} is a directory under the root
     */
    public boolean exists(final String folder) {
        final File dir = folder(folder);
        return dir != null && dir.isDirectory();
    }

    /**
     * @return the folder directory, or null for names escaping the root
     */
    private File folder(final String folder) {
        if (folder == null || folder.isEmpty())
            return root;
        if (folder.contains("..") || folder.contains("/") || folder.contains("\\"))
            return null;
        return new File(root, folder);
    }

    /**
     * Lists the supported files of a folder, opening readers for new ones
     *
     * @param folder       folder name under the root
     * @param declaredType metric display type; accepted, does not filter
     * @return file names, sorted
     * @throws DatasourceException if the folder does not exist
     */
    public List<String> list(final String folder, final String declaredType) throws DatasourceException {
        final File dir = folder(folder);
        final String[] names = dir == null ? null : dir.list();
        if (names == null)
            throw new DatasourceException(ErrorCode.FOLDER_NOT_FOUND, folder);
        Arrays.sort(names);

        final List<String> results = new ArrayList<>();
        for (final String name : names) {
            final File file = new File(dir, name);
            if (!file.isFile())
                continue;
            final SourceReaderPlugin plugin = plugin(file);
            if (plugin == null)
                continue;
            results.add(name);
            final String key = key(folder, name);
            if (readers.containsKey(key))
                continue;
            try {
                readers.computeIfAbsent(key, k -> {
                    try {
                        return plugin.open(file, IndexChoice.AUTO, logger);
                    } catch (IOException ex) {
                        throw new java.io.UncheckedIOException(ex);
                    }
                });
                failures.remove(key);
            } catch (java.io.UncheckedIOException ex) {
                final DatasourceException failure = ex.getCause() instanceof DatasourceException
                        ? (DatasourceException) ex.getCause()
                        : new DatasourceException(ErrorCode.FILE_NOT_READABLE, name, ex.getCause());
                failures.put(key, failure);
                logger.error("%s : %s", name, failure.getMessage());
            }
        }
        logger.log("%s : %d sources", dir, results.size());
        return results;
    }

    private static String key(final String folder, final String name) {
        return (folder == null ? "" : folder) + "/" + name;
    }

    private SourceReaderPlugin plugin(final File file) {
        for (final SourceReaderPlugin plugin : catalog.values()) {
            if (plugin.supports(file))
                return plugin;
        }
        return null;
    }

    /**
     * Looks up the reader of a listed source
     *
     * @param folder folder the source was listed in
     * @param source file name
     * @return the cached reader
     * @throws DatasourceException the open failure of the source, or
     *                             {@link ErrorCode#SOURCE_NOT_FOUND} if it was never listed
     */
    public SourceReader resolve(final String folder, final String source) throws DatasourceException {
        final String key = key(folder, source);
        final SourceReader reader = readers.get(key);
        if (reader != null)
            return reader;
        final DatasourceException failure = failures.get(key);
        if (failure != null)
            throw failure;
        throw new DatasourceException(ErrorCode.SOURCE_NOT_FOUND, source);
    }
}
