/**
 *
 */
package flint.ds;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * A queryable source: column discovery and column value extraction.
 */
public interface SourceReader {

    /**
     * Plugin registry for source format handlers.
     * Plugins are loaded dynamically via ServiceLoader, the CSV plugin is always present.
     */
    class PluginRegistry {
        private static final List<SourceReaderPlugin> plugins = new ArrayList<>();
        private static volatile boolean initialized = false;

        static {
            loadPlugins();
        }

        private static synchronized void loadPlugins() {
            if (initialized) return;

            final ServiceLoader<SourceReaderPlugin> loader = ServiceLoader.load(SourceReaderPlugin.class);
            for (SourceReaderPlugin plugin : loader) {
                plugins.add(plugin);
            }

            // Ensure the built-in CSV plugin is available even without ServiceLoader config
            if (plugins.stream().noneMatch(p -> p instanceof CSVSourceReaderPlugin))
                plugins.add(new CSVSourceReaderPlugin());

            // Sort by priority (descending)
            plugins.sort(Comparator.comparingInt(SourceReaderPlugin::priority).reversed());

            initialized = true;
        }

        /**
         * Plugins whose marker is among the enabled file types, by marker
         * @param filetypes enabled markers, e.g. ["csv"]
         * @return marker to plugin, in the order of {@code filetypes}
         */
        static Map<String, SourceReaderPlugin> catalog(final Collection<String> filetypes) {
            final Map<String, SourceReaderPlugin> m = new LinkedHashMap<>();
            for (final String type : filetypes) {
                for (final SourceReaderPlugin plugin : plugins) {
                    if (plugin.marker().equalsIgnoreCase(type)) {
                        m.putIfAbsent(plugin.marker(), plugin);
                        break;
                    }
                }
            }
            return m;
        }
    }

    /**
     * @return file name of the source
     */
    String name();

    /**
     * @return the index column the reader uses by default, or null for none
     */
    String indexColumn();

    /**
     * Header names, excluding the index column, containing {@code filter}
     * @param filter substring to match; empty matches all
     * @return matching column names in header order
     */
    List<String> columns(String filter);

    /**
     * Values of one column keyed by the index column
     * @param column requested column; resolved exactly first, then by substring
     * @param options index override; log scale is ignored
     * @return the column as a series named after the resolved column
     * @throws IOException if the file cannot be loaded or the column does not exist
     */
    Series values(String column, QueryOptions options) throws IOException;

    /**
     * Values of several columns read from one consistent table
     * @param columns requested columns
     * @param options index override; log scale is ignored
     * @return the columns in request order
     * @throws IOException if the file cannot be loaded or a column does not exist
     */
    Frame values(List<String> columns, QueryOptions options) throws IOException;
}
