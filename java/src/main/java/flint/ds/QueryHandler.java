/**
 * Datasource request orchestration
 */
package flint.ds;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers the requests of the dashboard: sources of a folder, metrics of a source,
 * data for a batch of targets and annotations.
 *
 * One handler serves one root directory; it is built once at startup and handed to
 * every request handler.
 */
public final class QueryHandler {
    /** Placeholder the dashboard sends before a source is chosen */
    static final String NO_SOURCE = "select source";

    private final SourceRegistry registry;
    private final MetricEngine engine;
    private final Map<String, AnnotationReader> finders = new ConcurrentHashMap<>();
    private final Logger logger;

    public QueryHandler(final SourceRegistry registry, final MetricEngine engine, final Logger logger) {
        this.registry = registry;
        this.engine = engine;
        this.logger = logger;
        register(SourceAnnotationReader.FINDER, new SourceAnnotationReader(registry));
    }

    /**
     * Handler for the root folder and file types of a configuration
     */
    public static QueryHandler create(final DatasourceConfig config, final Logger logger) {
        final SourceRegistry registry = new SourceRegistry(config.folder(), config.filetypes(), logger);
        return new QueryHandler(registry, new MetricEngine(logger), logger);
    }

    public SourceRegistry registry() {
        return registry;
    }

    /**
     * Registers an annotation finder
     * @param finder name used before ':' in annotation queries
     * @param reader the finder
     */
    public void register(final String finder, final AnnotationReader reader) {
        finders.put(finder, reader);
    }

    /**
     * @return true if the folder exists under the root
     */
    public boolean exists(final String folder) {
        return registry.exists(folder);
    }

    /**
     * Lists the sources of a folder
     * @param displayType declared display type, does not filter
     * @param folder folder name
     * @return file names
     * @throws DatasourceException if the folder does not exist
     */
    public List<String> getSources(final String displayType, final String folder) throws DatasourceException {
        return registry.list(folder, displayType);
    }

    /**
     * Lists the metrics of a source: the special catalog followed by the source's columns
     * @param displayType declared display type, does not filter
     * @param folder folder of the source
     * @param source file name
     * @param filter substring the columns must contain
     * @return namespaced special metrics and matching columns
     * @throws DatasourceException if the source is unknown or failed to open
     */
    public List<String> getMetrics(final String displayType, final String folder, final String source, final String filter)
            throws DatasourceException {
        if (NO_SOURCE.equals(source))
            return new ArrayList<>();
        final SourceReader reader = registry.resolve(folder, source);
        final List<String> metrics = engine.list();
        metrics.addAll(reader.columns(filter == null ? "" : filter));
        return metrics;
    }

    /**
     * Computes a batch of targets in order
     *
     * A target that fails to compute is reported in place and the remaining targets
     * are still answered. Unknown sources and unreadable files fail the whole batch.
     *
     * @param folder  folder of the sources
     * @param targets query targets
     * @return shaped results, one or more per answered target
     * @throws IOException if a source is unknown or cannot be loaded
     */
    public List<Map<String, Object>> getData(final String folder, final List<QueryTarget> targets) throws IOException {
        final List<Map<String, Object>> results = new ArrayList<>();
        for (final QueryTarget target : targets) {
            if (target.source().isEmpty())
                continue;
            final SourceReader reader = registry.resolve(folder, target.source());
            try {
                results.addAll(ResponseFormatter.shape(data(reader, target), target.shape()));
            } catch (DatasourceException ex) {
                if (!ex.isCategory(ErrorCode.Category.COMPUTE))
                    throw ex;
                logger.error("%s %s : %s", target.source(), target.metrics(), ex.getMessage());
                results.add(ResponseFormatter.error(String.join(",", target.metrics()), ex));
            }
        }
        return results;
    }

    /**
     * Computes one target: a special metric, or the raw column(s)
     */
    Frame data(final SourceReader reader, final QueryTarget target) throws IOException {
        final List<String> metrics = target.metrics();
        if (metrics.size() == 1) {
            final String requested = metrics.get(0);
            final boolean special = requested.startsWith(MetricEngine.PREFIX);
            final String name = special ? requested.substring(MetricEngine.PREFIX.length()) : requested;
            if (special || engine.contains(name))
                return engine.compute(name, reader, target.options());
            return reader.values(List.of(name), target.options());
        }
        return reader.values(metrics, target.options());
    }

    /**
     * Answers an annotation query {@code <finder>:<query>}
     * @param folder folder of the request
     * @param query annotation query
     * @param from range start, epoch milliseconds
     * @param to range end, epoch milliseconds
     * @return annotation entries
     * @throws IOException {@link ErrorCode#INVALID_QUERY} without ':', {@link ErrorCode#FINDER_NOT_FOUND}
     *                     for an unknown finder, or the finder's failure
     */
    public List<Map<String, Object>> getAnnotations(final String folder, final String query, final long from, final long to)
            throws IOException {
        final int i = query == null ? -1 : query.indexOf(':');
        if (i < 0)
            throw new DatasourceException(ErrorCode.INVALID_QUERY, "Target must be of type: <finder>:<metric_query>, got instead: " + query);
        final String finder = query.substring(0, i);
        final AnnotationReader reader = finders.get(finder);
        if (reader == null)
            throw new DatasourceException(ErrorCode.FINDER_NOT_FOUND, finder);
        return ResponseFormatter.annotations(query, reader.find(folder, query.substring(i + 1), from, to));
    }
}
