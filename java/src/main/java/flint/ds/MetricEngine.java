package flint.ds;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates special metrics against a source.
 */
public final class MetricEngine {
    /** Namespace of special metrics in metric listings and query targets */
    public static final String PREFIX = "special:";

    private final Logger logger;

    public MetricEngine(final Logger logger) {
        this.logger = logger;
    }

    /**
     * @return catalog names with the {@code special:} prefix
     */
    public List<String> list() {
        final List<String> a = new ArrayList<>();
        for (final SpecialMetric m : SpecialMetric.values())
            a.add(PREFIX + m.id());
        return a;
    }

    /**
     * @param name metric name without prefix
     * @return true if the name is in the catalog
     */
    public boolean contains(final String name) {
        return SpecialMetric.of(name) != null;
    }

    /**
     * Computes a special metric grouped by index key
     *
     * @param name    metric name without prefix
     * @param reader  source reader
     * @param options passed unchanged to the reader
     * @return single-series frame named after the metric, keys ascending
     * @throws IOException {@link ErrorCode#UNKNOWN_METRIC} for names outside the
     *                     catalog, other compute errors from the aggregation, or
     *                     load failures of the source
     */
    public Frame compute(final String name, final SourceReader reader, final QueryOptions options) throws IOException {
        final SpecialMetric metric = SpecialMetric.of(name);
        if (metric == null)
            throw new DatasourceException(ErrorCode.UNKNOWN_METRIC, name);

        final IO.StopWatch watch = new IO.StopWatch();
        final Frame input = reader.values(metric.inputs(), options);
        final Series s = new Aggregate(metric.id(), metric.function()).apply(input);
        logger.log("%s : %s over %d rows, %d groups, %dms", reader.name(), metric.id(), input.rows(), s.size(), watch.elapsed());
        return Frame.of(input.index(), input.isTime(), s);
    }
}
