package flint.ds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * One unit of a data request: a metric of a source, its options and the shape of
 * the response.
 */
public final class QueryTarget {
    /** Response encoding of a target */
    public enum Shape {
        TIMESERIES, TABLE
    }

    private final String source;
    private final List<String> metrics;
    private final Shape shape;
    private final QueryOptions options;

    public QueryTarget(final String source, final List<String> metrics, final Shape shape, final QueryOptions options) {
        this.source = source == null ? "" : source;
        this.metrics = Collections.unmodifiableList(new ArrayList<>(metrics));
        this.shape = shape == null ? Shape.TIMESERIES : shape;
        this.options = options == null ? QueryOptions.DEFAULT : options;
    }

    public QueryTarget(final String source, final String metric) {
        this(source, List.of(metric), Shape.TIMESERIES, QueryOptions.DEFAULT);
    }

    /**
     * Reads a target of a query request:
     * {@code {"source": ..., "target": "pd" | ["pd", "lgd"], "type": "timeseries" | "table", "data": {"index_col": ..., "log_scale": ...}}}
     *
     * @param o JSON object of one target
     * @return the target
     * @throws DatasourceException if a field has the wrong JSON type
     */
    public static QueryTarget fromJson(final JsonObject o) throws DatasourceException {
        final String source = string(o, "source");

        final List<String> metrics = new ArrayList<>();
        final JsonElement target = o.get("target");
        if (target != null && target.isJsonArray()) {
            for (final JsonElement e : target.getAsJsonArray()) {
                if (!isString(e))
                    throw new DatasourceException(ErrorCode.INVALID_REQUEST, "target entries must be strings: " + target);
                metrics.add(e.getAsString());
            }
        } else {
            metrics.add(string(o, "target"));
        }

        final Shape shape = "table".equals(string(o, "type")) ? Shape.TABLE : Shape.TIMESERIES;
        return new QueryTarget(source, metrics, shape, options(o.get("data")));
    }

    /**
     * Reads the optional {@code data} block; absent values keep the reader defaults
     */
    static QueryOptions options(final JsonElement data) throws DatasourceException {
        if (data == null || data.isJsonNull())
            return QueryOptions.DEFAULT;
        if (!data.isJsonObject())
            throw new DatasourceException(ErrorCode.INVALID_REQUEST, "data must be an object: " + data);
        final JsonObject o = data.getAsJsonObject();

        IndexChoice index = null;
        final JsonElement i = o.get("index_col");
        if (i != null && !i.isJsonNull()) {
            if (!i.isJsonPrimitive())
                throw new DatasourceException(ErrorCode.INVALID_REQUEST, "index_col must be a name or a position: " + i);
            final JsonPrimitive p = i.getAsJsonPrimitive();
            try {
                index = IndexChoice.of(p.isNumber() ? (Object) p.getAsInt() : p.getAsString());
            } catch (IllegalArgumentException ex) {
                throw new DatasourceException(ErrorCode.INVALID_REQUEST, "index_col " + i, ex);
            }
        }

        boolean logScale = false;
        final JsonElement l = o.get("log_scale");
        if (l != null && l.isJsonPrimitive()) {
            final JsonPrimitive p = l.getAsJsonPrimitive();
            logScale = p.isBoolean() ? p.getAsBoolean() : "true".equalsIgnoreCase(p.getAsString()) || "1".equals(p.getAsString());
        }
        return new QueryOptions(index, logScale);
    }

    private static boolean isString(final JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
    }

    private static String string(final JsonObject o, final String name) throws DatasourceException {
        final JsonElement e = o.get(name);
        if (e == null || e.isJsonNull())
            return "";
        if (!e.isJsonPrimitive())
            throw new DatasourceException(ErrorCode.INVALID_REQUEST, name + " must be a string: " + e);
        return e.getAsString();
    }

    /**
     * Reads the {@code targets} array of a query request
     */
    public static List<QueryTarget> targets(final JsonObject request) throws DatasourceException {
        final JsonElement e = request.get("targets");
        if (e == null || !e.isJsonArray())
            throw new DatasourceException(ErrorCode.INVALID_REQUEST, "targets must be an array");
        final JsonArray a = e.getAsJsonArray();
        final List<QueryTarget> targets = new ArrayList<>(a.size());
        for (final JsonElement t : a) {
            if (!t.isJsonObject())
                throw new DatasourceException(ErrorCode.INVALID_REQUEST, "target must be an object: " + t);
            targets.add(fromJson(t.getAsJsonObject()));
        }
        return targets;
    }

    public String source() {
        return source;
    }

    /**
     * @return requested metric names as sent, one or more
     */
    public List<String> metrics() {
        return metrics;
    }

    public Shape shape() {
        return shape;
    }

    public QueryOptions options() {
        return options;
    }

    @Override
    public String toString() {
        return "QueryTarget[" + source + ", " + metrics + ", " + shape + ", " + options + "]";
    }
}
