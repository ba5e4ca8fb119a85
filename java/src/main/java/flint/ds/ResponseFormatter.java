/**
 * Wire shapes of query results
 */
package flint.ds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reshapes computed frames into the JSON structures of the datasource protocol.
 *
 * <pre>
 * time series : {"target": "pd", "datapoints": [[0.1, 1577836800000], ...]}
 * table       : {"type": "table", "columns": [{"text": "date", "type": "time"}, {"text": "pd"}], "rows": [[1577836800000, 0.1], ...]}
 * annotation  : {"annotation": "source:events.csv", "time": 1577836800000, "title": "release", "text": "...", "tags": "..."}
 * </pre>
 *
 * The returned maps and lists serialize directly with Gson.
 */
public final class ResponseFormatter {

    private ResponseFormatter() {
    }

    /**
     * One time series per column, datapoints sorted by key with missing and non-finite values dropped
     * @param frame computed frame
     * @return time series entries; none for an empty frame
     */
    public static List<Map<String, Object>> timeseries(final Frame frame) {
        final List<Map<String, Object>> response = new ArrayList<>();
        if (frame.isEmpty())
            return response;
        for (final Series s : frame.series()) {
            final Series sorted = s.sorted();
            final List<Object[]> datapoints = new ArrayList<>(sorted.size());
            for (int i = 0; i < sorted.size(); i++)
                datapoints.add(new Object[] { sorted.value(i), sorted.key(i) });

            final Map<String, Object> m = new LinkedHashMap<>();
            m.put("target", s.name());
            m.put("datapoints", datapoints);
            response.add(m);
        }
        return response;
    }

    /**
     * The frame as one table: the index first, then the columns; rows sorted by key,
     * null standing for missing and non-finite values
     * @param frame computed frame
     * @return a single table entry; none for an empty frame
     */
    public static List<Map<String, Object>> table(final Frame frame) {
        final List<Map<String, Object>> response = new ArrayList<>();
        if (frame.isEmpty())
            return response;

        final List<Map<String, Object>> columns = new ArrayList<>();
        final Map<String, Object> index = new LinkedHashMap<>();
        index.put("text", frame.index() != null ? frame.index() : "index");
        if (frame.isTime())
            index.put("type", "time");
        columns.add(index);
        for (final Series s : frame.series()) {
            final Map<String, Object> c = new LinkedHashMap<>();
            c.put("text", s.name());
            columns.add(c);
        }

        final Integer[] order = new Integer[frame.rows()];
        for (int i = 0; i < order.length; i++)
            order[i] = i;
        Arrays.sort(order, (a, b) -> Series.compareKeys(frame.key(a), frame.key(b)));

        final List<Object[]> rows = new ArrayList<>(order.length);
        for (final int i : order) {
            final Object[] row = new Object[frame.series().size() + 1];
            row[0] = frame.key(i);
            for (int c = 0; c < frame.series().size(); c++) {
                final Object v = frame.series(c).value(i);
                row[c + 1] = Series.isMissing(v) ? null : v;
            }
            rows.add(row);
        }

        final Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "table");
        m.put("columns", columns);
        m.put("rows", rows);
        response.add(m);
        return response;
    }

    /**
     * Shapes a frame according to a target's shape hint
     */
    public static List<Map<String, Object>> shape(final Frame frame, final QueryTarget.Shape shape) {
        return shape == QueryTarget.Shape.TABLE ? table(frame) : timeseries(frame);
    }

    /**
     * In-place report of a target that failed to compute
     * @param target requested metric name(s)
     * @param ex     the failure
     */
    public static Map<String, Object> error(final String target, final DatasourceException ex) {
        final Map<String, Object> m = new LinkedHashMap<>();
        m.put("target", target);
        m.put("error", ex.getMessage());
        m.put("code", ex.getErrorCode().getCode());
        return m;
    }

    /**
     * Annotation entries; text and tags only when present
     * @param query the annotation query as sent
     */
    public static List<Map<String, Object>> annotations(final String query, final List<Annotation> annotations) {
        final List<Map<String, Object>> response = new ArrayList<>(annotations.size());
        for (final Annotation a : annotations) {
            final Map<String, Object> m = new LinkedHashMap<>();
            m.put("annotation", query);
            m.put("time", a.time());
            m.put("title", a.title());
            if (a.text() != null)
                m.put("text", a.text());
            if (a.tags() != null)
                m.put("tags", a.tags());
            response.add(m);
        }
        return response;
    }
}
