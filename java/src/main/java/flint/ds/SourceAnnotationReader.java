package flint.ds;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Annotations read from a date-indexed source of the same folder.
 *
 * The query is a source name. Each row becomes one annotation: the index value is
 * the time, the {@code title} column (or the first column) the title, and the
 * {@code text} and {@code tags} columns, when present, the text and tags.
 */
public final class SourceAnnotationReader implements AnnotationReader {
    public static final String FINDER = "source";

    private final SourceRegistry registry;

    public SourceAnnotationReader(final SourceRegistry registry) {
        this.registry = registry;
    }

    @Override
    public List<Annotation> find(final String folder, final String query, final long from, final long to) throws IOException {
        final String source = query.trim();
        registry.list(folder, null);
        final SourceReader reader = registry.resolve(folder, source);

        final List<String> available = reader.columns("");
        if (available.isEmpty())
            throw new DatasourceException(ErrorCode.INVALID_QUERY, source + " has no columns");
        final List<String> columns = new ArrayList<>();
        columns.add(available.contains("title") ? "title" : available.get(0));
        final boolean text = available.contains("text");
        final boolean tags = available.contains("tags");
        if (text)
            columns.add("text");
        if (tags)
            columns.add("tags");

        final Frame frame = reader.values(columns, QueryOptions.DEFAULT);
        if (!frame.isTime())
            throw new DatasourceException(ErrorCode.INVALID_QUERY, source + " has no date index");

        final List<Annotation> a = new ArrayList<>();
        for (int i = 0; i < frame.rows(); i++) {
            final long time = (Long) frame.key(i);
            if (time < from || time > to)
                continue;
            a.add(new Annotation(time,
                    title(frame.series(0).value(i)),
                    text ? string(frame.series(1).value(i)) : null,
                    tags ? string(frame.series(text ? 2 : 1).value(i)) : null));
        }
        a.sort((x, y) -> Long.compare(x.time(), y.time()));
        return a;
    }

    private static String title(final Object v) {
        final String s = string(v);
        return s == null ? "" : s;
    }

    private static String string(final Object v) {
        if (v == null)
            return null;
        if (v instanceof Double && ((Double) v) == Math.rint((Double) v) && !((Double) v).isInfinite())
            return String.valueOf(((Double) v).longValue());
        return v.toString();
    }
}
