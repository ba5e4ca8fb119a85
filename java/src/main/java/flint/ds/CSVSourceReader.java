/**
 * Delimited text source reader
 *
 * Sniffs the dialect of a CSV-like file, detects its date index column and
 * materializes the file on demand as an immutable indexed table.
 */
package flint.ds;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delimited text implementation of {@link SourceReader}
 *
 * The reader moves between two states: unloaded, and loaded for one index
 * column. A request without an index override reuses the loaded table; a request
 * whose override resolves to another column rebuilds the table from the file. The
 * check and the rebuild run under the reader's lock, and the new table is published
 * only when it is complete, so concurrent readers always see a whole table.
 */
final class CSVSourceReader implements SourceReader {
    static final String BOM = "\uFEFF";

    private final File file;
    private final Dialect dialect;
    private final String[] header;
    private final IndexChoice defaultChoice;
    private final int detected;
    private final int defaultIndex;
    private final List<String> columns;
    private final Logger logger;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile IndexedTable table;

    private CSVSourceReader(final File file, final Dialect dialect, final String[] header, final IndexChoice defaultChoice,
            final int detected, final int defaultIndex, final Logger logger) {
        this.file = file;
        this.dialect = dialect;
        this.header = header;
        this.defaultChoice = defaultChoice;
        this.detected = detected;
        this.defaultIndex = defaultIndex;
        this.logger = logger;

        final List<String> a = new ArrayList<>(header.length);
        for (int i = 0; i < header.length; i++) {
            if (i != defaultIndex)
                a.add(header[i]);
        }
        this.columns = java.util.Collections.unmodifiableList(a);
    }

    /**
     * Open a delimited file with automatic index detection
     *
     * @param file The file to open
     * @return reader for the file
     * @throws IOException if the file cannot be opened or its dialect sniffed
     */
    static CSVSourceReader open(final File file) throws IOException {
        return open(file, IndexChoice.AUTO, new Logger.NullLogger());
    }

    /**
     * Open a delimited file
     *
     * @param file   The file to open
     * @param index  index choice, {@link IndexChoice#AUTO} to detect a date column
     * @param logger Logger for operation tracking
     * @return reader for the file
     * @throws IOException if the file cannot be opened, its dialect sniffed, or the
     *                     explicit index column does not exist
     */
    static CSVSourceReader open(final File file, final IndexChoice index, final Logger logger) throws IOException {
        if (!file.isFile() || !file.canRead())
            throw new DatasourceException(ErrorCode.FILE_NOT_READABLE, file.getPath());

        final Dialect dialect;
        final String[] header;
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(IO.stream(file), StandardCharsets.UTF_8))) {
            String first = reader.readLine();
            if (first != null && first.startsWith(BOM))
                first = first.substring(BOM.length());
            if (first == null || first.isBlank())
                throw new DatasourceException(ErrorCode.EMPTY_FILE, file.getName());
            dialect = Dialect.sniff(first);

            final StringBuilder sb = new StringBuilder(first);
            while (!dialect.completed(sb)) {
                final String next = reader.readLine();
                if (next == null)
                    throw new DatasourceException(ErrorCode.MALFORMED_ROW, file.getName() + " : unterminated quoted header");
                sb.append('\n').append(next);
            }
            header = header(dialect.split(sb));
        } catch (DatasourceException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new DatasourceException(ErrorCode.FILE_NOT_READABLE, file.getPath(), ex);
        }

        final int detected = detect(header);
        final int defaultIndex = index.resolve(header, detected);
        logger.log("%s : %s, %d columns, index %s", file.getName(), dialect, header.length,
                defaultIndex < 0 ? "<none>" : header[defaultIndex]);
        return new CSVSourceReader(file, dialect, header, index, detected, defaultIndex, logger);
    }

    /**
     * Trim header names, name blank ones by position and make duplicates unique
     */
    private static String[] header(final String[] a) {
        final String[] v = new String[a.length];
        final Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < a.length; i++) {
            String name = a[i] == null ? "" : a[i].trim();
            if (name.isEmpty())
                name = "Unnamed: " + i;
            final int n = seen.merge(name, 1, Integer::sum);
            v[i] = n > 1 ? name + "." + (n - 1) : name;
        }
        return v;
    }

    /**
     * @return position of the first date-like header, or -1
     */
    static int detect(final String[] header) {
        for (int i = 0; i < header.length; i++) {
            if (Timestamps.isDateLike(header[i]))
                return i;
        }
        return -1;
    }

    @Override
    public String name() {
        return file.getName();
    }

    @Override
    public String indexColumn() {
        return defaultIndex < 0 ? null : header[defaultIndex];
    }

    Dialect dialect() {
        return dialect;
    }

    /**
     * @return the currently materialized table, or null before the first load
     */
    IndexedTable loaded() {
        return table;
    }

    @Override
    public List<String> columns(final String filter) {
        if (filter == null || filter.isEmpty())
            return columns;
        final List<String> a = new ArrayList<>();
        for (final String c : columns) {
            if (c.contains(filter))
                a.add(c);
        }
        return a;
    }

    @Override
    public Series values(final String column, final QueryOptions options) throws IOException {
        return table(options).series(column);
    }

    @Override
    public Frame values(final List<String> columns, final QueryOptions options) throws IOException {
        final IndexedTable t = table(options);
        final List<Series> a = new ArrayList<>(columns.size());
        for (final String c : columns)
            a.add(t.series(c));
        return new Frame(t.index(), t.keyType() == IndexedTable.KeyType.TIME, t.keys(), a);
    }

    /**
     * Returns the table for a request, loading or rebuilding it as needed
     */
    private IndexedTable table(final QueryOptions options) throws IOException {
        final IndexChoice override = options == null ? null : options.index();
        try (final IO.Closer CLOSER = new IO.Closer(lock)) {
            final IndexedTable current = this.table;
            if (current != null) {
                if (override == null)
                    return current;
                final int position = override.resolve(header, detected);
                if (position == current.indexPosition())
                    return current;
                logger.log("%s : index %s -> %s, rebuilding", file.getName(), current.choice(), override);
            }

            final IndexChoice choice = override != null ? override : defaultChoice;
            final int position = override != null ? override.resolve(header, detected) : defaultIndex;
            final IndexedTable loaded = IndexedTable.load(file, dialect, header, choice, position, logger);
            this.table = loaded;
            return loaded;
        }
    }

    @Override
    public String toString() {
        return "CSVSourceReader[" + file.getName() + ", " + dialect + ", index=" + indexColumn() + "]";
    }
}
