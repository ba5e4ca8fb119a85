/**
 * In-memory materialization of a delimited source
 */
package flint.ds;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rows of one source keyed by the values of its index column.
 *
 * A table is built once for one index choice and never mutated afterwards; the
 * only internal state that changes is the memo of normalized columns, which is
 * idempotent.
 */
final class IndexedTable {
    /** Kind of row keys */
    enum KeyType {
        /** epoch milliseconds of a date-like index column */
        TIME,
        /** zero-based row position, no index column */
        ROW,
        /** raw index values, Double when all are numeric, String otherwise */
        VALUE
    }

    private final IndexChoice choice;
    private final int indexPosition;
    private final String index;
    private final KeyType keyType;
    private final Object[] keys;
    private final Map<String, String[]> columns;
    private final Map<String, Object[]> normalized = new ConcurrentHashMap<>();

    private IndexedTable(final IndexChoice choice, final int indexPosition, final String index, final KeyType keyType,
            final Object[] keys, final Map<String, String[]> columns) {
        this.choice = choice;
        this.indexPosition = indexPosition;
        this.index = index;
        this.keyType = keyType;
        this.keys = keys;
        this.columns = Collections.unmodifiableMap(columns);
    }

    /**
     * Reads the whole file into a new table
     *
     * @param file          source file (plain or .gz)
     * @param dialect       sniffed dialect
     * @param header        full header of the file
     * @param choice        index choice the table is built for
     * @param indexPosition resolved header position of the index column, or -1
     * @param logger        logger
     * @return the new table
     * @throws IOException if the file cannot be read or a row is malformed
     */
    static IndexedTable load(final File file, final Dialect dialect, final String[] header, final IndexChoice choice,
            final int indexPosition, final Logger logger) throws IOException {
        final List<String[]> rows = new ArrayList<>();
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(IO.stream(file), StandardCharsets.UTF_8))) {
            final StringBuilder sb = new StringBuilder();
            boolean head = true;
            long line = 0;
            for (String s; (s = reader.readLine()) != null;) {
                line++;
                if (sb.length() > 0)
                    sb.append('\n');
                sb.append(s);
                if (!dialect.completed(sb))
                    continue;

                if (head) {
                    head = false;
                } else if (!isBlank(sb)) {
                    final String[] a = dialect.split(sb);
                    if (a.length > header.length)
                        throw new DatasourceException(ErrorCode.MALFORMED_ROW,
                                String.format("%s line %d : expected %d fields, saw %d", file.getName(), line, header.length, a.length));
                    rows.add(a.length == header.length ? a : java.util.Arrays.copyOf(a, header.length));
                }
                sb.setLength(0);
            }
            if (sb.length() > 0)
                throw new DatasourceException(ErrorCode.MALFORMED_ROW, file.getName() + " : unterminated quoted field");
        }

        final String index = indexPosition < 0 ? null : header[indexPosition];
        final KeyType keyType = indexPosition < 0 ? KeyType.ROW : (Timestamps.isDateLike(index) ? KeyType.TIME : KeyType.VALUE);

        // rows whose date index is missing cannot be placed on a time axis
        final List<String[]> kept;
        if (keyType == KeyType.TIME) {
            kept = new ArrayList<>(rows.size());
            for (final String[] r : rows) {
                if (r[indexPosition] != null)
                    kept.add(r);
            }
            if (kept.size() < rows.size())
                logger.error("%s : %d rows without a value in index column %s were skipped", file.getName(), rows.size() - kept.size(), index);
        } else {
            kept = rows;
        }

        final Object[] keys = new Object[kept.size()];
        switch (keyType) {
            case ROW -> {
                for (int i = 0; i < keys.length; i++)
                    keys[i] = (long) i;
            }
            case TIME -> {
                for (int i = 0; i < keys.length; i++)
                    keys[i] = Timestamps.parse(kept.get(i)[indexPosition]);
            }
            case VALUE -> {
                final Object[] raw = new Object[keys.length];
                for (int i = 0; i < raw.length; i++)
                    raw[i] = kept.get(i)[indexPosition];
                System.arraycopy(Numeric.normalize(raw), 0, keys, 0, keys.length);
            }
        }

        final Map<String, String[]> columns = new LinkedHashMap<>();
        for (int c = 0; c < header.length; c++) {
            if (c == indexPosition)
                continue;
            final String[] values = new String[kept.size()];
            for (int i = 0; i < values.length; i++)
                values[i] = kept.get(i)[c];
            columns.put(header[c], values);
        }

        logger.log("%s : loaded %d rows, index %s (%s)", file.getName(), keys.length, index == null ? "<none>" : index, keyType);
        return new IndexedTable(choice, indexPosition, index, keyType, keys, columns);
    }

    private static boolean isBlank(final CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isWhitespace(s.charAt(i)))
                return false;
        }
        return true;
    }

    IndexChoice choice() {
        return choice;
    }

    int indexPosition() {
        return indexPosition;
    }

    /**
     * @return name of the index column, or null when rows are keyed by position
     */
    String index() {
        return index;
    }

    KeyType keyType() {
        return keyType;
    }

    int rows() {
        return keys.length;
    }

    Object[] keys() {
        return keys;
    }

    /**
     * Resolves a requested column name: exact match first, then the first column
     * (in header order) containing the name
     *
     * @throws DatasourceException if the name is blank or no column matches
     */
    String resolve(final String name) throws DatasourceException {
        if (name == null || name.trim().isEmpty())
            throw new DatasourceException(ErrorCode.COLUMN_NOT_FOUND, "<EMPTY>");
        if (columns.containsKey(name))
            return name;
        for (final String c : columns.keySet()) {
            if (c.contains(name))
                return c;
        }
        throw new DatasourceException(ErrorCode.COLUMN_NOT_FOUND, name);
    }

    /**
     * Values of a column after locale numeric normalization
     */
    Series series(final String name) throws DatasourceException {
        final String column = resolve(name);
        final Object[] values = normalized.computeIfAbsent(column, c -> Numeric.normalize(columns.get(c)));
        return new Series(column, keys, values);
    }
}
