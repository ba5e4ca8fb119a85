package flint.ds;

import java.util.Objects;

/**
 * Which column indexes the rows of a source.
 *
 * AUTO uses the date column detected from the header (or none), NONE keys rows by
 * position, otherwise a column is chosen by name or by zero-based header position.
 */
public final class IndexChoice {
    /** Value of the "no index" sentinel on the wire */
    public static final int NONE_SENTINEL = -1;

    public static final IndexChoice AUTO = new IndexChoice(null, -2);
    public static final IndexChoice NONE = new IndexChoice(null, NONE_SENTINEL);

    private final String column;
    private final int position;

    private IndexChoice(final String column, final int position) {
        this.column = column;
        this.position = position;
    }

    public static IndexChoice column(final String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("index column name cannot be empty");
        return new IndexChoice(name, -2);
    }

    public static IndexChoice position(final int position) {
        if (position == NONE_SENTINEL)
            return NONE;
        if (position < 0)
            throw new IllegalArgumentException("invalid index position " + position);
        return new IndexChoice(null, position);
    }

    /**
     * Reads an index choice from a request value
     * @param v column name, column position, {@code -1} for no index, or null
     * @return the choice, or null if {@code v} is null
     */
    public static IndexChoice of(final Object v) {
        if (v == null)
            return null;
        if (v instanceof Number)
            return position(((Number) v).intValue());
        final String s = v.toString().trim();
        if (s.isEmpty())
            return null;
        if (s.matches("-?\\d+"))
            return position(Integer.parseInt(s));
        return column(s);
    }

    public boolean isAuto() {
        return this == AUTO;
    }

    public boolean isNone() {
        return this == NONE;
    }

    /**
     * Resolves this choice against a header
     *
     * @param header   full header of the file
     * @param detected position of the detected date column, or -1
     * @return header position of the index column, or -1 for no index
     * @throws DatasourceException if the named column or position does not exist
     */
    int resolve(final String[] header, final int detected) throws DatasourceException {
        if (isAuto())
            return detected;
        if (isNone())
            return -1;
        if (column != null) {
            for (int i = 0; i < header.length; i++) {
                if (column.equals(header[i]))
                    return i;
            }
            throw new DatasourceException(ErrorCode.INDEX_NOT_FOUND, column);
        }
        if (position >= header.length)
            throw new DatasourceException(ErrorCode.INDEX_NOT_FOUND, position);
        return position;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IndexChoice))
            return false;
        final IndexChoice other = (IndexChoice) o;
        return position == other.position && Objects.equals(column, other.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, position);
    }

    @Override
    public String toString() {
        if (this == AUTO)
            return "AUTO";
        if (this == NONE)
            return "NONE";
        return column != null ? column : String.valueOf(position);
    }
}
