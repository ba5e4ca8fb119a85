package flint.ds;

/**
 * Per-target options read from the {@code data} block of a query target.
 *
 * The log-scale flag is carried for display purposes only; no computation reads it.
 */
public final class QueryOptions {
    public static final QueryOptions DEFAULT = new QueryOptions(null, false);

    private final IndexChoice index;
    private final boolean logScale;

    public QueryOptions(final IndexChoice index, final boolean logScale) {
        this.index = index;
        this.logScale = logScale;
    }

    /**
     * @return index override, or null to use the reader default
     */
    public IndexChoice index() {
        return index;
    }

    public boolean logScale() {
        return logScale;
    }

    @Override
    public String toString() {
        return "QueryOptions[index=" + index + ", logScale=" + logScale + "]";
    }
}
