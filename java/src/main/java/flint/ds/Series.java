package flint.ds;

import java.util.Arrays;
import java.util.Comparator;

/**
 * A named column of values aligned with index keys.
 *
 * Keys are Long (epoch milliseconds or row position), Double or String; values are
 * Double, String or null. Series are immutable.
 */
public final class Series {
    /** Orders keys ascending; numbers before text, nulls last */
    public static final Comparator<Object> KEY_ORDER = Series::compareKeys;

    private final String name;
    private final Object[] keys;
    private final Object[] values;

    public Series(final String name, final Object[] keys, final Object[] values) {
        if (keys.length != values.length)
            throw new IllegalArgumentException("keys and values differ in length: " + keys.length + " != " + values.length);
        this.name = name;
        this.keys = keys;
        this.values = values;
    }

    public String name() {
        return name;
    }

    public int size() {
        return keys.length;
    }

    public Object key(final int i) {
        return keys[i];
    }

    public Object value(final int i) {
        return values[i];
    }

    Object[] keys() {
        return keys;
    }

    Object[] values() {
        return values;
    }

    /**
     * Drops missing and NaN values and sorts by key ascending (stable for equal keys)
     */
    public Series sorted() {
        final Integer[] order = new Integer[keys.length];
        int n = 0;
        for (int i = 0; i < keys.length; i++) {
            if (!isMissing(values[i]))
                order[n++] = i;
        }
        final Integer[] kept = Arrays.copyOf(order, n);
        Arrays.sort(kept, (a, b) -> compareKeys(keys[a], keys[b]));

        final Object[] k = new Object[n];
        final Object[] v = new Object[n];
        for (int i = 0; i < n; i++) {
            k[i] = keys[kept[i]];
            v[i] = values[kept[i]];
        }
        return new Series(name, k, v);
    }

    static boolean isMissing(final Object v) {
        return v == null || (v instanceof Double && !Double.isFinite((Double) v));
    }

    static int compareKeys(final Object a, final Object b) {
        if (a == b)
            return 0;
        if (a == null)
            return 1;
        if (b == null)
            return -1;
        if (a instanceof Number && b instanceof Number) {
            if (a instanceof Long && b instanceof Long)
                return Long.compare((Long) a, (Long) b);
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Number)
            return -1;
        if (b instanceof Number)
            return 1;
        return a.toString().compareTo(b.toString());
    }

    @Override
    public String toString() {
        final StringBuilder s = new StringBuilder(name).append(" {");
        for (int i = 0; i < keys.length; i++) {
            if (i > 0)
                s.append(", ");
            s.append(keys[i]).append('=').append(values[i]);
        }
        return s.append('}').toString();
    }
}
