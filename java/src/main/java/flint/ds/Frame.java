package flint.ds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Several series sharing the same index keys, in request order.
 */
public final class Frame {
    private final String index;
    private final boolean time;
    private final Object[] keys;
    private final List<Series> series;

    /**
     * @param index name of the index column, or null for row positions
     * @param time  true if keys are epoch milliseconds
     * @param keys  shared row keys
     */
    public Frame(final String index, final boolean time, final Object[] keys, final List<Series> series) {
        for (final Series s : series) {
            if (s.size() != keys.length)
                throw new IllegalArgumentException("series " + s.name() + " does not match the frame keys");
        }
        this.index = index;
        this.time = time;
        this.keys = keys;
        this.series = Collections.unmodifiableList(new ArrayList<>(series));
    }

    /**
     * Wraps a single series
     */
    public static Frame of(final String index, final boolean time, final Series s) {
        return new Frame(index, time, s.keys(), List.of(s));
    }

    public String index() {
        return index;
    }

    public boolean isTime() {
        return time;
    }

    public int rows() {
        return keys.length;
    }

    public Object key(final int i) {
        return keys[i];
    }

    Object[] keys() {
        return keys;
    }

    public List<Series> series() {
        return series;
    }

    public Series series(final int i) {
        return series.get(i);
    }

    public boolean isEmpty() {
        return keys.length == 0 || series.isEmpty();
    }
}
