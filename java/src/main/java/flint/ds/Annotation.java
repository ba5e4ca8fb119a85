package flint.ds;

/**
 * An event marker on the time axis of a dashboard.
 */
public final class Annotation {
    private final long time;
    private final String title;
    private final String text;
    private final String tags;

    /**
     * @param time  epoch milliseconds
     * @param title tooltip title
     * @param text  tooltip text, or null
     * @param tags  tags, or null
     */
    public Annotation(final long time, final String title, final String text, final String tags) {
        this.time = time;
        this.title = title;
        this.text = text;
        this.tags = tags;
    }

    public long time() {
        return time;
    }

    public String title() {
        return title;
    }

    public String text() {
        return text;
    }

    public String tags() {
        return tags;
    }

    @Override
    public String toString() {
        return "Annotation[" + time + ", " + title + "]";
    }
}
