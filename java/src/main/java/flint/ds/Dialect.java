/**
 * Delimited text dialect
 *
 * Describes how one delimited file separates and quotes its fields, and splits
 * records accordingly.
 */
package flint.ds;

import java.util.ArrayList;
import java.util.Set;

/**
 * Field delimiter, quote character and missing-value markers of a delimited file.
 *
 * A dialect is either one of the predefined constants or sniffed from the first
 * line of a file. Instances are immutable and safe to share between threads.
 */
public final class Dialect {
    /** Candidate delimiters in order of preference when counts tie */
    static final char[] DELIMITERS = { ',', ';', '\t', '|', ':' };

    /** Cell values read as missing, in addition to the empty unquoted cell */
    static final Set<String> NULLS = Set.of("NA", "N/A", "#N/A", "NaN", "nan", "NULL", "null");

    public static final Dialect CSV = new Dialect(',', '"', "CSV");
    public static final Dialect TSV = new Dialect('\t', '"', "TSV");

    private final char delimiter;
    private final char quote;
    private final String name;

    Dialect(final char delimiter, final char quote, final String name) {
        this.delimiter = delimiter;
        this.quote = quote;
        this.name = name;
    }

    /**
     * Detect the dialect of a file from its first line
     *
     * The delimiter is the candidate occurring most often outside quotes; the
     * quote character is a double quote unless the line only quotes with
     * apostrophes.
     *
     * @param line first line of the file, without line terminator
     * @return sniffed dialect
     * @throws DatasourceException if no candidate delimiter occurs in the line
     */
    public static Dialect sniff(final String line) throws DatasourceException {
        if (line == null || line.isEmpty())
            throw new DatasourceException(ErrorCode.DIALECT_NOT_DETECTED, "empty line");

        final char quote = (line.indexOf('"') < 0 && startsQuoted(line, '\'')) ? '\'' : '"';
        final int[] counts = new int[DELIMITERS.length];
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            final char ch = line.charAt(i);
            if (ch == quote) {
                quoted = !quoted;
                continue;
            }
            if (quoted)
                continue;
            for (int k = 0; k < DELIMITERS.length; k++) {
                if (DELIMITERS[k] == ch)
                    counts[k]++;
            }
        }

        int best = -1;
        for (int k = 0; k < DELIMITERS.length; k++) {
            if (counts[k] > 0 && (best < 0 || counts[k] > counts[best]))
                best = k;
        }
        if (best < 0)
            throw new DatasourceException(ErrorCode.DIALECT_NOT_DETECTED, line);

        final char delimiter = DELIMITERS[best];
        if (delimiter == CSV.delimiter && quote == CSV.quote)
            return CSV;
        if (delimiter == TSV.delimiter && quote == TSV.quote)
            return TSV;
        return new Dialect(delimiter, quote, "");
    }

    private static boolean startsQuoted(final String line, final char q) {
        return line.length() > 1 && line.charAt(0) == q;
    }

    public char delimiter() {
        return delimiter;
    }

    public char quote() {
        return quote;
    }

    /**
     * Split one record into fields
     *
     * Quoted fields may contain the delimiter, line breaks and doubled quote
     * characters. Unquoted empty fields and the missing-value markers become null.
     *
     * @param raw complete record, possibly spanning several physical lines
     * @return field values
     */
    public String[] split(final CharSequence raw) {
        final ArrayList<String> array = new ArrayList<>();
        final int L = raw.length();
        final StringBuilder s = new StringBuilder(Math.min(L, 256));
        boolean inQuote = false;
        boolean quoted = false;

        for (int i = 0; i < L; i++) {
            final char ch = raw.charAt(i);
            final char next = ((i + 1) < L) ? raw.charAt(i + 1) : '\0';

            // Outside quotes, CR/LF terminate the record
            if (!inQuote && (ch == '\n' || ch == '\r'))
                break;

            if (inQuote && quote == ch && quote == next) {
                s.append(ch);
                i++;
            } else if (inQuote && quote == ch) {
                inQuote = false;
            } else if (!inQuote && quote == ch) {
                inQuote = true;
                quoted = true;
            } else if (inQuote) {
                s.append(ch);
            } else if (delimiter == ch) {
                array.add(value(s, quoted));
                s.setLength(0);
                quoted = false;
            } else {
                s.append(ch);
            }
        }
        array.add(value(s, quoted));
        return array.toArray(String[]::new);
    }

    private static String value(final StringBuilder s, final boolean quoted) {
        final String v = s.toString();
        if (quoted)
            return v;
        final String t = v.trim();
        return (t.isEmpty() || NULLS.contains(t)) ? null : v;
    }

    /**
     * Check whether a record is complete (handles multi-line quoted fields)
     *
     * @param raw record content so far
     * @return true when the record does not end inside a quoted section
     */
    public boolean completed(final CharSequence raw) {
        boolean inQuote = false;
        final int len = raw.length();
        for (int i = 0; i < len; i++) {
            final char ch = raw.charAt(i);
            final char next = (i + 1) < len ? raw.charAt(i + 1) : '\0';
            if (inQuote && quote == ch && quote == next) {
                i++;
            } else if (quote == ch) {
                inQuote = !inQuote;
            }
        }
        return !inQuote;
    }

    @Override
    public String toString() {
        if (!name.isEmpty())
            return name;
        return "Dialect[delimiter=" + printable(delimiter) + ", quote=" + quote + "]";
    }

    private static String printable(final char c) {
        return c == '\t' ? "\\t" : String.valueOf(c);
    }
}
