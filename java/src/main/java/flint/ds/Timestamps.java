/**
 * Date parsing for index columns
 */
package flint.ds;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/**
 * Converts date-like index values to milliseconds since the epoch.
 *
 * Dates are read as yyyy-M-d, yyyy/M/d, d.M.yyyy or M/d/yyyy (day and month need
 * not be padded), each optionally followed by H:mm[:ss[.fraction]] and a zone
 * offset; yyyy-MM and yyyyMMdd are read as dates only. A 'T' may stand between
 * date and time. Values without an offset are read as UTC.
 */
public final class Timestamps {
	static final DateTimeFormatter DATE_FORMAT = dateTime("uuuu-M-d");
	static final DateTimeFormatter DATE_FORMAT_SLASH = dateTime("uuuu/M/d");
	static final DateTimeFormatter DATE_FORMAT_DOT = dateTime("d.M.uuuu");
	static final DateTimeFormatter DATE_FORMAT_US = dateTime("M/d/uuuu");
	static final DateTimeFormatter DATE_FORMAT_BASIC = date("uuuuMMdd");
	static final DateTimeFormatter YEAR_MONTH_FORMAT = new DateTimeFormatterBuilder() //
			.appendPattern("uuuu-M") //
			.parseDefaulting(ChronoField.DAY_OF_MONTH, 1) //
			.toFormatter(Locale.ROOT) //
			.withResolverStyle(ResolverStyle.STRICT);

	static final DateTimeFormatter[] FORMATS = { DATE_FORMAT, DATE_FORMAT_SLASH, DATE_FORMAT_DOT, DATE_FORMAT_US,
			DATE_FORMAT_BASIC, YEAR_MONTH_FORMAT };

	private static DateTimeFormatter date(final String pattern) {
		return new DateTimeFormatterBuilder() //
				.appendPattern(pattern) //
				.toFormatter(Locale.ROOT) //
				.withResolverStyle(ResolverStyle.STRICT);
	}

	/**
	 * Date pattern followed by an optional " H:mm[:ss[.fraction]][ ][offset]"
	 */
	private static DateTimeFormatter dateTime(final String pattern) {
		return new DateTimeFormatterBuilder() //
				.appendPattern(pattern) //
				.optionalStart() //
				.appendLiteral(' ') //
				.appendPattern("H:mm") //
				.optionalStart() //
				.appendLiteral(':') //
				.appendPattern("ss") //
				.optionalStart() //
				.appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true) //
				.optionalEnd() //
				.optionalEnd() //
				.optionalStart() //
				.appendLiteral(' ') //
				.optionalEnd() //
				.optionalStart() //
				.appendOffset("+HH:mm", "Z") //
				.optionalEnd() //
				.optionalEnd() //
				.toFormatter(Locale.ROOT) //
				.withResolverStyle(ResolverStyle.STRICT);
	}

	/** Header substrings marking a date column (compared in lower case) */
	static final String[] DATE_INDICATORS = { "date", "дата", "_dt" };

	private Timestamps() {
	}

	/**
	 * Checks whether a header name looks like a date column
	 * @param column header name
	 * @return true if the lower-cased name contains one of the date indicators
	 */
	public static boolean isDateLike(final String column) {
		if (column == null)
			return false;
		final String s = column.toLowerCase(Locale.ROOT);
		for (final String indicator : DATE_INDICATORS) {
			if (s.contains(indicator))
				return true;
		}
		return false;
	}

	/**
	 * Parses a date string into epoch milliseconds
	 *
	 * @param value the date string
	 * @return milliseconds since 1970-01-01T00:00:00Z
	 * @throws DatasourceException if the value has no supported layout
	 */
	public static long parse(final String value) throws DatasourceException {
		if (value == null)
			throw new DatasourceException(ErrorCode.INVALID_DATE, "<NULL>");
		final String s = value.trim().replace('T', ' ');
		DateTimeException last = null;
		for (final DateTimeFormatter f : FORMATS) {
			try {
				return millis(f.parse(s));
			} catch (DateTimeException ex) {
				last = ex;
			}
		}
		throw new DatasourceException(ErrorCode.INVALID_DATE, value, last);
	}

	private static long millis(final TemporalAccessor t) {
		final LocalDate date = LocalDate.from(t);
		final LocalTime time = t.isSupported(ChronoField.HOUR_OF_DAY) ? LocalTime.from(t) : LocalTime.MIDNIGHT;
		final ZoneOffset offset = t.isSupported(ChronoField.OFFSET_SECONDS) ? ZoneOffset.from(t) : ZoneOffset.UTC;
		return date.atTime(time).toInstant(offset).toEpochMilli();
	}
}
