package flint.ds;

/**
 * Locale numeric normalization.
 *
 * Decimal commas are rewritten to points before parsing. A column converts only
 * when every non-missing value parses; otherwise it keeps its text. Values that overflow a double are not numeric.
 */
public final class Numeric {

	private Numeric() {
	}

	/**
	 * Normalizes one value
	 * @param s raw cell text
	 * @return parsed number, or null if the text is not numeric
	 */
	public static Double parse(final String s) {
		if (s == null)
			return null;
		final String t = s.trim().replace(',', '.');
		if (t.isEmpty())
			return null;
		// Double.parseDouble accepts "1d", "0x1p3" and "Infinity", none of which are data
		final char last = t.charAt(t.length() - 1);
		if (!(Character.isDigit(last) || last == '.'))
			return null;
		try {
			final double d = Double.parseDouble(t);
			return Double.isFinite(d) ? d : null;
		} catch (NumberFormatException ex) {
			return null;
		}
	}

	/**
	 * Normalizes a column of values
	 *
	 * Already numeric values are kept as they are, so normalizing twice yields the
	 * same column.
	 *
	 * @param values column values (String, Number or null)
	 * @return a new array of Double values, or {@code values} itself if any value is not numeric
	 */
	public static Object[] normalize(final Object[] values) {
		final Object[] out = new Object[values.length];
		for (int i = 0; i < values.length; i++) {
			final Object v = values[i];
			if (v == null) {
				out[i] = null;
			} else if (v instanceof Double) {
				out[i] = v;
			} else if (v instanceof Number) {
				out[i] = ((Number) v).doubleValue();
			} else {
				final Double d = parse(v.toString());
				if (d == null)
					return values;
				out[i] = d;
			}
		}
		return out;
	}
}
