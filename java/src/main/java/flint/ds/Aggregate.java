/**
 * Provides grouping by index key and the aggregate functions behind special metrics
 */
package flint.ds;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Groups the rows of a frame by index key and computes one function per group
 * Keys are visited in ascending order; rows without a key are not grouped.
 */
public final class Aggregate {
	/** Name of the resulting series */
	private final String id;
	/** Aggregate function to execute */
	private final Function function;

	/**
	 * @param id       name of the resulting series
	 * @param function aggregate function
	 */
	public Aggregate(final String id, final Function function) {
		this.id = id;
		this.function = function;
	}

	/**
	 * Runs the function over all rows of the frame
	 * @param frame input columns, in the order the function expects them
	 * @return one value per index key, keys ascending
	 * @throws DatasourceException if the function rejects its input
	 */
	public Series apply(final Frame frame) throws DatasourceException {
		final Set<Object> keys = new TreeSet<>(Series.KEY_ORDER);
		for (int i = 0; i < frame.rows(); i++) {
			final Object key = frame.key(i);
			if (key == null)
				continue;
			keys.add(key);
			function.row(key, frame, i);
		}

		final Object[] k = keys.toArray();
		final Object[] v = new Object[k.length];
		for (int i = 0; i < k.length; i++)
			v[i] = function.compute(k[i]);
		return new Series(id, k, v);
	}

	@Override
	public String toString() {
		return "GROUP BY [index] FUNCTIONS [" + function + "]";
	}

	/**
	 * Abstract base class for aggregate functions
	 * Input columns are addressed by their position in the frame.
	 */
	public static abstract class Function {
		/** Input column positions */
		final int[] columns;

		protected Function(final int... columns) {
			this.columns = columns;
		}

		/**
		 * Processes one row of a group
		 * @param key group key
		 * @param frame input frame
		 * @param i row number
		 * @throws DatasourceException if the row cannot be aggregated
		 */
		public abstract void row(final Object key, final Frame frame, final int i) throws DatasourceException;

		/**
		 * Calculates the aggregate of a group
		 * @param key group key
		 * @return aggregate value, NaN when undefined
		 * @throws DatasourceException if the aggregate cannot be computed
		 */
		public abstract Object compute(final Object key) throws DatasourceException;

		/**
		 * Value of an input column as a number
		 * @return the number, or null for a missing value
		 * @throws DatasourceException if the column kept non-numeric text
		 */
		protected Double number(final Frame frame, final int column, final int i) throws DatasourceException {
			final Series s = frame.series(columns[column]);
			final Object v = s.value(i);
			if (v == null)
				return null;
			if (v instanceof Number)
				return ((Number) v).doubleValue();
			throw new DatasourceException(ErrorCode.NOT_NUMERIC, s.name() + " = " + v);
		}

		protected Object value(final Frame frame, final int column, final int i) {
			return frame.series(columns[column]).value(i);
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + Arrays.toString(columns);
		}
	}

	/**
	 * COUNT aggregate function - number of non-missing values
	 */
	public static class COUNT extends Function {
		private final Map<Object, Long> values = new HashMap<>();

		public COUNT(final int column) {
			super(column);
		}

		@Override
		public void row(final Object key, final Frame frame, final int i) {
			final long p = values.getOrDefault(key, 0L);
			values.put(key, value(frame, 0, i) != null ? p + 1 : p);
		}

		@Override
		public Object compute(final Object key) {
			return values.getOrDefault(key, 0L);
		}
	}

	/**
	 * SUM aggregate function - sum of non-missing values
	 */
	public static class SUM extends Function {
		private final Map<Object, Double> values = new HashMap<>();

		public SUM(final int column) {
			super(column);
		}

		@Override
		public void row(final Object key, final Frame frame, final int i) throws DatasourceException {
			final Double v = number(frame, 0, i);
			values.merge(key, v == null ? 0d : v, Double::sum);
		}

		@Override
		public Object compute(final Object key) {
			return values.getOrDefault(key, 0d);
		}
	}

	/**
	 * AVG aggregate function - mean of non-missing values, NaN for a group without values
	 */
	public static class AVG extends Function {
		private final Map<Object, double[]> values = new HashMap<>();

		public AVG(final int column) {
			super(column);
		}

		@Override
		public void row(final Object key, final Frame frame, final int i) throws DatasourceException {
			final Double v = number(frame, 0, i);
			final double[] acc = values.computeIfAbsent(key, k -> new double[2]);
			if (v != null) {
				acc[0] += v;
				acc[1] += 1;
			}
		}

		@Override
		public Object compute(final Object key) {
			final double[] acc = values.get(key);
			if (acc == null || acc[1] == 0)
				return Double.NaN;
			return acc[0] / acc[1];
		}
	}

	/**
	 * RATIO aggregate function - sum of the first column over sum of the second,
	 * NaN when the denominator sum is zero
	 */
	public static class RATIO extends Function {
		private final Map<Object, double[]> values = new HashMap<>();

		public RATIO(final int numerator, final int denominator) {
			super(numerator, denominator);
		}

		@Override
		public void row(final Object key, final Frame frame, final int i) throws DatasourceException {
			final Double n = number(frame, 0, i);
			final Double d = number(frame, 1, i);
			final double[] acc = values.computeIfAbsent(key, k -> new double[2]);
			if (n != null)
				acc[0] += n;
			if (d != null)
				acc[1] += d;
		}

		@Override
		public Object compute(final Object key) {
			final double[] acc = values.get(key);
			if (acc == null || acc[1] == 0)
				return Double.NaN;
			return acc[0] / acc[1];
		}
	}

	/**
	 * GINI aggregate function - 2 x AUC - 1 of a score column against a binary outcome column
	 */
	public static class GINI extends Function {
		private final Map<Object, List<double[]>> values = new HashMap<>();

		public GINI(final int score, final int outcome) {
			super(score, outcome);
		}

		@Override
		public void row(final Object key, final Frame frame, final int i) throws DatasourceException {
			final Double score = number(frame, 0, i);
			final Double outcome = number(frame, 1, i);
			if (score == null || outcome == null)
				throw new DatasourceException(ErrorCode.MISSING_VALUE, "group " + key + ", row " + i);
			values.computeIfAbsent(key, k -> new ArrayList<>()).add(new double[] { score, outcome });
		}

		@Override
		public Object compute(final Object key) throws DatasourceException {
			final List<double[]> rows = values.get(key);
			final double[] scores = new double[rows.size()];
			final double[] outcomes = new double[rows.size()];
			for (int i = 0; i < scores.length; i++) {
				scores[i] = rows.get(i)[0];
				outcomes[i] = rows.get(i)[1];
			}
			try {
				return 2 * auc(scores, outcomes) - 1;
			} catch (DatasourceException ex) {
				throw new DatasourceException(ex.getErrorCode(), "group " + key, ex);
			}
		}

		/**
		 * Area under the ROC curve of scores against a binary outcome
		 *
		 * Computed as the Mann-Whitney statistic with average ranks for tied scores.
		 * The larger of the two outcome values is the positive class.
		 *
		 * @param scores predicted scores
		 * @param outcomes outcome values, exactly two distinct
		 * @return AUC in [0, 1]
		 * @throws DatasourceException if the outcomes hold one class or more than two
		 */
		static double auc(final double[] scores, final double[] outcomes) throws DatasourceException {
			final TreeSet<Double> classes = new TreeSet<>();
			for (final double o : outcomes)
				classes.add(o);
			if (classes.size() < 2)
				throw new DatasourceException(ErrorCode.SINGLE_CLASS_GROUP, "ROC AUC score is not defined");
			if (classes.size() > 2)
				throw new DatasourceException(ErrorCode.NOT_BINARY, classes);
			final double positive = classes.last();

			final int n = scores.length;
			final Integer[] order = new Integer[n];
			for (int i = 0; i < n; i++)
				order[i] = i;
			Arrays.sort(order, (a, b) -> Double.compare(scores[a], scores[b]));

			// average ranks (1-based) over runs of tied scores
			final double[] ranks = new double[n];
			for (int i = 0; i < n;) {
				int j = i;
				while (j + 1 < n && scores[order[j + 1]] == scores[order[i]])
					j++;
				final double rank = (i + j) / 2.0 + 1;
				for (int k = i; k <= j; k++)
					ranks[order[k]] = rank;
				i = j + 1;
			}

			double sum = 0;
			long pos = 0;
			for (int i = 0; i < n; i++) {
				if (outcomes[i] == positive) {
					sum += ranks[i];
					pos++;
				}
			}
			final long neg = n - pos;
			return (sum - pos * (pos + 1) / 2.0) / ((double) pos * neg);
		}
	}
}
