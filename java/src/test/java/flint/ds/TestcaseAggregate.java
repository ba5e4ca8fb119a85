package flint.ds;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Group-by aggregation")
class TestcaseAggregate {

    private static Frame frame(final Object[] keys, final Object[]... columns) {
        final List<Series> a = new ArrayList<>();
        for (int i = 0; i < columns.length; i++)
            a.add(new Series("c" + i, keys, columns[i]));
        return new Frame("date", true, keys, a);
    }

    private static Object[] keys(final int n, final long key) {
        final Object[] k = new Object[n];
        java.util.Arrays.fill(k, key);
        return k;
    }

    @Test
    @DisplayName("groups come out ascending whatever the row order, rows without key are ignored")
    void testGrouping() throws Exception {
        final Object[] k = { 3L, 1L, null, 2L, 1L };
        final Series s = new Aggregate("n", new Aggregate.COUNT(0)).apply(frame(k, new Object[] { "a", "b", "c", null, "d" }));
        assertEquals("n", s.name());
        assertEquals(3, s.size());
        assertEquals(1L, s.key(0));
        assertEquals(2L, s.key(1));
        assertEquals(3L, s.key(2));
        assertEquals(2L, s.value(0));
        assertEquals(0L, s.value(1));
        assertEquals(1L, s.value(2));
    }

    @Test
    @DisplayName("SUM and AVG skip missing values, AVG of nothing is NaN")
    void testSumAvg() throws Exception {
        final Object[] k = { 1L, 1L, 1L, 2L };
        final Object[] v = { 1.0, null, 2.0, null };
        final Series sum = new Aggregate("sum", new Aggregate.SUM(0)).apply(frame(k, v));
        assertEquals(3.0, sum.value(0));
        assertEquals(0.0, sum.value(1));

        final Series avg = new Aggregate("avg", new Aggregate.AVG(0)).apply(frame(k, v));
        assertEquals(1.5, avg.value(0));
        assertTrue(((Double) avg.value(1)).isNaN());
    }

    @Test
    @DisplayName("RATIO is sum over sum per group, NaN when the denominator sums to zero")
    void testRatio() throws Exception {
        final Object[] k = { 1L, 1L, 1L, 2L, 2L };
        final Object[] defaults = { 1.0, 0.0, 1.0, 0.0, 1.0 };
        final Object[] exposure = { 1.0, 1.0, 2.0, 0.0, 0.0 };
        final Series s = new Aggregate("default_rate", new Aggregate.RATIO(0, 1)).apply(frame(k, defaults, exposure));
        assertEquals(0.5, (Double) s.value(0), 1e-12);
        assertTrue(((Double) s.value(1)).isNaN());
    }

    @Test
    @DisplayName("text left after normalization cannot be aggregated")
    void testNotNumeric() {
        final Object[] k = { 1L, 1L };
        final DatasourceException ex = assertThrows(DatasourceException.class,
                () -> new Aggregate("avg", new Aggregate.AVG(0)).apply(frame(k, new Object[] { "0.1", "high" })));
        assertEquals(ErrorCode.NOT_NUMERIC, ex.getErrorCode());
    }

    @Test
    @DisplayName("AUC - perfect, inverted and known rankings")
    void testAuc() throws Exception {
        final double[] y = { 0, 0, 1, 1 };
        assertEquals(1.0, Aggregate.GINI.auc(new double[] { 0.1, 0.2, 0.8, 0.9 }, y), 1e-12);
        assertEquals(0.0, Aggregate.GINI.auc(new double[] { 0.9, 0.8, 0.2, 0.1 }, y), 1e-12);
        assertEquals(0.75, Aggregate.GINI.auc(new double[] { 0.1, 0.4, 0.35, 0.8 }, y), 1e-12);
    }

    @Test
    @DisplayName("AUC - tied scores take average ranks")
    void testAucTies() throws Exception {
        assertEquals(0.5, Aggregate.GINI.auc(new double[] { 0.5, 0.5, 0.5, 0.5 }, new double[] { 0, 1, 0, 1 }), 1e-12);
        assertEquals(0.875, Aggregate.GINI.auc(new double[] { 0.2, 0.5, 0.5, 0.9 }, new double[] { 0, 0, 1, 1 }), 1e-12);
    }

    @Test
    @DisplayName("AUC - the larger outcome value is the positive class")
    void testAucPositiveClass() throws Exception {
        assertEquals(1.0, Aggregate.GINI.auc(new double[] { 1, 2, 3, 4 }, new double[] { 5, 5, 7, 7 }), 1e-12);
    }

    @Test
    @DisplayName("GINI - 2 x AUC - 1 per group")
    void testGini() throws Exception {
        final Object[] k = { 1L, 1L, 1L, 1L, 2L, 2L, 2L, 2L };
        final Object[] pd = { 0.1, 0.2, 0.8, 0.9, 0.9, 0.8, 0.2, 0.1 };
        final Object[] dflt = { 0.0, 0.0, 1.0, 1.0, 0.0, 0.0, 1.0, 1.0 };
        final Series s = new Aggregate("gini", new Aggregate.GINI(0, 1)).apply(frame(k, pd, dflt));
        assertEquals(1.0, (Double) s.value(0), 1e-12);
        assertEquals(-1.0, (Double) s.value(1), 1e-12);
    }

    @Test
    @DisplayName("GINI - single class, non binary and missing inputs are compute errors")
    void testGiniErrors() {
        final Object[] k = keys(3, 1L);
        DatasourceException ex = assertThrows(DatasourceException.class,
                () -> new Aggregate("gini", new Aggregate.GINI(0, 1)).apply(frame(k, new Object[] { 0.1, 0.2, 0.3 }, new Object[] { 0.0, 0.0, 0.0 })));
        assertEquals(ErrorCode.SINGLE_CLASS_GROUP, ex.getErrorCode());
        assertTrue(ex.isCategory(ErrorCode.Category.COMPUTE));

        ex = assertThrows(DatasourceException.class,
                () -> new Aggregate("gini", new Aggregate.GINI(0, 1)).apply(frame(k, new Object[] { 0.1, 0.2, 0.3 }, new Object[] { 0.0, 1.0, 2.0 })));
        assertEquals(ErrorCode.NOT_BINARY, ex.getErrorCode());

        ex = assertThrows(DatasourceException.class,
                () -> new Aggregate("gini", new Aggregate.GINI(0, 1)).apply(frame(k, new Object[] { 0.1, null, 0.3 }, new Object[] { 0.0, 1.0, 1.0 })));
        assertEquals(ErrorCode.MISSING_VALUE, ex.getErrorCode());
    }
}
