package flint.ds;

import java.util.Arrays;
import java.util.List;

/**
 * Catalog of derived metrics computed per index group.
 */
public enum SpecialMetric {
    /** number of agreements (non-missing ids) */
    AGREEMENT_COUNT("agreement_count", "id") {
        @Override
        Aggregate.Function function() {
            return new Aggregate.COUNT(0);
        }
    },
    /** sum of defaults over sum of current defaults */
    DEFAULT_RATE("default_rate", "default_12m", "cur_default") {
        @Override
        Aggregate.Function function() {
            return new Aggregate.RATIO(0, 1);
        }
    },
    /** mean probability of default */
    AVG_PD("avg_PD", "pd") {
        @Override
        Aggregate.Function function() {
            return new Aggregate.AVG(0);
        }
    },
    /** ranking quality of pd against the observed default */
    GINI("gini", "pd", "default_12m") {
        @Override
        Aggregate.Function function() {
            return new Aggregate.GINI(0, 1);
        }
    };

    private final String id;
    private final List<String> inputs;

    SpecialMetric(final String id, final String... inputs) {
        this.id = id;
        this.inputs = Arrays.asList(inputs);
    }

    /**
     * @return the metric name as used in queries, without prefix
     */
    public String id() {
        return id;
    }

    /**
     * @return logical input column names, matched against headers by substring
     */
    public List<String> inputs() {
        return inputs;
    }

    /**
     * @return a fresh aggregate function over the inputs, in input order
     */
    abstract Aggregate.Function function();

    /**
     * Looks up a metric by name
     * @return the metric, or null if the name is not in the catalog
     */
    public static SpecialMetric of(final String id) {
        for (final SpecialMetric m : values()) {
            if (m.id.equals(id))
                return m;
        }
        return null;
    }
}
