/**
 * Command line access to the datasource without the HTTP server
 */
package flint.ds;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public final class CLI {
    private static final String VERSION = "0.0.1";

    static boolean LOG = false;

    public static void main(String[] args) {
        try {
            long result = executeCLI(System.out, args);
            if (result < 0) {
                System.exit(1);
            }
        } catch (DatasourceException e) {
            System.err.println("Datasource Error (" + e.getErrorCode() + "): " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (LOG) {
                e.printStackTrace();
            }
            System.exit(1);
        }
    }

    /**
     * Runs one command and prints its JSON result
     * @return number of printed entries, 0 for help and version
     */
    static long executeCLI(PrintStream out, String[] args) throws Exception {
        String root = ".";
        String index = null;
        boolean table = false;
        boolean pretty = false;
        final List<String> operands = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String s = args[i];
            if ("-help".equals(s)) {
                usage(out);
                return 0;
            } else if ("-version".equals(s)) {
                out.println(DatasourceConfig.PRODUCT_NAME + " version " + VERSION);
                return 0;
            } else if ("-pretty".equals(s)) {
                pretty = true;
            } else if ("-log".equals(s)) {
                LOG = true;
            } else if ("-table".equals(s)) {
                table = true;
            } else if ("-root".equals(s)) {
                if (i + 1 < args.length) {
                    root = args[++i];
                } else {
                    throw new IllegalArgumentException("-root requires a directory");
                }
            } else if ("-index".equals(s)) {
                if (i + 1 < args.length) {
                    index = args[++i];
                } else {
                    throw new IllegalArgumentException("-index requires a column name or position");
                }
            } else {
                operands.add(s);
            }
        }

        if (operands.isEmpty()) {
            usage(out);
            return 0;
        }

        final Logger logger = LOG ? new Logger.ConsoleLogger() : new Logger.NullLogger();
        final SourceRegistry registry = new SourceRegistry(IO.path(root), List.of("csv"), logger);
        final QueryHandler handler = new QueryHandler(registry, new MetricEngine(logger), logger);

        final String command = operands.get(0);
        final List<?> result;
        switch (command) {
        case "sources" -> {
            require(operands, 2, "sources <folder>");
            result = handler.getSources("table", operands.get(1));
        }
        case "metrics" -> {
            require(operands, 3, "metrics <folder> <source> [filter]");
            handler.getSources("table", operands.get(1));
            result = handler.getMetrics("timeseries", operands.get(1), operands.get(2), operands.size() > 3 ? operands.get(3) : "");
        }
        case "query" -> {
            require(operands, 4, "query <folder> <source> <metric>...");
            handler.getSources("table", operands.get(1));
            final QueryOptions options = new QueryOptions(index == null ? null : IndexChoice.of(index), false);
            final List<QueryTarget> targets = new ArrayList<>();
            for (final String metric : operands.subList(3, operands.size()))
                targets.add(new QueryTarget(operands.get(2), List.of(metric), table ? QueryTarget.Shape.TABLE : QueryTarget.Shape.TIMESERIES, options));
            result = handler.getData(operands.get(1), targets);
        }
        case "annotations" -> {
            require(operands, 3, "annotations <folder> <finder>:<query>");
            result = handler.getAnnotations(operands.get(1), operands.get(2), Long.MIN_VALUE, Long.MAX_VALUE);
        }
        default -> throw new IllegalArgumentException("unknown command " + command);
        }

        final GsonBuilder builder = new GsonBuilder().serializeNulls();
        if (pretty)
            builder.setPrettyPrinting();
        final Gson g = builder.create();
        out.println(g.toJson(result));
        out.flush();
        return result.size();
    }

    private static void require(final List<String> operands, final int n, final String syntax) {
        if (operands.size() < n)
            throw new IllegalArgumentException("usage: " + syntax);
    }

    private static void usage(PrintStream out) {
        String CMD = "./bin/" + DatasourceConfig.PRODUCT_NAME_LC;

        out.println("Usage: \"" + CMD + "\" [options] <command> <folder> [arguments]\n");
        out.println(" commands:");
        out.println(" \tsources <folder>                      \tlist the sources of a folder");
        out.println(" \tmetrics <folder> <source> [filter]    \tlist special metrics and columns of a source");
        out.println(" \tquery <folder> <source> <metric>...   \tcompute metrics or read columns");
        out.println(" \tannotations <folder> <finder>:<query> \tlist annotations");
        out.println(" options:");
        out.println(" \t-root <dir>  \tdirectory holding the folders (default .)");
        out.println(" \t-index <col> \tindex column name or position, -1 for none");
        out.println(" \t-table       \ttable response instead of time series");
        out.println(" \t-pretty      \tpretty print JSON");
        out.println(" \t-log         \tenable detailed logging");
        out.println(" \t-version     \tshow version information");
        out.println(" \t-help        \tshow this help\n");
        out.println(" examples:");
        out.println("\t" + CMD + " -root /data sources portfolio");
        out.println("\t" + CMD + " -root /data metrics portfolio loans.csv pd");
        out.println("\t" + CMD + " -root /data query portfolio loans.csv special:gini special:avg_PD");
        out.println("\t" + CMD + " -root /data -index segment -table query portfolio loans.csv special:default_rate");
        out.println("\t" + CMD + " -root /data annotations portfolio source:events.csv");
        out.println();
    }
}
