package flint.ds;

/**
 * Logger interface for source and query operations
 *
 * Provides logging capabilities for tracking file loads, requests and errors.
 */
public interface Logger {
    /**
     * Log informational message
     *
     * @param fmt  printf style format
     * @param args format arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log error message
     *
     * @param fmt  printf style format
     * @param args format arguments
     */
    void error(String fmt, Object... args);


    /**
	 * Null logger that discards log messages but prints errors
	 */
    public static final class NullLogger implements Logger {
        @Override
        public void log(String fmt, Object... args) {
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.printf(fmt + "%n", args);
        }
    }

    /**
     * java.util.logging backed logger, messages at FINE and errors at SEVERE
     */
    public static final class DefaultLogger implements Logger {
        private final java.util.logging.Logger LOGGER;

        public DefaultLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger(name);
        }

        public DefaultLogger(Class<?> c) {
            this(c.getName());
        }

        @Override
        public void log(String fmt, Object... args) {
            if (LOGGER.isLoggable(java.util.logging.Level.FINE))
                LOGGER.log(java.util.logging.Level.FINE, String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.log(java.util.logging.Level.SEVERE, String.format(fmt, args));
        }
    }

    /**
     * Console logger used by the server in verbose mode
     */
    public static final class ConsoleLogger implements Logger {
        @Override
        public void log(String fmt, Object... args) {
            System.out.println(java.time.LocalDateTime.now().format(IO.TIMESTAMP_FORMAT) + " " + String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.println(java.time.LocalDateTime.now().format(IO.TIMESTAMP_FORMAT) + " " + String.format(fmt, args));
        }
    }
}
