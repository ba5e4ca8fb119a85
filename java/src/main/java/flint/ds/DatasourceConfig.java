package flint.ds;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Server configuration
 *
 * Settings are read from the first configuration file found, then overridden by
 * command-line options.
 *
 * Configuration file locations (in order of precedence):
 * 1. System property: -Dflintds.config=/path/to/datasource.properties
 * 2. ./datasource.properties (current directory)
 * 3. ~/.flintds/datasource.properties (user home)
 * 4. bundled defaults (datasource.properties on the classpath)
 *
 * Configuration format:
 * <pre>
 * port = 3003
 * addr = 0.0.0.0
 * folder = /data/csv
 * filetypes = csv
 * debug = false
 * </pre>
 *
 * Command-line options: -p/--port, -f/--folder, -a/--addr, -v (debug), -h (help).
 */
public final class DatasourceConfig {
    public static final String PRODUCT_NAME = "FlintDS";
    public static final String PRODUCT_NAME_LC = PRODUCT_NAME.toLowerCase();
    public static final String CONFIG_NAME = "datasource.properties";

    static final int DEFAULT_PORT = 3003;
    static final String DEFAULT_ADDR = "0.0.0.0";
    static final String DEFAULT_FOLDER = "./";
    static final String DEFAULT_FILETYPES = "csv";

    private int port = DEFAULT_PORT;
    private String addr = DEFAULT_ADDR;
    private File folder = new File(DEFAULT_FOLDER);
    private List<String> filetypes = List.of(DEFAULT_FILETYPES);
    private boolean debug = false;
    private boolean help = false;
    private File source; // configuration file, null for bundled defaults

    DatasourceConfig() {
    }

    /**
     * Loads the configuration file and applies command-line options
     * @param args command-line arguments
     * @return the configuration
     * @throws IOException if the configuration file cannot be read
     * @throws IllegalArgumentException for unknown options or malformed values
     */
    public static DatasourceConfig load(final String[] args) throws IOException {
        final DatasourceConfig config = new DatasourceConfig();
        final File file = findConfigFile();
        if (file != null) {
            try (final InputStream in = new FileInputStream(file)) {
                config.apply(read(in));
            }
            config.source = file;
        } else {
            try (final InputStream in = DatasourceConfig.class.getResourceAsStream("/" + CONFIG_NAME)) {
                if (in != null)
                    config.apply(read(in));
            }
        }
        config.parse(args);
        return config;
    }

    /**
     * Find configuration file from standard locations
     */
    private static File findConfigFile() {
        final String configPath = System.getProperty(PRODUCT_NAME_LC + ".config");
        if (configPath != null && !configPath.isEmpty()) {
            final File f = IO.path(configPath);
            if (f.exists()) return f;
        }

        final File localConfig = new File(CONFIG_NAME);
        if (localConfig.exists())
            return localConfig;

        final String home = System.getProperty("user.home");
        if (home != null) {
            final File homeConfig = new File(home, "." + PRODUCT_NAME_LC + "/" + CONFIG_NAME);
            if (homeConfig.exists())
                return homeConfig;
        }
        return null;
    }

    static Properties read(final InputStream in) throws IOException {
        final Properties props = new Properties();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            props.load(reader);
        }
        return props;
    }

    /**
     * Applies settings from properties; absent keys keep their current value
     */
    DatasourceConfig apply(final Properties props) {
        final String p = trimmed(props.getProperty("port"));
        if (p != null)
            port = port(p);
        final String a = trimmed(props.getProperty("addr"));
        if (a != null)
            addr = a;
        final String f = trimmed(props.getProperty("folder"));
        if (f != null)
            folder = IO.path(f);
        final String t = trimmed(props.getProperty("filetypes"));
        if (t != null)
            filetypes = filetypes(t);
        final String d = trimmed(props.getProperty("debug"));
        if (d != null)
            debug = Boolean.parseBoolean(d);
        return this;
    }

    /**
     * Applies command-line options
     */
    DatasourceConfig parse(final String[] args) {
        for (int i = 0; i < args.length; i++) {
            final String s = args[i];
            switch (s) {
            case "-h", "--help" -> help = true;
            case "-v" -> debug = true;
            case "-p", "--port" -> port = port(value(args, ++i, s));
            case "-f", "--folder" -> folder = IO.path(value(args, ++i, s));
            case "-a", "--addr" -> addr = value(args, ++i, s);
            default -> {
                if (s.startsWith("--port="))
                    port = port(s.substring("--port=".length()));
                else if (s.startsWith("--folder="))
                    folder = IO.path(s.substring("--folder=".length()));
                else if (s.startsWith("--addr="))
                    addr = s.substring("--addr=".length());
                else
                    throw new IllegalArgumentException("unknown option " + s);
            }
            }
        }
        return this;
    }

    private static String value(final String[] args, final int i, final String option) {
        if (i >= args.length)
            throw new IllegalArgumentException(option + " requires an argument");
        return args[i];
    }

    private static int port(final String s) {
        try {
            final int p = Integer.parseInt(s.trim());
            if (p < 0 || p > 65535)
                throw new IllegalArgumentException("port out of range: " + s);
            return p;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid port: " + s, ex);
        }
    }

    private static List<String> filetypes(final String s) {
        final List<String> a = new ArrayList<>();
        for (final String t : s.split(",")) {
            if (!t.isBlank())
                a.add(t.trim().toLowerCase());
        }
        return Collections.unmodifiableList(a);
    }

    private static String trimmed(final String s) {
        return (s == null || s.trim().isEmpty()) ? null : s.trim();
    }

    public static String usage() {
        return "usage: " + PRODUCT_NAME_LC + " [-p <port>] [-f <folder>] [-a <addr>] [-v] [-h]";
    }

    public int port() {
        return port;
    }

    public String addr() {
        return addr;
    }

    public File folder() {
        return folder;
    }

    public List<String> filetypes() {
        return filetypes;
    }

    public boolean debug() {
        return debug;
    }

    public boolean help() {
        return help;
    }

    /**
     * @return the configuration file that was read, or null for the bundled defaults
     */
    public File source() {
        return source;
    }

    @Override
    public String toString() {
        return "DatasourceConfig[port=" + port + ", addr=" + addr + ", folder=" + folder + ", filetypes=" + filetypes
                + ", debug=" + debug + "]";
    }
}
