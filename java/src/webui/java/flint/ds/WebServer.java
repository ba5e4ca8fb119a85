/**
 * WebServer - JSON datasource endpoint for dashboards
 * Serves sources, metrics, data and annotations of the folders under one root directory
 */
package flint.ds;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * HTTP front end of a {@link QueryHandler}.
 *
 * <pre>
 * GET  /&lt;folder&gt;              folder check
 * POST /&lt;folder&gt;/sources      {"type": ...}
 * POST /&lt;folder&gt;/search       {"source": ..., "type": ..., "target": ...}
 * POST /&lt;folder&gt;/query        {"targets": [...]}
 * POST /&lt;folder&gt;/annotations  {"range": {"from": ..., "to": ...}, "annotation": {"query": ...}}
 * </pre>
 *
 * GET and POST are accepted on every route, OPTIONS answers CORS preflight.
 */
public final class WebServer {
	static final int CORS_MAX_AGE = 600;

	private final QueryHandler handler;
	private final Logger logger;
	private final Gson g = new GsonBuilder() //
			.serializeNulls() //
			.create();
	private HttpServer server;

	public WebServer(final QueryHandler handler, final Logger logger) {
		this.handler = handler;
		this.logger = logger;
	}

	/**
	 * Main entry point, options as in {@link DatasourceConfig}
	 */
	public static void main(String[] args) throws Exception {
		final DatasourceConfig config;
		try {
			config = DatasourceConfig.load(args);
		} catch (IllegalArgumentException ex) {
			System.err.println(ex.getMessage());
			System.err.println(DatasourceConfig.usage());
			System.exit(2);
			return;
		}
		if (config.help()) {
			System.out.println(DatasourceConfig.usage());
			return;
		}

		final Logger logger = config.debug() ? new Logger.ConsoleLogger() : new Logger.DefaultLogger(WebServer.class);
		final QueryHandler handler = QueryHandler.create(config, logger);
		final WebServer webserver = new WebServer(handler, logger);
		final InetSocketAddress address = webserver.start(config.addr(), config.port());

		System.out.println(DatasourceConfig.PRODUCT_NAME + " http://" + address.getHostString() + ":" + address.getPort()
				+ " " + config.folder().getCanonicalPath());
	}

	/**
	 * Starts the HTTP server
	 * @param addr bind address
	 * @param port port number, 0 for any free port
	 * @return the bound address
	 * @throws IOException if server cannot be started
	 */
	public InetSocketAddress start(final String addr, final int port) throws IOException {
		server = HttpServer.create(new InetSocketAddress(addr, port), 0);
		server.createContext("/", this::handle);
		server.setExecutor(null);
		server.start();
		return server.getAddress();
	}

	public void stop() {
		if (server != null) {
			server.stop(0);
			server = null;
		}
	}

	void handle(final HttpExchange exchange) throws IOException {
		final IO.StopWatch watch = new IO.StopWatch();
		final String remote = exchange.getRemoteAddress().getAddress().getHostAddress();
		final String method = exchange.getRequestMethod();
		final Headers headers = exchange.getResponseHeaders();
		headers.add("Access-Control-Allow-Origin", "*");

		try (final IO.Closer CLOSER = new IO.Closer()) {
			CLOSER.register(exchange::close);

			if ("OPTIONS".equals(method)) {
				headers.add("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
				headers.add("Access-Control-Allow-Headers", "Content-Type");
				headers.add("Access-Control-Max-Age", String.valueOf(CORS_MAX_AGE));
				exchange.sendResponseHeaders(204, -1);
				LOG(remote, 204, watch, exchange.getRequestURI().toString());
				return;
			}

			final String[] path = segments(exchange.getRequestURI().getPath());
			int status = 200;
			byte[] bb;
			String message = null;
			try {
				final Object result = route(path, exchange);
				if (result instanceof String s) {
					headers.add("Content-Type", "text/plain;charset=UTF-8");
					bb = s.getBytes(StandardCharsets.UTF_8);
				} else {
					headers.add("Content-Type", "application/json;charset=UTF-8");
					bb = g.toJson(result).getBytes(StandardCharsets.UTF_8);
				}
			} catch (DatasourceException ex) {
				status = ex.getErrorCode().getCategory().status();
				message = ex.getMessage();
				bb = error(headers, message);
			} catch (JsonParseException | IllegalStateException ex) {
				status = 400;
				message = ex.getMessage();
				bb = error(headers, message);
			} catch (Exception ex) {
				status = 500;
				message = ex.toString();
				logger.error("%s %s : %s", method, exchange.getRequestURI(), ex);
				bb = error(headers, message);
			}

			exchange.sendResponseHeaders(status, bb.length);
			final OutputStream out = exchange.getResponseBody();
			out.write(bb);
			out.flush();
			LOG(remote, status, watch, exchange.getRequestURI() + (message != null ? "\t" + message : ""));
		}
	}

	/**
	 * Dispatches a request by path
	 * @return a String for text replies, otherwise the JSON result
	 */
	Object route(final String[] path, final HttpExchange exchange) throws IOException {
		if (path.length == 0 || path.length > 2)
			throw new DatasourceException(ErrorCode.INVALID_REQUEST, "unknown route " + exchange.getRequestURI().getPath());

		final String folder = path[0];
		if (path.length == 1) {
			if (!handler.exists(folder))
				throw new DatasourceException(ErrorCode.FOLDER_NOT_FOUND, folder);
			return "CSV datasource for " + folder;
		}

		final JsonObject body = body(exchange);
		switch (path[1]) {
		case "sources":
			return handler.getSources(string(body, "type", "timeseries"), folder);
		case "search":
			handler.getSources("table", folder);
			return handler.getMetrics(string(body, "type", "timeseries"), folder, string(body, "source", ""),
					string(body, "target", ""));
		case "query":
			handler.getSources("table", folder);
			return handler.getData(folder, QueryTarget.targets(body));
		case "annotations":
			return annotations(folder, body);
		default:
			throw new DatasourceException(ErrorCode.INVALID_REQUEST, "unknown route " + exchange.getRequestURI().getPath());
		}
	}

	private Object annotations(final String folder, final JsonObject body) throws IOException {
		final JsonElement annotation = body.get("annotation");
		if (annotation == null || !annotation.isJsonObject())
			throw new DatasourceException(ErrorCode.INVALID_REQUEST, "annotation must be an object");
		final String query = string(annotation.getAsJsonObject(), "query", "");

		long from = Long.MIN_VALUE;
		long to = Long.MAX_VALUE;
		final JsonElement range = body.get("range");
		if (range != null && range.isJsonObject()) {
			final JsonObject r = range.getAsJsonObject();
			if (r.has("from"))
				from = time(r.get("from"));
			if (r.has("to"))
				to = time(r.get("to"));
		}
		return handler.getAnnotations(folder, query, from, to);
	}

	/**
	 * Range bound: epoch milliseconds or an ISO-8601 instant ({@code 2020-01-01T00:00:00.000Z})
	 */
	static long time(final JsonElement e) throws DatasourceException {
		if (e.isJsonPrimitive() && e.getAsJsonPrimitive().isNumber())
			return e.getAsLong();
		final String s = e.getAsString();
		try {
			return Instant.parse(s).toEpochMilli();
		} catch (DateTimeParseException ex) {
			try {
				return Timestamps.parse(s);
			} catch (DatasourceException nested) {
				throw new DatasourceException(ErrorCode.INVALID_REQUEST, "invalid range bound " + s, nested);
			}
		}
	}

	private JsonObject body(final HttpExchange exchange) throws IOException {
		try (final InputStreamReader ir = new InputStreamReader(exchange.getRequestBody(), StandardCharsets.UTF_8)) {
			final JsonElement e = JsonParser.parseReader(ir);
			if (e.isJsonNull())
				return new JsonObject();
			if (!e.isJsonObject())
				throw new DatasourceException(ErrorCode.INVALID_REQUEST, "request body must be an object");
			return e.getAsJsonObject();
		}
	}

	private static String string(final JsonObject o, final String name, final String defaultValue) {
		final JsonElement e = o.get(name);
		if (e == null || e.isJsonNull() || !e.isJsonPrimitive())
			return defaultValue;
		return e.getAsString();
	}

	static String[] segments(final String path) {
		return java.util.Arrays.stream(path.split("/")) //
				.filter(s -> !s.isEmpty()) //
				.toArray(String[]::new);
	}

	private byte[] error(final Headers headers, final String message) {
		headers.set("Content-Type", "application/json;charset=UTF-8");
		final Map<String, Object> m = new LinkedHashMap<>();
		m.put("error", message);
		return g.toJson(m).getBytes(StandardCharsets.UTF_8);
	}

	private void LOG(final String remote, final int status, final IO.StopWatch watch, final String s) {
		logger.log("%s %d\t%dms\t%s", remote, status, watch.elapsed(), s);
	}
}
