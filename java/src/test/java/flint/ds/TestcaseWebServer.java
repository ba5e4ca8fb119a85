package flint.ds;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@DisplayName("HTTP endpoint")
class TestcaseWebServer {

    @TempDir
    File root;

    private WebServer server;
    private String base;

    @BeforeEach
    void start() throws Exception {
        CsvFixtures.write(new File(root, "risk"), "portfolio.csv", CsvFixtures.PORTFOLIO);
        CsvFixtures.write(new File(root, "risk"), "events.csv", "date,title\n2020-01-01,release\n2020-02-01,outage\n");
        final Logger logger = new Logger.NullLogger();
        server = new WebServer(new QueryHandler(new SourceRegistry(root, List.of("csv"), logger), new MetricEngine(logger), logger), logger);
        final InetSocketAddress address = server.start("127.0.0.1", 0);
        base = "http://127.0.0.1:" + address.getPort();
    }

    @AfterEach
    void stop() {
        server.stop();
    }

    private static final class Reply {
        final int status;
        final String body;
        final HttpURLConnection connection;

        Reply(final int status, final String body, final HttpURLConnection connection) {
            this.status = status;
            this.body = body;
            this.connection = connection;
        }

        JsonElement json() {
            return JsonParser.parseString(body);
        }
    }

    private Reply call(final String method, final String path, final String body) throws IOException {
        final HttpURLConnection c = (HttpURLConnection) new URL(base + path).openConnection();
        c.setRequestMethod(method);
        if (body != null) {
            c.setDoOutput(true);
            c.setRequestProperty("Content-Type", "application/json");
            try (OutputStream out = c.getOutputStream()) {
                out.write(body.getBytes(StandardCharsets.UTF_8));
            }
        }
        final int status = c.getResponseCode();
        final InputStream in = status >= 400 ? c.getErrorStream() : c.getInputStream();
        String text = "";
        if (in != null) {
            try (in) {
                text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new Reply(status, text, c);
    }

    @Test
    @DisplayName("folder check answers 200 for existing folders and 404 otherwise")
    void testFolderCheck() throws Exception {
        final Reply ok = call("GET", "/risk", null);
        assertEquals(200, ok.status);
        assertTrue(ok.body.contains("risk"));
        assertEquals("*", ok.connection.getHeaderField("Access-Control-Allow-Origin"));

        assertEquals(200, call("GET", "/risk/", null).status);

        final Reply missing = call("GET", "/credit", null);
        assertEquals(404, missing.status);
        assertTrue(missing.json().getAsJsonObject().get("error").getAsString().contains("credit"));
    }

    @Test
    @DisplayName("sources and search")
    void testSourcesAndSearch() throws Exception {
        final JsonArray sources = call("POST", "/risk/sources", "{\"type\": \"timeseries\"}").json().getAsJsonArray();
        assertEquals(2, sources.size());
        assertEquals("events.csv", sources.get(0).getAsString());

        final JsonArray metrics = call("POST", "/risk/search", "{\"source\": \"portfolio.csv\", \"target\": \"pd\"}").json().getAsJsonArray();
        assertEquals("special:agreement_count", metrics.get(0).getAsString());
        assertEquals("pd", metrics.get(4).getAsString());
        assertEquals(5, metrics.size());

        assertEquals(0, call("POST", "/risk/search", "{\"source\": \"select source\"}").json().getAsJsonArray().size());
        assertEquals(404, call("POST", "/risk/search", "{\"source\": \"nope.csv\"}").status);
    }

    @Test
    @DisplayName("query answers targets in order with in-place compute errors")
    void testQuery() throws Exception {
        final Reply reply = call("POST", "/risk/query", "{\"targets\": ["
                + "{\"source\": \"portfolio.csv\", \"target\": \"special:agreement_count\"},"
                + "{\"source\": \"portfolio.csv\", \"target\": \"special:unknown\"},"
                + "{\"source\": \"portfolio.csv\", \"target\": \"special:avg_PD\", \"type\": \"table\"}]}");
        assertEquals(200, reply.status);
        final JsonArray a = reply.json().getAsJsonArray();
        assertEquals(3, a.size());

        final JsonObject count = a.get(0).getAsJsonObject();
        assertEquals("agreement_count", count.get("target").getAsString());
        final JsonArray first = count.get("datapoints").getAsJsonArray().get(0).getAsJsonArray();
        assertEquals(3, first.get(0).getAsInt());
        assertEquals(CsvFixtures.JAN, first.get(1).getAsLong());

        assertEquals(ErrorCode.UNKNOWN_METRIC.getCode(), a.get(1).getAsJsonObject().get("code").getAsInt());
        assertEquals("table", a.get(2).getAsJsonObject().get("type").getAsString());
    }

    @Test
    @DisplayName("status mapping: rejected requests 400, unknown sources 404")
    void testErrors() throws Exception {
        assertEquals(400, call("POST", "/risk/query", "{\"targets\": 1}").status);
        assertEquals(400, call("POST", "/risk/query", "{not json").status);
        assertEquals(400, call("POST", "/risk/unknown", "{}").status);
        assertEquals(404, call("POST", "/risk/query", "{\"targets\": [{\"source\": \"nope.csv\", \"target\": \"pd\"}]}").status);
        assertEquals(404, call("POST", "/credit/sources", "{}").status);
    }

    @Test
    @DisplayName("annotations with an ISO range")
    void testAnnotations() throws Exception {
        final JsonArray a = call("POST", "/risk/annotations", "{\"range\": {\"from\": \"2020-01-15T00:00:00.000Z\", "
                + "\"to\": \"2020-03-01T00:00:00.000Z\"}, \"annotation\": {\"query\": \"source:events.csv\"}}").json().getAsJsonArray();
        assertEquals(1, a.size());
        assertEquals("outage", a.get(0).getAsJsonObject().get("title").getAsString());
        assertEquals(CsvFixtures.FEB, a.get(0).getAsJsonObject().get("time").getAsLong());

        assertEquals(400, call("POST", "/risk/annotations", "{\"annotation\": {\"query\": \"events.csv\"}}").status);
        assertEquals(404, call("POST", "/risk/annotations", "{\"annotation\": {\"query\": \"sql:x\"}}").status);
    }

    @Test
    @DisplayName("CORS preflight")
    void testPreflight() throws Exception {
        final Reply reply = call("OPTIONS", "/risk/query", null);
        assertEquals(204, reply.status);
        assertEquals("*", reply.connection.getHeaderField("Access-Control-Allow-Origin"));
        assertTrue(reply.connection.getHeaderField("Access-Control-Allow-Methods").contains("POST"));
    }

    @Test
    @DisplayName("range bounds accept epoch millis and ISO instants")
    void testTime() throws Exception {
        assertEquals(CsvFixtures.JAN, WebServer.time(JsonParser.parseString("1577836800000")));
        assertEquals(CsvFixtures.JAN, WebServer.time(JsonParser.parseString("\"2020-01-01T00:00:00Z\"")));
        assertEquals(CsvFixtures.JAN, WebServer.time(JsonParser.parseString("\"2020-01-01\"")));
        assertEquals(ErrorCode.INVALID_REQUEST, assertThrows(DatasourceException.class,
                () -> WebServer.time(JsonParser.parseString("\"now-6h\""))).getErrorCode());
        assertArrayEquals(new String[] { "risk", "query" }, WebServer.segments("/risk//query/"));
    }
}
