package flint.ds;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Source registry")
class TestcaseSourceRegistry {

    @TempDir
    File root;

    private SourceRegistry registry() {
        return new SourceRegistry(root, List.of("csv"), new Logger.NullLogger());
    }

    @Test
    @DisplayName("list - supported files only, sorted by name")
    void testList() throws Exception {
        final File folder = new File(root, "risk");
        CsvFixtures.write(folder, "b.csv", CsvFixtures.PORTFOLIO);
        CsvFixtures.write(folder, "a.csv", CsvFixtures.PORTFOLIO);
        CsvFixtures.gzip(folder, "c.csv.gz", CsvFixtures.PORTFOLIO);
        CsvFixtures.write(folder, "readme.txt", "not a source");
        new File(folder, "nested.csv").mkdirs();

        final SourceRegistry registry = registry();
        assertEquals(List.of("a.csv", "b.csv", "c.csv.gz"), registry.list("risk", "timeseries"));
        assertEquals(List.of("a.csv", "b.csv", "c.csv.gz"), registry.list("risk", "table"));
        assertTrue(registry.exists("risk"));
        assertFalse(registry.exists("credit"));
    }

    @Test
    @DisplayName("resolve - readers are cached per folder and name")
    void testResolve() throws Exception {
        CsvFixtures.write(new File(root, "one"), "p.csv", CsvFixtures.PORTFOLIO);
        CsvFixtures.write(new File(root, "two"), "p.csv", "id,score\n1,2\n");

        final SourceRegistry registry = registry();
        assertEquals(ErrorCode.SOURCE_NOT_FOUND,
                assertThrows(DatasourceException.class, () -> registry.resolve("one", "p.csv")).getErrorCode());

        registry.list("one", null);
        registry.list("two", null);
        final SourceReader one = registry.resolve("one", "p.csv");
        final SourceReader two = registry.resolve("two", "p.csv");
        assertNotSame(one, two);
        assertEquals("date", one.indexColumn());
        assertNull(two.indexColumn());

        registry.list("one", null);
        assertSame(one, registry.resolve("one", "p.csv"));
    }

    @Test
    @DisplayName("a file that fails to open stays listed and reports its error on resolve")
    void testFailedOpen() throws Exception {
        final File folder = new File(root, "risk");
        CsvFixtures.write(folder, "broken.csv", "");
        CsvFixtures.write(folder, "ok.csv", CsvFixtures.PORTFOLIO);

        final SourceRegistry registry = registry();
        assertEquals(List.of("broken.csv", "ok.csv"), registry.list("risk", null));
        final DatasourceException ex = assertThrows(DatasourceException.class, () -> registry.resolve("risk", "broken.csv"));
        assertTrue(ex.isErrorCode(ErrorCode.EMPTY_FILE));

        // fixed on disk, picked up by the next enumeration
        CsvFixtures.write(folder, "broken.csv", CsvFixtures.PORTFOLIO);
        registry.list("risk", null);
        assertEquals("date", registry.resolve("risk", "broken.csv").indexColumn());
    }

    @Test
    @DisplayName("missing folders and names escaping the root are not found")
    void testFolderNotFound() {
        final SourceRegistry registry = registry();
        assertEquals(ErrorCode.FOLDER_NOT_FOUND,
                assertThrows(DatasourceException.class, () -> registry.list("missing", null)).getErrorCode());
        assertThrows(DatasourceException.class, () -> registry.list("..", null));
        assertFalse(registry.exists("../etc"));
    }
}
