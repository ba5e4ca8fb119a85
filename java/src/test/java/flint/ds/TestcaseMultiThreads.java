package flint.ds;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Concurrent requests alternating index overrides on one reader
 */
@DisplayName("Concurrent rebuilds")
class TestcaseMultiThreads {

    @TempDir
    File dir;

    @Test
    @DisplayName("every request sees a whole table built for its own index")
    void testAlternatingOverrides() throws Exception {
        final StringBuilder s = new StringBuilder("date,id,pd,segment\n");
        for (int i = 0; i < 2000; i++)
            s.append(String.format("2020-%02d-01,%d,0.%d,%s\n", i % 12 + 1, i, i % 10, i % 2 == 0 ? "retail" : "corporate"));
        final CSVSourceReader reader = CSVSourceReader.open(CsvFixtures.write(dir, "big.csv", s.toString()));
        final MetricEngine engine = new MetricEngine(new Logger.NullLogger());

        final QueryOptions byDate = new QueryOptions(IndexChoice.column("date"), false);
        final QueryOptions bySegment = new QueryOptions(IndexChoice.column("segment"), false);

        final ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            final List<Future<Frame>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                final QueryOptions options = i % 2 == 0 ? byDate : bySegment;
                futures.add(pool.submit((Callable<Frame>) () -> engine.compute("agreement_count", reader, options)));
            }
            for (int i = 0; i < futures.size(); i++) {
                final Frame f = futures.get(i).get(60, TimeUnit.SECONDS);
                final Series count = f.series(0);
                long total = 0;
                for (int k = 0; k < count.size(); k++)
                    total += (Long) count.value(k);
                assertEquals(2000L, total);
                if (i % 2 == 0) {
                    assertTrue(f.isTime());
                    assertEquals(12, count.size());
                } else {
                    assertFalse(f.isTime());
                    assertEquals(List.of("corporate", "retail"), List.of(count.keys()));
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
