package flint.ds;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Date index parsing")
class TestcaseTimestamps {
    private static final long DAY = 86_400_000L;
    private static final long HOUR = 3_600_000L;

    @Test
    @DisplayName("isDateLike - indicators match case-insensitively")
    void testDateLike() {
        assertTrue(Timestamps.isDateLike("date"));
        assertTrue(Timestamps.isDateLike("Report_Date"));
        assertTrue(Timestamps.isDateLike("Дата отчета"));
        assertTrue(Timestamps.isDateLike("open_dt"));
        assertFalse(Timestamps.isDateLike("pd"));
        assertFalse(Timestamps.isDateLike("id"));
        assertFalse(Timestamps.isDateLike(null));
    }

    @Test
    @DisplayName("parse - supported layouts are read as UTC")
    void testParse() throws Exception {
        assertEquals(CsvFixtures.JAN, Timestamps.parse("2020-01"));
        assertEquals(CsvFixtures.JAN, Timestamps.parse("2020-01-01"));
        assertEquals(CsvFixtures.JAN, Timestamps.parse("2020/01/01"));
        assertEquals(CsvFixtures.JAN, Timestamps.parse("01.01.2020"));
        assertEquals(CsvFixtures.JAN, Timestamps.parse("01/01/2020"));
        assertEquals(CsvFixtures.JAN, Timestamps.parse("20200101"));
        assertEquals(CsvFixtures.JAN + 90_000L, Timestamps.parse("2020-01-01 00:01:30"));
        assertEquals(CsvFixtures.JAN + 60_000L, Timestamps.parse("2020-01-01T00:01"));
        assertEquals(CsvFixtures.JAN + 123L, Timestamps.parse("2020-01-01 00:00:00.123"));
        assertEquals(CsvFixtures.JAN, Timestamps.parse("2020-01-01T03:00:00+03:00"));
    }

    @Test
    @DisplayName("parse - unpadded days and months, day-first timestamps")
    void testParseUnpadded() throws Exception {
        assertEquals(CsvFixtures.JAN + 14 * DAY, Timestamps.parse("1/15/2020"));
        assertEquals(CsvFixtures.JAN + 4 * DAY, Timestamps.parse("2020-1-5"));
        assertEquals(CsvFixtures.JAN + 4 * DAY, Timestamps.parse("2020/1/5"));
        assertEquals(CsvFixtures.JAN + 4 * DAY, Timestamps.parse("5.1.2020"));
        assertEquals(CsvFixtures.JAN + 14 * DAY + 10 * HOUR, Timestamps.parse("15.01.2020 10:00"));
        assertEquals(CsvFixtures.JAN + 14 * DAY + 10 * HOUR + 30_000L, Timestamps.parse("1/15/2020 10:00:30"));
        assertEquals(CsvFixtures.JAN + 9 * HOUR, Timestamps.parse("2020-01-01 9:00"));
    }

    @Test
    @DisplayName("parse - fractions of any precision and offsets after the time")
    void testParseFractionsAndOffsets() throws Exception {
        final long t = CsvFixtures.JAN + 14 * DAY + 10 * HOUR;
        assertEquals(t + 120L, Timestamps.parse("2020-01-15 10:00:00.12"));
        assertEquals(t + 123L, Timestamps.parse("2020-01-15 10:00:00.123456"));
        assertEquals(t + 123L, Timestamps.parse("2020-01-15T10:00:00.123456789"));
        assertEquals(t - 3 * HOUR, Timestamps.parse("2020-01-15 10:00:00+03:00"));
        assertEquals(t - 3 * HOUR, Timestamps.parse("2020-01-15 10:00:00 +03:00"));
        assertEquals(t, Timestamps.parse("2020-01-15T10:00:00Z"));
        assertEquals(t + 2 * HOUR, Timestamps.parse("2020-01-15 10:00-02:00"));
    }

    @Test
    @DisplayName("parse - text that is not a date is a format error")
    void testParseFails() {
        final DatasourceException ex = assertThrows(DatasourceException.class, () -> Timestamps.parse("yesterday"));
        assertEquals(ErrorCode.INVALID_DATE, ex.getErrorCode());
        assertThrows(DatasourceException.class, () -> Timestamps.parse("2020-13-01"));
        assertThrows(DatasourceException.class, () -> Timestamps.parse("2020-02-30"));
        assertThrows(DatasourceException.class, () -> Timestamps.parse("15/31/2020"));
        assertThrows(DatasourceException.class, () -> Timestamps.parse("2020-01-15 10:00:00 tomorrow"));
        assertThrows(DatasourceException.class, () -> Timestamps.parse(null));
    }
}
