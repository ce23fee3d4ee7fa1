package de.bsommerfeld.catalogcrawler.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParseResultTest {

    @Test
    void parsed_shouldExposeValue() {
        ParseResult<String> result = ParseResult.parsed("ok");

        assertTrue(result.isParsed());
        assertEquals("ok", result.value().orElseThrow());
        assertTrue(result.reason().isEmpty());
    }

    @Test
    void skipped_shouldExposeReason() {
        ParseResult<String> result = ParseResult.skipped("missing title");

        assertFalse(result.isParsed());
        assertTrue(result.value().isEmpty());
        assertEquals("missing title", result.reason().orElseThrow());
        assertEquals("Skipped[missing title]", result.toString());
    }

    @Test
    void parsed_shouldRejectNull() {
        assertThrows(NullPointerException.class, () -> ParseResult.parsed(null));
    }

    @Test
    void syncResult_emptyShouldHaveNoFailures() {
        SyncResult result = SyncResult.empty();

        assertEquals(0, result.delivered());
        assertTrue(result.failedTitles().isEmpty());
        assertFalse(result.degraded());
    }
}
