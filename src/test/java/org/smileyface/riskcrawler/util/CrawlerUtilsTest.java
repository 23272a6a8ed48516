package org.smileyface.riskcrawler.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CrawlerUtilsTest {

    /**
     * Known digest of the empty string; null hashes the same way.
     */
    @Test
    void testSha256HexOfEmptyAndNull() {
        String empty = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
        assertEquals(empty, CrawlerUtils.sha256Hex(""));
        assertEquals(empty, CrawlerUtils.sha256Hex(null));
    }

    @Test
    void testSha256HexIsStable() {
        assertEquals(CrawlerUtils.sha256Hex("send bank details"), CrawlerUtils.sha256Hex("send bank details"));
        assertEquals(64, CrawlerUtils.sha256Hex("x").length());
    }

    @Test
    void testGetIndexName() {
        assertEquals("riskcrawler-targets", CrawlerUtils.getIndexName("riskcrawler", "targets"));
        assertEquals("test-verdicts", CrawlerUtils.getIndexName(" Test ", "verdicts"));
        assertEquals("riskcrawler-feedback", CrawlerUtils.getIndexName("  ", "feedback"));
        assertEquals("riskcrawler-feedback", CrawlerUtils.getIndexName(null, "feedback"));
    }

    @Test
    void testHostOf() {
        assertEquals("example.com", CrawlerUtils.hostOf("https://Example.com/a/b"));
        assertNull(CrawlerUtils.hostOf("not a url"));
        assertNull(CrawlerUtils.hostOf(null));
    }

    /**
     * Tabs, newlines and non-breaking spaces collapse to single spaces.
     */
    @Test
    void testCollapseWhitespace() {
        assertEquals("a b c", CrawlerUtils.collapseWhitespace("  a\t\nb  c  "));
        assertEquals("", CrawlerUtils.collapseWhitespace(null));
    }

    @Test
    void testTruncate() {
        assertEquals("abc", CrawlerUtils.truncate("abcdef", 3));
        assertEquals("abc", CrawlerUtils.truncate("abc", 10));
        assertEquals("abcdef", CrawlerUtils.truncate("abcdef", 0));
        assertEquals("", CrawlerUtils.truncate(null, 3));
    }

    @Test
    void testRound6() {
        assertEquals(0.75, CrawlerUtils.round6(0.7499999999999999));
        assertEquals(0.123457, CrawlerUtils.round6(0.1234565));
        assertEquals(1.0, CrawlerUtils.round6(1.0));
    }

    @Test
    void testClamp01() {
        assertEquals(0.0, CrawlerUtils.clamp01(-0.2));
        assertEquals(1.0, CrawlerUtils.clamp01(1.7));
        assertEquals(0.4, CrawlerUtils.clamp01(0.4));
        assertEquals(0.0, CrawlerUtils.clamp01(Double.NaN));
    }
}
