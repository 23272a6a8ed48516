package org.smileyface.riskcrawler.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class CrawlerUtils {

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * SHA-256 of the UTF-8 bytes of {@code text}, lower-case hex. Null input hashes as the empty string.
     */
    public static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Builds an Elasticsearch index name as prefix + "-" + suffix. A blank prefix falls back to "riskcrawler".
     */
    public static String getIndexName(String prefix, String suffix) {
        String p = (prefix == null || prefix.isBlank()) ? "riskcrawler" : prefix.trim().toLowerCase();
        return p + "-" + suffix;
    }

    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            String host = URI.create(url).getHost();
            return host == null ? null : host.toLowerCase();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    // Collapse runs of whitespace (including NBSP) into single spaces
    public static String collapseWhitespace(String input) {
        if (input == null) return "";
        return input.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    public static String truncate(String input, int maxLength) {
        if (input == null) return "";
        if (maxLength <= 0 || input.length() <= maxLength) return input;
        return input.substring(0, maxLength);
    }

    public static double round6(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).doubleValue();
    }

    public static double clamp01(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
