package io.xsql.engine;

import java.util.Locale;
import java.util.function.Function;

/**
 * Guardrails and defaults for query execution.
 *
 * Environment variables (system properties of the same name in lower-case
 * dotted form, e.g. {@code xsql.max-limit}, take precedence):
 * - XSQL_MAX_LIMIT: largest LIMIT accepted
 * - XSQL_MAX_RAW_HTML_BYTES: largest RAW() / FRAGMENTS(RAW()) input
 * - XSQL_MAX_FRAGMENT_COUNT: most fragments a FRAGMENTS subquery may yield
 * - XSQL_MAX_FRAGMENT_BYTES: total fragment markup size
 * - XSQL_MAX_REGEX_LENGTH: longest pattern accepted by {@code ~}
 * - XSQL_TFIDF_TOP_TERMS: TOP_TERMS used when TFIDF() does not name one
 */
public record EngineOptions(
        int maxLimit,
        int maxRawHtmlBytes,
        int maxFragmentCount,
        long maxFragmentBytes,
        int maxRegexLength,
        int defaultTopTerms) {

    public static final int DEFAULT_MAX_LIMIT = 100_000;
    public static final int DEFAULT_MAX_RAW_HTML_BYTES = 10 * 1024 * 1024;
    public static final int DEFAULT_MAX_FRAGMENT_COUNT = 10_000;
    public static final long DEFAULT_MAX_FRAGMENT_BYTES = 50L * 1024 * 1024;
    public static final int DEFAULT_MAX_REGEX_LENGTH = 1024;
    public static final int DEFAULT_TOP_TERMS = 30;

    public EngineOptions {
        requirePositive("maxLimit", maxLimit);
        requirePositive("maxRawHtmlBytes", maxRawHtmlBytes);
        requirePositive("maxFragmentCount", maxFragmentCount);
        requirePositive("maxFragmentBytes", maxFragmentBytes);
        requirePositive("maxRegexLength", maxRegexLength);
        requirePositive("defaultTopTerms", defaultTopTerms);
    }

    public static EngineOptions defaults() {
        return new EngineOptions(
                DEFAULT_MAX_LIMIT,
                DEFAULT_MAX_RAW_HTML_BYTES,
                DEFAULT_MAX_FRAGMENT_COUNT,
                DEFAULT_MAX_FRAGMENT_BYTES,
                DEFAULT_MAX_REGEX_LENGTH,
                DEFAULT_TOP_TERMS);
    }

    /**
     * Reads options from system properties and the environment, falling back
     * to {@link #defaults()} for anything unset.
     */
    public static EngineOptions fromEnvironment() {
        return fromLookup(name -> {
            String property = System.getProperty(propertyName(name));
            return property != null ? property : System.getenv(name);
        });
    }

    static EngineOptions fromLookup(Function<String, String> lookup) {
        return new EngineOptions(
                intSetting(lookup, "XSQL_MAX_LIMIT", DEFAULT_MAX_LIMIT),
                intSetting(lookup, "XSQL_MAX_RAW_HTML_BYTES", DEFAULT_MAX_RAW_HTML_BYTES),
                intSetting(lookup, "XSQL_MAX_FRAGMENT_COUNT", DEFAULT_MAX_FRAGMENT_COUNT),
                longSetting(lookup, "XSQL_MAX_FRAGMENT_BYTES", DEFAULT_MAX_FRAGMENT_BYTES),
                intSetting(lookup, "XSQL_MAX_REGEX_LENGTH", DEFAULT_MAX_REGEX_LENGTH),
                intSetting(lookup, "XSQL_TFIDF_TOP_TERMS", DEFAULT_TOP_TERMS));
    }

    public EngineOptions withMaxLimit(int limit) {
        return new EngineOptions(limit, maxRawHtmlBytes, maxFragmentCount, maxFragmentBytes,
                maxRegexLength, defaultTopTerms);
    }

    public EngineOptions withMaxFragmentCount(int count) {
        return new EngineOptions(maxLimit, maxRawHtmlBytes, count, maxFragmentBytes,
                maxRegexLength, defaultTopTerms);
    }

    public EngineOptions withMaxRawHtmlBytes(int bytes) {
        return new EngineOptions(maxLimit, bytes, maxFragmentCount, maxFragmentBytes,
                maxRegexLength, defaultTopTerms);
    }

    // XSQL_MAX_LIMIT -> xsql.max-limit
    static String propertyName(String envName) {
        String lower = envName.toLowerCase(Locale.ROOT);
        int first = lower.indexOf('_');
        return lower.substring(0, first) + "." + lower.substring(first + 1).replace('_', '-');
    }

    private static int intSetting(Function<String, String> lookup, String name, int fallback) {
        String raw = lookup.apply(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + raw, e);
        }
    }

    private static long longSetting(Function<String, String> lookup, String name, long fallback) {
        String raw = lookup.apply(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + name + ": " + raw, e);
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }
}
