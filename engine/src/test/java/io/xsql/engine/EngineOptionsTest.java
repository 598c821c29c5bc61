package io.xsql.engine;

import org.junit.jupiter.api.*;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Engine Options Tests")
class EngineOptionsTest {

    @Test
    @DisplayName("Unset settings fall back to defaults")
    void defaults() {
        EngineOptions options = EngineOptions.fromLookup(name -> null);

        assertEquals(EngineOptions.defaults(), options);
        assertEquals(EngineOptions.DEFAULT_MAX_LIMIT, options.maxLimit());
    }

    @Test
    @DisplayName("Settings override defaults")
    void overrides() {
        Map<String, String> env = Map.of(
                "XSQL_MAX_LIMIT", "50",
                "XSQL_MAX_FRAGMENT_BYTES", " 4096 ",
                "XSQL_TFIDF_TOP_TERMS", "");

        EngineOptions options = EngineOptions.fromLookup(env::get);

        assertEquals(50, options.maxLimit());
        assertEquals(4096L, options.maxFragmentBytes());
        assertEquals(EngineOptions.DEFAULT_TOP_TERMS, options.defaultTopTerms());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void invalidValues() {
        IllegalArgumentException notNumber = assertThrows(IllegalArgumentException.class,
                () -> EngineOptions.fromLookup(Map.of("XSQL_MAX_LIMIT", "lots")::get));
        assertTrue(notNumber.getMessage().contains("XSQL_MAX_LIMIT"));

        assertThrows(IllegalArgumentException.class,
                () -> EngineOptions.fromLookup(Map.of("XSQL_MAX_REGEX_LENGTH", "0")::get));
    }

    @Test
    @DisplayName("Environment names map to dotted property names")
    void propertyName() {
        assertEquals("xsql.max-limit", EngineOptions.propertyName("XSQL_MAX_LIMIT"));
        assertEquals("xsql.tfidf-top-terms", EngineOptions.propertyName("XSQL_TFIDF_TOP_TERMS"));
    }

    @Nested
    @DisplayName("System properties")
    class SystemProperties {

        @AfterEach
        void tearDown() {
            System.clearProperty("xsql.max-limit");
        }

        @Test
        @DisplayName("System property wins")
        void systemProperty() {
            System.setProperty("xsql.max-limit", "7");
            assertEquals(7, EngineOptions.fromEnvironment().maxLimit());
        }
    }
}
