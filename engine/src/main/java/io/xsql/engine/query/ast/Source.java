package io.xsql.engine.query.ast;

import java.util.Locale;

/**
 * The FROM clause of a SELECT.
 */
public sealed interface Source extends XsqlNode
        permits Source.Document, Source.Path, Source.Raw, Source.Fragments, Source.AliasRef {

    /**
     * Name this source binds, or null.
     */
    String alias();

    /**
     * {@code document} / {@code doc} [AS alias]: the input tree.
     */
    record Document(String alias) implements Source {
    }

    /**
     * 'file.html' [AS alias]: a local file.
     */
    record Path(String location, String alias) implements Source {
        public boolean isUrl() {
            String lower = location.toLowerCase(Locale.ROOT);
            return lower.startsWith("http://") || lower.startsWith("https://");
        }
    }

    /**
     * RAW('&lt;html&gt;') [AS alias]: inline markup.
     */
    record Raw(String html, String alias) implements Source {
    }

    /**
     * FRAGMENTS(RAW('...') | SELECT ...) [AS alias]
     *
     * Exactly one of {@code raw} and {@code query} is set.
     */
    record Fragments(Raw raw, SelectQuery query, String alias) implements Source {
        public boolean isSubquery() {
            return query != null;
        }
    }

    /**
     * A bare name referring to a source bound earlier.
     */
    record AliasRef(String name) implements Source {
        @Override
        public String alias() {
            return null;
        }
    }
}
