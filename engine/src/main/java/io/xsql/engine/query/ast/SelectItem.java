package io.xsql.engine.query.ast;

import java.util.List;

/**
 * Represents an item in the SELECT list.
 *
 * Every item has a column name: its alias when given, else its canonical text.
 */
public sealed interface SelectItem extends XsqlNode
        permits SelectItem.TagRef, SelectItem.FieldItem, SelectItem.TextItem,
        SelectItem.InnerHtmlItem, SelectItem.CountItem, SelectItem.SummarizeItem,
        SelectItem.TfidfItem, SelectItem.FlattenTextItem {

    /**
     * Result column name.
     */
    String column();

    /**
     * Tag this item anchors on, or null when it applies to any node.
     */
    default String anchorTag() {
        return null;
    }

    default boolean isAggregate() {
        return false;
    }

    /**
     * Bare tag or {@code *}; expands to the node columns.
     */
    record TagRef(String tag) implements SelectItem {
        public static final String ALL = "*";

        public boolean isAll() {
            return ALL.equals(tag);
        }

        @Override
        public String column() {
            return tag;
        }

        @Override
        public String anchorTag() {
            return isAll() ? null : tag;
        }
    }

    /**
     * {@code tag.field}, {@code attributes.name}, one field of {@code tag(f1, f2)},
     * optionally wrapped in TRIM().
     *
     * @param tag null when the prefix is not a tag (attributes, doc, the alias)
     */
    record FieldItem(String tag, FieldRef field, boolean trim, String column) implements SelectItem {
        @Override
        public String anchorTag() {
            return tag;
        }
    }

    /**
     * TEXT(tag) or TRIM(TEXT(tag))
     */
    record TextItem(String tag, boolean trim, String column) implements SelectItem {
        @Override
        public String anchorTag() {
            return tag;
        }
    }

    /**
     * INNER_HTML(tag[, n]), RAW_INNER_HTML(tag[, n]), optionally wrapped in TRIM().
     *
     * @param maxChars null when the markup is not truncated
     * @param raw      true to skip whitespace minification
     */
    record InnerHtmlItem(String tag, Integer maxChars, boolean raw, boolean trim, String column)
            implements SelectItem {
        @Override
        public String anchorTag() {
            return tag;
        }
    }

    /**
     * COUNT(*) or COUNT(tag)
     *
     * @param tag null for COUNT(*)
     */
    record CountItem(String tag, String column) implements SelectItem {
        @Override
        public boolean isAggregate() {
            return true;
        }
    }

    /**
     * SUMMARIZE(*): (tag, count) digest of the candidate set.
     */
    record SummarizeItem() implements SelectItem {
        @Override
        public String column() {
            return "SUMMARIZE(*)";
        }

        @Override
        public boolean isAggregate() {
            return true;
        }
    }

    /**
     * TFIDF(tags | *, ['term', ...], TOP_TERMS=n, MIN_DF=n, MAX_DF=n, STOPWORDS=...)
     *
     * @param tags     empty for {@code *}
     * @param terms    query terms; empty to report the top terms instead of a score
     * @param topTerms null to use the engine default
     * @param maxDf    0 for no upper bound
     */
    record TfidfItem(
            List<String> tags,
            List<String> terms,
            Integer topTerms,
            int minDf,
            int maxDf,
            Stopwords stopwords,
            String column) implements SelectItem {

        public TfidfItem {
            tags = List.copyOf(tags);
            terms = List.copyOf(terms);
        }

        public boolean scoresTerms() {
            return !terms.isEmpty();
        }

        @Override
        public boolean isAggregate() {
            return true;
        }
    }

    /**
     * One output column of {@code FLATTEN_TEXT(tag[, depth]) AS (c1, c2, ...)}:
     * the {@code index}-th descendant text value of the base node.
     *
     * @param tag   base tag; null when the base is the document or its alias
     * @param depth exact descendant depth, or null for every depth with blank
     *              values skipped
     */
    record FlattenTextItem(String tag, Integer depth, int index, String column) implements SelectItem {
        public static final String DEFAULT_COLUMN = "flatten_text";

        @Override
        public String anchorTag() {
            return tag;
        }
    }

    enum Stopwords {
        ENGLISH, NONE
    }
}
