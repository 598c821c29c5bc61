package io.xsql.engine.document;

import org.jsoup.parser.Tag;

import java.util.Set;

/**
 * Element categories used by text extraction and markup writing.
 */
public final class HtmlTags {

    private HtmlTags() {
    }

    /**
     * Elements whose body is raw text rather than markup.
     */
    public static final Set<String> RAW_TEXT = Set.of("script", "style");

    /**
     * Phrasing elements whose text counts as the parent's own text in TEXT(tag).
     */
    public static final Set<String> INLINE = Set.of(
            "a", "abbr", "b", "bdi", "bdo", "br", "cite", "code", "data", "dfn",
            "em", "i", "kbd", "mark", "q", "rp", "rt", "ruby", "s", "samp",
            "small", "span", "strong", "sub", "sup", "time", "u", "var", "wbr");

    /**
     * Elements that never have content or an end tag, as jsoup knows them.
     */
    public static boolean isVoid(String tag) {
        return Tag.isKnownTag(tag) && Tag.valueOf(tag).isEmpty();
    }

    public static boolean isRawText(String tag) {
        return RAW_TEXT.contains(tag);
    }

    public static boolean isInline(String tag) {
        return INLINE.contains(tag);
    }
}
