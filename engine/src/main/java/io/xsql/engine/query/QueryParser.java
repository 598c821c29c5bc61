package io.xsql.engine.query;

import io.xsql.engine.query.ast.Axis;
import io.xsql.engine.query.ast.CompareOp;
import io.xsql.engine.query.ast.DescribeQuery;
import io.xsql.engine.query.ast.Expression;
import io.xsql.engine.query.ast.FieldRef;
import io.xsql.engine.query.ast.Literal;
import io.xsql.engine.query.ast.Operand;
import io.xsql.engine.query.ast.OrderSpec;
import io.xsql.engine.query.ast.OutputTarget;
import io.xsql.engine.query.ast.Query;
import io.xsql.engine.query.ast.SelectItem;
import io.xsql.engine.query.ast.SelectQuery;
import io.xsql.engine.query.ast.ShowQuery;
import io.xsql.engine.query.ast.Source;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

import static io.xsql.engine.query.Token.*;

/**
 * Recursive descent parser for XSQL statements.
 *
 * Uses check()/consumeIf() for lookahead and lexer SavePoints where a
 * production needs more than one token to decide (function calls,
 * HAS_DIRECT_TEXT). A statement either parses completely or fails with a
 * {@link QueryParseException}; no partial AST escapes.
 */
public final class QueryParser {

    /**
     * Columns a tag-only SELECT produces; the only names EXCLUDE accepts.
     */
    public static final List<String> NODE_COLUMNS = List.of(
            "node_id", "tag", "attributes", "parent_id", "max_depth", "doc_order", "source_uri");

    private final Lexer lexer;

    // Names that may prefix a WHERE operand in the statement being parsed
    private Set<String> qualifiers = Set.of();

    public QueryParser(String query) {
        this.lexer = new Lexer(query);
    }

    /**
     * Parses one statement, optionally terminated by ';'.
     */
    public static Query parse(String query) {
        return new QueryParser(query).parseStatement();
    }

    public Query parseStatement() {
        Query query;
        if (check(SELECT)) {
            query = parseSelect();
        } else if (check(SHOW)) {
            query = parseShow();
        } else if (check(DESCRIBE)) {
            query = parseDescribe();
        } else {
            throw error("SELECT, SHOW or DESCRIBE");
        }
        consumeIf(SEMICOLON);
        if (!check(EOF)) {
            throw error(EOF.describe());
        }
        return query;
    }

    // ==================== Token Helpers ====================

    private Token current() {
        return lexer.token();
    }

    private String stringVal() {
        return lexer.stringVal();
    }

    private boolean check(Token t) {
        return current() == t;
    }

    private void advance() {
        lexer.nextToken();
    }

    private boolean consumeIf(Token t) {
        if (check(t)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(Token t) {
        if (!check(t)) {
            throw error(t.describe());
        }
        advance();
    }

    private boolean checkName() {
        return check(IDENTIFIER) || current().isKeyword();
    }

    /**
     * True when the current token is the given word, keyword or not.
     */
    private boolean checkWord(String word) {
        return checkName() && stringVal().equalsIgnoreCase(word);
    }

    private boolean consumeWord(String word) {
        if (checkWord(word)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Tag, field and attribute names; keywords are allowed (e.g. {@code table}).
     */
    private String expectName(String what) {
        if (checkName()) {
            String val = stringVal();
            advance();
            return val;
        }
        throw error(what);
    }

    private String expectString(String what) {
        if (!check(STRING)) {
            throw error(what);
        }
        String val = stringVal();
        advance();
        return val;
    }

    private int expectInteger(String what) {
        if (!check(INTEGER)) {
            throw error(what);
        }
        int val;
        try {
            val = Integer.parseInt(stringVal());
        } catch (NumberFormatException e) {
            throw error(what);
        }
        advance();
        return val;
    }

    private QueryParseException error(String expected) {
        String found = lexer.describe();
        return new QueryParseException("Expected " + expected + ", found " + found,
                lexer.tokenPos(), expected, found);
    }

    private QueryParseException invalid(String message, int position, String expected, String found) {
        return new QueryParseException(message, position, expected, found);
    }

    // ==================== List Parsing ====================

    private <T> List<T> parseList(Supplier<T> parser) {
        List<T> items = new ArrayList<>();
        do {
            items.add(parser.get());
        } while (consumeIf(COMMA));
        return items;
    }

    // ==================== SELECT Statement ====================

    private SelectQuery parseSelect() {
        int start = lexer.tokenPos();
        expect(SELECT);

        List<SelectItem> items = parseSelectList();

        List<String> exclude = List.of();
        if (check(EXCLUDE)) {
            int pos = lexer.tokenPos();
            advance();
            if (!(items.size() == 1 && items.get(0) instanceof SelectItem.TagRef ref && ref.isAll())) {
                throw invalid("EXCLUDE requires SELECT *", pos, "SELECT *", "EXCLUDE");
            }
            exclude = parseExcludeList();
        }

        expect(FROM);
        Source source = parseSource();
        items = unanchorQualifiedItems(items, source);

        Set<String> outer = qualifiers;
        qualifiers = qualifiersFor(items, source);
        Expression where = null;
        try {
            if (consumeIf(WHERE)) {
                where = parseExpression();
            }
        } finally {
            qualifiers = outer;
        }

        List<OrderSpec> orderBy = List.of();
        if (consumeIf(ORDER)) {
            expect(BY);
            orderBy = parseList(this::parseOrderSpec);
        }

        Integer limit = null;
        if (check(LIMIT)) {
            advance();
            int pos = lexer.tokenPos();
            limit = expectInteger("LIMIT count");
            if (limit < 0) {
                throw invalid("LIMIT must be non-negative", pos, "non-negative integer", String.valueOf(limit));
            }
        }

        OutputTarget output = null;
        if (check(TO)) {
            int pos = lexer.tokenPos();
            advance();
            output = parseOutputTarget();
            if (output instanceof OutputTarget.ToList) {
                requireSingleColumn(items, pos);
            }
        }

        if (items.stream().anyMatch(i -> i instanceof SelectItem.SummarizeItem) && items.size() > 1) {
            throw invalid("SUMMARIZE(*) cannot be combined with other select items", start,
                    "SUMMARIZE(*) alone", items.size() + " select items");
        }

        long flattenBases = items.stream()
                .filter(i -> i instanceof SelectItem.FlattenTextItem flatten && flatten.index() == 0)
                .count();
        if (flattenBases > 1) {
            throw invalid("Only one FLATTEN_TEXT() is allowed per SELECT", start,
                    "one FLATTEN_TEXT()", flattenBases + " FLATTEN_TEXT() items");
        }
        if (flattenBases == 1 && items.stream().anyMatch(SelectItem::isAggregate)) {
            throw invalid("FLATTEN_TEXT() cannot be combined with aggregates", start,
                    "FLATTEN_TEXT() with field projections", "aggregate select item");
        }

        return new SelectQuery(items, exclude, source, where, orderBy, limit, output);
    }

    private void requireSingleColumn(List<SelectItem> items, int pos) {
        boolean single = items.size() == 1
                && !(items.get(0) instanceof SelectItem.TagRef)
                && !(items.get(0) instanceof SelectItem.SummarizeItem);
        if (!single) {
            throw invalid("TO LIST() requires a single projected column", pos,
                    "single projected column", items.size() + " select items");
        }
    }

    private List<String> parseExcludeList() {
        boolean parenthesized = consumeIf(LPAREN);
        List<String> fields = parseList(() -> {
            int pos = lexer.tokenPos();
            String field = expectName("column to exclude").toLowerCase(Locale.ROOT);
            if (!NODE_COLUMNS.contains(field)) {
                throw invalid("Cannot EXCLUDE unknown column: " + field, pos,
                        "one of " + NODE_COLUMNS, field);
            }
            return field;
        });
        if (parenthesized) {
            expect(RPAREN);
        }
        return fields;
    }

    // ==================== SELECT List ====================

    private List<SelectItem> parseSelectList() {
        List<SelectItem> items = new ArrayList<>();
        Boolean tagOnly = null;
        do {
            int pos = lexer.tokenPos();
            List<SelectItem> parsed = parseSelectItem();
            boolean isTag = parsed.get(0) instanceof SelectItem.TagRef;
            if (tagOnly == null) {
                tagOnly = isTag;
            } else if (tagOnly != isTag) {
                throw invalid("Cannot mix bare tags with projections in SELECT", pos,
                        tagOnly ? "bare tag" : "projection", parsed.get(0).column());
            }
            items.addAll(parsed);
        } while (consumeIf(COMMA));
        return items;
    }

    private List<SelectItem> parseSelectItem() {
        if (consumeIf(STAR)) {
            return List.of(new SelectItem.TagRef(SelectItem.TagRef.ALL));
        }
        if (!checkName()) {
            throw error("select item");
        }

        Lexer.SavePoint mark = lexer.mark();
        String name = stringVal();
        advance();

        if (check(LPAREN)) {
            String upper = name.toUpperCase(Locale.ROOT);
            if (upper.equals("FLATTEN_TEXT") || upper.equals("FLATTEN")) {
                return parseFlattenText();
            }
            SelectItem function = parseFunctionItem(name);
            if (function != null) {
                return List.of(withAlias(function));
            }
            // tag(field, ...)
            lexer.reset(mark);
            return parseFieldGroup();
        }

        lexer.reset(mark);
        SelectItem item = parseProjection(false);
        if (item instanceof SelectItem.TagRef) {
            if (check(AS)) {
                throw error("',' or FROM");
            }
            return List.of(item);
        }
        return List.of(withAlias(item));
    }

    private SelectItem withAlias(SelectItem item) {
        if (!consumeIf(AS)) {
            return item;
        }
        int pos = lexer.tokenPos();
        String alias = check(STRING) ? expectString("alias") : expectName("alias");
        if (item instanceof SelectItem.FieldItem f) {
            return new SelectItem.FieldItem(f.tag(), f.field(), f.trim(), alias);
        }
        if (item instanceof SelectItem.TextItem t) {
            return new SelectItem.TextItem(t.tag(), t.trim(), alias);
        }
        if (item instanceof SelectItem.InnerHtmlItem h) {
            return new SelectItem.InnerHtmlItem(h.tag(), h.maxChars(), h.raw(), h.trim(), alias);
        }
        if (item instanceof SelectItem.CountItem c) {
            return new SelectItem.CountItem(c.tag(), alias);
        }
        if (item instanceof SelectItem.TfidfItem t) {
            return new SelectItem.TfidfItem(t.tags(), t.terms(), t.topTerms(), t.minDf(), t.maxDf(),
                    t.stopwords(), alias);
        }
        throw invalid(item.column() + " cannot be aliased", pos, "',' or FROM", "alias " + alias);
    }

    /**
     * Parses {@code tag}, {@code tag.field}, {@code tag.attributes.name} or
     * {@code attributes.name}.
     */
    private SelectItem parseProjection(boolean trim) {
        String prefix = expectName("tag name").toLowerCase(Locale.ROOT);
        if (!consumeIf(DOT)) {
            if (trim) {
                throw error("'.' after " + prefix);
            }
            return new SelectItem.TagRef(prefix);
        }
        String fieldName = expectName("field name").toLowerCase(Locale.ROOT);
        FieldRef field;
        String fieldText = fieldName;
        if (fieldName.equals("attributes") && consumeIf(DOT)) {
            String attr = expectName("attribute name").toLowerCase(Locale.ROOT);
            field = new FieldRef.AttributeNamed(attr);
            fieldText = "attributes." + attr;
        } else {
            field = FieldRef.of(fieldName);
        }

        String column = prefix + "." + fieldText;
        if (trim) {
            column = "TRIM(" + column + ")";
        }
        if (prefix.equals("attributes")) {
            return new SelectItem.FieldItem(null, new FieldRef.AttributeNamed(fieldName), trim, column);
        }
        return new SelectItem.FieldItem(prefix, field, trim, column);
    }

    private List<SelectItem> parseFieldGroup() {
        String tag = expectName("tag name").toLowerCase(Locale.ROOT);
        expect(LPAREN);
        List<SelectItem> items = new ArrayList<>();
        List<String> fields = parseList(() -> expectName("field name").toLowerCase(Locale.ROOT));
        expect(RPAREN);
        for (String f : fields) {
            items.add(new SelectItem.FieldItem(tag, FieldRef.of(f), false, tag + "." + f));
        }
        return items;
    }

    /**
     * Parses a function-style select item whose name has been consumed and
     * whose '(' is current. Returns null when {@code name} is not a function.
     */
    private SelectItem parseFunctionItem(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        switch (upper) {
            case "TEXT", "INNER_HTML", "RAW_INNER_HTML" -> {
                return parseMarkupFunction(upper, false);
            }
            case "TRIM" -> {
                return parseTrim();
            }
            case "COUNT" -> {
                return parseCount();
            }
            case "SUMMARIZE" -> {
                expect(LPAREN);
                expect(STAR);
                expect(RPAREN);
                return new SelectItem.SummarizeItem();
            }
            case "TFIDF" -> {
                return parseTfidf();
            }
            default -> {
                return null;
            }
        }
    }

    /**
     * {@code FLATTEN_TEXT(tag[, depth]) [AS (name, ...)]}: one column per name,
     * a single {@code flatten_text} column without AS.
     */
    private List<SelectItem> parseFlattenText() {
        expect(LPAREN);
        String tag = expectName("tag name").toLowerCase(Locale.ROOT);
        Integer depth = null;
        if (consumeIf(COMMA)) {
            depth = expectNonNegative("FLATTEN_TEXT depth");
        }
        expect(RPAREN);

        List<String> names = List.of(SelectItem.FlattenTextItem.DEFAULT_COLUMN);
        if (consumeIf(AS)) {
            expect(LPAREN);
            names = parseList(() -> check(STRING) ? expectString("column alias") : expectName("column alias"));
            expect(RPAREN);
        }
        List<SelectItem> items = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            items.add(new SelectItem.FlattenTextItem(tag, depth, i, names.get(i)));
        }
        return items;
    }

    private SelectItem parseMarkupFunction(String function, boolean trim) {
        expect(LPAREN);
        String tag = expectName("tag name").toLowerCase(Locale.ROOT);
        Integer maxChars = null;
        if (!function.equals("TEXT") && consumeIf(COMMA)) {
            int pos = lexer.tokenPos();
            maxChars = expectInteger("maximum length");
            if (maxChars < 0) {
                throw invalid("Length must be non-negative", pos, "non-negative integer", String.valueOf(maxChars));
            }
        }
        expect(RPAREN);

        String column = function + "(" + tag + (maxChars != null ? ", " + maxChars : "") + ")";
        if (trim) {
            column = "TRIM(" + column + ")";
        }
        if (function.equals("TEXT")) {
            return new SelectItem.TextItem(tag, trim, column);
        }
        return new SelectItem.InnerHtmlItem(tag, maxChars, function.equals("RAW_INNER_HTML"), trim, column);
    }

    private SelectItem parseTrim() {
        expect(LPAREN);
        SelectItem inner;
        if (checkName()) {
            Lexer.SavePoint mark = lexer.mark();
            String name = stringVal().toUpperCase(Locale.ROOT);
            advance();
            if (check(LPAREN) && (name.equals("TEXT") || name.equals("INNER_HTML") || name.equals("RAW_INNER_HTML"))) {
                inner = parseMarkupFunction(name, true);
            } else {
                lexer.reset(mark);
                inner = parseProjection(true);
            }
        } else {
            throw error("TEXT(...), INNER_HTML(...) or tag.field");
        }
        expect(RPAREN);
        return inner;
    }

    private SelectItem parseCount() {
        expect(LPAREN);
        String tag = null;
        if (!consumeIf(STAR)) {
            tag = expectName("'*' or tag name").toLowerCase(Locale.ROOT);
        }
        expect(RPAREN);
        return new SelectItem.CountItem(tag, "COUNT(" + (tag == null ? "*" : tag) + ")");
    }

    private SelectItem parseTfidf() {
        expect(LPAREN);
        List<String> tags = new ArrayList<>();
        List<String> terms = new ArrayList<>();
        boolean all = false;
        Integer topTerms = null;
        int minDf = 0;
        int maxDf = 0;
        SelectItem.Stopwords stopwords = SelectItem.Stopwords.ENGLISH;

        do {
            int pos = lexer.tokenPos();
            if (consumeIf(STAR)) {
                all = true;
            } else if (check(STRING)) {
                terms.add(expectString("term").toLowerCase(Locale.ROOT));
            } else {
                String name = expectName("tag, term or option");
                if (!consumeIf(EQ)) {
                    tags.add(name.toLowerCase(Locale.ROOT));
                    continue;
                }
                switch (name.toUpperCase(Locale.ROOT)) {
                    case "TOP_TERMS" -> {
                        topTerms = expectInteger("TOP_TERMS value");
                        if (topTerms <= 0) {
                            throw invalid("TOP_TERMS must be positive", pos, "positive integer", String.valueOf(topTerms));
                        }
                    }
                    case "MIN_DF" -> minDf = expectNonNegative("MIN_DF value");
                    case "MAX_DF" -> maxDf = expectNonNegative("MAX_DF value");
                    case "STOPWORDS" -> {
                        String mode = expectName("ENGLISH or NONE").toUpperCase(Locale.ROOT);
                        stopwords = switch (mode) {
                            case "ENGLISH", "DEFAULT" -> SelectItem.Stopwords.ENGLISH;
                            case "NONE", "OFF" -> SelectItem.Stopwords.NONE;
                            default -> throw invalid("Unknown STOPWORDS mode: " + mode, pos, "ENGLISH or NONE", mode);
                        };
                    }
                    default -> throw invalid("Unknown TFIDF option: " + name, pos,
                            "TOP_TERMS, MIN_DF, MAX_DF or STOPWORDS", name);
                }
            }
        } while (consumeIf(COMMA));
        int close = lexer.tokenPos();
        expect(RPAREN);

        if (all && !tags.isEmpty()) {
            throw invalid("TFIDF cannot combine '*' with tag names", close, "'*' or tag names", "both");
        }
        if (!all && tags.isEmpty()) {
            throw invalid("TFIDF requires '*' or at least one tag", close, "'*' or tag name", "none");
        }
        if (maxDf > 0 && maxDf < minDf) {
            throw invalid("MAX_DF must be >= MIN_DF", close, "MAX_DF >= " + minDf, String.valueOf(maxDf));
        }

        List<String> parts = new ArrayList<>(all ? List.of("*") : tags);
        for (String term : terms) {
            parts.add("'" + term + "'");
        }
        String column = "TFIDF(" + String.join(", ", parts) + ")";
        return new SelectItem.TfidfItem(tags, terms, topTerms, minDf, maxDf, stopwords, column);
    }

    private int expectNonNegative(String what) {
        int pos = lexer.tokenPos();
        int value = expectInteger(what);
        if (value < 0) {
            throw invalid(what + " must be non-negative", pos, "non-negative integer", String.valueOf(value));
        }
        return value;
    }

    /**
     * {@code doc.text} or {@code page.href} (with {@code FROM ... AS page}) refer
     * to the candidate itself rather than a tag.
     */
    private static List<SelectItem> unanchorQualifiedItems(List<SelectItem> items, Source source) {
        Set<String> names = sourceNames(source);
        List<SelectItem> out = new ArrayList<>(items.size());
        for (SelectItem item : items) {
            if (item instanceof SelectItem.FieldItem f && f.tag() != null && names.contains(f.tag())) {
                out.add(new SelectItem.FieldItem(null, f.field(), f.trim(), f.column()));
            } else if (item instanceof SelectItem.FlattenTextItem f && f.tag() != null && names.contains(f.tag())) {
                out.add(new SelectItem.FlattenTextItem(null, f.depth(), f.index(), f.column()));
            } else {
                out.add(item);
            }
        }
        return out;
    }

    private static Set<String> sourceNames(Source source) {
        Set<String> names = new HashSet<>();
        if (source.alias() != null) {
            names.add(source.alias().toLowerCase(Locale.ROOT));
        }
        if (source instanceof Source.Document) {
            names.add("doc");
            names.add("document");
        }
        if (source instanceof Source.AliasRef ref) {
            names.add(ref.name().toLowerCase(Locale.ROOT));
        }
        return names;
    }

    private static Set<String> qualifiersFor(List<SelectItem> items, Source source) {
        Set<String> names = sourceNames(source);
        Set<String> anchors = new LinkedHashSet<>();
        for (SelectItem item : items) {
            String anchor = item.anchorTag();
            if (anchor == null) {
                anchors.clear();
                break;
            }
            anchors.add(anchor);
        }
        if (anchors.size() == 1) {
            names.add(anchors.iterator().next());
        }
        return names;
    }

    // ==================== FROM ====================

    private Source parseSource() {
        if (checkWord("document") || checkWord("doc")) {
            advance();
            return new Source.Document(parseOptionalAlias());
        }
        if (check(STRING)) {
            String location = expectString("path");
            if (location.isBlank()) {
                throw error("non-empty path");
            }
            return new Source.Path(location, parseOptionalAlias());
        }
        if (check(RAW)) {
            Source.Raw raw = parseRaw();
            return new Source.Raw(raw.html(), parseOptionalAlias());
        }
        if (consumeIf(FRAGMENTS)) {
            expect(LPAREN);
            Source.Raw raw = null;
            SelectQuery subquery = null;
            if (check(RAW)) {
                raw = parseRaw();
            } else if (check(SELECT)) {
                subquery = parseSelect();
            } else {
                throw error("RAW(...) or SELECT");
            }
            expect(RPAREN);
            return new Source.Fragments(raw, subquery, parseOptionalAlias());
        }
        if (check(IDENTIFIER)) {
            String name = stringVal();
            advance();
            return new Source.AliasRef(name.toLowerCase(Locale.ROOT));
        }
        throw error("source (document, 'path', RAW(...), FRAGMENTS(...) or alias)");
    }

    private Source.Raw parseRaw() {
        expect(RAW);
        expect(LPAREN);
        String html = expectString("markup string");
        expect(RPAREN);
        return new Source.Raw(html, null);
    }

    private String parseOptionalAlias() {
        if (consumeIf(AS)) {
            return expectName("alias").toLowerCase(Locale.ROOT);
        }
        if (check(IDENTIFIER)) {
            String alias = stringVal().toLowerCase(Locale.ROOT);
            advance();
            return alias;
        }
        return null;
    }

    // ==================== WHERE Expressions ====================

    private Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (consumeIf(OR)) {
            left = Expression.or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parsePrimary();
        while (consumeIf(AND)) {
            left = Expression.and(left, parsePrimary());
        }
        return left;
    }

    private Expression parsePrimary() {
        if (consumeIf(LPAREN)) {
            Expression inner = parseExpression();
            expect(RPAREN);
            return inner;
        }
        if (check(EXISTS)) {
            return parseExists();
        }
        if (consumeIf(HAS_DIRECT_TEXT)) {
            return new Expression.DirectText(Axis.SELF, null, parseOptionalNeedle());
        }
        Expression directText = tryParseDirectText();
        if (directText != null) {
            return directText;
        }
        return parseComparison();
    }

    private Expression parseExists() {
        expect(EXISTS);
        expect(LPAREN);
        int pos = lexer.tokenPos();
        String name = expectName("axis");
        Axis axis = Axis.fromName(name);
        if (axis == null) {
            throw invalid("Unknown axis: " + name, pos, "parent, child, ancestor or descendant", name);
        }
        Expression where = null;
        if (consumeIf(WHERE)) {
            where = parseExpression();
        }
        expect(RPAREN);
        return new Expression.Exists(axis, where);
    }

    /**
     * {@code name HAS_DIRECT_TEXT} or {@code axis.name HAS_DIRECT_TEXT}; resets
     * and returns null for anything else.
     */
    private Expression tryParseDirectText() {
        if (!checkName()) {
            return null;
        }
        Lexer.SavePoint mark = lexer.mark();
        String first = stringVal().toLowerCase(Locale.ROOT);
        advance();
        String second = null;
        if (consumeIf(DOT)) {
            if (!checkName()) {
                lexer.reset(mark);
                return null;
            }
            second = stringVal().toLowerCase(Locale.ROOT);
            advance();
        }
        if (!consumeIf(HAS_DIRECT_TEXT)) {
            lexer.reset(mark);
            return null;
        }

        Axis axis = Axis.fromName(first);
        String needle = parseOptionalNeedle();
        if (second != null) {
            if (axis == null) {
                if (!qualifiers.contains(first)) {
                    throw invalid("Unknown qualifier: " + first, mark.tokenPos(), "axis or source alias", first);
                }
                return new Expression.DirectText(Axis.SELF, second, needle);
            }
            return new Expression.DirectText(axis, second, needle);
        }
        if (axis != null) {
            return new Expression.DirectText(axis, null, needle);
        }
        return new Expression.DirectText(Axis.SELF, first, needle);
    }

    private String parseOptionalNeedle() {
        return check(STRING) ? expectString("text") : null;
    }

    private Expression parseComparison() {
        Operand operand = parseOperand();
        int pos = lexer.tokenPos();

        switch (current()) {
            case EQ -> {
                advance();
                return Expression.compare(operand, CompareOp.EQ, parseValue());
            }
            case NE -> {
                advance();
                return Expression.compare(operand, CompareOp.NE, parseValue());
            }
            case TILDE -> {
                advance();
                if (!check(STRING)) {
                    throw error("regular expression string");
                }
                return Expression.compare(operand, CompareOp.REGEX, parseValue());
            }
            case IN -> {
                advance();
                return new Expression.Comparison(operand, CompareOp.IN, parseValueList());
            }
            case CONTAINS -> {
                advance();
                if (consumeIf(ALL)) {
                    return new Expression.Comparison(operand, CompareOp.CONTAINS_ALL, parseValueList());
                }
                if (consumeIf(ANY)) {
                    return new Expression.Comparison(operand, CompareOp.CONTAINS_ANY, parseValueList());
                }
                return Expression.compare(operand, CompareOp.CONTAINS, parseValue());
            }
            case IS -> {
                advance();
                boolean negated = consumeIf(NOT);
                expect(NULL);
                return Expression.compare(operand, negated ? CompareOp.IS_NOT_NULL : CompareOp.IS_NULL);
            }
            default -> throw invalid("Expected comparison operator, found " + lexer.describe(), pos,
                    "comparison operator", lexer.describe());
        }
    }

    /**
     * {@code [axis.]field_ref} where field_ref is a node field, {@code attributes},
     * {@code attributes.name} or a bare attribute name.
     */
    private Operand parseOperand() {
        int pos = lexer.tokenPos();
        String first = expectName("field, attribute or axis");
        String lower = first.toLowerCase(Locale.ROOT);

        Axis axis = Axis.fromName(lower);
        if (axis != null && consumeIf(DOT)) {
            return new Operand(axis, parseFieldRef());
        }
        if (lower.equals("attributes")) {
            if (consumeIf(DOT)) {
                return Operand.self(new FieldRef.AttributeNamed(expectName("attribute name").toLowerCase(Locale.ROOT)));
            }
            return Operand.self(FieldRef.Attributes.INSTANCE);
        }
        if (check(DOT)) {
            if (!qualifiers.contains(lower)) {
                throw invalid("Unknown qualifier: " + first, pos, "axis, source alias or selected tag", first);
            }
            advance();
            return Operand.self(parseFieldRef());
        }
        return Operand.self(FieldRef.of(lower));
    }

    private FieldRef parseFieldRef() {
        String name = expectName("field name").toLowerCase(Locale.ROOT);
        if (name.equals("attributes")) {
            if (consumeIf(DOT)) {
                return new FieldRef.AttributeNamed(expectName("attribute name").toLowerCase(Locale.ROOT));
            }
            return FieldRef.Attributes.INSTANCE;
        }
        return FieldRef.of(name);
    }

    private Literal parseValue() {
        if (check(STRING)) {
            String val = stringVal();
            advance();
            return Literal.string(val);
        }
        if (check(INTEGER) || check(DECIMAL)) {
            String val = stringVal();
            advance();
            return Literal.number(val);
        }
        throw error("string or number");
    }

    /**
     * {@code (v, ...)}, possibly empty, or a single bare value.
     */
    private List<Literal> parseValueList() {
        if (!consumeIf(LPAREN)) {
            return List.of(parseValue());
        }
        if (consumeIf(RPAREN)) {
            return List.of();
        }
        List<Literal> values = parseList(this::parseValue);
        expect(RPAREN);
        return values;
    }

    // ==================== ORDER BY ====================

    private OrderSpec parseOrderSpec() {
        String key = parseOrderKey();
        if (consumeIf(DESC)) {
            return OrderSpec.desc(key);
        }
        consumeIf(ASC);
        return OrderSpec.asc(key);
    }

    /**
     * Column names may be dotted ({@code title.text}) or function-shaped
     * ({@code COUNT(*)}); the key is rebuilt from tokens.
     */
    private String parseOrderKey() {
        if (check(STRING)) {
            return expectString("order key");
        }
        StringBuilder key = new StringBuilder(expectName("order key"));
        while (consumeIf(DOT)) {
            key.append('.').append(expectName("field name"));
        }
        if (check(LPAREN)) {
            int depth = 0;
            do {
                if (check(EOF)) {
                    throw error("')'");
                }
                if (check(LPAREN)) depth++;
                if (check(RPAREN)) depth--;
                key.append(tokenText());
                advance();
            } while (depth > 0);
        }
        return key.toString();
    }

    private String tokenText() {
        return switch (current()) {
            case LPAREN -> "(";
            case RPAREN -> ")";
            case COMMA -> ", ";
            case DOT -> ".";
            case STAR -> "*";
            case EQ -> "=";
            case STRING -> "'" + stringVal() + "'";
            default -> stringVal() != null ? stringVal() : "";
        };
    }

    // ==================== TO ====================

    private OutputTarget parseOutputTarget() {
        if (consumeIf(LIST)) {
            if (consumeIf(LPAREN)) {
                expect(RPAREN);
            }
            return OutputTarget.ToList.INSTANCE;
        }
        if (consumeIf(TABLE)) {
            return parseTableTarget();
        }
        if (consumeIf(CSV)) {
            return new OutputTarget.ToCsv(parsePathArgument());
        }
        if (consumeIf(PARQUET)) {
            return new OutputTarget.ToParquet(parsePathArgument());
        }
        throw error("LIST, TABLE, CSV or PARQUET");
    }

    private String parsePathArgument() {
        expect(LPAREN);
        String path = expectString("output path");
        if (path.isBlank()) {
            throw error("non-empty output path");
        }
        expect(RPAREN);
        return path;
    }

    private OutputTarget.ToTable parseTableTarget() {
        boolean header = true;
        String export = null;
        if (!consumeIf(LPAREN)) {
            return new OutputTarget.ToTable(true, null);
        }
        if (consumeIf(RPAREN)) {
            return new OutputTarget.ToTable(true, null);
        }
        do {
            if (consumeWord("NOHEADER") || consumeWord("NO_HEADER")) {
                header = false;
            } else if (consumeWord("HEADER")) {
                consumeIf(EQ);
                if (consumeWord("ON")) {
                    header = true;
                } else if (consumeWord("OFF")) {
                    header = false;
                } else if (!check(COMMA) && !check(RPAREN)) {
                    throw error("ON or OFF");
                }
            } else if (consumeWord("EXPORT")) {
                consumeIf(EQ);
                export = expectString("export path");
                if (export.isBlank()) {
                    throw error("non-empty export path");
                }
            } else {
                throw error("HEADER, NOHEADER, NO_HEADER or EXPORT");
            }
        } while (consumeIf(COMMA));
        expect(RPAREN);
        return new OutputTarget.ToTable(header, export);
    }

    // ==================== SHOW / DESCRIBE ====================

    private ShowQuery parseShow() {
        expect(SHOW);
        int pos = lexer.tokenPos();
        String name = expectName("INPUT, INPUTS, FUNCTIONS, AXES or OPERATORS").toUpperCase(Locale.ROOT);
        for (ShowQuery.Target target : ShowQuery.Target.values()) {
            if (target.name().equals(name)) {
                return new ShowQuery(target);
            }
        }
        throw invalid("Unknown SHOW target: " + name, pos, "INPUT, INPUTS, FUNCTIONS, AXES or OPERATORS", name);
    }

    private DescribeQuery parseDescribe() {
        expect(DESCRIBE);
        int pos = lexer.tokenPos();
        String name = expectName("DOC, DOCUMENT or LANGUAGE").toUpperCase(Locale.ROOT);
        return switch (name) {
            case "DOC", "DOCUMENT" -> new DescribeQuery(DescribeQuery.Target.DOCUMENT);
            case "LANGUAGE" -> new DescribeQuery(DescribeQuery.Target.LANGUAGE);
            default -> throw invalid("Unknown DESCRIBE target: " + name, pos, "DOC, DOCUMENT or LANGUAGE", name);
        };
    }
}
