package io.xsql.engine.execution;

import io.xsql.engine.EngineOptions;
import io.xsql.engine.document.DocumentNode;
import io.xsql.engine.document.DocumentTree;
import io.xsql.engine.query.ast.Axis;
import io.xsql.engine.query.ast.CompareOp;
import io.xsql.engine.query.ast.Expression;
import io.xsql.engine.query.ast.FieldRef;
import io.xsql.engine.query.ast.Literal;
import io.xsql.engine.query.ast.SelectItem;
import io.xsql.engine.query.ast.SelectQuery;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates WHERE expressions against one candidate node at a time.
 *
 * Axis operands are existential: the predicate holds when it holds for at
 * least one resolved node. An axis that resolves to no node makes every
 * operator false except IS NULL.
 */
final class FilterEvaluator {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final DocumentTree tree;
    private final int maxRegexLength;
    private final Map<Expression.Comparison, Pattern> patterns = new IdentityHashMap<>();

    FilterEvaluator(DocumentTree tree, EngineOptions options) {
        this.tree = tree;
        this.maxRegexLength = options.maxRegexLength();
    }

    /**
     * Nodes of the tree, in document order, that pass the implicit tag filter
     * and the WHERE clause.
     */
    List<DocumentNode> candidates(SelectQuery query) {
        Expression where = query.where();
        if (where != null) {
            validate(where);
        }
        Set<String> tags = implicitTags(query);
        List<DocumentNode> out = new ArrayList<>();
        for (DocumentNode node : tree.nodes()) {
            if (!tags.isEmpty() && !tags.contains(node.tag())) {
                continue;
            }
            boolean passes = where == null
                    || (query.isFlatten() ? matchesFlattenBase(where, node) : matches(where, node));
            if (passes) {
                out.add(node);
            }
        }
        return out;
    }

    /**
     * Tags the SELECT list restricts candidates to; empty for no restriction.
     */
    static Set<String> implicitTags(SelectQuery query) {
        for (SelectItem item : query.items()) {
            if (item instanceof SelectItem.FlattenTextItem flatten) {
                return flatten.tag() == null ? Set.of() : Set.of(flatten.tag());
            }
        }
        if (query.where() != null && constrainsTag(query.where())) {
            return Set.of();
        }
        Set<String> tags = new LinkedHashSet<>();
        for (SelectItem item : query.items()) {
            if (item instanceof SelectItem.CountItem || item instanceof SelectItem.SummarizeItem) {
                continue;
            }
            if (item instanceof SelectItem.TfidfItem tfidf) {
                if (tfidf.tags().isEmpty()) {
                    return Set.of();
                }
                tags.addAll(tfidf.tags());
                continue;
            }
            String anchor = item.anchorTag();
            if (anchor == null) {
                return Set.of();
            }
            tags.add(anchor);
        }
        return tags;
    }

    /**
     * True when the expression names a tag itself, outside any EXISTS.
     */
    static boolean constrainsTag(Expression expr) {
        if (expr instanceof Expression.Binary binary) {
            return constrainsTag(binary.left()) || constrainsTag(binary.right());
        }
        if (expr instanceof Expression.Comparison cmp) {
            return cmp.operand().field() instanceof FieldRef.NodeField nodeField
                    && nodeField.field() == FieldRef.Field.TAG;
        }
        if (expr instanceof Expression.DirectText directText) {
            return directText.tag() != null;
        }
        return false;
    }

    // ==================== Validation ====================

    void validate(Expression expr) {
        if (expr instanceof Expression.Binary binary) {
            validate(binary.left());
            validate(binary.right());
        } else if (expr instanceof Expression.Exists exists) {
            if (exists.where() != null) {
                validate(exists.where());
            }
        } else if (expr instanceof Expression.Comparison cmp) {
            validateComparison(cmp);
        }
    }

    private void validateComparison(Expression.Comparison cmp) {
        CompareOp op = cmp.op();
        if (cmp.operand().field() instanceof FieldRef.Attributes && !op.isNullTest()) {
            throw new FilterException("'" + cmp.operand().display() + "' supports only IS NULL and IS NOT NULL; "
                    + "compare a single attribute with attributes.<name>");
        }
        boolean single = op == CompareOp.EQ || op == CompareOp.NE
                || op == CompareOp.REGEX || op == CompareOp.CONTAINS;
        if (single && cmp.values().size() != 1) {
            throw new FilterException("Operator " + op.symbol() + " expects exactly one value, got "
                    + cmp.values().size());
        }
        if (op == CompareOp.REGEX) {
            String regex = cmp.values().get(0).text();
            if (regex.length() > maxRegexLength) {
                throw new FilterException("Regular expression longer than " + maxRegexLength + " characters");
            }
            try {
                patterns.put(cmp, Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new FilterException("Invalid regular expression '" + regex + "': " + e.getDescription(), e);
            }
        }
    }

    // ==================== Evaluation ====================

    boolean matches(Expression expr, DocumentNode node) {
        if (expr instanceof Expression.Binary binary) {
            return switch (binary.op()) {
                case AND -> matches(binary.left(), node) && matches(binary.right(), node);
                case OR -> matches(binary.left(), node) || matches(binary.right(), node);
            };
        }
        if (expr instanceof Expression.Comparison cmp) {
            return matchesComparison(cmp, node);
        }
        if (expr instanceof Expression.Exists exists) {
            for (DocumentNode target : resolve(exists.axis(), node)) {
                if (exists.where() == null || matches(exists.where(), target)) {
                    return true;
                }
            }
            return false;
        }
        if (expr instanceof Expression.DirectText directText) {
            return matchesDirectText(directText, node);
        }
        throw new IllegalStateException("Unknown expression: " + expr);
    }

    private boolean matchesComparison(Expression.Comparison cmp, DocumentNode node) {
        List<DocumentNode> targets = resolve(cmp.operand().axis(), node);
        if (cmp.op() == CompareOp.IS_NULL && targets.isEmpty()) {
            return true;
        }
        for (DocumentNode target : targets) {
            if (holdsFor(cmp, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Applies the comparison to {@code node} itself, ignoring its axis.
     */
    boolean holdsFor(Expression.Comparison cmp, DocumentNode node) {
        FieldRef field = cmp.operand().field();
        Value value = NodeFields.value(tree, node, field);
        boolean absent = NodeFields.isAbsent(value);
        return switch (cmp.op()) {
            case IS_NULL -> absent;
            case IS_NOT_NULL -> !absent;
            default -> !absent && test(cmp, field, value);
        };
    }

    // ==================== FLATTEN_TEXT ====================

    /**
     * WHERE as applied to FLATTEN_TEXT base nodes: descendant comparisons
     * choose the flattened descendants instead, so they hold here.
     */
    boolean matchesFlattenBase(Expression expr, DocumentNode node) {
        if (expr instanceof Expression.Binary binary) {
            boolean left = matchesFlattenBase(binary.left(), node);
            boolean right = matchesFlattenBase(binary.right(), node);
            return binary.op() == Expression.BoolOp.AND ? left && right : left || right;
        }
        if (expr instanceof Expression.Comparison cmp && cmp.operand().axis() == Axis.DESCENDANT) {
            return true;
        }
        return matches(expr, node);
    }

    /**
     * Descendant comparisons on the tag or a named attribute, outside EXISTS.
     */
    static List<Expression.Comparison> descendantFilters(Expression expr) {
        List<Expression.Comparison> out = new ArrayList<>();
        collectDescendantFilters(expr, out);
        return out;
    }

    private static void collectDescendantFilters(Expression expr, List<Expression.Comparison> out) {
        if (expr instanceof Expression.Binary binary) {
            collectDescendantFilters(binary.left(), out);
            collectDescendantFilters(binary.right(), out);
        } else if (expr instanceof Expression.Comparison cmp && cmp.operand().axis() == Axis.DESCENDANT) {
            FieldRef field = cmp.operand().field();
            boolean tag = field instanceof FieldRef.NodeField nodeField && nodeField.field() == FieldRef.Field.TAG;
            if (tag || field instanceof FieldRef.AttributeNamed) {
                out.add(cmp);
            }
        }
    }

    private boolean test(Expression.Comparison cmp, FieldRef field, Value value) {
        List<Literal> values = cmp.values();
        String text = value.asText();
        return switch (cmp.op()) {
            case EQ -> equalsLiteral(field, value, values.get(0));
            case NE -> !equalsLiteral(field, value, values.get(0));
            case IN -> values.stream().anyMatch(lit -> equalsLiteral(field, value, lit));
            case REGEX -> patterns.get(cmp).matcher(text).find();
            case CONTAINS -> containsIgnoreCase(text, values.get(0).text());
            case CONTAINS_ALL -> values.stream().allMatch(lit -> containsIgnoreCase(text, lit.text()));
            case CONTAINS_ANY -> values.stream().anyMatch(lit -> containsIgnoreCase(text, lit.text()));
            case IS_NULL, IS_NOT_NULL -> throw new IllegalStateException("Null tests are handled by the caller");
        };
    }

    private static boolean equalsLiteral(FieldRef field, Value value, Literal literal) {
        String text = value.asText();
        if (field instanceof FieldRef.NodeField nodeField && nodeField.field() == FieldRef.Field.TAG) {
            return text.equals(literal.text().toLowerCase(Locale.ROOT));
        }
        if (literal.isNumber()) {
            if (value instanceof Value.NumberValue number) {
                return number.value().compareTo(literal.numericValue()) == 0;
            }
            String trimmed = text.trim();
            return NUMBER.matcher(trimmed).matches()
                    && new BigDecimal(trimmed).compareTo(literal.numericValue()) == 0;
        }
        if (field instanceof FieldRef.AttributeNamed named && named.name().equals("class")) {
            return text.equals(literal.text()) || classTokens(text).contains(literal.text());
        }
        return text.equals(literal.text());
    }

    private boolean matchesDirectText(Expression.DirectText directText, DocumentNode node) {
        String needle = directText.needle();
        for (DocumentNode target : resolve(directText.axis(), node)) {
            if (directText.tag() != null && !target.tag().equals(directText.tag())) {
                continue;
            }
            String own = target.directText();
            boolean holds = needle == null || needle.isEmpty()
                    ? !own.trim().isEmpty()
                    : containsIgnoreCase(own, needle);
            if (holds) {
                return true;
            }
        }
        return false;
    }

    private List<DocumentNode> resolve(Axis axis, DocumentNode node) {
        return switch (axis) {
            case SELF -> List.of(node);
            case PARENT -> {
                DocumentNode parent = tree.parent(node);
                yield parent == null ? List.of() : List.of(parent);
            }
            case CHILD -> tree.children(node);
            case ANCESTOR -> tree.ancestors(node);
            case DESCENDANT -> tree.descendants(node);
        };
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    private static Set<String> classTokens(String value) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : value.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
