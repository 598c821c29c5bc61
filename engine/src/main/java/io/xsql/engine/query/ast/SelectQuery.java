package io.xsql.engine.query.ast;

import java.util.List;

/**
 * SELECT items [EXCLUDE ...] FROM source [WHERE ...] [ORDER BY ...] [LIMIT n] [TO ...]
 *
 * @param where  null when absent
 * @param limit  null when absent
 * @param output null when absent (equivalent to TO LIST())
 */
public record SelectQuery(
        List<SelectItem> items,
        List<String> exclude,
        Source source,
        Expression where,
        List<OrderSpec> orderBy,
        Integer limit,
        OutputTarget output) implements Query {

    public SelectQuery {
        items = List.copyOf(items);
        exclude = List.copyOf(exclude);
        orderBy = List.copyOf(orderBy);
    }

    public boolean hasAggregate() {
        return items.stream().anyMatch(SelectItem::isAggregate);
    }

    /**
     * True for SELECT lists made only of bare tags or {@code *}.
     */
    public boolean isTagOnly() {
        return items.stream().allMatch(item -> item instanceof SelectItem.TagRef);
    }

    /**
     * True when the select list contains FLATTEN_TEXT columns.
     */
    public boolean isFlatten() {
        return items.stream().anyMatch(item -> item instanceof SelectItem.FlattenTextItem);
    }
}
