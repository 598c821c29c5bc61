package io.xsql.engine.execution;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single cell of a query result.
 *
 * Values are immutable. {@link #asText()} is the plain rendering used by the
 * CSV and table serializers; {@link #toJson()} renders nested values.
 */
public sealed interface Value
        permits Value.StringValue, Value.NumberValue, Value.BooleanValue, Value.NullValue,
        Value.ListValue, Value.MapValue {

    // ==================== Factory Methods ====================

    static Value of(String s) {
        return s == null ? NullValue.INSTANCE : new StringValue(s);
    }

    static Value of(long n) {
        return new NumberValue(BigDecimal.valueOf(n));
    }

    static Value of(double d) {
        return new NumberValue(BigDecimal.valueOf(d));
    }

    static Value of(boolean b) {
        return b ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static Value nullValue() {
        return NullValue.INSTANCE;
    }

    static Value ofStrings(Map<String, String> map) {
        Map<String, Value> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(k, of(v)));
        return new MapValue(out);
    }

    // ==================== Accessors ====================

    default boolean isNull() {
        return false;
    }

    /**
     * Plain text of the value; null for {@link NullValue}.
     */
    String asText();

    String toJson();

    // ==================== Variants ====================

    record StringValue(String value) implements Value {
        @Override
        public String asText() {
            return value;
        }

        @Override
        public String toJson() {
            return quote(value);
        }

    }

    /**
     * Integral numbers render without a fraction: 3, not 3.0.
     */
    record NumberValue(BigDecimal value) implements Value {
        public boolean isIntegral() {
            return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
        }

        @Override
        public String asText() {
            if (isIntegral()) {
                return value.toBigInteger().toString();
            }
            return value.stripTrailingZeros().toPlainString();
        }

        @Override
        public String toJson() {
            return asText();
        }

    }

    record BooleanValue(boolean value) implements Value {
        public static final BooleanValue TRUE = new BooleanValue(true);
        public static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public String toJson() {
            return asText();
        }

    }

    record NullValue() implements Value {
        public static final NullValue INSTANCE = new NullValue();

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public String asText() {
            return null;
        }

        @Override
        public String toJson() {
            return "null";
        }

    }

    record ListValue(List<Value> values) implements Value {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public String asText() {
            return toJson();
        }

        @Override
        public String toJson() {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append(values.get(i).toJson());
            }
            return sb.append(']').toString();
        }

    }

    /**
     * Ordered string-keyed mapping, e.g. attributes or TFIDF term scores.
     */
    record MapValue(Map<String, Value> entries) implements Value {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public Value get(String key) {
            Value v = entries.get(key);
            return v != null ? v : NullValue.INSTANCE;
        }

        @Override
        public String asText() {
            return toJson();
        }

        @Override
        public String toJson() {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<String, Value> e : entries.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(quote(e.getKey())).append(':').append(e.getValue().toJson());
            }
            return sb.append('}').toString();
        }

    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
