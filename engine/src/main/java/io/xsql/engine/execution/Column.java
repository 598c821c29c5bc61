package io.xsql.engine.execution;

/**
 * Column metadata for query results.
 *
 * @param type one of {@code string}, {@code int64}, {@code double},
 *             {@code map<string,string>}, {@code map<string,double>}
 */
public record Column(String name, String type) {

    public static final String STRING = "string";
    public static final String INT64 = "int64";
    public static final String DOUBLE = "double";
    public static final String STRING_MAP = "map<string,string>";
    public static final String DOUBLE_MAP = "map<string,double>";

    public static Column string(String name) {
        return new Column(name, STRING);
    }

    public static Column int64(String name) {
        return new Column(name, INT64);
    }
}
