package io.xsql.engine.query.ast;

/**
 * The TO clause of a SELECT.
 */
public sealed interface OutputTarget extends XsqlNode
        permits OutputTarget.ToList, OutputTarget.ToTable, OutputTarget.ToCsv, OutputTarget.ToParquet {

    /**
     * TO LIST()
     */
    record ToList() implements OutputTarget {
        public static final ToList INSTANCE = new ToList();
    }

    /**
     * TO TABLE([HEADER=ON|OFF | NOHEADER | NO_HEADER][, EXPORT='path'])
     *
     * @param exportPath null when the rendering is not persisted
     */
    record ToTable(boolean header, String exportPath) implements OutputTarget {
        public boolean hasExport() {
            return exportPath != null;
        }
    }

    /**
     * TO CSV('path')
     */
    record ToCsv(String path) implements OutputTarget {
    }

    /**
     * TO PARQUET('path')
     */
    record ToParquet(String path) implements OutputTarget {
    }
}
