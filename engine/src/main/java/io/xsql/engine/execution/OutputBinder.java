package io.xsql.engine.execution;

import io.xsql.engine.query.ast.OutputTarget;
import io.xsql.engine.serialization.CsvSerializer;
import io.xsql.engine.serialization.ParquetSerializer;
import io.xsql.engine.serialization.ResultFileWriter;
import io.xsql.engine.serialization.TableSerializer;

import java.nio.file.Path;

/**
 * BIND stage: applies the TO clause. Rows and columns pass through
 * unchanged; files are written atomically.
 */
final class OutputBinder {

    private OutputBinder() {
    }

    static ResultSet bind(OutputTarget target, ResultSet result) {
        if (target == null || target instanceof OutputTarget.ToList) {
            return result;
        }
        if (target instanceof OutputTarget.ToTable table) {
            String rendering = TableSerializer.of(table.header()).render(result);
            if (table.hasExport()) {
                ResultFileWriter.write(result, Path.of(table.exportPath()),
                        table.header() ? CsvSerializer.INSTANCE : CsvSerializer.WITHOUT_HEADER);
            }
            return result.withRendering(rendering);
        }
        if (target instanceof OutputTarget.ToCsv csv) {
            ResultFileWriter.write(result, Path.of(csv.path()), CsvSerializer.INSTANCE);
            return result;
        }
        if (target instanceof OutputTarget.ToParquet parquet) {
            ResultFileWriter.write(result, Path.of(parquet.path()), ParquetSerializer.INSTANCE);
            return result;
        }
        throw new IllegalStateException("Unknown output target: " + target);
    }
}
