package io.xsql.engine.serialization;

import io.xsql.engine.execution.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a serialized result to a file without ever exposing a partial one:
 * the bytes go to a temporary sibling first, which is then moved over the
 * target. The temporary is removed when anything fails.
 */
public final class ResultFileWriter {

    private static final Logger logger = LoggerFactory.getLogger(ResultFileWriter.class);

    private ResultFileWriter() {
    }

    public static void write(ResultSet result, Path target, ResultSerializer serializer) {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path temp = null;
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            temp = Files.createTempFile(dir, "." + absolute.getFileName() + "-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                serializer.serialize(result, out);
            }
            move(temp, absolute);
            temp = null;
            logger.info("Exported {} rows as {} to {}", result.rowCount(), serializer.formatId(), absolute);
        } catch (IOException | RuntimeException e) {
            throw new OutputException(target, e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing instead", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}", temp, e);
        }
    }
}
