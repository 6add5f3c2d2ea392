package io.formulaxform.core.engine;

import io.formulaxform.core.model.GeneratedUnit;
import io.formulaxform.core.model.WriteStatus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists generated units. A file left by an earlier pass is always removed first, so an empty
 * unit leaves no stale file behind. Write failures are reported as {@link WriteStatus#FAILED}
 * and logged; they never propagate.
 */
public final class SourceFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(SourceFileWriter.class);

    private SourceFileWriter() {}

    /**
     * Replaces {@code directory/unit.fileName()} with the unit's source.
     *
     * @return {@link WriteStatus#WRITTEN}, {@link WriteStatus#SKIPPED} for an empty unit, or
     *     {@link WriteStatus#FAILED}
     */
    public static WriteStatus write(Path directory, GeneratedUnit unit) {
        Path target = directory.resolve(unit.fileName());
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.error("Cannot remove previous {}: {}", target, e.getMessage());
            return WriteStatus.FAILED;
        }
        if (unit.isEmpty()) {
            LOG.debug("No formula for {}, nothing written", unit.fileName());
            return WriteStatus.SKIPPED;
        }
        try {
            Files.createDirectories(directory);
            Files.writeString(target, unit.source(), StandardCharsets.UTF_8);
            LOG.info("Generated {} ({} chars)", target, unit.source().length());
            return WriteStatus.WRITTEN;
        } catch (IOException e) {
            LOG.error("Cannot write {}: {}", target, e.getMessage());
            return WriteStatus.FAILED;
        }
    }

    /**
     * Deletes the files of {@code directory} and then the directory itself. A missing directory
     * is not an error.
     *
     * @throws UncheckedIOException if a file or the directory cannot be removed
     */
    public static void cleanDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            return;
        }
        try {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
                for (Path entry : entries) {
                    Files.delete(entry);
                }
            }
            Files.delete(directory);
            LOG.debug("Removed {}", directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clean " + directory, e);
        }
    }
}
