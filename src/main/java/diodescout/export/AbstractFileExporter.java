package diodescout.export;

import diodescout.model.types.MeasurementSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Writes the export to a temporary file next to the destination and then moves it over
 * the destination, so that a failed export never leaves a truncated file.
 */
public abstract class AbstractFileExporter implements SeriesExporter {
    private static final Logger logger = LogManager.getLogger(AbstractFileExporter.class.getName());

    @Override
    public boolean export(List<MeasurementSeries> seriesList, Path destination) {
        Path absoluteDestination = destination.toAbsolutePath();
        Path tempFile = null;
        try {
            // created with the default permissions, as a plain new file would be
            tempFile = Files.createFile(absoluteDestination.resolveSibling(
                    "." + absoluteDestination.getFileName() + "." + UUID.randomUUID() + ".tmp"));
            try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                this.writeSeries(seriesList, writer);
            }
            copyPermissionsIfExists(absoluteDestination, tempFile);
            moveReplacing(tempFile, absoluteDestination);
            logger.info("{} series exported to {}", seriesList.size(), absoluteDestination);
            return true;
        } catch (IOException e) {
            logger.error("Export to {} failed", absoluteDestination, e);
            deleteQuietly(tempFile);
            return false;
        }
    }

    /**
     * @param writer already buffered, it is closed by the caller
     */
    protected abstract void writeSeries(List<MeasurementSeries> seriesList, Writer writer) throws IOException;

    // an overwritten export keeps the permissions it had
    private static void copyPermissionsIfExists(Path destination, Path tempFile) throws IOException {
        if (!Files.exists(destination)
                || !Files.getFileStore(tempFile).supportsFileAttributeView(PosixFileAttributeView.class))
            return;
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(destination);
        Files.setPosixFilePermissions(tempFile, permissions);
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tempFile) {
        if (tempFile == null)
            return;
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warn("Cannot delete temporary export file {}", tempFile, e);
        }
    }
}
