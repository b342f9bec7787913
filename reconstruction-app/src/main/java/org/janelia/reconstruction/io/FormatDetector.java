package org.janelia.reconstruction.io;

import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies the reconstruction serialization present in a directory.
 * A format is only recognized when all three of its table files exist.
 */
public class FormatDetector {

    public static ReconstructionFormat detect(final Path directory) {

        ReconstructionFormat format = ReconstructionFormat.UNRECOGNIZED;

        if (Files.isDirectory(directory)) {
            if (hasAllTables(directory, ReconstructionFormat.TEXT)) {
                format = ReconstructionFormat.TEXT;
            } else if (hasAllTables(directory, ReconstructionFormat.BINARY)) {
                format = ReconstructionFormat.BINARY;
            }
        }

        LOG.debug("detect: returning {} for {}", format, directory);

        return format;
    }

    private static boolean hasAllTables(final Path directory,
                                        final ReconstructionFormat format) {
        for (final ReconstructionTable table : ReconstructionTable.values()) {
            if (! Files.isRegularFile(directory.resolve(table.getFileName(format)))) {
                return false;
            }
        }
        return true;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FormatDetector.class);
}
