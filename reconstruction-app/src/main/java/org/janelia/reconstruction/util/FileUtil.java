package org.janelia.reconstruction.util;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.janelia.reconstruction.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities for reading and writing files.
 */
public class FileUtil {

    public static Reader getUtf8Reader(final Path path)
            throws IOException {
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    public static void saveJsonFile(final Path path,
                                    final Object data)
            throws IOException {

        final Path toPath = path.toAbsolutePath();

        try (final Writer writer = Files.newBufferedWriter(toPath, StandardCharsets.UTF_8)) {
            JsonUtils.MAPPER.writeValue(writer, data);
            writer.write('\n');
        } catch (final IOException e) {
            throw new IOException("failed to write " + toPath, e);
        }

        LOG.info("saveJsonFile: wrote data to {}", toPath);
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    // last try
                    if (! directory.mkdirs()) {
                        if (! directory.exists()) {
                            throw new IllegalArgumentException("failed to create " + directory);
                        }
                    }
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Deletes the file or directory tree.  Symbolic links are deleted but never followed.
     */
    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory() && (! Files.isSymbolicLink(file.toPath()))) {
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteSuccessful && deleteRecursive(f);
                }
            }
        }

        if (file.delete()) {
            LOG.debug("deleted {}", file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete {}", file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
