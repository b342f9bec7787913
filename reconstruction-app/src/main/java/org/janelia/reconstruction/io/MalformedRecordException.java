package org.janelia.reconstruction.io;

import java.nio.file.Path;

/**
 * Thrown when a record in a table file violates its schema.
 * The message identifies the file and the position (line or record/byte offset) of the problem.
 */
public class MalformedRecordException
        extends IllegalArgumentException {

    private final Path path;
    private final String position;

    public MalformedRecordException(final Path path,
                                    final String position,
                                    final String problem) {
        this(path, position, problem, null);
    }

    public MalformedRecordException(final Path path,
                                    final String position,
                                    final String problem,
                                    final Throwable cause) {
        super(problem + " at " + position + " in " + path, cause);
        this.path = path;
        this.position = position;
    }

    public Path getPath() {
        return path;
    }

    public String getPosition() {
        return position;
    }
}
