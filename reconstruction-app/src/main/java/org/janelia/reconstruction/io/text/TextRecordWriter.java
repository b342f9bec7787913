package org.janelia.reconstruction.io.text;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.janelia.reconstruction.io.RecordWriter;

/**
 * Base class for writers of line oriented tables.
 * Header comment lines are written first, then one formatted record at a time.
 * Doubles are written with {@link Double#toString(double)} so that parsed values match exactly.
 *
 * @param <T> record type.
 */
public abstract class TextRecordWriter<T>
        implements RecordWriter<T> {

    private final Path path;
    private final BufferedWriter writer;
    private long recordCount;

    /**
     * @param  path            table file to create (or replace).
     * @param  headerComments  comment lines to write before any records.
     */
    protected TextRecordWriter(final Path path,
                               final List<String> headerComments)
            throws IOException {
        this.path = path;
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        this.recordCount = 0;

        for (final String comment : headerComments) {
            if (! comment.startsWith(TextRecordReader.COMMENT_MARKER)) {
                writer.write(TextRecordReader.COMMENT_MARKER);
                writer.write(' ');
            }
            writer.write(comment);
            writer.write('\n');
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void write(final T record)
            throws IOException {
        final StringBuilder sb = new StringBuilder(256);
        appendRecord(record, sb);
        writer.write(sb.toString());
        writer.write('\n');
        recordCount++;
    }

    @Override
    public long getRecordCount() {
        return recordCount;
    }

    @Override
    public void close()
            throws IOException {
        writer.close();
    }

    /**
     * Appends the text form of the specified record (without a trailing line terminator).
     */
    protected abstract void appendRecord(final T record,
                                         final StringBuilder sb);

}
