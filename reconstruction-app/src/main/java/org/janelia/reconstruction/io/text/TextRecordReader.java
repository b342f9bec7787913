package org.janelia.reconstruction.io.text;

import com.google.common.primitives.UnsignedLong;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.io.RecordReader;

/**
 * Base class for streaming readers of line oriented tables.
 * Comment lines (starting with {@value #COMMENT_MARKER}) and blank lines between records are skipped.
 * Comments that precede the first record are retained as the table header.
 *
 * @param <T> record type.
 */
public abstract class TextRecordReader<T>
        implements RecordReader<T> {

    public static final String COMMENT_MARKER = "#";

    private final Path path;
    private final BufferedReader reader;
    private final List<String> headerComments;
    private long lineNumber;
    private long recordCount;
    private boolean foundFirstRecord;
    private boolean exhausted;
    private T nextRecord;

    protected TextRecordReader(final Path path)
            throws IOException {
        this.path = path;
        this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        this.headerComments = new ArrayList<>();
        this.lineNumber = 0;
        this.recordCount = 0;
        this.foundFirstRecord = false;
        this.exhausted = false;
        this.nextRecord = null;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return comment lines that precede the first record (including their marker).
     */
    public List<String> getHeaderComments() {
        hasNext(); // header is complete once the first record has been located
        return Collections.unmodifiableList(headerComments);
    }

    @Override
    public boolean hasNext() {
        if ((nextRecord == null) && (! exhausted)) {
            try {
                final String line = readNextRecordLine();
                if (line == null) {
                    exhausted = true;
                } else {
                    nextRecord = parseRecord(line);
                }
            } catch (final IOException e) {
                throw new UncheckedIOException("failed to read " + path, e);
            }
        }
        return nextRecord != null;
    }

    @Override
    public T next() {
        if (! hasNext()) {
            throw new NoSuchElementException("no more records in " + path);
        }
        final T record = nextRecord;
        nextRecord = null;
        recordCount++;
        return record;
    }

    @Override
    public long getRecordCount() {
        return recordCount;
    }

    @Override
    public void close()
            throws IOException {
        reader.close();
    }

    /**
     * Parses one record starting with the specified line.
     * Implementations that span multiple lines should use {@link #readContinuationLine}.
     */
    protected abstract T parseRecord(final String line)
            throws IOException, MalformedRecordException;

    /**
     * @return the line immediately following the current one, without skipping comments or blank lines.
     *
     * @throws MalformedRecordException
     *   if the end of the file is reached.
     */
    protected String readContinuationLine(final String expectedContent)
            throws IOException, MalformedRecordException {
        final String line = reader.readLine();
        if (line == null) {
            throw malformed("missing " + expectedContent + " line after line " + lineNumber);
        }
        lineNumber++;
        return line;
    }

    protected String[] splitFields(final String line) {
        return WHITESPACE_PATTERN.split(line.trim());
    }

    protected String[] splitFields(final String line,
                                   final int limit) {
        return WHITESPACE_PATTERN.split(line.trim(), limit);
    }

    protected MalformedRecordException malformed(final String problem) {
        return new MalformedRecordException(path, "line " + lineNumber, problem);
    }

    protected MalformedRecordException malformed(final String problem,
                                                 final Throwable cause) {
        return new MalformedRecordException(path, "line " + lineNumber, problem, cause);
    }

    protected long parseLong(final String value,
                             final String fieldName)
            throws MalformedRecordException {
        try {
            return Long.parseLong(value);
        } catch (final NumberFormatException e) {
            throw malformed("invalid " + fieldName + " '" + value + "'", e);
        }
    }

    protected long parseUnsignedInt(final String value,
                                    final String fieldName)
            throws MalformedRecordException {
        final long parsedValue = parseLong(value, fieldName);
        if ((parsedValue < 0) || (parsedValue > MAX_UNSIGNED_INT)) {
            throw malformed(fieldName + " " + value + " is not an unsigned 32 bit value");
        }
        return parsedValue;
    }

    protected UnsignedLong parseUnsignedLong(final String value,
                                             final String fieldName)
            throws MalformedRecordException {
        try {
            return UnsignedLong.valueOf(value);
        } catch (final NumberFormatException e) {
            throw malformed("invalid " + fieldName + " '" + value + "'", e);
        }
    }

    protected int parseInt(final String value,
                           final String fieldName)
            throws MalformedRecordException {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw malformed("invalid " + fieldName + " '" + value + "'", e);
        }
    }

    protected double parseDouble(final String value,
                                 final String fieldName)
            throws MalformedRecordException {
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw malformed("invalid " + fieldName + " '" + value + "'", e);
        }
    }

    private String readNextRecordLine()
            throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.startsWith(COMMENT_MARKER)) {
                if (! foundFirstRecord) {
                    headerComments.add(line);
                }
            } else if (! line.trim().isEmpty()) {
                foundFirstRecord = true;
                break;
            }
        }
        return line;
    }

    private static final long MAX_UNSIGNED_INT = 0xFFFFFFFFL;
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
}
