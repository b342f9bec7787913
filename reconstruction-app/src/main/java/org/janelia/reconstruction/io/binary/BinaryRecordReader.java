package org.janelia.reconstruction.io.binary;

import com.google.common.io.CountingInputStream;
import com.google.common.io.LittleEndianDataInputStream;
import com.google.common.primitives.UnsignedLong;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.io.RecordReader;

/**
 * Base class for streaming readers of packed little-endian tables.
 * A table starts with an unsigned 64 bit record count followed by that many records.
 *
 * Unsigned and signed 64 bit fields are decoded into different Java types
 * ({@link UnsignedLong} and {@code long}) so that the two cannot be mixed up by callers.
 *
 * @param <T> record type.
 */
public abstract class BinaryRecordReader<T>
        implements RecordReader<T> {

    private final Path path;
    private final long fileSize;
    private final CountingInputStream countingStream;
    private final LittleEndianDataInputStream in;
    private final UnsignedLong declaredRecordCount;
    private long recordCount;
    private boolean verifiedEnd;

    protected BinaryRecordReader(final Path path)
            throws IOException, MalformedRecordException {
        this.path = path;
        this.fileSize = Files.size(path);
        this.countingStream = new CountingInputStream(
                new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE));
        this.in = new LittleEndianDataInputStream(countingStream);
        this.recordCount = 0;
        this.verifiedEnd = false;

        try {
            this.declaredRecordCount = readUInt64();
        } catch (final EOFException e) {
            in.close();
            throw malformed("missing record count", e);
        }
    }

    public Path getPath() {
        return path;
    }

    public UnsignedLong getDeclaredRecordCount() {
        return declaredRecordCount;
    }

    @Override
    public boolean hasNext() {
        final boolean hasNext = UnsignedLong.valueOf(recordCount).compareTo(declaredRecordCount) < 0;
        if ((! hasNext) && (! verifiedEnd)) {
            verifyEndOfData();
        }
        return hasNext;
    }

    @Override
    public T next() {
        if (! hasNext()) {
            throw new NoSuchElementException("all " + declaredRecordCount + " records already read from " + path);
        }
        final T record;
        try {
            record = readRecord();
        } catch (final EOFException e) {
            throw malformed("data ends before record is complete (file declares " +
                            declaredRecordCount + " records)", e);
        } catch (final IOException e) {
            throw new UncheckedIOException("failed to read " + path, e);
        }
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
        in.close();
    }

    /**
     * Decodes the next record from the stream.
     *
     * @throws EOFException
     *   if the stream ends before the record is complete.
     */
    protected abstract T readRecord()
            throws IOException, MalformedRecordException;

    protected MalformedRecordException malformed(final String problem) {
        return malformed(problem, null);
    }

    protected MalformedRecordException malformed(final String problem,
                                                 final Throwable cause) {
        final String position = "record " + recordCount + " (byte offset " + countingStream.getCount() + ")";
        return new MalformedRecordException(path, position, problem, cause);
    }

    protected int readUInt8()
            throws IOException {
        return in.readUnsignedByte();
    }

    protected int readInt32()
            throws IOException {
        return in.readInt();
    }

    protected long readUInt32()
            throws IOException {
        return Integer.toUnsignedLong(in.readInt());
    }

    protected long readInt64()
            throws IOException {
        return in.readLong();
    }

    protected UnsignedLong readUInt64()
            throws IOException {
        return UnsignedLong.fromLongBits(in.readLong());
    }

    protected double readFloat64()
            throws IOException {
        return in.readDouble();
    }

    /**
     * Reads an unsigned 64 bit element count that precedes a variable length list.
     *
     * @param  listName         name of the list for error messages.
     * @param  bytesPerElement  encoded size of each list element.
     *
     * @throws MalformedRecordException
     *   if the count is too large to be a plausible list length or
     *   if the elements cannot fit in the bytes left in the file.
     */
    protected int readLength(final String listName,
                             final int bytesPerElement)
            throws IOException, MalformedRecordException {
        final UnsignedLong length = readUInt64();
        if (length.compareTo(MAX_LIST_LENGTH) > 0) {
            throw malformed(listName + " length " + length + " exceeds maximum of " + MAX_LIST_LENGTH);
        }
        final long remainingBytes = fileSize - countingStream.getCount();
        if (length.longValue() > remainingBytes / bytesPerElement) {
            throw malformed(listName + " length " + length + " needs " + (length.longValue() * bytesPerElement) +
                            " bytes but only " + remainingBytes + " bytes remain in the file");
        }
        return length.intValue();
    }

    /**
     * Reads bytes up to (and consumes) a null terminator and decodes them as UTF-8.
     */
    protected String readNullTerminatedString(final String fieldName)
            throws IOException, MalformedRecordException {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        int b;
        while ((b = in.read()) != 0) {
            if (b == -1) {
                throw malformed(fieldName + " is not null terminated");
            }
            bytes.write(b);
        }
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private void verifyEndOfData() {
        verifiedEnd = true;
        try {
            if (in.read() != -1) {
                throw malformed("unexpected data after the " + declaredRecordCount + " declared records");
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("failed to read " + path, e);
        }
    }

    private static final int BUFFER_SIZE = 65536;
    private static final UnsignedLong MAX_LIST_LENGTH = UnsignedLong.valueOf(Integer.MAX_VALUE - 8);
}
