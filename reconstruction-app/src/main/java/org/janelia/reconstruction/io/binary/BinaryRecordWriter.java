package org.janelia.reconstruction.io.binary;

import com.google.common.io.LittleEndianDataOutputStream;
import com.google.common.primitives.UnsignedLong;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.janelia.reconstruction.io.RecordWriter;

/**
 * Base class for writers of packed little-endian tables.
 *
 * Records are streamed to disk as they are written.  The leading record count is
 * written as a placeholder and patched when the writer is closed, so callers never
 * need to know the number of records in advance.
 *
 * @param <T> record type.
 */
public abstract class BinaryRecordWriter<T>
        implements RecordWriter<T> {

    private final Path path;
    private final FileChannel channel;
    private final LittleEndianDataOutputStream out;
    private long recordCount;
    private boolean isClosed;

    protected BinaryRecordWriter(final Path path)
            throws IOException {
        this.path = path;
        this.channel = FileChannel.open(path,
                                        StandardOpenOption.CREATE,
                                        StandardOpenOption.TRUNCATE_EXISTING,
                                        StandardOpenOption.WRITE);
        this.out = new LittleEndianDataOutputStream(
                new BufferedOutputStream(Channels.newOutputStream(channel), BUFFER_SIZE));
        this.recordCount = 0;
        this.isClosed = false;

        out.writeLong(0L); // record count placeholder
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void write(final T record)
            throws IOException {
        writeRecord(record);
        recordCount++;
    }

    @Override
    public long getRecordCount() {
        return recordCount;
    }

    @Override
    public void close()
            throws IOException {
        if (! isClosed) {
            isClosed = true;
            try {
                out.flush();
                final ByteBuffer countBuffer = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
                countBuffer.putLong(recordCount);
                countBuffer.flip();
                while (countBuffer.hasRemaining()) {
                    channel.write(countBuffer, countBuffer.position());
                }
            } finally {
                out.close();
            }
        }
    }

    protected abstract void writeRecord(final T record)
            throws IOException;

    protected void writeUInt8(final int value)
            throws IOException {
        if ((value < 0) || (value > 255)) {
            throw new IllegalArgumentException(value + " is not an unsigned 8 bit value");
        }
        out.writeByte(value);
    }

    protected void writeInt32(final int value)
            throws IOException {
        out.writeInt(value);
    }

    protected void writeUInt32(final long value)
            throws IOException {
        if ((value < 0) || (value > 0xFFFFFFFFL)) {
            throw new IllegalArgumentException(value + " is not an unsigned 32 bit value");
        }
        out.writeInt((int) value);
    }

    protected void writeInt64(final long value)
            throws IOException {
        out.writeLong(value);
    }

    protected void writeUInt64(final UnsignedLong value)
            throws IOException {
        out.writeLong(value.longValue());
    }

    protected void writeFloat64(final double value)
            throws IOException {
        out.writeDouble(value);
    }

    protected void writeNullTerminatedString(final String value)
            throws IOException {
        final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        for (final byte b : bytes) {
            if (b == 0) {
                throw new IllegalArgumentException("string '" + value + "' contains a null character");
            }
        }
        out.write(bytes);
        out.writeByte(0);
    }

    private static final int BUFFER_SIZE = 65536;
}
