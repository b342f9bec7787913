package org.janelia.reconstruction.io.ply;

import com.google.common.io.ByteStreams;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;

import org.janelia.reconstruction.io.MalformedRecordException;
import org.janelia.reconstruction.io.RecordReader;

/**
 * Streams x, y, z coordinates of the vertices in a binary little-endian PLY file.
 * Other declared vertex properties (colors, normals, ...) are skipped using the declared stride.
 */
public class PlyVertexReader
        implements RecordReader<double[]> {

    private final Path path;
    private final InputStream in;
    private final PlyHeader header;
    private final PlyHeader.Property[] coordinateProperties;
    private final byte[] vertexBytes;
    private final ByteBuffer vertexBuffer;
    private long recordCount;

    public PlyVertexReader(final Path path)
            throws IOException, MalformedRecordException {
        this.path = path;
        this.in = new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE);

        try {
            this.header = PlyHeader.read(in, path);
            this.coordinateProperties = new PlyHeader.Property[] {
                    header.getVertexProperty("x"),
                    header.getVertexProperty("y"),
                    header.getVertexProperty("z")
            };
        } catch (final MalformedRecordException e) {
            in.close();
            throw e;
        } catch (final IllegalArgumentException e) {
            in.close();
            throw new MalformedRecordException(path, "header", e.getMessage(), e);
        }

        this.vertexBytes = new byte[header.getVertexStride()];
        this.vertexBuffer = ByteBuffer.wrap(vertexBytes).order(ByteOrder.LITTLE_ENDIAN);
        this.recordCount = 0;
    }

    public PlyHeader getHeader() {
        return header;
    }

    @Override
    public boolean hasNext() {
        return recordCount < header.getVertexCount();
    }

    /**
     * @return coordinates of the next vertex as {x, y, z}.
     */
    @Override
    public double[] next() {
        if (! hasNext()) {
            throw new NoSuchElementException("all " + header.getVertexCount() + " vertices already read from " + path);
        }
        try {
            ByteStreams.readFully(in, vertexBytes);
        } catch (final EOFException e) {
            throw new MalformedRecordException(path, "vertex " + recordCount,
                                               "data ends before vertex is complete (header declares " +
                                               header.getVertexCount() + " vertices)", e);
        } catch (final IOException e) {
            throw new UncheckedIOException("failed to read " + path, e);
        }
        final double[] xyz = new double[3];
        for (int i = 0; i < xyz.length; i++) {
            xyz[i] = coordinateProperties[i].getType().read(vertexBuffer, coordinateProperties[i].getOffset());
        }
        recordCount++;
        return xyz;
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

    private static final int BUFFER_SIZE = 65536;
}
