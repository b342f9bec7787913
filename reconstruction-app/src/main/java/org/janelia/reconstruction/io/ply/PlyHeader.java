package org.janelia.reconstruction.io.ply;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.janelia.reconstruction.io.MalformedRecordException;

/**
 * Vertex layout parsed from the ASCII header of a binary little-endian PLY file.
 * Only the first element may be the vertex element; list properties are not supported.
 */
public class PlyHeader {

    public static final String END_HEADER = "end_header";

    /**
     * A named scalar property and its byte offset within a vertex record.
     */
    public static class Property {

        private final String name;
        private final PlyPropertyType type;
        private final int offset;

        public Property(final String name,
                        final PlyPropertyType type,
                        final int offset) {
            this.name = name;
            this.type = type;
            this.offset = offset;
        }

        public String getName() {
            return name;
        }

        public PlyPropertyType getType() {
            return type;
        }

        public int getOffset() {
            return offset;
        }
    }

    private final long vertexCount;
    private final List<Property> vertexProperties;
    private final int vertexStride;

    public PlyHeader(final long vertexCount,
                     final List<Property> vertexProperties) {
        this.vertexCount = vertexCount;
        this.vertexProperties = Collections.unmodifiableList(new ArrayList<>(vertexProperties));
        int stride = 0;
        for (final Property property : vertexProperties) {
            stride += property.getType().getByteCount();
        }
        this.vertexStride = stride;
    }

    public long getVertexCount() {
        return vertexCount;
    }

    public List<Property> getVertexProperties() {
        return vertexProperties;
    }

    public int getVertexStride() {
        return vertexStride;
    }

    /**
     * @throws IllegalArgumentException
     *   if no vertex property has the specified name.
     */
    public Property getVertexProperty(final String name)
            throws IllegalArgumentException {
        for (final Property property : vertexProperties) {
            if (property.getName().equals(name)) {
                return property;
            }
        }
        throw new IllegalArgumentException("vertex property '" + name + "' is not declared");
    }

    /**
     * Consumes header lines from the stream up to and including the end_header line,
     * leaving the stream positioned at the first vertex record.
     */
    public static PlyHeader read(final InputStream in,
                                 final Path path)
            throws IOException, MalformedRecordException {

        int lineNumber = 0;
        String line = readAsciiLine(in);
        lineNumber++;
        if (! "ply".equals(line)) {
            throw new MalformedRecordException(path, "line " + lineNumber, "missing ply magic number");
        }

        String format = null;
        long vertexCount = -1;
        boolean inVertexElement = false;
        boolean foundOtherElement = false;
        int offset = 0;
        final List<Property> properties = new ArrayList<>();

        while (true) {
            line = readAsciiLine(in);
            lineNumber++;
            if (line == null) {
                throw new MalformedRecordException(path, "line " + lineNumber,
                                                   "header ends without " + END_HEADER + " line");
            }

            final String[] w = WHITESPACE_PATTERN.split(line.trim());
            if (END_HEADER.equals(line.trim())) {
                break;
            } else if ("format".equals(w[0])) {
                format = w.length > 1 ? w[1] : "";
            } else if ("element".equals(w[0])) {
                if (w.length != 3) {
                    throw new MalformedRecordException(path, "line " + lineNumber, "invalid element declaration");
                }
                if ("vertex".equals(w[1])) {
                    if (foundOtherElement) {
                        throw new MalformedRecordException(path, "line " + lineNumber,
                                                           "vertex element must be declared first");
                    }
                    inVertexElement = true;
                    try {
                        vertexCount = Long.parseLong(w[2]);
                    } catch (final NumberFormatException e) {
                        throw new MalformedRecordException(path, "line " + lineNumber,
                                                           "invalid vertex count '" + w[2] + "'", e);
                    }
                } else {
                    inVertexElement = false;
                    foundOtherElement = true;
                }
            } else if ("property".equals(w[0]) && inVertexElement) {
                if ((w.length != 3) || "list".equals(w[1])) {
                    throw new MalformedRecordException(path, "line " + lineNumber,
                                                       "unsupported vertex property declaration '" + line + "'");
                }
                final PlyPropertyType type;
                try {
                    type = PlyPropertyType.fromTypeName(w[1]);
                } catch (final IllegalArgumentException e) {
                    throw new MalformedRecordException(path, "line " + lineNumber, e.getMessage(), e);
                }
                properties.add(new Property(w[2], type, offset));
                offset += type.getByteCount();
            }
            // comment, obj_info, and properties of other elements are ignored
        }

        if (! "binary_little_endian".equals(format)) {
            throw new MalformedRecordException(path, "header",
                                               "unsupported format '" + format +
                                               "', only binary_little_endian is supported");
        }
        if (vertexCount < 0) {
            throw new MalformedRecordException(path, "header", "missing vertex element");
        }

        return new PlyHeader(vertexCount, properties);
    }

    private static String readAsciiLine(final InputStream in)
            throws IOException {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(80);
        int b;
        while ((b = in.read()) != '\n') {
            if (b == -1) {
                return bytes.size() == 0 ? null : bytes.toString(StandardCharsets.US_ASCII.name());
            }
            if (b != '\r') {
                bytes.write(b);
            }
        }
        return bytes.toString(StandardCharsets.US_ASCII.name());
    }

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
}
