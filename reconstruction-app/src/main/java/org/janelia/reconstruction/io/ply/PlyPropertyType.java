package org.janelia.reconstruction.io.ply;

import java.nio.ByteBuffer;

/**
 * Scalar property types that can appear in a PLY element declaration.
 */
public enum PlyPropertyType {

    CHAR(1, "char", "int8"),
    UCHAR(1, "uchar", "uint8"),
    SHORT(2, "short", "int16"),
    USHORT(2, "ushort", "uint16"),
    INT(4, "int", "int32"),
    UINT(4, "uint", "uint32"),
    FLOAT(4, "float", "float32"),
    DOUBLE(8, "double", "float64");

    private final int byteCount;
    private final String[] typeNames;

    PlyPropertyType(final int byteCount,
                    final String... typeNames) {
        this.byteCount = byteCount;
        this.typeNames = typeNames;
    }

    public int getByteCount() {
        return byteCount;
    }

    /**
     * @return value of this type stored at the specified offset of the (little-endian ordered) buffer.
     */
    public double read(final ByteBuffer buffer,
                       final int offset) {
        final double value;
        switch (this) {
            case CHAR:   value = buffer.get(offset); break;
            case UCHAR:  value = buffer.get(offset) & 0xff; break;
            case SHORT:  value = buffer.getShort(offset); break;
            case USHORT: value = buffer.getShort(offset) & 0xffff; break;
            case INT:    value = buffer.getInt(offset); break;
            case UINT:   value = Integer.toUnsignedLong(buffer.getInt(offset)); break;
            case FLOAT:  value = buffer.getFloat(offset); break;
            default:     value = buffer.getDouble(offset); break;
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException
     *   if the name is not a known scalar type.
     */
    public static PlyPropertyType fromTypeName(final String typeName)
            throws IllegalArgumentException {
        for (final PlyPropertyType type : values()) {
            for (final String name : type.typeNames) {
                if (name.equals(typeName)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("unknown PLY property type '" + typeName + "'");
    }
}
