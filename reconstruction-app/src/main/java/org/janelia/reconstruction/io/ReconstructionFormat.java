package org.janelia.reconstruction.io;

/**
 * Serializations of a reconstruction.
 */
public enum ReconstructionFormat {

    /** Line oriented text tables (cameras.txt, images.txt, points3D.txt). */
    TEXT("txt"),

    /** Packed little-endian binary tables (cameras.bin, images.bin, points3D.bin). */
    BINARY("bin"),

    /** Directory does not contain a complete set of either serialization. */
    UNRECOGNIZED(null);

    private final String extension;

    ReconstructionFormat(final String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        if (extension == null) {
            throw new IllegalStateException(this + " format has no file extension");
        }
        return extension;
    }

    public boolean isRecognized() {
        return extension != null;
    }
}
