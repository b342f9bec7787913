package org.janelia.reconstruction.io;

/**
 * The three tables that make up a reconstruction.
 */
public enum ReconstructionTable {

    CAMERAS("cameras"),
    IMAGES("images"),
    POINTS("points3D");

    private final String baseName;

    ReconstructionTable(final String baseName) {
        this.baseName = baseName;
    }

    public String getBaseName() {
        return baseName;
    }

    public String getFileName(final ReconstructionFormat format) {
        return baseName + "." + format.getExtension();
    }
}
