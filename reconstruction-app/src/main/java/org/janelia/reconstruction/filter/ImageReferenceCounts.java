package org.janelia.reconstruction.filter;

import java.io.Serializable;

/**
 * Observation reference counts for one image after repair.
 * A reference is "kept" when it still names a surviving point and "cleaned" when it is
 * the unmatched sentinel after repair, whether it was rewritten or already unmatched.
 */
public class ImageReferenceCounts implements Serializable {

    private final long imageId;
    private final String name;
    private long total;
    private long kept;
    private long cleaned;
    private long rewritten;

    @SuppressWarnings("unused")
    private ImageReferenceCounts() {
        this(0, null);
    }

    public ImageReferenceCounts(final long imageId,
                                final String name) {
        this.imageId = imageId;
        this.name = name;
        this.total = 0;
        this.kept = 0;
        this.cleaned = 0;
        this.rewritten = 0;
    }

    public long getImageId() {
        return imageId;
    }

    public String getName() {
        return name;
    }

    public long getTotal() {
        return total;
    }

    public long getKept() {
        return kept;
    }

    public long getCleaned() {
        return cleaned;
    }

    /**
     * @return number of cleaned references that named a point before repair.
     */
    public long getRewritten() {
        return rewritten;
    }

    void addKept() {
        total++;
        kept++;
    }

    void addCleaned(final boolean wasRewritten) {
        total++;
        cleaned++;
        if (wasRewritten) {
            rewritten++;
        }
    }

    @Override
    public String toString() {
        return "{imageId: " + imageId + ", total: " + total + ", kept: " + kept + ", cleaned: " + cleaned + "}";
    }
}
