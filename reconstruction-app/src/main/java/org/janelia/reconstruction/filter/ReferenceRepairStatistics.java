package org.janelia.reconstruction.filter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregate and per image reference repair counts.
 */
public class ReferenceRepairStatistics implements Serializable {

    private long imageCount;
    private long totalReferences;
    private long keptReferences;
    private long cleanedReferences;
    private long rewrittenReferences;
    private final List<ImageReferenceCounts> images;

    public ReferenceRepairStatistics() {
        this.imageCount = 0;
        this.totalReferences = 0;
        this.keptReferences = 0;
        this.cleanedReferences = 0;
        this.rewrittenReferences = 0;
        this.images = new ArrayList<>();
    }

    public long getImageCount() {
        return imageCount;
    }

    public long getTotalReferences() {
        return totalReferences;
    }

    public long getKeptReferences() {
        return keptReferences;
    }

    public long getCleanedReferences() {
        return cleanedReferences;
    }

    public long getRewrittenReferences() {
        return rewrittenReferences;
    }

    /**
     * @return counts for each repaired image in repair order.
     */
    public List<ImageReferenceCounts> getImages() {
        return Collections.unmodifiableList(images);
    }

    void add(final ImageReferenceCounts imageCounts) {
        imageCount++;
        totalReferences += imageCounts.getTotal();
        keptReferences += imageCounts.getKept();
        cleanedReferences += imageCounts.getCleaned();
        rewrittenReferences += imageCounts.getRewritten();
        images.add(imageCounts);
    }

    @Override
    public String toString() {
        return "{imageCount: " + imageCount +
               ", totalReferences: " + totalReferences +
               ", keptReferences: " + keptReferences +
               ", cleanedReferences: " + cleanedReferences +
               ", rewrittenReferences: " + rewrittenReferences + "}";
    }
}
