package org.janelia.reconstruction.model;

import java.util.Objects;

/**
 * One observation of a 3D point: the image and the index into that image's observation list.
 */
public class TrackElement {

    private final long imageId;
    private final long observationIndex;

    public TrackElement(final long imageId,
                        final long observationIndex) {
        this.imageId = imageId;
        this.observationIndex = observationIndex;
    }

    public long getImageId() {
        return imageId;
    }

    public long getObservationIndex() {
        return observationIndex;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final TrackElement that = (TrackElement) o;
        return (imageId == that.imageId) && (observationIndex == that.observationIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(imageId, observationIndex);
    }

    @Override
    public String toString() {
        return imageId + ":" + observationIndex;
    }
}
