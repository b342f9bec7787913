package org.janelia.reconstruction.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Registered image: pose (world-to-camera rotation quaternion and translation),
 * the camera that captured it, and its ordered list of 2D observations.
 */
public class ImageRecord {

    private final long imageId;
    private final double qw;
    private final double qx;
    private final double qy;
    private final double qz;
    private final double tx;
    private final double ty;
    private final double tz;
    private final long cameraId;
    private final String name;
    private final List<Observation> observations;

    public ImageRecord(final long imageId,
                       final double qw,
                       final double qx,
                       final double qy,
                       final double qz,
                       final double tx,
                       final double ty,
                       final double tz,
                       final long cameraId,
                       final String name,
                       final List<Observation> observations) {
        this.imageId = imageId;
        this.qw = qw;
        this.qx = qx;
        this.qy = qy;
        this.qz = qz;
        this.tx = tx;
        this.ty = ty;
        this.tz = tz;
        this.cameraId = cameraId;
        this.name = name;
        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
    }

    public long getImageId() {
        return imageId;
    }

    public double getQw() {
        return qw;
    }

    public double getQx() {
        return qx;
    }

    public double getQy() {
        return qy;
    }

    public double getQz() {
        return qz;
    }

    public double getTx() {
        return tx;
    }

    public double getTy() {
        return ty;
    }

    public double getTz() {
        return tz;
    }

    public long getCameraId() {
        return cameraId;
    }

    public String getName() {
        return name;
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public CameraPosition getCameraPosition() {
        return new CameraPosition(imageId, name, tx, ty, tz);
    }

    /**
     * @return copy of this image with the same pose but the specified observations.
     */
    public ImageRecord withObservations(final List<Observation> replacementObservations) {
        return new ImageRecord(imageId, qw, qx, qy, qz, tx, ty, tz, cameraId, name, replacementObservations);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final ImageRecord that = (ImageRecord) o;
        return (imageId == that.imageId) &&
               (Double.compare(that.qw, qw) == 0) &&
               (Double.compare(that.qx, qx) == 0) &&
               (Double.compare(that.qy, qy) == 0) &&
               (Double.compare(that.qz, qz) == 0) &&
               (Double.compare(that.tx, tx) == 0) &&
               (Double.compare(that.ty, ty) == 0) &&
               (Double.compare(that.tz, tz) == 0) &&
               (cameraId == that.cameraId) &&
               name.equals(that.name) &&
               observations.equals(that.observations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(imageId, qw, qx, qy, qz, tx, ty, tz, cameraId, name, observations);
    }

    @Override
    public String toString() {
        return "image " + imageId + " (" + name + ", " + observations.size() + " observations)";
    }
}
