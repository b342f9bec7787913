package org.janelia.reconstruction;

import com.google.common.primitives.UnsignedLong;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.reconstruction.io.ReconstructionFiles;
import org.janelia.reconstruction.io.ReconstructionFormat;
import org.janelia.reconstruction.io.RecordReader;
import org.janelia.reconstruction.io.RecordWriter;
import org.janelia.reconstruction.model.CameraModel;
import org.janelia.reconstruction.model.CameraRecord;
import org.janelia.reconstruction.model.ImageRecord;
import org.janelia.reconstruction.model.Observation;
import org.janelia.reconstruction.model.PointRecord;
import org.janelia.reconstruction.model.TrackElement;

/**
 * Builds small synthetic reconstructions and reference clouds for tests.
 *
 * The standard scenario has one camera, five images and fifty points.
 * Images 1-3 sit near the origin, image 4 is 1500 and image 5 is 2000 units away.
 * Point p lies at (p, p / 2, 2) and is observed once by image (p / 10) + 1 at observation index p % 10.
 * Every image also has one unmatched observation, and image 1 has an extra observation
 * that references the missing point {@link #MISSING_POINT_ID}.
 */
public class ReconstructionTestData {

    public static final long MISSING_POINT_ID = 999;
    public static final int POINT_COUNT = 50;
    public static final int POINTS_PER_IMAGE = 10;

    public final List<CameraRecord> cameras;
    public final List<ImageRecord> images;
    public final List<PointRecord> points;

    public ReconstructionTestData(final List<CameraRecord> cameras,
                                  final List<ImageRecord> images,
                                  final List<PointRecord> points) {
        this.cameras = cameras;
        this.images = images;
        this.points = points;
    }

    public static ReconstructionTestData buildStandardScenario() {

        final List<CameraRecord> cameras = Collections.singletonList(buildCamera(1));

        final double[][] imagePositions = {
                { 0.0, 0.0, 0.0 },
                { 1.0, 0.0, 0.0 },
                { 0.0, 1.0, 0.0 },
                { 1500.0, 0.0, 0.0 },
                { 0.0, 2000.0, 0.0 }
        };

        final List<ImageRecord> images = new ArrayList<>();
        for (int i = 0; i < imagePositions.length; i++) {
            final long imageId = i + 1;
            final List<Observation> observations = new ArrayList<>();
            for (int j = 0; j < POINTS_PER_IMAGE; j++) {
                observations.add(new Observation(10.0 * j, 20.0 * j + 0.5, (i * POINTS_PER_IMAGE) + j));
            }
            observations.add(new Observation(1.25, 2.5, Observation.UNMATCHED));
            if (imageId == 1) {
                observations.add(new Observation(3.75, 4.5, MISSING_POINT_ID));
            }
            images.add(buildImage(imageId, imagePositions[i], observations));
        }

        final List<PointRecord> points = new ArrayList<>();
        for (int p = 0; p < POINT_COUNT; p++) {
            final List<TrackElement> track =
                    Collections.singletonList(new TrackElement((p / POINTS_PER_IMAGE) + 1, p % POINTS_PER_IMAGE));
            points.add(buildPoint(p, getStandardPointLocation(p), track));
        }

        return new ReconstructionTestData(cameras, images, points);
    }

    public static double[] getStandardPointLocation(final int pointIndex) {
        return new double[] { pointIndex, pointIndex / 2.0, 2.0 };
    }

    public static CameraRecord buildCamera(final long cameraId) {
        return new CameraRecord(cameraId, CameraModel.PINHOLE, 1920, 1080,
                                new double[] { 1500.5, 1500.25, 960.0, 540.0 });
    }

    public static ImageRecord buildImage(final long imageId,
                                         final double[] position,
                                         final List<Observation> observations) {
        return new ImageRecord(imageId, 1.0, 0.0, 0.0, 0.0,
                               position[0], position[1], position[2],
                               1, "image_" + imageId + ".jpg", observations);
    }

    public static PointRecord buildPoint(final long pointId,
                                         final double[] location,
                                         final List<TrackElement> track) {
        return new PointRecord(UnsignedLong.valueOf(pointId),
                               location[0], location[1], location[2],
                               (int) (pointId % 256), 128, 255, 0.125, track);
    }

    public void write(final Path directory,
                      final ReconstructionFormat format)
            throws IOException {
        final ReconstructionFiles files = new ReconstructionFiles(directory, format);
        try (final RecordWriter<CameraRecord> writer = files.createCameraWriter(null)) {
            for (final CameraRecord camera : cameras) {
                writer.write(camera);
            }
        }
        try (final RecordWriter<ImageRecord> writer = files.createImageWriter(null)) {
            for (final ImageRecord image : images) {
                writer.write(image);
            }
        }
        try (final RecordWriter<PointRecord> writer = files.createPointWriter(null)) {
            for (final PointRecord point : points) {
                writer.write(point);
            }
        }
    }

    public static <T> List<T> readAll(final RecordReader<T> reader)
            throws IOException {
        final List<T> records = new ArrayList<>();
        try (final RecordReader<T> r = reader) {
            while (r.hasNext()) {
                records.add(r.next());
            }
        }
        return records;
    }

    /**
     * Converts reconstruction frame locations into reference cloud (source) coordinates
     * for the default transform (x' = x, y' = -z, z' = y).
     */
    public static double[] toDefaultSourceFrame(final double[] location) {
        return new double[] { location[0], location[2], -location[1] };
    }

    /**
     * Writes a binary little-endian PLY file with double x, y, z and uchar color vertex properties.
     */
    public static void writePly(final Path path,
                                final List<double[]> vertices)
            throws IOException {

        final String header =
                "ply\n" +
                "format binary_little_endian 1.0\n" +
                "comment written for tests\n" +
                "element vertex " + vertices.size() + "\n" +
                "property double x\n" +
                "property double y\n" +
                "property double z\n" +
                "property uchar red\n" +
                "property uchar green\n" +
                "property uchar blue\n" +
                "element face 0\n" +
                "property list uchar int vertex_indices\n" +
                "end_header\n";

        final ByteBuffer buffer = ByteBuffer.allocate(vertices.size() * 27).order(ByteOrder.LITTLE_ENDIAN);
        for (final double[] vertex : vertices) {
            buffer.putDouble(vertex[0]);
            buffer.putDouble(vertex[1]);
            buffer.putDouble(vertex[2]);
            buffer.put((byte) 200);
            buffer.put((byte) 100);
            buffer.put((byte) 50);
        }

        try (final OutputStream out = Files.newOutputStream(path)) {
            out.write(header.getBytes(StandardCharsets.US_ASCII));
            out.write(buffer.array());
        }
    }

}
