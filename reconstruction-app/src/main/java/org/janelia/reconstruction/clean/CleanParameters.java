package org.janelia.reconstruction.clean;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.janelia.reconstruction.filter.CameraOutlierDetector;
import org.janelia.reconstruction.filter.CoordinateTransform;
import org.janelia.reconstruction.filter.OutlierThresholdMode;
import org.janelia.reconstruction.filter.SpatialPointFilter;
import org.janelia.reconstruction.io.ReconstructionFormat;
import org.janelia.reconstruction.json.JsonUtils;
import org.janelia.reconstruction.util.BoundedBuffer;
import org.janelia.reconstruction.util.FileUtil;

/**
 * Parameters for cleaning a reconstruction.
 */
public class CleanParameters
        implements Serializable {

    @Parameter(
            names = "--outlierThresholdMode",
            description = "AUTO derives the camera outlier distance from the camera distribution, " +
                          "FIXED uses --outlierThreshold")
    public OutlierThresholdMode outlierThresholdMode = OutlierThresholdMode.AUTO;

    @Parameter(
            names = "--outlierThreshold",
            description = "Camera distance from the median position beyond which a camera is an outlier " +
                          "(only used in FIXED mode)")
    public Double outlierThreshold = 100.0;

    @Parameter(
            names = "--outlierPercentile",
            description = "Distance percentile used to derive the AUTO mode threshold")
    public Double outlierPercentile = CameraOutlierDetector.DEFAULT_PERCENTILE;

    @Parameter(
            names = "--outlierMultiplier",
            description = "Factor applied to the percentile distance to derive the AUTO mode threshold")
    public Double outlierMultiplier = CameraOutlierDetector.DEFAULT_MULTIPLIER;

    @Parameter(
            names = "--outlierMinThreshold",
            description = "Smallest threshold the AUTO mode may derive")
    public Double outlierMinThreshold = CameraOutlierDetector.DEFAULT_MIN_THRESHOLD;

    @Parameter(
            names = "--referenceCloud",
            description = "Binary PLY point cloud used to spatially filter 3D points " +
                          "(omit to keep all points unless --discoverReferenceCloud is specified)")
    public String referenceCloud;

    @Parameter(
            names = "--discoverReferenceCloud",
            description = "When --referenceCloud is omitted, use the first .ply file (by name) in the input directory",
            arity = 0)
    public boolean discoverReferenceCloud = false;

    @Parameter(
            names = "--spatialFilterThreshold",
            description = "Maximum distance between a kept point and its nearest reference point")
    public Double spatialFilterThreshold = SpatialPointFilter.DEFAULT_THRESHOLD;

    @Parameter(
            names = "--coordinateTransform",
            description = "Nine comma separated values of the row-major 3x3 matrix M that maps " +
                          "reference cloud coordinates into the reconstruction frame (reference = source * M^T)",
            listConverter = DoubleListConverter.class)
    public List<Double> coordinateTransform = new ArrayList<>(CoordinateTransform.DEFAULT_MATRIX);

    @Parameter(
            names = "--outputFormat",
            description = "Serialization for cleaned tables (omit to use the input serialization)")
    public ReconstructionFormat outputFormat;

    @Parameter(
            names = "--maxMaterializedRecords",
            description = "Maximum number of camera positions or reference points held in memory")
    public Integer maxMaterializedRecords = BoundedBuffer.DEFAULT_CAPACITY;

    @Parameter(
            names = "--linkImageDirectory",
            description = "Link an 'images' directory found in the input directory into the output directory",
            arity = 1)
    public boolean linkImageDirectory = true;

    public CleanParameters() {
    }

    public CameraOutlierDetector buildOutlierDetector()
            throws IllegalArgumentException {
        return new CameraOutlierDetector(outlierThresholdMode,
                                         outlierThreshold,
                                         outlierPercentile,
                                         outlierMultiplier,
                                         outlierMinThreshold);
    }

    public CoordinateTransform buildCoordinateTransform()
            throws IllegalArgumentException {
        return new CoordinateTransform(coordinateTransform);
    }

    /**
     * @return path of the reference cloud to filter against, or null if points should not be filtered.
     *
     * @throws IOException
     *   if the input directory cannot be searched.
     */
    public Path resolveReferenceCloud(final Path inputDirectory)
            throws IOException {
        Path path = null;
        if (referenceCloud != null) {
            path = Paths.get(referenceCloud).toAbsolutePath();
        } else if (discoverReferenceCloud) {
            try (final Stream<Path> stream = Files.list(inputDirectory)) {
                path = stream
                        .filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".ply"))
                        .sorted()
                        .findFirst()
                        .orElse(null);
            }
        }
        return path;
    }

    public void validate()
            throws IllegalArgumentException {

        if (outlierThresholdMode == null) {
            throw new IllegalArgumentException("--outlierThresholdMode must be specified");
        }
        if ((outlierPercentile == null) || (outlierMultiplier == null) || (outlierMinThreshold == null)) {
            throw new IllegalArgumentException(
                    "--outlierPercentile, --outlierMultiplier and --outlierMinThreshold must be specified");
        }

        // detector and transform constructors validate their own values
        buildOutlierDetector();
        buildCoordinateTransform();

        if (spatialFilterThreshold == null) {
            throw new IllegalArgumentException("--spatialFilterThreshold must be specified");
        }
        SpatialPointFilter.validateThreshold(spatialFilterThreshold);

        if (ReconstructionFormat.UNRECOGNIZED.equals(outputFormat)) {
            throw new IllegalArgumentException("--outputFormat must be TEXT or BINARY");
        }

        if ((maxMaterializedRecords == null) || (maxMaterializedRecords < 1)) {
            throw new IllegalArgumentException("--maxMaterializedRecords must be a positive number");
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static CleanParameters fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static CleanParameters fromJsonFile(final String dataFile)
            throws IOException {
        final CleanParameters parameters;
        final Path path = Paths.get(dataFile).toAbsolutePath();
        try (final Reader reader = FileUtil.getUtf8Reader(path)) {
            parameters = fromJson(reader);
        }
        return parameters;
    }

    public static class DoubleListConverter
            implements IStringConverter<List<Double>> {

        @Override
        public List<Double> convert(final String value) {
            final List<Double> list = new ArrayList<>();
            for (final String token : value.split(",")) {
                final String trimmedToken = token.trim();
                try {
                    list.add(Double.parseDouble(trimmedToken));
                } catch (final NumberFormatException e) {
                    throw new ParameterException("invalid number '" + trimmedToken + "' in list '" + value + "'");
                }
            }
            return list;
        }
    }

    private static final JsonUtils.Helper<CleanParameters> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.STRICT_MAPPER, CleanParameters.class);
}
