package org.janelia.reconstruction.clean;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

import org.janelia.reconstruction.filter.CameraOutlierAnalysis;
import org.janelia.reconstruction.filter.ReferenceRepairStatistics;
import org.janelia.reconstruction.io.ReconstructionFormat;

/**
 * Statistics spanning all stages of a cleaning run.
 *
 * Everything except the {@link StageTimings} is a pure function of the input tables and parameters,
 * so serialized reports from identical runs are byte-identical.
 */
public class CleaningReport
        implements Serializable {

    private ReconstructionFormat inputFormat;
    private ReconstructionFormat outputFormat;
    private CleanParameters parameters;
    private long cameraCount;
    private CameraOutlierAnalysis cameraOutliers;
    private PointFilterStatistics points;
    private ReferenceRepairStatistics references;
    private final Map<String, Long> inputFileBytes;
    private final Map<String, Long> outputFileBytes;

    @JsonIgnore
    private final StageTimings timings;

    public CleaningReport() {
        this.inputFileBytes = new TreeMap<>();
        this.outputFileBytes = new TreeMap<>();
        this.timings = new StageTimings();
    }

    public ReconstructionFormat getInputFormat() {
        return inputFormat;
    }

    public void setInputFormat(final ReconstructionFormat inputFormat) {
        this.inputFormat = inputFormat;
    }

    public ReconstructionFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(final ReconstructionFormat outputFormat) {
        this.outputFormat = outputFormat;
    }

    public CleanParameters getParameters() {
        return parameters;
    }

    public void setParameters(final CleanParameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @return number of records in the (unchanged) camera table.
     */
    public long getCameraCount() {
        return cameraCount;
    }

    public void setCameraCount(final long cameraCount) {
        this.cameraCount = cameraCount;
    }

    public CameraOutlierAnalysis getCameraOutliers() {
        return cameraOutliers;
    }

    public void setCameraOutliers(final CameraOutlierAnalysis cameraOutliers) {
        this.cameraOutliers = cameraOutliers;
    }

    public PointFilterStatistics getPoints() {
        return points;
    }

    public void setPoints(final PointFilterStatistics points) {
        this.points = points;
    }

    public ReferenceRepairStatistics getReferences() {
        return references;
    }

    public void setReferences(final ReferenceRepairStatistics references) {
        this.references = references;
    }

    public Map<String, Long> getInputFileBytes() {
        return inputFileBytes;
    }

    public Map<String, Long> getOutputFileBytes() {
        return outputFileBytes;
    }

    public StageTimings getTimings() {
        return timings;
    }

    @Override
    public String toString() {
        return "{inputFormat: " + inputFormat +
               ", outputFormat: " + outputFormat +
               ", cameraOutliers: " + cameraOutliers +
               ", points: " + points +
               ", references: " + references + "}";
    }
}
