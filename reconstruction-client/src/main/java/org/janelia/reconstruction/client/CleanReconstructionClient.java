package org.janelia.reconstruction.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.janelia.reconstruction.clean.CleanParameters;
import org.janelia.reconstruction.clean.CleaningException;
import org.janelia.reconstruction.clean.CleaningOrchestrator;
import org.janelia.reconstruction.clean.CleaningReport;
import org.janelia.reconstruction.client.parameter.CommandLineParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for removing outlier cameras, spatially filtering points, and repairing
 * observation references of a reconstruction.
 */
public class CleanReconstructionClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Directory containing the reconstruction tables to clean",
                required = true)
        public String input;

        @Parameter(
                names = "--output",
                description = "Directory for cleaned tables and statistics (must differ from --input)",
                required = true)
        public String output;

        @Parameter(
                names = "--cleanParametersJson",
                description = "JSON file with clean parameters (overrides all clean options on the command line)")
        public String cleanParametersJson;

        @ParametersDelegate
        public CleanParameters clean = new CleanParameters();

        public CleanParameters getCleanParameters()
                throws IOException {
            return cleanParametersJson == null ? clean : CleanParameters.fromJsonFile(cleanParametersJson);
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, CleanReconstructionClient.class);

                LOG.info("runClient: entry, parameters={}", parameters);

                final CleanReconstructionClient client = new CleanReconstructionClient(parameters);
                client.cleanReconstruction();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public CleanReconstructionClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public CleaningReport cleanReconstruction()
            throws IOException, CleaningException {

        final Path inputDirectory = Paths.get(parameters.input).toAbsolutePath();
        final Path outputDirectory = Paths.get(parameters.output).toAbsolutePath();

        final CleaningOrchestrator orchestrator = new CleaningOrchestrator(parameters.getCleanParameters());
        final CleaningReport report = orchestrator.clean(inputDirectory, outputDirectory);

        LOG.info("cleanReconstruction: removed {} of {} cameras and {} of {} points, cleaned {} of {} references",
                 report.getCameraOutliers().getOutlierCount(),
                 report.getCameraOutliers().getTotalCameras(),
                 report.getPoints().getPointsRemoved(),
                 report.getPoints().getPointsBefore(),
                 report.getReferences().getCleanedReferences(),
                 report.getReferences().getTotalReferences());

        return report;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CleanReconstructionClient.class);
}
