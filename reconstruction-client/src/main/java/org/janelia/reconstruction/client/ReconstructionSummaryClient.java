package org.janelia.reconstruction.client;

import com.beust.jcommander.Parameter;

import java.nio.file.Paths;

import org.janelia.reconstruction.client.parameter.CommandLineParameters;
import org.janelia.reconstruction.io.ReconstructionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client that logs the serialization and record counts of a reconstruction.
 */
public class ReconstructionSummaryClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Directory containing the reconstruction tables",
                required = true)
        public String input;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, ReconstructionSummaryClient.class);

                final ReconstructionSummary summary =
                        ReconstructionSummary.summarize(Paths.get(parameters.input).toAbsolutePath());

                LOG.info("runClient: {} contains {}", parameters.input, summary);
            }
        };
        clientRunner.run();
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionSummaryClient.class);
}
