package org.janelia.reconstruction.client;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map;

import org.janelia.reconstruction.client.parameter.CommandLineParameters;
import org.janelia.reconstruction.io.ReconstructionConverter;
import org.janelia.reconstruction.io.ReconstructionFormat;
import org.janelia.reconstruction.io.ReconstructionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for converting reconstruction tables between the text and binary serializations.
 */
public class ConvertReconstructionClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--input",
                description = "Directory containing the reconstruction tables to convert",
                required = true)
        public String input;

        @Parameter(
                names = "--output",
                description = "Directory for converted tables",
                required = true)
        public String output;

        @Parameter(
                names = "--format",
                description = "Target serialization",
                required = true)
        public ReconstructionFormat format;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, ConvertReconstructionClient.class);

                LOG.info("runClient: entry, parameters={}", parameters);

                final ConvertReconstructionClient client = new ConvertReconstructionClient(parameters);
                client.convert();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public ConvertReconstructionClient(final Parameters parameters)
            throws IllegalArgumentException {
        if ((parameters.format == null) || (! parameters.format.isRecognized())) {
            throw new IllegalArgumentException("--format must be TEXT or BINARY");
        }
        this.parameters = parameters;
    }

    public Map<ReconstructionTable, Long> convert()
            throws IOException {
        return ReconstructionConverter.convert(Paths.get(parameters.input).toAbsolutePath(),
                                               Paths.get(parameters.output).toAbsolutePath(),
                                               parameters.format);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ConvertReconstructionClient.class);
}
