package org.janelia.reconstruction.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.PrintStream;
import java.io.Serializable;

import org.janelia.reconstruction.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base parameters for the reconstruction command line clients.
 *
 * Subclasses are nested in their client class, which supplies the program name shown in usage.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    /** Exit status for a command line that could not be parsed. */
    public static final int USAGE_EXIT_STATUS = 2;

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public CommandLineParameters() {
        this.help = false;
    }

    /**
     * Parses the arguments and exits the JVM after printing usage when help is requested
     * (status 0) or parsing fails ({@link #USAGE_EXIT_STATUS}).
     */
    public void parse(final String[] args,
                      final Class<?> programClass) {
        parse(args, programClass, true);
    }

    /**
     * @param  exitOnHelpOrFailure  if false, usage is printed but the JVM keeps running.
     *
     * @throws IllegalArgumentException
     *   if parsing fails and the JVM is not exited.
     */
    public void parse(final String[] args,
                      final Class<?> programClass,
                      final boolean exitOnHelpOrFailure)
            throws IllegalArgumentException {

        final JCommander jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName("java -cp reconstruction-client.jar " + programClass.getName())
                .build();

        ParameterException failure = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException e) {
            failure = e;
        }

        if (help || (failure != null)) {
            final PrintStream out = failure == null ? System.out : System.err;
            if (failure != null) {
                out.println("\nERROR: " + failure.getMessage() + "\n");
                LOG.error("parse: failed to parse {} arguments", programClass.getSimpleName(), failure);
            }
            final StringBuilder usage = new StringBuilder();
            jCommander.getUsageFormatter().usage(usage);
            out.println(usage);

            if (exitOnHelpOrFailure) {
                System.exit(failure == null ? 0 : USAGE_EXIT_STATUS);
            } else if (failure != null) {
                throw new IllegalArgumentException("invalid " + programClass.getSimpleName() + " arguments: " +
                                                   failure.getMessage(), failure);
            }
        }
    }

    /**
     * @return single line JSON form of these parameters, for logging.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.FAST_MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Parses "--help" without exiting, so tests can check that the annotations of a
     * client's parameters are consistent.
     *
     * @param  parameters  parameters instance nested in a client class.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);
}
