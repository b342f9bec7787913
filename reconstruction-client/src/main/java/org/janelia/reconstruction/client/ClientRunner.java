package org.janelia.reconstruction.client;

import org.janelia.reconstruction.clean.CleaningException;
import org.janelia.reconstruction.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a client's main method so that every run ends with one "run: exit" log message
 * and an exit status that tells scripts what kind of failure occurred.
 * A run without the exit message was terminated externally.
 */
public abstract class ClientRunner {

    public static final int SUCCESS_EXIT_STATUS = 0;
    public static final int UNEXPECTED_FAILURE_EXIT_STATUS = 1;
    public static final int INVALID_INPUT_EXIT_STATUS = 2;
    public static final int CLEANING_FAILURE_EXIT_STATUS = 3;

    private final String[] args;

    public ClientRunner(final String[] args) {
        this.args = args;
    }

    public void run() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();
        int exitStatus = SUCCESS_EXIT_STATUS;

        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
        } catch (final Throwable t) {
            exitStatus = getExitStatus(t);
            if (t instanceof CleaningException) {
                LOG.error("run: cleaning failed in {} stage", ((CleaningException) t).getStage(), t);
            } else {
                LOG.error("run: caught exception", t);
            }
            LOG.info("run: exit, processing failed with status {} after {}", exitStatus, processTimer);
        }

        System.exit(exitStatus);
    }

    /**
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    /**
     * @return process exit status for the specified client failure.
     */
    public static int getExitStatus(final Throwable failure) {
        final int exitStatus;
        if (failure instanceof CleaningException) {
            exitStatus = CLEANING_FAILURE_EXIT_STATUS;
        } else if (failure instanceof IllegalArgumentException) {
            exitStatus = INVALID_INPUT_EXIT_STATUS;
        } else {
            exitStatus = UNEXPECTED_FAILURE_EXIT_STATUS;
        }
        return exitStatus;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
