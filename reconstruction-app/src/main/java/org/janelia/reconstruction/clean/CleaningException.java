package org.janelia.reconstruction.clean;

/**
 * Failure of a cleaning run, attributed to the stage that detected it.
 */
public class CleaningException
        extends Exception {

    private final CleaningStage stage;

    public CleaningException(final CleaningStage stage,
                             final Throwable cause) {
        super(stage + " stage failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public CleaningStage getStage() {
        return stage;
    }
}
