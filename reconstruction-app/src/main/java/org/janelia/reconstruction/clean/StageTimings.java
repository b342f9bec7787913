package org.janelia.reconstruction.clean;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.Map;

/**
 * Elapsed milliseconds for each completed cleaning stage.
 * Kept apart from the statistics report so that the report is identical for identical runs.
 */
public class StageTimings
        implements Serializable {

    private final Map<CleaningStage, Long> stageMilliseconds;
    private long totalMilliseconds;

    public StageTimings() {
        this.stageMilliseconds = new EnumMap<>(CleaningStage.class);
        this.totalMilliseconds = 0;
    }

    public void add(final CleaningStage stage,
                    final long milliseconds) {
        stageMilliseconds.merge(stage, milliseconds, Long::sum);
        totalMilliseconds += milliseconds;
    }

    public Long getMilliseconds(final CleaningStage stage) {
        return stageMilliseconds.get(stage);
    }

    public long getTotalMilliseconds() {
        return totalMilliseconds;
    }

    @Override
    public String toString() {
        return stageMilliseconds + ", total " + totalMilliseconds + " ms";
    }
}
