package org.janelia.reconstruction.io;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Forward-only stream of records decoded one at a time from a table file.
 * Callers must close the reader to release the underlying file.
 *
 * @param <T> record type.
 */
public interface RecordReader<T> extends Iterator<T>, Closeable {

    /**
     * @return number of records returned by {@link #next()} so far.
     */
    long getRecordCount();

}
