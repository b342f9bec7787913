package org.janelia.reconstruction.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * Appends records to a table file.  The table is only complete once the writer is closed.
 *
 * @param <T> record type.
 */
public interface RecordWriter<T> extends Closeable {

    void write(T record) throws IOException;

    /**
     * @return number of records written so far.
     */
    long getRecordCount();

}
