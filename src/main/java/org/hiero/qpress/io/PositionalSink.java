// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.io;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * A destination that accepts writes at explicit offsets, in any order and from several threads at once. Callers
 * guarantee that concurrent writes never overlap.
 */
public interface PositionalSink extends Closeable {

    /**
     * Write all remaining bytes of {@code data} starting at {@code offset}.
     *
     * @param offset absolute destination offset
     * @param data the bytes to write
     * @throws IOException if the write fails
     */
    void write(long offset, ByteBuffer data) throws IOException;

    /**
     * Close the sink and remove whatever it has written. Used when its contents cannot be trusted.
     *
     * @throws IOException if the output cannot be removed
     */
    void discard() throws IOException;
}
