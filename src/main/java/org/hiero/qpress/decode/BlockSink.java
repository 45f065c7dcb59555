// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import java.io.IOException;
import org.hiero.qpress.format.QpressException;

/**
 * Receives the blocks of one file in stream order and turns them into output. Exactly one of
 * {@link #complete(long, int, boolean)} or {@link #abort()} is called at the end.
 */
public interface BlockSink {

    /**
     * Accept the next block. May return before the block is written and may block for backpressure.
     *
     * @param task the block and its destination offset
     * @throws IOException if the block cannot be accepted
     * @throws QpressException if a synchronous sink fails to decompress the block
     */
    void accept(BlockWriteTask task) throws IOException, QpressException;

    /**
     * Finish the file: wait for every accepted block and report the outcome.
     *
     * @param bytes total decompressed bytes of the accepted blocks
     * @param blocks number of accepted blocks
     * @param partial true if the size limit stopped the file before its trailer
     * @return the outcome of the file
     * @throws IOException if the output cannot be finished
     */
    FileOutcome complete(long bytes, int blocks, boolean partial) throws IOException;

    /**
     * Abandon the file after a fatal archive error, releasing its resources. Never throws.
     */
    void abort();
}
