// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import java.util.Objects;
import org.hiero.qpress.format.DataBlock;

/**
 * A block together with where its decompressed bytes belong. The offset is computed by the reader before the task is
 * handed to a worker, so the final file content does not depend on the order workers finish in.
 *
 * @param fileName name of the file the block belongs to
 * @param index position of the block within its file, starting at zero
 * @param offset absolute offset of the block's first decompressed byte within the file
 * @param block the parsed block
 */
public record BlockWriteTask(String fileName, int index, long offset, DataBlock block) {
    /**
     * Constructor.
     */
    public BlockWriteTask {
        Objects.requireNonNull(fileName);
        Objects.requireNonNull(block);
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0, was " + offset);
    }
}
