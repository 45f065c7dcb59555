// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import java.io.OutputStream;
import java.util.Objects;
import org.hiero.qpress.format.ArchiveHeader;

/**
 * Writes every file of an archive, one after the other, to a single stream.
 */
public final class StreamFileOutput implements FileOutput {
    /** Smallest decompression buffer allocated up front. */
    static final int MIN_BUFFER_SIZE = 4 * 1024;
    /** Largest decompression buffer allocated up front, larger blocks grow the buffer when they arrive. */
    static final int MAX_BUFFER_SIZE = 16 * 1024 * 1024;

    private final OutputStream out;
    private final BlockDecompressor decompressor;
    private SequentialBlockWriter writer;

    /**
     * Constructor.
     *
     * @param out the destination, not closed
     * @param decompressor used to decompress blocks
     */
    public StreamFileOutput(OutputStream out, BlockDecompressor decompressor) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
        this.decompressor = Objects.requireNonNull(decompressor, "decompressor cannot be null");
    }

    @Override
    public BlockSink open(String name, ArchiveHeader header) {
        if (writer == null) {
            writer = new SequentialBlockWriter(
                    out, decompressor, header.bufferSizeHint(MIN_BUFFER_SIZE, MAX_BUFFER_SIZE));
        }
        return writer.begin(name);
    }
}
