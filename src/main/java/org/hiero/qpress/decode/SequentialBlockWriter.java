// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import static java.lang.System.Logger.Level.DEBUG;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import org.hiero.qpress.format.QpressException;

/**
 * Decompresses blocks on the calling thread and writes them to a stream in arrival order. One instance serves every
 * file of an archive and reuses a single decompression buffer, growing it when a block needs more room.
 * <p>
 * Failures are thrown straight away: bytes already written to a stream cannot be taken back.
 */
public final class SequentialBlockWriter implements BlockSink {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final OutputStream out;
    private final BlockDecompressor decompressor;
    private byte[] buffer;
    private String name;

    /**
     * Constructor.
     *
     * @param out the destination, not closed by this writer
     * @param decompressor used to decompress blocks
     * @param initialBufferSize starting size of the decompression buffer
     */
    public SequentialBlockWriter(OutputStream out, BlockDecompressor decompressor, int initialBufferSize) {
        this.out = Objects.requireNonNull(out);
        this.decompressor = Objects.requireNonNull(decompressor);
        this.buffer = new byte[Math.max(0, initialBufferSize)];
    }

    /**
     * Start writing the next file.
     *
     * @param fileName the file name as stored in the archive
     * @return this writer
     */
    SequentialBlockWriter begin(String fileName) {
        this.name = Objects.requireNonNull(fileName);
        return this;
    }

    @Override
    public void accept(BlockWriteTask task) throws IOException, QpressException {
        final int size = task.block().decompressedSize();
        if (size > buffer.length) {
            buffer = new byte[size];
        }
        final int written = decompressor.decompressInto(task, buffer);
        out.write(buffer, 0, written);
    }

    @Override
    public FileOutcome complete(long bytes, int blocks, boolean partial) throws IOException {
        out.flush();
        LOGGER.log(DEBUG, "Streamed {0} blocks, {1} bytes of {2}", blocks, bytes, name);
        return partial ? FileOutcome.partial(name, bytes, blocks) : FileOutcome.complete(name, bytes, blocks);
    }

    @Override
    public void abort() {
        // nothing to clean up, the bytes already written stay in the stream
    }
}
