// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import org.hiero.qpress.concurrent.TaskBatch;
import org.hiero.qpress.io.PositionalSink;

/**
 * Decompresses the blocks of one file on the worker pool and writes each one at its precomputed offset. Workers may
 * finish in any order, the file content is the same.
 * <p>
 * {@link #complete(long, int, boolean)} is the drain barrier: it waits for every submitted block, then either closes
 * the file or, when any block failed, deletes it and reports the file as failed.
 */
public final class PositionalBlockWriter implements BlockSink {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final String name;
    private final TaskBatch batch;
    private final PositionalSink sink;
    private final BlockDecompressor decompressor;
    private boolean finished = false;

    /**
     * Constructor.
     *
     * @param name the file name as stored in the archive
     * @param batch the batch the file's block tasks run in
     * @param sink the destination, owned by this writer from now on
     * @param decompressor used by the workers to decompress blocks
     */
    public PositionalBlockWriter(String name, TaskBatch batch, PositionalSink sink, BlockDecompressor decompressor) {
        this.name = Objects.requireNonNull(name);
        this.batch = Objects.requireNonNull(batch);
        this.sink = Objects.requireNonNull(sink);
        this.decompressor = Objects.requireNonNull(decompressor);
    }

    @Override
    public void accept(BlockWriteTask task) throws InterruptedIOException {
        if (finished) {
            throw new IllegalStateException("File " + name + " is already finished");
        }
        // once a block failed the file is lost, keep reading but stop decompressing
        if (batch.isCancelled()) return;
        batch.submit(() -> {
            final byte[] data = decompressor.decompress(task);
            sink.write(task.offset(), ByteBuffer.wrap(data));
        });
    }

    @Override
    public FileOutcome complete(long bytes, int blocks, boolean partial) throws IOException {
        if (finished) {
            throw new IllegalStateException("File " + name + " is already finished");
        }
        finished = true;
        final TaskBatch.Result result;
        try {
            result = batch.await();
        } catch (InterruptedIOException e) {
            discardQuietly();
            throw e;
        }
        if (result.isSuccess()) {
            try {
                sink.close();
            } catch (IOException e) {
                discardQuietly();
                throw e;
            }
            LOGGER.log(
                    DEBUG,
                    "Wrote {0} blocks, {1} bytes to {2}{3}",
                    blocks,
                    bytes,
                    name,
                    partial ? " (partial)" : "");
            return partial ? FileOutcome.partial(name, bytes, blocks) : FileOutcome.complete(name, bytes, blocks);
        }
        final Throwable failure = result.primaryFailure();
        try {
            sink.discard();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        LOGGER.log(ERROR, "Failed to decode " + name + ", " + result.skipped() + " blocks skipped", failure);
        return FileOutcome.failed(name, bytes, blocks, failure);
    }

    @Override
    public void abort() {
        if (finished) return;
        finished = true;
        batch.cancel();
        try {
            batch.await();
        } catch (InterruptedIOException e) {
            LOGGER.log(WARNING, "Interrupted draining " + name + " after an archive error");
        }
        discardQuietly();
    }

    private void discardQuietly() {
        try {
            sink.discard();
        } catch (IOException e) {
            LOGGER.log(WARNING, "Could not remove incomplete output " + name, e);
        }
    }
}
