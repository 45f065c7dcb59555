// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import static java.lang.System.Logger.Level.WARNING;

import java.util.Objects;
import org.hiero.qpress.codec.BlockCodec;
import org.hiero.qpress.codec.DecompressionException;
import org.hiero.qpress.config.ChecksumPolicy;
import org.hiero.qpress.format.ChecksumMismatchException;
import org.hiero.qpress.format.DataBlock;
import org.hiero.qpress.format.QpressException;

/**
 * Verifies and decompresses single blocks. Stateless apart from its configuration, so one instance is shared by all
 * workers.
 */
public final class BlockDecompressor {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final BlockCodec codec;
    private final ChecksumPolicy checksumPolicy;

    /**
     * Constructor.
     *
     * @param codec the codec the packets were compressed with
     * @param checksumPolicy what to do when a block checksum does not match its packet
     */
    public BlockDecompressor(BlockCodec codec, ChecksumPolicy checksumPolicy) {
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.checksumPolicy = Objects.requireNonNull(checksumPolicy, "checksumPolicy cannot be null");
    }

    /**
     * Decompress a block into a new buffer sized exactly to its declared decompressed size.
     *
     * @param task the block to decompress
     * @return the decompressed bytes
     * @throws QpressException if the checksum check fails under {@link ChecksumPolicy#FAIL} or the packet is invalid
     */
    public byte[] decompress(BlockWriteTask task) throws QpressException {
        final byte[] destination = new byte[task.block().decompressedSize()];
        decompressInto(task, destination);
        return destination;
    }

    /**
     * Decompress a block into the start of a caller supplied buffer.
     *
     * @param task the block to decompress
     * @param destination buffer at least {@code task.block().decompressedSize()} bytes long
     * @return the number of bytes written, always the declared decompressed size
     * @throws QpressException if the checksum check fails under {@link ChecksumPolicy#FAIL} or the packet is invalid
     */
    public int decompressInto(BlockWriteTask task, byte[] destination) throws QpressException {
        final DataBlock block = task.block();
        verifyChecksum(task);
        final int written = codec.decompress(block.packet(), destination);
        if (written != block.decompressedSize()) {
            throw new DecompressionException("Block %d of %s decompressed to %d bytes but declares %d"
                    .formatted(task.index(), task.fileName(), written, block.decompressedSize()));
        }
        return written;
    }

    private void verifyChecksum(BlockWriteTask task) throws ChecksumMismatchException {
        if (checksumPolicy == ChecksumPolicy.IGNORE) return;
        final DataBlock block = task.block();
        final long actual = block.computeChecksum();
        if (actual == block.checksum()) return;
        final String message = "Checksum mismatch in block %d of %s: stored %08x, computed %08x"
                .formatted(task.index(), task.fileName(), block.checksum(), actual);
        if (checksumPolicy == ChecksumPolicy.FAIL) {
            throw new ChecksumMismatchException(message);
        }
        LOGGER.log(WARNING, message);
    }
}
