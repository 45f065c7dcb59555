// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import static java.lang.System.Logger.Level.INFO;

import java.io.IOException;
import java.util.Objects;
import org.hiero.qpress.codec.BlockCodec;
import org.hiero.qpress.config.DecoderConfig;
import org.hiero.qpress.format.ArchiveHeader;
import org.hiero.qpress.format.DataBlock;
import org.hiero.qpress.format.FileTrailer;
import org.hiero.qpress.format.QpressException;
import org.hiero.qpress.format.QpressFormat;
import org.hiero.qpress.format.QpressFormatException;
import org.hiero.qpress.io.QpressInputStream;

/**
 * Decodes the body of one file target: the blocks up to and including the trailer. Blocks are read on the calling
 * thread, their offsets assigned from the running total of decompressed sizes, and handed to a {@link BlockSink}.
 */
final class FileTargetDecoder {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    /**
     * The outcome of one file together with whether the size limit was hit. After the limit is hit the stream is in
     * the middle of the file and no further target can be read.
     *
     * @param outcome the file outcome
     * @param limitReached true if the size limit stopped the file
     */
    record Decoded(FileOutcome outcome, boolean limitReached) {}

    private final BlockCodec codec;
    private final DecoderConfig config;

    /**
     * Constructor.
     *
     * @param codec the codec used to read packet headers
     * @param config supplies the per file size limit
     */
    FileTargetDecoder(BlockCodec codec, DecoderConfig config) {
        this.codec = Objects.requireNonNull(codec);
        this.config = Objects.requireNonNull(config);
    }

    /**
     * Decode a file whose name has already been read.
     *
     * @param name the file name
     * @param in the archive stream, positioned after the name
     * @param header the archive header
     * @param output where the file is written
     * @return the file outcome
     * @throws IOException if reading the archive or creating the output fails
     * @throws QpressException if the archive is malformed
     */
    Decoded decode(String name, QpressInputStream in, ArchiveHeader header, FileOutput output)
            throws IOException, QpressException {
        final BlockSink sink = output.open(name, header);
        boolean finished = false;
        try {
            long offset = 0;
            int blocks = 0;
            while (true) {
                final long markerOffset = in.position();
                final int marker = in.readMarker();
                if (marker == QpressFormat.BLOCK_MARKER) {
                    final DataBlock block = DataBlock.read(in, codec);
                    if (config.hasSizeLimit() && offset + block.decompressedSize() > config.sizeLimit()) {
                        LOGGER.log(
                                INFO,
                                "Size limit of {0} bytes reached in {1} after {2} bytes",
                                config.sizeLimit(),
                                name,
                                offset);
                        final FileOutcome outcome = sink.complete(offset, blocks, true);
                        finished = true;
                        return new Decoded(outcome, true);
                    }
                    sink.accept(new BlockWriteTask(name, blocks, offset, block));
                    offset += block.decompressedSize();
                    blocks++;
                } else if (marker == QpressFormat.TRAILER_MARKER) {
                    FileTrailer.read(in);
                    final FileOutcome outcome = sink.complete(offset, blocks, false);
                    finished = true;
                    return new Decoded(outcome, false);
                } else if (marker < 0) {
                    throw new QpressFormatException("Unexpected end of stream in file %s at offset %d"
                            .formatted(name, markerOffset));
                } else {
                    throw new QpressFormatException("Invalid block marker 0x%02x in file %s at offset %d"
                            .formatted(marker, name, markerOffset));
                }
            }
        } finally {
            if (!finished) sink.abort();
        }
    }
}
