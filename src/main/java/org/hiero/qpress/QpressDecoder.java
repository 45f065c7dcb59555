// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;
import org.hiero.qpress.codec.BlockCodec;
import org.hiero.qpress.codec.QuickLzCodec;
import org.hiero.qpress.concurrent.BoundedTaskPool;
import org.hiero.qpress.config.DecoderConfig;
import org.hiero.qpress.decode.ArchiveDecoder;
import org.hiero.qpress.decode.BlockDecompressor;
import org.hiero.qpress.decode.DecodeResult;
import org.hiero.qpress.decode.DirectoryFileOutput;
import org.hiero.qpress.decode.StreamFileOutput;
import org.hiero.qpress.format.QpressException;
import org.hiero.qpress.io.QpressInputStream;

/**
 * Entry point for decoding qpress archives, either into a directory with parallel decompression or into a single
 * stream.
 *
 * <pre>{@code
 * QpressDecoder decoder = new QpressDecoder(DecoderConfig.defaults().withSizeLimit(1 << 20));
 * try (InputStream in = Files.newInputStream(archive)) {
 *     DecodeResult result = decoder.decodeToDirectory(in, outputDir);
 * }
 * }</pre>
 */
public final class QpressDecoder {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    /** Read buffer wrapped around archive streams that are not buffered already. */
    private static final int READ_BUFFER_SIZE = 1024 * 1024;
    /** Prefix of the worker thread names. */
    private static final String WORKER_THREAD_PREFIX = "qpress-worker";

    private final DecoderConfig config;
    private final BlockCodec codec;

    /**
     * Create a decoder for QuickLZ compressed archives.
     *
     * @param config the decoder configuration
     */
    public QpressDecoder(DecoderConfig config) {
        this(config, new QuickLzCodec());
    }

    /**
     * Create a decoder for archives whose blocks use the given codec.
     *
     * @param config the decoder configuration
     * @param codec the block codec
     */
    public QpressDecoder(DecoderConfig config, BlockCodec codec) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    /**
     * Decode an archive into a directory, one output file per file target. Blocks are decompressed and written on a
     * worker pool that lives for this call only.
     *
     * @param archive the archive stream, not closed
     * @param destination directory to create the files in, created if missing
     * @return the outcome of every file
     * @throws java.nio.file.FileAlreadyExistsException if an output file already exists
     * @throws QpressException if the archive is malformed or uses unsupported features
     * @throws IOException if reading the archive or writing the output fails
     */
    public DecodeResult decodeToDirectory(InputStream archive, Path destination) throws IOException, QpressException {
        Objects.requireNonNull(archive, "archive cannot be null");
        Objects.requireNonNull(destination, "destination cannot be null");
        final BlockDecompressor decompressor = new BlockDecompressor(codec, config.checksumPolicy());
        try (BoundedTaskPool pool =
                new BoundedTaskPool(config.workerCount(), config.maxPendingTasks(), WORKER_THREAD_PREFIX)) {
            final DecodeResult result = new ArchiveDecoder(codec, config)
                    .decode(wrap(archive), new DirectoryFileOutput(destination, pool, decompressor));
            logResult(result);
            return result;
        }
    }

    /**
     * Decode an archive into a single stream, writing the content of every file target in archive order. Runs on the
     * calling thread, the first failure is thrown.
     *
     * @param archive the archive stream, not closed
     * @param sink the destination stream, flushed but not closed
     * @return the outcome of every file
     * @throws QpressException if the archive is malformed, a block fails to decompress or uses unsupported features
     * @throws IOException if reading the archive or writing the output fails
     */
    public DecodeResult decodeToSink(InputStream archive, OutputStream sink) throws IOException, QpressException {
        Objects.requireNonNull(archive, "archive cannot be null");
        Objects.requireNonNull(sink, "sink cannot be null");
        final BlockDecompressor decompressor = new BlockDecompressor(codec, config.checksumPolicy());
        final DecodeResult result = new ArchiveDecoder(codec, config)
                .decode(wrap(archive), new StreamFileOutput(sink, decompressor));
        logResult(result);
        return result;
    }

    private static QpressInputStream wrap(InputStream archive) {
        if (archive instanceof QpressInputStream qpressInputStream) return qpressInputStream;
        return new QpressInputStream(
                archive instanceof BufferedInputStream ? archive : new BufferedInputStream(archive, READ_BUFFER_SIZE));
    }

    private void logResult(DecodeResult result) {
        LOGGER.log(
                INFO,
                "Decoded {0} files, {1} bytes{2}",
                result.files().size(),
                result.totalBytes(),
                result.isPartial() ? ", stopped at size limit" : "");
        if (!result.isSuccess()) {
            LOGGER.log(WARNING, "{0} files failed to decode", result.failures().size());
        }
    }
}
