// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.decode;

import static java.lang.System.Logger.Level.DEBUG;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import org.hiero.qpress.concurrent.BoundedTaskPool;
import org.hiero.qpress.format.ArchiveHeader;
import org.hiero.qpress.format.QpressFormatException;
import org.hiero.qpress.io.FileChannelSink;

/**
 * Writes every file of an archive into one base directory, decompressing on a shared worker pool. The base directory
 * is created when the first file is opened. Existing files are never overwritten.
 */
public final class DirectoryFileOutput implements FileOutput {
    private final System.Logger LOGGER = System.getLogger(getClass().getName());

    private final Path baseDirectory;
    private final BoundedTaskPool pool;
    private final BlockDecompressor decompressor;

    /**
     * Constructor.
     *
     * @param baseDirectory directory the files are created in
     * @param pool worker pool running the block tasks
     * @param decompressor used by the workers to decompress blocks
     */
    public DirectoryFileOutput(Path baseDirectory, BoundedTaskPool pool, BlockDecompressor decompressor) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory cannot be null");
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.decompressor = Objects.requireNonNull(decompressor, "decompressor cannot be null");
    }

    @Override
    public BlockSink open(String name, ArchiveHeader header) throws IOException, QpressFormatException {
        final Path destination = resolve(name);
        Files.createDirectories(baseDirectory);
        final FileChannelSink sink = FileChannelSink.create(destination);
        LOGGER.log(DEBUG, "Extracting {0}", destination);
        return new PositionalBlockWriter(name, pool.newBatch(name), sink, decompressor);
    }

    /**
     * Resolve an archive file name to a path directly inside the base directory.
     *
     * @param name the file name as stored in the archive
     * @return the destination path
     * @throws QpressFormatException if the name is empty, absolute, a relative reference or has more than one element
     */
    Path resolve(String name) throws QpressFormatException {
        final Path relative;
        try {
            relative = baseDirectory.getFileSystem().getPath(name);
        } catch (InvalidPathException e) {
            throw new QpressFormatException("Invalid file name '" + name + "'", e);
        }
        if (name.isEmpty()
                || relative.isAbsolute()
                || relative.getNameCount() != 1
                || relative.getFileName().toString().equals(".")
                || relative.getFileName().toString().equals("..")) {
            throw new QpressFormatException("Unsafe file name '" + name + "'");
        }
        return baseDirectory.resolve(relative.getFileName().toString());
    }
}
