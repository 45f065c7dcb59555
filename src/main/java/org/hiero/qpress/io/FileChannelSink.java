// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * A {@link PositionalSink} backed by a file. {@link FileChannel#write(ByteBuffer, long)} is safe for concurrent use
 * and does not move the channel position, so blocks can be written by several workers without locking.
 */
public final class FileChannelSink implements PositionalSink {
    private final Path path;
    private final FileChannel channel;

    private FileChannelSink(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
    }

    /**
     * Create a new file and open it for positional writes.
     *
     * @param path the file to create, must not exist
     * @return the sink
     * @throws java.nio.file.FileAlreadyExistsException if the file already exists, it is left untouched
     * @throws IOException if the file cannot be created
     */
    public static FileChannelSink create(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        return new FileChannelSink(
                path, FileChannel.open(path, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
    }

    @Override
    public void write(long offset, ByteBuffer data) throws IOException {
        long position = offset;
        while (data.hasRemaining()) {
            position += channel.write(data, position);
        }
    }

    @Override
    public void discard() throws IOException {
        try {
            close();
        } finally {
            Files.deleteIfExists(path);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
