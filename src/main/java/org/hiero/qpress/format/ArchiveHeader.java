// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

import java.io.IOException;
import org.hiero.qpress.io.QpressInputStream;

/**
 * The fixed header at the start of every qpress archive.
 *
 * @param chunkSize the nominal decompressed size of the blocks the encoder produced, unsigned. It is only used to
 *     pre-size buffers and is never validated against block contents.
 */
public record ArchiveHeader(long chunkSize) {

    /**
     * Read and validate the archive header: the {@link QpressFormat#MAGIC} followed by the little endian chunk size.
     *
     * @param in the archive stream positioned at its first byte
     * @return the parsed header
     * @throws QpressFormatException if the magic does not match or the stream is too short
     * @throws IOException if the underlying stream fails
     */
    public static ArchiveHeader read(QpressInputStream in) throws IOException, QpressFormatException {
        in.expect(QpressFormat.MAGIC, "archive magic");
        return new ArchiveHeader(in.readLongLE("archive chunk size"));
    }

    /**
     * Compute a buffer size hint from the chunk size, clamped into {@code [minimum, maximum]}.
     *
     * @param minimum smallest size to return
     * @param maximum largest size to return
     * @return the clamped chunk size
     */
    public int bufferSizeHint(int minimum, int maximum) {
        if (chunkSize < 0 || chunkSize > maximum) return maximum;
        return (int) Math.max(minimum, chunkSize);
    }

    @Override
    public String toString() {
        return "ArchiveHeader[chunkSize=" + Long.toUnsignedString(chunkSize) + "]";
    }
}
