// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

import java.io.IOException;
import java.util.zip.Adler32;
import org.hiero.qpress.codec.BlockCodec;
import org.hiero.qpress.codec.DeclaredSizes;
import org.hiero.qpress.io.QpressInputStream;

/**
 * One compressed data block of a file. The packet is kept exactly as read, header included, and is only
 * decompressed later by a worker into a buffer of {@link #decompressedSize()} bytes.
 *
 * @param recoveryInfo opaque recovery information, not interpreted
 * @param checksum the stored Adler-32 of {@code packet}, unsigned
 * @param headerLength length of the codec header at the start of {@code packet}
 * @param packet the codec packet, header and payload
 * @param decompressedSize the decompressed size declared by the packet header
 */
public record DataBlock(byte[] recoveryInfo, long checksum, int headerLength, byte[] packet, int decompressedSize) {
    /** Largest packet or decompressed size a block may declare, bounded by what a Java array can hold. */
    public static final int MAX_BLOCK_SIZE = Integer.MAX_VALUE - 8;

    /**
     * Read a block whose {@link QpressFormat#BLOCK_MARKER} byte has already been consumed. The codec header is read
     * in two steps, first its flags byte which tells the header length and then the rest, so packets shorter than the
     * long header are not over-read. Declared sizes are checked against each other before the payload is read, and
     * the payload buffer only grows as its bytes arrive.
     *
     * @param in the archive stream
     * @param codec the codec used to read the packet header
     * @return the parsed block
     * @throws QpressFormatException if the block is malformed or the stream ends early
     * @throws IOException if the underlying stream fails
     */
    public static DataBlock read(QpressInputStream in, BlockCodec codec) throws IOException, QpressFormatException {
        in.expect(QpressFormat.BLOCK_TAIL, "block tail");
        final byte[] recoveryInfo = in.readExactly(QpressFormat.RECOVERY_INFO_LENGTH, "block recovery info");
        final long checksum = in.readUnsignedIntLE("block checksum");
        final long headerStart = in.position();
        final byte flags = in.readExactly(1, "packet header")[0];
        final int headerLength = codec.headerLength(flags);
        final byte[] header = new byte[headerLength];
        header[0] = flags;
        in.readExactly(header, 1, headerLength - 1, "packet header");
        final DeclaredSizes sizes = codec.declaredSizes(header);
        if (sizes.compressedSize() < headerLength || sizes.compressedSize() > MAX_BLOCK_SIZE) {
            throw new QpressFormatException("Invalid packet compressed size %d at offset %d"
                    .formatted(sizes.compressedSize(), headerStart));
        }
        if (sizes.decompressedSize() < 0 || sizes.decompressedSize() > MAX_BLOCK_SIZE) {
            throw new QpressFormatException("Invalid packet decompressed size %d at offset %d"
                    .formatted(sizes.decompressedSize(), headerStart));
        }
        if (sizes.decompressedSize() > codec.maxDecompressedSize(header)) {
            throw new QpressFormatException("Packet at offset %d declares %d decompressed bytes from %d compressed"
                    .formatted(headerStart, sizes.decompressedSize(), sizes.compressedSize()));
        }
        final byte[] packet = in.readExactly(header, (int) sizes.compressedSize(), "packet payload");
        return new DataBlock(recoveryInfo, checksum, headerLength, packet, (int) sizes.decompressedSize());
    }

    /**
     * @return total packet size, header included
     */
    public int compressedSize() {
        return packet.length;
    }

    /**
     * @return the Adler-32 of the packet as it was read
     */
    public long computeChecksum() {
        final Adler32 adler = new Adler32();
        adler.update(packet, 0, packet.length);
        return adler.getValue();
    }

    /**
     * @return true if the stored checksum matches the packet
     */
    public boolean checksumMatches() {
        return computeChecksum() == checksum;
    }
}
