// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.codec;

/**
 * A block compression algorithm whose packets carry their own size header. Implementations must be stateless so a
 * single instance can be shared by every decompression worker.
 */
public interface BlockCodec {

    /**
     * Work out the length of a packet header from its first byte.
     *
     * @param flags the first byte of the packet
     * @return the header length in bytes, the header includes {@code flags}
     */
    int headerLength(byte flags);

    /**
     * Decode the sizes declared in a packet header. This is pure and never touches the payload.
     *
     * @param header exactly {@link #headerLength(byte)} bytes
     * @return the declared sizes
     */
    DeclaredSizes declaredSizes(byte[] header);

    /**
     * Upper bound on the decompressed size a packet with this header can legitimately declare, given its declared
     * compressed size. Headers declaring more are corrupt and are rejected before any buffer is sized from them.
     *
     * @param header exactly {@link #headerLength(byte)} bytes
     * @return the largest decompressed size consistent with the header
     */
    long maxDecompressedSize(byte[] header);

    /**
     * Decompress one whole packet, header included.
     *
     * @param packet the packet, exactly its declared compressed size
     * @param destination a buffer of at least the declared decompressed size
     * @return the number of bytes written to {@code destination}
     * @throws DecompressionException if the packet is not valid for this algorithm
     */
    int decompress(byte[] packet, byte[] destination) throws DecompressionException;
}
