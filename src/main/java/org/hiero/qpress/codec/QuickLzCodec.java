// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.codec;

import java.util.Arrays;

/**
 * Decoder for QuickLZ 1.5 packets, the block format qpress writes. Supports packets produced with compression level 1
 * (the qpress default) and level 3, both with streaming buffer 0 which is what qpress uses. Packets are independent,
 * all decoder state lives on the stack of {@link #decompress(byte[], byte[])} so one instance can be shared freely.
 * <p>
 * Packet layout: a flags byte followed by the compressed and decompressed sizes, either as single bytes (3 byte
 * header) or as 32 bit little endian integers (9 byte header). Flag bits:
 * <ul>
 *     <li>bit 0 - payload is compressed, otherwise it is stored verbatim</li>
 *     <li>bit 1 - 9 byte header</li>
 *     <li>bits 2-3 - compression level</li>
 *     <li>bits 4-5 - streaming buffer, must be 0</li>
 *     <li>bit 6 - always set</li>
 * </ul>
 * Compressed payloads are groups of a 32 bit control word followed by up to 31 items, each control bit selecting a
 * literal byte (0) or a back reference (1).
 */
public final class QuickLzCodec implements BlockCodec {
    /** Length of the long form header. */
    public static final int LONG_HEADER_LENGTH = 9;
    /** Length of the short form header. */
    public static final int SHORT_HEADER_LENGTH = 3;

    private static final int CONTROL_WORD_LENGTH = 4;
    private static final int UNCONDITIONAL_MATCH_LENGTH = 6;
    private static final int UNCOMPRESSED_END = 4;
    private static final int HASH_VALUES = 4096;
    private static final int CONTROL_WORD_SENTINEL = 0x80000000;
    /** Most output per payload byte: a 3 byte level 1 back reference copies at most 255 bytes. */
    private static final int MAX_EXPANSION = 85;
    /** Number of consecutive literal bits at the bottom of a control word nibble. */
    private static final int[] LITERAL_RUN = {4, 0, 1, 0, 2, 0, 1, 0, 3, 0, 1, 0, 2, 0, 1, 0};

    @Override
    public int headerLength(byte flags) {
        return (flags & 0x02) != 0 ? LONG_HEADER_LENGTH : SHORT_HEADER_LENGTH;
    }

    @Override
    public DeclaredSizes declaredSizes(byte[] header) {
        if (headerLength(header[0]) == LONG_HEADER_LENGTH) {
            return new DeclaredSizes(readUnsignedIntLE(header, 1), readUnsignedIntLE(header, 5));
        }
        return new DeclaredSizes(header[1] & 0xFF, header[2] & 0xFF);
    }

    @Override
    public long maxDecompressedSize(byte[] header) {
        final int headerLength = headerLength(header[0]);
        final long payload = Math.max(0, declaredSizes(header).compressedSize() - headerLength);
        return (header[0] & 0x01) == 0 ? payload : payload * MAX_EXPANSION;
    }

    @Override
    public int decompress(byte[] packet, byte[] destination) throws DecompressionException {
        if (packet.length < SHORT_HEADER_LENGTH) {
            throw new DecompressionException("Packet of " + packet.length + " bytes is shorter than its header");
        }
        final int flags = packet[0] & 0xFF;
        final int headerLength = headerLength(packet[0]);
        if (packet.length < headerLength) {
            throw new DecompressionException("Packet of " + packet.length + " bytes is shorter than its header");
        }
        final DeclaredSizes sizes = declaredSizes(Arrays.copyOf(packet, headerLength));
        if (sizes.compressedSize() != packet.length) {
            throw new DecompressionException("Packet declares %d compressed bytes but holds %d"
                    .formatted(sizes.compressedSize(), packet.length));
        }
        if (sizes.decompressedSize() > destination.length) {
            throw new DecompressionException("Packet declares %d decompressed bytes but destination holds %d"
                    .formatted(sizes.decompressedSize(), destination.length));
        }
        final int size = (int) sizes.decompressedSize();
        final int streamingBuffer = (flags >>> 4) & 0x03;
        if (streamingBuffer != 0) {
            throw new DecompressionException("Unsupported QuickLZ streaming buffer setting " + streamingBuffer);
        }
        if ((flags & 0x01) == 0) {
            if (packet.length - headerLength != size) {
                throw new DecompressionException("Stored packet holds %d bytes but declares %d"
                        .formatted(packet.length - headerLength, size));
            }
            System.arraycopy(packet, headerLength, destination, 0, size);
            return size;
        }
        final int level = (flags >>> 2) & 0x03;
        if (level != 1 && level != 3) {
            throw new DecompressionException("Unsupported QuickLZ compression level " + level);
        }
        return decompressCore(packet, headerLength, destination, size, level);
    }

    private static int decompressCore(byte[] src, int srcPos, byte[] dst, int size, int level)
            throws DecompressionException {
        final int srcEnd = src.length;
        final int lastDestinationByte = size - 1;
        final int lastMatchStart = lastDestinationByte - UNCONDITIONAL_MATCH_LENGTH - UNCOMPRESSED_END;
        // level 1 back references name a hash of the 3 bytes they repeat, level 3 carries plain offsets
        final int[] hashTable = level == 1 ? new int[HASH_VALUES] : null;
        if (hashTable != null) Arrays.fill(hashTable, -1);
        int lastHashed = -1;
        int dstPos = 0;
        int controlWord = 1;

        while (true) {
            if (controlWord == 1) {
                requireAvailable(srcPos, CONTROL_WORD_LENGTH, srcEnd, "control word");
                controlWord = readIntLE(src, srcPos) | CONTROL_WORD_SENTINEL;
                srcPos += CONTROL_WORD_LENGTH;
            }
            final int fetch = readIntLEPadded(src, srcPos, srcEnd);

            if ((controlWord & 1) == 1) {
                controlWord >>>= 1;
                final int matchLength;
                final int matchStart;
                if (level == 1) {
                    matchStart = hashTable[(fetch >>> 4) & 0xFFF];
                    if ((fetch & 0xF) != 0) {
                        matchLength = (fetch & 0xF) + 2;
                        srcPos += 2;
                    } else {
                        matchLength = (fetch >>> 16) & 0xFF;
                        srcPos += 3;
                    }
                } else {
                    final int offset;
                    if ((fetch & 3) == 0) {
                        offset = (fetch & 0xFF) >>> 2;
                        matchLength = 3;
                        srcPos += 1;
                    } else if ((fetch & 2) == 0) {
                        offset = (fetch & 0xFFFF) >>> 2;
                        matchLength = 3;
                        srcPos += 2;
                    } else if ((fetch & 1) == 0) {
                        offset = (fetch & 0xFFFF) >>> 6;
                        matchLength = ((fetch >>> 2) & 15) + 3;
                        srcPos += 2;
                    } else if ((fetch & 127) != 3) {
                        offset = (fetch >>> 7) & 0x1FFFF;
                        matchLength = ((fetch >>> 2) & 0x1F) + 2;
                        srcPos += 3;
                    } else {
                        offset = fetch >>> 15;
                        matchLength = ((fetch >>> 7) & 255) + 3;
                        srcPos += 4;
                    }
                    matchStart = dstPos - offset;
                }
                if (srcPos > srcEnd) {
                    throw new DecompressionException("Back reference runs past the end of the packet");
                }
                if (matchStart < 0
                        || matchStart >= dstPos
                        || matchLength > size - dstPos
                        || (level == 1 && matchLength < 3)) {
                    throw new DecompressionException("Invalid back reference to %d of length %d at output %d"
                            .formatted(matchStart, matchLength, dstPos));
                }
                // byte by byte, source and destination may overlap
                for (int i = 0; i < matchLength; i++) {
                    dst[dstPos + i] = dst[matchStart + i];
                }
                dstPos += matchLength;
                if (hashTable != null) {
                    updateHashUpTo(hashTable, dst, lastHashed, dstPos - matchLength);
                    lastHashed = dstPos - 1;
                }
            } else if (dstPos < lastMatchStart) {
                final int run = LITERAL_RUN[controlWord & 0xF];
                requireAvailable(srcPos, run, srcEnd, "literal");
                System.arraycopy(src, srcPos, dst, dstPos, run);
                controlWord >>>= run;
                dstPos += run;
                srcPos += run;
                if (hashTable != null) {
                    lastHashed = updateHashUpTo(hashTable, dst, lastHashed, dstPos - 3);
                }
            } else {
                // the tail of a packet is always literals
                while (dstPos <= lastDestinationByte) {
                    if (controlWord == 1) {
                        srcPos += CONTROL_WORD_LENGTH;
                        controlWord = CONTROL_WORD_SENTINEL;
                    }
                    requireAvailable(srcPos, 1, srcEnd, "literal");
                    dst[dstPos++] = src[srcPos++];
                    controlWord >>>= 1;
                }
                return size;
            }
        }
    }

    /**
     * Hash every output position after {@code lastHashed} up to and including {@code max}.
     *
     * @return the new last hashed position
     */
    private static int updateHashUpTo(int[] hashTable, byte[] dst, int lastHashed, int max) {
        while (lastHashed < max) {
            lastHashed++;
            final int value = (dst[lastHashed] & 0xFF)
                    | (dst[lastHashed + 1] & 0xFF) << 8
                    | (dst[lastHashed + 2] & 0xFF) << 16;
            hashTable[((value >>> 12) ^ value) & (HASH_VALUES - 1)] = lastHashed;
        }
        return lastHashed;
    }

    private static void requireAvailable(int pos, int length, int end, String what) throws DecompressionException {
        if (pos + length > end) {
            throw new DecompressionException("Packet truncated reading " + what + " at packet offset " + pos);
        }
    }

    private static int readIntLE(byte[] b, int pos) {
        return (b[pos] & 0xFF) | (b[pos + 1] & 0xFF) << 8 | (b[pos + 2] & 0xFF) << 16 | (b[pos + 3] & 0xFF) << 24;
    }

    /** Read up to 4 bytes, missing bytes past {@code end} read as zero. */
    private static int readIntLEPadded(byte[] b, int pos, int end) {
        int value = 0;
        for (int i = 0; i < 4 && pos + i < end; i++) {
            value |= (b[pos + i] & 0xFF) << (8 * i);
        }
        return value;
    }

    private static long readUnsignedIntLE(byte[] b, int pos) {
        return readIntLE(b, pos) & 0xFFFFFFFFL;
    }
}
