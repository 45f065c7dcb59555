// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

import java.nio.charset.StandardCharsets;

/**
 * Constants describing the qpress archive container. All multi byte integers in the container are little endian.
 *
 * <pre>
 * ARCHIVE        = ARCHIVE_HEADER, (UP_RECORD | DOWN_RECORD | FILE_RECORD)*
 * ARCHIVE_HEADER = "qpress10", chunkSize: u64
 * UP_RECORD      = 'U'
 * DOWN_RECORD    = 'D', nameLength: u32, name, 0x00
 * FILE_RECORD    = 'F', nameLength: u32, name, 0x00, BLOCK*, TRAILER
 * BLOCK          = 'N', "EWBNEWB", recoveryInfo[8], checksum: u32, packet
 * TRAILER        = 'E', "NDSENDS", recoveryInfo[8]
 * </pre>
 *
 * The archive ends at end of stream or at a zero type byte.
 */
public final class QpressFormat {
    /** The 8 byte magic every archive starts with. */
    public static final byte[] MAGIC = "qpress10".getBytes(StandardCharsets.US_ASCII);
    /** Type byte that terminates an archive. */
    public static final int END_OF_ARCHIVE = 0;
    /** Type byte of a directory down record. */
    public static final int DOWN_DIRECTORY_MARKER = 'D';
    /** Type byte of a directory up record. */
    public static final int UP_DIRECTORY_MARKER = 'U';
    /** Type byte of a file record. */
    public static final int FILE_MARKER = 'F';
    /** Marker byte starting a data block inside a file record. */
    public static final int BLOCK_MARKER = 'N';
    /** Marker byte starting the trailer of a file record. */
    public static final int TRAILER_MARKER = 'E';
    /** The 7 bytes following {@link #BLOCK_MARKER}. */
    public static final byte[] BLOCK_TAIL = "EWBNEWB".getBytes(StandardCharsets.US_ASCII);
    /** The 7 bytes following {@link #TRAILER_MARKER}. */
    public static final byte[] TRAILER_TAIL = "NDSENDS".getBytes(StandardCharsets.US_ASCII);
    /** Length of the opaque recovery information field of blocks and trailers. */
    public static final int RECOVERY_INFO_LENGTH = 8;
    /** Terminator byte following every name. */
    public static final int NAME_TERMINATOR = 0;
    /** Longest name accepted, guards against allocating a huge buffer for a corrupt length. */
    public static final int MAX_NAME_LENGTH = 64 * 1024;

    private QpressFormat() {
        // constants
    }
}
