// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.fixtures;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * The example archive from the qpress format description: directory {@code FOO} holding file {@code c.txt} with
 * content {@code hello} and the empty directory {@code BAR}, next to file {@code d.txt} with content {@code there}.
 * qpress writes the file before the directory records that precede it in the tree.
 */
public final class ExampleArchive {
    /** The archive bytes exactly as documented. */
    public static final byte[] BYTES = HexFormat.of()
            .parseHex("7170726573733130" + "0000010000000000"
                    // F c.txt
                    + "4605000000" + "632e747874" + "00"
                    + "4e4557424e455742" + "0000000000000000" + "eb02250d"
                    + "450c0500000080" + "68656c6c6f"
                    + "454e4453454e4453" + "0000000000000000"
                    // D FOO, D BAR
                    + "4403000000" + "464f4f" + "00"
                    + "4403000000" + "424152" + "00"
                    // F d.txt
                    + "4605000000" + "642e747874" + "00"
                    + "4e4557424e455742" + "0000000000000000" + "ef025a0d"
                    + "450c0500000080" + "7468657265"
                    + "454e4453454e4453" + "0000000000000000"
                    // U U
                    + "5555");

    /** Offset of the first directory record. */
    public static final int FIRST_DIRECTORY_OFFSET = 0x4b;
    /** Offset of the second file record. */
    public static final int SECOND_FILE_OFFSET = 0x5d;
    /** Offset of the up directory records. */
    public static final int UP_DIRECTORY_OFFSET = 0x98;

    private ExampleArchive() {}

    /**
     * @return the example with every directory record removed, two files in one directory
     */
    public static byte[] withoutDirectories() {
        final byte[] head = Arrays.copyOfRange(BYTES, 0, FIRST_DIRECTORY_OFFSET);
        final byte[] tail = Arrays.copyOfRange(BYTES, SECOND_FILE_OFFSET, UP_DIRECTORY_OFFSET);
        final byte[] result = Arrays.copyOf(head, head.length + tail.length);
        System.arraycopy(tail, 0, result, head.length, tail.length);
        return result;
    }
}
