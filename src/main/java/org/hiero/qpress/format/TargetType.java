// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

/**
 * The kinds of top level records in a qpress archive, identified by their type byte.
 */
public enum TargetType {
    /** Leave the current directory. */
    UP_DIRECTORY(QpressFormat.UP_DIRECTORY_MARKER),
    /** Enter a named directory, creating it. */
    DOWN_DIRECTORY(QpressFormat.DOWN_DIRECTORY_MARKER),
    /** A file with its compressed blocks. */
    FILE(QpressFormat.FILE_MARKER);

    private final int marker;

    TargetType(int marker) {
        this.marker = marker;
    }

    /**
     * Look up the target type for a type byte.
     *
     * @param marker the type byte read from the archive
     * @param offset offset of the type byte, used in error messages
     * @return the matching type
     * @throws QpressFormatException if no target type uses this byte
     */
    public static TargetType fromMarker(int marker, long offset) throws QpressFormatException {
        for (TargetType type : values()) {
            if (type.marker == marker) return type;
        }
        throw new QpressFormatException("Unknown target type 0x%02x at offset %d".formatted(marker, offset));
    }
}
