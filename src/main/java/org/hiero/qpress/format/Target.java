// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

import java.io.IOException;
import org.hiero.qpress.io.QpressInputStream;

/**
 * One top level record of a qpress archive. Directory records are modelled so that meeting one is a typed,
 * explicit event rather than an unknown marker, even though they are not reconstructed.
 */
public interface Target {

    /** Directory up record, carries no payload. */
    record UpDirectory() implements Target {}

    /**
     * Directory down record.
     *
     * @param name the directory name
     */
    record DownDirectory(String name) implements Target {}

    /**
     * The header of a file record. The blocks and trailer that follow it are streamed by the file decoder rather
     * than held here.
     *
     * @param name the file name
     */
    record FileTarget(String name) implements Target {}

    /**
     * Read the header part of a record whose type byte has already been consumed.
     *
     * @param type the record type
     * @param in the archive stream positioned just after the type byte
     * @return the parsed record
     * @throws QpressFormatException if the record is malformed
     * @throws IOException if the underlying stream fails
     */
    static Target read(TargetType type, QpressInputStream in) throws IOException, QpressFormatException {
        return switch (type) {
            case UP_DIRECTORY -> new UpDirectory();
            case DOWN_DIRECTORY -> new DownDirectory(in.readName("directory name"));
            case FILE -> new FileTarget(in.readName("file name"));
        };
    }
}
