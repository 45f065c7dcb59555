// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

import java.io.IOException;
import org.hiero.qpress.io.QpressInputStream;

/**
 * The record that ends the block sequence of a file.
 *
 * @param recoveryInfo opaque recovery information, not interpreted
 */
public record FileTrailer(byte[] recoveryInfo) {

    /**
     * Read a trailer whose {@link QpressFormat#TRAILER_MARKER} byte has already been consumed.
     *
     * @param in the archive stream
     * @return the parsed trailer
     * @throws QpressFormatException if the tail bytes are wrong or the stream ends early
     * @throws IOException if the underlying stream fails
     */
    public static FileTrailer read(QpressInputStream in) throws IOException, QpressFormatException {
        in.expect(QpressFormat.TRAILER_TAIL, "trailer tail");
        return new FileTrailer(in.readExactly(QpressFormat.RECOVERY_INFO_LENGTH, "trailer recovery info"));
    }
}
