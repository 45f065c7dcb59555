// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

/**
 * Exception thrown when the Adler-32 checksum stored with a data block does not match its compressed packet.
 */
public class ChecksumMismatchException extends QpressException {
    public ChecksumMismatchException(final String message) {
        super(message);
    }
}
