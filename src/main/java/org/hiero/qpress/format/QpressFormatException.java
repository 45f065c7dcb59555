// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

/**
 * Exception thrown when an archive does not follow the qpress container format: bad magic, bad marker or tail
 * bytes, a malformed length prefixed field, or the stream ending in the middle of a field.
 */
public class QpressFormatException extends QpressException {
    public QpressFormatException(final String message) {
        super(message);
    }

    public QpressFormatException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
