// SPDX-License-Identifier: Apache-2.0
package org.hiero.qpress.format;

/**
 * A checked exception to act as a base for all qpress decoding exceptions.
 */
public class QpressException extends Exception {
    /**
     * {@inheritDoc}
     */
    public QpressException(final String message) {
        super(message);
    }

    /**
     * {@inheritDoc}
     */
    public QpressException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
